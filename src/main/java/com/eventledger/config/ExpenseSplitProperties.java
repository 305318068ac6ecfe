package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.providers.expense-split")
public record ExpenseSplitProperties(String baseUrl,
                                     String apiKey,
                                     String ownerFirstName,
                                     String datedAfter,
                                     int limit) {}
