package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.providers.card-aggregator")
public record CardAggregatorProperties(String baseUrl, String apiKey, String apiVersion, int pageLimit) {}
