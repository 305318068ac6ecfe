package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.app")
public record AppProperties(String frontendUrl) {}
