package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.sync")
public record SyncProperties(boolean enabled,
                             long pollMs,
                             long intervalMs,
                             int poolSize,
                             long fetchTimeoutMs,
                             int connectTimeoutMs,
                             int readTimeoutMs) {}
