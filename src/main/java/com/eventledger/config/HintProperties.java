package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.hints")
public record HintProperties(int maxExpressionLength, int maxNestingDepth) {}
