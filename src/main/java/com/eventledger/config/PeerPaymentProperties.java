package com.eventledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventledger.providers.peer-payment")
public record PeerPaymentProperties(String baseUrl,
                                    String accessToken,
                                    String userId,
                                    String ownerFirstName,
                                    int pageLimit) {}
