package com.eventledger.provider.peerpayment;

import com.eventledger.config.PeerPaymentProperties;
import com.eventledger.config.SyncConfig;
import com.eventledger.config.SyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

@Component
public class PeerPaymentClient {
  static final int DEFAULT_PAGE_LIMIT = 50;

  private final PeerPaymentProperties properties;
  private final RestClient restClient;

  public PeerPaymentClient(PeerPaymentProperties properties, SyncProperties syncProperties) {
    this.properties = properties;
    this.restClient = SyncConfig.restClient(properties.baseUrl(), syncProperties);
  }

  /** One page of the owner's feed, newest first; {@code beforeId} continues below that story. */
  public JsonNode listTransactions(String beforeId) {
    require(properties.baseUrl(), "baseUrl");
    require(properties.accessToken(), "accessToken");
    require(properties.userId(), "userId");
    int limit = properties.pageLimit() > 0 ? properties.pageLimit() : DEFAULT_PAGE_LIMIT;
    return restClient.get()
        .uri(builder -> {
          UriBuilder uri = builder.path("/v1/stories/target-or-actor/{userId}")
              .queryParam("limit", limit);
          if (beforeId != null) {
            uri.queryParam("before_id", beforeId);
          }
          return uri.build(properties.userId());
        })
        .headers(headers -> headers.setBearerAuth(properties.accessToken()))
        .retrieve()
        .body(JsonNode.class);
  }

  public String ownerFirstName() {
    return properties.ownerFirstName();
  }

  private static void require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Missing peer payment configuration: " + field);
    }
  }
}
