package com.eventledger.provider.expensesplit;

import com.eventledger.config.ExpenseSplitProperties;
import com.eventledger.config.SyncConfig;
import com.eventledger.config.SyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

@Component
public class ExpenseSplitClient {
  static final int DEFAULT_LIMIT = 500;

  private final ExpenseSplitProperties properties;
  private final RestClient restClient;

  public ExpenseSplitClient(ExpenseSplitProperties properties, SyncProperties syncProperties) {
    this.properties = properties;
    this.restClient = SyncConfig.restClient(properties.baseUrl(), syncProperties);
  }

  public JsonNode listExpenses() {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("Missing expense split configuration: baseUrl");
    }
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException("Missing expense split configuration: apiKey");
    }
    int limit = properties.limit() > 0 ? properties.limit() : DEFAULT_LIMIT;
    return restClient.get()
        .uri(builder -> {
          UriBuilder uri = builder.path("/api/v3.0/get_expenses").queryParam("limit", limit);
          if (properties.datedAfter() != null && !properties.datedAfter().isBlank()) {
            uri.queryParam("dated_after", properties.datedAfter());
          }
          return uri.build();
        })
        .headers(headers -> headers.setBearerAuth(properties.apiKey()))
        .retrieve()
        .body(JsonNode.class);
  }

  public String ownerFirstName() {
    return properties.ownerFirstName();
  }
}
