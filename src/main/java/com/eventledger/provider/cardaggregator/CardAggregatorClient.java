package com.eventledger.provider.cardaggregator;

import com.eventledger.config.CardAggregatorProperties;
import com.eventledger.config.SyncConfig;
import com.eventledger.config.SyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

@Component
public class CardAggregatorClient {
  static final int DEFAULT_PAGE_LIMIT = 100;

  private final CardAggregatorProperties properties;
  private final RestClient restClient;

  public CardAggregatorClient(CardAggregatorProperties properties, SyncProperties syncProperties) {
    this.properties = properties;
    this.restClient = SyncConfig.restClient(properties.baseUrl(), syncProperties);
  }

  public JsonNode listTransactions(String accountId, String startingAfter) {
    requireConfigured();
    int limit = properties.pageLimit() > 0 ? properties.pageLimit() : DEFAULT_PAGE_LIMIT;
    return restClient.get()
        .uri(builder -> {
          UriBuilder uri = builder.path("/v1/financial_connections/transactions")
              .queryParam("account", accountId)
              .queryParam("limit", limit);
          if (startingAfter != null) {
            uri.queryParam("starting_after", startingAfter);
          }
          return uri.build();
        })
        .headers(this::authenticate)
        .retrieve()
        .body(JsonNode.class);
  }

  public JsonNode inferredBalances(String accountId) {
    requireConfigured();
    return restClient.get()
        .uri(builder -> builder.path("/v1/financial_connections/accounts/{id}/inferred_balances")
            .queryParam("limit", 1)
            .build(accountId))
        .headers(this::authenticate)
        .retrieve()
        .body(JsonNode.class);
  }

  private void authenticate(HttpHeaders headers) {
    headers.setBasicAuth(properties.apiKey(), "");
    if (properties.apiVersion() != null && !properties.apiVersion().isBlank()) {
      headers.set("Stripe-Version", properties.apiVersion());
    }
  }

  private void requireConfigured() {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("Missing card aggregator configuration: baseUrl");
    }
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException("Missing card aggregator configuration: apiKey");
    }
  }
}
