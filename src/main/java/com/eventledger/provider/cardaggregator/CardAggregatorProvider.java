package com.eventledger.provider.cardaggregator;

import static com.eventledger.provider.JsonNodes.array;
import static com.eventledger.provider.JsonNodes.decimal;
import static com.eventledger.provider.JsonNodes.firstNonBlank;
import static com.eventledger.provider.JsonNodes.instant;
import static com.eventledger.provider.JsonNodes.text;

import com.eventledger.model.Account;
import com.eventledger.model.ProviderType;
import com.eventledger.provider.AccountProvider;
import com.eventledger.provider.FetchResult;
import com.eventledger.provider.NormalizedItem;
import com.eventledger.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * Financial-connections style card feed. Amounts arrive in cents with the issuer's sign
 * convention, which already matches the ledger (negative is money out).
 */
@Component
public class CardAggregatorProvider implements AccountProvider {
  private static final Logger log = LoggerFactory.getLogger(CardAggregatorProvider.class);
  private static final int MAX_PAGES = 500;

  private final CardAggregatorClient client;

  public CardAggregatorProvider(CardAggregatorClient client) {
    this.client = client;
  }

  @Override
  public ProviderType getProviderType() {
    return ProviderType.CARD_AGGREGATOR;
  }

  @Override
  public FetchResult fetch(Account account) throws ProviderException {
    String accountId = account.getExternalId();
    if (accountId == null || accountId.isBlank()) {
      throw new ProviderException("Card aggregator account " + account.getId() + " has no external id");
    }
    List<NormalizedItem> items = new ArrayList<>();
    try {
      String startingAfter = null;
      int pages = 0;
      boolean hasMore;
      do {
        JsonNode response = client.listTransactions(accountId, startingAfter);
        JsonNode data = array(response, "data");
        if (data == null) {
          throw new ProviderException("Malformed card aggregator response: missing data array");
        }
        String lastId = null;
        for (JsonNode tx : data) {
          lastId = text(tx, "id");
          NormalizedItem item = normalize(tx, account.getDisplayName());
          if (item != null) {
            items.add(item);
          }
        }
        hasMore = response.path("has_more").asBoolean(false) && lastId != null;
        startingAfter = lastId;
        pages++;
      } while (hasMore && pages < MAX_PAGES);
    } catch (RestClientException | IllegalStateException ex) {
      throw new ProviderException("Card aggregator request failed: " + ex.getMessage(), ex);
    }

    BigDecimal balance = null;
    Instant balanceAsOf = null;
    try {
      JsonNode balances = array(client.inferredBalances(accountId), "data");
      if (balances != null && balances.size() > 0) {
        BigDecimal cents = decimal(balances.get(0), "current.usd");
        if (cents != null) {
          balance = cents.movePointLeft(2);
          balanceAsOf = instant(balances.get(0), "as_of");
        }
      }
    } catch (RestClientException ex) {
      log.warn("Card aggregator balance lookup failed for account {}: {}", account.getId(), ex.getMessage());
    }
    return new FetchResult(items, balance, balanceAsOf);
  }

  NormalizedItem normalize(JsonNode tx, String paymentMethod) throws ProviderException {
    if (!"posted".equalsIgnoreCase(text(tx, "status"))) {
      return null;
    }
    String id = text(tx, "id");
    BigDecimal cents = decimal(tx, "amount");
    Instant date = instant(tx, "transacted_at");
    if (id == null || cents == null || date == null) {
      throw new ProviderException("Malformed card aggregator transaction: " + firstNonBlank(id, "<no id>"));
    }
    String description = firstNonBlank(text(tx, "description"), "");
    return new NormalizedItem(id, date, cents.movePointLeft(2), description, description, paymentMethod);
  }
}
