package com.eventledger.provider.expensesplit;

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

@Component
public class ExpenseSplitProvider implements AccountProvider {
  private static final Logger log = LoggerFactory.getLogger(ExpenseSplitProvider.class);

  private final ExpenseSplitClient client;

  public ExpenseSplitProvider(ExpenseSplitClient client) {
    this.client = client;
  }

  @Override
  public ProviderType getProviderType() {
    return ProviderType.EXPENSE_SPLIT;
  }

  @Override
  public FetchResult fetch(Account account) throws ProviderException {
    String owner = client.ownerFirstName();
    if (owner == null || owner.isBlank()) {
      throw new ProviderException("Expense split owner first name is not configured");
    }
    JsonNode expenses;
    try {
      expenses = array(client.listExpenses(), "expenses");
    } catch (RestClientException | IllegalStateException ex) {
      throw new ProviderException("Expense split request failed: " + ex.getMessage(), ex);
    }
    if (expenses == null) {
      throw new ProviderException("Malformed expense split response: missing expenses array");
    }
    List<NormalizedItem> items = new ArrayList<>();
    for (JsonNode expense : expenses) {
      NormalizedItem item = normalize(expense, owner, account.getDisplayName());
      if (item != null) {
        items.add(item);
      }
    }
    return FetchResult.of(items);
  }

  /** Returns null for deleted expenses and for expenses the owner takes no part in. */
  NormalizedItem normalize(JsonNode expense, String owner, String paymentMethod) throws ProviderException {
    if (text(expense, "deleted_at") != null) {
      return null;
    }
    String id = text(expense, "id");
    Instant date = instant(expense, "date");
    JsonNode users = array(expense, "users");
    if (id == null || date == null || users == null) {
      throw new ProviderException("Malformed expense split expense: " + firstNonBlank(id, "<no id>"));
    }
    BigDecimal ownerBalance = null;
    List<String> others = new ArrayList<>();
    for (JsonNode share : users) {
      String firstName = firstNonBlank(text(share, "user.first_name"), text(share, "first_name"));
      if (firstName == null) {
        continue;
      }
      if (firstName.equalsIgnoreCase(owner)) {
        ownerBalance = decimal(share, "net_balance");
      } else {
        others.add(firstName);
      }
    }
    if (ownerBalance == null) {
      log.debug("Skipping expense {} without a share for {}", id, owner);
      return null;
    }
    return new NormalizedItem(
        id,
        date,
        ownerBalance,
        firstNonBlank(text(expense, "description"), ""),
        String.join(" ", others),
        paymentMethod);
  }
}
