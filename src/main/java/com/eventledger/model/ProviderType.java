package com.eventledger.model;

import java.util.Arrays;
import java.util.Optional;

public enum ProviderType {
  CARD_AGGREGATOR("card-aggregator"),
  PEER_PAYMENT("peer-payment"),
  EXPENSE_SPLIT("expense-split");

  private final String key;

  ProviderType(String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }

  public static Optional<ProviderType> fromKey(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(type -> type.key.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
        .findFirst();
  }
}
