package com.eventledger.provider;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Output of one provider fetch. {@code balance} is null when the provider reports none. */
public record FetchResult(List<NormalizedItem> items, BigDecimal balance, Instant balanceAsOf) {

  public static FetchResult of(List<NormalizedItem> items) {
    return new FetchResult(items, null, null);
  }
}
