package com.eventledger.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BalancesResponse {
  private List<AccountResponse> accounts;
  private BigDecimal total;
  private Instant computedAt;
}
