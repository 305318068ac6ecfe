package com.eventledger.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MonthlyBreakdownResponse {
  /** Category name to month ({@code MM-yyyy}) to amount. */
  private Map<String, Map<String, BigDecimal>> data;
  private List<String> months;
  private Instant computedAt;
}
