package com.eventledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EventResponse {
  private UUID id;
  private String name;
  private String category;
  /** Unix seconds. */
  private long date;
  private BigDecimal amount;
  @JsonProperty("is_duplicate_transaction")
  private boolean duplicateTransaction;
  private List<UUID> lineItemIds;
  private List<String> tags;
}
