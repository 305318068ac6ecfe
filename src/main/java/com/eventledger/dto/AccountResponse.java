package com.eventledger.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountResponse {
  private UUID id;
  private String provider;
  private String displayName;
  private String externalId;
  private String status;
  private BigDecimal balance;
  private Instant balanceAsOf;
  private String syncStatus;
  private Instant lastSyncedAt;
  private String lastSyncError;
}
