package com.eventledger.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncResultResponse {
  private UUID accountId;
  private String outcome;
  private int itemsMerged;
  private String error;
}
