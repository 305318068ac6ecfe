package com.eventledger.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Sync outcomes together with the reviewable items after the refresh. */
@Getter
@AllArgsConstructor
public class RefreshResponse {
  private List<SyncResultResponse> results;
  private List<LineItemResponse> data;
}
