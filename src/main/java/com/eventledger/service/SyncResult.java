package com.eventledger.service;

import java.util.UUID;

/** Outcome of syncing one account. Not persisted. */
public record SyncResult(UUID accountId, Outcome outcome, int itemsMerged, String error) {
  public static final String TIMEOUT = "timeout";
  public static final String IN_PROGRESS = "sync already in progress";

  public enum Outcome {
    OK,
    ERROR
  }

  public static SyncResult ok(UUID accountId, int itemsMerged) {
    return new SyncResult(accountId, Outcome.OK, itemsMerged, null);
  }

  public static SyncResult error(UUID accountId, String error) {
    return new SyncResult(accountId, Outcome.ERROR, 0, error);
  }

  public boolean isOk() {
    return outcome == Outcome.OK;
  }
}
