package com.eventledger.model;

/** Per-account sync state: {@code IDLE -> FETCHING -> MERGED | FAILED}. */
public enum SyncStatus {
  IDLE,
  FETCHING,
  MERGED,
  FAILED
}
