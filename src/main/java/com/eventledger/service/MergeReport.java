package com.eventledger.service;

/** Outcome of one {@link LineItemLedger#merge} call. */
public record MergeReport(int inserted, int updated, int unchanged) {

  public int merged() {
    return inserted + updated + unchanged;
  }
}
