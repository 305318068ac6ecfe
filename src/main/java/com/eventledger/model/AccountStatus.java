package com.eventledger.model;

public enum AccountStatus {
  ACTIVE,
  INACTIVE
}
