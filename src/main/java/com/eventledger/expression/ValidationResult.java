package com.eventledger.expression;

public record ValidationResult(boolean valid, String error) {

  public static ValidationResult ok() {
    return new ValidationResult(true, null);
  }

  public static ValidationResult invalid(String error) {
    return new ValidationResult(false, error);
  }
}
