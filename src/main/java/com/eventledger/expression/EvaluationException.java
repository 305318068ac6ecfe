package com.eventledger.expression;

/**
 * Raised when a compiled expression fails at evaluation time, for example a division by
 * zero or an out-of-range index into {@code items}.
 */
public class EvaluationException extends Exception {
  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
