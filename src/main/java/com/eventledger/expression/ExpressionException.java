package com.eventledger.expression;

/**
 * Raised when an expression cannot be compiled: a syntax error, a field or method outside
 * the line-item schema, a non-boolean result, or a violated size limit.
 */
public class ExpressionException extends Exception {
  private final int position;

  public ExpressionException(String message, int position) {
    super(position >= 0 ? message + " at position " + position : message);
    this.position = position;
  }

  public ExpressionException(String message) {
    this(message, -1);
  }

  public int getPosition() {
    return position;
  }
}
