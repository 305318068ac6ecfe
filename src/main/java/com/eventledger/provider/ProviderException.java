package com.eventledger.provider;

/** A provider fetch failed: auth error, upstream error or a payload that cannot be normalized. */
public class ProviderException extends Exception {
  public ProviderException(String message) {
    super(message);
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
