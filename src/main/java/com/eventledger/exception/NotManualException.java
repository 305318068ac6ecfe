package com.eventledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class NotManualException extends ResponseStatusException {
  public NotManualException(String message) {
    super(HttpStatus.CONFLICT, message);
  }
}
