package com.eventledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class DuplicateOrderException extends ResponseStatusException {
  public DuplicateOrderException(String message) {
    super(HttpStatus.CONFLICT, message);
  }
}
