package com.eventledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** A category cannot be deleted while events or hints still reference it. */
public class CategoryInUseException extends ResponseStatusException {
  public CategoryInUseException(String categoryId) {
    super(HttpStatus.CONFLICT, "Cannot delete category " + categoryId + ": it is in use");
  }
}
