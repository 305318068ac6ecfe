package com.eventledger.exception;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Some of the requested line items do not exist; nothing was changed. */
public class PartialNotFoundException extends ResponseStatusException {
  private final List<UUID> missingIds;

  public PartialNotFoundException(Collection<UUID> missingIds) {
    super(HttpStatus.NOT_FOUND, "Line items not found: " + missingIds);
    this.missingIds = List.copyOf(missingIds);
  }

  public List<UUID> getMissingIds() {
    return missingIds;
  }
}
