package com.eventledger.exception;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Line items already belong to another event. */
public class ConflictException extends ResponseStatusException {
  private final List<UUID> conflictingIds;

  public ConflictException(Collection<UUID> conflictingIds) {
    super(HttpStatus.CONFLICT, "Line items already attached to an event: " + conflictingIds);
    this.conflictingIds = List.copyOf(conflictingIds);
  }

  public List<UUID> getConflictingIds() {
    return conflictingIds;
  }
}
