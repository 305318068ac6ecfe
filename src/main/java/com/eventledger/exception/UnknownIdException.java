package com.eventledger.exception;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class UnknownIdException extends ResponseStatusException {
  private final List<UUID> unknownIds;

  public UnknownIdException(Collection<UUID> unknownIds) {
    super(HttpStatus.NOT_FOUND, "Unknown hint ids: " + unknownIds);
    this.unknownIds = List.copyOf(unknownIds);
  }

  public List<UUID> getUnknownIds() {
    return unknownIds;
  }
}
