package com.eventledger.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ReorderHintsRequest {
  @NotNull
  private List<UUID> hintIds;
}
