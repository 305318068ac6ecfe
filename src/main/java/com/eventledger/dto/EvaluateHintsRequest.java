package com.eventledger.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class EvaluateHintsRequest {
  @NotEmpty
  private List<UUID> lineItemIds;
}
