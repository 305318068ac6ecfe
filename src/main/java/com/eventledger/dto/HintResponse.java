package com.eventledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HintResponse {
  private UUID id;
  private String name;
  private String celExpression;
  private String prefillName;
  private String prefillCategoryId;
  private int displayOrder;
  @JsonProperty("is_active")
  private boolean active;
  private Instant createdAt;
  private Instant updatedAt;
}
