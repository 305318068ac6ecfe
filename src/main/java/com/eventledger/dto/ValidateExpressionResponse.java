package com.eventledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ValidateExpressionResponse {
  @JsonProperty("is_valid")
  private boolean valid;
  private String error;
}
