package com.eventledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EvaluateHintsResponse {
  @JsonInclude(JsonInclude.Include.ALWAYS)
  private SuggestionResponse suggestion;
}
