package com.eventledger.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SuggestionResponse {
  private String name;
  private String category;
  private UUID matchedHintId;
  private String matchedHintName;
}
