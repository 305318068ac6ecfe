package com.eventledger.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateAccountRequest {
  /** Provider key, e.g. {@code card-aggregator}. */
  @NotBlank
  private String provider;

  @NotBlank
  private String displayName;

  private String externalId;
}
