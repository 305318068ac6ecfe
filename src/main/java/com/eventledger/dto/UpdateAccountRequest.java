package com.eventledger.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateAccountRequest {
  private String displayName;
  private String status;
}
