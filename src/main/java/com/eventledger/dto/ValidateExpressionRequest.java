package com.eventledger.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ValidateExpressionRequest {
  private String celExpression;
}
