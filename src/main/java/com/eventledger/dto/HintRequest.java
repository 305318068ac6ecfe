package com.eventledger.dto;

import lombok.Getter;
import lombok.Setter;

/** Create or partial update of a hint; null fields are left untouched on update. */
@Getter
@Setter
public class HintRequest {
  private String name;
  private String celExpression;
  private String prefillName;
  private String prefillCategoryId;
  private Integer displayOrder;
  private Boolean isActive;
}
