package com.eventledger.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LineItemResponse {
  private UUID id;
  private String provider;
  private String externalRef;
  /** Unix seconds. */
  private long date;
  private BigDecimal amount;
  private String description;
  private String responsibleParty;
  private String paymentMethod;
  private boolean reviewed;
  private boolean selected;
  private boolean manual;
  private UUID eventId;
}
