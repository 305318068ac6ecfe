package com.eventledger.dto;

import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EventListResponse {
  private List<EventResponse> data;
  private BigDecimal total;
}
