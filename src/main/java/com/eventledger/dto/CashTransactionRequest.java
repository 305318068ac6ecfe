package com.eventledger.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CashTransactionRequest {
  @NotNull
  private LocalDate date;

  @NotNull
  private BigDecimal amount;

  private String description;
  private String responsibleParty;
  private String paymentMethod;
}
