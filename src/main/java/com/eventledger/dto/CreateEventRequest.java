package com.eventledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateEventRequest {
  @NotBlank
  private String name;

  @NotBlank
  private String category;

  @NotEmpty
  private List<UUID> lineItems;

  private LocalDate date;
  private Boolean isDuplicateTransaction;
  private List<String> tags;
}
