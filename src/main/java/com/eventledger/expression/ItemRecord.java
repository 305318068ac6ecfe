package com.eventledger.expression;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/** One selected line item as seen by an expression. */
public record ItemRecord(BigDecimal amount, String description, String paymentMethod, String responsibleParty) {
  static final Set<String> FIELDS = Set.of("amount", "description", "payment_method", "responsible_party");

  public ItemRecord {
    amount = amount == null ? BigDecimal.ZERO : amount;
    description = description == null ? "" : description;
    paymentMethod = paymentMethod == null ? "" : paymentMethod;
    responsibleParty = responsibleParty == null ? "" : responsibleParty;
  }

  /** Field value by its expression name; strings are lower-cased. */
  Object field(String name) {
    return switch (name) {
      case "amount" -> amount;
      case "description" -> description.toLowerCase(Locale.ROOT);
      case "payment_method" -> paymentMethod.toLowerCase(Locale.ROOT);
      case "responsible_party" -> responsibleParty.toLowerCase(Locale.ROOT);
      default -> throw new IllegalArgumentException("Unknown item field " + name);
    };
  }
}
