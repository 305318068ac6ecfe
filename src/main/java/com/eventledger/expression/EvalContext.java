package com.eventledger.expression;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Root object of an expression, built from a non-empty selection of line items.
 *
 * <p>{@code amount} is the sum of the selected amounts and {@code count} the number of
 * items. A string field resolves to the value all items share or, when they differ, to
 * the distinct values joined with a single space in selection order. Strings are
 * lower-cased so comparisons ignore case.
 */
public final class EvalContext {
  static final Set<String> FIELDS =
      Set.of("amount", "count", "description", "payment_method", "responsible_party", "items");

  private final List<ItemRecord> items;
  private final BigDecimal amount;
  private final String description;
  private final String paymentMethod;
  private final String responsibleParty;

  private EvalContext(List<ItemRecord> items) {
    this.items = List.copyOf(items);
    this.amount = items.stream().map(ItemRecord::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    this.description = joined(ItemRecord::description);
    this.paymentMethod = joined(ItemRecord::paymentMethod);
    this.responsibleParty = joined(ItemRecord::responsibleParty);
  }

  public static EvalContext of(List<ItemRecord> items) {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("An evaluation context needs at least one line item");
    }
    return new EvalContext(items);
  }

  public List<ItemRecord> items() {
    return items;
  }

  public BigDecimal amount() {
    return amount;
  }

  public int count() {
    return items.size();
  }

  BigDecimal average() {
    return amount.divide(BigDecimal.valueOf(items.size()), MathContext.DECIMAL64);
  }

  BigDecimal min() {
    return items.stream().map(ItemRecord::amount).min(Comparator.naturalOrder()).orElseThrow();
  }

  BigDecimal max() {
    return items.stream().map(ItemRecord::amount).max(Comparator.naturalOrder()).orElseThrow();
  }

  Object field(String name) {
    return switch (name) {
      case "amount" -> amount;
      case "count" -> items.size();
      case "description" -> description;
      case "payment_method" -> paymentMethod;
      case "responsible_party" -> responsibleParty;
      case "items" -> items;
      default -> throw new IllegalArgumentException("Unknown field " + name);
    };
  }

  private String joined(Function<ItemRecord, String> field) {
    Set<String> distinct = new LinkedHashSet<>();
    for (ItemRecord item : items) {
      distinct.add(field.apply(item));
    }
    return String.join(" ", distinct).toLowerCase(Locale.ROOT);
  }
}
