package com.eventledger.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** Lenient accessors shared by the provider normalizers. */
public final class JsonNodes {
  private JsonNodes() {
  }

  public static String text(JsonNode node, String path) {
    JsonNode current = node;
    for (String part : path.split("\\.")) {
      if (current == null) {
        return null;
      }
      current = current.path(part);
      if (current.isMissingNode() || current.isNull()) {
        return null;
      }
    }
    return current.isTextual() ? current.asText() : current.toString();
  }

  public static String firstNonBlank(String... values) {
    if (values == null) {
      return null;
    }
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  public static JsonNode array(JsonNode root, String... candidates) {
    if (root == null) {
      return null;
    }
    if (root.isArray()) {
      return root;
    }
    for (String key : candidates) {
      JsonNode node = root.path(key);
      if (node.isArray()) {
        return node;
      }
    }
    return null;
  }

  public static BigDecimal decimal(JsonNode node, String path) {
    String value = text(node, path);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  /** Accepts epoch seconds, an ISO offset date-time or a plain ISO date (taken as UTC midnight). */
  public static Instant instant(JsonNode node, String path) {
    String value = text(node, path);
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return Instant.ofEpochSecond(Long.parseLong(trimmed));
    }
    try {
      return OffsetDateTime.parse(trimmed).toInstant();
    } catch (DateTimeParseException ignored) {
      // fall through to a plain date
    }
    try {
      return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed)
          .atStartOfDay(ZoneOffset.UTC)
          .toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
