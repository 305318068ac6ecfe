package com.eventledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "line_items",
    uniqueConstraints = @UniqueConstraint(name = "uk_line_items_provider_ref", columnNames = {"provider", "external_ref"}),
    indexes = @Index(name = "ix_line_items_event", columnList = "event_id")
)
@Getter
@Setter
public class LineItem {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(length = 32)
  private ProviderType provider;

  @Column(name = "external_ref", length = 255)
  private String externalRef;

  @Column(name = "occurred_at", nullable = false)
  private Instant date;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(columnDefinition = "text")
  private String description;

  @Column
  private String counterparty;

  @Column
  private String paymentMethod;

  @Column(nullable = false)
  private boolean reviewed;

  @Column(nullable = false)
  private boolean selected;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "event_id")
  private Event event;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  /** Entered by hand rather than pulled from a provider. */
  public boolean isManual() {
    return provider == null && (externalRef == null || externalRef.isBlank());
  }

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    counterparty = truncate(counterparty, DEFAULT_VARCHAR_LIMIT);
    paymentMethod = truncate(paymentMethod, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
