package com.eventledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "event_hints")
@Getter
@Setter
public class Hint {
  @Id
  private UUID id;

  @Column(nullable = false)
  private String name;

  @Column(nullable = false, columnDefinition = "text")
  private String expression;

  /** Bumped on every expression change; part of the compiled-form cache key. */
  @Column(nullable = false)
  private int expressionVersion;

  @Column(nullable = false)
  private String prefillName;

  @Column
  private String prefillCategoryId;

  @Column(nullable = false)
  private int displayOrder;

  @Column(nullable = false)
  private boolean active = true;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  public void touch() {
    updatedAt = Instant.now();
  }
}
