package com.eventledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "accounts")
@Getter
@Setter
public class Account {
  @Id
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private ProviderType provider;

  @Column(nullable = false)
  private String displayName;

  /** Provider-native account id, if the provider distinguishes accounts. */
  @Column
  private String externalId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AccountStatus status = AccountStatus.ACTIVE;

  @Column(precision = 19, scale = 4)
  private BigDecimal balance;

  @Column
  private Instant balanceAsOf;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status")
  private SyncStatus syncStatus = SyncStatus.IDLE;

  @Column
  private Instant lastSyncedAt;

  @Column(columnDefinition = "TEXT")
  private String lastSyncError;

  @Column
  private Instant createdAt;

  @Column
  private Instant updatedAt;

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
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
