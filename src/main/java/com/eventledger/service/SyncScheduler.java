package com.eventledger.service;

import com.eventledger.config.SyncProperties;
import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.repository.AccountRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private final AccountRepository accountRepository;
  private final AccountSyncOrchestrator orchestrator;
  private final SyncProperties properties;

  public SyncScheduler(AccountRepository accountRepository,
                       AccountSyncOrchestrator orchestrator,
                       SyncProperties properties) {
    this.accountRepository = accountRepository;
    this.orchestrator = orchestrator;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${eventledger.sync.poll-ms:60000}")
  public void run() {
    if (!properties.enabled()) {
      return;
    }
    Instant now = Instant.now();
    List<Account> due = accountRepository.findByStatus(AccountStatus.ACTIVE)
        .stream()
        .filter(account -> shouldSync(account, now))
        .toList();
    if (!due.isEmpty()) {
      orchestrator.refreshAll(due);
    }
  }

  boolean shouldSync(Account account, Instant now) {
    if (orchestrator.isInFlight(account.getId())) {
      return false;
    }
    long intervalMs = properties.intervalMs();
    if (intervalMs <= 0) {
      return true;
    }
    Instant lastSync = account.getLastSyncedAt();
    if (lastSync == null) {
      return true;
    }
    return Duration.between(lastSync, now).toMillis() >= intervalMs;
  }
}
