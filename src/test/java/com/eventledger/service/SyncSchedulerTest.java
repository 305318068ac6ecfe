package com.eventledger.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.eventledger.config.SyncProperties;
import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.repository.AccountRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {
  @Mock
  AccountRepository accountRepository;
  @Mock
  AccountSyncOrchestrator orchestrator;

  @Test
  void doesNothingWhenDisabled() {
    SyncScheduler scheduler = new SyncScheduler(accountRepository, orchestrator, properties(false));

    scheduler.run();

    verifyNoInteractions(accountRepository, orchestrator);
  }

  @Test
  void refreshesOnlyAccountsWhoseIntervalElapsed() {
    Account stale = account(Instant.now().minus(Duration.ofHours(2)));
    Account fresh = account(Instant.now().minus(Duration.ofMinutes(5)));
    Account never = account(null);
    Account busy = account(null);
    when(accountRepository.findByStatus(AccountStatus.ACTIVE)).thenReturn(List.of(stale, fresh, never, busy));
    when(orchestrator.isInFlight(any())).thenReturn(false);
    when(orchestrator.isInFlight(busy.getId())).thenReturn(true);

    new SyncScheduler(accountRepository, orchestrator, properties(true)).run();

    verify(orchestrator).refreshAll(List.of(stale, never));
  }

  @Test
  void skipsRefreshWhenNothingIsDue() {
    Account fresh = account(Instant.now());
    when(accountRepository.findByStatus(AccountStatus.ACTIVE)).thenReturn(List.of(fresh));

    new SyncScheduler(accountRepository, orchestrator, properties(true)).run();

    verify(orchestrator, never()).refreshAll(any());
  }

  private static SyncProperties properties(boolean enabled) {
    return new SyncProperties(enabled, 60_000, Duration.ofHours(1).toMillis(), 3, 30_000, 0, 0);
  }

  private static Account account(Instant lastSyncedAt) {
    Account account = new Account();
    account.setId(UUID.randomUUID());
    account.setLastSyncedAt(lastSyncedAt);
    return account;
  }
}
