package com.eventledger.service;

import com.eventledger.config.SyncProperties;
import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.model.SyncStatus;
import com.eventledger.provider.AccountProvider;
import com.eventledger.provider.FetchResult;
import com.eventledger.provider.ProviderException;
import com.eventledger.provider.ProviderRegistry;
import com.eventledger.repository.AccountRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Refreshes accounts against their providers. Fetches run on the bounded sync pool under
 * one shared deadline; merges run on the calling thread. An account is never fetched twice
 * at the same time, and one account's failure never affects another's result.
 */
@Service
public class AccountSyncOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(AccountSyncOrchestrator.class);
  static final long DEFAULT_FETCH_TIMEOUT_MS = 30_000;

  private final AccountRepository accountRepository;
  private final ProviderRegistry providerRegistry;
  private final LineItemLedger ledger;
  private final AggregateService aggregateService;
  private final ExecutorService executor;
  private final long fetchTimeoutMs;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public AccountSyncOrchestrator(AccountRepository accountRepository,
                                 ProviderRegistry providerRegistry,
                                 LineItemLedger ledger,
                                 AggregateService aggregateService,
                                 @Qualifier("syncExecutor") ExecutorService executor,
                                 SyncProperties properties) {
    this.accountRepository = accountRepository;
    this.providerRegistry = providerRegistry;
    this.ledger = ledger;
    this.aggregateService = aggregateService;
    this.executor = executor;
    this.fetchTimeoutMs = properties.fetchTimeoutMs() > 0 ? properties.fetchTimeoutMs() : DEFAULT_FETCH_TIMEOUT_MS;
  }

  /** Syncs every active account. */
  public List<SyncResult> refreshAll() {
    return refreshAll(accountRepository.findByStatus(AccountStatus.ACTIVE));
  }

  /**
   * Syncs the active accounts among the given ones, returning one result per synced account
   * in the same order. Inactive accounts are skipped and get no result.
   */
  public List<SyncResult> refreshAll(List<Account> accounts) {
    List<Account> active = accounts.stream()
        .filter(account -> account.getStatus() == AccountStatus.ACTIVE)
        .toList();
    if (active.size() < accounts.size()) {
      log.info("Skipping {} inactive account(s)", accounts.size() - active.size());
    }
    return sync(active);
  }

  /** Syncs one account regardless of its status, so a reactivated account can catch up. */
  public SyncResult refreshOne(Account account) {
    return sync(List.of(account)).get(0);
  }

  /** True while a fetch for the account is running, including one that already timed out. */
  public boolean isInFlight(UUID accountId) {
    return inFlight.contains(accountId);
  }

  private List<SyncResult> sync(List<Account> accounts) {
    log.info("Refreshing {} account(s)", accounts.size());
    Map<UUID, SyncResult> results = new LinkedHashMap<>();
    List<FetchTask> pending = new ArrayList<>();
    for (Account account : accounts) {
      results.put(account.getId(), null);
      if (!inFlight.add(account.getId())) {
        log.info("Account {} is already syncing; skipping", account.getId());
        results.put(account.getId(), SyncResult.error(account.getId(), SyncResult.IN_PROGRESS));
        continue;
      }
      try {
        AccountProvider provider = providerRegistry.require(account.getProvider());
        FetchTask task = new FetchTask(markFetching(account), provider);
        task.future = executor.submit(task);
        pending.add(task);
      } catch (RuntimeException ex) {
        inFlight.remove(account.getId());
        results.put(account.getId(), fail(account, ex.getMessage()));
      }
    }

    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(fetchTimeoutMs);
    boolean merged = false;
    for (FetchTask task : pending) {
      Account account = task.account;
      try {
        SyncResult result = await(task, deadline);
        merged |= result.isOk();
        results.put(account.getId(), result);
      } finally {
        // an abandoned fetch releases the account itself once its worker exits
        if (!task.isAbandoned()) {
          inFlight.remove(account.getId());
        }
      }
    }
    if (merged) {
      aggregateService.recomputeQuietly();
    }
    List<SyncResult> ordered = new ArrayList<>(results.values());
    long failures = ordered.stream().filter(result -> !result.isOk()).count();
    log.info("Refresh finished: {} ok, {} failed", ordered.size() - failures, failures);
    return ordered;
  }

  private SyncResult await(FetchTask task, long deadline) {
    Account account = task.account;
    FetchResult fetched;
    try {
      long remaining = Math.max(0, deadline - System.nanoTime());
      fetched = task.future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      task.abandon();
      log.warn("Fetch for account {} timed out after {} ms", account.getId(), fetchTimeoutMs);
      return fail(account, SyncResult.TIMEOUT);
    } catch (InterruptedException ex) {
      task.abandon();
      Thread.currentThread().interrupt();
      return fail(account, "interrupted");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof ProviderException) {
        log.warn("Fetch for account {} failed: {}", account.getId(), cause.getMessage());
      } else {
        log.warn("Fetch for account {} failed unexpectedly", account.getId(), cause);
      }
      return fail(account, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    }

    try {
      MergeReport report = ledger.merge(account.getProvider(), fetched.items());
      account.setSyncStatus(SyncStatus.MERGED);
      account.setLastSyncedAt(Instant.now());
      account.setLastSyncError(null);
      if (fetched.balance() != null) {
        account.setBalance(fetched.balance());
        account.setBalanceAsOf(fetched.balanceAsOf() == null ? Instant.now() : fetched.balanceAsOf());
      }
      accountRepository.save(account);
      return SyncResult.ok(account.getId(), report.merged());
    } catch (RuntimeException ex) {
      log.warn("Merge for account {} failed: {}", account.getId(), ex.getMessage(), ex);
      return fail(account, "merge failed: " + ex.getMessage());
    }
  }

  private Account markFetching(Account account) {
    account.setSyncStatus(SyncStatus.FETCHING);
    return accountRepository.save(account);
  }

  private SyncResult fail(Account account, String error) {
    try {
      account.setSyncStatus(SyncStatus.FAILED);
      account.setLastSyncError(error);
      accountRepository.save(account);
    } catch (RuntimeException ex) {
      log.warn("Could not record sync failure for account {}: {}", account.getId(), ex.getMessage());
    }
    return SyncResult.error(account.getId(), error);
  }

  private enum TaskState { QUEUED, RUNNING, DONE, ABANDONED }

  /**
   * One provider fetch on the sync pool. Cancelling cannot stop a provider that ignores
   * interrupts, so once a running fetch is abandoned the worker keeps the account in flight
   * until the provider call returns.
   */
  private final class FetchTask implements Callable<FetchResult> {
    private final Account account;
    private final AccountProvider provider;
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.QUEUED);
    private Future<FetchResult> future;

    FetchTask(Account account, AccountProvider provider) {
      this.account = account;
      this.provider = provider;
    }

    @Override
    public FetchResult call() throws ProviderException {
      if (!state.compareAndSet(TaskState.QUEUED, TaskState.RUNNING)) {
        return null;
      }
      try {
        return provider.fetch(account);
      } finally {
        if (!state.compareAndSet(TaskState.RUNNING, TaskState.DONE)) {
          inFlight.remove(account.getId());
          log.info("Abandoned fetch for account {} has exited", account.getId());
        }
      }
    }

    void abandon() {
      future.cancel(true);
      if (state.getAndSet(TaskState.ABANDONED) != TaskState.RUNNING) {
        inFlight.remove(account.getId());
      }
    }

    boolean isAbandoned() {
      return state.get() == TaskState.ABANDONED;
    }
  }
}
