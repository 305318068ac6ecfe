package com.eventledger.controller;

import com.eventledger.dto.AccountResponse;
import com.eventledger.dto.BalancesResponse;
import com.eventledger.dto.CreateAccountRequest;
import com.eventledger.dto.MonthlyBreakdownResponse;
import com.eventledger.dto.RefreshResponse;
import com.eventledger.dto.UpdateAccountRequest;
import com.eventledger.model.Account;
import com.eventledger.model.ProviderType;
import com.eventledger.service.AccountService;
import com.eventledger.service.AccountSyncOrchestrator;
import com.eventledger.service.AggregateService;
import com.eventledger.service.AggregateSnapshot;
import com.eventledger.service.LineItemLedger;
import com.eventledger.service.SyncResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AccountController {
  private final AccountService accountService;
  private final AccountSyncOrchestrator orchestrator;
  private final AggregateService aggregateService;
  private final LineItemLedger ledger;

  public AccountController(AccountService accountService,
                           AccountSyncOrchestrator orchestrator,
                           AggregateService aggregateService,
                           LineItemLedger ledger) {
    this.accountService = accountService;
    this.orchestrator = orchestrator;
    this.aggregateService = aggregateService;
    this.ledger = ledger;
  }

  @GetMapping("/accounts")
  public List<AccountResponse> list() {
    return accountService.list().stream().map(ResponseMapper::account).toList();
  }

  @PostMapping("/accounts")
  @ResponseStatus(HttpStatus.CREATED)
  public AccountResponse create(@Valid @RequestBody CreateAccountRequest request) {
    return ResponseMapper.account(accountService.create(request));
  }

  @PatchMapping("/accounts/{accountId}")
  public AccountResponse update(@PathVariable UUID accountId, @RequestBody UpdateAccountRequest request) {
    return ResponseMapper.account(accountService.update(accountId, request));
  }

  @GetMapping("/accounts/balances")
  public BalancesResponse balances() {
    AggregateSnapshot snapshot = aggregateService.current();
    List<AccountResponse> accounts = accountService.listActive().stream().map(ResponseMapper::account).toList();
    return new BalancesResponse(accounts, snapshot.totalBalance(), snapshot.computedAt());
  }

  @GetMapping("/monthly_breakdown")
  public MonthlyBreakdownResponse monthlyBreakdown() {
    AggregateSnapshot snapshot = aggregateService.current();
    return new MonthlyBreakdownResponse(snapshot.monthlyBreakdown(), snapshot.months(), snapshot.computedAt());
  }

  @PostMapping("/refresh/all")
  public RefreshResponse refreshAll() {
    List<SyncResult> results = orchestrator.refreshAll();
    return new RefreshResponse(
        results.stream().map(ResponseMapper::syncResult).toList(),
        ResponseMapper.lineItems(ledger.listUnreviewed()));
  }

  /** 200 on success, 409 while the account is already syncing, 502 when the provider failed. */
  @GetMapping("/account/{provider}/{accountId}/refresh")
  public ResponseEntity<RefreshResponse> refreshOne(@PathVariable String provider, @PathVariable UUID accountId) {
    ProviderType type = AccountService.parseProvider(provider);
    Account account = accountService.get(type, accountId);
    SyncResult result = orchestrator.refreshOne(account);
    RefreshResponse body = new RefreshResponse(
        List.of(ResponseMapper.syncResult(result)),
        ResponseMapper.lineItems(ledger.listUnreviewed()));
    if (result.isOk()) {
      return ResponseEntity.ok(body);
    }
    HttpStatus status = SyncResult.IN_PROGRESS.equals(result.error()) ? HttpStatus.CONFLICT : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status).body(body);
  }
}
