package com.eventledger.service;

import com.eventledger.dto.CreateAccountRequest;
import com.eventledger.dto.UpdateAccountRequest;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.ValidationException;
import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.model.ProviderType;
import com.eventledger.repository.AccountRepository;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AccountService {
  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final AccountRepository repository;
  private final AggregateService aggregateService;

  public AccountService(AccountRepository repository, AggregateService aggregateService) {
    this.repository = repository;
    this.aggregateService = aggregateService;
  }

  public List<Account> list() {
    return repository.findAllByOrderByDisplayNameAsc();
  }

  public List<Account> listActive() {
    return repository.findByStatus(AccountStatus.ACTIVE);
  }

  public Account get(UUID id) {
    return repository.findById(id)
        .orElseThrow(() -> new NotFoundException("Account not found: " + id));
  }

  public Account get(ProviderType provider, UUID id) {
    return repository.findByIdAndProvider(id, provider)
        .orElseThrow(() -> new NotFoundException("Account not found: " + provider.getKey() + "/" + id));
  }

  public Account create(CreateAccountRequest request) {
    ProviderType provider = parseProvider(request.getProvider());
    if (request.getDisplayName() == null || request.getDisplayName().isBlank()) {
      throw new ValidationException("display_name is required");
    }
    Account account = new Account();
    account.setProvider(provider);
    account.setDisplayName(request.getDisplayName().trim());
    if (request.getExternalId() != null && !request.getExternalId().isBlank()) {
      account.setExternalId(request.getExternalId().trim());
    }
    Account saved = repository.save(account);
    log.info("Created {} account {}", provider.getKey(), saved.getId());
    return saved;
  }

  public Account update(UUID id, UpdateAccountRequest request) {
    Account account = get(id);
    if (request.getDisplayName() != null) {
      if (request.getDisplayName().isBlank()) {
        throw new ValidationException("display_name must not be blank");
      }
      account.setDisplayName(request.getDisplayName().trim());
    }
    boolean statusChanged = false;
    if (request.getStatus() != null) {
      AccountStatus status = parseStatus(request.getStatus());
      statusChanged = status != account.getStatus();
      account.setStatus(status);
    }
    Account saved = repository.save(account);
    if (statusChanged) {
      log.info("Account {} is now {}", id, saved.getStatus());
      aggregateService.recomputeQuietly();
    }
    return saved;
  }

  public static ProviderType parseProvider(String value) {
    return ProviderType.fromKey(value == null ? null : value.trim())
        .orElseThrow(() -> new ValidationException("Unknown provider: " + value));
  }

  private static AccountStatus parseStatus(String value) {
    try {
      return AccountStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("Unknown account status: " + value);
    }
  }
}
