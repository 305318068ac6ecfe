package com.eventledger.repository;

import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.model.ProviderType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountRepository extends JpaRepository<Account, UUID> {
  List<Account> findByStatus(AccountStatus status);

  Optional<Account> findByIdAndProvider(UUID id, ProviderType provider);

  List<Account> findAllByOrderByDisplayNameAsc();
}
