package com.eventledger.provider;

import com.eventledger.model.Account;
import com.eventledger.model.ProviderType;

public interface AccountProvider {
  ProviderType getProviderType();

  FetchResult fetch(Account account) throws ProviderException;
}
