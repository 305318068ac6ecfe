package com.eventledger.provider;

import com.eventledger.exception.NotFoundException;
import com.eventledger.model.ProviderType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ProviderRegistry {
  private final Map<ProviderType, AccountProvider> providers = new EnumMap<>(ProviderType.class);

  public ProviderRegistry(List<AccountProvider> providers) {
    for (AccountProvider provider : providers) {
      AccountProvider previous = this.providers.put(provider.getProviderType(), provider);
      if (previous != null) {
        throw new IllegalStateException("Two providers registered for " + provider.getProviderType());
      }
    }
  }

  public AccountProvider require(ProviderType type) {
    AccountProvider provider = providers.get(type);
    if (provider == null) {
      throw new NotFoundException("Unknown provider: " + type);
    }
    return provider;
  }

  public List<AccountProvider> list() {
    return List.copyOf(providers.values());
  }
}
