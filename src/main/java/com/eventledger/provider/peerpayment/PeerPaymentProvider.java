package com.eventledger.provider.peerpayment;

import static com.eventledger.provider.JsonNodes.array;
import static com.eventledger.provider.JsonNodes.decimal;
import static com.eventledger.provider.JsonNodes.firstNonBlank;
import static com.eventledger.provider.JsonNodes.instant;
import static com.eventledger.provider.JsonNodes.text;

import com.eventledger.model.Account;
import com.eventledger.model.ProviderType;
import com.eventledger.provider.AccountProvider;
import com.eventledger.provider.FetchResult;
import com.eventledger.provider.NormalizedItem;
import com.eventledger.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * Peer-to-peer payment feed. The upstream amount is always positive; the sign comes from
 * who paid whom. The owner pays when they send a {@code pay} or are the target of a
 * {@code charge}.
 */
@Component
public class PeerPaymentProvider implements AccountProvider {
  private static final int MAX_PAGES = 200;

  private final PeerPaymentClient client;

  public PeerPaymentProvider(PeerPaymentClient client) {
    this.client = client;
  }

  @Override
  public ProviderType getProviderType() {
    return ProviderType.PEER_PAYMENT;
  }

  @Override
  public FetchResult fetch(Account account) throws ProviderException {
    String owner = client.ownerFirstName();
    if (owner == null || owner.isBlank()) {
      throw new ProviderException("Peer payment owner first name is not configured");
    }
    List<NormalizedItem> items = new ArrayList<>();
    try {
      String beforeId = null;
      int pages = 0;
      boolean more;
      do {
        JsonNode response = client.listTransactions(beforeId);
        JsonNode data = array(response, "data");
        if (data == null) {
          throw new ProviderException("Malformed peer payment response: missing data array");
        }
        String lastId = null;
        for (JsonNode story : data) {
          lastId = text(story, "id");
          items.add(normalize(story, owner, account.getDisplayName()));
        }
        more = text(response, "pagination.next") != null && lastId != null;
        beforeId = lastId;
        pages++;
      } while (more && pages < MAX_PAGES);
    } catch (RestClientException | IllegalStateException ex) {
      throw new ProviderException("Peer payment request failed: " + ex.getMessage(), ex);
    }
    return FetchResult.of(items);
  }

  NormalizedItem normalize(JsonNode story, String owner, String paymentMethod) throws ProviderException {
    String id = text(story, "id");
    BigDecimal amount = decimal(story, "amount");
    Instant date = instant(story, "date_created");
    String action = firstNonBlank(text(story, "payment_type"), text(story, "action"));
    String actor = firstNonBlank(text(story, "actor.first_name"), "");
    String target = firstNonBlank(text(story, "target.first_name"), "");
    if (id == null || amount == null || date == null || action == null) {
      throw new ProviderException("Malformed peer payment story: " + firstNonBlank(id, "<no id>"));
    }
    boolean ownerIsActor = actor.equalsIgnoreCase(owner);
    boolean ownerIsTarget = target.equalsIgnoreCase(owner);
    boolean ownerPaid = (ownerIsActor && "pay".equalsIgnoreCase(action))
        || (ownerIsTarget && "charge".equalsIgnoreCase(action));
    String counterparty = ownerIsActor ? target : actor;
    BigDecimal magnitude = amount.abs();
    return new NormalizedItem(
        id,
        date,
        ownerPaid ? magnitude.negate() : magnitude,
        firstNonBlank(text(story, "note"), ""),
        counterparty,
        paymentMethod);
  }
}
