package com.eventledger.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.eventledger.model.Account;
import com.eventledger.provider.expensesplit.ExpenseSplitClient;
import com.eventledger.provider.expensesplit.ExpenseSplitProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExpenseSplitProviderTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Mock
  ExpenseSplitClient client;

  @Test
  void ownersNetBalanceBecomesTheAmountAndDeletedExpensesAreSkipped() throws Exception {
    Account account = new Account();
    account.setId(UUID.randomUUID());
    account.setDisplayName("Splitwise");
    when(client.ownerFirstName()).thenReturn("Jordan");
    when(client.listExpenses()).thenReturn(mapper.readTree("""
        {"expenses": [
          {"id": 101, "description": "Groceries", "date": "2024-02-10T12:00:00Z", "deleted_at": null,
           "users": [
             {"user": {"first_name": "Jordan"}, "net_balance": "-23.40"},
             {"user": {"first_name": "Alex"}, "net_balance": "11.70"},
             {"user": {"first_name": "Sam"}, "net_balance": "11.70"}]},
          {"id": 102, "description": "Old dinner", "date": "2024-02-11T12:00:00Z", "deleted_at": "2024-02-12T00:00:00Z",
           "users": [{"user": {"first_name": "Jordan"}, "net_balance": "5.00"}]},
          {"id": 103, "description": "Not mine", "date": "2024-02-12T12:00:00Z",
           "users": [{"user": {"first_name": "Alex"}, "net_balance": "5.00"}]}
        ]}
        """));

    FetchResult result = new ExpenseSplitProvider(client).fetch(account);

    assertThat(result.items()).hasSize(1);
    NormalizedItem item = result.items().get(0);
    assertThat(item.externalRef()).isEqualTo("101");
    assertThat(item.amount()).isEqualByComparingTo("-23.40");
    assertThat(item.counterparty()).isEqualTo("Alex Sam");
    assertThat(item.date()).isEqualTo(Instant.parse("2024-02-10T12:00:00Z"));
    assertThat(item.paymentMethod()).isEqualTo("Splitwise");
  }
}
