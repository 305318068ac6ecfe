package com.eventledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.Mockito.when;

import com.eventledger.config.HintProperties;
import com.eventledger.expression.ExpressionCompiler;
import com.eventledger.expression.ExpressionEvaluator;
import com.eventledger.model.Hint;
import com.eventledger.model.LineItem;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HintMatcherTest {
  @Mock
  HintStore hintStore;

  HintMatcher matcher;

  @BeforeEach
  void setUp() {
    matcher = new HintMatcher(hintStore, new ExpressionCompiler(new HintProperties(0, 0)), new ExpressionEvaluator());
  }

  @Test
  void returnsFirstMatchingHintInDisplayOrder() {
    Hint never = hint(0, "false", "Never");
    Hint first = hint(1, "true", "First");
    Hint second = hint(2, "true", "Second");
    when(hintStore.list(true)).thenReturn(List.of(never, first, second));

    Optional<Suggestion> suggestion = matcher.suggest(List.of(item("-12.00", "Cafe")));

    assertThat(suggestion).isPresent();
    assertThat(suggestion.get().matchedHintId()).isEqualTo(first.getId());
    assertThat(suggestion.get().name()).isEqualTo("First");
    assertThat(suggestion.get().matchedHintName()).isEqualTo("hint-1");
  }

  @Test
  void returnsEmptyWhenNothingMatches() {
    when(hintStore.list(true)).thenReturn(List.of(hint(0, "amount > 0", "Income")));

    assertThat(matcher.suggest(List.of(item("-5", "Bakery")))).isEmpty();
  }

  @Test
  void skipsHintsThatFailToEvaluateOrCompile() {
    Hint broken = hint(0, "items[3].amount < 0", "Broken");
    Hint stale = hint(1, "merchant == \"x\"", "Stale");
    Hint good = hint(2, "description.contains(\"cafe\")", "Coffee Run");
    good.setPrefillCategoryId("dining");
    when(hintStore.list(true)).thenReturn(List.of(broken, stale, good));

    Optional<Suggestion> suggestion = matcher.suggest(List.of(item("-12.00", "Blue Cafe")));

    assertThat(suggestion).contains(new Suggestion("Coffee Run", "dining", good.getId(), "hint-2"));
  }

  @Test
  void identicalSelectionsYieldIdenticalSuggestions() {
    when(hintStore.list(true)).thenReturn(List.of(hint(0, "count > 1 && amount < 0", "Group")));
    List<LineItem> selection = List.of(item("-30", "Dinner"), item("10", "Dinner split"));

    assertThat(matcher.suggest(selection)).isEqualTo(matcher.suggest(selection));
    assertThat(matcher.suggest(selection)).isPresent();
  }

  @Test
  void recompilesWhenExpressionVersionChanges() {
    Hint hint = hint(0, "amount < 0", "Spend");
    when(hintStore.list(true)).thenReturn(List.of(hint));
    List<LineItem> selection = List.of(item("-1", "x"));

    assertThat(matcher.suggest(selection)).isPresent();
    hint.setExpression("amount > 0");
    hint.setExpressionVersion(2);

    assertThat(matcher.suggest(selection)).isEmpty();
    assertThat(matcher.cacheSize()).isEqualTo(1);
  }

  @Test
  void backtrackingPatternIsSkippedAndLaterHintStillMatches() {
    Hint bomb = hint(0, "description.matches(\"(.*a){20}b\")", "Bomb");
    Hint fallback = hint(1, "amount < 0", "Fallback");
    when(hintStore.list(true)).thenReturn(List.of(bomb, fallback));
    List<LineItem> selection = List.of(item("-3", "a".repeat(66) + "!"));

    Optional<Suggestion> suggestion = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> matcher.suggest(selection));

    assertThat(suggestion.map(Suggestion::matchedHintId)).contains(fallback.getId());
  }

  @Test
  void dropsCompiledFormsOfHintsNoLongerListed() {
    Hint kept = hint(0, "amount > 0", "Kept");
    Hint removed = hint(1, "amount > 100", "Removed");
    when(hintStore.list(true)).thenReturn(List.of(kept, removed), List.of(kept));
    List<LineItem> selection = List.of(item("-1", "x"));

    matcher.suggest(selection);
    assertThat(matcher.cacheSize()).isEqualTo(2);

    matcher.suggest(selection);
    assertThat(matcher.cacheSize()).isEqualTo(1);
  }

  @Test
  void rejectsEmptySelection() {
    assertThatThrownBy(() -> matcher.suggest(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Hint hint(int order, String expression, String prefillName) {
    Hint hint = new Hint();
    hint.setId(UUID.randomUUID());
    hint.setName("hint-" + order);
    hint.setExpression(expression);
    hint.setExpressionVersion(1);
    hint.setPrefillName(prefillName);
    hint.setDisplayOrder(order);
    return hint;
  }

  private static LineItem item(String amount, String description) {
    LineItem item = new LineItem();
    item.setId(UUID.randomUUID());
    item.setAmount(new BigDecimal(amount));
    item.setDescription(description);
    item.setPaymentMethod("Amex");
    item.setCounterparty(description);
    item.setDate(Instant.ofEpochSecond(1_700_000_000L));
    return item;
  }
}
