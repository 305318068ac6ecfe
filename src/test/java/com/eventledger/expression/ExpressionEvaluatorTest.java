package com.eventledger.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.eventledger.config.HintProperties;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {
  private final ExpressionCompiler compiler = new ExpressionCompiler(new HintProperties(0, 0));
  private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

  private final EvalContext dinner = EvalContext.of(List.of(
      new ItemRecord(new BigDecimal("-42.10"), "Trattoria Roma", "Amex", "Trattoria Roma"),
      new ItemRecord(new BigDecimal("21.05"), "dinner split", "Venmo", "Alex")));

  @Test
  void amountIsTheExactSumOfSelectedItems() throws Exception {
    assertThat(evaluator.evaluate(compiler.compile("amount == -21.05"), dinner)).isEqualTo(true);
    assertThat(test("amount == -21.050")).isTrue();
    assertThat(test("count == 2 && count() == 2")).isTrue();
  }

  @Test
  void stringFieldsJoinDistinctValuesAndCompareCaseInsensitively() throws Exception {
    assertThat(test("description == \"trattoria roma DINNER SPLIT\"")).isTrue();
    assertThat(test("payment_method.contains('VENMO')")).isTrue();
    assertThat(test("description.startsWith(\"TRATTORIA\") && description.endsWith(\"Split\")")).isTrue();
    assertThat(test("responsible_party.matches(\".*ROMA\\s+alex\")")).isTrue();
    assertThat(test("responsible_party matches 'roma'")).isFalse();
  }

  @Test
  void sharedValueIsNotRepeated() throws Exception {
    EvalContext rent = EvalContext.of(List.of(
        new ItemRecord(new BigDecimal("-900"), "Rent", "Chase", "Landlord"),
        new ItemRecord(new BigDecimal("450"), "Rent", "Venmo", "Sam")));

    assertThat(evaluator.test(compiler.compile("description == \"rent\" && same(description)"), rent)).isTrue();
    assertThat(evaluator.test(compiler.compile("same(payment_method)"), rent)).isFalse();
  }

  @Test
  void aggregatesAndPerItemPredicates() throws Exception {
    assertThat(test("sum(amount) == amount && min_val(amount) == -42.10 && max_val(amount) == 21.05")).isTrue();
    assertThat(test("avg(amount) == -10.525")).isTrue();
    assertThat(test("any_match(amount > 0) && !all_match(amount > 0)")).isTrue();
    assertThat(test("!items.?[payment_method == \"amex\"].isEmpty() && items.?[amount == 0].isEmpty()")).isTrue();
    assertThat(test("items[1].responsible_party == \"alex\" && items.size() == 2")).isTrue();
  }

  @Test
  void arithmeticUsesDecimalSemantics() throws Exception {
    EvalContext cents = EvalContext.of(List.of(
        new ItemRecord(new BigDecimal("0.1"), "a", "Cash", ""),
        new ItemRecord(new BigDecimal("0.2"), "b", "Cash", "")));

    assertThat(evaluator.test(compiler.compile("amount == 0.3"), cents)).isTrue();
    assertThat(evaluator.test(compiler.compile("amount * 10 / 3 == 1"), cents)).isTrue();
  }

  @Test
  void runtimeErrorsAreReportedNotTreatedAsFalse() throws Exception {
    CompiledExpression outOfRange = compiler.compile("items[5].amount < 0");
    CompiledExpression divideByZero = compiler.compile("amount / 0 > 1");

    assertThatThrownBy(() -> evaluator.test(outOfRange, dinner))
        .isInstanceOf(EvaluationException.class)
        .hasMessageContaining("index");
    assertThatThrownBy(() -> evaluator.test(divideByZero, dinner))
        .isInstanceOf(EvaluationException.class);
  }

  @Test
  void catastrophicBacktrackingIsCutOffInsteadOfHanging() throws Exception {
    EvalContext bomb = EvalContext.of(List.of(
        new ItemRecord(BigDecimal.ONE, "a".repeat(66) + "!", "Cash", "")));
    CompiledExpression method = compiler.compile("description.matches(\"(.*a){20}b\")");
    CompiledExpression operator = compiler.compile("description matches '(.*a){20}b'");

    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
      assertThatThrownBy(() -> evaluator.test(method, bomb)).isInstanceOf(EvaluationException.class);
      assertThatThrownBy(() -> evaluator.test(operator, bomb)).isInstanceOf(EvaluationException.class);
    });
  }

  @Test
  void contextRequiresAtLeastOneItem() {
    assertThatThrownBy(() -> EvalContext.of(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingFieldsDefaultToEmptyValues() throws Exception {
    EvalContext bare = EvalContext.of(List.of(new ItemRecord(null, null, null, null)));

    assertThat(evaluator.test(compiler.compile("amount == 0 && description == \"\""), bare)).isTrue();
  }

  private boolean test(String expression) throws Exception {
    return evaluator.test(compiler.compile(expression), dinner);
  }
}
