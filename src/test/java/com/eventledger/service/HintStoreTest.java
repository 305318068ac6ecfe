package com.eventledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eventledger.config.HintProperties;
import com.eventledger.dto.HintRequest;
import com.eventledger.exception.DuplicateOrderException;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.UnknownIdException;
import com.eventledger.exception.ValidationException;
import com.eventledger.expression.ExpressionCompiler;
import com.eventledger.model.Category;
import com.eventledger.model.Hint;
import com.eventledger.repository.CategoryRepository;
import com.eventledger.repository.HintRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Import(HintStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class HintStoreTest {
  @Autowired
  HintStore hintStore;
  @Autowired
  HintRepository hintRepository;
  @Autowired
  CategoryRepository categoryRepository;

  @TestConfiguration
  static class CompilerConfig {
    @Bean
    ExpressionCompiler expressionCompiler() {
      return new ExpressionCompiler(new HintProperties(0, 0));
    }
  }

  @BeforeEach
  void setUp() {
    hintRepository.deleteAll();
    categoryRepository.deleteAll();
    Category dining = new Category();
    dining.setId("dining");
    dining.setName("Dining");
    categoryRepository.save(dining);
  }

  @Test
  void createAppendsAfterTheHighestOrder() {
    Hint first = hintStore.create(request("Coffee", "description.contains(\"cafe\")", null));
    Hint second = hintStore.create(request("Rent", "amount < -1000", null));

    assertThat(first.getDisplayOrder()).isZero();
    assertThat(second.getDisplayOrder()).isEqualTo(1);
    assertThat(first.getExpressionVersion()).isEqualTo(1);
    assertThat(first.isActive()).isTrue();
  }

  @Test
  void createRejectsInvalidExpressionsAndUnknownCategories() {
    assertThatThrownBy(() -> hintStore.create(request("Bad", "amount <", null)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Invalid expression");

    HintRequest unknownCategory = request("Coffee", "true", null);
    unknownCategory.setPrefillCategoryId("nope");
    assertThatThrownBy(() -> hintStore.create(unknownCategory)).isInstanceOf(ValidationException.class);

    assertThat(hintRepository.count()).isZero();
  }

  @Test
  void explicitOrderCollidingWithAnActiveHintIsRejected() {
    hintStore.create(request("Coffee", "true", 3));

    assertThatThrownBy(() -> hintStore.create(request("Other", "true", 3)))
        .isInstanceOf(DuplicateOrderException.class);

    HintRequest inactive = request("Draft", "true", 3);
    inactive.setIsActive(false);
    assertThat(hintStore.create(inactive).getDisplayOrder()).isEqualTo(3);
    assertThat(hintStore.list(true)).hasSize(1);
    assertThat(hintStore.list(false)).hasSize(2);
  }

  @Test
  void updateBumpsVersionOnlyWhenExpressionChanges() {
    Hint hint = hintStore.create(request("Coffee", "true", null));

    HintRequest rename = new HintRequest();
    rename.setName("Coffee run");
    rename.setPrefillCategoryId("dining");
    Hint renamed = hintStore.update(hint.getId(), rename);

    HintRequest newExpression = new HintRequest();
    newExpression.setCelExpression("amount < 0");
    Hint changed = hintStore.update(hint.getId(), newExpression);

    assertThat(renamed.getExpressionVersion()).isEqualTo(1);
    assertThat(renamed.getPrefillCategoryId()).isEqualTo("dining");
    assertThat(changed.getExpressionVersion()).isEqualTo(2);
    assertThat(changed.getName()).isEqualTo("Coffee run");
  }

  @Test
  void updateRejectsInvalidExpressionAndLeavesHintUntouched() {
    Hint hint = hintStore.create(request("Coffee", "true", null));
    HintRequest broken = new HintRequest();
    broken.setCelExpression("amount + ");

    assertThatThrownBy(() -> hintStore.update(hint.getId(), broken)).isInstanceOf(ValidationException.class);
    assertThat(hintStore.get(hint.getId()).getExpression()).isEqualTo("true");
    assertThatThrownBy(() -> hintStore.update(UUID.randomUUID(), broken)).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> hintStore.update(UUID.randomUUID(), new HintRequest()))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void reorderRewritesListedIdsAndKeepsTheRestBehindInOrder() {
    Hint a = hintStore.create(request("A", "true", null));
    Hint b = hintStore.create(request("B", "true", null));
    Hint c = hintStore.create(request("C", "true", null));
    Hint d = hintStore.create(request("D", "true", null));

    hintStore.reorder(List.of(d.getId(), b.getId()));

    assertThat(hintStore.list(true)).extracting(Hint::getName).containsExactly("D", "B", "A", "C");
    assertThat(hintStore.list(true)).extracting(Hint::getDisplayOrder).containsExactly(0, 1, 2, 3);
  }

  @Test
  void reorderWithUnknownIdChangesNothing() {
    Hint a = hintStore.create(request("A", "true", null));
    Hint b = hintStore.create(request("B", "true", null));
    UUID unknown = UUID.randomUUID();

    assertThatThrownBy(() -> hintStore.reorder(List.of(b.getId(), unknown)))
        .isInstanceOfSatisfying(UnknownIdException.class,
            ex -> assertThat(ex.getUnknownIds()).containsExactly(unknown));
    assertThatThrownBy(() -> hintStore.reorder(List.of(a.getId(), a.getId())))
        .isInstanceOf(ValidationException.class);

    assertThat(hintStore.list(true)).extracting(Hint::getName).containsExactly("A", "B");
  }

  @Test
  void deleteRemovesTheHint() {
    Hint hint = hintStore.create(request("A", "true", null));

    hintStore.delete(hint.getId());

    assertThat(hintStore.list(false)).isEmpty();
    assertThatThrownBy(() -> hintStore.delete(hint.getId())).isInstanceOf(NotFoundException.class);
  }

  private static HintRequest request(String name, String expression, Integer order) {
    HintRequest request = new HintRequest();
    request.setName(name);
    request.setCelExpression(expression);
    request.setPrefillName(name);
    request.setDisplayOrder(order);
    return request;
  }
}
