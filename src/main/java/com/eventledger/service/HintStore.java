package com.eventledger.service;

import com.eventledger.dto.HintRequest;
import com.eventledger.exception.DuplicateOrderException;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.UnknownIdException;
import com.eventledger.exception.ValidationException;
import com.eventledger.expression.ExpressionCompiler;
import com.eventledger.expression.ValidationResult;
import com.eventledger.model.Hint;
import com.eventledger.repository.CategoryRepository;
import com.eventledger.repository.HintRepository;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Ordered collection of hints. Active hints never share a {@code displayOrder}; every
 * mutation runs in one transaction so readers never observe a half-applied reorder.
 */
@Service
public class HintStore {
  private static final Logger log = LoggerFactory.getLogger(HintStore.class);

  private final HintRepository repository;
  private final CategoryRepository categoryRepository;
  private final ExpressionCompiler compiler;
  private final TransactionTemplate transactionTemplate;
  private final ReentrantLock lock = new ReentrantLock();

  public HintStore(HintRepository repository,
                   CategoryRepository categoryRepository,
                   ExpressionCompiler compiler,
                   PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.categoryRepository = categoryRepository;
    this.compiler = compiler;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public List<Hint> list(boolean activeOnly) {
    return activeOnly
        ? repository.findByActiveTrueOrderByDisplayOrderAscIdAsc()
        : repository.findAllByOrderByDisplayOrderAscIdAsc();
  }

  public Hint get(UUID id) {
    return repository.findById(id)
        .orElseThrow(() -> new NotFoundException("Hint not found: " + id));
  }

  public ValidationResult validate(String expression) {
    return compiler.validate(expression);
  }

  public Hint create(HintRequest request) {
    String name = requireText(request.getName(), "name");
    String expression = requireExpression(request.getCelExpression());
    String prefillName = requireText(request.getPrefillName(), "prefill_name");
    String categoryId = checkCategory(request.getPrefillCategoryId());
    boolean active = request.getIsActive() == null || request.getIsActive();

    Hint saved = locked(() -> {
      Hint hint = new Hint();
      hint.setName(name);
      hint.setExpression(expression);
      hint.setExpressionVersion(1);
      hint.setPrefillName(prefillName);
      hint.setPrefillCategoryId(categoryId);
      hint.setActive(active);
      if (request.getDisplayOrder() == null) {
        hint.setDisplayOrder(repository.findMaxDisplayOrder() + 1);
      } else {
        int order = requireOrder(request.getDisplayOrder());
        if (active && repository.existsByActiveTrueAndDisplayOrder(order)) {
          throw new DuplicateOrderException("Another active hint already uses display order " + order);
        }
        hint.setDisplayOrder(order);
      }
      return repository.save(hint);
    });
    log.info("Created hint {} '{}' at order {}", saved.getId(), saved.getName(), saved.getDisplayOrder());
    return saved;
  }

  public Hint update(UUID id, HintRequest request) {
    String expression = request.getCelExpression() == null ? null : requireExpression(request.getCelExpression());
    String categoryId = request.getPrefillCategoryId() == null ? null : checkCategory(request.getPrefillCategoryId());

    Hint saved = locked(() -> {
      Hint hint = get(id);
      if (request.getName() != null) {
        hint.setName(requireText(request.getName(), "name"));
      }
      if (request.getPrefillName() != null) {
        hint.setPrefillName(requireText(request.getPrefillName(), "prefill_name"));
      }
      if (request.getPrefillCategoryId() != null) {
        hint.setPrefillCategoryId(categoryId);
      }
      if (expression != null && !expression.equals(hint.getExpression())) {
        hint.setExpression(expression);
        hint.setExpressionVersion(hint.getExpressionVersion() + 1);
      }
      if (request.getIsActive() != null) {
        hint.setActive(request.getIsActive());
      }
      if (request.getDisplayOrder() != null) {
        hint.setDisplayOrder(requireOrder(request.getDisplayOrder()));
      }
      if (hint.isActive()) {
        repository.findFirstByActiveTrueAndDisplayOrderAndIdNot(hint.getDisplayOrder(), hint.getId())
            .ifPresent(other -> {
              throw new DuplicateOrderException(
                  "Hint " + other.getId() + " already uses display order " + hint.getDisplayOrder());
            });
      }
      hint.touch();
      return repository.save(hint);
    });
    log.info("Updated hint {}", id);
    return saved;
  }

  public void delete(UUID id) {
    locked(() -> {
      repository.delete(get(id));
      return null;
    });
    log.info("Deleted hint {}", id);
  }

  /**
   * Gives the listed hints orders {@code 0..n-1} in list order. Hints not listed keep their
   * relative order and move to {@code n} and above.
   */
  public List<Hint> reorder(List<UUID> ids) {
    if (ids == null) {
      throw new ValidationException("hint_ids is required");
    }
    Set<UUID> seen = new HashSet<>();
    for (UUID id : ids) {
      if (id == null || !seen.add(id)) {
        throw new ValidationException("hint_ids must be distinct and non-null");
      }
    }
    List<Hint> reordered = locked(() -> {
      Map<UUID, Hint> all = new LinkedHashMap<>();
      for (Hint hint : repository.findAllByOrderByDisplayOrderAscIdAsc()) {
        all.put(hint.getId(), hint);
      }
      List<UUID> unknown = ids.stream().filter(id -> !all.containsKey(id)).toList();
      if (!unknown.isEmpty()) {
        throw new UnknownIdException(unknown);
      }
      List<Hint> ordered = new ArrayList<>();
      ids.forEach(id -> ordered.add(all.get(id)));
      all.values().stream().filter(hint -> !seen.contains(hint.getId())).forEach(ordered::add);
      for (int i = 0; i < ordered.size(); i++) {
        Hint hint = ordered.get(i);
        if (hint.getDisplayOrder() != i) {
          hint.setDisplayOrder(i);
          hint.touch();
        }
      }
      return repository.saveAll(ordered);
    });
    log.info("Reordered {} hints", ids.size());
    return reordered;
  }

  private <T> T locked(Supplier<T> work) {
    lock.lock();
    try {
      return transactionTemplate.execute(status -> work.get());
    } finally {
      lock.unlock();
    }
  }

  private String requireExpression(String expression) {
    ValidationResult result = compiler.validate(expression);
    if (!result.valid()) {
      throw new ValidationException("Invalid expression: " + result.error());
    }
    return expression.trim();
  }

  private String checkCategory(String categoryId) {
    if (categoryId == null || categoryId.isBlank()) {
      return null;
    }
    String trimmed = categoryId.trim();
    if (!categoryRepository.existsById(trimmed)) {
      throw new ValidationException("Unknown category: " + trimmed);
    }
    return trimmed;
  }

  private static int requireOrder(int order) {
    if (order < 0) {
      throw new ValidationException("display_order must not be negative");
    }
    return order;
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required");
    }
    return value.trim();
  }
}
