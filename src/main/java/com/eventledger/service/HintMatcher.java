package com.eventledger.service;

import com.eventledger.expression.CompiledExpression;
import com.eventledger.expression.EvalContext;
import com.eventledger.expression.EvaluationException;
import com.eventledger.expression.ExpressionCompiler;
import com.eventledger.expression.ExpressionEvaluator;
import com.eventledger.expression.ExpressionException;
import com.eventledger.expression.ItemRecord;
import com.eventledger.model.Hint;
import com.eventledger.model.LineItem;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Suggests an event name and category for a selection by returning the first active hint,
 * in display order, whose expression holds. A hint that fails to compile or evaluate is
 * logged and skipped.
 */
@Service
public class HintMatcher {
  private static final Logger log = LoggerFactory.getLogger(HintMatcher.class);

  private final HintStore hintStore;
  private final ExpressionCompiler compiler;
  private final ExpressionEvaluator evaluator;
  private final Map<CacheKey, CompiledExpression> cache = new ConcurrentHashMap<>();

  public HintMatcher(HintStore hintStore, ExpressionCompiler compiler, ExpressionEvaluator evaluator) {
    this.hintStore = hintStore;
    this.compiler = compiler;
    this.evaluator = evaluator;
  }

  public Optional<Suggestion> suggest(List<LineItem> selected) {
    if (selected == null || selected.isEmpty()) {
      throw new IllegalArgumentException("At least one line item must be selected");
    }
    EvalContext context = EvalContext.of(selected.stream().map(HintMatcher::toRecord).toList());
    List<Hint> hints = hintStore.list(true);
    evictMissing(hints);
    for (Hint hint : hints) {
      CompiledExpression compiled = compiled(hint);
      if (compiled == null) {
        continue;
      }
      try {
        if (evaluator.test(compiled, context)) {
          log.debug("Hint {} matched {} item(s)", hint.getId(), selected.size());
          return Optional.of(new Suggestion(
              hint.getPrefillName(), hint.getPrefillCategoryId(), hint.getId(), hint.getName()));
        }
      } catch (EvaluationException ex) {
        log.warn("Skipping hint {} '{}': {}", hint.getId(), hint.getName(), ex.getMessage());
      }
    }
    return Optional.empty();
  }

  private CompiledExpression compiled(Hint hint) {
    CacheKey key = new CacheKey(hint.getId(), hint.getExpressionVersion());
    CompiledExpression cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    try {
      CompiledExpression compiled = compiler.compile(hint.getExpression());
      cache.keySet().removeIf(existing -> existing.hintId().equals(hint.getId()));
      cache.put(key, compiled);
      return compiled;
    } catch (ExpressionException ex) {
      log.warn("Skipping hint {} '{}' that does not compile: {}", hint.getId(), hint.getName(), ex.getMessage());
      return null;
    }
  }

  /** Drops compiled forms of hints that were deleted or deactivated. */
  private void evictMissing(List<Hint> hints) {
    Set<UUID> live = hints.stream().map(Hint::getId).collect(Collectors.toSet());
    cache.keySet().removeIf(key -> !live.contains(key.hintId()));
  }

  int cacheSize() {
    return cache.size();
  }

  static ItemRecord toRecord(LineItem item) {
    return new ItemRecord(item.getAmount(), item.getDescription(), item.getPaymentMethod(), item.getCounterparty());
  }

  private record CacheKey(UUID hintId, int expressionVersion) {}
}
