package com.eventledger.expression;

import java.util.List;
import java.util.Set;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

/**
 * The only methods an expression may call: string tests, list size checks and the amount
 * aggregates on the root. Anything else fails to resolve.
 *
 * <p>{@code matches} is delegated to the SpEL {@code matches} operator, which bounds the
 * work a single regular expression may do.
 */
final class LineItemMethodResolver implements MethodResolver {
  static final Set<String> METHOD_NAMES = Set.of(
      "contains", "startsWith", "endsWith", "matches", "size", "isEmpty",
      "sum", "count", "avg", "min_val", "max_val");

  private static final Expression MATCHES = new SpelExpressionParser().parseExpression("#input matches #pattern");

  @Override
  public MethodExecutor resolve(EvaluationContext context, Object target, String name,
                                List<TypeDescriptor> argumentTypes) {
    int arity = argumentTypes.size();
    if (target instanceof String) {
      return arity == 0 ? stringQuery(name) : arity == 1 ? stringTest(name) : null;
    }
    if (target instanceof List) {
      return listMethod(name, arity);
    }
    if (target instanceof EvalContext) {
      return aggregate(name, arity);
    }
    return null;
  }

  private static MethodExecutor stringQuery(String name) {
    return switch (name) {
      case "size" -> (context, target, args) -> new TypedValue(((String) target).length());
      case "isEmpty" -> (context, target, args) -> new TypedValue(((String) target).isEmpty());
      default -> null;
    };
  }

  private static MethodExecutor stringTest(String name) {
    return switch (name) {
      case "contains" -> (context, target, args) -> new TypedValue(((String) target).contains(text(args[0])));
      case "startsWith" -> (context, target, args) -> new TypedValue(((String) target).startsWith(text(args[0])));
      case "endsWith" -> (context, target, args) -> new TypedValue(((String) target).endsWith(text(args[0])));
      case "matches" -> (context, target, args) -> new TypedValue(matches((String) target, text(args[0])));
      default -> null;
    };
  }

  private static MethodExecutor listMethod(String name, int arity) {
    if (arity == 0 && "size".equals(name)) {
      return (context, target, args) -> new TypedValue(((List<?>) target).size());
    }
    if (arity == 0 && "isEmpty".equals(name)) {
      return (context, target, args) -> new TypedValue(((List<?>) target).isEmpty());
    }
    if (arity == 1 && "contains".equals(name)) {
      return (context, target, args) -> new TypedValue(((List<?>) target).contains(args[0]));
    }
    return null;
  }

  private static MethodExecutor aggregate(String name, int arity) {
    if (arity == 0) {
      return "count".equals(name) ? (context, target, args) -> new TypedValue(((EvalContext) target).count()) : null;
    }
    if (arity != 1) {
      return null;
    }
    return switch (name) {
      case "sum" -> (context, target, args) -> new TypedValue(((EvalContext) target).amount());
      case "avg" -> (context, target, args) -> new TypedValue(((EvalContext) target).average());
      case "min_val" -> (context, target, args) -> new TypedValue(((EvalContext) target).min());
      case "max_val" -> (context, target, args) -> new TypedValue(((EvalContext) target).max());
      default -> null;
    };
  }

  private static boolean matches(String input, String pattern) {
    SimpleEvaluationContext regexContext = SimpleEvaluationContext.forReadOnlyDataBinding().build();
    regexContext.setVariable("input", input);
    regexContext.setVariable("pattern", pattern);
    return Boolean.TRUE.equals(MATCHES.getValue(regexContext, Boolean.class));
  }

  private static String text(Object argument) throws AccessException {
    if (argument instanceof String value) {
      return value;
    }
    throw new AccessException("Expected a string argument but got " + argument);
  }
}
