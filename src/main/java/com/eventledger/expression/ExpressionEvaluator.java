package com.eventledger.expression;

import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Evaluates compiled expressions against an {@link EvalContext}. The evaluation context
 * only reads the line-item fields and resolves the whitelisted methods; types, beans and
 * constructors are unavailable.
 */
@Component
public class ExpressionEvaluator {
  private final LineItemPropertyAccessor propertyAccessor = new LineItemPropertyAccessor();
  private final LineItemMethodResolver methodResolver = new LineItemMethodResolver();

  public boolean test(CompiledExpression expression, EvalContext context) throws EvaluationException {
    Object value = evaluate(expression, context);
    if (!(value instanceof Boolean result)) {
      throw new EvaluationException("Expression did not produce a boolean");
    }
    return result;
  }

  public Object evaluate(CompiledExpression expression, EvalContext context) throws EvaluationException {
    SimpleEvaluationContext evaluationContext = SimpleEvaluationContext.forPropertyAccessors(propertyAccessor)
        .withMethodResolvers(methodResolver)
        .build();
    try {
      return expression.expression().getValue(evaluationContext, context);
    } catch (org.springframework.expression.EvaluationException ex) {
      throw new EvaluationException(ex.getSimpleMessage(), ex);
    } catch (ArithmeticException ex) {
      throw new EvaluationException("Arithmetic error: " + ex.getMessage(), ex);
    }
  }
}
