package com.eventledger.expression;

import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

/** Exposes the fixed, read-only field set of {@link EvalContext} and {@link ItemRecord}. */
final class LineItemPropertyAccessor implements PropertyAccessor {

  @Override
  public Class<?>[] getSpecificTargetClasses() {
    return new Class<?>[] {EvalContext.class, ItemRecord.class};
  }

  @Override
  public boolean canRead(EvaluationContext context, Object target, String name) {
    if (target instanceof EvalContext) {
      return EvalContext.FIELDS.contains(name);
    }
    return target instanceof ItemRecord && ItemRecord.FIELDS.contains(name);
  }

  @Override
  public TypedValue read(EvaluationContext context, Object target, String name) throws AccessException {
    if (target instanceof EvalContext scope && EvalContext.FIELDS.contains(name)) {
      return new TypedValue(scope.field(name));
    }
    if (target instanceof ItemRecord item && ItemRecord.FIELDS.contains(name)) {
      return new TypedValue(item.field(name));
    }
    throw new AccessException("Unknown field '" + name + "'");
  }

  @Override
  public boolean canWrite(EvaluationContext context, Object target, String name) {
    return false;
  }

  @Override
  public void write(EvaluationContext context, Object target, String name, Object newValue) throws AccessException {
    throw new AccessException("Line item fields are read-only");
  }
}
