package com.eventledger.expression;

import com.eventledger.config.HintProperties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.Assign;
import org.springframework.expression.spel.ast.BeanReference;
import org.springframework.expression.spel.ast.BooleanLiteral;
import org.springframework.expression.spel.ast.CompoundExpression;
import org.springframework.expression.spel.ast.ConstructorReference;
import org.springframework.expression.spel.ast.FunctionReference;
import org.springframework.expression.spel.ast.MethodReference;
import org.springframework.expression.spel.ast.OpAnd;
import org.springframework.expression.spel.ast.OpEQ;
import org.springframework.expression.spel.ast.OpGE;
import org.springframework.expression.spel.ast.OpGT;
import org.springframework.expression.spel.ast.OpLE;
import org.springframework.expression.spel.ast.OpLT;
import org.springframework.expression.spel.ast.OpNE;
import org.springframework.expression.spel.ast.OpOr;
import org.springframework.expression.spel.ast.OperatorBetween;
import org.springframework.expression.spel.ast.OperatorInstanceof;
import org.springframework.expression.spel.ast.OperatorMatches;
import org.springframework.expression.spel.ast.OperatorNot;
import org.springframework.expression.spel.ast.PropertyOrFieldReference;
import org.springframework.expression.spel.ast.StringLiteral;
import org.springframework.expression.spel.ast.Ternary;
import org.springframework.expression.spel.ast.TypeReference;
import org.springframework.expression.spel.ast.VariableReference;
import org.springframework.expression.spel.standard.SpelExpression;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;

/**
 * Compiles hint expressions into SpEL ASTs checked against the line-item schema: only the
 * known fields and methods may appear, the result must be boolean, and type, bean,
 * constructor and assignment constructs are rejected up front.
 */
@Component
public class ExpressionCompiler {
  static final int DEFAULT_MAX_LENGTH = 500;
  static final int DEFAULT_MAX_DEPTH = 10;

  private static final Set<String> AMOUNT_AGGREGATES = Set.of("sum", "avg", "min_val", "max_val");
  private static final Set<String> BOOLEAN_METHODS = Set.of("contains", "startsWith", "endsWith", "matches", "isEmpty");
  private static final Set<String> VARIABLES = Set.of("#this", "#root");

  private final SpelExpressionParser parser = new SpelExpressionParser();
  private final int maxLength;
  private final int maxDepth;

  public ExpressionCompiler(HintProperties properties) {
    this.maxLength = properties.maxExpressionLength() > 0 ? properties.maxExpressionLength() : DEFAULT_MAX_LENGTH;
    this.maxDepth = properties.maxNestingDepth() > 0 ? properties.maxNestingDepth() : DEFAULT_MAX_DEPTH;
  }

  public CompiledExpression compile(String source) throws ExpressionException {
    if (source == null || source.isBlank()) {
      throw new ExpressionException("Expression cannot be empty");
    }
    String trimmed = source.trim();
    if (trimmed.length() > maxLength) {
      throw new ExpressionException("Expression too long (max " + maxLength + " characters)");
    }
    if (ExpressionSource.nestingDepth(trimmed) > maxDepth) {
      throw new ExpressionException("Expression too deeply nested (max " + maxDepth + " levels)");
    }
    String prepared = ExpressionSource.expandMacros(ExpressionSource.foldLiterals(trimmed));
    SpelExpression parsed;
    try {
      parsed = parser.parseRaw(prepared);
    } catch (ParseException ex) {
      throw new ExpressionException(ex.getSimpleMessage(), ex.getPosition());
    }
    SpelNode root = parsed.getAST();
    check(root);
    if (!yieldsBoolean(root)) {
      throw new ExpressionException("Expression must evaluate to a boolean");
    }
    return new CompiledExpression(trimmed, parsed);
  }

  public ValidationResult validate(String source) {
    try {
      compile(source);
      return ValidationResult.ok();
    } catch (ExpressionException ex) {
      return ValidationResult.invalid(ex.getMessage());
    }
  }

  private void check(SpelNode node) throws ExpressionException {
    if (node instanceof Assign || node instanceof TypeReference || node instanceof ConstructorReference
        || node instanceof BeanReference || node instanceof FunctionReference || node instanceof OperatorInstanceof) {
      throw new ExpressionException("Unsupported construct '" + node.toStringAST() + "'", node.getStartPosition());
    }
    if (node instanceof VariableReference && !VARIABLES.contains(node.toStringAST())) {
      throw new ExpressionException("Unknown variable '" + node.toStringAST() + "'", node.getStartPosition());
    }
    if (node instanceof PropertyOrFieldReference property && !EvalContext.FIELDS.contains(property.getName())) {
      throw new ExpressionException("Unknown identifier '" + property.getName() + "'", node.getStartPosition());
    }
    if (node instanceof MethodReference method) {
      checkMethod(method);
    }
    if (node instanceof OperatorMatches && node.getChild(1) instanceof StringLiteral literal) {
      checkPattern(literal);
    }
    for (int i = 0; i < node.getChildCount(); i++) {
      check(node.getChild(i));
    }
  }

  private void checkMethod(MethodReference method) throws ExpressionException {
    String name = method.getName();
    if (!LineItemMethodResolver.METHOD_NAMES.contains(name)) {
      throw new ExpressionException("Unknown function '" + name + "'", method.getStartPosition());
    }
    if (AMOUNT_AGGREGATES.contains(name)
        && (method.getChildCount() != 1
            || !(method.getChild(0) instanceof PropertyOrFieldReference argument)
            || !"amount".equals(argument.getName()))) {
      throw new ExpressionException(name + "() only accepts 'amount'", method.getStartPosition());
    }
    if ("matches".equals(name) && method.getChildCount() == 1 && method.getChild(0) instanceof StringLiteral literal) {
      checkPattern(literal);
    }
  }

  private void checkPattern(StringLiteral literal) throws ExpressionException {
    Object pattern = literal.getLiteralValue().getValue();
    try {
      Pattern.compile(String.valueOf(pattern));
    } catch (PatternSyntaxException ex) {
      throw new ExpressionException("Invalid regular expression: " + ex.getDescription(), literal.getStartPosition());
    }
  }

  private static boolean yieldsBoolean(SpelNode node) {
    if (node instanceof OpAnd || node instanceof OpOr || node instanceof OperatorNot
        || node instanceof OpEQ || node instanceof OpNE || node instanceof OpLT || node instanceof OpLE
        || node instanceof OpGT || node instanceof OpGE || node instanceof OperatorMatches
        || node instanceof OperatorBetween || node instanceof BooleanLiteral) {
      return true;
    }
    if (node instanceof MethodReference method) {
      return BOOLEAN_METHODS.contains(method.getName());
    }
    if (node instanceof CompoundExpression) {
      return yieldsBoolean(node.getChild(node.getChildCount() - 1));
    }
    if (node instanceof Ternary) {
      return yieldsBoolean(node.getChild(1)) && yieldsBoolean(node.getChild(2));
    }
    return false;
  }
}
