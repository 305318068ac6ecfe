package com.eventledger.expression;

import org.springframework.expression.spel.standard.SpelExpression;

/** A checked expression ready for evaluation. Immutable and safe to share between threads. */
public record CompiledExpression(String source, SpelExpression expression) {}
