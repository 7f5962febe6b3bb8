package com.codeheadsystems.emulator.expression.ast;

/**
 * Visitor over the condition node types.
 *
 * @param <T> the result type
 */
public interface ConditionVisitor<T> {

  T visitAnd(AndCondition condition);

  T visitComparison(ComparisonCondition condition);

  T visitBetween(BetweenCondition condition);

  T visitFunction(FunctionCondition condition);
}
