package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code operand comparator operand}.
 */
@Value.Immutable
public interface ComparisonCondition extends Condition {

  /**
   * Of comparison condition.
   *
   * @param left     the left
   * @param operator the operator
   * @param right    the right
   * @return the comparison condition
   */
  static ComparisonCondition of(final Operand left, final ComparisonOperator operator, final Operand right) {
    return ImmutableComparisonCondition.of(left, operator, right);
  }

  @Value.Parameter
  Operand left();

  @Value.Parameter
  ComparisonOperator operator();

  @Value.Parameter
  Operand right();

  @Override
  default <T> T accept(final ConditionVisitor<T> visitor) {
    return visitor.visitComparison(this);
  }
}
