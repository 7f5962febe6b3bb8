package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code operand BETWEEN low AND high}, inclusive on both ends.
 */
@Value.Immutable
public interface BetweenCondition extends Condition {

  /**
   * Of between condition.
   *
   * @param operand the operand
   * @param low     the low
   * @param high    the high
   * @return the between condition
   */
  static BetweenCondition of(final Operand operand, final Operand low, final Operand high) {
    return ImmutableBetweenCondition.of(operand, low, high);
  }

  @Value.Parameter
  Operand operand();

  @Value.Parameter
  Operand low();

  @Value.Parameter
  Operand high();

  @Override
  default <T> T accept(final ConditionVisitor<T> visitor) {
    return visitor.visitBetween(this);
  }
}
