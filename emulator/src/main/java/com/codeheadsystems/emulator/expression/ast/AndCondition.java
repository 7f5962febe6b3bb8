package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * Both sides must hold. Evaluated left to right.
 */
@Value.Immutable
public interface AndCondition extends Condition {

  /**
   * Of and condition.
   *
   * @param left  the left
   * @param right the right
   * @return the and condition
   */
  static AndCondition of(final Condition left, final Condition right) {
    return ImmutableAndCondition.of(left, right);
  }

  @Value.Parameter
  Condition left();

  @Value.Parameter
  Condition right();

  @Override
  default <T> T accept(final ConditionVisitor<T> visitor) {
    return visitor.visitAnd(this);
  }
}
