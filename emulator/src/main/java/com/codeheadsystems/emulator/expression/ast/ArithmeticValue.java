package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code term + term} or {@code term - term}; both sides must be numbers.
 */
@Value.Immutable
public interface ArithmeticValue extends UpdateValue {

  /**
   * The arithmetic operators SET allows.
   */
  enum Operator {
    PLUS, MINUS
  }

  static ArithmeticValue of(final UpdateValue left, final Operator operator, final UpdateValue right) {
    return ImmutableArithmeticValue.of(left, operator, right);
  }

  @Value.Parameter
  UpdateValue left();

  @Value.Parameter
  Operator operator();

  @Value.Parameter
  UpdateValue right();

  @Override
  default <T> T accept(final UpdateValueVisitor<T> visitor) {
    return visitor.visitArithmetic(this);
  }
}
