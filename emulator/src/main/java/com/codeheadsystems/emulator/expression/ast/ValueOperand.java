package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * A value placeholder such as {@code :v}.
 */
@Value.Immutable
public interface ValueOperand extends Operand {

  static ValueOperand of(final String placeholder) {
    return ImmutableValueOperand.of(placeholder);
  }

  /**
   * The placeholder, including its leading ':'.
   *
   * @return the string
   */
  @Value.Parameter
  String placeholder();

  @Override
  default <T> T accept(final OperandVisitor<T> visitor) {
    return visitor.visitValue(this);
  }
}
