package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * A plain path or value placeholder on the right of SET.
 */
@Value.Immutable
public interface OperandValue extends UpdateValue {

  static OperandValue of(final Operand operand) {
    return ImmutableOperandValue.of(operand);
  }

  @Value.Parameter
  Operand operand();

  @Override
  default <T> T accept(final UpdateValueVisitor<T> visitor) {
    return visitor.visitOperand(this);
  }
}
