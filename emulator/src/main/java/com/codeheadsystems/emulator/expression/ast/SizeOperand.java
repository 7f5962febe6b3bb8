package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code size(path)}: a number derived from the attribute at the path.
 */
@Value.Immutable
public interface SizeOperand extends Operand {

  static SizeOperand of(final Path path) {
    return ImmutableSizeOperand.of(path);
  }

  @Value.Parameter
  Path path();

  @Override
  default <T> T accept(final OperandVisitor<T> visitor) {
    return visitor.visitSize(this);
  }
}
