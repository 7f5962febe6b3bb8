package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * An attribute of the item, possibly nested.
 */
@Value.Immutable
public interface PathOperand extends Operand {

  static PathOperand of(final Path path) {
    return ImmutablePathOperand.of(path);
  }

  @Value.Parameter
  Path path();

  @Override
  default <T> T accept(final OperandVisitor<T> visitor) {
    return visitor.visitPath(this);
  }
}
