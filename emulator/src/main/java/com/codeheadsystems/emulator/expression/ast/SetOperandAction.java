package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code path :value} inside an ADD or DELETE clause.
 */
@Value.Immutable
public interface SetOperandAction {

  static SetOperandAction of(final Path path, final ValueOperand value) {
    return ImmutableSetOperandAction.of(path, value);
  }

  @Value.Parameter
  Path path();

  @Value.Parameter
  ValueOperand value();
}
