package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code path = value} inside a SET clause.
 */
@Value.Immutable
public interface SetAction {

  static SetAction of(final Path path, final UpdateValue value) {
    return ImmutableSetAction.of(path, value);
  }

  @Value.Parameter
  Path path();

  @Value.Parameter
  UpdateValue value();
}
