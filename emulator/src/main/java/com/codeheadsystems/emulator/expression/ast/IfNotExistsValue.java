package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code if_not_exists(path, fallback)}.
 */
@Value.Immutable
public interface IfNotExistsValue extends UpdateValue {

  static IfNotExistsValue of(final Path path, final UpdateValue fallback) {
    return ImmutableIfNotExistsValue.of(path, fallback);
  }

  @Value.Parameter
  Path path();

  @Value.Parameter
  UpdateValue fallback();

  @Override
  default <T> T accept(final UpdateValueVisitor<T> visitor) {
    return visitor.visitIfNotExists(this);
  }
}
