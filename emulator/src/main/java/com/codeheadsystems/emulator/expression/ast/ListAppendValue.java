package com.codeheadsystems.emulator.expression.ast;

import org.immutables.value.Value;

/**
 * {@code list_append(first, second)}.
 */
@Value.Immutable
public interface ListAppendValue extends UpdateValue {

  static ListAppendValue of(final UpdateValue first, final UpdateValue second) {
    return ImmutableListAppendValue.of(first, second);
  }

  @Value.Parameter
  UpdateValue first();

  @Value.Parameter
  UpdateValue second();

  @Override
  default <T> T accept(final UpdateValueVisitor<T> visitor) {
    return visitor.visitListAppend(this);
  }
}
