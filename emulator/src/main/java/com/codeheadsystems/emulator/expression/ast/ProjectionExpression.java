package com.codeheadsystems.emulator.expression.ast;

import java.util.List;
import org.immutables.value.Value;

/**
 * The attribute paths a read should return.
 */
@Value.Immutable
public interface ProjectionExpression {

  static ProjectionExpression of(final List<Path> paths) {
    return ImmutableProjectionExpression.of(paths);
  }

  @Value.Parameter
  List<Path> paths();
}
