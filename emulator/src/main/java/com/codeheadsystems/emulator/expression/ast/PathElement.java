package com.codeheadsystems.emulator.expression.ast;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * One step of a document path: a map key (name or {@code #placeholder}) or a list index.
 */
@Value.Immutable
public interface PathElement {

  static PathElement named(final String name) {
    return ImmutablePathElement.builder().name(name).build();
  }

  static PathElement indexed(final int index) {
    return ImmutablePathElement.builder().index(index).build();
  }

  Optional<String> name();

  Optional<Integer> index();

  /**
   * Exactly one of name and index is set.
   */
  @Value.Check
  default void check() {
    if (name().isPresent() == index().isPresent()) {
      throw new IllegalStateException("A path element is either a name or an index");
    }
  }

  /**
   * Is index boolean.
   *
   * @return the boolean
   */
  default boolean isIndex() {
    return index().isPresent();
  }

  /**
   * The element as written in an expression.
   *
   * @return the string
   */
  default String text() {
    return name().orElseGet(() -> "[" + index().orElseThrow() + "]");
  }
}
