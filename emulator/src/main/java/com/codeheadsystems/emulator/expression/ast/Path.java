package com.codeheadsystems.emulator.expression.ast;

import java.util.List;
import java.util.stream.Collectors;
import org.immutables.value.Value;

/**
 * A document path. The first element is always a name.
 */
@Value.Immutable
public interface Path {

  /**
   * Of path.
   *
   * @param elements the elements
   * @return the path
   */
  static Path of(final List<PathElement> elements) {
    return ImmutablePath.of(elements);
  }

  /**
   * Single top level attribute.
   *
   * @param name the name or name placeholder
   * @return the path
   */
  static Path of(final String name) {
    return of(List.of(PathElement.named(name)));
  }

  @Value.Parameter
  List<PathElement> elements();

  /**
   * The top level element.
   *
   * @return the path element
   */
  default PathElement head() {
    return elements().get(0);
  }

  /**
   * The path as written in an expression.
   *
   * @return the string
   */
  default String text() {
    return elements().stream()
        .map(element -> element.isIndex() ? element.text() : "." + element.text())
        .collect(Collectors.joining())
        .substring(1);
  }
}
