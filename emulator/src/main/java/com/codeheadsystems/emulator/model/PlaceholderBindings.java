package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.exception.UnresolvedPlaceholderException;
import java.util.Map;
import org.immutables.value.Value;

/**
 * The expression attribute names ({@code #x}) and values ({@code :x}) supplied with a request.
 */
@Value.Immutable
public interface PlaceholderBindings {

  /**
   * Bindings with nothing bound.
   *
   * @return the placeholder bindings
   */
  static PlaceholderBindings empty() {
    return ImmutablePlaceholderBindings.builder().build();
  }

  /**
   * Names map, keyed by the placeholder including its '#'.
   *
   * @return the map
   */
  Map<String, String> names();

  /**
   * Values map, keyed by the placeholder including its ':'.
   *
   * @return the map
   */
  Map<String, AttributeValue> values();

  /**
   * Resolves a path element token. Tokens without a leading '#' are attribute names already.
   *
   * @param token the token
   * @return the attribute name
   * @throws UnresolvedPlaceholderException if the placeholder is not bound
   */
  default String resolveName(final String token) {
    if (!token.startsWith("#")) {
      return token;
    }
    final String name = names().get(token);
    if (name == null) {
      throw new UnresolvedPlaceholderException(token);
    }
    return name;
  }

  /**
   * Resolves a value placeholder.
   *
   * @param placeholder the placeholder including its ':'
   * @return the attribute value
   * @throws UnresolvedPlaceholderException if the placeholder is not bound
   */
  default AttributeValue resolveValue(final String placeholder) {
    final AttributeValue value = values().get(placeholder);
    if (value == null) {
      throw new UnresolvedPlaceholderException(placeholder);
    }
    return value;
  }
}
