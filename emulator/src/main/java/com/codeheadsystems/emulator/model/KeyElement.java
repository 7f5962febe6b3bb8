package com.codeheadsystems.emulator.model;

import org.immutables.value.Value;

/**
 * One entry of a key schema.
 */
@Value.Immutable
public interface KeyElement {

  /**
   * Of key element.
   *
   * @param attributeName the attribute name
   * @param keyRole       the key role
   * @return the key element
   */
  static KeyElement of(final String attributeName, final KeyRole keyRole) {
    return ImmutableKeyElement.builder().attributeName(attributeName).keyRole(keyRole).build();
  }

  /**
   * Attribute name string.
   *
   * @return the string
   */
  String attributeName();

  /**
   * Key role.
   *
   * @return the key role
   */
  KeyRole keyRole();
}
