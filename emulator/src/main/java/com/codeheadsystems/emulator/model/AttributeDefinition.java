package com.codeheadsystems.emulator.model;

import org.immutables.value.Value;

/**
 * A declared attribute and its scalar type.
 */
@Value.Immutable
public interface AttributeDefinition {

  /**
   * Of attribute definition.
   *
   * @param attributeName the attribute name
   * @param attributeType the attribute type
   * @return the attribute definition
   */
  static AttributeDefinition of(final String attributeName, final ScalarType attributeType) {
    return ImmutableAttributeDefinition.builder().attributeName(attributeName).attributeType(attributeType).build();
  }

  /**
   * Attribute name string.
   *
   * @return the string
   */
  String attributeName();

  /**
   * Attribute type.
   *
   * @return the scalar type
   */
  ScalarType attributeType();
}
