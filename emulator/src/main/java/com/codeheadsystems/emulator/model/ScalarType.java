package com.codeheadsystems.emulator.model;

/**
 * The attribute types a key attribute may have.
 */
public enum ScalarType {
  S(AttributeValue.Type.S),
  N(AttributeValue.Type.N),
  B(AttributeValue.Type.B);

  private final AttributeValue.Type valueType;

  ScalarType(final AttributeValue.Type valueType) {
    this.valueType = valueType;
  }

  /**
   * True if the value is of this type.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean matches(final AttributeValue value) {
    return value.type() == valueType;
  }
}
