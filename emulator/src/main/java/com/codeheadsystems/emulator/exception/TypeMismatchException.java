package com.codeheadsystems.emulator.exception;

/**
 * Raised for operand types the API rejects outright, such as an unknown attribute_type tag.
 */
public class TypeMismatchException extends EmulatorException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public TypeMismatchException(final String message) {
    super(message);
  }
}
