package com.codeheadsystems.emulator.exception;

/**
 * Raised when a request violates the table schema or the documented limits of the API.
 */
public class ValidationException extends EmulatorException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public ValidationException(final String message) {
    super(message);
  }
}
