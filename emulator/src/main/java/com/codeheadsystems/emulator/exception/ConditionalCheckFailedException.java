package com.codeheadsystems.emulator.exception;

/**
 * Raised when a condition expression evaluates to false; storage is left untouched.
 */
public class ConditionalCheckFailedException extends EmulatorException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public ConditionalCheckFailedException(final String message) {
    super(message);
  }
}
