package com.codeheadsystems.emulator.exception;

/**
 * Raised when creating a table whose name is already taken.
 */
public class TableAlreadyExistsException extends EmulatorException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public TableAlreadyExistsException(final String message) {
    super(message);
  }
}
