package com.codeheadsystems.emulator.exception;

/**
 * Raised when the named table does not exist.
 */
public class TableNotFoundException extends EmulatorException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public TableNotFoundException(final String message) {
    super(message);
  }
}
