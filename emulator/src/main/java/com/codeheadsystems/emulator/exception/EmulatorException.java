package com.codeheadsystems.emulator.exception;

/**
 * Base type of every error raised by the emulator core.
 */
public class EmulatorException extends RuntimeException {

  /**
   * Instantiates a new Emulator exception.
   *
   * @param message the message
   */
  public EmulatorException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Emulator exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EmulatorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
