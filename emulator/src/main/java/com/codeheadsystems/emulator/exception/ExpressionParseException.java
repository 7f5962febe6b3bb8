package com.codeheadsystems.emulator.exception;

/**
 * Raised when expression text does not match the grammar.
 */
public class ExpressionParseException extends EmulatorException {

  private final String fragment;
  private final int position;

  /**
   * Instantiates a new Expression parse exception.
   *
   * @param reason   what was wrong
   * @param fragment the offending piece of the expression
   * @param position zero based character offset of the fragment
   */
  public ExpressionParseException(final String reason, final String fragment, final int position) {
    super(String.format("Invalid expression: %s; token: \"%s\", near position %d", reason, fragment, position));
    this.fragment = fragment;
    this.position = position;
  }

  /**
   * Gets fragment.
   *
   * @return the fragment
   */
  public String getFragment() {
    return fragment;
  }

  /**
   * Gets position.
   *
   * @return the position
   */
  public int getPosition() {
    return position;
  }
}
