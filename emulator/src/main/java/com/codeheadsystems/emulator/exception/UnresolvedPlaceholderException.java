package com.codeheadsystems.emulator.exception;

/**
 * Raised when an expression references a placeholder that has no binding.
 */
public class UnresolvedPlaceholderException extends EmulatorException {

  private final String placeholder;

  /**
   * Instantiates a new Unresolved placeholder exception.
   *
   * @param placeholder the placeholder token, including its leading '#' or ':'
   */
  public UnresolvedPlaceholderException(final String placeholder) {
    super(placeholder.startsWith("#")
        ? "An expression attribute name used in the document path is not defined; attribute name: " + placeholder
        : "An expression attribute value used in expression is not defined; attribute value: " + placeholder);
    this.placeholder = placeholder;
  }

  /**
   * The unbound placeholder.
   *
   * @return the placeholder
   */
  public String getPlaceholder() {
    return placeholder;
  }
}
