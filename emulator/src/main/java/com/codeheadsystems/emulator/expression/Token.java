package com.codeheadsystems.emulator.expression;

/**
 * A lexical token with its offset in the source text.
 */
public final class Token {

  /**
   * The token kinds.
   */
  public enum Type {
    NAME,
    NAME_PLACEHOLDER,
    VALUE_PLACEHOLDER,
    INTEGER,
    COMPARATOR,
    DOT,
    COMMA,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    PLUS,
    MINUS,
    END
  }

  private final Type type;
  private final String text;
  private final int position;

  /**
   * Instantiates a new Token.
   *
   * @param type     the type
   * @param text     the text
   * @param position the position
   */
  public Token(final Type type, final String text, final int position) {
    this.type = type;
    this.text = text;
    this.position = position;
  }

  public Type type() {
    return type;
  }

  public String text() {
    return text;
  }

  public int position() {
    return position;
  }

  /**
   * True for a NAME token spelling the keyword, ignoring case.
   *
   * @param keyword the keyword
   * @return the boolean
   */
  public boolean isKeyword(final String keyword) {
    return type == Type.NAME && text.equalsIgnoreCase(keyword);
  }

  @Override
  public String toString() {
    return type + "(" + text + ")@" + position;
  }
}
