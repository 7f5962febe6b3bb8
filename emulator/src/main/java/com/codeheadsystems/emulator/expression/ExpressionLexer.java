package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Splits expression text into tokens. Keywords and function names come out as NAME tokens; the
 * parsers decide what they mean.
 */
@Singleton
public class ExpressionLexer {

  /**
   * Instantiates a new Expression lexer.
   */
  @Inject
  public ExpressionLexer() {
  }

  /**
   * Tokenize list. The last token is always END.
   *
   * @param text the expression text
   * @return the list
   * @throws ExpressionParseException on a character outside the expression alphabet
   */
  public List<Token> tokenize(final String text) {
    final List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '#' || c == ':') {
        final int end = wordEnd(text, i + 1);
        if (end == i + 1) {
          throw new ExpressionParseException("placeholder name missing", String.valueOf(c), i);
        }
        tokens.add(new Token(c == '#' ? Token.Type.NAME_PLACEHOLDER : Token.Type.VALUE_PLACEHOLDER,
            text.substring(i, end), i));
        i = end;
      } else if (Character.isLetter(c) || c == '_') {
        final int end = wordEnd(text, i);
        tokens.add(new Token(Token.Type.NAME, text.substring(i, end), i));
        i = end;
      } else if (Character.isDigit(c)) {
        int end = i;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
          end++;
        }
        tokens.add(new Token(Token.Type.INTEGER, text.substring(i, end), i));
        i = end;
      } else if (c == '<' || c == '>') {
        final boolean twoChars = i + 1 < text.length()
            && (text.charAt(i + 1) == '=' || (c == '<' && text.charAt(i + 1) == '>'));
        final int end = twoChars ? i + 2 : i + 1;
        tokens.add(new Token(Token.Type.COMPARATOR, text.substring(i, end), i));
        i = end;
      } else {
        tokens.add(new Token(single(c, i), String.valueOf(c), i));
        i++;
      }
    }
    tokens.add(new Token(Token.Type.END, "", text.length()));
    return tokens;
  }

  private Token.Type single(final char c, final int position) {
    return switch (c) {
      case '=' -> Token.Type.COMPARATOR;
      case '.' -> Token.Type.DOT;
      case ',' -> Token.Type.COMMA;
      case '(' -> Token.Type.LEFT_PAREN;
      case ')' -> Token.Type.RIGHT_PAREN;
      case '[' -> Token.Type.LEFT_BRACKET;
      case ']' -> Token.Type.RIGHT_BRACKET;
      case '+' -> Token.Type.PLUS;
      case '-' -> Token.Type.MINUS;
      default -> throw new ExpressionParseException("unexpected character", String.valueOf(c), position);
    };
  }

  private int wordEnd(final String text, final int start) {
    int end = start;
    while (end < text.length()
        && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
      end++;
    }
    return end;
  }
}
