package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.expression.ast.Operand;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathElement;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Position within a token list, plus the productions every expression grammar shares: paths and
 * operands.
 */
class ExpressionCursor {

  static final Set<String> KEYWORDS = Set.of(
      "AND", "OR", "NOT", "BETWEEN", "IN", "SET", "REMOVE", "ADD", "DELETE");

  private final List<Token> tokens;
  private int index;

  ExpressionCursor(final List<Token> tokens) {
    this.tokens = tokens;
    this.index = 0;
  }

  Token peek() {
    return tokens.get(index);
  }

  Token peek(final int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  Token next() {
    final Token token = tokens.get(index);
    if (token.type() != Token.Type.END) {
      index++;
    }
    return token;
  }

  boolean atEnd() {
    return peek().type() == Token.Type.END;
  }

  boolean accept(final Token.Type type) {
    if (peek().type() == type) {
      next();
      return true;
    }
    return false;
  }

  boolean acceptKeyword(final String keyword) {
    if (peek().isKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  Token expect(final Token.Type type, final String what) {
    if (peek().type() != type) {
      throw error("expected " + what);
    }
    return next();
  }

  void expectKeyword(final String keyword) {
    if (!acceptKeyword(keyword)) {
      throw error("expected " + keyword);
    }
  }

  void expectEnd() {
    if (!atEnd()) {
      throw error("unexpected token");
    }
  }

  ExpressionParseException error(final String reason) {
    return error(reason, peek());
  }

  ExpressionParseException error(final String reason, final Token token) {
    final String fragment = token.type() == Token.Type.END ? "<end of expression>" : token.text();
    return new ExpressionParseException(reason, fragment, token.position());
  }

  /**
   * path = element ( "." element | "[" digits "]" )*.
   */
  Path path() {
    final List<PathElement> elements = new ArrayList<>();
    elements.add(element());
    while (true) {
      if (accept(Token.Type.DOT)) {
        elements.add(element());
      } else if (accept(Token.Type.LEFT_BRACKET)) {
        final Token digits = expect(Token.Type.INTEGER, "a list index");
        final int listIndex;
        try {
          listIndex = Integer.parseInt(digits.text());
        } catch (NumberFormatException e) {
          throw error("list index out of range", digits);
        }
        expect(Token.Type.RIGHT_BRACKET, "]");
        elements.add(PathElement.indexed(listIndex));
      } else {
        return Path.of(elements);
      }
    }
  }

  /**
   * operand = path | ":" ident | "size" "(" path ")".
   */
  Operand operand() {
    final Token token = peek();
    switch (token.type()) {
      case VALUE_PLACEHOLDER:
        next();
        return ValueOperand.of(token.text());
      case NAME_PLACEHOLDER:
        return PathOperand.of(path());
      case NAME:
        if (token.text().equals("size") && peek(1).type() == Token.Type.LEFT_PAREN) {
          next();
          next();
          final Path path = path();
          expect(Token.Type.RIGHT_PAREN, ")");
          return SizeOperand.of(path);
        }
        return PathOperand.of(path());
      case LEFT_PAREN:
        throw error("parentheses are not supported");
      default:
        throw error("expected an operand");
    }
  }

  private PathElement element() {
    final Token token = peek();
    if (token.type() == Token.Type.NAME_PLACEHOLDER) {
      return PathElement.named(next().text());
    }
    if (token.type() == Token.Type.NAME) {
      if (KEYWORDS.contains(token.text().toUpperCase())) {
        throw error(token.text().toUpperCase() + " is not supported here");
      }
      return PathElement.named(next().text());
    }
    throw error("expected an attribute name");
  }
}
