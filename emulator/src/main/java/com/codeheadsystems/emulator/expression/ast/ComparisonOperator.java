package com.codeheadsystems.emulator.expression.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * The comparators of the expression language.
 */
public enum ComparisonOperator {
  EQ("="),
  NE("<>"),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String symbol;

  ComparisonOperator(final String symbol) {
    this.symbol = symbol;
  }

  /**
   * Finds the operator written as the given symbol.
   *
   * @param symbol the symbol
   * @return the optional
   */
  public static Optional<ComparisonOperator> fromSymbol(final String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
  }

  /**
   * Symbol string.
   *
   * @return the string
   */
  public String symbol() {
    return symbol;
  }
}
