package com.codeheadsystems.emulator.expression.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * The boolean functions usable as a whole condition. Names are case sensitive.
 */
public enum ConditionFunction {
  ATTRIBUTE_EXISTS("attribute_exists", 1),
  ATTRIBUTE_NOT_EXISTS("attribute_not_exists", 1),
  ATTRIBUTE_TYPE("attribute_type", 2),
  BEGINS_WITH("begins_with", 2),
  CONTAINS("contains", 2);

  private final String functionName;
  private final int arity;

  ConditionFunction(final String functionName, final int arity) {
    this.functionName = functionName;
    this.arity = arity;
  }

  /**
   * Finds the function with the given name.
   *
   * @param functionName the function name
   * @return the optional
   */
  public static Optional<ConditionFunction> fromName(final String functionName) {
    return Arrays.stream(values()).filter(f -> f.functionName.equals(functionName)).findFirst();
  }

  /**
   * Function name as written in expressions.
   *
   * @return the string
   */
  public String functionName() {
    return functionName;
  }

  /**
   * Number of operands the function takes.
   *
   * @return the int
   */
  public int arity() {
    return arity;
  }
}
