package com.codeheadsystems.emulator.expression.ast;

/**
 * A parsed condition, key condition or filter expression.
 */
public interface Condition {

  /**
   * Accept t.
   *
   * @param <T>     the result type
   * @param visitor the visitor
   * @return the result
   */
  <T> T accept(ConditionVisitor<T> visitor);
}
