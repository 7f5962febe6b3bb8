package com.codeheadsystems.emulator.expression.ast;

/**
 * Something that evaluates to a value, or to nothing when the attribute is absent.
 */
public interface Operand {

  <T> T accept(OperandVisitor<T> visitor);
}
