package com.codeheadsystems.emulator.expression.ast;

/**
 * Visitor over the operand types.
 *
 * @param <T> the result type
 */
public interface OperandVisitor<T> {

  T visitPath(PathOperand operand);

  T visitValue(ValueOperand operand);

  T visitSize(SizeOperand operand);
}
