package com.codeheadsystems.emulator.expression.ast;

/**
 * Visitor over SET value forms.
 *
 * @param <T> the result type
 */
public interface UpdateValueVisitor<T> {

  T visitOperand(OperandValue value);

  T visitArithmetic(ArithmeticValue value);

  T visitIfNotExists(IfNotExistsValue value);

  T visitListAppend(ListAppendValue value);
}
