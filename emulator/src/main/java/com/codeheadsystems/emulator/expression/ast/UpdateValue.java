package com.codeheadsystems.emulator.expression.ast;

/**
 * Right hand side of a SET action.
 */
public interface UpdateValue {

  <T> T accept(UpdateValueVisitor<T> visitor);
}
