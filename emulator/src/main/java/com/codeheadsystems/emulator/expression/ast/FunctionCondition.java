package com.codeheadsystems.emulator.expression.ast;

import java.util.List;
import org.immutables.value.Value;

/**
 * A boolean function call such as {@code attribute_exists(#a)}.
 */
@Value.Immutable
public interface FunctionCondition extends Condition {

  /**
   * Of function condition.
   *
   * @param function  the function
   * @param arguments the arguments
   * @return the function condition
   */
  static FunctionCondition of(final ConditionFunction function, final List<Operand> arguments) {
    return ImmutableFunctionCondition.of(function, arguments);
  }

  @Value.Parameter
  ConditionFunction function();

  @Value.Parameter
  List<Operand> arguments();

  @Override
  default <T> T accept(final ConditionVisitor<T> visitor) {
    return visitor.visitFunction(this);
  }
}
