package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Read a contiguous range of one partition.
 */
@Value.Immutable
public interface QueryCommand {

  String tableName();

  Condition keyCondition();

  Optional<Condition> filter();

  Optional<ProjectionExpression> projection();

  @Value.Default
  default PlaceholderBindings bindings() {
    return PlaceholderBindings.empty();
  }

  /**
   * Ascending sort key order when true.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean scanForward() {
    return true;
  }

  /**
   * Maximum number of items to evaluate, before the filter.
   *
   * @return the optional
   */
  Optional<Integer> limit();

  Optional<Map<String, AttributeValue>> exclusiveStartKey();

  @Value.Default
  default Select select() {
    return Select.ALL_ATTRIBUTES;
  }
}
