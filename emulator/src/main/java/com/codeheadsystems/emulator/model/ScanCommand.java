package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Read every item of a table, or of one segment of it.
 */
@Value.Immutable
public interface ScanCommand {

  String tableName();

  Optional<Condition> filter();

  Optional<ProjectionExpression> projection();

  @Value.Default
  default PlaceholderBindings bindings() {
    return PlaceholderBindings.empty();
  }

  /**
   * Maximum number of items to evaluate, before the filter.
   *
   * @return the optional
   */
  Optional<Integer> limit();

  Optional<Map<String, AttributeValue>> exclusiveStartKey();

  Optional<Integer> segment();

  Optional<Integer> totalSegments();

  @Value.Default
  default Select select() {
    return Select.ALL_ATTRIBUTES;
  }
}
