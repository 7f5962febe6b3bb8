package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Read one item by its full primary key.
 */
@Value.Immutable
public interface GetItemCommand {

  String tableName();

  Map<String, AttributeValue> key();

  Optional<ProjectionExpression> projection();

  @Value.Default
  default PlaceholderBindings bindings() {
    return PlaceholderBindings.empty();
  }
}
