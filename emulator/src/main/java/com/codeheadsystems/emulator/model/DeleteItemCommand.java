package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.expression.ast.Condition;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Remove one item, optionally only when a condition holds.
 */
@Value.Immutable
public interface DeleteItemCommand {

  String tableName();

  Map<String, AttributeValue> key();

  Optional<Condition> condition();

  @Value.Default
  default PlaceholderBindings bindings() {
    return PlaceholderBindings.empty();
  }
}
