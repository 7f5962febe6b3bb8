package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.UpdateExpression;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Modify one item in place, creating it from the key when absent.
 */
@Value.Immutable
public interface UpdateItemCommand {

  String tableName();

  Map<String, AttributeValue> key();

  /**
   * The update. Without one, the item is created from the key if missing and otherwise left alone.
   *
   * @return the optional
   */
  Optional<UpdateExpression> update();

  Optional<Condition> condition();

  @Value.Default
  default PlaceholderBindings bindings() {
    return PlaceholderBindings.empty();
  }
}
