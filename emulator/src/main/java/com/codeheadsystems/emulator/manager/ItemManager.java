package com.codeheadsystems.emulator.manager;

import com.codeheadsystems.emulator.exception.ConditionalCheckFailedException;
import com.codeheadsystems.emulator.exception.TableNotFoundException;
import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ConditionEvaluator;
import com.codeheadsystems.emulator.expression.Projector;
import com.codeheadsystems.emulator.expression.UpdateEvaluator;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.UpdateExpression;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.DeleteItemCommand;
import com.codeheadsystems.emulator.model.GetItemCommand;
import com.codeheadsystems.emulator.model.ImmutableWriteResult;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.PutItemCommand;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.TableStatus;
import com.codeheadsystems.emulator.model.UpdateItemCommand;
import com.codeheadsystems.emulator.model.WriteResult;
import com.codeheadsystems.emulator.store.ItemStore;
import com.codeheadsystems.emulator.store.Table;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single item reads and writes.
 *
 * <p>Every write holds the table's exclusive lock from reading the existing item, through the
 * condition check, to storing the result. Two conditional writes on one key can therefore never
 * both pass.
 */
@Singleton
public class ItemManager {

  private static final Logger log = LoggerFactory.getLogger(ItemManager.class);

  private final TableManager tableManager;
  private final ItemValidator itemValidator;
  private final ConditionEvaluator conditionEvaluator;
  private final UpdateEvaluator updateEvaluator;
  private final Projector projector;

  /**
   * Instantiates a new Item manager.
   *
   * @param tableManager       the table manager
   * @param itemValidator      the item validator
   * @param conditionEvaluator the condition evaluator
   * @param updateEvaluator    the update evaluator
   * @param projector          the projector
   */
  @Inject
  public ItemManager(final TableManager tableManager,
                     final ItemValidator itemValidator,
                     final ConditionEvaluator conditionEvaluator,
                     final UpdateEvaluator updateEvaluator,
                     final Projector projector) {
    log.info("ItemManager({}, {}, {}, {}, {})", tableManager, itemValidator, conditionEvaluator, updateEvaluator, projector);
    this.tableManager = tableManager;
    this.itemValidator = itemValidator;
    this.conditionEvaluator = conditionEvaluator;
    this.updateEvaluator = updateEvaluator;
    this.projector = projector;
  }

  /**
   * Put item.
   *
   * @param command the command
   * @return the previous item as the old image, the stored item as the new one
   * @throws ConditionalCheckFailedException if the condition is false for the existing item
   */
  public WriteResult putItem(final PutItemCommand command) {
    log.trace("putItem({})", command);
    final Table table = tableManager.getTable(command.tableName());
    itemValidator.validateItem(table.schema(), command.item());
    final ItemStore store = table.itemStore();
    return store.write(() -> {
      ensureLive(table);
      final Optional<Map<String, AttributeValue>> existing = store.get(store.keyOf(command.item()));
      command.condition().ifPresent(condition ->
          checkCondition(condition, existing, command.bindings(), command.tableName()));
      final Optional<Map<String, AttributeValue>> previous = store.put(command.item());
      return ImmutableWriteResult.builder().oldItem(previous).newItem(command.item()).build();
    });
  }

  /**
   * Get item.
   *
   * @param command the command
   * @return the item, projected when asked, or empty
   */
  public Optional<Map<String, AttributeValue>> getItem(final GetItemCommand command) {
    log.trace("getItem({})", command);
    final Table table = tableManager.getTable(command.tableName());
    itemValidator.validateKey(table.schema(), command.key());
    final ItemStore store = table.itemStore();
    final Optional<Map<String, AttributeValue>> item = store.read(() -> store.get(store.keyOf(command.key())));
    return command.projection()
        .map(projection -> item.map(found -> projector.project(found, projection, command.bindings())))
        .orElse(item);
  }

  /**
   * Delete item. Deleting a missing item succeeds.
   *
   * @param command the command
   * @return the removed item as the old image
   * @throws ConditionalCheckFailedException if the condition is false for the existing item
   */
  public WriteResult deleteItem(final DeleteItemCommand command) {
    log.trace("deleteItem({})", command);
    final Table table = tableManager.getTable(command.tableName());
    itemValidator.validateKey(table.schema(), command.key());
    final ItemStore store = table.itemStore();
    return store.write(() -> {
      ensureLive(table);
      final Optional<Map<String, AttributeValue>> existing = store.get(store.keyOf(command.key()));
      command.condition().ifPresent(condition ->
          checkCondition(condition, existing, command.bindings(), command.tableName()));
      final Optional<Map<String, AttributeValue>> removed = store.delete(store.keyOf(command.key()));
      return ImmutableWriteResult.builder().oldItem(removed).build();
    });
  }

  /**
   * Update item, creating it from the key when it does not exist.
   *
   * @param command the command
   * @return the item before and after
   * @throws ValidationException             if the update targets a key attribute or is invalid for the item
   * @throws ConditionalCheckFailedException if the condition is false for the existing item
   */
  public WriteResult updateItem(final UpdateItemCommand command) {
    log.trace("updateItem({})", command);
    final Table table = tableManager.getTable(command.tableName());
    final TableSchema schema = table.schema();
    itemValidator.validateKey(schema, command.key());
    command.update().ifPresent(update -> checkKeyNotTargeted(update, schema, command.bindings()));
    final ItemStore store = table.itemStore();
    return store.write(() -> {
      ensureLive(table);
      final Optional<Map<String, AttributeValue>> existing = store.get(store.keyOf(command.key()));
      command.condition().ifPresent(condition ->
          checkCondition(condition, existing, command.bindings(), command.tableName()));
      final Map<String, AttributeValue> base = existing.orElse(command.key());
      final Map<String, AttributeValue> updated = command.update()
          .map(update -> updateEvaluator.apply(update, base, command.bindings()))
          .orElse(base);
      itemValidator.validateItem(schema, updated);
      store.put(updated);
      return ImmutableWriteResult.builder().oldItem(existing).newItem(updated).build();
    });
  }

  private void checkKeyNotTargeted(final UpdateExpression update,
                                   final TableSchema schema,
                                   final PlaceholderBindings bindings) {
    for (Path path : update.targetPaths()) {
      final String attribute = bindings.resolveName(path.head().name().orElseThrow());
      if (schema.keyNames().contains(attribute)) {
        log.warn("Rejected update of key attribute {} in {}", attribute, schema.tableName());
        throw new ValidationException("One or more parameter values were invalid: Cannot update attribute "
            + attribute + ". This attribute is part of the key");
      }
    }
  }

  private void checkCondition(final Condition condition,
                              final Optional<Map<String, AttributeValue>> existing,
                              final PlaceholderBindings bindings,
                              final String tableName) {
    if (!conditionEvaluator.evaluate(condition, existing.orElse(Map.of()), bindings)) {
      log.debug("Condition failed on {}: {}", tableName, condition);
      throw new ConditionalCheckFailedException("The conditional request failed");
    }
  }

  private void ensureLive(final Table table) {
    if (table.status() == TableStatus.DELETING) {
      throw new TableNotFoundException("Requested resource not found: Table: " + table.name() + " not found");
    }
  }
}
