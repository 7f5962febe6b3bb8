package com.codeheadsystems.emulator.manager;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.AttributeDefinition;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.util.ItemSizeCalculator;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks items and keys against a table schema. Attribute values validate themselves on
 * construction, so only the key attributes and the overall size are checked here.
 */
@Singleton
public class ItemValidator {

  private static final Logger log = LoggerFactory.getLogger(ItemValidator.class);

  private final Configuration configuration;
  private final ItemSizeCalculator itemSizeCalculator;

  /**
   * Instantiates a new Item validator.
   *
   * @param configuration      the configuration
   * @param itemSizeCalculator the item size calculator
   */
  @Inject
  public ItemValidator(final Configuration configuration, final ItemSizeCalculator itemSizeCalculator) {
    log.info("ItemValidator({}, {})", configuration, itemSizeCalculator);
    this.configuration = configuration;
    this.itemSizeCalculator = itemSizeCalculator;
  }

  /**
   * Validate a whole item.
   *
   * @param schema the schema
   * @param item   the item
   * @throws ValidationException if a key attribute is missing, mistyped or empty, or the item is too large
   */
  public void validateItem(final TableSchema schema, final Map<String, AttributeValue> item) {
    for (AttributeDefinition key : keys(schema)) {
      final AttributeValue value = item.get(key.attributeName());
      if (value == null) {
        throw invalid("One or more parameter values were invalid: Missing the key "
            + key.attributeName() + " in the item");
      }
      checkKeyValue(key, value);
    }
    if (itemSizeCalculator.sizeOf(item) > configuration.maxItemSizeBytes()) {
      throw invalid("Item size has exceeded the maximum allowed size");
    }
  }

  /**
   * Validate a key map: exactly the key attributes, with the schema types.
   *
   * @param schema the schema
   * @param key    the key
   */
  public void validateKey(final TableSchema schema, final Map<String, AttributeValue> key) {
    checkKey(schema, key, "The provided key element does not match the schema");
  }

  /**
   * Validate a pagination start key.
   *
   * @param schema the schema
   * @param key    the key
   */
  public void validateExclusiveStartKey(final TableSchema schema, final Map<String, AttributeValue> key) {
    checkKey(schema, key, "The provided starting key is invalid: The provided key element does not match the schema");
  }

  private void checkKey(final TableSchema schema, final Map<String, AttributeValue> key, final String mismatch) {
    if (key.size() != schema.keyNames().size() || !key.keySet().containsAll(schema.keyNames())) {
      throw invalid(mismatch);
    }
    for (AttributeDefinition definition : keys(schema)) {
      final AttributeValue value = key.get(definition.attributeName());
      if (!definition.attributeType().matches(value)) {
        throw invalid(mismatch);
      }
      checkKeyValue(definition, value);
    }
  }

  private void checkKeyValue(final AttributeDefinition key, final AttributeValue value) {
    if (!key.attributeType().matches(value)) {
      throw invalid("One or more parameter values were invalid: Type mismatch for key "
          + key.attributeName() + " expected: " + key.attributeType() + " actual: " + value.type());
    }
    final boolean empty = (value.type() == AttributeValue.Type.S && value.s().isEmpty())
        || (value.type() == AttributeValue.Type.B && value.b().asByteArray().length == 0);
    if (empty) {
      throw invalid("One or more parameter values are not valid. The AttributeValue for a key attribute "
          + "cannot contain an empty string value. Key: " + key.attributeName());
    }
  }

  private List<AttributeDefinition> keys(final TableSchema schema) {
    return schema.sortKey()
        .map(sort -> List.of(schema.partitionKey(), sort))
        .orElseGet(() -> List.of(schema.partitionKey()));
  }

  private ValidationException invalid(final String message) {
    log.warn("Rejected item: {}", message);
    return new ValidationException(message);
  }
}
