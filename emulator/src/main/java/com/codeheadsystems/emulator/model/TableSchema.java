package com.codeheadsystems.emulator.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * What a table was created with. The key accessors assume the schema passed validation in the
 * table manager.
 */
@Value.Immutable
public interface TableSchema {

  /**
   * Table name string.
   *
   * @return the string
   */
  String tableName();

  /**
   * Key schema list.
   *
   * @return the list
   */
  List<KeyElement> keySchema();

  /**
   * Attribute definitions list.
   *
   * @return the list
   */
  List<AttributeDefinition> attributeDefinitions();

  /**
   * Billing mode.
   *
   * @return the billing mode
   */
  @Value.Default
  default BillingMode billingMode() {
    return BillingMode.PROVISIONED;
  }

  /**
   * Read capacity units, when given on creation.
   *
   * @return the optional
   */
  Optional<Long> readCapacityUnits();

  /**
   * Write capacity units, when given on creation.
   *
   * @return the optional
   */
  Optional<Long> writeCapacityUnits();

  /**
   * The partition key definition.
   *
   * @return the attribute definition
   */
  default AttributeDefinition partitionKey() {
    return definitionFor(KeyRole.HASH)
        .orElseThrow(() -> new IllegalStateException("No partition key in " + tableName()));
  }

  /**
   * The sort key definition, if the table has one.
   *
   * @return the optional
   */
  default Optional<AttributeDefinition> sortKey() {
    return definitionFor(KeyRole.RANGE);
  }

  /**
   * Names of the key attributes, partition key first.
   *
   * @return the list
   */
  default List<String> keyNames() {
    return sortKey()
        .map(sort -> List.of(partitionKey().attributeName(), sort.attributeName()))
        .orElseGet(() -> List.of(partitionKey().attributeName()));
  }

  /**
   * The definition of the attribute holding the given key role.
   *
   * @param role the role
   * @return the optional
   */
  default Optional<AttributeDefinition> definitionFor(final KeyRole role) {
    return keySchema().stream()
        .filter(element -> element.keyRole() == role)
        .findFirst()
        .flatMap(element -> attributeDefinitions().stream()
            .filter(definition -> definition.attributeName().equals(element.attributeName()))
            .findFirst());
  }
}
