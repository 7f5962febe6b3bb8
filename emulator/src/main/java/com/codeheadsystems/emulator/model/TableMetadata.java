package com.codeheadsystems.emulator.model;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * Point in time description of a table.
 */
@Value.Immutable
public interface TableMetadata {

  /**
   * Schema table schema.
   *
   * @return the table schema
   */
  TableSchema schema();

  /**
   * Table status.
   *
   * @return the table status
   */
  TableStatus tableStatus();

  /**
   * Generated table id.
   *
   * @return the string
   */
  String tableId();

  /**
   * Table arn string.
   *
   * @return the string
   */
  String tableArn();

  /**
   * Creation date time instant.
   *
   * @return the instant
   */
  Instant creationDateTime();

  /**
   * Item count.
   *
   * @return the long
   */
  long itemCount();

  /**
   * Table size bytes.
   *
   * @return the long
   */
  long tableSizeBytes();

  /**
   * Read capacity units.
   *
   * @return the long
   */
  long readCapacityUnits();

  /**
   * Write capacity units.
   *
   * @return the long
   */
  long writeCapacityUnits();
}
