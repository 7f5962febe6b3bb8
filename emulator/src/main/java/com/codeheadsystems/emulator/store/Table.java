package com.codeheadsystems.emulator.store;

import com.codeheadsystems.emulator.model.ImmutableTableMetadata;
import com.codeheadsystems.emulator.model.TableMetadata;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.TableStatus;
import java.time.Instant;

/**
 * A table in the catalog: fixed identity, a lifecycle status, and its item store.
 */
public class Table {

  private final TableSchema schema;
  private final String tableId;
  private final String tableArn;
  private final Instant creationDateTime;
  private final long readCapacityUnits;
  private final long writeCapacityUnits;
  private final ItemStore itemStore;
  private volatile TableStatus status;

  /**
   * Instantiates a new Table in CREATING status.
   *
   * @param schema             the schema
   * @param tableId            the table id
   * @param tableArn           the table arn
   * @param creationDateTime   the creation date time
   * @param readCapacityUnits  the read capacity units
   * @param writeCapacityUnits the write capacity units
   * @param itemStore          the item store
   */
  public Table(final TableSchema schema,
               final String tableId,
               final String tableArn,
               final Instant creationDateTime,
               final long readCapacityUnits,
               final long writeCapacityUnits,
               final ItemStore itemStore) {
    this.schema = schema;
    this.tableId = tableId;
    this.tableArn = tableArn;
    this.creationDateTime = creationDateTime;
    this.readCapacityUnits = readCapacityUnits;
    this.writeCapacityUnits = writeCapacityUnits;
    this.itemStore = itemStore;
    this.status = TableStatus.CREATING;
  }

  public TableSchema schema() {
    return schema;
  }

  public String name() {
    return schema.tableName();
  }

  public ItemStore itemStore() {
    return itemStore;
  }

  public TableStatus status() {
    return status;
  }

  /**
   * Sets the status.
   *
   * @param status the status
   */
  public void status(final TableStatus status) {
    this.status = status;
  }

  /**
   * Snapshot of the table. Counts are read under the store's shared lock.
   *
   * @return the table metadata
   */
  public TableMetadata describe() {
    return itemStore.read(() -> ImmutableTableMetadata.builder()
        .schema(schema)
        .tableStatus(status)
        .tableId(tableId)
        .tableArn(tableArn)
        .creationDateTime(creationDateTime)
        .itemCount(itemStore.itemCount())
        .tableSizeBytes(itemStore.sizeBytes())
        .readCapacityUnits(readCapacityUnits)
        .writeCapacityUnits(writeCapacityUnits)
        .build());
  }
}
