package com.codeheadsystems.emulator.manager;

import com.codeheadsystems.emulator.exception.TableAlreadyExistsException;
import com.codeheadsystems.emulator.exception.TableNotFoundException;
import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.AttributeDefinition;
import com.codeheadsystems.emulator.model.BillingMode;
import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.model.ImmutableTableList;
import com.codeheadsystems.emulator.model.KeyElement;
import com.codeheadsystems.emulator.model.KeyRole;
import com.codeheadsystems.emulator.model.TableList;
import com.codeheadsystems.emulator.model.TableMetadata;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.TableStatus;
import com.codeheadsystems.emulator.store.ItemStore;
import com.codeheadsystems.emulator.store.Table;
import com.codeheadsystems.emulator.util.ItemSizeCalculator;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The table catalog. One instance per emulator; tables live as long as it does.
 */
@Singleton
public class TableManager {

  private static final Logger log = LoggerFactory.getLogger(TableManager.class);

  private static final Pattern TABLE_NAME = Pattern.compile("[a-zA-Z0-9_.-]+");
  private static final int MIN_TABLE_NAME_LENGTH = 3;
  private static final int MAX_TABLE_NAME_LENGTH = 255;

  private final Configuration configuration;
  private final Clock clock;
  private final ItemSizeCalculator itemSizeCalculator;
  private final ConcurrentMap<String, Table> tables = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Table manager.
   *
   * @param configuration      the configuration
   * @param clock              the clock
   * @param itemSizeCalculator the item size calculator
   */
  @Inject
  public TableManager(final Configuration configuration,
                      final Clock clock,
                      final ItemSizeCalculator itemSizeCalculator) {
    log.info("TableManager({}, {}, {})", configuration, clock, itemSizeCalculator);
    this.configuration = configuration;
    this.clock = clock;
    this.itemSizeCalculator = itemSizeCalculator;
  }

  /**
   * Create table.
   *
   * @param schema the schema
   * @return the table metadata, ACTIVE
   * @throws ValidationException         if the schema is invalid
   * @throws TableAlreadyExistsException if the name is taken
   */
  public TableMetadata createTable(final TableSchema schema) {
    log.trace("createTable({})", schema);
    validate(schema);
    final boolean onDemand = schema.billingMode() == BillingMode.PAY_PER_REQUEST;
    final Table table = new Table(
        schema,
        UUID.randomUUID().toString(),
        String.format("arn:aws:dynamodb:%s:%s:table/%s",
            configuration.region(), configuration.accountId(), schema.tableName()),
        clock.instant(),
        onDemand ? 0L : schema.readCapacityUnits().orElse(configuration.defaultReadCapacityUnits()),
        onDemand ? 0L : schema.writeCapacityUnits().orElse(configuration.defaultWriteCapacityUnits()),
        new ItemStore(schema, itemSizeCalculator));
    table.status(TableStatus.ACTIVE);
    if (tables.putIfAbsent(schema.tableName(), table) != null) {
      log.warn("Table already exists: {}", schema.tableName());
      throw new TableAlreadyExistsException("Table already exists: " + schema.tableName());
    }
    log.info("Created table {}", schema.tableName());
    return table.describe();
  }

  /**
   * Describe table.
   *
   * @param tableName the table name
   * @return the table metadata
   * @throws TableNotFoundException if there is no such table
   */
  public TableMetadata describeTable(final String tableName) {
    log.trace("describeTable({})", tableName);
    return getTable(tableName).describe();
  }

  /**
   * Delete table, with all its items.
   *
   * @param tableName the table name
   * @return the table metadata, DELETING
   * @throws TableNotFoundException if there is no such table
   */
  public TableMetadata deleteTable(final String tableName) {
    log.trace("deleteTable({})", tableName);
    final Table table = getTable(tableName);
    return table.itemStore().write(() -> {
      if (!tables.remove(tableName, table)) {
        throw notFound(tableName);
      }
      table.status(TableStatus.DELETING);
      log.info("Deleted table {}", tableName);
      return table.describe();
    });
  }

  /**
   * List table names in lexicographic order.
   *
   * @param exclusiveStartTableName the name to start after
   * @param limit                   the page size
   * @return the table list
   * @throws ValidationException if the limit is out of range
   */
  public TableList listTables(final Optional<String> exclusiveStartTableName, final Optional<Integer> limit) {
    log.trace("listTables({}, {})", exclusiveStartTableName, limit);
    final int pageSize = limit.orElse(configuration.defaultPageLimit());
    if (pageSize < 1 || pageSize > configuration.maxPageLimit()) {
      throw new ValidationException("1 validation error detected: Value '" + pageSize
          + "' at 'limit' failed to satisfy constraint: Member must have value between 1 and "
          + configuration.maxPageLimit());
    }
    final List<String> names = tables.keySet().stream()
        .sorted()
        .filter(name -> exclusiveStartTableName.map(start -> name.compareTo(start) > 0).orElse(true))
        .toList();
    final List<String> page = names.subList(0, Math.min(pageSize, names.size()));
    final ImmutableTableList.Builder builder = ImmutableTableList.builder().tableNames(page);
    if (names.size() > page.size()) {
      builder.lastEvaluatedTableName(page.get(page.size() - 1));
    }
    return builder.build();
  }

  /**
   * The live table with the name.
   *
   * @param tableName the table name
   * @return the table
   * @throws TableNotFoundException if there is no such table, or it is being deleted
   */
  public Table getTable(final String tableName) {
    final Table table = tables.get(tableName);
    if (table == null || table.status() == TableStatus.DELETING) {
      throw notFound(tableName);
    }
    return table;
  }

  private TableNotFoundException notFound(final String tableName) {
    log.debug("Table not found: {}", tableName);
    return new TableNotFoundException("Requested resource not found: Table: " + tableName + " not found");
  }

  private void validate(final TableSchema schema) {
    final String name = schema.tableName();
    if (name.length() < MIN_TABLE_NAME_LENGTH || name.length() > MAX_TABLE_NAME_LENGTH) {
      throw invalid("TableName must be at least 3 characters long and at most 255 characters long");
    }
    if (!TABLE_NAME.matcher(name).matches()) {
      throw invalid("1 validation error detected: Value '" + name
          + "' at 'tableName' failed to satisfy constraint: Member must satisfy regular expression pattern: "
          + TABLE_NAME.pattern());
    }
    final List<KeyElement> keySchema = schema.keySchema();
    if (keySchema.isEmpty() || keySchema.size() > 2) {
      throw invalid("1 validation error detected: Value at 'keySchema' failed to satisfy constraint: "
          + "Member must have length less than or equal to 2 and greater than or equal to 1");
    }
    if (keySchema.get(0).keyRole() != KeyRole.HASH) {
      throw invalid("Invalid KeySchema: The first KeySchemaElement is not a HASH key type");
    }
    if (keySchema.size() == 2) {
      if (keySchema.get(1).keyRole() == KeyRole.HASH) {
        throw invalid("Too many hash keys specified.  All Dynamo DB tables must have exactly one hash key");
      }
      if (keySchema.get(0).attributeName().equals(keySchema.get(1).attributeName())) {
        throw invalid("Both the Hash Key and the Range Key element in the KeySchema have the same name");
      }
    }
    final Set<String> defined = new HashSet<>();
    for (AttributeDefinition definition : schema.attributeDefinitions()) {
      if (!defined.add(definition.attributeName())) {
        throw invalid("Cannot have two attributes with the same name");
      }
    }
    final Set<String> keyNames = keySchema.stream().map(KeyElement::attributeName).collect(Collectors.toSet());
    if (!defined.containsAll(keyNames)) {
      throw invalid("One or more parameter values were invalid: Some index key attributes are not defined in "
          + "AttributeDefinitions. Keys: " + keyNames + ", AttributeDefinitions: " + defined);
    }
    if (!keyNames.containsAll(defined)) {
      throw invalid("One or more parameter values were invalid: Number of attributes in KeySchema does not "
          + "exactly match number of attributes defined in AttributeDefinitions");
    }
    if (schema.billingMode() == BillingMode.PAY_PER_REQUEST
        && (schema.readCapacityUnits().isPresent() || schema.writeCapacityUnits().isPresent())) {
      throw invalid("One or more parameter values were invalid: Neither ReadCapacityUnits nor WriteCapacityUnits "
          + "can be specified when BillingMode is PAY_PER_REQUEST");
    }
    if (schema.readCapacityUnits().orElse(1L) < 1 || schema.writeCapacityUnits().orElse(1L) < 1) {
      throw invalid("One or more parameter values were invalid: Provisioned throughput must be at least 1");
    }
  }

  private ValidationException invalid(final String message) {
    log.warn("Rejected table schema: {}", message);
    return new ValidationException(message);
  }
}
