package com.codeheadsystems.emulator.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

import com.codeheadsystems.emulator.exception.TableAlreadyExistsException;
import com.codeheadsystems.emulator.exception.TableNotFoundException;
import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.AttributeDefinition;
import com.codeheadsystems.emulator.model.BillingMode;
import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.model.ImmutableConfiguration;
import com.codeheadsystems.emulator.model.ImmutableTableSchema;
import com.codeheadsystems.emulator.model.KeyElement;
import com.codeheadsystems.emulator.model.KeyRole;
import com.codeheadsystems.emulator.model.ScalarType;
import com.codeheadsystems.emulator.model.TableList;
import com.codeheadsystems.emulator.model.TableMetadata;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.TableStatus;
import com.codeheadsystems.emulator.util.ItemSizeCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TableManagerTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private Clock clock;

  private TableManager manager;

  @BeforeEach
  void setup() {
    lenient().when(clock.instant()).thenReturn(NOW);
    final Configuration configuration = ImmutableConfiguration.builder()
        .region("eu-central-1")
        .accountId("111122223333")
        .build();
    manager = new TableManager(configuration, clock, new ItemSizeCalculator());
  }

  private ImmutableTableSchema.Builder schema(final String name) {
    return ImmutableTableSchema.builder()
        .tableName(name)
        .addKeySchema(KeyElement.of("pk", KeyRole.HASH))
        .addAttributeDefinitions(AttributeDefinition.of("pk", ScalarType.S));
  }

  @Test
  void createTable_describesActiveTable() {
    final TableMetadata metadata = manager.createTable(schema("users").build());

    assertThat(metadata.tableStatus()).isEqualTo(TableStatus.ACTIVE);
    assertThat(metadata.tableArn()).isEqualTo("arn:aws:dynamodb:eu-central-1:111122223333:table/users");
    assertThat(metadata.creationDateTime()).isEqualTo(NOW);
    assertThat(metadata.itemCount()).isZero();
    assertThat(metadata.readCapacityUnits()).isEqualTo(5L);
    assertThat(metadata.tableId()).isNotBlank();
    assertThat(manager.describeTable("users")).isEqualTo(metadata);
  }

  @Test
  void createTable_onDemand_reportsNoCapacity() {
    final TableMetadata metadata = manager.createTable(schema("users").billingMode(BillingMode.PAY_PER_REQUEST).build());

    assertThat(metadata.readCapacityUnits()).isZero();
    assertThat(metadata.writeCapacityUnits()).isZero();
  }

  @Test
  void createTable_duplicate() {
    manager.createTable(schema("users").build());

    assertThatThrownBy(() -> manager.createTable(schema("users").build()))
        .isInstanceOf(TableAlreadyExistsException.class)
        .hasMessage("Table already exists: users");
  }

  @Test
  void createTable_invalidName() {
    assertThatThrownBy(() -> manager.createTable(schema("ab").build()))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> manager.createTable(schema("bad name!").build()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void createTable_firstKeyMustBeHash() {
    final TableSchema schema = ImmutableTableSchema.builder()
        .tableName("users")
        .addKeySchema(KeyElement.of("sk", KeyRole.RANGE), KeyElement.of("pk", KeyRole.HASH))
        .addAttributeDefinitions(AttributeDefinition.of("pk", ScalarType.S), AttributeDefinition.of("sk", ScalarType.S))
        .build();

    assertThatThrownBy(() -> manager.createTable(schema))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not a HASH key type");
  }

  @Test
  void createTable_twoHashKeys() {
    final TableSchema schema = schema("users")
        .addKeySchema(KeyElement.of("other", KeyRole.HASH))
        .addAttributeDefinitions(AttributeDefinition.of("other", ScalarType.S))
        .build();

    assertThatThrownBy(() -> manager.createTable(schema))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Too many hash keys");
  }

  @Test
  void createTable_undefinedKey() {
    final TableSchema schema = ImmutableTableSchema.builder()
        .tableName("users")
        .addKeySchema(KeyElement.of("pk", KeyRole.HASH))
        .addAttributeDefinitions(AttributeDefinition.of("id", ScalarType.S))
        .build();

    assertThatThrownBy(() -> manager.createTable(schema))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not defined in AttributeDefinitions");
  }

  @Test
  void createTable_unusedDefinition() {
    final TableSchema schema = schema("users")
        .addAttributeDefinitions(AttributeDefinition.of("extra", ScalarType.N))
        .build();

    assertThatThrownBy(() -> manager.createTable(schema))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("does not exactly match");
  }

  @Test
  void createTable_onDemandWithCapacity() {
    final TableSchema schema = schema("users")
        .billingMode(BillingMode.PAY_PER_REQUEST)
        .readCapacityUnits(10L)
        .build();

    assertThatThrownBy(() -> manager.createTable(schema))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("PAY_PER_REQUEST");
  }

  @Test
  void deleteTable_removesTable() {
    manager.createTable(schema("users").build());

    final TableMetadata deleted = manager.deleteTable("users");

    assertThat(deleted.tableStatus()).isEqualTo(TableStatus.DELETING);
    assertThatThrownBy(() -> manager.describeTable("users"))
        .isInstanceOf(TableNotFoundException.class)
        .hasMessage("Requested resource not found: Table: users not found");
    assertThatThrownBy(() -> manager.deleteTable("users"))
        .isInstanceOf(TableNotFoundException.class);
  }

  @Test
  void deleteTable_nameCanBeReused() {
    manager.createTable(schema("users").build());
    manager.deleteTable("users");

    assertThat(manager.createTable(schema("users").build()).tableStatus()).isEqualTo(TableStatus.ACTIVE);
  }

  @Test
  void listTables_paginates() {
    for (String name : new String[]{"delta", "alpha", "charlie", "bravo", "echo"}) {
      manager.createTable(schema(name).build());
    }

    final TableList first = manager.listTables(Optional.empty(), Optional.of(2));
    assertThat(first.tableNames()).containsExactly("alpha", "bravo");
    assertThat(first.lastEvaluatedTableName()).contains("bravo");

    final TableList second = manager.listTables(first.lastEvaluatedTableName(), Optional.of(2));
    assertThat(second.tableNames()).containsExactly("charlie", "delta");

    final TableList last = manager.listTables(second.lastEvaluatedTableName(), Optional.of(2));
    assertThat(last.tableNames()).containsExactly("echo");
    assertThat(last.lastEvaluatedTableName()).isEmpty();
  }

  @Test
  void listTables_exactPage_hasNoContinuation() {
    manager.createTable(schema("alpha").build());

    assertThat(manager.listTables(Optional.empty(), Optional.of(1)).lastEvaluatedTableName()).isEmpty();
  }

  @Test
  void listTables_invalidLimit() {
    assertThatThrownBy(() -> manager.listTables(Optional.empty(), Optional.of(0)))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> manager.listTables(Optional.empty(), Optional.of(101)))
        .isInstanceOf(ValidationException.class);
  }
}
