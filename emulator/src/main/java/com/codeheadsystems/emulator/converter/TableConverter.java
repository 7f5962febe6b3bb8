package com.codeheadsystems.emulator.converter;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.ImmutableTableSchema;
import com.codeheadsystems.emulator.model.KeyElement;
import com.codeheadsystems.emulator.model.KeyRole;
import com.codeheadsystems.emulator.model.ScalarType;
import com.codeheadsystems.emulator.model.TableMetadata;
import com.codeheadsystems.emulator.model.TableSchema;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.BillingModeSummary;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputDescription;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * The type Table converter.
 */
@Singleton
public class TableConverter {

  /**
   * Instantiates a new Table converter.
   */
  @Inject
  public TableConverter() {
  }

  /**
   * Convert a create table request to a schema.
   *
   * @param createTableRequest the create table request
   * @return the table schema
   * @throws ValidationException if a key type, attribute type or billing mode is unknown
   */
  public TableSchema convert(final CreateTableRequest createTableRequest) {
    if (createTableRequest.tableName() == null) {
      throw new ValidationException("1 validation error detected: Value null at 'tableName' failed to satisfy "
          + "constraint: Member must not be null");
    }
    final ImmutableTableSchema.Builder builder = ImmutableTableSchema.builder()
        .tableName(createTableRequest.tableName())
        .keySchema(createTableRequest.keySchema().stream().map(this::keyElement).toList())
        .attributeDefinitions(createTableRequest.attributeDefinitions().stream().map(this::attributeDefinition).toList());
    if (createTableRequest.billingMode() != null) {
      builder.billingMode(billingMode(createTableRequest.billingMode()));
    }
    final ProvisionedThroughput throughput = createTableRequest.provisionedThroughput();
    if (throughput != null) {
      if (throughput.readCapacityUnits() != null) {
        builder.readCapacityUnits(throughput.readCapacityUnits());
      }
      if (throughput.writeCapacityUnits() != null) {
        builder.writeCapacityUnits(throughput.writeCapacityUnits());
      }
    }
    return builder.build();
  }

  /**
   * Table description from the metadata.
   *
   * @param metadata the metadata
   * @return the table description
   */
  public TableDescription toDescription(final TableMetadata metadata) {
    final TableSchema schema = metadata.schema();
    final List<KeySchemaElement> keySchema = schema.keySchema().stream()
        .map(element -> KeySchemaElement.builder()
            .attributeName(element.attributeName())
            .keyType(element.keyRole() == KeyRole.HASH ? KeyType.HASH : KeyType.RANGE)
            .build())
        .toList();
    final List<AttributeDefinition> attributeDefinitions = schema.attributeDefinitions().stream()
        .map(definition -> AttributeDefinition.builder()
            .attributeName(definition.attributeName())
            .attributeType(ScalarAttributeType.fromValue(definition.attributeType().name()))
            .build())
        .toList();
    return TableDescription.builder()
        .tableName(schema.tableName())
        .tableId(metadata.tableId())
        .tableArn(metadata.tableArn())
        .tableStatus(TableStatus.fromValue(metadata.tableStatus().name()))
        .creationDateTime(metadata.creationDateTime())
        .keySchema(keySchema)
        .attributeDefinitions(attributeDefinitions)
        .itemCount(metadata.itemCount())
        .tableSizeBytes(metadata.tableSizeBytes())
        .billingModeSummary(BillingModeSummary.builder()
            .billingMode(BillingMode.fromValue(schema.billingMode().name()))
            .build())
        .provisionedThroughput(ProvisionedThroughputDescription.builder()
            .readCapacityUnits(metadata.readCapacityUnits())
            .writeCapacityUnits(metadata.writeCapacityUnits())
            .numberOfDecreasesToday(0L)
            .build())
        .build();
  }

  private KeyElement keyElement(final KeySchemaElement element) {
    final KeyRole role = switch (element.keyType() == null ? KeyType.UNKNOWN_TO_SDK_VERSION : element.keyType()) {
      case HASH -> KeyRole.HASH;
      case RANGE -> KeyRole.RANGE;
      default -> throw new ValidationException("1 validation error detected: Value '" + element.keyTypeAsString()
          + "' at 'keySchema.member.keyType' failed to satisfy constraint: Member must satisfy enum value set: "
          + "[HASH, RANGE]");
    };
    return KeyElement.of(element.attributeName(), role);
  }

  private com.codeheadsystems.emulator.model.AttributeDefinition attributeDefinition(
      final AttributeDefinition definition) {
    final ScalarType type = switch (definition.attributeType() == null
        ? ScalarAttributeType.UNKNOWN_TO_SDK_VERSION : definition.attributeType()) {
      case S -> ScalarType.S;
      case N -> ScalarType.N;
      case B -> ScalarType.B;
      default -> throw new ValidationException("1 validation error detected: Value '" + definition.attributeTypeAsString()
          + "' at 'attributeDefinitions.member.attributeType' failed to satisfy constraint: "
          + "Member must satisfy enum value set: [B, N, S]");
    };
    return com.codeheadsystems.emulator.model.AttributeDefinition.of(definition.attributeName(), type);
  }

  private com.codeheadsystems.emulator.model.BillingMode billingMode(final BillingMode billingMode) {
    return switch (billingMode) {
      case PROVISIONED -> com.codeheadsystems.emulator.model.BillingMode.PROVISIONED;
      case PAY_PER_REQUEST -> com.codeheadsystems.emulator.model.BillingMode.PAY_PER_REQUEST;
      default -> throw new ValidationException("1 validation error detected: Value '" + billingMode
          + "' at 'billingMode' failed to satisfy constraint: Member must satisfy enum value set: "
          + "[PROVISIONED, PAY_PER_REQUEST]");
    };
  }
}
