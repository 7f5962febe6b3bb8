package com.codeheadsystems.emulator.endToEnd;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.emulator.EmulatorDynamoDbClient;
import com.codeheadsystems.emulator.converter.ExceptionTranslator;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

public class ItemOperationsTest extends BaseEndToEndTest {

  private static final String TABLE_NAME = "ItemOpsTable";
  private static final String HASH_KEY = "userId";
  private static final String SORT_KEY = "timestamp";

  private static final Map<String, AttributeValue> KEY = Map.of(
      HASH_KEY, AttributeValue.builder().s("user-123").build(),
      SORT_KEY, AttributeValue.builder().s("2024-01-01T00:00:00Z").build());

  private EmulatorDynamoDbClient client;

  @BeforeEach
  void setup() {
    client = component.dynamoDbClient();
    client.createTable(CreateTableRequest.builder()
        .tableName(TABLE_NAME)
        .keySchema(
            KeySchemaElement.builder().attributeName(HASH_KEY).keyType(KeyType.HASH).build(),
            KeySchemaElement.builder().attributeName(SORT_KEY).keyType(KeyType.RANGE).build())
        .attributeDefinitions(
            AttributeDefinition.builder().attributeName(HASH_KEY).attributeType(ScalarAttributeType.S).build(),
            AttributeDefinition.builder().attributeName(SORT_KEY).attributeType(ScalarAttributeType.S).build())
        .build());
  }

  private Map<String, AttributeValue> item(final String name, final String age) {
    return Map.of(
        HASH_KEY, AttributeValue.builder().s("user-123").build(),
        SORT_KEY, AttributeValue.builder().s("2024-01-01T00:00:00Z").build(),
        "name", AttributeValue.builder().s(name).build(),
        "age", AttributeValue.builder().n(age).build());
  }

  private void putItem(final Map<String, AttributeValue> item) {
    client.putItem(PutItemRequest.builder().tableName(TABLE_NAME).item(item).build());
  }

  private Map<String, AttributeValue> getItem() {
    return client.getItem(GetItemRequest.builder().tableName(TABLE_NAME).key(KEY).build()).item();
  }

  @Test
  void putItem_and_getItem_roundTrip() {
    final PutItemResponse putResponse = client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("John Doe", "30"))
        .build());

    assertThat(putResponse.hasAttributes()).isFalse();
    assertThat(getItem()).isEqualTo(item("John Doe", "30"));
  }

  @Test
  void putItem_and_getItem_everyType() {
    final Map<String, AttributeValue> item = new HashMap<>(KEY);
    item.put("data", AttributeValue.builder().b(SdkBytes.fromByteArray(new byte[]{1, 2, 3})).build());
    item.put("active", AttributeValue.builder().bool(true).build());
    item.put("deleted", AttributeValue.builder().nul(true).build());
    item.put("history", AttributeValue.builder().l(
        AttributeValue.builder().s("login").build(),
        AttributeValue.builder().n("42").build()).build());
    item.put("address", AttributeValue.builder().m(Map.of(
        "city", AttributeValue.builder().s("Portland").build())).build());
    item.put("tags", AttributeValue.builder().ss("a", "b").build());
    item.put("scores", AttributeValue.builder().ns("1", "2.5").build());
    item.put("keys", AttributeValue.builder().bs(
        SdkBytes.fromByteArray(new byte[]{1}), SdkBytes.fromByteArray(new byte[]{2})).build());

    client.putItem(PutItemRequest.builder().tableName(TABLE_NAME).item(item).build());

    assertThat(getItem()).isEqualTo(item);
  }

  @Test
  void putItem_sameItemTwice() {
    putItem(item("John Doe", "30"));
    final Map<String, AttributeValue> first = getItem();

    putItem(item("John Doe", "30"));

    assertThat(getItem()).isEqualTo(first);
    assertThat(client.describeTable(DescribeTableRequest.builder().tableName(TABLE_NAME).build())
        .table().itemCount()).isEqualTo(1L);
  }

  @Test
  void getItem_missing() {
    final GetItemResponse response = client.getItem(GetItemRequest.builder().tableName(TABLE_NAME).key(KEY).build());

    assertThat(response.hasItem()).isFalse();
  }

  @Test
  void getItem_projection() {
    putItem(item("John Doe", "30"));

    final GetItemResponse response = client.getItem(GetItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .projectionExpression("#n")
        .expressionAttributeNames(Map.of("#n", "name"))
        .build());

    assertThat(response.item()).containsOnlyKeys("name");
  }

  @Test
  void getItem_unknownTable() {
    assertThatThrownBy(() -> client.getItem(GetItemRequest.builder().tableName("Nope").key(KEY).build()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void putItem_returnsOldValues() {
    putItem(item("John Doe", "30"));

    final PutItemResponse response = client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("Jane Doe", "31"))
        .returnValues(ReturnValue.ALL_OLD)
        .build());

    assertThat(response.attributes()).isEqualTo(item("John Doe", "30"));
    assertThat(getItem()).isEqualTo(item("Jane Doe", "31"));
  }

  @Test
  void putItem_invalidReturnValues() {
    assertThatThrownBy(() -> client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("John Doe", "30"))
        .returnValues(ReturnValue.ALL_NEW)
        .build()))
        .isInstanceOf(DynamoDbException.class)
        .hasMessageContaining("Return values set to invalid value");
  }

  @Test
  void putItem_conditionFails() {
    putItem(item("John Doe", "30"));

    assertThatThrownBy(() -> client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("Jane Doe", "31"))
        .conditionExpression("attribute_not_exists(#u)")
        .expressionAttributeNames(Map.of("#u", HASH_KEY))
        .build()))
        .isInstanceOf(ConditionalCheckFailedException.class);
    assertThat(getItem()).isEqualTo(item("John Doe", "30"));
  }

  @Test
  void putItem_parseError() {
    assertThatThrownBy(() -> client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("John Doe", "30"))
        .conditionExpression("#u =")
        .expressionAttributeNames(Map.of("#u", HASH_KEY))
        .build()))
        .isInstanceOf(DynamoDbException.class)
        .satisfies(e -> assertThat(((DynamoDbException) e).awsErrorDetails().errorCode())
            .isEqualTo(ExceptionTranslator.VALIDATION_EXCEPTION));
  }

  @Test
  void putItem_unboundPlaceholder() {
    assertThatThrownBy(() -> client.putItem(PutItemRequest.builder()
        .tableName(TABLE_NAME)
        .item(item("John Doe", "30"))
        .conditionExpression("#u = :u")
        .expressionAttributeNames(Map.of("#u", HASH_KEY))
        .build()))
        .isInstanceOf(DynamoDbException.class)
        .hasMessageContaining(":u");
  }

  @Test
  void deleteItem_returnsOldValues() {
    putItem(item("John Doe", "30"));

    final DeleteItemResponse response = client.deleteItem(DeleteItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .returnValues(ReturnValue.ALL_OLD)
        .build());

    assertThat(response.attributes()).isEqualTo(item("John Doe", "30"));
    assertThat(client.getItem(GetItemRequest.builder().tableName(TABLE_NAME).key(KEY).build()).hasItem()).isFalse();
  }

  @Test
  void deleteItem_conditionFails() {
    putItem(item("John Doe", "30"));

    assertThatThrownBy(() -> client.deleteItem(DeleteItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .conditionExpression("age > :min")
        .expressionAttributeValues(Map.of(":min", AttributeValue.builder().n("40").build()))
        .build()))
        .isInstanceOf(ConditionalCheckFailedException.class);
  }

  @Test
  void updateItem_allNew() {
    putItem(item("John Doe", "30"));

    final UpdateItemResponse response = client.updateItem(UpdateItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .updateExpression("SET age = age + :one, #e = :email")
        .expressionAttributeNames(Map.of("#e", "email"))
        .expressionAttributeValues(Map.of(
            ":one", AttributeValue.builder().n("1").build(),
            ":email", AttributeValue.builder().s("john@example.com").build()))
        .returnValues(ReturnValue.ALL_NEW)
        .build());

    assertThat(response.attributes())
        .containsEntry("age", AttributeValue.builder().n("31").build())
        .containsEntry("email", AttributeValue.builder().s("john@example.com").build())
        .containsEntry("name", AttributeValue.builder().s("John Doe").build());
    assertThat(getItem()).isEqualTo(response.attributes());
  }

  @Test
  void updateItem_updatedOldAndNew() {
    putItem(item("John Doe", "30"));

    final UpdateItemResponse updatedNew = client.updateItem(UpdateItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .updateExpression("SET #n = :n")
        .expressionAttributeNames(Map.of("#n", "name"))
        .expressionAttributeValues(Map.of(":n", AttributeValue.builder().s("Jane Doe").build()))
        .returnValues(ReturnValue.UPDATED_NEW)
        .build());
    final UpdateItemResponse updatedOld = client.updateItem(UpdateItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .updateExpression("REMOVE age")
        .returnValues(ReturnValue.UPDATED_OLD)
        .build());

    assertThat(updatedNew.attributes()).isEqualTo(Map.of("name", AttributeValue.builder().s("Jane Doe").build()));
    assertThat(updatedOld.attributes()).isEqualTo(Map.of("age", AttributeValue.builder().n("30").build()));
    assertThat(getItem()).doesNotContainKey("age");
  }

  @Test
  void updateItem_createsItem() {
    final UpdateItemResponse response = client.updateItem(UpdateItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .updateExpression("ADD visits :one")
        .expressionAttributeValues(Map.of(":one", AttributeValue.builder().n("1").build()))
        .returnValues(ReturnValue.ALL_OLD)
        .build());

    assertThat(response.hasAttributes()).isFalse();
    assertThat(getItem()).containsEntry("visits", AttributeValue.builder().n("1").build());
  }

  @Test
  void updateItem_keyAttribute() {
    assertThatThrownBy(() -> client.updateItem(UpdateItemRequest.builder()
        .tableName(TABLE_NAME)
        .key(KEY)
        .updateExpression("SET #u = :u")
        .expressionAttributeNames(Map.of("#u", HASH_KEY))
        .expressionAttributeValues(Map.of(":u", AttributeValue.builder().s("other").build()))
        .build()))
        .isInstanceOf(DynamoDbException.class)
        .hasMessageContaining("This attribute is part of the key");
  }
}
