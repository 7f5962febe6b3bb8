package com.codeheadsystems.emulator;

import com.codeheadsystems.emulator.converter.AttributeValueConverter;
import com.codeheadsystems.emulator.converter.ExceptionTranslator;
import com.codeheadsystems.emulator.converter.RequestConverter;
import com.codeheadsystems.emulator.converter.TableConverter;
import com.codeheadsystems.emulator.exception.EmulatorException;
import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.manager.ItemManager;
import com.codeheadsystems.emulator.manager.QueryManager;
import com.codeheadsystems.emulator.manager.TableManager;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.ImmutableDeleteItemCommand;
import com.codeheadsystems.emulator.model.ImmutableGetItemCommand;
import com.codeheadsystems.emulator.model.ImmutablePutItemCommand;
import com.codeheadsystems.emulator.model.ItemPage;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.TableList;
import com.codeheadsystems.emulator.model.WriteResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.CreateTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * A DynamoDB client that runs every request against the in-memory emulator.
 */
@Singleton
public class EmulatorDynamoDbClient implements DynamoDbClient {

  private static final Logger log = LoggerFactory.getLogger(EmulatorDynamoDbClient.class);

  private static final String SERVICE_NAME = "dynamodb";

  private final TableManager tableManager;
  private final ItemManager itemManager;
  private final QueryManager queryManager;
  private final TableConverter tableConverter;
  private final RequestConverter requestConverter;
  private final AttributeValueConverter attributeValueConverter;
  private final ExceptionTranslator exceptionTranslator;

  /**
   * Instantiates a new Emulator dynamo db client.
   *
   * @param tableManager            the table manager
   * @param itemManager             the item manager
   * @param queryManager            the query manager
   * @param tableConverter          the table converter
   * @param requestConverter        the request converter
   * @param attributeValueConverter the attribute value converter
   * @param exceptionTranslator     the exception translator
   */
  @Inject
  public EmulatorDynamoDbClient(final TableManager tableManager,
                                final ItemManager itemManager,
                                final QueryManager queryManager,
                                final TableConverter tableConverter,
                                final RequestConverter requestConverter,
                                final AttributeValueConverter attributeValueConverter,
                                final ExceptionTranslator exceptionTranslator) {
    log.info("EmulatorDynamoDbClient({},{},{},{},{},{},{})", tableManager, itemManager, queryManager,
        tableConverter, requestConverter, attributeValueConverter, exceptionTranslator);
    this.tableManager = tableManager;
    this.itemManager = itemManager;
    this.queryManager = queryManager;
    this.tableConverter = tableConverter;
    this.requestConverter = requestConverter;
    this.attributeValueConverter = attributeValueConverter;
    this.exceptionTranslator = exceptionTranslator;
  }

  @Override
  public String serviceName() {
    return SERVICE_NAME;
  }

  @Override
  public void close() {

  }

  @Override
  public CreateTableResponse createTable(final CreateTableRequest createTableRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> CreateTableResponse.builder()
        .tableDescription(tableConverter.toDescription(
            tableManager.createTable(tableConverter.convert(createTableRequest))))
        .build());
  }

  @Override
  public DescribeTableResponse describeTable(final DescribeTableRequest describeTableRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> DescribeTableResponse.builder()
        .table(tableConverter.toDescription(tableManager.describeTable(describeTableRequest.tableName())))
        .build());
  }

  @Override
  public DeleteTableResponse deleteTable(final DeleteTableRequest deleteTableRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> DeleteTableResponse.builder()
        .tableDescription(tableConverter.toDescription(tableManager.deleteTable(deleteTableRequest.tableName())))
        .build());
  }

  @Override
  public ListTablesResponse listTables(final ListTablesRequest listTablesRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final TableList list = tableManager.listTables(
          Optional.ofNullable(listTablesRequest.exclusiveStartTableName()),
          Optional.ofNullable(listTablesRequest.limit()));
      return ListTablesResponse.builder()
          .tableNames(list.tableNames())
          .lastEvaluatedTableName(list.lastEvaluatedTableName().orElse(null))
          .build();
    });
  }

  @Override
  public PutItemResponse putItem(final PutItemRequest putItemRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final ReturnValue returnValue = returnValue(putItemRequest.returnValues(), ReturnValue.ALL_OLD);
      final WriteResult result = itemManager.putItem(requestConverter.toCommand(putItemRequest));
      final PutItemResponse.Builder builder = PutItemResponse.builder();
      if (returnValue == ReturnValue.ALL_OLD) {
        result.oldItem().ifPresent(old -> builder.attributes(attributeValueConverter.fromItem(old)));
      }
      return builder.build();
    });
  }

  @Override
  public GetItemResponse getItem(final GetItemRequest getItemRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final GetItemResponse.Builder builder = GetItemResponse.builder();
      itemManager.getItem(requestConverter.toCommand(getItemRequest))
          .ifPresent(item -> builder.item(attributeValueConverter.fromItem(item)));
      return builder.build();
    });
  }

  @Override
  public DeleteItemResponse deleteItem(final DeleteItemRequest deleteItemRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final ReturnValue returnValue = returnValue(deleteItemRequest.returnValues(), ReturnValue.ALL_OLD);
      final WriteResult result = itemManager.deleteItem(requestConverter.toCommand(deleteItemRequest));
      final DeleteItemResponse.Builder builder = DeleteItemResponse.builder();
      if (returnValue == ReturnValue.ALL_OLD) {
        result.oldItem().ifPresent(old -> builder.attributes(attributeValueConverter.fromItem(old)));
      }
      return builder.build();
    });
  }

  @Override
  public UpdateItemResponse updateItem(final UpdateItemRequest updateItemRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final ReturnValue returnValue = returnValue(updateItemRequest.returnValues(),
          ReturnValue.ALL_OLD, ReturnValue.ALL_NEW, ReturnValue.UPDATED_OLD, ReturnValue.UPDATED_NEW);
      final WriteResult result = itemManager.updateItem(requestConverter.toCommand(updateItemRequest));
      final Map<String, AttributeValue> oldItem = result.oldItem().orElse(Map.of());
      final Map<String, AttributeValue> newItem = result.newItem().orElse(Map.of());
      final Optional<Map<String, AttributeValue>> attributes = switch (returnValue) {
        case ALL_OLD -> result.oldItem();
        case ALL_NEW -> result.newItem();
        case UPDATED_OLD -> Optional.of(changed(oldItem, newItem));
        case UPDATED_NEW -> Optional.of(changed(newItem, oldItem));
        default -> Optional.empty();
      };
      final UpdateItemResponse.Builder builder = UpdateItemResponse.builder();
      attributes.filter(map -> !map.isEmpty())
          .ifPresent(map -> builder.attributes(attributeValueConverter.fromItem(map)));
      return builder.build();
    });
  }

  @Override
  public QueryResponse query(final QueryRequest queryRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final ItemPage page = queryManager.query(requestConverter.toCommand(queryRequest));
      final QueryResponse.Builder builder = QueryResponse.builder()
          .count(page.count())
          .scannedCount(page.scannedCount());
      if (queryRequest.select() != Select.COUNT) {
        builder.items(page.items().stream().map(attributeValueConverter::fromItem).toList());
      }
      page.lastEvaluatedKey().ifPresent(key -> builder.lastEvaluatedKey(attributeValueConverter.fromItem(key)));
      return builder.build();
    });
  }

  @Override
  public ScanResponse scan(final ScanRequest scanRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final ItemPage page = queryManager.scan(requestConverter.toCommand(scanRequest));
      final ScanResponse.Builder builder = ScanResponse.builder()
          .count(page.count())
          .scannedCount(page.scannedCount());
      if (scanRequest.select() != Select.COUNT) {
        builder.items(page.items().stream().map(attributeValueConverter::fromItem).toList());
      }
      page.lastEvaluatedKey().ifPresent(key -> builder.lastEvaluatedKey(attributeValueConverter.fromItem(key)));
      return builder.build();
    });
  }

  /**
   * Runs each put and delete on its own. Writes that fail for a missing table or invalid item come back
   * unprocessed; a failed write does not stop the others.
   *
   * @param batchWriteItemRequest the batch write item request
   * @return the batch write item response
   */
  @Override
  public BatchWriteItemResponse batchWriteItem(final BatchWriteItemRequest batchWriteItemRequest) throws AwsServiceException, SdkClientException {
    final Map<String, List<WriteRequest>> unprocessed = new LinkedHashMap<>();
    batchWriteItemRequest.requestItems().forEach((tableName, writes) -> {
      for (WriteRequest write : writes) {
        try {
          if (write.putRequest() != null) {
            itemManager.putItem(ImmutablePutItemCommand.builder()
                .tableName(tableName)
                .item(attributeValueConverter.toItem(write.putRequest().item()))
                .build());
          } else if (write.deleteRequest() != null) {
            itemManager.deleteItem(ImmutableDeleteItemCommand.builder()
                .tableName(tableName)
                .key(attributeValueConverter.toItem(write.deleteRequest().key()))
                .build());
          } else {
            throw new ValidationException("Supplied WriteRequest must contain exactly one of PutRequest or DeleteRequest");
          }
        } catch (EmulatorException e) {
          log.warn("Unprocessed write on {}: {}", tableName, e.getMessage());
          unprocessed.computeIfAbsent(tableName, k -> new ArrayList<>()).add(write);
        }
      }
    });
    return BatchWriteItemResponse.builder().unprocessedItems(unprocessed).build();
  }

  @Override
  public BatchGetItemResponse batchGetItem(final BatchGetItemRequest batchGetItemRequest) throws AwsServiceException, SdkClientException {
    return translated(() -> {
      final Map<String, List<Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue>>> responses =
          new LinkedHashMap<>();
      batchGetItemRequest.requestItems().forEach((tableName, keysAndAttributes) -> {
        final List<Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue>> found = new ArrayList<>();
        for (Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> key : keysAndAttributes.keys()) {
          itemManager.getItem(getCommand(tableName, key, keysAndAttributes))
              .ifPresent(item -> found.add(attributeValueConverter.fromItem(item)));
        }
        responses.put(tableName, found);
      });
      return BatchGetItemResponse.builder().responses(responses).unprocessedKeys(Map.of()).build();
    });
  }

  private ImmutableGetItemCommand getCommand(
      final String tableName,
      final Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> key,
      final KeysAndAttributes keysAndAttributes) {
    final PlaceholderBindings bindings = requestConverter.bindings(keysAndAttributes.expressionAttributeNames(), Map.of());
    final ImmutableGetItemCommand.Builder builder = ImmutableGetItemCommand.builder()
        .tableName(tableName)
        .key(attributeValueConverter.toItem(key))
        .bindings(bindings);
    if (keysAndAttributes.hasAttributesToGet()) {
      builder.projection(requestConverter.projectionOf(keysAndAttributes.attributesToGet()));
    } else {
      builder.projection(requestConverter.projection(keysAndAttributes.projectionExpression()));
    }
    return builder.build();
  }

  /**
   * Top level attributes of the first item whose value differs in, or is absent from, the second.
   */
  private Map<String, AttributeValue> changed(final Map<String, AttributeValue> item,
                                              final Map<String, AttributeValue> other) {
    final Map<String, AttributeValue> result = new LinkedHashMap<>();
    item.forEach((name, value) -> {
      if (!value.equals(other.get(name))) {
        result.put(name, value);
      }
    });
    return result;
  }

  private ReturnValue returnValue(final ReturnValue requested, final ReturnValue... allowed) {
    if (requested == null || requested == ReturnValue.NONE) {
      return ReturnValue.NONE;
    }
    for (ReturnValue returnValue : allowed) {
      if (returnValue == requested) {
        return requested;
      }
    }
    throw new ValidationException("Return values set to invalid value");
  }

  private <T> T translated(final Supplier<T> operation) {
    try {
      return operation.get();
    } catch (EmulatorException e) {
      throw exceptionTranslator.translate(e);
    }
  }
}
