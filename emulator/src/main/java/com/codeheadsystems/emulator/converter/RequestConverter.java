package com.codeheadsystems.emulator.converter;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ConditionExpressionParser;
import com.codeheadsystems.emulator.expression.ProjectionExpressionParser;
import com.codeheadsystems.emulator.expression.UpdateExpressionParser;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.DeleteItemCommand;
import com.codeheadsystems.emulator.model.GetItemCommand;
import com.codeheadsystems.emulator.model.ImmutableDeleteItemCommand;
import com.codeheadsystems.emulator.model.ImmutableGetItemCommand;
import com.codeheadsystems.emulator.model.ImmutablePlaceholderBindings;
import com.codeheadsystems.emulator.model.ImmutablePutItemCommand;
import com.codeheadsystems.emulator.model.ImmutableQueryCommand;
import com.codeheadsystems.emulator.model.ImmutableScanCommand;
import com.codeheadsystems.emulator.model.ImmutableUpdateItemCommand;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.PutItemCommand;
import com.codeheadsystems.emulator.model.QueryCommand;
import com.codeheadsystems.emulator.model.ScanCommand;
import com.codeheadsystems.emulator.model.UpdateItemCommand;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Turns SDK item requests into emulator commands, parsing their expressions.
 */
@Singleton
public class RequestConverter {

  private static final Logger log = LoggerFactory.getLogger(RequestConverter.class);

  private final AttributeValueConverter attributeValueConverter;
  private final ConditionExpressionParser conditionExpressionParser;
  private final UpdateExpressionParser updateExpressionParser;
  private final ProjectionExpressionParser projectionExpressionParser;

  /**
   * Instantiates a new Request converter.
   *
   * @param attributeValueConverter    the attribute value converter
   * @param conditionExpressionParser  the condition expression parser
   * @param updateExpressionParser     the update expression parser
   * @param projectionExpressionParser the projection expression parser
   */
  @Inject
  public RequestConverter(final AttributeValueConverter attributeValueConverter,
                          final ConditionExpressionParser conditionExpressionParser,
                          final UpdateExpressionParser updateExpressionParser,
                          final ProjectionExpressionParser projectionExpressionParser) {
    log.info("RequestConverter({}, {}, {}, {})", attributeValueConverter, conditionExpressionParser,
        updateExpressionParser, projectionExpressionParser);
    this.attributeValueConverter = attributeValueConverter;
    this.conditionExpressionParser = conditionExpressionParser;
    this.updateExpressionParser = updateExpressionParser;
    this.projectionExpressionParser = projectionExpressionParser;
  }

  /**
   * Put command.
   *
   * @param request the request
   * @return the put item command
   */
  public PutItemCommand toCommand(final PutItemRequest request) {
    return ImmutablePutItemCommand.builder()
        .tableName(tableName(request.tableName()))
        .item(attributeValueConverter.toItem(request.item()))
        .condition(condition(request.conditionExpression()))
        .bindings(bindings(request.expressionAttributeNames(), request.expressionAttributeValues()))
        .build();
  }

  /**
   * Get command. A legacy attributes-to-get list becomes a projection.
   *
   * @param request the request
   * @return the get item command
   */
  public GetItemCommand toCommand(final GetItemRequest request) {
    final Optional<ProjectionExpression> projection = request.hasAttributesToGet()
        ? Optional.of(projectionOf(request.attributesToGet()))
        : projection(request.projectionExpression());
    return ImmutableGetItemCommand.builder()
        .tableName(tableName(request.tableName()))
        .key(attributeValueConverter.toItem(request.key()))
        .projection(projection)
        .bindings(bindings(request.expressionAttributeNames(), Map.of()))
        .build();
  }

  /**
   * Delete command.
   *
   * @param request the request
   * @return the delete item command
   */
  public DeleteItemCommand toCommand(final DeleteItemRequest request) {
    return ImmutableDeleteItemCommand.builder()
        .tableName(tableName(request.tableName()))
        .key(attributeValueConverter.toItem(request.key()))
        .condition(condition(request.conditionExpression()))
        .bindings(bindings(request.expressionAttributeNames(), request.expressionAttributeValues()))
        .build();
  }

  /**
   * Update command.
   *
   * @param request the request
   * @return the update item command
   */
  public UpdateItemCommand toCommand(final UpdateItemRequest request) {
    return ImmutableUpdateItemCommand.builder()
        .tableName(tableName(request.tableName()))
        .key(attributeValueConverter.toItem(request.key()))
        .update(Optional.ofNullable(request.updateExpression()).map(updateExpressionParser::parse))
        .condition(condition(request.conditionExpression()))
        .bindings(bindings(request.expressionAttributeNames(), request.expressionAttributeValues()))
        .build();
  }

  /**
   * Query command.
   *
   * @param request the request
   * @return the query command
   * @throws ValidationException if there is no key condition or an index is named
   */
  public QueryCommand toCommand(final QueryRequest request) {
    if (request.indexName() != null) {
      throw new ValidationException("The table does not have the specified index: " + request.indexName());
    }
    if (request.keyConditionExpression() == null) {
      throw new ValidationException(
          "Either the KeyConditions or KeyConditionExpression parameter must be specified in the request.");
    }
    return ImmutableQueryCommand.builder()
        .tableName(tableName(request.tableName()))
        .keyCondition(conditionExpressionParser.parse(request.keyConditionExpression()))
        .filter(condition(request.filterExpression()))
        .projection(projection(request.projectionExpression()))
        .bindings(bindings(request.expressionAttributeNames(), request.expressionAttributeValues()))
        .scanForward(request.scanIndexForward() == null || request.scanIndexForward())
        .limit(Optional.ofNullable(request.limit()))
        .exclusiveStartKey(exclusiveStartKey(request.hasExclusiveStartKey(), request.exclusiveStartKey()))
        .select(select(request.select()))
        .build();
  }

  /**
   * Scan command.
   *
   * @param request the request
   * @return the scan command
   * @throws ValidationException if an index is named
   */
  public ScanCommand toCommand(final ScanRequest request) {
    if (request.indexName() != null) {
      throw new ValidationException("The table does not have the specified index: " + request.indexName());
    }
    return ImmutableScanCommand.builder()
        .tableName(tableName(request.tableName()))
        .filter(condition(request.filterExpression()))
        .projection(projection(request.projectionExpression()))
        .bindings(bindings(request.expressionAttributeNames(), request.expressionAttributeValues()))
        .limit(Optional.ofNullable(request.limit()))
        .exclusiveStartKey(exclusiveStartKey(request.hasExclusiveStartKey(), request.exclusiveStartKey()))
        .segment(Optional.ofNullable(request.segment()))
        .totalSegments(Optional.ofNullable(request.totalSegments()))
        .select(select(request.select()))
        .build();
  }

  /**
   * Placeholder bindings from the request's expression attribute maps.
   *
   * @param names  the names, may be null
   * @param values the values, may be null
   * @return the placeholder bindings
   */
  public PlaceholderBindings bindings(
      final Map<String, String> names,
      final Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> values) {
    return ImmutablePlaceholderBindings.builder()
        .names(names == null ? Map.of() : names)
        .values(attributeValueConverter.toItem(values))
        .build();
  }

  /**
   * Projection of a list of attribute names, as legacy requests give them.
   *
   * @param attributesToGet the attributes to get
   * @return the projection expression
   */
  public ProjectionExpression projectionOf(final List<String> attributesToGet) {
    return ProjectionExpression.of(attributesToGet.stream().map(Path::of).toList());
  }

  private Optional<Condition> condition(final String expression) {
    return Optional.ofNullable(expression).map(conditionExpressionParser::parse);
  }

  /**
   * Parses a projection expression, when one is given.
   *
   * @param expression the expression, may be null
   * @return the optional
   */
  public Optional<ProjectionExpression> projection(final String expression) {
    return Optional.ofNullable(expression).map(projectionExpressionParser::parse);
  }

  private Optional<Map<String, AttributeValue>> exclusiveStartKey(
      final boolean present,
      final Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> key) {
    return present ? Optional.of(attributeValueConverter.toItem(key)) : Optional.empty();
  }

  private com.codeheadsystems.emulator.model.Select select(final Select select) {
    if (select == null) {
      return com.codeheadsystems.emulator.model.Select.ALL_ATTRIBUTES;
    }
    return switch (select) {
      case ALL_ATTRIBUTES, SPECIFIC_ATTRIBUTES -> com.codeheadsystems.emulator.model.Select.ALL_ATTRIBUTES;
      case COUNT -> com.codeheadsystems.emulator.model.Select.COUNT;
      default -> throw new ValidationException("1 validation error detected: Value '" + select
          + "' at 'select' failed to satisfy constraint: Member must satisfy enum value set: "
          + "[SPECIFIC_ATTRIBUTES, COUNT, ALL_ATTRIBUTES]");
    };
  }

  private String tableName(final String tableName) {
    if (tableName == null) {
      throw new ValidationException("1 validation error detected: Value null at 'tableName' failed to satisfy "
          + "constraint: Member must not be null");
    }
    return tableName;
  }
}
