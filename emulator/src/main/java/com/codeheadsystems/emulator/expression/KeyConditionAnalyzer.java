package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ast.AndCondition;
import com.codeheadsystems.emulator.expression.ast.BetweenCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonOperator;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ConditionFunction;
import com.codeheadsystems.emulator.expression.ast.FunctionCondition;
import com.codeheadsystems.emulator.expression.ast.Operand;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import com.codeheadsystems.emulator.model.AttributeDefinition;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.ScalarType;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.ValueOrdering;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a key condition into a {@link KeyRange}.
 *
 * <p>A key condition is {@code pk = :v}, optionally ANDed with one sort key condition: a comparator
 * other than {@code <>}, BETWEEN, or begins_with. Anything else is rejected.
 */
@Singleton
public class KeyConditionAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(KeyConditionAnalyzer.class);

  /**
   * Instantiates a new Key condition analyzer.
   */
  @Inject
  public KeyConditionAnalyzer() {
    log.info("KeyConditionAnalyzer()");
  }

  /**
   * Analyze key range.
   *
   * @param keyCondition the key condition
   * @param schema       the table schema
   * @param bindings     the bindings
   * @return the key range
   * @throws ValidationException if the condition is not a valid key condition for the schema
   */
  public KeyRange analyze(final Condition keyCondition,
                          final TableSchema schema,
                          final PlaceholderBindings bindings) {
    log.trace("analyze({}, {})", keyCondition, schema.tableName());
    ExpressionReferences.requireBound(ExpressionReferences.placeholders(keyCondition), bindings);
    final List<Condition> parts = new ArrayList<>();
    flatten(keyCondition, parts);
    if (parts.size() > 2) {
      throw new ValidationException("Invalid KeyConditionExpression: Conditions can be of length 1 or 2 only");
    }
    final AttributeDefinition partitionKey = schema.partitionKey();
    final Optional<AttributeDefinition> sortKey = schema.sortKey();
    AttributeValue partitionValue = null;
    ImmutableKeyRange.Builder range = null;
    for (Condition part : parts) {
      final String attribute = keyAttribute(part, bindings);
      if (attribute.equals(partitionKey.attributeName())) {
        if (partitionValue != null) {
          throw new ValidationException("KeyConditionExpressions must only contain one condition per key");
        }
        partitionValue = partitionValue(part, partitionKey, bindings);
      } else if (sortKey.isPresent() && attribute.equals(sortKey.get().attributeName())) {
        if (range != null) {
          throw new ValidationException("KeyConditionExpressions must only contain one condition per key");
        }
        range = sortRange(part, sortKey.get(), bindings);
      } else {
        throw new ValidationException("Query condition missed key schema element: "
            + partitionKey.attributeName());
      }
    }
    if (partitionValue == null) {
      throw new ValidationException("Query condition missed key schema element: " + partitionKey.attributeName());
    }
    return (range == null ? ImmutableKeyRange.builder() : range)
        .partitionValue(partitionValue)
        .build();
  }

  private void flatten(final Condition condition, final List<Condition> parts) {
    if (condition instanceof AndCondition) {
      final AndCondition and = (AndCondition) condition;
      flatten(and.left(), parts);
      flatten(and.right(), parts);
    } else {
      parts.add(condition);
    }
  }

  private String keyAttribute(final Condition condition, final PlaceholderBindings bindings) {
    final Operand subject;
    if (condition instanceof ComparisonCondition) {
      subject = ((ComparisonCondition) condition).left();
    } else if (condition instanceof BetweenCondition) {
      subject = ((BetweenCondition) condition).operand();
    } else if (condition instanceof FunctionCondition
        && ((FunctionCondition) condition).function() == ConditionFunction.BEGINS_WITH) {
      subject = ((FunctionCondition) condition).arguments().get(0);
    } else {
      throw new ValidationException("Invalid operator used in KeyConditionExpression: " + describe(condition));
    }
    if (!(subject instanceof PathOperand) || ((PathOperand) subject).path().elements().size() != 1) {
      throw new ValidationException("Invalid KeyConditionExpression: key conditions must name a top level key attribute");
    }
    return bindings.resolveName(((PathOperand) subject).path().head().name().orElseThrow());
  }

  private AttributeValue partitionValue(final Condition condition,
                                        final AttributeDefinition partitionKey,
                                        final PlaceholderBindings bindings) {
    if (!(condition instanceof ComparisonCondition)
        || ((ComparisonCondition) condition).operator() != ComparisonOperator.EQ) {
      throw new ValidationException("Query key condition not supported");
    }
    return keyValue(((ComparisonCondition) condition).right(), partitionKey, bindings);
  }

  private ImmutableKeyRange.Builder sortRange(final Condition condition,
                                              final AttributeDefinition sortKey,
                                              final PlaceholderBindings bindings) {
    final ImmutableKeyRange.Builder builder = ImmutableKeyRange.builder();
    if (condition instanceof BetweenCondition) {
      final BetweenCondition between = (BetweenCondition) condition;
      final AttributeValue low = keyValue(between.low(), sortKey, bindings);
      final AttributeValue high = keyValue(between.high(), sortKey, bindings);
      if (ValueOrdering.KEY_ORDER.compare(low, high) > 0) {
        throw new ValidationException("Invalid KeyConditionExpression: The BETWEEN operator requires upper bound "
            + "to be greater than or equal to lower bound; lower bound operand: AttributeValue: " + low
            + ", upper bound operand: AttributeValue: " + high);
      }
      return builder.lowerBound(low).upperBound(high);
    }
    if (condition instanceof FunctionCondition) {
      if (sortKey.attributeType() == ScalarType.N) {
        throw new ValidationException("Invalid KeyConditionExpression: Incorrect operand type for operator "
            + "or function; operator or function: begins_with, operand type: N");
      }
      return builder.prefix(keyValue(((FunctionCondition) condition).arguments().get(1), sortKey, bindings));
    }
    final ComparisonCondition comparison = (ComparisonCondition) condition;
    final AttributeValue value = keyValue(comparison.right(), sortKey, bindings);
    return switch (comparison.operator()) {
      case EQ -> builder.lowerBound(value).upperBound(value);
      case LT -> builder.upperBound(value).upperInclusive(false);
      case LE -> builder.upperBound(value);
      case GT -> builder.lowerBound(value).lowerInclusive(false);
      case GE -> builder.lowerBound(value);
      case NE -> throw new ValidationException("Unsupported operator on KeyConditionExpression: operator: <>");
    };
  }

  private AttributeValue keyValue(final Operand operand,
                                  final AttributeDefinition key,
                                  final PlaceholderBindings bindings) {
    if (!(operand instanceof ValueOperand)) {
      throw new ValidationException("Invalid KeyConditionExpression: key values must be expression attribute values");
    }
    final AttributeValue value = bindings.resolveValue(((ValueOperand) operand).placeholder());
    if (!key.attributeType().matches(value)) {
      throw new ValidationException("One or more parameter values were invalid: "
          + "Condition parameter type does not match schema type");
    }
    return value;
  }

  private String describe(final Condition condition) {
    if (condition instanceof FunctionCondition) {
      return ((FunctionCondition) condition).function().functionName();
    }
    return condition.getClass().getSimpleName();
  }
}
