package com.codeheadsystems.emulator.manager;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ConditionEvaluator;
import com.codeheadsystems.emulator.expression.ExpressionReferences;
import com.codeheadsystems.emulator.expression.KeyConditionAnalyzer;
import com.codeheadsystems.emulator.expression.KeyRange;
import com.codeheadsystems.emulator.expression.Projector;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.model.ImmutableItemPage;
import com.codeheadsystems.emulator.model.ItemPage;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.PrimaryKey;
import com.codeheadsystems.emulator.model.QueryCommand;
import com.codeheadsystems.emulator.model.ScanCommand;
import com.codeheadsystems.emulator.model.Select;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.store.ItemStore;
import com.codeheadsystems.emulator.store.Table;
import com.codeheadsystems.emulator.util.ItemSizeCalculator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query and scan.
 *
 * <p>A page examines items in key order until the limit or the byte budget is reached. Items
 * examined count toward {@code scannedCount} whether or not they pass the filter. When items remain,
 * the key of the last examined item is returned so the next page starts right after it.
 */
@Singleton
public class QueryManager {

  private static final Logger log = LoggerFactory.getLogger(QueryManager.class);

  private static final int MAX_TOTAL_SEGMENTS = 1_000_000;

  private final TableManager tableManager;
  private final ItemValidator itemValidator;
  private final KeyConditionAnalyzer keyConditionAnalyzer;
  private final ConditionEvaluator conditionEvaluator;
  private final Projector projector;
  private final ItemSizeCalculator itemSizeCalculator;
  private final Configuration configuration;

  /**
   * Instantiates a new Query manager.
   *
   * @param tableManager         the table manager
   * @param itemValidator        the item validator
   * @param keyConditionAnalyzer the key condition analyzer
   * @param conditionEvaluator   the condition evaluator
   * @param projector            the projector
   * @param itemSizeCalculator   the item size calculator
   * @param configuration        the configuration
   */
  @Inject
  public QueryManager(final TableManager tableManager,
                      final ItemValidator itemValidator,
                      final KeyConditionAnalyzer keyConditionAnalyzer,
                      final ConditionEvaluator conditionEvaluator,
                      final Projector projector,
                      final ItemSizeCalculator itemSizeCalculator,
                      final Configuration configuration) {
    log.info("QueryManager({}, {}, {}, {}, {}, {}, {})", tableManager, itemValidator, keyConditionAnalyzer,
        conditionEvaluator, projector, itemSizeCalculator, configuration);
    this.tableManager = tableManager;
    this.itemValidator = itemValidator;
    this.keyConditionAnalyzer = keyConditionAnalyzer;
    this.conditionEvaluator = conditionEvaluator;
    this.projector = projector;
    this.itemSizeCalculator = itemSizeCalculator;
    this.configuration = configuration;
  }

  /**
   * Query one partition.
   *
   * @param command the command
   * @return the item page
   * @throws ValidationException if the key condition, filter, limit or start key is invalid
   */
  public ItemPage query(final QueryCommand command) {
    log.trace("query({})", command);
    final Table table = tableManager.getTable(command.tableName());
    final TableSchema schema = table.schema();
    final ItemStore store = table.itemStore();
    final KeyRange range = keyConditionAnalyzer.analyze(command.keyCondition(), schema, command.bindings());
    command.filter().ifPresent(filter -> checkFilterAvoidsKeys(filter, schema, command.bindings()));
    checkCommon(command.limit(), command.select(), command.projection());
    final Optional<PrimaryKey> start = startKey(schema, store, command.exclusiveStartKey());
    if (start.isPresent() && !start.get().partitionValue().equals(range.partitionValue())) {
      throw new ValidationException("The provided starting key is outside query boundaries based on provided conditions");
    }
    return store.read(() -> {
      NavigableMap<AttributeValue, Map<String, AttributeValue>> view = store.range(range);
      if (!command.scanForward()) {
        view = view.descendingMap();
      }
      if (start.isPresent()) {
        view = view.tailMap(store.sortValue(start.get()), false);
      }
      return page(view.values().iterator(), store, command.filter(), command.projection(), command.bindings(),
          command.limit(), command.select());
    });
  }

  /**
   * Scan the table, or one segment of it.
   *
   * @param command the command
   * @return the item page
   * @throws ValidationException if the limit, segments or start key are invalid
   */
  public ItemPage scan(final ScanCommand command) {
    log.trace("scan({})", command);
    final Table table = tableManager.getTable(command.tableName());
    final ItemStore store = table.itemStore();
    checkCommon(command.limit(), command.select(), command.projection());
    checkSegments(command.segment(), command.totalSegments());
    command.filter().ifPresent(filter ->
        ExpressionReferences.requireBound(ExpressionReferences.placeholders(filter), command.bindings()));
    final Optional<PrimaryKey> start = startKey(table.schema(), store, command.exclusiveStartKey());
    return store.read(() -> {
      final NavigableMap<AttributeValue, NavigableMap<AttributeValue, Map<String, AttributeValue>>> partitions =
          store.partitions();
      final Stream<Map<String, AttributeValue>> items;
      if (start.isPresent()) {
        final AttributeValue startPartition = start.get().partitionValue();
        final NavigableMap<AttributeValue, Map<String, AttributeValue>> first = partitions.get(startPartition);
        items = Stream.concat(
            first == null ? Stream.empty() : first.tailMap(store.sortValue(start.get()), false).values().stream(),
            itemsOf(partitions.tailMap(startPartition, false), command));
      } else {
        items = itemsOf(partitions, command);
      }
      return page(items.iterator(), store, command.filter(), command.projection(), command.bindings(),
          command.limit(), command.select());
    });
  }

  private Stream<Map<String, AttributeValue>> itemsOf(
      final NavigableMap<AttributeValue, NavigableMap<AttributeValue, Map<String, AttributeValue>>> partitions,
      final ScanCommand command) {
    return partitions.entrySet().stream()
        .filter(entry -> inSegment(entry.getKey(), command))
        .flatMap(entry -> entry.getValue().values().stream());
  }

  private boolean inSegment(final AttributeValue partitionValue, final ScanCommand command) {
    if (command.totalSegments().isEmpty()) {
      return true;
    }
    return Math.floorMod(partitionValue.hashCode(), command.totalSegments().get()) == command.segment().orElseThrow();
  }

  private ItemPage page(final Iterator<Map<String, AttributeValue>> candidates,
                        final ItemStore store,
                        final Optional<Condition> filter,
                        final Optional<ProjectionExpression> projection,
                        final PlaceholderBindings bindings,
                        final Optional<Integer> limit,
                        final Select select) {
    final List<Map<String, AttributeValue>> items = new ArrayList<>();
    int scanned = 0;
    int matched = 0;
    long bytes = 0;
    Map<String, AttributeValue> lastEvaluated = null;
    boolean truncated = false;
    while (candidates.hasNext()) {
      if ((limit.isPresent() && scanned >= limit.get()) || bytes >= configuration.maxPageSizeBytes()) {
        truncated = true;
        break;
      }
      final Map<String, AttributeValue> item = candidates.next();
      scanned++;
      bytes += itemSizeCalculator.sizeOf(item);
      lastEvaluated = item;
      if (filter.isPresent() && !conditionEvaluator.evaluate(filter.get(), item, bindings)) {
        continue;
      }
      matched++;
      if (select != Select.COUNT) {
        items.add(projection.map(p -> projector.project(item, p, bindings)).orElse(item));
      }
    }
    log.debug("page: scanned {}, matched {}, truncated {}", scanned, matched, truncated);
    final ImmutableItemPage.Builder builder = ImmutableItemPage.builder()
        .items(items)
        .count(matched)
        .scannedCount(scanned);
    if (truncated && lastEvaluated != null) {
      builder.lastEvaluatedKey(store.keyMapOf(lastEvaluated));
    }
    return builder.build();
  }

  private Optional<PrimaryKey> startKey(final TableSchema schema,
                                        final ItemStore store,
                                        final Optional<Map<String, AttributeValue>> exclusiveStartKey) {
    return exclusiveStartKey.map(key -> {
      itemValidator.validateExclusiveStartKey(schema, key);
      return store.keyOf(key);
    });
  }

  private void checkCommon(final Optional<Integer> limit,
                           final Select select,
                           final Optional<ProjectionExpression> projection) {
    if (limit.isPresent() && limit.get() < 1) {
      throw new ValidationException("1 validation error detected: Value '" + limit.get()
          + "' at 'limit' failed to satisfy constraint: Member must have value greater than or equal to 1");
    }
    if (select == Select.COUNT && projection.isPresent()) {
      throw new ValidationException("Cannot specify the ProjectionExpression when choosing to get only the Count");
    }
  }

  private void checkSegments(final Optional<Integer> segment, final Optional<Integer> totalSegments) {
    if (segment.isPresent() != totalSegments.isPresent()) {
      throw new ValidationException("The Segment parameter and the TotalSegments parameter must be given together");
    }
    if (totalSegments.isPresent()) {
      final int total = totalSegments.get();
      if (total < 1 || total > MAX_TOTAL_SEGMENTS) {
        throw new ValidationException("1 validation error detected: Value '" + total
            + "' at 'totalSegments' failed to satisfy constraint: Member must have value between 1 and 1000000");
      }
      if (segment.get() < 0 || segment.get() >= total) {
        throw new ValidationException("The Segment parameter is zero-based and must be less than parameter "
            + "TotalSegments: Segment: " + segment.get() + " is not less than TotalSegments: " + total);
      }
    }
  }

  private void checkFilterAvoidsKeys(final Condition filter, final TableSchema schema, final PlaceholderBindings bindings) {
    ExpressionReferences.requireBound(ExpressionReferences.placeholders(filter), bindings);
    for (Path path : ExpressionReferences.paths(filter)) {
      final String attribute = bindings.resolveName(path.head().name().orElseThrow());
      if (schema.keyNames().contains(attribute)) {
        throw new ValidationException("Filter Expression can only contain non-primary key attributes: "
            + "Primary key attribute: " + attribute);
      }
    }
  }
}
