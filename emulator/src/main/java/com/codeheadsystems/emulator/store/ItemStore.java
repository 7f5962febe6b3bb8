package com.codeheadsystems.emulator.store;

import com.codeheadsystems.emulator.expression.KeyRange;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PrimaryKey;
import com.codeheadsystems.emulator.model.TableSchema;
import com.codeheadsystems.emulator.model.ValueOrdering;
import com.codeheadsystems.emulator.util.ItemSizeCalculator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Items of one table: partitions ordered by partition key, items in a partition ordered by sort key.
 * Tables without a sort key hold at most one item per partition.
 *
 * <p>The accessors do no locking of their own. Callers wrap them in {@link #read(Supplier)} or
 * {@link #write(Supplier)} so that a check and the write that depends on it happen under one lock.
 */
public class ItemStore {

  private static final AttributeValue NO_SORT_KEY = AttributeValue.fromNull();

  private final TableSchema schema;
  private final ItemSizeCalculator sizeCalculator;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final NavigableMap<AttributeValue, NavigableMap<AttributeValue, Map<String, AttributeValue>>> partitions =
      new TreeMap<>(ValueOrdering.KEY_ORDER);
  private long itemCount;
  private long sizeBytes;

  /**
   * Instantiates a new Item store.
   *
   * @param schema         the schema
   * @param sizeCalculator the size calculator
   */
  public ItemStore(final TableSchema schema, final ItemSizeCalculator sizeCalculator) {
    this.schema = schema;
    this.sizeCalculator = sizeCalculator;
  }

  /**
   * Runs the work holding the shared lock.
   *
   * @param <T>  the result type
   * @param work the work
   * @return the result
   */
  public <T> T read(final Supplier<T> work) {
    lock.readLock().lock();
    try {
      return work.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Runs the work holding the exclusive lock.
   *
   * @param <T>  the result type
   * @param work the work
   * @return the result
   */
  public <T> T write(final Supplier<T> work) {
    lock.writeLock().lock();
    try {
      return work.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * The primary key of an item, or of a key map.
   *
   * @param item the item
   * @return the primary key
   */
  public PrimaryKey keyOf(final Map<String, AttributeValue> item) {
    return PrimaryKey.of(
        item.get(schema.partitionKey().attributeName()),
        schema.sortKey().map(sort -> item.get(sort.attributeName())));
  }

  /**
   * The key attributes of an item as a map, in schema order.
   *
   * @param item the item
   * @return the map
   */
  public Map<String, AttributeValue> keyMapOf(final Map<String, AttributeValue> item) {
    final Map<String, AttributeValue> key = new LinkedHashMap<>();
    for (String name : schema.keyNames()) {
      key.put(name, item.get(name));
    }
    return key;
  }

  /**
   * Get item.
   *
   * @param key the key
   * @return the optional
   */
  public Optional<Map<String, AttributeValue>> get(final PrimaryKey key) {
    return Optional.ofNullable(partitions.get(key.partitionValue()))
        .map(partition -> partition.get(sortValue(key)));
  }

  /**
   * Stores the item, replacing any item with the same key.
   *
   * @param item the item, already validated
   * @return the replaced item
   */
  public Optional<Map<String, AttributeValue>> put(final Map<String, AttributeValue> item) {
    final PrimaryKey key = keyOf(item);
    final Map<String, AttributeValue> stored = Collections.unmodifiableMap(new LinkedHashMap<>(item));
    final Map<String, AttributeValue> previous = partitions
        .computeIfAbsent(key.partitionValue(), k -> new TreeMap<>(ValueOrdering.KEY_ORDER))
        .put(sortValue(key), stored);
    if (previous == null) {
      itemCount++;
    } else {
      sizeBytes -= sizeCalculator.sizeOf(previous);
    }
    sizeBytes += sizeCalculator.sizeOf(stored);
    return Optional.ofNullable(previous);
  }

  /**
   * Removes the item with the key.
   *
   * @param key the key
   * @return the removed item
   */
  public Optional<Map<String, AttributeValue>> delete(final PrimaryKey key) {
    final NavigableMap<AttributeValue, Map<String, AttributeValue>> partition = partitions.get(key.partitionValue());
    if (partition == null) {
      return Optional.empty();
    }
    final Map<String, AttributeValue> removed = partition.remove(sortValue(key));
    if (partition.isEmpty()) {
      partitions.remove(key.partitionValue());
    }
    if (removed != null) {
      itemCount--;
      sizeBytes -= sizeCalculator.sizeOf(removed);
    }
    return Optional.ofNullable(removed);
  }

  /**
   * The items of one partition that the range selects, in ascending sort key order.
   *
   * @param range the range
   * @return the map keyed by sort value
   */
  public NavigableMap<AttributeValue, Map<String, AttributeValue>> range(final KeyRange range) {
    final NavigableMap<AttributeValue, Map<String, AttributeValue>> partition = partitions.get(range.partitionValue());
    if (partition == null) {
      return Collections.emptyNavigableMap();
    }
    NavigableMap<AttributeValue, Map<String, AttributeValue>> view = partition;
    if (range.lowerBound().isPresent()) {
      view = view.tailMap(range.lowerBound().get(), range.lowerInclusive());
    }
    if (range.upperBound().isPresent()) {
      view = view.headMap(range.upperBound().get(), range.upperInclusive());
    }
    if (range.prefix().isPresent()) {
      final AttributeValue prefix = range.prefix().get();
      view = view.tailMap(prefix, true);
      for (AttributeValue sortValue : view.keySet()) {
        if (!ValueOrdering.startsWith(sortValue, prefix)) {
          return view.headMap(sortValue, false);
        }
      }
    }
    return view;
  }

  /**
   * All partitions in partition key order.
   *
   * @return the map keyed by partition value
   */
  public NavigableMap<AttributeValue, NavigableMap<AttributeValue, Map<String, AttributeValue>>> partitions() {
    return Collections.unmodifiableNavigableMap(partitions);
  }

  /**
   * The sort key used inside a partition.
   *
   * @param key the key
   * @return the attribute value
   */
  public AttributeValue sortValue(final PrimaryKey key) {
    return key.sortValue().orElse(NO_SORT_KEY);
  }

  public long itemCount() {
    return itemCount;
  }

  public long sizeBytes() {
    return sizeBytes;
  }

  public TableSchema schema() {
    return schema;
  }
}
