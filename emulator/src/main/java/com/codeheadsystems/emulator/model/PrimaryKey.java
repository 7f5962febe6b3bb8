package com.codeheadsystems.emulator.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The key values identifying one item.
 */
@Value.Immutable
public interface PrimaryKey {

  /**
   * Of primary key.
   *
   * @param partitionValue the partition value
   * @param sortValue      the sort value
   * @return the primary key
   */
  static PrimaryKey of(final AttributeValue partitionValue, final Optional<AttributeValue> sortValue) {
    return ImmutablePrimaryKey.builder().partitionValue(partitionValue).sortValue(sortValue).build();
  }

  /**
   * Partition value.
   *
   * @return the attribute value
   */
  AttributeValue partitionValue();

  /**
   * Sort value.
   *
   * @return the optional
   */
  Optional<AttributeValue> sortValue();
}
