package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.model.AttributeValue;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The partition and contiguous sort key range a key condition selects. With no bounds and no
 * prefix, the whole partition is selected.
 */
@Value.Immutable
public interface KeyRange {

  AttributeValue partitionValue();

  Optional<AttributeValue> lowerBound();

  @Value.Default
  default boolean lowerInclusive() {
    return true;
  }

  Optional<AttributeValue> upperBound();

  @Value.Default
  default boolean upperInclusive() {
    return true;
  }

  /**
   * begins_with prefix on the sort key.
   *
   * @return the optional
   */
  Optional<AttributeValue> prefix();
}
