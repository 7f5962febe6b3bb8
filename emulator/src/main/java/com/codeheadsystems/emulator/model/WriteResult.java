package com.codeheadsystems.emulator.model;

import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Item images around a write.
 */
@Value.Immutable
public interface WriteResult {

  Optional<Map<String, AttributeValue>> oldItem();

  Optional<Map<String, AttributeValue>> newItem();
}
