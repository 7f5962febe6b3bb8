package com.codeheadsystems.emulator.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One page of a query or scan.
 */
@Value.Immutable
public interface ItemPage {

  /**
   * Items that passed the filter. Empty for {@link Select#COUNT}.
   *
   * @return the list
   */
  List<Map<String, AttributeValue>> items();

  /**
   * Items that passed the filter.
   *
   * @return the int
   */
  int count();

  /**
   * Items examined before the filter.
   *
   * @return the int
   */
  int scannedCount();

  /**
   * Key of the last examined item, present when the page stopped before the end of the range.
   *
   * @return the optional
   */
  Optional<Map<String, AttributeValue>> lastEvaluatedKey();
}
