package com.codeheadsystems.emulator.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One page of table names.
 */
@Value.Immutable
public interface TableList {

  /**
   * Table names list.
   *
   * @return the list
   */
  List<String> tableNames();

  /**
   * Name to continue after, present when more tables remain.
   *
   * @return the optional
   */
  Optional<String> lastEvaluatedTableName();
}
