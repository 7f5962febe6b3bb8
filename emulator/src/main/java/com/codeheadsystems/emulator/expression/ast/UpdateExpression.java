package com.codeheadsystems.emulator.expression.ast;

import java.util.List;
import java.util.stream.Stream;
import org.immutables.value.Value;

/**
 * A parsed update expression, grouped by clause.
 */
@Value.Immutable
public interface UpdateExpression {

  /**
   * SET actions.
   *
   * @return the list
   */
  List<SetAction> setActions();

  /**
   * REMOVE paths.
   *
   * @return the list
   */
  List<Path> removePaths();

  /**
   * ADD actions.
   *
   * @return the list
   */
  List<SetOperandAction> addActions();

  /**
   * DELETE actions.
   *
   * @return the list
   */
  List<SetOperandAction> deleteActions();

  /**
   * Every path the expression writes to, in clause order.
   *
   * @return the list
   */
  default List<Path> targetPaths() {
    return Stream.of(
            setActions().stream().map(SetAction::path),
            removePaths().stream(),
            addActions().stream().map(SetOperandAction::path),
            deleteActions().stream().map(SetOperandAction::path))
        .flatMap(s -> s)
        .toList();
  }
}
