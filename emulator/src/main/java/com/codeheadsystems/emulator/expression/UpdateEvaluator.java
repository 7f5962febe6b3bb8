package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ast.ArithmeticValue;
import com.codeheadsystems.emulator.expression.ast.IfNotExistsValue;
import com.codeheadsystems.emulator.expression.ast.ListAppendValue;
import com.codeheadsystems.emulator.expression.ast.OperandValue;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathElement;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.SetAction;
import com.codeheadsystems.emulator.expression.ast.SetOperandAction;
import com.codeheadsystems.emulator.expression.ast.UpdateExpression;
import com.codeheadsystems.emulator.expression.ast.UpdateValueVisitor;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an update expression to an item, returning the new item. The input is not modified.
 *
 * <p>Every right hand side of SET is computed from the item as it was before the update, as are
 * ADD and DELETE. Target paths may not overlap.
 */
@Singleton
public class UpdateEvaluator {

  private static final Logger log = LoggerFactory.getLogger(UpdateEvaluator.class);

  private static final String INCORRECT_DATA_TYPE = "An operand in the update expression has an incorrect data type";

  /**
   * Orders sibling list indexes high to low so removing one does not shift the next.
   */
  private static final Comparator<List<PathElement>> REMOVAL_ORDER = (left, right) -> {
    for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
      final PathElement a = left.get(i);
      final PathElement b = right.get(i);
      final int c = a.isIndex() && b.isIndex()
          ? Integer.compare(b.index().orElseThrow(), a.index().orElseThrow())
          : a.text().compareTo(b.text());
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(left.size(), right.size());
  };

  /**
   * Instantiates a new Update evaluator.
   */
  @Inject
  public UpdateEvaluator() {
    log.info("UpdateEvaluator()");
  }

  /**
   * Apply the update.
   *
   * @param update   the update
   * @param item     the current item, or just the key when the item does not exist
   * @param bindings the bindings
   * @return the updated item
   * @throws ValidationException for overlapping paths, wrong operand types or invalid document paths
   */
  public Map<String, AttributeValue> apply(final UpdateExpression update,
                                           final Map<String, AttributeValue> item,
                                           final PlaceholderBindings bindings) {
    log.trace("apply({}, {})", update, item);
    ExpressionReferences.requireBound(ExpressionReferences.placeholders(update), bindings);
    checkOverlap(update, bindings);

    final Map<String, AttributeValue> result = new LinkedHashMap<>(item);
    final ValueComputation computation = new ValueComputation(item, bindings);
    for (SetAction action : update.setActions()) {
      DocumentPath.set(result, DocumentPath.resolve(action.path(), bindings), action.value().accept(computation));
    }
    update.removePaths().stream()
        .map(path -> DocumentPath.resolve(path, bindings))
        .sorted(REMOVAL_ORDER)
        .forEach(elements -> DocumentPath.remove(result, elements));
    for (SetOperandAction action : update.addActions()) {
      add(result, DocumentPath.resolve(action.path(), bindings), bindings.resolveValue(action.value().placeholder()));
    }
    for (SetOperandAction action : update.deleteActions()) {
      delete(result, DocumentPath.resolve(action.path(), bindings), bindings.resolveValue(action.value().placeholder()));
    }
    return result;
  }

  private void checkOverlap(final UpdateExpression update, final PlaceholderBindings bindings) {
    final List<List<PathElement>> targets = new ArrayList<>();
    for (Path path : update.targetPaths()) {
      final List<PathElement> resolved = DocumentPath.resolve(path, bindings);
      for (List<PathElement> other : targets) {
        final int shared = Math.min(other.size(), resolved.size());
        if (other.subList(0, shared).equals(resolved.subList(0, shared))) {
          throw new ValidationException("Invalid UpdateExpression: Two document paths overlap with each other; "
              + "must remove or rewrite one of these paths; path one: " + DocumentPath.render(other)
              + ", path two: " + DocumentPath.render(resolved));
        }
      }
      targets.add(resolved);
    }
  }

  private void add(final Map<String, AttributeValue> item,
                   final List<PathElement> path,
                   final AttributeValue value) {
    final AttributeValue existing = DocumentPath.get(item, path).orElse(null);
    if (value.type() == AttributeValue.Type.N) {
      if (existing == null) {
        DocumentPath.set(item, path, value);
      } else if (existing.type() == AttributeValue.Type.N) {
        DocumentPath.set(item, path, AttributeValue.fromN(existing.number().add(value.number())));
      } else {
        throw new ValidationException(INCORRECT_DATA_TYPE);
      }
    } else if (value.isSet()) {
      if (existing == null) {
        DocumentPath.set(item, path, value);
      } else if (existing.type() == value.type()) {
        DocumentPath.set(item, path, union(existing, value));
      } else {
        throw new ValidationException(INCORRECT_DATA_TYPE);
      }
    } else {
      throw new ValidationException("Incorrect operand type for operator or function; operator: ADD, operand type: "
          + value.type());
    }
  }

  private void delete(final Map<String, AttributeValue> item,
                      final List<PathElement> path,
                      final AttributeValue value) {
    if (!value.isSet()) {
      throw new ValidationException("Incorrect operand type for operator or function; operator: DELETE, operand type: "
          + value.type());
    }
    final AttributeValue existing = DocumentPath.get(item, path).orElse(null);
    if (existing == null) {
      return;
    }
    if (existing.type() != value.type()) {
      throw new ValidationException(INCORRECT_DATA_TYPE);
    }
    final List<AttributeValue> remaining = members(existing).stream()
        .filter(member -> !members(value).contains(member))
        .toList();
    if (remaining.isEmpty()) {
      DocumentPath.remove(item, path);
    } else {
      DocumentPath.set(item, path, fromMembers(existing.type(), remaining));
    }
  }

  private AttributeValue union(final AttributeValue existing, final AttributeValue added) {
    final Set<AttributeValue> members = new LinkedHashSet<>(members(existing));
    members.addAll(members(added));
    return fromMembers(existing.type(), new ArrayList<>(members));
  }

  // Set members as scalar values, so numbers compare numerically.
  private List<AttributeValue> members(final AttributeValue set) {
    return switch (set.type()) {
      case SS -> set.ss().stream().map(AttributeValue::fromS).toList();
      case NS -> set.ns().stream().map(AttributeValue::fromN).toList();
      case BS -> set.bs().stream().map(AttributeValue::fromB).toList();
      default -> throw new IllegalArgumentException("Not a set: " + set);
    };
  }

  private AttributeValue fromMembers(final AttributeValue.Type type, final List<AttributeValue> members) {
    return switch (type) {
      case SS -> AttributeValue.fromSs(members.stream().map(AttributeValue::s).collect(Collectors.toList()));
      case NS -> AttributeValue.fromNs(members.stream().map(AttributeValue::n).collect(Collectors.toList()));
      case BS -> AttributeValue.fromBs(members.stream().map(AttributeValue::b).collect(Collectors.toList()));
      default -> throw new IllegalArgumentException("Not a set type: " + type);
    };
  }

  /**
   * Computes SET right hand sides against the original item.
   */
  private static class ValueComputation implements UpdateValueVisitor<AttributeValue> {

    private final Map<String, AttributeValue> item;
    private final PlaceholderBindings bindings;

    ValueComputation(final Map<String, AttributeValue> item, final PlaceholderBindings bindings) {
      this.item = item;
      this.bindings = bindings;
    }

    @Override
    public AttributeValue visitOperand(final OperandValue value) {
      if (value.operand() instanceof ValueOperand) {
        return bindings.resolveValue(((ValueOperand) value.operand()).placeholder());
      }
      final Path path = ((PathOperand) value.operand()).path();
      return DocumentPath.get(item, DocumentPath.resolve(path, bindings))
          .orElseThrow(() -> new ValidationException(
              "The provided expression refers to an attribute that does not exist in the item"));
    }

    @Override
    public AttributeValue visitArithmetic(final ArithmeticValue value) {
      final AttributeValue left = value.left().accept(this);
      final AttributeValue right = value.right().accept(this);
      if (left.type() != AttributeValue.Type.N || right.type() != AttributeValue.Type.N) {
        throw new ValidationException(INCORRECT_DATA_TYPE);
      }
      final BigDecimal result = value.operator() == ArithmeticValue.Operator.PLUS
          ? left.number().add(right.number())
          : left.number().subtract(right.number());
      return AttributeValue.fromN(result);
    }

    @Override
    public AttributeValue visitIfNotExists(final IfNotExistsValue value) {
      return DocumentPath.get(item, DocumentPath.resolve(value.path(), bindings))
          .orElseGet(() -> value.fallback().accept(this));
    }

    @Override
    public AttributeValue visitListAppend(final ListAppendValue value) {
      final AttributeValue first = value.first().accept(this);
      final AttributeValue second = value.second().accept(this);
      if (first.type() != AttributeValue.Type.L || second.type() != AttributeValue.Type.L) {
        throw new ValidationException(INCORRECT_DATA_TYPE);
      }
      final List<AttributeValue> combined = new ArrayList<>(first.l());
      combined.addAll(second.l());
      return AttributeValue.fromL(combined);
    }
  }
}
