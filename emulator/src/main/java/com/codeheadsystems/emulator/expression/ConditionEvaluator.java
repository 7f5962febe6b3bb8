package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.TypeMismatchException;
import com.codeheadsystems.emulator.exception.UnresolvedPlaceholderException;
import com.codeheadsystems.emulator.expression.ast.AndCondition;
import com.codeheadsystems.emulator.expression.ast.BetweenCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonCondition;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ConditionVisitor;
import com.codeheadsystems.emulator.expression.ast.FunctionCondition;
import com.codeheadsystems.emulator.expression.ast.Operand;
import com.codeheadsystems.emulator.expression.ast.OperandVisitor;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import com.codeheadsystems.emulator.model.ValueOrdering;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntPredicate;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a condition against one item.
 *
 * <p>Comparing values of different types, or reading an attribute the item does not have, makes
 * the condition false rather than failing. An unbound placeholder always fails, even on a branch
 * that AND would have skipped.
 */
@Singleton
public class ConditionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

  /**
   * Instantiates a new Condition evaluator.
   */
  @Inject
  public ConditionEvaluator() {
    log.info("ConditionEvaluator()");
  }

  /**
   * Evaluate boolean.
   *
   * @param condition the condition
   * @param item      the item, empty when there is none
   * @param bindings  the bindings
   * @return true if the condition holds
   * @throws UnresolvedPlaceholderException if the condition uses a placeholder with no binding
   * @throws TypeMismatchException          if a function is given an operand type it never accepts
   */
  public boolean evaluate(final Condition condition,
                          final Map<String, AttributeValue> item,
                          final PlaceholderBindings bindings) {
    log.trace("evaluate({}, {})", condition, item);
    ExpressionReferences.requireBound(ExpressionReferences.placeholders(condition), bindings);
    return condition.accept(new Evaluation(item, bindings));
  }

  /**
   * One evaluation of a condition against one item.
   */
  private static class Evaluation implements ConditionVisitor<Boolean>, OperandVisitor<Optional<AttributeValue>> {

    private final Map<String, AttributeValue> item;
    private final PlaceholderBindings bindings;

    Evaluation(final Map<String, AttributeValue> item, final PlaceholderBindings bindings) {
      this.item = item;
      this.bindings = bindings;
    }

    @Override
    public Boolean visitAnd(final AndCondition condition) {
      return condition.left().accept(this) && condition.right().accept(this);
    }

    @Override
    public Boolean visitComparison(final ComparisonCondition condition) {
      final Optional<AttributeValue> left = condition.left().accept(this);
      final Optional<AttributeValue> right = condition.right().accept(this);
      if (left.isEmpty() || right.isEmpty() || left.get().type() != right.get().type()) {
        return false;
      }
      return switch (condition.operator()) {
        case EQ -> left.get().equals(right.get());
        case NE -> !left.get().equals(right.get());
        case LT -> ordered(left.get(), right.get(), c -> c < 0);
        case LE -> ordered(left.get(), right.get(), c -> c <= 0);
        case GT -> ordered(left.get(), right.get(), c -> c > 0);
        case GE -> ordered(left.get(), right.get(), c -> c >= 0);
      };
    }

    @Override
    public Boolean visitBetween(final BetweenCondition condition) {
      final Optional<AttributeValue> value = condition.operand().accept(this);
      final Optional<AttributeValue> low = condition.low().accept(this);
      final Optional<AttributeValue> high = condition.high().accept(this);
      if (value.isEmpty() || low.isEmpty() || high.isEmpty()) {
        return false;
      }
      return ordered(value.get(), low.get(), c -> c >= 0) && ordered(value.get(), high.get(), c -> c <= 0);
    }

    @Override
    public Boolean visitFunction(final FunctionCondition condition) {
      final Operand first = condition.arguments().get(0);
      return switch (condition.function()) {
        case ATTRIBUTE_EXISTS -> first.accept(this).isPresent();
        case ATTRIBUTE_NOT_EXISTS -> first.accept(this).isEmpty();
        case ATTRIBUTE_TYPE -> attributeType(first, condition.arguments().get(1));
        case BEGINS_WITH -> beginsWith(first, condition.arguments().get(1));
        case CONTAINS -> contains(first, condition.arguments().get(1));
      };
    }

    @Override
    public Optional<AttributeValue> visitPath(final PathOperand operand) {
      return resolve(operand.path());
    }

    @Override
    public Optional<AttributeValue> visitValue(final ValueOperand operand) {
      return Optional.of(bindings.resolveValue(operand.placeholder()));
    }

    @Override
    public Optional<AttributeValue> visitSize(final SizeOperand operand) {
      return resolve(operand.path()).flatMap(this::size);
    }

    private Optional<AttributeValue> resolve(final Path path) {
      return DocumentPath.get(item, DocumentPath.resolve(path, bindings));
    }

    private Optional<AttributeValue> size(final AttributeValue value) {
      final Optional<Integer> size = switch (value.type()) {
        case S -> Optional.of(value.s().codePointCount(0, value.s().length()));
        case B -> Optional.of(value.b().asByteArray().length);
        case L -> Optional.of(value.l().size());
        case M -> Optional.of(value.m().size());
        case SS -> Optional.of(value.ss().size());
        case NS -> Optional.of(value.ns().size());
        case BS -> Optional.of(value.bs().size());
        default -> Optional.empty();
      };
      return size.map(n -> AttributeValue.fromN(BigDecimal.valueOf(n)));
    }

    private boolean ordered(final AttributeValue left,
                            final AttributeValue right,
                            final IntPredicate test) {
      final OptionalInt comparison = ValueOrdering.compare(left, right);
      return comparison.isPresent() && test.test(comparison.getAsInt());
    }

    private boolean attributeType(final Operand path, final Operand typeOperand) {
      final Optional<AttributeValue> typeOperandValue = typeOperand.accept(this);
      if (typeOperandValue.isEmpty()) {
        return false;
      }
      final AttributeValue typeName = typeOperandValue.get();
      final boolean known = typeName.type() == AttributeValue.Type.S
          && Arrays.stream(AttributeValue.Type.values()).anyMatch(t -> t.name().equals(typeName.s()));
      if (!known) {
        throw new TypeMismatchException("Invalid attribute type name found in type: " + typeName
            + ", valid types: {S, N, B, BOOL, NULL, L, M, SS, NS, BS}");
      }
      return path.accept(this).map(value -> value.type().name().equals(typeName.s())).orElse(false);
    }

    private boolean beginsWith(final Operand path, final Operand prefixOperand) {
      final Optional<AttributeValue> prefixValue = prefixOperand.accept(this);
      if (prefixValue.isEmpty()) {
        return false;
      }
      final AttributeValue prefix = prefixValue.get();
      if (prefix.type() != AttributeValue.Type.S && prefix.type() != AttributeValue.Type.B) {
        throw new TypeMismatchException("Incorrect operand type for operator or function; "
            + "operator or function: begins_with, operand type: " + prefix.type());
      }
      return path.accept(this).map(value -> ValueOrdering.startsWith(value, prefix)).orElse(false);
    }

    private boolean contains(final Operand path, final Operand needleOperand) {
      final Optional<AttributeValue> haystack = path.accept(this);
      final Optional<AttributeValue> needle = needleOperand.accept(this);
      if (haystack.isEmpty() || needle.isEmpty()) {
        return false;
      }
      final AttributeValue h = haystack.get();
      final AttributeValue n = needle.get();
      return switch (h.type()) {
        case S -> n.type() == AttributeValue.Type.S && h.s().contains(n.s());
        case SS -> n.type() == AttributeValue.Type.S && h.ss().contains(n.s());
        case NS -> n.type() == AttributeValue.Type.N
            && h.numbers().stream().anyMatch(member -> member.compareTo(n.number()) == 0);
        case BS -> n.type() == AttributeValue.Type.B && h.bs().contains(n.b());
        case L -> h.l().contains(n);
        default -> false;
      };
    }
  }
}
