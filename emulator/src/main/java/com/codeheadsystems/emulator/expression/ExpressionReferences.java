package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.expression.ast.AndCondition;
import com.codeheadsystems.emulator.expression.ast.ArithmeticValue;
import com.codeheadsystems.emulator.expression.ast.BetweenCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonCondition;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ConditionVisitor;
import com.codeheadsystems.emulator.expression.ast.FunctionCondition;
import com.codeheadsystems.emulator.expression.ast.IfNotExistsValue;
import com.codeheadsystems.emulator.expression.ast.ListAppendValue;
import com.codeheadsystems.emulator.expression.ast.OperandValue;
import com.codeheadsystems.emulator.expression.ast.OperandVisitor;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import com.codeheadsystems.emulator.expression.ast.SetAction;
import com.codeheadsystems.emulator.expression.ast.SetOperandAction;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.UpdateExpression;
import com.codeheadsystems.emulator.expression.ast.UpdateValueVisitor;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects what an expression refers to: the placeholders it uses and the attribute paths it reads.
 */
public final class ExpressionReferences {

  private ExpressionReferences() {
  }

  /**
   * Placeholders in a condition, in order of appearance.
   *
   * @param condition the condition
   * @return the set
   */
  public static Set<String> placeholders(final Condition condition) {
    final Collector collector = new Collector();
    condition.accept(collector);
    return collector.placeholders;
  }

  /**
   * Placeholders in an update expression.
   *
   * @param update the update
   * @return the set
   */
  public static Set<String> placeholders(final UpdateExpression update) {
    final Collector collector = new Collector();
    for (SetAction action : update.setActions()) {
      collector.addPath(action.path());
      action.value().accept(collector);
    }
    update.removePaths().forEach(collector::addPath);
    for (SetOperandAction action : update.addActions()) {
      collector.addPath(action.path());
      action.value().accept(collector);
    }
    for (SetOperandAction action : update.deleteActions()) {
      collector.addPath(action.path());
      action.value().accept(collector);
    }
    return collector.placeholders;
  }

  /**
   * Placeholders in a projection.
   *
   * @param projection the projection
   * @return the set
   */
  public static Set<String> placeholders(final ProjectionExpression projection) {
    final Collector collector = new Collector();
    projection.paths().forEach(collector::addPath);
    return collector.placeholders;
  }

  /**
   * Attribute paths a condition reads.
   *
   * @param condition the condition
   * @return the list
   */
  public static List<Path> paths(final Condition condition) {
    final Collector collector = new Collector();
    condition.accept(collector);
    return collector.paths;
  }

  /**
   * Fails on the first placeholder that has no binding.
   *
   * @param placeholders the placeholders
   * @param bindings     the bindings
   */
  public static void requireBound(final Set<String> placeholders, final PlaceholderBindings bindings) {
    for (String placeholder : placeholders) {
      if (placeholder.startsWith("#")) {
        bindings.resolveName(placeholder);
      } else {
        bindings.resolveValue(placeholder);
      }
    }
  }

  private static class Collector
      implements ConditionVisitor<Void>, OperandVisitor<Void>, UpdateValueVisitor<Void> {

    private final Set<String> placeholders = new LinkedHashSet<>();
    private final List<Path> paths = new ArrayList<>();

    void addPath(final Path path) {
      paths.add(path);
      path.elements().stream()
          .flatMap(element -> element.name().stream())
          .filter(name -> name.startsWith("#"))
          .forEach(placeholders::add);
    }

    @Override
    public Void visitAnd(final AndCondition condition) {
      condition.left().accept(this);
      condition.right().accept(this);
      return null;
    }

    @Override
    public Void visitComparison(final ComparisonCondition condition) {
      condition.left().accept(this);
      condition.right().accept(this);
      return null;
    }

    @Override
    public Void visitBetween(final BetweenCondition condition) {
      condition.operand().accept(this);
      condition.low().accept(this);
      condition.high().accept(this);
      return null;
    }

    @Override
    public Void visitFunction(final FunctionCondition condition) {
      condition.arguments().forEach(argument -> argument.accept(this));
      return null;
    }

    @Override
    public Void visitPath(final PathOperand operand) {
      addPath(operand.path());
      return null;
    }

    @Override
    public Void visitValue(final ValueOperand operand) {
      placeholders.add(operand.placeholder());
      return null;
    }

    @Override
    public Void visitSize(final SizeOperand operand) {
      addPath(operand.path());
      return null;
    }

    @Override
    public Void visitOperand(final OperandValue value) {
      return value.operand().accept(this);
    }

    @Override
    public Void visitArithmetic(final ArithmeticValue value) {
      value.left().accept(this);
      value.right().accept(this);
      return null;
    }

    @Override
    public Void visitIfNotExists(final IfNotExistsValue value) {
      addPath(value.path());
      value.fallback().accept(this);
      return null;
    }

    @Override
    public Void visitListAppend(final ListAppendValue value) {
      value.first().accept(this);
      value.second().accept(this);
      return null;
    }
  }
}
