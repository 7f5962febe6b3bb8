package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.expression.ast.AndCondition;
import com.codeheadsystems.emulator.expression.ast.BetweenCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonOperator;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ConditionFunction;
import com.codeheadsystems.emulator.expression.ast.FunctionCondition;
import com.codeheadsystems.emulator.expression.ast.Operand;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for condition, key condition and filter expressions.
 *
 * <p>Grammar:
 * <pre>
 * condition_expression = condition ( "AND" condition )*
 * condition  = operand comparator operand
 *            | operand "BETWEEN" operand "AND" operand
 *            | function "(" operand ( "," operand )* ")"
 * operand    = path | :value | size(path)
 * comparator = "=" | "&lt;&gt;" | "&lt;" | "&lt;=" | "&gt;" | "&gt;="
 * </pre>
 * AND is the only conjunction and groups pairwise from the left. OR, NOT and parentheses are
 * rejected.
 */
@Singleton
public class ConditionExpressionParser {

  private static final Logger log = LoggerFactory.getLogger(ConditionExpressionParser.class);

  private final ExpressionLexer lexer;

  /**
   * Instantiates a new Condition expression parser.
   *
   * @param lexer the lexer
   */
  @Inject
  public ConditionExpressionParser(final ExpressionLexer lexer) {
    log.info("ConditionExpressionParser({})", lexer);
    this.lexer = lexer;
  }

  /**
   * Parse condition.
   *
   * @param expression the expression text
   * @return the condition
   * @throws ExpressionParseException if the text does not match the grammar
   */
  public Condition parse(final String expression) {
    log.trace("parse({})", expression);
    if (expression == null || expression.isBlank()) {
      throw new ExpressionParseException("the expression can not be empty", "", 0);
    }
    final ExpressionCursor cursor = new ExpressionCursor(lexer.tokenize(expression));
    Condition result = condition(cursor);
    while (cursor.acceptKeyword("AND")) {
      result = AndCondition.of(result, condition(cursor));
    }
    if (cursor.peek().isKeyword("OR") || cursor.peek().isKeyword("NOT")) {
      throw cursor.error("operator not supported");
    }
    cursor.expectEnd();
    return result;
  }

  private Condition condition(final ExpressionCursor cursor) {
    final Token start = cursor.peek();
    if (start.isKeyword("NOT")) {
      throw cursor.error("operator not supported");
    }
    if (start.type() == Token.Type.NAME
        && cursor.peek(1).type() == Token.Type.LEFT_PAREN
        && !start.text().equals("size")) {
      return function(cursor);
    }
    final Operand left = cursor.operand();
    if (cursor.acceptKeyword("BETWEEN")) {
      final Operand low = cursor.operand();
      cursor.expectKeyword("AND");
      final Operand high = cursor.operand();
      return BetweenCondition.of(left, low, high);
    }
    if (cursor.peek().isKeyword("IN")) {
      throw cursor.error("operator not supported");
    }
    if (cursor.peek().type() == Token.Type.COMPARATOR) {
      final Token symbol = cursor.next();
      final ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol.text())
          .orElseThrow(() -> cursor.error("unknown comparator", symbol));
      return ComparisonCondition.of(left, operator, cursor.operand());
    }
    if (left instanceof SizeOperand) {
      throw cursor.error("size() is only valid as an operand of a comparison", start);
    }
    throw cursor.error("expected a comparator");
  }

  private Condition function(final ExpressionCursor cursor) {
    final Token name = cursor.next();
    final ConditionFunction function = ConditionFunction.fromName(name.text())
        .orElseThrow(() -> cursor.error("invalid function name", name));
    cursor.expect(Token.Type.LEFT_PAREN, "(");
    final List<Operand> arguments = new ArrayList<>();
    if (cursor.peek().type() != Token.Type.RIGHT_PAREN) {
      do {
        arguments.add(cursor.operand());
      } while (cursor.accept(Token.Type.COMMA));
    }
    cursor.expect(Token.Type.RIGHT_PAREN, ")");
    if (arguments.size() != function.arity()) {
      throw cursor.error("incorrect number of operands for function " + function.functionName(), name);
    }
    if (!(arguments.get(0) instanceof PathOperand)) {
      throw cursor.error("the first operand of " + function.functionName() + " must be an attribute path", name);
    }
    if ((function == ConditionFunction.ATTRIBUTE_TYPE || function == ConditionFunction.BEGINS_WITH)
        && !(arguments.get(1) instanceof ValueOperand)) {
      throw cursor.error("the second operand of " + function.functionName() + " must be a value", name);
    }
    if (function == ConditionFunction.CONTAINS && arguments.get(1) instanceof SizeOperand) {
      throw cursor.error("size() is not valid as an operand of contains", name);
    }
    return FunctionCondition.of(function, arguments);
  }
}
