package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.expression.ast.ArithmeticValue;
import com.codeheadsystems.emulator.expression.ast.IfNotExistsValue;
import com.codeheadsystems.emulator.expression.ast.ImmutableUpdateExpression;
import com.codeheadsystems.emulator.expression.ast.ListAppendValue;
import com.codeheadsystems.emulator.expression.ast.Operand;
import com.codeheadsystems.emulator.expression.ast.OperandValue;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.SetAction;
import com.codeheadsystems.emulator.expression.ast.SetOperandAction;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.UpdateExpression;
import com.codeheadsystems.emulator.expression.ast.UpdateValue;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import java.util.HashSet;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for update expressions.
 *
 * <pre>
 * update     = clause+
 * clause     = SET set_action ("," set_action)* | REMOVE path ("," path)*
 *            | ADD path :value ("," path :value)* | DELETE path :value ("," path :value)*
 * set_action = path "=" term [ ("+" | "-") term ]
 * term       = operand | if_not_exists(path, operand) | list_append(term, term)
 * </pre>
 * Each clause keyword may appear once.
 */
@Singleton
public class UpdateExpressionParser {

  private static final Logger log = LoggerFactory.getLogger(UpdateExpressionParser.class);

  private final ExpressionLexer lexer;

  /**
   * Instantiates a new Update expression parser.
   *
   * @param lexer the lexer
   */
  @Inject
  public UpdateExpressionParser(final ExpressionLexer lexer) {
    log.info("UpdateExpressionParser({})", lexer);
    this.lexer = lexer;
  }

  /**
   * Parse update expression.
   *
   * @param expression the expression
   * @return the update expression
   * @throws ExpressionParseException if the text does not match the grammar
   */
  public UpdateExpression parse(final String expression) {
    log.trace("parse({})", expression);
    if (expression == null || expression.isBlank()) {
      throw new ExpressionParseException("the expression can not be empty", "", 0);
    }
    final ExpressionCursor cursor = new ExpressionCursor(lexer.tokenize(expression));
    final ImmutableUpdateExpression.Builder builder = ImmutableUpdateExpression.builder();
    final Set<String> seen = new HashSet<>();
    while (!cursor.atEnd()) {
      final Token clause = cursor.peek();
      final String keyword = clause.text().toUpperCase();
      if (clause.type() != Token.Type.NAME
          || !Set.of("SET", "REMOVE", "ADD", "DELETE").contains(keyword)) {
        throw cursor.error("expected SET, REMOVE, ADD or DELETE");
      }
      if (!seen.add(keyword)) {
        throw cursor.error("the " + keyword + " section can only be used once in an update expression");
      }
      cursor.next();
      do {
        switch (keyword) {
          case "SET" -> builder.addSetActions(setAction(cursor));
          case "REMOVE" -> builder.addRemovePaths(cursor.path());
          case "ADD" -> builder.addAddActions(setOperandAction(cursor));
          default -> builder.addDeleteActions(setOperandAction(cursor));
        }
      } while (cursor.accept(Token.Type.COMMA));
    }
    return builder.build();
  }

  private SetAction setAction(final ExpressionCursor cursor) {
    final Path path = cursor.path();
    final Token equals = cursor.expect(Token.Type.COMPARATOR, "=");
    if (!equals.text().equals("=")) {
      throw cursor.error("expected =", equals);
    }
    UpdateValue value = term(cursor);
    if (cursor.peek().type() == Token.Type.PLUS || cursor.peek().type() == Token.Type.MINUS) {
      final ArithmeticValue.Operator operator = cursor.next().type() == Token.Type.PLUS
          ? ArithmeticValue.Operator.PLUS
          : ArithmeticValue.Operator.MINUS;
      value = ArithmeticValue.of(value, operator, term(cursor));
    }
    return SetAction.of(path, value);
  }

  private UpdateValue term(final ExpressionCursor cursor) {
    final Token token = cursor.peek();
    if (token.type() == Token.Type.NAME && cursor.peek(1).type() == Token.Type.LEFT_PAREN) {
      if (token.text().equals("if_not_exists")) {
        cursor.next();
        cursor.next();
        final Path path = cursor.path();
        cursor.expect(Token.Type.COMMA, ",");
        final UpdateValue fallback = OperandValue.of(plainOperand(cursor));
        cursor.expect(Token.Type.RIGHT_PAREN, ")");
        return IfNotExistsValue.of(path, fallback);
      }
      if (token.text().equals("list_append")) {
        cursor.next();
        cursor.next();
        final UpdateValue first = term(cursor);
        cursor.expect(Token.Type.COMMA, ",");
        final UpdateValue second = term(cursor);
        cursor.expect(Token.Type.RIGHT_PAREN, ")");
        return ListAppendValue.of(first, second);
      }
      if (!token.text().equals("size")) {
        throw cursor.error("invalid function name for an update expression");
      }
    }
    return OperandValue.of(plainOperand(cursor));
  }

  private Operand plainOperand(final ExpressionCursor cursor) {
    final Token start = cursor.peek();
    final Operand operand = cursor.operand();
    if (operand instanceof SizeOperand) {
      throw cursor.error("size() is not valid in an update expression", start);
    }
    return operand;
  }

  private SetOperandAction setOperandAction(final ExpressionCursor cursor) {
    final Path path = cursor.path();
    final Token value = cursor.expect(Token.Type.VALUE_PLACEHOLDER, "a value placeholder");
    return SetOperandAction.of(path, ValueOperand.of(value.text()));
  }
}
