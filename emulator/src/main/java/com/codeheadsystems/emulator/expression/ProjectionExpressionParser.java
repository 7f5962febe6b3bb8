package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for projection expressions: {@code path ("," path)*}.
 */
@Singleton
public class ProjectionExpressionParser {

  private static final Logger log = LoggerFactory.getLogger(ProjectionExpressionParser.class);

  private final ExpressionLexer lexer;

  /**
   * Instantiates a new Projection expression parser.
   *
   * @param lexer the lexer
   */
  @Inject
  public ProjectionExpressionParser(final ExpressionLexer lexer) {
    log.info("ProjectionExpressionParser({})", lexer);
    this.lexer = lexer;
  }

  /**
   * Parse projection expression.
   *
   * @param expression the expression
   * @return the projection expression
   * @throws ExpressionParseException if the text is not a list of paths
   */
  public ProjectionExpression parse(final String expression) {
    log.trace("parse({})", expression);
    if (expression == null || expression.isBlank()) {
      throw new ExpressionParseException("the expression can not be empty", "", 0);
    }
    final ExpressionCursor cursor = new ExpressionCursor(lexer.tokenize(expression));
    final List<Path> paths = new ArrayList<>();
    do {
      paths.add(cursor.path());
    } while (cursor.accept(Token.Type.COMMA));
    cursor.expectEnd();
    return ProjectionExpression.of(paths);
  }
}
