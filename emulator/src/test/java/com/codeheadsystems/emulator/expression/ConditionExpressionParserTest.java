package com.codeheadsystems.emulator.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.expression.ast.AndCondition;
import com.codeheadsystems.emulator.expression.ast.BetweenCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonCondition;
import com.codeheadsystems.emulator.expression.ast.ComparisonOperator;
import com.codeheadsystems.emulator.expression.ast.Condition;
import com.codeheadsystems.emulator.expression.ast.ConditionFunction;
import com.codeheadsystems.emulator.expression.ast.FunctionCondition;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathElement;
import com.codeheadsystems.emulator.expression.ast.PathOperand;
import com.codeheadsystems.emulator.expression.ast.SizeOperand;
import com.codeheadsystems.emulator.expression.ast.ValueOperand;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConditionExpressionParserTest {

  private ConditionExpressionParser parser;

  @BeforeEach
  void setup() {
    parser = new ConditionExpressionParser(new ExpressionLexer());
  }

  @Test
  void parse_simpleComparison() {
    assertThat(parser.parse("#a = :v"))
        .isEqualTo(ComparisonCondition.of(PathOperand.of(Path.of("#a")), ComparisonOperator.EQ, ValueOperand.of(":v")));
  }

  @Test
  void parse_everyComparator() {
    for (ComparisonOperator operator : ComparisonOperator.values()) {
      final Condition condition = parser.parse("a " + operator.symbol() + " :v");
      assertThat(condition).isInstanceOf(ComparisonCondition.class);
      assertThat(((ComparisonCondition) condition).operator()).isEqualTo(operator);
    }
  }

  @Test
  void parse_missingRightOperand_fails() {
    assertThatThrownBy(() -> parser.parse("#a ="))
        .isInstanceOf(ExpressionParseException.class)
        .hasFieldOrPropertyWithValue("fragment", "<end of expression>")
        .hasFieldOrPropertyWithValue("position", 4);
  }

  @Test
  void parse_empty_fails() {
    assertThatThrownBy(() -> parser.parse(" "))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("can not be empty");
  }

  @Test
  void parse_andGroupsFromTheLeft() {
    final Condition a = ComparisonCondition.of(PathOperand.of(Path.of("a")), ComparisonOperator.EQ, ValueOperand.of(":a"));
    final Condition b = ComparisonCondition.of(PathOperand.of(Path.of("b")), ComparisonOperator.LT, ValueOperand.of(":b"));
    final Condition c = FunctionCondition.of(ConditionFunction.ATTRIBUTE_EXISTS, List.of(PathOperand.of(Path.of("c"))));

    assertThat(parser.parse("a = :a AND b < :b and attribute_exists(c)"))
        .isEqualTo(AndCondition.of(AndCondition.of(a, b), c));
  }

  @Test
  void parse_between() {
    assertThat(parser.parse("n BETWEEN :lo AND :hi"))
        .isEqualTo(BetweenCondition.of(PathOperand.of(Path.of("n")), ValueOperand.of(":lo"), ValueOperand.of(":hi")));
  }

  @Test
  void parse_sizeOperand() {
    assertThat(parser.parse("size(tags) > :n"))
        .isEqualTo(ComparisonCondition.of(SizeOperand.of(Path.of("tags")), ComparisonOperator.GT, ValueOperand.of(":n")));
  }

  @Test
  void parse_sizeAlone_fails() {
    assertThatThrownBy(() -> parser.parse("size(tags)"))
        .isInstanceOf(ExpressionParseException.class);
  }

  @Test
  void parse_nestedPath() {
    final Path path = Path.of(List.of(
        PathElement.named("#a"), PathElement.named("b"), PathElement.indexed(2), PathElement.named("c")));

    assertThat(parser.parse("#a.b[2].c = :v"))
        .isEqualTo(ComparisonCondition.of(PathOperand.of(path), ComparisonOperator.EQ, ValueOperand.of(":v")));
  }

  @Test
  void parse_beginsWith() {
    assertThat(parser.parse("begins_with(sk, :prefix)"))
        .isEqualTo(FunctionCondition.of(ConditionFunction.BEGINS_WITH,
            List.of(PathOperand.of(Path.of("sk")), ValueOperand.of(":prefix"))));
  }

  @Test
  void parse_or_notSupported() {
    assertThatThrownBy(() -> parser.parse("a = :a OR b = :b"))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("operator not supported")
        .hasFieldOrPropertyWithValue("fragment", "OR");
  }

  @Test
  void parse_not_notSupported() {
    assertThatThrownBy(() -> parser.parse("NOT attribute_exists(a)"))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("operator not supported");
  }

  @Test
  void parse_in_notSupported() {
    assertThatThrownBy(() -> parser.parse("a IN (:a, :b)"))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("operator not supported");
  }

  @Test
  void parse_parentheses_notSupported() {
    assertThatThrownBy(() -> parser.parse("(a = :a)"))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("parentheses are not supported");
  }

  @Test
  void parse_unknownFunction_fails() {
    assertThatThrownBy(() -> parser.parse("starts_with(a, :b)"))
        .isInstanceOf(ExpressionParseException.class)
        .hasFieldOrPropertyWithValue("fragment", "starts_with");
  }

  @Test
  void parse_wrongArity_fails() {
    assertThatThrownBy(() -> parser.parse("attribute_exists(a, b)"))
        .isInstanceOf(ExpressionParseException.class)
        .hasMessageContaining("incorrect number of operands");
  }

  @Test
  void parse_functionOnValue_fails() {
    assertThatThrownBy(() -> parser.parse("attribute_exists(:a)"))
        .isInstanceOf(ExpressionParseException.class);
  }

  @Test
  void parse_bareLiteral_fails() {
    assertThatThrownBy(() -> parser.parse("a = 5"))
        .isInstanceOf(ExpressionParseException.class);
  }

  @Test
  void parse_trailingTokens_fail() {
    assertThatThrownBy(() -> parser.parse("a = :a b"))
        .isInstanceOf(ExpressionParseException.class)
        .hasFieldOrPropertyWithValue("fragment", "b");
  }
}
