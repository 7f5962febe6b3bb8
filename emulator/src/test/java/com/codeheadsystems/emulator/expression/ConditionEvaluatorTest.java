package com.codeheadsystems.emulator.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.emulator.exception.TypeMismatchException;
import com.codeheadsystems.emulator.exception.UnresolvedPlaceholderException;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.ImmutablePlaceholderBindings;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.SdkBytes;

class ConditionEvaluatorTest {

  private static final Map<String, AttributeValue> ITEM = Map.of(
      "name", AttributeValue.fromS("alpha-one"),
      "age", AttributeValue.fromN("42"),
      "tags", AttributeValue.fromL(List.of(AttributeValue.fromS("x"), AttributeValue.fromS("y"), AttributeValue.fromS("z"))),
      "colors", AttributeValue.fromSs(List.of("red", "blue")),
      "address", AttributeValue.fromM(Map.of("city", AttributeValue.fromS("Paris"))),
      "data", AttributeValue.fromB(SdkBytes.fromByteArray(new byte[]{1, 2, 3})));

  private ConditionExpressionParser parser;
  private ConditionEvaluator evaluator;

  @BeforeEach
  void setup() {
    parser = new ConditionExpressionParser(new ExpressionLexer());
    evaluator = new ConditionEvaluator();
  }

  private boolean evaluate(final String expression, final Map<String, AttributeValue> values) {
    final PlaceholderBindings bindings = ImmutablePlaceholderBindings.builder()
        .putNames("#n", "name")
        .putAllValues(values)
        .build();
    return evaluator.evaluate(parser.parse(expression), ITEM, bindings);
  }

  @Test
  void evaluate_equals() {
    assertThat(evaluate("#n = :v", Map.of(":v", AttributeValue.fromS("alpha-one")))).isTrue();
    assertThat(evaluate("#n = :v", Map.of(":v", AttributeValue.fromS("beta")))).isFalse();
  }

  @Test
  void evaluate_numbersCompareNumerically() {
    assertThat(evaluate("age = :v", Map.of(":v", AttributeValue.fromN("42.0")))).isTrue();
    assertThat(evaluate("age > :v", Map.of(":v", AttributeValue.fromN("9")))).isTrue();
    assertThat(evaluate("age <= :v", Map.of(":v", AttributeValue.fromN("41.9")))).isFalse();
  }

  @Test
  void evaluate_typeMismatch_isFalse() {
    assertThat(evaluate("age = :v", Map.of(":v", AttributeValue.fromS("42")))).isFalse();
    assertThat(evaluate("age <> :v", Map.of(":v", AttributeValue.fromS("42")))).isFalse();
    assertThat(evaluate("age < :v", Map.of(":v", AttributeValue.fromS("42")))).isFalse();
  }

  @Test
  void evaluate_missingAttribute_isFalse() {
    assertThat(evaluate("missing = :v", Map.of(":v", AttributeValue.fromS("x")))).isFalse();
    assertThat(evaluate("missing <> :v", Map.of(":v", AttributeValue.fromS("x")))).isFalse();
  }

  @Test
  void evaluate_between() {
    assertThat(evaluate("age BETWEEN :lo AND :hi",
        Map.of(":lo", AttributeValue.fromN("40"), ":hi", AttributeValue.fromN("42")))).isTrue();
    assertThat(evaluate("age BETWEEN :lo AND :hi",
        Map.of(":lo", AttributeValue.fromN("43"), ":hi", AttributeValue.fromN("50")))).isFalse();
  }

  @Test
  void evaluate_beginsWith() {
    assertThat(evaluate("begins_with(#n, :p)", Map.of(":p", AttributeValue.fromS("alpha")))).isTrue();
    assertThat(evaluate("begins_with(#n, :p)", Map.of(":p", AttributeValue.fromS("one")))).isFalse();
    assertThat(evaluate("begins_with(data, :p)",
        Map.of(":p", AttributeValue.fromB(SdkBytes.fromByteArray(new byte[]{1, 2}))))).isTrue();
  }

  @Test
  void evaluate_beginsWith_numberPrefix_typeMismatch() {
    assertThatThrownBy(() -> evaluate("begins_with(#n, :p)", Map.of(":p", AttributeValue.fromN("1"))))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void evaluate_sizeOfList() {
    assertThat(evaluate("size(tags) = :three", Map.of(":three", AttributeValue.fromN("3")))).isTrue();
    assertThat(evaluate("size(tags) > :three", Map.of(":three", AttributeValue.fromN("3")))).isFalse();
  }

  @Test
  void evaluate_sizeOfStringAndBinary() {
    assertThat(evaluate("size(#n) = :v", Map.of(":v", AttributeValue.fromN("9")))).isTrue();
    assertThat(evaluate("size(data) = :v", Map.of(":v", AttributeValue.fromN("3")))).isTrue();
  }

  @Test
  void evaluate_sizeOfMissing_isFalse() {
    assertThat(evaluate("size(missing) >= :v", Map.of(":v", AttributeValue.fromN("0")))).isFalse();
  }

  @Test
  void evaluate_attributeExists() {
    assertThat(evaluate("attribute_exists(address.city)", Map.of())).isTrue();
    assertThat(evaluate("attribute_exists(address.zip)", Map.of())).isFalse();
    assertThat(evaluate("attribute_not_exists(missing)", Map.of())).isTrue();
    assertThat(evaluate("attribute_exists(tags[2])", Map.of())).isTrue();
    assertThat(evaluate("attribute_exists(tags[3])", Map.of())).isFalse();
  }

  @Test
  void evaluate_attributeType() {
    assertThat(evaluate("attribute_type(colors, :t)", Map.of(":t", AttributeValue.fromS("SS")))).isTrue();
    assertThat(evaluate("attribute_type(colors, :t)", Map.of(":t", AttributeValue.fromS("L")))).isFalse();
  }

  @Test
  void evaluate_attributeType_unknownType() {
    assertThatThrownBy(() -> evaluate("attribute_type(colors, :t)", Map.of(":t", AttributeValue.fromS("STRING"))))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void evaluate_contains() {
    assertThat(evaluate("contains(#n, :v)", Map.of(":v", AttributeValue.fromS("ha-o")))).isTrue();
    assertThat(evaluate("contains(colors, :v)", Map.of(":v", AttributeValue.fromS("red")))).isTrue();
    assertThat(evaluate("contains(colors, :v)", Map.of(":v", AttributeValue.fromS("green")))).isFalse();
    assertThat(evaluate("contains(tags, :v)", Map.of(":v", AttributeValue.fromS("y")))).isTrue();
  }

  @Test
  void evaluate_and() {
    assertThat(evaluate("age > :a AND begins_with(#n, :p)",
        Map.of(":a", AttributeValue.fromN("1"), ":p", AttributeValue.fromS("alpha")))).isTrue();
    assertThat(evaluate("age > :a AND begins_with(#n, :p)",
        Map.of(":a", AttributeValue.fromN("100"), ":p", AttributeValue.fromS("alpha")))).isFalse();
  }

  @Test
  void evaluate_emptyItem() {
    assertThat(evaluator.evaluate(parser.parse("attribute_not_exists(pk)"), Map.of(), PlaceholderBindings.empty()))
        .isTrue();
  }

  @Test
  void evaluate_unboundValue() {
    assertThatThrownBy(() -> evaluate("age = :nope", Map.of()))
        .isInstanceOf(UnresolvedPlaceholderException.class)
        .hasFieldOrPropertyWithValue("placeholder", ":nope");
  }

  @Test
  void evaluate_unboundName_evenWhenNotReached() {
    assertThatThrownBy(() -> evaluate("age = :v AND #other = :v", Map.of(":v", AttributeValue.fromS("x"))))
        .isInstanceOf(UnresolvedPlaceholderException.class)
        .hasFieldOrPropertyWithValue("placeholder", "#other");
  }
}
