package com.codeheadsystems.emulator.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.emulator.exception.UnresolvedPlaceholderException;
import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.ImmutablePlaceholderBindings;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpdateEvaluatorTest {

  private static final PlaceholderBindings BINDINGS = ImmutablePlaceholderBindings.builder()
      .putNames("#c", "count")
      .putValues(":one", AttributeValue.fromN("1"))
      .putValues(":name", AttributeValue.fromS("bob"))
      .putValues(":list", AttributeValue.fromL(List.of(AttributeValue.fromS("c"))))
      .putValues(":tags", AttributeValue.fromSs(List.of("b", "c")))
      .putValues(":nums", AttributeValue.fromNs(List.of("2")))
      .putValues(":zero", AttributeValue.fromN("0"))
      .build();

  private UpdateExpressionParser parser;
  private UpdateEvaluator evaluator;
  private Map<String, AttributeValue> item;

  @BeforeEach
  void setup() {
    parser = new UpdateExpressionParser(new ExpressionLexer());
    evaluator = new UpdateEvaluator();
    item = new LinkedHashMap<>();
    item.put("pk", AttributeValue.fromS("key"));
    item.put("count", AttributeValue.fromN("41"));
    item.put("letters", AttributeValue.fromL(List.of(AttributeValue.fromS("a"), AttributeValue.fromS("b"))));
    item.put("tags", AttributeValue.fromSs(List.of("a", "b")));
    item.put("nums", AttributeValue.fromNs(List.of("1", "2")));
    item.put("profile", AttributeValue.fromM(Map.of("city", AttributeValue.fromS("Oslo"))));
  }

  private Map<String, AttributeValue> apply(final String expression) {
    return evaluator.apply(parser.parse(expression), item, BINDINGS);
  }

  @Test
  void apply_setValue() {
    final Map<String, AttributeValue> result = apply("SET name = :name");

    assertThat(result).containsEntry("name", AttributeValue.fromS("bob"));
    assertThat(item).doesNotContainKey("name");
  }

  @Test
  void apply_increment() {
    assertThat(apply("SET #c = #c + :one")).containsEntry("count", AttributeValue.fromN("42"));
    assertThat(apply("SET #c = #c - :one")).containsEntry("count", AttributeValue.fromN("40"));
  }

  @Test
  void apply_setValuesComputedFromOriginalItem() {
    final Map<String, AttributeValue> result = apply("SET #c = :zero, other = #c");

    assertThat(result).containsEntry("count", AttributeValue.fromN("0"));
    assertThat(result).containsEntry("other", AttributeValue.fromN("41"));
  }

  @Test
  void apply_ifNotExists() {
    assertThat(apply("SET #c = if_not_exists(#c, :zero)")).containsEntry("count", AttributeValue.fromN("41"));
    assertThat(apply("SET fresh = if_not_exists(fresh, :zero)")).containsEntry("fresh", AttributeValue.fromN("0"));
  }

  @Test
  void apply_listAppend() {
    assertThat(apply("SET letters = list_append(letters, :list)")).containsEntry("letters",
        AttributeValue.fromL(List.of(AttributeValue.fromS("a"), AttributeValue.fromS("b"), AttributeValue.fromS("c"))));
  }

  @Test
  void apply_setNestedAndIndexed() {
    final Map<String, AttributeValue> result = apply("SET profile.city = :name, letters[5] = :name");

    assertThat(result.get("profile").m()).containsEntry("city", AttributeValue.fromS("bob"));
    assertThat(result.get("letters").l()).containsExactly(
        AttributeValue.fromS("a"), AttributeValue.fromS("b"), AttributeValue.fromS("bob"));
  }

  @Test
  void apply_setUnderMissingParent_fails() {
    assertThatThrownBy(() -> apply("SET missing.city = :name"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("document path provided in the update expression is invalid");
  }

  @Test
  void apply_remove() {
    final Map<String, AttributeValue> result = apply("REMOVE profile.city, letters[0], missing");

    assertThat(result.get("profile").m()).isEmpty();
    assertThat(result.get("letters").l()).containsExactly(AttributeValue.fromS("b"));
  }

  @Test
  void apply_removeSeveralIndexes() {
    final Map<String, AttributeValue> result = apply("REMOVE letters[0], letters[1]");

    assertThat(result.get("letters").l()).isEmpty();
  }

  @Test
  void apply_addNumberAndSet() {
    final Map<String, AttributeValue> result = apply("ADD #c :one, tags :tags, fresh :one");

    assertThat(result).containsEntry("count", AttributeValue.fromN("42"));
    assertThat(result).containsEntry("fresh", AttributeValue.fromN("1"));
    assertThat(result.get("tags").ss()).containsExactlyInAnyOrder("a", "b", "c");
  }

  @Test
  void apply_deleteFromSet() {
    final Map<String, AttributeValue> result = apply("DELETE tags :tags, nums :nums");

    assertThat(result.get("tags").ss()).containsExactly("a");
    assertThat(result.get("nums").ns()).containsExactly("1");
  }

  @Test
  void apply_deleteLastMember_removesAttribute() {
    item.put("tags", AttributeValue.fromSs(List.of("b")));

    assertThat(apply("DELETE tags :tags")).doesNotContainKey("tags");
  }

  @Test
  void apply_addToString_fails() {
    assertThatThrownBy(() -> apply("ADD pk :one"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("An operand in the update expression has an incorrect data type");
  }

  @Test
  void apply_arithmeticOnString_fails() {
    assertThatThrownBy(() -> apply("SET pk = pk + :one"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("An operand in the update expression has an incorrect data type");
  }

  @Test
  void apply_missingOperand_fails() {
    assertThatThrownBy(() -> apply("SET a = missing + :one"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("does not exist in the item");
  }

  @Test
  void apply_overlappingPaths_fail() {
    assertThatThrownBy(() -> apply("SET profile.city = :name REMOVE profile"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Two document paths overlap");
  }

  @Test
  void apply_unboundPlaceholder_fails() {
    assertThatThrownBy(() -> apply("SET a = :missing"))
        .isInstanceOf(UnresolvedPlaceholderException.class);
  }
}
