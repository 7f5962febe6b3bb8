package com.codeheadsystems.emulator.expression;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.ImmutablePlaceholderBindings;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectorTest {

  private static final Map<String, AttributeValue> ITEM = Map.of(
      "pk", AttributeValue.fromS("key"),
      "name", AttributeValue.fromS("alice"),
      "letters", AttributeValue.fromL(List.of(
          AttributeValue.fromS("a"), AttributeValue.fromS("b"), AttributeValue.fromS("c"))),
      "profile", AttributeValue.fromM(Map.of(
          "city", AttributeValue.fromS("Oslo"),
          "zip", AttributeValue.fromS("0150"))));

  private ProjectionExpressionParser parser;
  private Projector projector;

  @BeforeEach
  void setup() {
    parser = new ProjectionExpressionParser(new ExpressionLexer());
    projector = new Projector();
  }

  private Map<String, AttributeValue> project(final String expression, final PlaceholderBindings bindings) {
    return projector.project(ITEM, parser.parse(expression), bindings);
  }

  @Test
  void project_topLevel() {
    assertThat(project("name, missing", PlaceholderBindings.empty()))
        .containsOnlyKeys("name")
        .containsEntry("name", AttributeValue.fromS("alice"));
  }

  @Test
  void project_nameplaceholder() {
    final PlaceholderBindings bindings = ImmutablePlaceholderBindings.builder().putNames("#n", "name").build();

    assertThat(project("#n", bindings)).containsOnlyKeys("name");
  }

  @Test
  void project_nestedKeepsStructure() {
    final Map<String, AttributeValue> result = project("profile.city", PlaceholderBindings.empty());

    assertThat(result).containsOnlyKeys("profile");
    assertThat(result.get("profile").m()).containsOnlyKeys("city");
  }

  @Test
  void project_listElementsArePacked() {
    final Map<String, AttributeValue> result = project("letters[2], letters[0]", PlaceholderBindings.empty());

    assertThat(result.get("letters").l()).containsExactly(AttributeValue.fromS("a"), AttributeValue.fromS("c"));
  }

  @Test
  void project_wholeAttributeWins() {
    final Map<String, AttributeValue> result = project("profile, profile.city", PlaceholderBindings.empty());

    assertThat(result.get("profile").m()).containsOnlyKeys("city", "zip");
  }
}
