package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathElement;
import com.codeheadsystems.emulator.expression.ast.ProjectionExpression;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a projection expression to an item.
 *
 * <p>Nested paths keep the enclosing structure: projecting {@code a.b} from
 * {@code {a: {b: 1, c: 2}}} gives {@code {a: {b: 1}}}. Projected list elements keep their relative
 * order but are packed together. Paths the item lacks are skipped.
 */
@Singleton
public class Projector {

  private static final Logger log = LoggerFactory.getLogger(Projector.class);

  /**
   * Instantiates a new Projector.
   */
  @Inject
  public Projector() {
    log.info("Projector()");
  }

  /**
   * Project map.
   *
   * @param item       the item
   * @param projection the projection
   * @param bindings   the bindings
   * @return the projected item
   */
  public Map<String, AttributeValue> project(final Map<String, AttributeValue> item,
                                             final ProjectionExpression projection,
                                             final PlaceholderBindings bindings) {
    log.trace("project({}, {})", item, projection);
    ExpressionReferences.requireBound(ExpressionReferences.placeholders(projection), bindings);
    final Map<Object, Object> root = new LinkedHashMap<>();
    for (Path path : projection.paths()) {
      final List<PathElement> elements = DocumentPath.resolve(path, bindings);
      final Optional<AttributeValue> value = DocumentPath.get(item, elements);
      value.ifPresent(v -> insert(root, elements, v));
    }
    final Map<String, AttributeValue> result = new LinkedHashMap<>();
    root.forEach((key, node) -> result.put((String) key, toValue(node)));
    return result;
  }

  // Nodes are AttributeValue leaves, LinkedHashMap for maps keyed by name, TreeMap for lists keyed by index.
  @SuppressWarnings("unchecked")
  private void insert(final Map<Object, Object> root, final List<PathElement> elements, final AttributeValue value) {
    Map<Object, Object> node = root;
    for (int i = 0; i < elements.size() - 1; i++) {
      final Object key = keyOf(elements.get(i));
      final Object child = node.get(key);
      if (child instanceof AttributeValue) {
        return;
      }
      if (child == null) {
        final Map<Object, Object> created = elements.get(i + 1).isIndex() ? new TreeMap<>() : new LinkedHashMap<>();
        node.put(key, created);
        node = created;
      } else {
        node = (Map<Object, Object>) child;
      }
    }
    node.put(keyOf(elements.get(elements.size() - 1)), value);
  }

  private Object keyOf(final PathElement element) {
    return element.isIndex() ? (Object) element.index().orElseThrow() : element.name().orElseThrow();
  }

  @SuppressWarnings("unchecked")
  private AttributeValue toValue(final Object node) {
    if (node instanceof AttributeValue) {
      return (AttributeValue) node;
    }
    if (node instanceof TreeMap) {
      return AttributeValue.fromL(((TreeMap<Object, Object>) node).values().stream().map(this::toValue).toList());
    }
    final Map<String, AttributeValue> map = new LinkedHashMap<>();
    ((Map<Object, Object>) node).forEach((key, child) -> map.put((String) key, toValue(child)));
    return AttributeValue.fromM(map);
  }
}
