package com.codeheadsystems.emulator.expression;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.expression.ast.Path;
import com.codeheadsystems.emulator.expression.ast.PathElement;
import com.codeheadsystems.emulator.model.AttributeValue;
import com.codeheadsystems.emulator.model.PlaceholderBindings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads and writes nested attributes of an item. Paths handed to the mutating methods must already
 * have their name placeholders resolved.
 */
public final class DocumentPath {

  private DocumentPath() {
  }

  /**
   * Replaces name placeholders with the attribute names they are bound to.
   *
   * @param path     the path
   * @param bindings the bindings
   * @return the resolved elements
   */
  public static List<PathElement> resolve(final Path path, final PlaceholderBindings bindings) {
    return path.elements().stream()
        .map(element -> element.isIndex()
            ? element
            : PathElement.named(bindings.resolveName(element.name().orElseThrow())))
        .toList();
  }

  /**
   * The value at the path, or empty when any step is missing or of the wrong kind.
   *
   * @param item     the item
   * @param elements the resolved elements
   * @return the optional
   */
  public static Optional<AttributeValue> get(final Map<String, AttributeValue> item,
                                             final List<PathElement> elements) {
    AttributeValue current = item.get(nameOf(elements.get(0)));
    for (int i = 1; i < elements.size() && current != null; i++) {
      current = child(current, elements.get(i));
    }
    return Optional.ofNullable(current);
  }

  /**
   * Writes the value at the path. Every parent must exist; an index past the end of a list appends.
   *
   * @param item     the mutable item
   * @param elements the resolved elements
   * @param value    the value
   */
  public static void set(final Map<String, AttributeValue> item,
                         final List<PathElement> elements,
                         final AttributeValue value) {
    final String top = nameOf(elements.get(0));
    if (elements.size() == 1) {
      item.put(top, value);
      return;
    }
    final AttributeValue existing = item.get(top);
    if (existing == null) {
      throw invalidPath();
    }
    item.put(top, setIn(existing, elements, 1, value));
  }

  /**
   * Removes the value at the path. Missing paths are ignored.
   *
   * @param item     the mutable item
   * @param elements the resolved elements
   */
  public static void remove(final Map<String, AttributeValue> item, final List<PathElement> elements) {
    final String top = nameOf(elements.get(0));
    if (elements.size() == 1) {
      item.remove(top);
      return;
    }
    final AttributeValue existing = item.get(top);
    if (existing != null) {
      item.put(top, removeIn(existing, elements, 1));
    }
  }

  /**
   * Renders resolved elements for messages.
   *
   * @param elements the elements
   * @return the string
   */
  public static String render(final List<PathElement> elements) {
    return elements.stream().map(PathElement::text).collect(Collectors.joining(", ", "[", "]"));
  }

  private static AttributeValue child(final AttributeValue container, final PathElement element) {
    if (element.isIndex()) {
      if (container.type() != AttributeValue.Type.L) {
        return null;
      }
      final int index = element.index().orElseThrow();
      return index < container.l().size() ? container.l().get(index) : null;
    }
    if (container.type() != AttributeValue.Type.M) {
      return null;
    }
    return container.m().get(nameOf(element));
  }

  private static AttributeValue setIn(final AttributeValue container,
                                      final List<PathElement> elements,
                                      final int position,
                                      final AttributeValue value) {
    final PathElement element = elements.get(position);
    final boolean last = position == elements.size() - 1;
    if (element.isIndex()) {
      if (container.type() != AttributeValue.Type.L) {
        throw invalidPath();
      }
      final List<AttributeValue> list = new ArrayList<>(container.l());
      final int index = element.index().orElseThrow();
      if (last && index >= list.size()) {
        list.add(value);
      } else if (last) {
        list.set(index, value);
      } else if (index < list.size()) {
        list.set(index, setIn(list.get(index), elements, position + 1, value));
      } else {
        throw invalidPath();
      }
      return AttributeValue.fromL(list);
    }
    if (container.type() != AttributeValue.Type.M) {
      throw invalidPath();
    }
    final Map<String, AttributeValue> map = new LinkedHashMap<>(container.m());
    final String key = nameOf(element);
    if (last) {
      map.put(key, value);
    } else {
      final AttributeValue child = map.get(key);
      if (child == null) {
        throw invalidPath();
      }
      map.put(key, setIn(child, elements, position + 1, value));
    }
    return AttributeValue.fromM(map);
  }

  private static AttributeValue removeIn(final AttributeValue container,
                                         final List<PathElement> elements,
                                         final int position) {
    final PathElement element = elements.get(position);
    final boolean last = position == elements.size() - 1;
    if (element.isIndex()) {
      final int index = element.index().orElseThrow();
      if (container.type() != AttributeValue.Type.L || index >= container.l().size()) {
        return container;
      }
      final List<AttributeValue> list = new ArrayList<>(container.l());
      if (last) {
        list.remove(index);
      } else {
        list.set(index, removeIn(list.get(index), elements, position + 1));
      }
      return AttributeValue.fromL(list);
    }
    final String key = nameOf(element);
    if (container.type() != AttributeValue.Type.M || !container.m().containsKey(key)) {
      return container;
    }
    final Map<String, AttributeValue> map = new LinkedHashMap<>(container.m());
    if (last) {
      map.remove(key);
    } else {
      map.put(key, removeIn(map.get(key), elements, position + 1));
    }
    return AttributeValue.fromM(map);
  }

  private static String nameOf(final PathElement element) {
    return element.name().orElseThrow(() -> new IllegalArgumentException("Not a name element: " + element));
  }

  private static ValidationException invalidPath() {
    return new ValidationException("The document path provided in the update expression is invalid for update");
  }
}
