package com.codeheadsystems.emulator.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.OptionalInt;

/**
 * Ordering of scalar values: numeric for N, UTF-8 byte order for S, unsigned byte order for B.
 */
public final class ValueOrdering {

  /**
   * Total order over key values of one type. Comparing different variants is a programming error.
   */
  public static final Comparator<AttributeValue> KEY_ORDER = ValueOrdering::compareKeys;

  private ValueOrdering() {
  }

  /**
   * Compares two values when they are both of the same orderable variant.
   *
   * @param left  the left
   * @param right the right
   * @return the comparison, or empty when the values are not comparable
   */
  public static OptionalInt compare(final AttributeValue left, final AttributeValue right) {
    if (left.type() != right.type()) {
      return OptionalInt.empty();
    }
    return switch (left.type()) {
      case S -> OptionalInt.of(compareUtf8(left.s(), right.s()));
      case N -> OptionalInt.of(left.number().compareTo(right.number()));
      case B -> OptionalInt.of(Arrays.compareUnsigned(left.b().asByteArray(), right.b().asByteArray()));
      default -> OptionalInt.empty();
    };
  }

  /**
   * True when value starts with prefix; both must be S or both B.
   *
   * @param value  the value
   * @param prefix the prefix
   * @return the boolean
   */
  public static boolean startsWith(final AttributeValue value, final AttributeValue prefix) {
    if (value.type() != prefix.type()) {
      return false;
    }
    if (value.type() == AttributeValue.Type.S) {
      return value.s().startsWith(prefix.s());
    }
    if (value.type() == AttributeValue.Type.B) {
      final byte[] bytes = value.b().asByteArray();
      final byte[] start = prefix.b().asByteArray();
      return bytes.length >= start.length && Arrays.equals(bytes, 0, start.length, start, 0, start.length);
    }
    return false;
  }

  private static int compareKeys(final AttributeValue left, final AttributeValue right) {
    if (left.type() == AttributeValue.Type.NULL && right.type() == AttributeValue.Type.NULL) {
      return 0;
    }
    return compare(left, right).orElseThrow(() ->
        new IllegalArgumentException("Key values are not comparable: " + left + ", " + right));
  }

  // Code point order is UTF-8 byte order.
  private static int compareUtf8(final String left, final String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      final int a = left.codePointAt(i);
      final int b = right.codePointAt(j);
      if (a != b) {
        return Integer.compare(a, b);
      }
      i += Character.charCount(a);
      j += Character.charCount(b);
    }
    return Integer.compare(left.length() - i, right.length() - j);
  }
}
