package com.codeheadsystems.emulator.util;

import com.codeheadsystems.emulator.model.AttributeValue;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Computes item sizes the way DynamoDB bills and limits them.
 *
 * <ul>
 *   <li>Strings: UTF-8 bytes. Binary: raw bytes.</li>
 *   <li>Numbers: one byte per two significant digits, plus one.</li>
 *   <li>Booleans and null: one byte.</li>
 *   <li>Lists and maps: three bytes, plus one byte and the content of each element.</li>
 *   <li>Every attribute and map key also counts its name in UTF-8 bytes.</li>
 * </ul>
 */
@Singleton
public class ItemSizeCalculator {

  private static final int CONTAINER_OVERHEAD = 3;
  private static final int ELEMENT_OVERHEAD = 1;

  /**
   * Instantiates a new Item size calculator.
   */
  @Inject
  public ItemSizeCalculator() {
    // Stateless
  }

  /**
   * Size of an item in bytes.
   *
   * @param item the item
   * @return the size
   */
  public long sizeOf(final Map<String, AttributeValue> item) {
    long size = 0;
    for (Map.Entry<String, AttributeValue> entry : item.entrySet()) {
      size += utf8Length(entry.getKey()) + sizeOf(entry.getValue());
    }
    return size;
  }

  /**
   * Size of one value in bytes, without its attribute name.
   *
   * @param value the value
   * @return the size
   */
  public long sizeOf(final AttributeValue value) {
    return switch (value.type()) {
      case S -> utf8Length(value.s());
      case N -> numberSize(value.number());
      case B -> value.b().asByteArray().length;
      case BOOL, NULL -> 1;
      case L -> CONTAINER_OVERHEAD + value.l().stream()
          .mapToLong(element -> ELEMENT_OVERHEAD + sizeOf(element))
          .sum();
      case M -> CONTAINER_OVERHEAD + value.m().entrySet().stream()
          .mapToLong(entry -> ELEMENT_OVERHEAD + utf8Length(entry.getKey()) + sizeOf(entry.getValue()))
          .sum();
      case SS -> value.ss().stream().mapToLong(this::utf8Length).sum();
      case NS -> value.numbers().stream().mapToLong(this::numberSize).sum();
      case BS -> value.bs().stream().mapToLong(bytes -> bytes.asByteArray().length).sum();
    };
  }

  private long numberSize(final BigDecimal number) {
    if (number.signum() == 0) {
      return 1;
    }
    final int digits = number.stripTrailingZeros().precision();
    return (digits + 1) / 2 + 1;
  }

  private long utf8Length(final String text) {
    return text.getBytes(StandardCharsets.UTF_8).length;
  }
}
