package com.codeheadsystems.emulator.model;

import com.codeheadsystems.emulator.exception.ValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import software.amazon.awssdk.core.SdkBytes;

/**
 * A single typed value stored in an item. Exactly one variant is populated, named by {@link #type()}.
 *
 * <p>Instances are immutable. Numbers keep the text they were created from but compare and hash
 * numerically, so {@code 1.0} equals {@code 1}. Sets are unordered for equality.
 */
public final class AttributeValue {

  /**
   * The variant tags, named as the wire API names them.
   */
  public enum Type {
    S, N, B, BOOL, NULL, L, M, SS, NS, BS
  }

  private static final int MAX_SIGNIFICANT_DIGITS = 38;
  private static final int MAX_EXPONENT = 125;
  private static final int MIN_EXPONENT = -130;
  private static final AttributeValue NULL_VALUE = new AttributeValue(Type.NULL, Boolean.TRUE);
  private static final AttributeValue TRUE_VALUE = new AttributeValue(Type.BOOL, Boolean.TRUE);
  private static final AttributeValue FALSE_VALUE = new AttributeValue(Type.BOOL, Boolean.FALSE);

  private final Type type;
  private final Object value;

  private AttributeValue(final Type type, final Object value) {
    this.type = type;
    this.value = value;
  }

  /**
   * String value.
   *
   * @param value the string
   * @return the attribute value
   */
  public static AttributeValue fromS(final String value) {
    return new AttributeValue(Type.S, Objects.requireNonNull(value, "value"));
  }

  /**
   * Number value from its decimal text.
   *
   * @param text the number text
   * @return the attribute value
   * @throws ValidationException if the text is not a number the API can store
   */
  public static AttributeValue fromN(final String text) {
    return new AttributeValue(Type.N, new NumberValue(text, parseNumber(text)));
  }

  /**
   * Number value.
   *
   * @param number the number
   * @return the attribute value
   */
  public static AttributeValue fromN(final BigDecimal number) {
    final BigDecimal stripped = number.signum() == 0 ? BigDecimal.ZERO : number.stripTrailingZeros();
    return fromN(stripped.toPlainString());
  }

  /**
   * Binary value.
   *
   * @param bytes the bytes
   * @return the attribute value
   */
  public static AttributeValue fromB(final SdkBytes bytes) {
    return new AttributeValue(Type.B, Objects.requireNonNull(bytes, "bytes"));
  }

  /**
   * Boolean value.
   *
   * @param value the value
   * @return the attribute value
   */
  public static AttributeValue fromBool(final boolean value) {
    return value ? TRUE_VALUE : FALSE_VALUE;
  }

  /**
   * The null value.
   *
   * @return the attribute value
   */
  public static AttributeValue fromNull() {
    return NULL_VALUE;
  }

  /**
   * List value.
   *
   * @param values the elements
   * @return the attribute value
   */
  public static AttributeValue fromL(final List<AttributeValue> values) {
    return new AttributeValue(Type.L, List.copyOf(values));
  }

  /**
   * Map value. Entry order is kept.
   *
   * @param values the entries
   * @return the attribute value
   */
  public static AttributeValue fromM(final Map<String, AttributeValue> values) {
    return new AttributeValue(Type.M, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  /**
   * String set.
   *
   * @param values the members
   * @return the attribute value
   * @throws ValidationException if empty or containing duplicates
   */
  public static AttributeValue fromSs(final Collection<String> values) {
    final Set<String> members = new LinkedHashSet<>(values);
    checkSet(values.size(), members.size());
    return new AttributeValue(Type.SS, Collections.unmodifiableSet(members));
  }

  /**
   * Number set.
   *
   * @param values the members as decimal text
   * @return the attribute value
   * @throws ValidationException if empty, containing duplicates or an invalid number
   */
  public static AttributeValue fromNs(final Collection<String> values) {
    final List<NumberValue> members = new ArrayList<>();
    final Set<BigDecimal> seen = new HashSet<>();
    for (String text : values) {
      final NumberValue number = new NumberValue(text, parseNumber(text));
      if (seen.add(number.normalized())) {
        members.add(number);
      }
    }
    checkSet(values.size(), members.size());
    return new AttributeValue(Type.NS, Collections.unmodifiableList(members));
  }

  /**
   * Binary set.
   *
   * @param values the members
   * @return the attribute value
   * @throws ValidationException if empty or containing duplicates
   */
  public static AttributeValue fromBs(final Collection<SdkBytes> values) {
    final Set<SdkBytes> members = new LinkedHashSet<>(values);
    checkSet(values.size(), members.size());
    return new AttributeValue(Type.BS, Collections.unmodifiableSet(members));
  }

  /**
   * Parses and validates number text against the limits of the API.
   *
   * @param text the text
   * @return the number
   * @throws ValidationException for malformed text, more than 38 significant digits, or a magnitude out of range
   */
  public static BigDecimal parseNumber(final String text) {
    if (text == null || text.isEmpty()) {
      throw new ValidationException("The parameter cannot be converted to a numeric value");
    }
    final BigDecimal number;
    try {
      number = new BigDecimal(text);
    } catch (NumberFormatException e) {
      throw new ValidationException("The parameter cannot be converted to a numeric value: " + text);
    }
    if (number.signum() == 0) {
      return number;
    }
    final BigDecimal stripped = number.stripTrailingZeros();
    if (stripped.precision() > MAX_SIGNIFICANT_DIGITS) {
      throw new ValidationException("Attempting to store more than 38 significant digits in a Number");
    }
    final int exponent = stripped.precision() - stripped.scale() - 1;
    if (exponent > MAX_EXPONENT) {
      throw new ValidationException("Number overflow. Attempting to store a number with magnitude larger than supported range");
    }
    if (exponent < MIN_EXPONENT) {
      throw new ValidationException("Number underflow. Attempting to store a number with magnitude smaller than supported range");
    }
    return number;
  }

  private static void checkSet(final int given, final int distinct) {
    if (given == 0) {
      throw new ValidationException("One or more parameter values were invalid: An empty set is not allowed");
    }
    if (given != distinct) {
      throw new ValidationException("One or more parameter values were invalid: Input collection contains duplicates");
    }
  }

  /**
   * The variant of this value.
   *
   * @return the type
   */
  public Type type() {
    return type;
  }

  /**
   * String content.
   *
   * @return the string
   */
  public String s() {
    return (String) expect(Type.S);
  }

  /**
   * Number text, as given.
   *
   * @return the text
   */
  public String n() {
    return ((NumberValue) expect(Type.N)).text();
  }

  /**
   * Number content.
   *
   * @return the number
   */
  public BigDecimal number() {
    return ((NumberValue) expect(Type.N)).number();
  }

  /**
   * Binary content.
   *
   * @return the bytes
   */
  public SdkBytes b() {
    return (SdkBytes) expect(Type.B);
  }

  /**
   * Boolean content.
   *
   * @return the boolean
   */
  public boolean bool() {
    return (Boolean) expect(Type.BOOL);
  }

  /**
   * List content.
   *
   * @return the list
   */
  @SuppressWarnings("unchecked")
  public List<AttributeValue> l() {
    return (List<AttributeValue>) expect(Type.L);
  }

  /**
   * Map content.
   *
   * @return the map
   */
  @SuppressWarnings("unchecked")
  public Map<String, AttributeValue> m() {
    return (Map<String, AttributeValue>) expect(Type.M);
  }

  /**
   * String set content.
   *
   * @return the set
   */
  @SuppressWarnings("unchecked")
  public Set<String> ss() {
    return (Set<String>) expect(Type.SS);
  }

  /**
   * Number set content as decimal text.
   *
   * @return the texts
   */
  public List<String> ns() {
    return numberMembers().stream().map(NumberValue::text).toList();
  }

  /**
   * Number set content as numbers.
   *
   * @return the numbers
   */
  public List<BigDecimal> numbers() {
    return numberMembers().stream().map(NumberValue::number).toList();
  }

  /**
   * Binary set content.
   *
   * @return the set
   */
  @SuppressWarnings("unchecked")
  public Set<SdkBytes> bs() {
    return (Set<SdkBytes>) expect(Type.BS);
  }

  /**
   * True for the three set variants.
   *
   * @return the boolean
   */
  public boolean isSet() {
    return type == Type.SS || type == Type.NS || type == Type.BS;
  }

  @SuppressWarnings("unchecked")
  private List<NumberValue> numberMembers() {
    return (List<NumberValue>) expect(Type.NS);
  }

  private Object expect(final Type expected) {
    if (type != expected) {
      throw new IllegalStateException("Not a " + expected + " value: " + this);
    }
    return value;
  }

  private Set<BigDecimal> normalizedNumbers() {
    return numberMembers().stream().map(NumberValue::normalized).collect(Collectors.toSet());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AttributeValue)) {
      return false;
    }
    final AttributeValue that = (AttributeValue) o;
    if (type != that.type) {
      return false;
    }
    return switch (type) {
      case N -> number().compareTo(that.number()) == 0;
      case NS -> normalizedNumbers().equals(that.normalizedNumbers());
      default -> value.equals(that.value);
    };
  }

  @Override
  public int hashCode() {
    return switch (type) {
      case N -> 31 * type.hashCode() + ((NumberValue) value).normalized().hashCode();
      case NS -> 31 * type.hashCode() + normalizedNumbers().hashCode();
      default -> 31 * type.hashCode() + value.hashCode();
    };
  }

  @Override
  public String toString() {
    final String content = switch (type) {
      case N -> n();
      case NS -> ns().toString();
      case B -> "0x" + hex(b().asByteArray());
      case BS -> bs().stream().map(bytes -> "0x" + hex(bytes.asByteArray())).toList().toString();
      default -> String.valueOf(value);
    };
    return "{" + type + ": " + content + "}";
  }

  private static String hex(final byte[] bytes) {
    return HexFormat.of().formatHex(bytes);
  }

  /**
   * Number text paired with its parsed form.
   */
  private static final class NumberValue {

    private final String text;
    private final BigDecimal number;

    private NumberValue(final String text, final BigDecimal number) {
      this.text = text;
      this.number = number;
    }

    String text() {
      return text;
    }

    BigDecimal number() {
      return number;
    }

    BigDecimal normalized() {
      return number.signum() == 0 ? BigDecimal.ZERO : number.stripTrailingZeros();
    }
  }
}
