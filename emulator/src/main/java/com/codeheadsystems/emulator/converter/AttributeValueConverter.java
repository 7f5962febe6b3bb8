package com.codeheadsystems.emulator.converter;

import com.codeheadsystems.emulator.exception.ValidationException;
import com.codeheadsystems.emulator.model.AttributeValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between the SDK's attribute values and the emulator's.
 * Handles all attribute value types: S, N, B, SS, NS, BS, M, L, BOOL, NULL.
 */
@Singleton
public class AttributeValueConverter {

  private static final Logger log = LoggerFactory.getLogger(AttributeValueConverter.class);

  /**
   * Instantiates a new Attribute value converter.
   */
  @Inject
  public AttributeValueConverter() {
    log.info("AttributeValueConverter()");
  }

  /**
   * Converts an SDK item to an emulator item.
   *
   * @param item the item, may be null
   * @return the item, empty when null was given
   */
  public Map<String, AttributeValue> toItem(
      final Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> item) {
    final Map<String, AttributeValue> result = new LinkedHashMap<>();
    if (item != null) {
      item.forEach((name, value) -> result.put(name, toValue(value)));
    }
    return result;
  }

  /**
   * Converts an emulator item to an SDK item.
   *
   * @param item the item
   * @return the sdk item
   */
  public Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> fromItem(
      final Map<String, AttributeValue> item) {
    final Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> result = new LinkedHashMap<>();
    item.forEach((name, value) -> result.put(name, fromValue(value)));
    return result;
  }

  /**
   * Converts an SDK value. Exactly one data type must be set.
   *
   * @param value the value
   * @return the attribute value
   * @throws ValidationException if no data type is set or a number is malformed
   */
  public AttributeValue toValue(final software.amazon.awssdk.services.dynamodb.model.AttributeValue value) {
    if (value == null) {
      throw emptyValue();
    }
    if (value.s() != null) {
      return AttributeValue.fromS(value.s());
    }
    if (value.n() != null) {
      return AttributeValue.fromN(value.n());
    }
    if (value.b() != null) {
      return AttributeValue.fromB(value.b());
    }
    if (value.bool() != null) {
      return AttributeValue.fromBool(value.bool());
    }
    if (value.nul() != null) {
      if (!value.nul()) {
        throw new ValidationException("One or more parameter values were invalid: Null attribute value types "
            + "must have the value of true");
      }
      return AttributeValue.fromNull();
    }
    if (value.hasSs()) {
      return AttributeValue.fromSs(value.ss());
    }
    if (value.hasNs()) {
      return AttributeValue.fromNs(value.ns());
    }
    if (value.hasBs()) {
      return AttributeValue.fromBs(value.bs());
    }
    if (value.hasL()) {
      return AttributeValue.fromL(value.l().stream().map(this::toValue).toList());
    }
    if (value.hasM()) {
      return AttributeValue.fromM(toItem(value.m()));
    }
    throw emptyValue();
  }

  /**
   * Converts an emulator value to the SDK's.
   *
   * @param value the value
   * @return the sdk attribute value
   */
  public software.amazon.awssdk.services.dynamodb.model.AttributeValue fromValue(final AttributeValue value) {
    final software.amazon.awssdk.services.dynamodb.model.AttributeValue.Builder builder =
        software.amazon.awssdk.services.dynamodb.model.AttributeValue.builder();
    return switch (value.type()) {
      case S -> builder.s(value.s()).build();
      case N -> builder.n(value.n()).build();
      case B -> builder.b(value.b()).build();
      case BOOL -> builder.bool(value.bool()).build();
      case NULL -> builder.nul(true).build();
      case SS -> builder.ss(List.copyOf(value.ss())).build();
      case NS -> builder.ns(value.ns()).build();
      case BS -> builder.bs(List.copyOf(value.bs())).build();
      case L -> builder.l(value.l().stream().map(this::fromValue).toList()).build();
      case M -> builder.m(fromItem(value.m())).build();
    };
  }

  private ValidationException emptyValue() {
    return new ValidationException("Supplied AttributeValue is empty, must contain exactly one of the supported datatypes");
  }
}
