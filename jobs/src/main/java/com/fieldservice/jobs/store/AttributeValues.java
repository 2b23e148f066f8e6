package com.fieldservice.jobs.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Small helpers for building, reading and comparing {@link AttributeValue}s */
public final class AttributeValues {

  private AttributeValues() {}

  public static AttributeValue s(String value) {
    return AttributeValue.builder().s(value).build();
  }

  public static AttributeValue n(Number value) {
    return AttributeValue.builder().n(value.toString()).build();
  }

  public static AttributeValue bool(boolean value) {
    return AttributeValue.builder().bool(value).build();
  }

  public static AttributeValue instant(Instant value) {
    return n(value.toEpochMilli());
  }

  public static AttributeValue stringList(List<String> values) {
    List<AttributeValue> items = new ArrayList<>();
    for (String value : values) {
      items.add(s(value));
    }
    return AttributeValue.builder().l(items).build();
  }

  public static AttributeValue map(Map<String, AttributeValue> value) {
    return AttributeValue.builder().m(value).build();
  }

  public static String getString(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    if (value != null && value.s() != null) {
      return value.s();
    } else if (value != null && value.n() != null) {
      return value.n();
    }
    return null;
  }

  public static BigDecimal getNumber(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    if (value == null || value.n() == null) {
      return null;
    }
    return new BigDecimal(value.n());
  }

  public static Instant getInstant(Map<String, AttributeValue> item, String key) {
    BigDecimal millis = getNumber(item, key);
    return millis == null ? null : Instant.ofEpochMilli(millis.longValueExact());
  }

  public static Boolean getBoolean(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    return value == null ? null : value.bool();
  }

  public static Map<String, AttributeValue> getMap(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    if (value == null || !value.hasM()) {
      return null;
    }
    return value.m();
  }

  /** Reads a list of strings, accepting either a list of S values or a string set */
  public static List<String> getStringList(Map<String, AttributeValue> item, String key) {
    AttributeValue value = item.get(key);
    if (value == null) {
      return null;
    }
    if (value.hasSs()) {
      return new ArrayList<>(value.ss());
    }
    if (!value.hasL()) {
      return null;
    }
    List<String> result = new ArrayList<>();
    for (AttributeValue element : value.l()) {
      if (element.s() != null) {
        result.add(element.s());
      }
    }
    return result;
  }

  /**
   * Orders two scalar values. Numbers compare numerically, strings lexicographically, booleans
   * false before true. A missing value sorts before any present value.
   */
  public static int compare(AttributeValue left, AttributeValue right) {
    if (left == null || right == null) {
      return left == null ? (right == null ? 0 : -1) : 1;
    }
    if (left.n() != null && right.n() != null) {
      return new BigDecimal(left.n()).compareTo(new BigDecimal(right.n()));
    }
    if (left.s() != null && right.s() != null) {
      return left.s().compareTo(right.s());
    }
    if (left.bool() != null && right.bool() != null) {
      return Boolean.compare(left.bool(), right.bool());
    }
    return 0;
  }

  /** Equality as a store condition sees it: same type and same value */
  public static boolean matches(AttributeValue left, AttributeValue right) {
    if (left == null || right == null) {
      return left == right;
    }
    if (left.n() != null && right.n() != null) {
      return new BigDecimal(left.n()).compareTo(new BigDecimal(right.n())) == 0;
    }
    return Objects.equals(left, right);
  }
}
