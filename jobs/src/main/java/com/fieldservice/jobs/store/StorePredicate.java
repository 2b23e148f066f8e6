package com.fieldservice.jobs.store;

import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** A filter on one attribute that a store can evaluate itself */
public record StorePredicate(String attribute, Operator operator, List<AttributeValue> values) {

  public enum Operator {
    EQ,
    IN,
    GT,
    GTE,
    LT,
    LTE
  }

  public StorePredicate {
    values = List.copyOf(values);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Predicate on " + attribute + " needs a value");
    }
  }

  public static StorePredicate eq(String attribute, AttributeValue value) {
    return new StorePredicate(attribute, Operator.EQ, List.of(value));
  }

  public static StorePredicate in(String attribute, List<AttributeValue> values) {
    return new StorePredicate(attribute, Operator.IN, values);
  }

  public static StorePredicate gt(String attribute, AttributeValue value) {
    return new StorePredicate(attribute, Operator.GT, List.of(value));
  }

  public static StorePredicate gte(String attribute, AttributeValue value) {
    return new StorePredicate(attribute, Operator.GTE, List.of(value));
  }

  public static StorePredicate lt(String attribute, AttributeValue value) {
    return new StorePredicate(attribute, Operator.LT, List.of(value));
  }

  public static StorePredicate lte(String attribute, AttributeValue value) {
    return new StorePredicate(attribute, Operator.LTE, List.of(value));
  }

  /** Evaluates the predicate against a record. A missing attribute never matches. */
  public boolean matches(Map<String, AttributeValue> item) {
    AttributeValue actual = item.get(attribute);
    if (actual == null) {
      return false;
    }
    AttributeValue expected = values.get(0);
    return switch (operator) {
      case EQ -> AttributeValues.matches(actual, expected);
      case IN -> values.stream().anyMatch(value -> AttributeValues.matches(actual, value));
      case GT -> AttributeValues.compare(actual, expected) > 0;
      case GTE -> AttributeValues.compare(actual, expected) >= 0;
      case LT -> AttributeValues.compare(actual, expected) < 0;
      case LTE -> AttributeValues.compare(actual, expected) <= 0;
    };
  }
}
