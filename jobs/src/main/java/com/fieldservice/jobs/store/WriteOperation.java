package com.fieldservice.jobs.store;

import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * One write inside a {@link JobStore#transaction}. Conditions are attribute equalities that must
 * hold on the stored record at commit time; every write except a put also requires the record
 * to exist.
 */
public record WriteOperation(
    Type type,
    String collection,
    String id,
    Map<String, AttributeValue> attributes,
    Map<String, AttributeValue> conditions,
    boolean mustNotExist) {

  public enum Type {
    PUT,
    UPDATE,
    DELETE,
    CONDITION_CHECK
  }

  public WriteOperation {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    conditions = conditions == null ? Map.of() : Map.copyOf(conditions);
  }

  public static WriteOperation put(String collection, String id, Map<String, AttributeValue> record) {
    return new WriteOperation(Type.PUT, collection, id, record, null, false);
  }

  public static WriteOperation putIfAbsent(
      String collection, String id, Map<String, AttributeValue> record) {
    return new WriteOperation(Type.PUT, collection, id, record, null, true);
  }

  public static WriteOperation update(
      String collection, String id, Map<String, AttributeValue> attributes) {
    return new WriteOperation(Type.UPDATE, collection, id, attributes, null, false);
  }

  public static WriteOperation updateIf(
      String collection,
      String id,
      Map<String, AttributeValue> attributes,
      Map<String, AttributeValue> conditions) {
    return new WriteOperation(Type.UPDATE, collection, id, attributes, conditions, false);
  }

  public static WriteOperation delete(String collection, String id) {
    return new WriteOperation(Type.DELETE, collection, id, null, null, false);
  }

  public static WriteOperation conditionCheck(
      String collection, String id, Map<String, AttributeValue> conditions) {
    return new WriteOperation(Type.CONDITION_CHECK, collection, id, null, conditions, false);
  }

  /** Checks this operation's preconditions against the currently stored record (null if absent) */
  public boolean isSatisfiedBy(Map<String, AttributeValue> current) {
    if (mustNotExist) {
      return current == null;
    }
    if (current == null) {
      return type == Type.PUT && conditions.isEmpty();
    }
    for (Map.Entry<String, AttributeValue> condition : conditions.entrySet()) {
      if (!AttributeValues.matches(current.get(condition.getKey()), condition.getValue())) {
        return false;
      }
    }
    return true;
  }
}
