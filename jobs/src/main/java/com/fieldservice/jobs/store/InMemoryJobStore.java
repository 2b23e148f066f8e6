package com.fieldservice.jobs.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Map-backed store for local runs and tests. Writes take the write lock and reads the read lock,
 * so a transaction is either fully visible or not at all, as with DynamoDB's TransactWriteItems.
 */
public class InMemoryJobStore implements JobStore {

  private final Map<String, Map<String, Map<String, AttributeValue>>> collections =
      new ConcurrentHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public Map<String, AttributeValue> get(String collection, String id) {
    lock.readLock().lock();
    try {
      return copyOf(records(collection).get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void put(String collection, String id, Map<String, AttributeValue> record) {
    lock.writeLock().lock();
    try {
      applyPut(collection, id, record);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void update(String collection, String id, Map<String, AttributeValue> partialRecord) {
    lock.writeLock().lock();
    try {
      applyUpdate(collection, id, partialRecord);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void delete(String collection, String id) {
    lock.writeLock().lock();
    try {
      records(collection).remove(id);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Map<String, AttributeValue>> query(String collection, StoreQuery query) {
    List<Map<String, AttributeValue>> matching = new ArrayList<>();
    Map<String, AttributeValue> cursor;
    lock.readLock().lock();
    try {
      for (Map<String, AttributeValue> record : records(collection).values()) {
        if (query.predicates().stream().allMatch(predicate -> predicate.matches(record))) {
          matching.add(new HashMap<>(record));
        }
      }
      cursor = query.afterId() == null ? null : copyOf(records(collection).get(query.afterId()));
    } finally {
      lock.readLock().unlock();
    }
    return StoreQueries.window(
        matching, query, StoreCollections.keyAttribute(collection), cursor);
  }

  @Override
  public void transaction(List<WriteOperation> operations) throws TransactionConflictException {
    lock.writeLock().lock();
    try {
      for (int i = 0; i < operations.size(); i++) {
        WriteOperation operation = operations.get(i);
        Map<String, AttributeValue> current = records(operation.collection()).get(operation.id());
        if (!operation.isSatisfiedBy(current)) {
          throw new TransactionConflictException(
              "Condition failed for " + operation.collection() + "/" + operation.id(), i);
        }
      }
      for (WriteOperation operation : operations) {
        switch (operation.type()) {
          case PUT -> applyPut(operation.collection(), operation.id(), operation.attributes());
          case UPDATE -> applyUpdate(operation.collection(), operation.id(), operation.attributes());
          case DELETE -> records(operation.collection()).remove(operation.id());
          case CONDITION_CHECK -> {}
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void applyPut(String collection, String id, Map<String, AttributeValue> record) {
    records(collection).put(id, withKey(collection, id, record));
  }

  private void applyUpdate(String collection, String id, Map<String, AttributeValue> partialRecord) {
    Map<String, AttributeValue> current = records(collection).get(id);
    Map<String, AttributeValue> merged = current == null ? new HashMap<>() : new HashMap<>(current);
    merged.putAll(partialRecord);
    records(collection).put(id, withKey(collection, id, merged));
  }

  private Map<String, Map<String, AttributeValue>> records(String collection) {
    return collections.computeIfAbsent(collection, name -> new ConcurrentHashMap<>());
  }

  private static Map<String, AttributeValue> copyOf(Map<String, AttributeValue> record) {
    return record == null ? null : new HashMap<>(record);
  }

  private static Map<String, AttributeValue> withKey(
      String collection, String id, Map<String, AttributeValue> record) {
    Map<String, AttributeValue> copy = new HashMap<>(record);
    copy.put(StoreCollections.keyAttribute(collection), AttributeValues.s(id));
    return copy;
  }
}
