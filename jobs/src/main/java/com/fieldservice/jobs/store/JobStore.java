package com.fieldservice.jobs.store;

import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Document store the engine reads and writes through. Records are DynamoDB attribute maps keyed
 * by collection and identifier. Implementations surface failures as {@link
 * com.fieldservice.jobs.exceptions.StoreFailureException}.
 */
public interface JobStore {

  /**
   * Reads one record
   *
   * @param collection collection name from {@link StoreCollections}
   * @param id record identifier
   * @return the record, or null when absent
   */
  Map<String, AttributeValue> get(String collection, String id);

  /** Creates or replaces a record */
  void put(String collection, String id, Map<String, AttributeValue> record);

  /** Sets the given attributes on an existing record, leaving the others untouched */
  void update(String collection, String id, Map<String, AttributeValue> partialRecord);

  void delete(String collection, String id);

  /**
   * Returns the records matching every predicate, ordered by {@link StoreQuery#orderBy()} with the
   * record key as tiebreak, starting strictly after the record named by {@link
   * StoreQuery#afterId()}. A cursor that no longer exists restarts from the top.
   */
  List<Map<String, AttributeValue>> query(String collection, StoreQuery query);

  /**
   * Applies all writes atomically or none of them
   *
   * @throws TransactionConflictException when a write condition no longer holds
   */
  void transaction(List<WriteOperation> operations) throws TransactionConflictException;
}
