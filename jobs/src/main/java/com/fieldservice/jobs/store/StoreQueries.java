package com.fieldservice.jobs.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Ordering and cursor windowing shared by the store implementations */
final class StoreQueries {

  private StoreQueries() {}

  static Comparator<Map<String, AttributeValue>> ordering(String orderBy, String keyAttribute, boolean descending) {
    Comparator<Map<String, AttributeValue>> byKey =
        (a, b) -> AttributeValues.compare(a.get(keyAttribute), b.get(keyAttribute));
    Comparator<Map<String, AttributeValue>> comparator =
        orderBy == null
            ? byKey
            : ((Comparator<Map<String, AttributeValue>>)
                    (a, b) -> AttributeValues.compare(a.get(orderBy), b.get(orderBy)))
                .thenComparing(byKey);
    return descending ? comparator.reversed() : comparator;
  }

  /**
   * Sorts the matching records and returns the window after the cursor record
   *
   * @param matching records that passed every predicate
   * @param query the query being answered
   * @param keyAttribute key attribute of the collection
   * @param cursorRecord the record named by the cursor, or null to start from the top
   */
  static List<Map<String, AttributeValue>> window(
      List<Map<String, AttributeValue>> matching,
      StoreQuery query,
      String keyAttribute,
      Map<String, AttributeValue> cursorRecord) {
    Comparator<Map<String, AttributeValue>> ordering =
        ordering(query.orderBy(), keyAttribute, query.descending());
    List<Map<String, AttributeValue>> sorted = new ArrayList<>(matching);
    sorted.sort(ordering);

    int start = 0;
    if (cursorRecord != null) {
      while (start < sorted.size() && ordering.compare(sorted.get(start), cursorRecord) <= 0) {
        start++;
      }
    }
    int end = query.limit() > 0 ? Math.min(sorted.size(), start + query.limit()) : sorted.size();
    return new ArrayList<>(sorted.subList(start, end));
  }
}
