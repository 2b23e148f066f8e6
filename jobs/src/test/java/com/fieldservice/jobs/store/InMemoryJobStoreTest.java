package com.fieldservice.jobs.store;

import static com.fieldservice.jobs.store.AttributeValues.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class InMemoryJobStoreTest {

  private InMemoryJobStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryJobStore();
    store.put(StoreCollections.JOBS, "a", Map.of("status", s("pending"), "rank", n(2)));
    store.put(StoreCollections.JOBS, "b", Map.of("status", s("assigned"), "rank", n(10)));
    store.put(StoreCollections.JOBS, "c", Map.of("status", s("pending"), "rank", n(2)));
  }

  @Test
  void putAddsKeyAttribute() {
    assertEquals(s("a"), store.get(StoreCollections.JOBS, "a").get("jobId"));
    assertNull(store.get(StoreCollections.JOBS, "zzz"));
  }

  @Test
  void updateMergesAttributes() {
    store.update(StoreCollections.JOBS, "a", Map.of("status", s("cancelled")));

    Map<String, AttributeValue> record = store.get(StoreCollections.JOBS, "a");
    assertEquals(s("cancelled"), record.get("status"));
    assertEquals(n(2), record.get("rank"));
  }

  @Test
  void queryOrdersNumericallyWithKeyTiebreak() {
    List<String> ids = ids(store.query(StoreCollections.JOBS, StoreQuery.builder().orderBy("rank", true).build()));

    assertEquals(List.of("b", "c", "a"), ids);
  }

  @Test
  void queryFiltersAndWindows() {
    StoreQuery pending =
        StoreQuery.builder().where(StorePredicate.eq("status", s("pending"))).orderBy("rank", false).limit(1).build();

    assertEquals(List.of("a"), ids(store.query(StoreCollections.JOBS, pending)));

    StoreQuery next =
        StoreQuery.builder()
            .where(StorePredicate.eq("status", s("pending")))
            .orderBy("rank", false)
            .afterId("a")
            .build();
    assertEquals(List.of("c"), ids(store.query(StoreCollections.JOBS, next)));
  }

  @Test
  void rangePredicatesCompareNumerically() {
    StoreQuery above = StoreQuery.builder().where(StorePredicate.gt("rank", n(2))).build();
    StoreQuery atLeast = StoreQuery.builder().where(StorePredicate.gte("rank", n(2))).build();

    assertEquals(List.of("b"), ids(store.query(StoreCollections.JOBS, above)));
    assertEquals(3, store.query(StoreCollections.JOBS, atLeast).size());
  }

  @Test
  void missingAttributeNeverMatches() {
    StoreQuery query = StoreQuery.builder().where(StorePredicate.lt("startedAt", n(100))).build();

    assertTrue(store.query(StoreCollections.JOBS, query).isEmpty());
  }

  @Test
  void failedConditionAbortsWholeTransaction() {
    TransactionConflictException e =
        assertThrows(
            TransactionConflictException.class,
            () ->
                store.transaction(
                    List.of(
                        WriteOperation.update(StoreCollections.JOBS, "a", Map.of("status", s("assigned"))),
                        WriteOperation.updateIf(
                            StoreCollections.JOBS, "b", Map.of("status", s("cancelled")), Map.of("status", s("pending"))))));

    assertEquals(1, e.getFailedOperationIndex());
    assertEquals(s("pending"), store.get(StoreCollections.JOBS, "a").get("status"));
  }

  @Test
  void putIfAbsentAndConditionCheck() throws Exception {
    assertThrows(
        TransactionConflictException.class,
        () -> store.transaction(List.of(WriteOperation.putIfAbsent(StoreCollections.JOBS, "a", Map.of()))));
    assertThrows(
        TransactionConflictException.class,
        () -> store.transaction(List.of(WriteOperation.update(StoreCollections.JOBS, "missing", Map.of("x", n(1))))));

    store.transaction(
        List.of(
            WriteOperation.conditionCheck(StoreCollections.JOBS, "b", Map.of("rank", n(10.0))),
            WriteOperation.putIfAbsent(StoreCollections.ASSIGNMENTS, "as-1", Map.of("jobId", s("b")))));

    assertEquals(s("as-1"), store.get(StoreCollections.ASSIGNMENTS, "as-1").get("assignmentId"));
  }

  @Test
  void readersNeverSeeHalfAppliedTransaction() throws Exception {
    store.put(StoreCollections.JOBS, "x", Map.of("version", n(0)));
    store.put(StoreCollections.JOBS, "y", Map.of("version", n(0)));
    AtomicBoolean writing = new AtomicBoolean(true);
    AtomicInteger tornReads = new AtomicInteger();

    ExecutorService executor = Executors.newFixedThreadPool(2);
    Future<?> writer =
        executor.submit(
            () -> {
              try {
                for (int i = 1; i <= 20_000; i++) {
                  store.transaction(
                      List.of(
                          WriteOperation.update(StoreCollections.JOBS, "x", Map.of("version", n(i))),
                          WriteOperation.update(StoreCollections.JOBS, "y", Map.of("version", n(i)))));
                }
              } finally {
                writing.set(false);
              }
              return null;
            });
    Future<?> reader =
        executor.submit(
            () -> {
              while (writing.get()) {
                long x = version(store.get(StoreCollections.JOBS, "x"));
                long y = version(store.get(StoreCollections.JOBS, "y"));
                if (y < x) {
                  tornReads.incrementAndGet();
                }
              }
            });

    writer.get(30, TimeUnit.SECONDS);
    reader.get(30, TimeUnit.SECONDS);
    executor.shutdown();

    assertEquals(0, tornReads.get());
    assertEquals(20_000L, version(store.get(StoreCollections.JOBS, "y")));
  }

  private static long version(Map<String, AttributeValue> record) {
    return Long.parseLong(record.get("version").n());
  }

  private static List<String> ids(List<Map<String, AttributeValue>> records) {
    return records.stream().map(record -> record.get("jobId").s()).collect(Collectors.toList());
  }
}
