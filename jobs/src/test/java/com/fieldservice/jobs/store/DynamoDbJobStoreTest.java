package com.fieldservice.jobs.store;

import static com.fieldservice.jobs.store.AttributeValues.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fieldservice.jobs.exceptions.StoreFailureException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

@ExtendWith(MockitoExtension.class)
class DynamoDbJobStoreTest {

  @Mock private DynamoDbClient client;
  private DynamoDbJobStore store;

  @BeforeEach
  void setUp() {
    store =
        new DynamoDbJobStore(
            client,
            Map.of(StoreCollections.JOBS, "Jobs", StoreCollections.ASSIGNMENTS, "JobAssignments",
                StoreCollections.USERS, "Users"));
  }

  @Test
  void buildsFilterExpressionWithPlaceholders() {
    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> values = new HashMap<>();

    String expression =
        DynamoDbJobStore.filterExpression(
            List.of(
                StorePredicate.in("status", List.of(s("assigned"), s("pending"))),
                StorePredicate.lt("scheduledDate", n(1000))),
            names,
            values);

    assertEquals("#f0 IN (:v0_0, :v0_1) AND #f1 < :v1_0", expression);
    assertEquals(Map.of("#f0", "status", "#f1", "scheduledDate"), names);
    assertEquals(s("pending"), values.get(":v0_1"));
    assertNull(DynamoDbJobStore.filterExpression(List.of(), names, values));
  }

  @Test
  void queryScansEveryPageThenWindows() {
    Map<String, AttributeValue> lastKey = Map.of("jobId", s("b"));
    when(client.scan(any(ScanRequest.class)))
        .thenReturn(
            ScanResponse.builder()
                .items(List.of(Map.of("jobId", s("a"), "createdAt", n(1)), Map.of("jobId", s("b"), "createdAt", n(3))))
                .lastEvaluatedKey(lastKey)
                .build())
        .thenReturn(
            ScanResponse.builder().items(List.of(Map.of("jobId", s("c"), "createdAt", n(2)))).build());

    List<Map<String, AttributeValue>> records =
        store.query(StoreCollections.JOBS, StoreQuery.builder().orderBy("createdAt", true).limit(2).build());

    assertEquals(List.of(s("b"), s("c")), List.of(records.get(0).get("jobId"), records.get(1).get("jobId")));
    ArgumentCaptor<ScanRequest> scans = ArgumentCaptor.forClass(ScanRequest.class);
    verify(client, times(2)).scan(scans.capture());
    assertEquals("Jobs", scans.getAllValues().get(0).tableName());
    assertEquals(lastKey, scans.getAllValues().get(1).exclusiveStartKey());
  }

  @Test
  void getUsesConsistentReadAndMapsMissingToNull() {
    when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

    assertNull(store.get(StoreCollections.USERS, "tech-1"));

    ArgumentCaptor<GetItemRequest> request = ArgumentCaptor.forClass(GetItemRequest.class);
    verify(client).getItem(request.capture());
    assertTrue(request.getValue().consistentRead());
    assertEquals(Map.of("userId", s("tech-1")), request.getValue().key());
  }

  @Test
  void conditionalFailureBecomesConflictWithIndex() {
    when(client.transactWriteItems(any(TransactWriteItemsRequest.class)))
        .thenThrow(
            TransactionCanceledException.builder()
                .message("cancelled")
                .cancellationReasons(
                    CancellationReason.builder().code("None").build(),
                    CancellationReason.builder().code("ConditionalCheckFailed").build())
                .build());

    TransactionConflictException e =
        assertThrows(
            TransactionConflictException.class,
            () ->
                store.transaction(
                    List.of(
                        WriteOperation.update(StoreCollections.JOBS, "a", Map.of("status", s("x"))),
                        WriteOperation.conditionCheck(StoreCollections.USERS, "t", Map.of("isActive", bool(true))))));

    assertEquals(1, e.getFailedOperationIndex());
  }

  @Test
  void otherCancellationIsStoreFailure() {
    when(client.transactWriteItems(any(TransactWriteItemsRequest.class)))
        .thenThrow(
            TransactionCanceledException.builder()
                .message("throttled")
                .cancellationReasons(CancellationReason.builder().code("ThrottlingError").build())
                .build());

    assertThrows(
        StoreFailureException.class,
        () -> store.transaction(List.of(WriteOperation.delete(StoreCollections.JOBS, "a"))));
  }

  @Test
  void transactionItemsCarryConditions() throws Exception {
    when(client.transactWriteItems(any(TransactWriteItemsRequest.class)))
        .thenReturn(TransactWriteItemsResponse.builder().build());

    store.transaction(
        List.of(
            WriteOperation.updateIf(
                StoreCollections.JOBS, "job-1", Map.of("status", s("assigned")), Map.of("status", s("pending"))),
            WriteOperation.putIfAbsent(StoreCollections.ASSIGNMENTS, "as-1", Map.of("jobId", s("job-1")))));

    ArgumentCaptor<TransactWriteItemsRequest> request = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
    verify(client).transactWriteItems(request.capture());
    List<TransactWriteItem> items = request.getValue().transactItems();

    Update update = items.get(0).update();
    assertEquals("Jobs", update.tableName());
    assertEquals("SET #a0 = :a0", update.updateExpression());
    assertEquals("attribute_exists(#pk) AND #c0 = :c0", update.conditionExpression());
    assertEquals("jobId", update.expressionAttributeNames().get("#pk"));
    assertEquals(s("pending"), update.expressionAttributeValues().get(":c0"));
    assertEquals(s("assigned"), update.expressionAttributeValues().get(":a0"));

    Put put = items.get(1).put();
    assertEquals("JobAssignments", put.tableName());
    assertEquals("attribute_not_exists(#pk)", put.conditionExpression());
    assertEquals(s("as-1"), put.item().get("assignmentId"));
  }

  @Test
  void sdkErrorsBecomeStoreFailures() {
    when(client.getItem(any(GetItemRequest.class)))
        .thenThrow(DynamoDbException.builder().message("boom").build());

    assertThrows(StoreFailureException.class, () -> store.get(StoreCollections.JOBS, "a"));
  }
}
