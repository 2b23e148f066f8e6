package com.fieldservice.jobs.store;

import com.fieldservice.jobs.exceptions.StoreFailureException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

/**
 * {@link JobStore} over DynamoDB tables. Queries scan with a filter expression and order the
 * matches in memory, since no secondary index covers the arbitrary filter combinations.
 */
public class DynamoDbJobStore implements JobStore {

  private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
  private static final String TRANSACTION_CONFLICT = "TransactionConflict";

  private final DynamoDbClient dynamoDbClient;
  private final Map<String, String> tableNames;

  /**
   * @param dynamoDbClient client used for every call
   * @param tableNames table name per collection from {@link StoreCollections}
   */
  public DynamoDbJobStore(DynamoDbClient dynamoDbClient, Map<String, String> tableNames) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableNames = Map.copyOf(tableNames);
  }

  @Override
  public Map<String, AttributeValue> get(String collection, String id) {
    try {
      GetItemResponse response =
          dynamoDbClient.getItem(
              GetItemRequest.builder()
                  .tableName(tableName(collection))
                  .key(key(collection, id))
                  .consistentRead(true)
                  .build());
      if (!response.hasItem() || response.item().isEmpty()) {
        return null;
      }
      return response.item();
    } catch (SdkException e) {
      throw new StoreFailureException("Error reading " + collection + "/" + id, e);
    }
  }

  @Override
  public void put(String collection, String id, Map<String, AttributeValue> record) {
    try {
      Map<String, AttributeValue> item = new HashMap<>(record);
      item.putAll(key(collection, id));
      dynamoDbClient.putItem(
          PutItemRequest.builder().tableName(tableName(collection)).item(item).build());
    } catch (SdkException e) {
      throw new StoreFailureException("Error writing " + collection + "/" + id, e);
    }
  }

  @Override
  public void update(String collection, String id, Map<String, AttributeValue> partialRecord) {
    if (partialRecord.isEmpty()) {
      return;
    }
    try {
      Map<String, String> names = new HashMap<>();
      Map<String, AttributeValue> values = new HashMap<>();
      String updateExpression = setExpression(partialRecord, names, values);
      names.put("#pk", StoreCollections.keyAttribute(collection));
      dynamoDbClient.updateItem(
          UpdateItemRequest.builder()
              .tableName(tableName(collection))
              .key(key(collection, id))
              .updateExpression(updateExpression)
              .conditionExpression("attribute_exists(#pk)")
              .expressionAttributeNames(names)
              .expressionAttributeValues(values)
              .build());
    } catch (ConditionalCheckFailedException e) {
      throw new StoreFailureException("Record to update does not exist: " + collection + "/" + id, e);
    } catch (SdkException e) {
      throw new StoreFailureException("Error updating " + collection + "/" + id, e);
    }
  }

  @Override
  public void delete(String collection, String id) {
    try {
      dynamoDbClient.deleteItem(
          DeleteItemRequest.builder().tableName(tableName(collection)).key(key(collection, id)).build());
    } catch (SdkException e) {
      throw new StoreFailureException("Error deleting " + collection + "/" + id, e);
    }
  }

  @Override
  public List<Map<String, AttributeValue>> query(String collection, StoreQuery query) {
    try {
      Map<String, String> names = new HashMap<>();
      Map<String, AttributeValue> values = new HashMap<>();
      String filterExpression = filterExpression(query.predicates(), names, values);

      List<Map<String, AttributeValue>> matching = new ArrayList<>();
      Map<String, AttributeValue> lastEvaluatedKey = null;

      do {
        ScanRequest.Builder scanRequest =
            ScanRequest.builder().tableName(tableName(collection)).exclusiveStartKey(lastEvaluatedKey);
        if (filterExpression != null) {
          scanRequest
              .filterExpression(filterExpression)
              .expressionAttributeNames(names)
              .expressionAttributeValues(values);
        }

        ScanResponse response = dynamoDbClient.scan(scanRequest.build());
        matching.addAll(response.items());
        lastEvaluatedKey = response.lastEvaluatedKey();

      } while (lastEvaluatedKey != null && !lastEvaluatedKey.isEmpty());

      Map<String, AttributeValue> cursor =
          query.afterId() == null ? null : get(collection, query.afterId());
      return StoreQueries.window(
          matching, query, StoreCollections.keyAttribute(collection), cursor);
    } catch (SdkException e) {
      throw new StoreFailureException("Error querying " + collection, e);
    }
  }

  @Override
  public void transaction(List<WriteOperation> operations) throws TransactionConflictException {
    List<TransactWriteItem> items = new ArrayList<>();
    for (WriteOperation operation : operations) {
      items.add(toTransactItem(operation));
    }
    try {
      dynamoDbClient.transactWriteItems(
          TransactWriteItemsRequest.builder().transactItems(items).build());
    } catch (TransactionCanceledException e) {
      List<CancellationReason> reasons =
          e.hasCancellationReasons() ? e.cancellationReasons() : List.of();
      for (int i = 0; i < reasons.size(); i++) {
        String code = reasons.get(i).code();
        if (CONDITIONAL_CHECK_FAILED.equals(code) || TRANSACTION_CONFLICT.equals(code)) {
          throw new TransactionConflictException(
              "Transaction cancelled: " + code + " on operation " + i, i);
        }
      }
      throw new StoreFailureException("Transaction cancelled: " + e.getMessage(), e);
    } catch (SdkException e) {
      throw new StoreFailureException("Error executing transaction", e);
    }
  }

  private TransactWriteItem toTransactItem(WriteOperation operation) {
    String collection = operation.collection();
    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> values = new HashMap<>();
    String condition = conditionExpression(operation, names, values);
    Map<String, AttributeValue> conditionValues = values.isEmpty() ? null : values;

    return switch (operation.type()) {
      case PUT -> {
        Map<String, AttributeValue> item = new HashMap<>(operation.attributes());
        item.putAll(key(collection, operation.id()));
        Put.Builder put = Put.builder().tableName(tableName(collection)).item(item);
        if (condition != null) {
          put.conditionExpression(condition)
              .expressionAttributeNames(names)
              .expressionAttributeValues(conditionValues);
        }
        yield TransactWriteItem.builder().put(put.build()).build();
      }
      case UPDATE -> {
        if (operation.attributes().isEmpty()) {
          // Nothing to set; still assert the conditions
          yield conditionCheck(collection, operation.id(), condition, names, conditionValues);
        }
        Map<String, AttributeValue> updateValues = new HashMap<>(values);
        String updateExpression = setExpression(operation.attributes(), names, updateValues);
        yield TransactWriteItem.builder()
            .update(
                Update.builder()
                    .tableName(tableName(collection))
                    .key(key(collection, operation.id()))
                    .updateExpression(updateExpression)
                    .conditionExpression(condition)
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(updateValues)
                    .build())
            .build();
      }
      case DELETE -> TransactWriteItem.builder()
          .delete(
              Delete.builder()
                  .tableName(tableName(collection))
                  .key(key(collection, operation.id()))
                  .conditionExpression(condition)
                  .expressionAttributeNames(names)
                  .expressionAttributeValues(conditionValues)
                  .build())
          .build();
      case CONDITION_CHECK -> conditionCheck(collection, operation.id(), condition, names, conditionValues);
    };
  }

  private TransactWriteItem conditionCheck(
      String collection,
      String id,
      String condition,
      Map<String, String> names,
      Map<String, AttributeValue> values) {
    return TransactWriteItem.builder()
        .conditionCheck(
            ConditionCheck.builder()
                .tableName(tableName(collection))
                .key(key(collection, id))
                .conditionExpression(condition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .build())
        .build();
  }

  /** Builds the commit-time condition; null for an unconditional put. */
  private static String conditionExpression(
      WriteOperation operation, Map<String, String> names, Map<String, AttributeValue> values) {
    List<String> clauses = new ArrayList<>();
    if (operation.mustNotExist()) {
      names.put("#pk", StoreCollections.keyAttribute(operation.collection()));
      clauses.add("attribute_not_exists(#pk)");
    } else if (operation.type() != WriteOperation.Type.PUT) {
      names.put("#pk", StoreCollections.keyAttribute(operation.collection()));
      clauses.add("attribute_exists(#pk)");
    }
    int i = 0;
    for (Map.Entry<String, AttributeValue> condition : operation.conditions().entrySet()) {
      names.put("#c" + i, condition.getKey());
      values.put(":c" + i, condition.getValue());
      clauses.add("#c" + i + " = :c" + i);
      i++;
    }
    return clauses.isEmpty() ? null : String.join(" AND ", clauses);
  }

  private static String setExpression(
      Map<String, AttributeValue> attributes,
      Map<String, String> names,
      Map<String, AttributeValue> values) {
    StringJoiner assignments = new StringJoiner(", ", "SET ", "");
    int i = 0;
    for (Map.Entry<String, AttributeValue> attribute : attributes.entrySet()) {
      names.put("#a" + i, attribute.getKey());
      values.put(":a" + i, attribute.getValue());
      assignments.add("#a" + i + " = :a" + i);
      i++;
    }
    return assignments.toString();
  }

  static String filterExpression(
      List<StorePredicate> predicates, Map<String, String> names, Map<String, AttributeValue> values) {
    if (predicates.isEmpty()) {
      return null;
    }
    List<String> clauses = new ArrayList<>();
    for (int i = 0; i < predicates.size(); i++) {
      StorePredicate predicate = predicates.get(i);
      String name = "#f" + i;
      names.put(name, predicate.attribute());
      List<String> placeholders = new ArrayList<>();
      for (int j = 0; j < predicate.values().size(); j++) {
        String placeholder = ":v" + i + "_" + j;
        values.put(placeholder, predicate.values().get(j));
        placeholders.add(placeholder);
      }
      String first = placeholders.get(0);
      clauses.add(
          switch (predicate.operator()) {
            case EQ -> name + " = " + first;
            case IN -> name + " IN (" + String.join(", ", placeholders) + ")";
            case GT -> name + " > " + first;
            case GTE -> name + " >= " + first;
            case LT -> name + " < " + first;
            case LTE -> name + " <= " + first;
          });
    }
    return String.join(" AND ", clauses);
  }

  private String tableName(String collection) {
    String tableName = tableNames.get(collection);
    if (tableName == null) {
      throw new StoreFailureException("No table configured for collection: " + collection);
    }
    return tableName;
  }

  private static Map<String, AttributeValue> key(String collection, String id) {
    return Map.of(StoreCollections.keyAttribute(collection), AttributeValues.s(id));
  }
}
