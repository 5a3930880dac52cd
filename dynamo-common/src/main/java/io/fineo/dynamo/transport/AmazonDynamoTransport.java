/*
 *    Copyright 2016 Fineo, Inc.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package io.fineo.dynamo.transport;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.document.ItemUtils;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemRequest;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemResult;
import com.amazonaws.services.dynamodbv2.model.BatchWriteItemRequest;
import com.amazonaws.services.dynamodbv2.model.BatchWriteItemResult;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.DeleteRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemResult;
import com.amazonaws.services.dynamodbv2.model.KeysAndAttributes;
import com.amazonaws.services.dynamodbv2.model.PutItemRequest;
import com.amazonaws.services.dynamodbv2.model.PutRequest;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ReturnValue;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.amazonaws.services.dynamodbv2.model.WriteRequest;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link DynamoTransport} backed by the AWS SDK low-level client. Values cross the boundary as
 * 'simple' java values and are converted with {@link ItemUtils}.
 */
public class AmazonDynamoTransport implements DynamoTransport {

  private static final Logger LOG = LoggerFactory.getLogger(AmazonDynamoTransport.class);
  // limit imposed by AWS on the number of requests in a single batch write
  static final int MAX_BATCH_WRITE = 25;
  // how many times we resubmit items dynamo handed back as unprocessed before giving up
  private static final int MAX_UNPROCESSED_RESUBMITS = 10;
  // wait before the first resubmit, doubled for each one after that
  private static final long DEFAULT_RESUBMIT_BACKOFF_MILLIS = 50;
  private static final long MAX_RESUBMIT_BACKOFF_MILLIS = 2000;

  private final AmazonDynamoDB client;
  private final long resubmitBackoffMillis;

  public AmazonDynamoTransport(AmazonDynamoDB client) {
    this(client, DEFAULT_RESUBMIT_BACKOFF_MILLIS);
  }

  @VisibleForTesting
  AmazonDynamoTransport(AmazonDynamoDB client, long resubmitBackoffMillis) {
    this.client = checkNotNull(client, "client");
    checkArgument(resubmitBackoffMillis >= 0, "Negative resubmit backoff: %s",
      resubmitBackoffMillis);
    this.resubmitBackoffMillis = resubmitBackoffMillis;
  }

  @Override
  public Map<String, Object> get(String table, Map<String, Object> key, boolean consistentRead) {
    GetItemRequest request = new GetItemRequest()
      .withTableName(table)
      .withKey(ItemUtils.fromSimpleMap(key))
      .withConsistentRead(consistentRead);
    GetItemResult result = client.getItem(request);
    return fromDynamo(result.getItem());
  }

  @Override
  public BatchGetPage batchGet(String table, List<Map<String, Object>> keys,
    boolean consistentRead) {
    List<Map<String, AttributeValue>> dynamoKeys =
      keys.stream().map(ItemUtils::fromSimpleMap).collect(Collectors.toList());
    KeysAndAttributes request = new KeysAndAttributes()
      .withKeys(dynamoKeys)
      .withConsistentRead(consistentRead);
    BatchGetItemResult result = client.batchGetItem(
      new BatchGetItemRequest().withRequestItems(Collections.singletonMap(table, request)));

    List<Map<String, Object>> items = new ArrayList<>();
    if (result.getResponses() != null && result.getResponses().get(table) != null) {
      for (Map<String, AttributeValue> item : result.getResponses().get(table)) {
        items.add(fromDynamo(item));
      }
    }
    List<Map<String, Object>> unprocessed = new ArrayList<>();
    if (result.getUnprocessedKeys() != null) {
      KeysAndAttributes remaining = result.getUnprocessedKeys().get(table);
      if (remaining != null && remaining.getKeys() != null) {
        for (Map<String, AttributeValue> key : remaining.getKeys()) {
          unprocessed.add(fromDynamo(key));
        }
      }
    }
    return new BatchGetPage(items, unprocessed);
  }

  @Override
  public Map<String, Object> put(String table, Map<String, Object> item,
    WriteCondition condition) {
    PutItemRequest request = new PutItemRequest()
      .withTableName(table)
      .withItem(ItemUtils.fromSimpleMap(item))
      .withReturnValues(ReturnValue.ALL_OLD);
    if (condition != null) {
      request.withConditionExpression(condition.getExpression());
      request.withExpressionAttributeNames(names(condition.getNameMap()));
      request.withExpressionAttributeValues(values(condition.getValueMap()));
    }
    return fromDynamo(client.putItem(request).getAttributes());
  }

  @Override
  public Map<String, Object> delete(String table, Map<String, Object> key,
    WriteCondition condition) {
    DeleteItemRequest request = new DeleteItemRequest()
      .withTableName(table)
      .withKey(ItemUtils.fromSimpleMap(key))
      .withReturnValues(ReturnValue.ALL_OLD);
    if (condition != null) {
      request.withConditionExpression(condition.getExpression());
      request.withExpressionAttributeNames(names(condition.getNameMap()));
      request.withExpressionAttributeValues(values(condition.getValueMap()));
    }
    return fromDynamo(client.deleteItem(request).getAttributes());
  }

  @Override
  public void batchWrite(String table, List<Map<String, Object>> puts,
    List<Map<String, Object>> deletes) {
    List<WriteRequest> requests = new ArrayList<>();
    for (Map<String, Object> item : puts) {
      requests.add(new WriteRequest(new PutRequest().withItem(ItemUtils.fromSimpleMap(item))));
    }
    for (Map<String, Object> key : deletes) {
      requests.add(new WriteRequest(new DeleteRequest().withKey(ItemUtils.fromSimpleMap(key))));
    }

    for (List<WriteRequest> chunk : Lists.partition(requests, MAX_BATCH_WRITE)) {
      List<WriteRequest> pending = chunk;
      int sent = 0;
      while (true) {
        BatchWriteItemResult result = client.batchWriteItem(
          new BatchWriteItemRequest().withRequestItems(Collections.singletonMap(table, pending)));
        sent++;
        Map<String, List<WriteRequest>> unprocessed = result.getUnprocessedItems();
        pending = unprocessed == null || unprocessed.get(table) == null ?
                  Collections.emptyList() : unprocessed.get(table);
        if (pending.isEmpty()) {
          break;
        }
        if (sent > MAX_UNPROCESSED_RESUBMITS) {
          throw new IllegalStateException(
            "Dynamo did not accept " + pending.size() + " writes to " + table + " after "
            + sent + " requests");
        }
        LOG.debug("Resubmitting {} unprocessed writes to {}", pending.size(), table);
        pauseBeforeResubmit(table, sent);
      }
    }
  }

  private void pauseBeforeResubmit(String table, int sent) {
    long wait = Math.min(resubmitBackoffMillis << (sent - 1), MAX_RESUBMIT_BACKOFF_MILLIS);
    if (wait == 0) {
      return;
    }
    try {
      Thread.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(
        "Interrupted while waiting to resubmit unprocessed writes to " + table, e);
    }
  }

  @Override
  public ItemPage query(String table, ReadRequest read) {
    QueryRequest request = new QueryRequest()
      .withTableName(table)
      .withKeyConditionExpression(read.getKeyConditionExpression())
      .withFilterExpression(read.getFilterExpression())
      .withExpressionAttributeNames(names(read.getNameMap()))
      .withExpressionAttributeValues(values(read.getValueMap()))
      .withExclusiveStartKey(ItemUtils.fromSimpleMap(read.getExclusiveStartKey()))
      .withLimit(read.getLimit())
      .withScanIndexForward(read.isScanForward())
      .withConsistentRead(read.isConsistentRead());
    QueryResult result = client.query(request);
    return new ItemPage(fromDynamo(result.getItems()), fromDynamo(result.getLastEvaluatedKey()));
  }

  @Override
  public ItemPage scan(String table, ReadRequest read) {
    ScanRequest request = new ScanRequest()
      .withTableName(table)
      .withFilterExpression(read.getFilterExpression())
      .withExpressionAttributeNames(names(read.getNameMap()))
      .withExpressionAttributeValues(values(read.getValueMap()))
      .withExclusiveStartKey(ItemUtils.fromSimpleMap(read.getExclusiveStartKey()))
      .withLimit(read.getLimit())
      .withConsistentRead(read.isConsistentRead());
    ScanResult result = client.scan(request);
    return new ItemPage(fromDynamo(result.getItems()), fromDynamo(result.getLastEvaluatedKey()));
  }

  @Override
  public Map<String, Object> update(String table, Map<String, Object> key,
    UpdateRequest update) {
    UpdateItemRequest request = new UpdateItemRequest()
      .withTableName(table)
      .withKey(ItemUtils.fromSimpleMap(key))
      .withUpdateExpression(update.getUpdateExpression())
      .withConditionExpression(update.getConditionExpression())
      .withExpressionAttributeNames(names(update.getNameMap()))
      .withExpressionAttributeValues(values(update.getValueMap()))
      .withReturnValues(ReturnValue.ALL_NEW);
    return fromDynamo(client.updateItem(request).getAttributes());
  }

  // dynamo rejects empty placeholder maps, so they have to be left off the request entirely
  private static Map<String, String> names(Map<String, String> names) {
    return names == null || names.isEmpty() ? null : names;
  }

  private static Map<String, AttributeValue> values(Map<String, Object> values) {
    return values == null || values.isEmpty() ? null : ItemUtils.fromSimpleMap(values);
  }

  private static Map<String, Object> fromDynamo(Map<String, AttributeValue> item) {
    if (item == null || item.isEmpty()) {
      return null;
    }
    return ItemUtils.toSimpleMapValue(item);
  }

  private static List<Map<String, Object>> fromDynamo(List<Map<String, AttributeValue>> items) {
    if (items == null) {
      return Collections.emptyList();
    }
    return items.stream().map(AmazonDynamoTransport::fromDynamo).collect(Collectors.toList());
  }
}
