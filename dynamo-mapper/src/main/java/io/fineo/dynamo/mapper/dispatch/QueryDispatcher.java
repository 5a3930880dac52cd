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

package io.fineo.dynamo.mapper.dispatch;

import io.fineo.dynamo.mapper.attribute.Attribute;
import io.fineo.dynamo.mapper.condition.Comparison;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.condition.NameMapper;
import io.fineo.dynamo.mapper.condition.Operator;
import io.fineo.dynamo.mapper.exception.MultipleKeyLookupException;
import io.fineo.dynamo.mapper.exception.ValidationException;
import io.fineo.dynamo.mapper.iterator.BatchGetIterator;
import io.fineo.dynamo.mapper.iterator.PagingIterator;
import io.fineo.dynamo.mapper.iterator.PointGetIterator;
import io.fineo.dynamo.mapper.iterator.ResultIterator;
import io.fineo.dynamo.mapper.key.KeyClassifier;
import io.fineo.dynamo.mapper.key.KeySpec;
import io.fineo.dynamo.mapper.key.KeyStrictness;
import io.fineo.dynamo.mapper.schema.DynamoRecord;
import io.fineo.dynamo.mapper.schema.TableSchema;
import io.fineo.dynamo.transport.DynamoTransport;
import io.fineo.dynamo.transport.ReadRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Picks the cheapest store operation that can answer a lookup:
 * <ol>
 * <li>a list of keys is read with batch gets</li>
 * <li>a single key is read with a get</li>
 * <li>a condition with equality on the hash key (and, optionally, a key-compatible comparison on
 * the range key) is a query, with the rest of the condition as the filter</li>
 * <li>an <tt>IN</tt> on the hash key of a hash-only table, with nothing else, is a batch get
 * over the candidate values</li>
 * <li>anything else scans the table with the whole condition as the filter</li>
 * </ol>
 * All validation and rendering happens when planning, before anything is sent to dynamo.
 */
public class QueryDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(QueryDispatcher.class);

  private final TableSchema schema;
  private final KeySpec keys;
  private final KeyClassifier classifier;

  public QueryDispatcher(TableSchema schema) {
    this.schema = checkNotNull(schema, "schema");
    this.keys = schema.getKeySpec();
    this.classifier = new KeyClassifier(keys);
  }

  public KeyClassifier getClassifier() {
    return classifier;
  }

  public ResultIterator<DynamoRecord> dispatch(DynamoTransport transport, String table,
    LookupStrategy strategy, ReadOptions options) {
    return execute(transport, table, plan(strategy, options), options);
  }

  public ResultIterator<DynamoRecord> execute(DynamoTransport transport, String table,
    DispatchPlan plan, ReadOptions options) {
    LOG.debug("Running {} on {}", plan, table);
    switch (plan.getOperation()) {
      case GET:
        return new PointGetIterator<>(transport, table, plan.getKeys().get(0),
          options.isConsistentRead(), schema::decode);
      case BATCH_GET:
        return new BatchGetIterator<>(transport, table, plan.getKeys(),
          options.isConsistentRead(), options.getLimit(), schema::decode);
      case QUERY:
        return new PagingIterator<>(transport, table, plan.getRequest(),
          PagingIterator.Mode.QUERY, options.getLimit(), schema::decode);
      case SCAN:
        return new PagingIterator<>(transport, table, plan.getRequest(),
          PagingIterator.Mode.SCAN, options.getLimit(), schema::decode);
      default:
        throw new IllegalStateException("Unknown operation " + plan.getOperation());
    }
  }

  public DispatchPlan plan(LookupStrategy strategy, ReadOptions options) {
    checkNotNull(strategy, "strategy");
    return strategy.visit(new LookupStrategy.Visitor<DispatchPlan>() {
      @Override
      public DispatchPlan visitHashKey(LookupStrategy.HashKey hashKey) {
        return DispatchPlan.get(resolveKey(hashKey).getKey());
      }

      @Override
      public DispatchPlan visitKeyPair(LookupStrategy.KeyPair keyPair) {
        return DispatchPlan.get(resolveKey(keyPair).getKey());
      }

      @Override
      public DispatchPlan visitKeyMap(LookupStrategy.KeyMap keyMap) {
        return DispatchPlan.get(resolveKey(keyMap).getKey());
      }

      @Override
      public DispatchPlan visitRecord(LookupStrategy.RecordKey record) {
        return DispatchPlan.get(resolveKey(record).getKey());
      }

      @Override
      public DispatchPlan visitKeyList(LookupStrategy.KeyList list) {
        if (list.getKeys().isEmpty()) {
          throw new ValidationException("Need at least one key to look up");
        }
        List<Map<String, Object>> keys = new ArrayList<>();
        for (LookupStrategy key : list.getKeys()) {
          ResolvedKey resolved = resolveKey(key);
          if (resolved.getCondition() != null) {
            throw new ValidationException(
              "Keys in a batch lookup cannot carry other conditions, got: " + key);
          }
          keys.add(resolved.getKey());
        }
        return DispatchPlan.batchGet(keys);
      }

      @Override
      public DispatchPlan visitSearch(LookupStrategy.Search search) {
        return planSearch(search.getCondition(), options);
      }
    });
  }

  private DispatchPlan planSearch(Condition condition, ReadOptions options) {
    List<Comparison> keyConditions =
      classifier.classify(condition, KeyStrictness.NONE, false);
    if (keyConditions == null) {
      return scan(condition, options, "no key condition");
    }

    Comparison hash = null;
    Comparison range = null;
    for (Comparison comparison : keyConditions) {
      if (keys.isHash(comparison.getAttribute())) {
        hash = comparison;
      } else {
        range = comparison;
      }
    }
    if (!usableForKey(hash, Operator.EQ) || (range != null && !usableForKey(range, null))) {
      return scan(condition, options, "key comparisons cannot be used to query");
    }

    NameMapper mapper = new NameMapper();
    try {
      String keyCondition = classifier.renderKeyCondition(keyConditions, mapper);
      Condition filter = classifier.filterOf(condition);
      ReadRequest request = new ReadRequest()
        .withKeyConditionExpression(keyCondition)
        .withFilterExpression(filter == null ? null : filter.asFilterExpression(mapper))
        .withScanForward(!options.isDescending())
        .withConsistentRead(options.isConsistentRead());
      withPlaceholders(request, mapper);
      LOG.debug("Querying with key condition '{}' and filter '{}'", keyCondition,
        request.getFilterExpression());
      return DispatchPlan.query(keyConditions, filter, request);
    } catch (MultipleKeyLookupException e) {
      // only a bare IN on the hash of a hash-only table names an exact set of items
      if (hash == condition && !keys.hasRange()) {
        LOG.warn("IN on hash key {} cannot be queried, reading the {} keys with batch gets",
          hash.getAttribute(), hash.getValues().size());
        List<Map<String, Object>> batch = new ArrayList<>();
        Attribute<?> attribute = hash.getAttribute();
        for (Object value : hash.getValues()) {
          batch.add(Collections.singletonMap(attribute.getName(),
            schema.encodeKey(attribute, value)));
        }
        return DispatchPlan.batchGet(batch);
      }
      return scan(condition, options, e.getMessage());
    }
  }

  /**
   * @param required operator the comparison must use, or <tt>null</tt> for any key operator.
   *                 <tt>IN</tt> is always let through, so it can be rerouted once rendering fails.
   */
  private boolean usableForKey(Comparison comparison, Operator required) {
    Operator operator = comparison.getOperator();
    if (operator == Operator.IN) {
      return true;
    }
    return required == null ? operator.isKeyOperator() : operator == required;
  }

  private DispatchPlan scan(Condition condition, ReadOptions options, String reason) {
    NameMapper mapper = new NameMapper();
    ReadRequest request = new ReadRequest()
      .withFilterExpression(condition.asFilterExpression(mapper))
      .withConsistentRead(options.isConsistentRead());
    withPlaceholders(request, mapper);
    LOG.warn("Scanning {} ({}) with filter: {}", schema.getName(), reason, condition);
    return DispatchPlan.scan(condition, request);
  }

  private static void withPlaceholders(ReadRequest request, NameMapper mapper) {
    request.withNameMap(new LinkedHashMap<>(mapper.getNameMap()))
      .withValueMap(new LinkedHashMap<>(mapper.getValueMap()));
  }

  /**
   * Resolve a lookup that has to name exactly one item. Conditions must give every key
   * attribute with equality; the rest of the condition is handed back alongside the key.
   *
   * @throws ValidationException if the lookup does not name exactly one item
   */
  public ResolvedKey resolveKey(LookupStrategy strategy) {
    checkNotNull(strategy, "strategy");
    return strategy.visit(new LookupStrategy.Visitor<ResolvedKey>() {
      @Override
      public ResolvedKey visitHashKey(LookupStrategy.HashKey hashKey) {
        if (keys.hasRange()) {
          throw new ValidationException(
            schema.getName() + " has a range key, so both hash and range values are needed. Got: "
            + hashKey);
        }
        Map<String, Object> key = new LinkedHashMap<>();
        key.put(keys.getHash().getName(), schema.encodeKey(keys.getHash(), hashKey.getValue()));
        return new ResolvedKey(key, null);
      }

      @Override
      public ResolvedKey visitKeyPair(LookupStrategy.KeyPair keyPair) {
        if (!keys.hasRange()) {
          throw new ValidationException(
            schema.getName() + " only has a hash key, but got a pair: " + keyPair);
        }
        Map<String, Object> key = new LinkedHashMap<>();
        key.put(keys.getHash().getName(), schema.encodeKey(keys.getHash(), keyPair.getHash()));
        key.put(keys.getRange().getName(),
          schema.encodeKey(keys.getRange(), keyPair.getRange()));
        return new ResolvedKey(key, null);
      }

      @Override
      public ResolvedKey visitKeyMap(LookupStrategy.KeyMap keyMap) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (Attribute<?> attribute : keys.getAttributes()) {
          Object value = keyMap.getKey().get(attribute.getName());
          if (Attribute.isEmpty(value)) {
            throw new ValidationException(
              "Missing value for key attribute '" + attribute + "' in " + keyMap);
          }
          key.put(attribute.getName(), attribute.encode(value));
        }
        return new ResolvedKey(key, null);
      }

      @Override
      public ResolvedKey visitRecord(LookupStrategy.RecordKey record) {
        return new ResolvedKey(schema.keyOf(record.getRecord()), null);
      }

      @Override
      public ResolvedKey visitKeyList(LookupStrategy.KeyList list) {
        throw new ValidationException("Expected the key of a single item, got a list: " + list);
      }

      @Override
      public ResolvedKey visitSearch(LookupStrategy.Search search) {
        Condition condition = search.getCondition();
        return new ResolvedKey(classifier.keyMap(condition), classifier.filterOf(condition));
      }
    });
  }
}
