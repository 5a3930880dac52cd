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

package io.fineo.dynamo.mapper.table;

import io.fineo.dynamo.config.DynamoConnection;
import io.fineo.dynamo.mapper.attribute.Attribute;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.condition.NameMapper;
import io.fineo.dynamo.mapper.dispatch.DispatchPlan;
import io.fineo.dynamo.mapper.dispatch.LookupStrategy;
import io.fineo.dynamo.mapper.dispatch.QueryDispatcher;
import io.fineo.dynamo.mapper.dispatch.ReadOptions;
import io.fineo.dynamo.mapper.dispatch.ResolvedKey;
import io.fineo.dynamo.mapper.exception.ConditionalCheckFailedException;
import io.fineo.dynamo.mapper.exception.ValidationException;
import io.fineo.dynamo.mapper.iterator.ResultIterator;
import io.fineo.dynamo.mapper.schema.DynamoRecord;
import io.fineo.dynamo.mapper.schema.TableSchema;
import io.fineo.dynamo.mapper.update.CompiledUpdate;
import io.fineo.dynamo.mapper.update.SetUpdate;
import io.fineo.dynamo.mapper.update.Update;
import io.fineo.dynamo.mapper.update.UpdateCompiler;
import io.fineo.dynamo.transport.DynamoTransport;
import io.fineo.dynamo.transport.UpdateRequest;
import io.fineo.dynamo.transport.WriteCondition;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads and writes the items of a single table.
 * <p>
 * Lookups are described with a {@link LookupStrategy} and turned into the cheapest store
 * operation by the {@link QueryDispatcher}. Guarded single-item writes throw
 * {@link ConditionalCheckFailedException} when the guard fails; bulk writes collect those items
 * in {@link BatchResult#getFailed()} and carry on.
 */
public class DynamoTable {

  private static final Logger LOG = LoggerFactory.getLogger(DynamoTable.class);

  private final TableSchema schema;
  private final Supplier<DynamoTransport> transport;
  private final String tableName;
  private final boolean consistentRead;
  private final QueryDispatcher dispatcher;
  private final UpdateCompiler compiler;

  public DynamoTable(TableSchema schema, DynamoConnection connection) {
    this(schema, connection::transport, connection.prefixedTableName(schema.getName()),
      connection.isConsistentRead(), new UpdateCompiler());
  }

  public DynamoTable(TableSchema schema, DynamoTransport transport, String tableName,
    boolean consistentRead) {
    this(schema, () -> transport, tableName, consistentRead, new UpdateCompiler());
  }

  public DynamoTable(TableSchema schema, Supplier<DynamoTransport> transport, String tableName,
    boolean consistentRead, UpdateCompiler compiler) {
    this.schema = checkNotNull(schema, "schema");
    this.transport = checkNotNull(transport, "transport");
    this.tableName = checkNotNull(tableName, "tableName");
    this.consistentRead = consistentRead;
    this.dispatcher = new QueryDispatcher(schema);
    this.compiler = checkNotNull(compiler, "compiler");
  }

  /**
   * Lookup over a list of (hash, range) key pairs
   */
  public static LookupStrategy keysIn(List<? extends Pair<?, ?>> pairs) {
    List<LookupStrategy> keys = new ArrayList<>();
    for (Pair<?, ?> pair : pairs) {
      keys.add(LookupStrategy.keyPair(pair));
    }
    return LookupStrategy.keys(keys);
  }

  public TableSchema getSchema() {
    return schema;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * @return the item, or <tt>null</tt> if there is no item with that key
   * @throws ValidationException if the lookup does not name exactly one item
   */
  public DynamoRecord getOne(LookupStrategy strategy) {
    ResolvedKey resolved = dispatcher.resolveKey(strategy);
    if (resolved.getCondition() != null) {
      throw new ValidationException(
        "Only key conditions can be used to get a single item, also got: "
        + resolved.getCondition());
    }
    return decode(transport.get().get(tableName, resolved.getKey(), consistentRead));
  }

  public ResultIterator<DynamoRecord> getMany(LookupStrategy strategy) {
    return getMany(strategy, ReadOptions.defaults());
  }

  public ResultIterator<DynamoRecord> getMany(LookupStrategy strategy, ReadOptions options) {
    return dispatcher.dispatch(transport.get(), tableName, strategy, resolve(options));
  }

  /**
   * Save the record, replacing any item with the same key
   */
  public DynamoRecord saveOne(DynamoRecord record) {
    return saveOne(record, true);
  }

  /**
   * @param overwrite if <tt>false</tt>, fail if an item with the same key already exists
   * @throws ConditionalCheckFailedException if the item exists and we cannot overwrite it
   */
  public DynamoRecord saveOne(DynamoRecord record, boolean overwrite) {
    return saveOne(record, overwrite ? null : keyGuard(false));
  }

  /**
   * @param guard condition the currently stored item must meet, or <tt>null</tt>
   * @throws ConditionalCheckFailedException if the guard is not met
   */
  public DynamoRecord saveOne(DynamoRecord record, Condition guard) {
    Map<String, Object> item = schema.encode(record);
    try {
      transport.get().put(tableName, item, asWriteCondition(guard));
    } catch (com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException e) {
      throw new ConditionalCheckFailedException(
        "Save of " + schema.keyOf(record) + " to " + tableName + " failed guard: " + guard, e);
    }
    return schema.decode(item);
  }

  public BatchResult<DynamoRecord> saveMany(List<DynamoRecord> records) {
    return saveMany(records, true);
  }

  /**
   * Save the records with batch writes, or one at a time with a guard when not overwriting. Of
   * several records with the same key only the last is written.
   */
  public BatchResult<DynamoRecord> saveMany(List<DynamoRecord> records, boolean overwrite) {
    if (!overwrite) {
      return saveMany(records, keyGuard(false));
    }
    // encode everything first, so a bad record fails before anything is written
    List<Map<String, Object>> items = new ArrayList<>();
    for (DynamoRecord record : records) {
      items.add(schema.encode(record));
    }
    items = schema.distinctItems(items);
    transport.get().batchWrite(tableName, items, Collections.<Map<String, Object>>emptyList());
    BatchResult<DynamoRecord> result = new BatchResult<>();
    for (Map<String, Object> item : items) {
      result.succeeded(schema.decode(item));
    }
    return result;
  }

  /**
   * Save each record guarded by the condition. Records whose guard fails end up in
   * {@link BatchResult#getFailed()}.
   */
  public BatchResult<DynamoRecord> saveMany(List<DynamoRecord> records, Condition guard) {
    checkNotNull(guard, "guard");
    BatchResult<DynamoRecord> result = new BatchResult<>();
    for (DynamoRecord record : records) {
      try {
        result.succeeded(saveOne(record, guard));
      } catch (ConditionalCheckFailedException e) {
        LOG.debug("Not saving {}: {}", record, e.getMessage());
        result.failed(record);
      }
    }
    return result;
  }

  /**
   * Delete a single item. Any non-key part of a condition is used as the guard for the delete.
   *
   * @return the deleted item, or <tt>null</tt> if there was no item with that key
   * @throws ConditionalCheckFailedException if the guard is not met
   */
  public DynamoRecord deleteOne(LookupStrategy strategy) {
    ResolvedKey resolved = dispatcher.resolveKey(strategy);
    return decode(delete(resolved));
  }

  /**
   * Delete all the items matching the lookup. Keys with a guard condition are deleted one at a
   * time and end up in {@link BatchResult#getFailed()} when the guard is not met; everything
   * else is deleted with batch writes.
   *
   * <p>
   * Batch deletes do not report which items were there, so {@link BatchResult#getSucceeded()}
   * holds every key a delete was requested for. For an <tt>IN</tt> on the hash key that
   * includes keys with no stored item. Repeated keys are deleted once.
   *
   * @return the deleted items. Items deleted in a batch only have their key attributes.
   */
  public BatchResult<DynamoRecord> deleteMany(LookupStrategy strategy) {
    checkNotNull(strategy, "strategy");
    BatchResult<DynamoRecord> result = new BatchResult<>();
    List<Map<String, Object>> batch =
      TableSchema.distinctKeys(strategy.visit(new KeysToDelete(result)));
    if (!batch.isEmpty()) {
      transport.get().batchWrite(tableName, Collections.<Map<String, Object>>emptyList(), batch);
    }
    for (Map<String, Object> key : batch) {
      result.succeeded(schema.decode(key));
    }
    return result;
  }

  public DynamoRecord updateOne(LookupStrategy strategy, Update... updates) {
    return updateOne(strategy, Arrays.asList(updates));
  }

  /**
   * Apply the updates to an existing item. Never creates an item.
   *
   * @return the item after the update
   * @throws ValidationException if there are no updates or the lookup is not a plain key
   * @throws ConditionalCheckFailedException if there is no item with that key
   */
  public DynamoRecord updateOne(LookupStrategy strategy, List<? extends Update> updates) {
    if (updates == null || updates.isEmpty()) {
      throw new ValidationException("No updates given for " + strategy);
    }
    ResolvedKey resolved = dispatcher.resolveKey(strategy);
    if (resolved.getCondition() != null) {
      throw new ValidationException(
        "Only key conditions can be used to update an item, also got: "
        + resolved.getCondition());
    }
    CompiledUpdate compiled = compiler.compile(updates);
    if (compiled.isEmpty()) {
      LOG.debug("Nothing to update for {}, all updates were no-ops", resolved.getKey());
      return decode(transport.get().get(tableName, resolved.getKey(), consistentRead));
    }

    UpdateRequest request = new UpdateRequest(compiled.getExpression(), compiled.getNames(),
      compiled.getValues(), asWriteCondition(keyGuard(true)));
    try {
      return decode(transport.get().update(tableName, resolved.getKey(), request));
    } catch (com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException e) {
      throw new ConditionalCheckFailedException(
        "No item " + resolved.getKey() + " in " + tableName + " to update", e);
    }
  }

  /**
   * Set every non-key attribute in the map on the item named by the key attributes in the map
   */
  public DynamoRecord updateFromMap(Map<String, ?> values) {
    List<Update> updates = new ArrayList<>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      Attribute<?> attribute = schema.getAttribute(entry.getKey());
      if (attribute == null) {
        throw new ValidationException(
          "Unknown attribute '" + entry.getKey() + "' for table " + schema.getName());
      }
      if (attribute.isKey()) {
        continue;
      }
      updates.add(new SetUpdate(attribute, entry.getValue(), false));
    }
    return updateOne(LookupStrategy.keyMap(values), updates);
  }

  private Map<String, Object> delete(ResolvedKey resolved) {
    try {
      return transport.get().delete(tableName, resolved.getKey(),
        asWriteCondition(resolved.getCondition()));
    } catch (com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException e) {
      throw new ConditionalCheckFailedException(
        "Delete of " + resolved.getKey() + " from " + tableName + " failed guard: "
        + resolved.getCondition(), e);
    }
  }

  /**
   * Guard on every key attribute, so the write only applies if the item does (or does not)
   * already exist
   */
  private Condition keyGuard(boolean exists) {
    Condition guard = null;
    for (Attribute<?> key : schema.getKeySpec().getAttributes()) {
      Condition check = exists ? key.exists() : key.notExists();
      guard = guard == null ? check : guard.and(check);
    }
    return guard;
  }

  private WriteCondition asWriteCondition(Condition condition) {
    if (condition == null) {
      return null;
    }
    NameMapper mapper = new NameMapper();
    String expression = condition.asFilterExpression(mapper);
    return new WriteCondition(expression, new LinkedHashMap<>(mapper.getNameMap()),
      new LinkedHashMap<>(mapper.getValueMap()));
  }

  private ReadOptions resolve(ReadOptions options) {
    return (options == null ? ReadOptions.defaults() : options)
      .withDefaultConsistentRead(consistentRead);
  }

  private DynamoRecord decode(Map<String, Object> item) {
    return item == null ? null : schema.decode(item);
  }

  /**
   * Collects the keys to batch delete. Keys that come with a guard are deleted right away, one
   * at a time.
   */
  private class KeysToDelete implements LookupStrategy.Visitor<List<Map<String, Object>>> {

    private final BatchResult<DynamoRecord> result;

    private KeysToDelete(BatchResult<DynamoRecord> result) {
      this.result = result;
    }

    @Override
    public List<Map<String, Object>> visitHashKey(LookupStrategy.HashKey hashKey) {
      return single(hashKey);
    }

    @Override
    public List<Map<String, Object>> visitKeyPair(LookupStrategy.KeyPair keyPair) {
      return single(keyPair);
    }

    @Override
    public List<Map<String, Object>> visitKeyMap(LookupStrategy.KeyMap keyMap) {
      return single(keyMap);
    }

    @Override
    public List<Map<String, Object>> visitRecord(LookupStrategy.RecordKey record) {
      return single(record);
    }

    @Override
    public List<Map<String, Object>> visitKeyList(LookupStrategy.KeyList list) {
      return deleteKeys(list.getKeys());
    }

    private List<Map<String, Object>> deleteKeys(List<LookupStrategy> keys) {
      // resolve everything up front, so a bad key fails before anything is deleted
      List<ResolvedKey> resolved = new ArrayList<>();
      for (LookupStrategy key : keys) {
        resolved.add(dispatcher.resolveKey(key));
      }
      List<Map<String, Object>> batch = new ArrayList<>();
      for (ResolvedKey key : resolved) {
        if (key.getCondition() == null) {
          batch.add(key.getKey());
          continue;
        }
        try {
          Map<String, Object> deleted = delete(key);
          result.succeeded(decode(deleted == null ? key.getKey() : deleted));
        } catch (ConditionalCheckFailedException e) {
          LOG.debug("Not deleting {}: {}", key.getKey(), e.getMessage());
          result.failed(schema.decode(key.getKey()));
        }
      }
      return batch;
    }

    @Override
    public List<Map<String, Object>> visitSearch(LookupStrategy.Search search) {
      ReadOptions options = resolve(ReadOptions.defaults());
      DispatchPlan plan = dispatcher.plan(search, options);
      if (plan.getOperation() == DispatchPlan.Operation.BATCH_GET) {
        // keys are fully known, no need to read the items first
        return new ArrayList<>(plan.getKeys());
      }
      List<Map<String, Object>> batch = new ArrayList<>();
      ResultIterator<DynamoRecord> items =
        dispatcher.execute(transport.get(), tableName, plan, options);
      while (items.hasNext()) {
        batch.add(schema.keyOf(items.next()));
      }
      return batch;
    }

    private List<Map<String, Object>> single(LookupStrategy key) {
      return deleteKeys(Collections.singletonList(key));
    }
  }
}
