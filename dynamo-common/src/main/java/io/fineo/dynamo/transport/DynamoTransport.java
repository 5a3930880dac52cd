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

import java.util.List;
import java.util.Map;

/**
 * The raw operations we need from Dynamo. Keys and items are maps of attribute name to a
 * 'simple' primitive value (String, BigDecimal/Number, Boolean, byte[], List, Map), which is what
 * the {@link com.amazonaws.services.dynamodbv2.document.ItemUtils} conversions understand.
 * <p>
 * Any write that carries a condition may fail with
 * {@link com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException}; all other
 * failures are whatever the underlying client throws.
 * </p>
 */
public interface DynamoTransport {

  /**
   * @return the item stored under the key, or <tt>null</tt> if there is no such item
   */
  Map<String, Object> get(String table, Map<String, Object> key, boolean consistentRead);

  /**
   * A single round trip of a batch get. Dynamo is free to only process some of the keys; the rest
   * are handed back in {@link BatchGetPage#getUnprocessedKeys()}.
   */
  BatchGetPage batchGet(String table, List<Map<String, Object>> keys, boolean consistentRead);

  /**
   * @return the item previously stored under the same key, if any
   */
  Map<String, Object> put(String table, Map<String, Object> item, WriteCondition condition);

  /**
   * @return the deleted item, or <tt>null</tt> if nothing was stored under the key
   */
  Map<String, Object> delete(String table, Map<String, Object> key, WriteCondition condition);

  void batchWrite(String table, List<Map<String, Object>> puts, List<Map<String, Object>> deletes);

  /**
   * A single page of a query. Pass {@link ItemPage#getLastEvaluatedKey()} back as the exclusive
   * start key to continue.
   */
  ItemPage query(String table, ReadRequest request);

  ItemPage scan(String table, ReadRequest request);

  /**
   * @return the item after the update was applied
   */
  Map<String, Object> update(String table, Map<String, Object> key, UpdateRequest update);
}
