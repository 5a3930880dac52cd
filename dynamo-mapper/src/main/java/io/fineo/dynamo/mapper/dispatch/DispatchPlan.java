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

import io.fineo.dynamo.mapper.condition.Comparison;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.schema.TableSchema;
import io.fineo.dynamo.transport.ReadRequest;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The store operation chosen for a single read, with everything needed to run it. Built fresh
 * for each call.
 */
public class DispatchPlan {

  public enum Operation {
    GET, BATCH_GET, QUERY, SCAN
  }

  private final Operation operation;
  private final List<Map<String, Object>> keys;
  private final List<Comparison> keyConditions;
  private final Condition filter;
  private final ReadRequest request;

  private DispatchPlan(Operation operation, List<Map<String, Object>> keys,
    List<Comparison> keyConditions, Condition filter, ReadRequest request) {
    this.operation = operation;
    this.keys = keys;
    this.keyConditions = keyConditions;
    this.filter = filter;
    this.request = request;
  }

  static DispatchPlan get(Map<String, Object> key) {
    return new DispatchPlan(Operation.GET, Collections.singletonList(key),
      Collections.<Comparison>emptyList(), null, null);
  }

  static DispatchPlan batchGet(List<Map<String, Object>> keys) {
    return new DispatchPlan(Operation.BATCH_GET,
      Collections.unmodifiableList(TableSchema.distinctKeys(keys)),
      Collections.<Comparison>emptyList(), null, null);
  }

  static DispatchPlan query(List<Comparison> keyConditions, Condition filter,
    ReadRequest request) {
    return new DispatchPlan(Operation.QUERY, Collections.<Map<String, Object>>emptyList(),
      Collections.unmodifiableList(keyConditions), filter, request);
  }

  static DispatchPlan scan(Condition filter, ReadRequest request) {
    return new DispatchPlan(Operation.SCAN, Collections.<Map<String, Object>>emptyList(),
      Collections.<Comparison>emptyList(), filter, request);
  }

  public Operation getOperation() {
    return operation;
  }

  /**
   * @return encoded keys to read for a {@link Operation#GET} or {@link Operation#BATCH_GET}
   */
  public List<Map<String, Object>> getKeys() {
    return keys;
  }

  public List<Comparison> getKeyConditions() {
    return keyConditions;
  }

  public Condition getFilter() {
    return filter;
  }

  /**
   * @return the rendered request for a {@link Operation#QUERY} or {@link Operation#SCAN}
   */
  public ReadRequest getRequest() {
    return request;
  }

  @Override
  public String toString() {
    return "DispatchPlan{" +
           "operation=" + operation +
           ", keys=" + keys +
           ", keyConditions=" + keyConditions +
           ", filter=" + filter +
           ", request=" + request +
           '}';
  }
}
