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

import java.util.HashMap;
import java.util.Map;

/**
 * Parameters for a single query or scan round trip. Scans ignore the key condition and the scan
 * direction.
 */
public class ReadRequest {

  private String keyConditionExpression;
  private String filterExpression;
  private Map<String, String> nameMap = new HashMap<>();
  private Map<String, Object> valueMap = new HashMap<>();
  private Map<String, Object> exclusiveStartKey;
  private Integer limit;
  private boolean scanForward = true;
  private boolean consistentRead;

  public ReadRequest withKeyConditionExpression(String keyConditionExpression) {
    this.keyConditionExpression = keyConditionExpression;
    return this;
  }

  public ReadRequest withFilterExpression(String filterExpression) {
    this.filterExpression = filterExpression;
    return this;
  }

  public ReadRequest withNameMap(Map<String, String> nameMap) {
    this.nameMap = nameMap;
    return this;
  }

  public ReadRequest withValueMap(Map<String, Object> valueMap) {
    this.valueMap = valueMap;
    return this;
  }

  public ReadRequest withExclusiveStartKey(Map<String, Object> exclusiveStartKey) {
    this.exclusiveStartKey = exclusiveStartKey;
    return this;
  }

  public ReadRequest withLimit(Integer limit) {
    this.limit = limit;
    return this;
  }

  public ReadRequest withScanForward(boolean scanForward) {
    this.scanForward = scanForward;
    return this;
  }

  public ReadRequest withConsistentRead(boolean consistentRead) {
    this.consistentRead = consistentRead;
    return this;
  }

  /**
   * @return a shallow copy that can be continued from a different start key or limit without
   * touching this request
   */
  public ReadRequest copy() {
    return new ReadRequest()
      .withKeyConditionExpression(keyConditionExpression)
      .withFilterExpression(filterExpression)
      .withNameMap(nameMap)
      .withValueMap(valueMap)
      .withExclusiveStartKey(exclusiveStartKey)
      .withLimit(limit)
      .withScanForward(scanForward)
      .withConsistentRead(consistentRead);
  }

  public String getKeyConditionExpression() {
    return keyConditionExpression;
  }

  public String getFilterExpression() {
    return filterExpression;
  }

  public Map<String, String> getNameMap() {
    return nameMap;
  }

  public Map<String, Object> getValueMap() {
    return valueMap;
  }

  public Map<String, Object> getExclusiveStartKey() {
    return exclusiveStartKey;
  }

  public Integer getLimit() {
    return limit;
  }

  public boolean isScanForward() {
    return scanForward;
  }

  public boolean isConsistentRead() {
    return consistentRead;
  }

  @Override
  public String toString() {
    return "ReadRequest{" +
           "keyCondition='" + keyConditionExpression + '\'' +
           ", filter='" + filterExpression + '\'' +
           ", names=" + nameMap +
           ", values=" + valueMap +
           ", startKey=" + exclusiveStartKey +
           ", limit=" + limit +
           ", forward=" + scanForward +
           ", consistent=" + consistentRead +
           '}';
  }
}
