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
 * A compiled update expression, an optional guard condition and the union of the placeholders
 * both of them reference.
 */
public class UpdateRequest {

  private final String updateExpression;
  private final String conditionExpression;
  private final Map<String, String> nameMap = new HashMap<>();
  private final Map<String, Object> valueMap = new HashMap<>();

  public UpdateRequest(String updateExpression, Map<String, String> names,
    Map<String, Object> values, WriteCondition condition) {
    this.updateExpression = updateExpression;
    this.nameMap.putAll(names);
    this.valueMap.putAll(values);
    if (condition != null) {
      this.conditionExpression = condition.getExpression();
      this.nameMap.putAll(condition.getNameMap());
      this.valueMap.putAll(condition.getValueMap());
    } else {
      this.conditionExpression = null;
    }
  }

  public String getUpdateExpression() {
    return updateExpression;
  }

  public String getConditionExpression() {
    return conditionExpression;
  }

  public Map<String, String> getNameMap() {
    return nameMap;
  }

  public Map<String, Object> getValueMap() {
    return valueMap;
  }

  @Override
  public String toString() {
    return "UpdateRequest{" +
           "update='" + updateExpression + '\'' +
           ", condition='" + conditionExpression + '\'' +
           ", names=" + nameMap +
           ", values=" + valueMap +
           '}';
  }
}
