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

import java.util.Collections;
import java.util.Map;

/**
 * A rendered condition expression guarding a put or delete, along with the placeholders it
 * references.
 */
public class WriteCondition {

  private final String expression;
  private final Map<String, String> nameMap;
  private final Map<String, Object> valueMap;

  public WriteCondition(String expression, Map<String, String> nameMap,
    Map<String, Object> valueMap) {
    this.expression = expression;
    this.nameMap = nameMap == null ? Collections.emptyMap() : nameMap;
    this.valueMap = valueMap == null ? Collections.emptyMap() : valueMap;
  }

  public String getExpression() {
    return expression;
  }

  public Map<String, String> getNameMap() {
    return nameMap;
  }

  public Map<String, Object> getValueMap() {
    return valueMap;
  }

  @Override
  public String toString() {
    return "WriteCondition{" +
           "expression='" + expression + '\'' +
           ", names=" + nameMap +
           ", values=" + valueMap +
           '}';
  }
}
