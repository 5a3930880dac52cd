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

import io.fineo.dynamo.mapper.condition.Condition;

import java.util.Collections;
import java.util.Map;

/**
 * The primary key of exactly one item, plus any non-key condition that came with it
 */
public class ResolvedKey {

  private final Map<String, Object> key;
  private final Condition condition;

  public ResolvedKey(Map<String, Object> key, Condition condition) {
    this.key = Collections.unmodifiableMap(key);
    this.condition = condition;
  }

  /**
   * @return encoded key values, by attribute name
   */
  public Map<String, Object> getKey() {
    return key;
  }

  /**
   * @return the rest of the condition, or <tt>null</tt>
   */
  public Condition getCondition() {
    return condition;
  }

  @Override
  public String toString() {
    return "ResolvedKey{" +
           "key=" + key +
           ", condition=" + condition +
           '}';
  }
}
