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

package io.fineo.dynamo.mapper.update;

import java.util.Collections;
import java.util.Map;

/**
 * A complete update expression and the placeholders it references
 */
public class CompiledUpdate {

  private final String expression;
  private final Map<String, String> names;
  private final Map<String, Object> values;

  public CompiledUpdate(String expression, Map<String, String> names,
    Map<String, Object> values) {
    this.expression = expression;
    this.names = Collections.unmodifiableMap(names);
    this.values = Collections.unmodifiableMap(values);
  }

  public String getExpression() {
    return expression;
  }

  public Map<String, String> getNames() {
    return names;
  }

  public Map<String, Object> getValues() {
    return values;
  }

  /**
   * @return <tt>true</tt> if every update was a no-op
   */
  public boolean isEmpty() {
    return expression.isEmpty();
  }

  @Override
  public String toString() {
    return "CompiledUpdate{" +
           "expression='" + expression + '\'' +
           ", names=" + names +
           ", values=" + values +
           '}';
  }
}
