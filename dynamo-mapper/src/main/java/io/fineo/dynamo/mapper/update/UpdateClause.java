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

import io.fineo.dynamo.mapper.attribute.Attribute;

import java.util.Collections;
import java.util.Map;

/**
 * A single rendered piece of an update expression, e.g. <tt>#att0 = :val1</tt>, along with the
 * placeholders it uses.
 */
public class UpdateClause {

  private final UpdateAction action;
  private final Attribute<?> target;
  private final String expression;
  private final Map<String, String> names;
  private final Map<String, Object> values;

  public UpdateClause(UpdateAction action, Attribute<?> target, String expression,
    Map<String, String> names, Map<String, Object> values) {
    this.action = action;
    this.target = target;
    this.expression = expression;
    this.names = Collections.unmodifiableMap(names);
    this.values = Collections.unmodifiableMap(values);
  }

  public UpdateAction getAction() {
    return action;
  }

  public Attribute<?> getTarget() {
    return target;
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

  @Override
  public String toString() {
    return action + " " + expression;
  }
}
