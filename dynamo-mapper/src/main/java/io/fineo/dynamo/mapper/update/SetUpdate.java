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

import java.util.HashMap;
import java.util.Map;

/**
 * Set the attribute to a value. Setting an empty value removes the attribute, unless it should
 * only be set when missing, in which case there is nothing to do.
 */
public class SetUpdate extends Update {

  private final Object value;
  private final boolean ifNotExists;

  public SetUpdate(Attribute<?> attribute, Object value, boolean ifNotExists) {
    super(attribute);
    this.value = value;
    this.ifNotExists = ifNotExists;
  }

  public Object getValue() {
    return value;
  }

  public boolean isIfNotExists() {
    return ifNotExists;
  }

  @Override
  public UpdateClause compile(PlaceholderSequence sequence) {
    if (Attribute.isEmpty(value)) {
      if (ifNotExists) {
        return null;
      }
      return new RemoveUpdate(attribute).compile(sequence);
    }

    Map<String, String> names = new HashMap<>();
    Map<String, Object> values = new HashMap<>();
    String path = path(sequence, names);
    String placeholder = sequence.nextValue();
    values.put(placeholder, attribute.encode(value));
    String expression = ifNotExists ?
                        path + " = if_not_exists(" + path + ", " + placeholder + ")" :
                        path + " = " + placeholder;
    return new UpdateClause(UpdateAction.SET, attribute, expression, names, values);
  }
}
