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

import io.fineo.dynamo.mapper.attribute.ListAttribute;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Add values to the end (or the front) of a list attribute with <tt>list_append</tt>. Extending
 * with no values is skipped.
 */
public class ListExtendUpdate extends Update {

  private final List<?> values;
  private final boolean append;

  public ListExtendUpdate(ListAttribute<?> attribute, List<?> values, boolean append) {
    super(attribute);
    this.values = values == null ? new ArrayList<>() : new ArrayList<>(values);
    this.append = append;
  }

  public List<?> getValues() {
    return values;
  }

  public boolean isAppend() {
    return append;
  }

  @Override
  public UpdateClause compile(PlaceholderSequence sequence) {
    if (values.isEmpty()) {
      return null;
    }
    Map<String, String> names = new HashMap<>();
    Map<String, Object> valueMap = new HashMap<>();
    String path = path(sequence, names);
    String placeholder = sequence.nextValue();
    valueMap.put(placeholder, attribute.encode(values));
    String expression = append ?
                        path + " = list_append(" + path + ", " + placeholder + ")" :
                        path + " = list_append(" + placeholder + ", " + path + ")";
    return new UpdateClause(UpdateAction.SET, attribute, expression, names, valueMap);
  }
}
