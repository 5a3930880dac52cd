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

package io.fineo.dynamo.mapper.schema;

import io.fineo.dynamo.mapper.attribute.Attribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An item, as logical values keyed by top-level attribute name
 */
public class DynamoRecord {

  private final Map<String, Object> values = new LinkedHashMap<>();

  public DynamoRecord() {
  }

  public DynamoRecord(Map<String, ?> values) {
    this.values.putAll(values);
  }

  public <T> DynamoRecord with(Attribute<T> attribute, T value) {
    checkArgument(!attribute.isNested(),
      "Set nested attribute %s through the value of its top-level document", attribute);
    values.put(attribute.getName(), value);
    return this;
  }

  public DynamoRecord with(String name, Object value) {
    values.put(name, value);
    return this;
  }

  /**
   * @return the value of the attribute, following the document path for nested attributes
   */
  @SuppressWarnings("unchecked")
  public <T> T get(Attribute<T> attribute) {
    Object current = values;
    for (String segment : attribute.getPath()) {
      if (!(current instanceof Map)) {
        return null;
      }
      current = ((Map<?, ?>) current).get(segment);
    }
    return (T) current;
  }

  public Object get(String name) {
    return values.get(name);
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return values.equals(((DynamoRecord) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "DynamoRecord" + values;
  }
}
