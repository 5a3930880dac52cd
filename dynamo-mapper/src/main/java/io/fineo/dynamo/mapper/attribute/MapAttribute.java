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

package io.fineo.dynamo.mapper.attribute;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A nested document. Known children convert their own values; any other entries are stored as
 * given. Children are addressed in expressions by their dotted path, e.g. <tt>address.city</tt>.
 */
public class MapAttribute extends Attribute<Map<String, Object>> {

  private final Map<String, Attribute<?>> children = new LinkedHashMap<>();

  public MapAttribute(String name) {
    this(name, false);
  }

  public MapAttribute(String name, boolean required) {
    super(name, PrimitiveKind.MAP, KeyRole.NONE, required);
  }

  /**
   * Nest the attribute under this document
   *
   * @return the child, for chaining into a field declaration
   */
  public <A extends Attribute<?>> A child(A attribute) {
    attribute.setParent(this);
    children.put(attribute.getLocalName(), attribute);
    return attribute;
  }

  public Collection<Attribute<?>> getChildren() {
    return ImmutableList.copyOf(children.values());
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (!(value instanceof Map)) {
      throw unsupported(value);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      String key = String.valueOf(entry.getKey());
      Attribute<?> child = children.get(key);
      Object encoded = child == null ? entry.getValue() : child.encode(entry.getValue());
      if (!isEmpty(encoded)) {
        out.put(key, encoded);
      }
    }
    for (Attribute<?> child : children.values()) {
      child.validate(out.get(child.getLocalName()));
    }
    return out;
  }

  @Override
  protected Map<String, Object> fromPrimitive(Object primitive) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) primitive).entrySet()) {
      String key = String.valueOf(entry.getKey());
      Attribute<?> child = children.get(key);
      out.put(key, child == null ? entry.getValue() : child.decode(entry.getValue()));
    }
    return out;
  }
}
