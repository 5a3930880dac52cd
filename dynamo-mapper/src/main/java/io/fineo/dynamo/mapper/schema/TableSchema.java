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

import com.google.common.base.Strings;
import io.fineo.dynamo.mapper.attribute.Attribute;
import io.fineo.dynamo.mapper.key.KeySpec;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Description of a table: its name, primary key and the attributes we know about. Converts
 * records to the primitive items dynamo stores and back.
 */
public class TableSchema {

  private final String name;
  private final KeySpec keySpec;
  private final Map<String, Attribute<?>> attributes = new LinkedHashMap<>();

  public TableSchema(String name, Attribute<?>... attributes) {
    this(name, Arrays.asList(attributes));
  }

  public TableSchema(String name, List<? extends Attribute<?>> attributes) {
    checkArgument(!Strings.isNullOrEmpty(name), "Tables must have a name");
    this.name = name;
    List<Attribute<?>> hash = new ArrayList<>();
    List<Attribute<?>> range = new ArrayList<>();
    for (Attribute<?> attribute : attributes) {
      checkArgument(!attribute.isNested(), "Only top-level attributes belong to a table, got %s",
        attribute);
      checkArgument(!this.attributes.containsKey(attribute.getName()),
        "Attribute %s defined more than once in %s", attribute, name);
      this.attributes.put(attribute.getName(), attribute);
      if (attribute.isHashKey()) {
        hash.add(attribute);
      } else if (attribute.isRangeKey()) {
        range.add(attribute);
      }
    }
    checkArgument(hash.size() == 1, "Table %s needs exactly one hash key, got %s", name, hash);
    checkArgument(range.size() <= 1, "Table %s can have at most one range key, got %s", name,
      range);
    this.keySpec = new KeySpec(hash.get(0), range.isEmpty() ? null : range.get(0));
  }

  public String getName() {
    return name;
  }

  public KeySpec getKeySpec() {
    return keySpec;
  }

  public Collection<Attribute<?>> getAttributes() {
    return Collections.unmodifiableCollection(attributes.values());
  }

  /**
   * @return the attribute, or <tt>null</tt> if the schema does not know about it
   */
  public Attribute<?> getAttribute(String name) {
    return attributes.get(name);
  }

  /**
   * Convert the record to a dynamo item. Empty values are left out and unknown attributes are
   * stored as given.
   *
   * @throws io.fineo.dynamo.mapper.exception.ValidationException if a key or required attribute
   *                                                              is missing
   */
  public Map<String, Object> encode(DynamoRecord record) {
    Map<String, Object> item = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
      Attribute<?> attribute = attributes.get(entry.getKey());
      Object encoded = attribute == null ? entry.getValue() : attribute.encode(entry.getValue());
      if (!Attribute.isEmpty(encoded)) {
        item.put(entry.getKey(), encoded);
      }
    }
    for (Attribute<?> attribute : attributes.values()) {
      attribute.validate(item.get(attribute.getName()));
    }
    return item;
  }

  public DynamoRecord decode(Map<String, Object> item) {
    DynamoRecord record = new DynamoRecord();
    for (Map.Entry<String, Object> entry : item.entrySet()) {
      Attribute<?> attribute = attributes.get(entry.getKey());
      record.with(entry.getKey(),
        attribute == null ? entry.getValue() : attribute.decode(entry.getValue()));
    }
    return record;
  }

  /**
   * @return the encoded primary key of the record
   */
  public Map<String, Object> keyOf(DynamoRecord record) {
    Map<String, Object> key = new LinkedHashMap<>();
    for (Attribute<?> attribute : keySpec.getAttributes()) {
      key.put(attribute.getName(), encodeKey(attribute, record.get(attribute.getName())));
    }
    return key;
  }

  /**
   * Drop repeated keys, keeping the first of each in the order given. Dynamo rejects a batch
   * request that names the same key twice.
   */
  public static List<Map<String, Object>> distinctKeys(Collection<Map<String, Object>> keys) {
    Map<Map<String, Object>, Map<String, Object>> distinct = new LinkedHashMap<>();
    for (Map<String, Object> key : keys) {
      distinct.putIfAbsent(comparable(key), key);
    }
    return new ArrayList<>(distinct.values());
  }

  /**
   * Collapse encoded items that share a primary key. The last item for a key wins, in the
   * position of the first.
   */
  public List<Map<String, Object>> distinctItems(Collection<Map<String, Object>> items) {
    Map<Map<String, Object>, Map<String, Object>> distinct = new LinkedHashMap<>();
    for (Map<String, Object> item : items) {
      Map<String, Object> key = new LinkedHashMap<>();
      for (Attribute<?> attribute : keySpec.getAttributes()) {
        key.put(attribute.getName(), item.get(attribute.getName()));
      }
      distinct.put(comparable(key), item);
    }
    return new ArrayList<>(distinct.values());
  }

  // binary keys compare by content
  private static Map<String, Object> comparable(Map<String, Object> key) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : key.entrySet()) {
      Object value = entry.getValue();
      copy.put(entry.getKey(), value instanceof byte[] ? ByteBuffer.wrap((byte[]) value) : value);
    }
    return copy;
  }

  /**
   * @throws io.fineo.dynamo.mapper.exception.ValidationException if the value is missing
   */
  public Object encodeKey(Attribute<?> attribute, Object value) {
    attribute.validate(value);
    return attribute.encode(value);
  }

  @Override
  public String toString() {
    return "TableSchema{" +
           "name='" + name + '\'' +
           ", keys=" + keySpec +
           ", attributes=" + attributes.keySet() +
           '}';
  }
}
