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

import com.google.common.collect.ImmutableList;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.schema.DynamoRecord;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * How the caller wants to find items: by a single key (in one of several shapes), by a list of
 * keys, or by a condition. Use the static factories to build one and a {@link Visitor} to handle
 * each shape.
 */
public abstract class LookupStrategy {

  public interface Visitor<T> {

    T visitHashKey(HashKey hashKey);

    T visitKeyPair(KeyPair keyPair);

    T visitKeyMap(KeyMap keyMap);

    T visitRecord(RecordKey record);

    T visitKeyList(KeyList keys);

    T visitSearch(Search search);
  }

  public abstract <T> T visit(Visitor<T> visitor);

  /**
   * Value of the hash key, for tables without a range key
   */
  public static LookupStrategy hashKey(Object value) {
    return new HashKey(value);
  }

  public static LookupStrategy keyPair(Object hash, Object range) {
    return new KeyPair(hash, range);
  }

  public static LookupStrategy keyPair(Pair<?, ?> pair) {
    return new KeyPair(pair.getLeft(), pair.getRight());
  }

  /**
   * Key values by attribute name. Entries that are not part of the key are ignored.
   */
  public static LookupStrategy keyMap(Map<String, ?> key) {
    return new KeyMap(key);
  }

  public static LookupStrategy record(DynamoRecord record) {
    return new RecordKey(record);
  }

  public static LookupStrategy keys(List<? extends LookupStrategy> keys) {
    return new KeyList(keys);
  }

  public static LookupStrategy keys(LookupStrategy... keys) {
    return new KeyList(ImmutableList.copyOf(keys));
  }

  public static LookupStrategy search(Condition condition) {
    return new Search(condition);
  }

  public static class HashKey extends LookupStrategy {
    private final Object value;

    private HashKey(Object value) {
      this.value = value;
    }

    public Object getValue() {
      return value;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitHashKey(this);
    }

    @Override
    public String toString() {
      return "HashKey(" + value + ")";
    }
  }

  public static class KeyPair extends LookupStrategy {
    private final Object hash;
    private final Object range;

    private KeyPair(Object hash, Object range) {
      this.hash = hash;
      this.range = range;
    }

    public Object getHash() {
      return hash;
    }

    public Object getRange() {
      return range;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitKeyPair(this);
    }

    @Override
    public String toString() {
      return "KeyPair(" + hash + ", " + range + ")";
    }
  }

  public static class KeyMap extends LookupStrategy {
    private final Map<String, Object> key;

    private KeyMap(Map<String, ?> key) {
      this.key = Collections.unmodifiableMap(new LinkedHashMap<>(checkNotNull(key, "key")));
    }

    public Map<String, Object> getKey() {
      return key;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitKeyMap(this);
    }

    @Override
    public String toString() {
      return "KeyMap" + key;
    }
  }

  public static class RecordKey extends LookupStrategy {
    private final DynamoRecord record;

    private RecordKey(DynamoRecord record) {
      this.record = checkNotNull(record, "record");
    }

    public DynamoRecord getRecord() {
      return record;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitRecord(this);
    }

    @Override
    public String toString() {
      return "RecordKey(" + record + ")";
    }
  }

  public static class KeyList extends LookupStrategy {
    private final List<LookupStrategy> keys;

    private KeyList(List<? extends LookupStrategy> keys) {
      this.keys = Collections.unmodifiableList(new ArrayList<>(checkNotNull(keys, "keys")));
    }

    public List<LookupStrategy> getKeys() {
      return keys;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitKeyList(this);
    }

    @Override
    public String toString() {
      return "KeyList" + keys;
    }
  }

  public static class Search extends LookupStrategy {
    private final Condition condition;

    private Search(Condition condition) {
      this.condition = checkNotNull(condition, "condition");
    }

    public Condition getCondition() {
      return condition;
    }

    @Override
    public <T> T visit(Visitor<T> visitor) {
      return visitor.visitSearch(this);
    }

    @Override
    public String toString() {
      return "Search(" + condition + ")";
    }
  }
}
