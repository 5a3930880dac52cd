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

package io.fineo.dynamo.mapper.key;

import com.google.common.collect.ImmutableList;
import io.fineo.dynamo.mapper.attribute.Attribute;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Primary key of a table: a hash key and, optionally, a range key
 */
public class KeySpec {

  private final Attribute<?> hash;
  private final Attribute<?> range;

  public KeySpec(Attribute<?> hash) {
    this(hash, null);
  }

  public KeySpec(Attribute<?> hash, Attribute<?> range) {
    this.hash = checkNotNull(hash, "Tables must have a hash key");
    checkArgument(hash.isHashKey(), "%s is not a hash key", hash);
    checkArgument(range == null || range.isRangeKey(), "%s is not a range key", range);
    this.range = range;
  }

  public Attribute<?> getHash() {
    return hash;
  }

  /**
   * @return the range key, or <tt>null</tt> if the table only has a hash key
   */
  public Attribute<?> getRange() {
    return range;
  }

  public boolean hasRange() {
    return range != null;
  }

  public List<Attribute<?>> getAttributes() {
    return range == null ? ImmutableList.<Attribute<?>>of(hash) :
           ImmutableList.<Attribute<?>>of(hash, range);
  }

  public int size() {
    return range == null ? 1 : 2;
  }

  public boolean isKey(Attribute<?> attribute) {
    return isHash(attribute) || isRange(attribute);
  }

  public boolean isHash(Attribute<?> attribute) {
    return hash.getName().equals(attribute.getName());
  }

  public boolean isRange(Attribute<?> attribute) {
    return range != null && range.getName().equals(attribute.getName());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    KeySpec keySpec = (KeySpec) o;

    if (!hash.equals(keySpec.hash)) {
      return false;
    }
    return range != null ? range.equals(keySpec.range) : keySpec.range == null;
  }

  @Override
  public int hashCode() {
    int result = hash.hashCode();
    result = 31 * result + (range != null ? range.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    return "KeySpec{" +
           "hash=" + hash +
           ", range=" + range +
           '}';
  }
}
