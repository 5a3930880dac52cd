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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.fineo.dynamo.mapper.condition.Comparison;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.condition.Operator;
import io.fineo.dynamo.mapper.exception.EncodingException;
import io.fineo.dynamo.mapper.exception.ValidationException;
import io.fineo.dynamo.mapper.update.RemoveUpdate;
import io.fineo.dynamo.mapper.update.SetUpdate;
import io.fineo.dynamo.mapper.update.Update;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A named field of an item. Knows how to convert its logical values to and from the primitive
 * values dynamo stores, and is the entry point for building conditions and updates on the field.
 *
 * @param <T> logical type of the field's values
 */
public abstract class Attribute<T> {

  private static final Joiner PATH = Joiner.on('.');

  private final String name;
  private final PrimitiveKind kind;
  private final KeyRole role;
  private final boolean required;
  private MapAttribute parent;

  protected Attribute(String name, PrimitiveKind kind, KeyRole role, boolean required) {
    checkArgument(!Strings.isNullOrEmpty(name), "Attributes must have a name");
    checkArgument(name.indexOf('.') < 0,
      "Attribute name '%s' cannot contain '.', nest it in a MapAttribute instead", name);
    this.kind = checkNotNull(kind, "kind");
    this.role = checkNotNull(role, "role");
    checkArgument(role == KeyRole.NONE || kind.isKeyKind(), "%s attribute '%s' cannot be a key",
      kind, name);
    this.name = name;
    // keys always have to be present
    this.required = required || role != KeyRole.NONE;
  }

  /**
   * @return <tt>true</tt> if the value is absent: <tt>null</tt> or the empty string
   */
  public static boolean isEmpty(Object value) {
    return value == null || "".equals(value);
  }

  void setParent(MapAttribute parent) {
    checkState(this.parent == null, "Attribute %s already belongs to %s", name, this.parent);
    checkArgument(role == KeyRole.NONE, "Key attribute %s cannot be nested", name);
    this.parent = parent;
  }

  /**
   * @return full document path of the attribute, e.g. <tt>address.city</tt>
   */
  public String getName() {
    return PATH.join(getPath());
  }

  public String getLocalName() {
    return name;
  }

  public List<String> getPath() {
    if (parent == null) {
      return ImmutableList.of(name);
    }
    return ImmutableList.<String>builder().addAll(parent.getPath()).add(name).build();
  }

  public boolean isNested() {
    return parent != null;
  }

  public PrimitiveKind getKind() {
    return kind;
  }

  public KeyRole getRole() {
    return role;
  }

  public boolean isHashKey() {
    return role == KeyRole.HASH;
  }

  public boolean isRangeKey() {
    return role == KeyRole.RANGE;
  }

  public boolean isKey() {
    return role != KeyRole.NONE;
  }

  public boolean isRequired() {
    return required;
  }

  /**
   * Convert a logical value to what dynamo stores.
   *
   * @return the primitive value, or <tt>null</tt> if the value is empty
   * @throws EncodingException if the value is not valid for this attribute
   */
  public Object encode(Object value) {
    if (isEmpty(value)) {
      return null;
    }
    try {
      return toPrimitive(value);
    } catch (ClassCastException | NumberFormatException e) {
      throw new EncodingException("Cannot encode '" + value + "' as " + kind + " for " + getName(),
        e);
    }
  }

  /**
   * Convert an operand of a condition. Usually the same as {@link #encode(Object)}, but containers
   * also accept a single element here (for <tt>contains</tt>).
   */
  public Object encodeOperand(Object value) {
    return encode(value);
  }

  public T decode(Object primitive) {
    if (primitive == null) {
      return null;
    }
    try {
      return fromPrimitive(primitive);
    } catch (ClassCastException | NumberFormatException e) {
      throw new EncodingException("Cannot decode '" + primitive + "' from " + kind + " for "
                                  + getName(), e);
    }
  }

  /**
   * @throws ValidationException if the attribute is required and the value is empty
   */
  public void validate(Object value) {
    if (required && isEmpty(value)) {
      throw new ValidationException("Attribute '" + getName() + "' is required");
    }
  }

  protected abstract Object toPrimitive(Object value);

  protected abstract T fromPrimitive(Object primitive);

  protected EncodingException unsupported(Object value) {
    return new EncodingException(
      "Cannot encode " + value.getClass().getSimpleName() + " '" + value + "' as " + kind + " for "
      + getName());
  }

  /*
   * Conditions
   */
  public Condition eq(T value) {
    return new Comparison(this, Operator.EQ, value);
  }

  public Condition ne(T value) {
    return new Comparison(this, Operator.NE, value);
  }

  public Condition lt(T value) {
    return new Comparison(this, Operator.LT, value);
  }

  public Condition lte(T value) {
    return new Comparison(this, Operator.LTE, value);
  }

  public Condition gt(T value) {
    return new Comparison(this, Operator.GT, value);
  }

  public Condition gte(T value) {
    return new Comparison(this, Operator.GTE, value);
  }

  public Condition in(Collection<? extends T> values) {
    return new Comparison(this, Operator.IN, values == null ? null : new ArrayList<>(values));
  }

  @SafeVarargs
  public final Condition in(T... values) {
    return in(Arrays.asList(values));
  }

  public Condition contains(Object value) {
    return new Comparison(this, Operator.CONTAINS, value);
  }

  public Condition beginsWith(T prefix) {
    return new Comparison(this, Operator.BEGINS_WITH, prefix);
  }

  public Condition exists() {
    return new Comparison(this, Operator.EXISTS);
  }

  public Condition notExists() {
    return new Comparison(this, Operator.NOT_EXISTS);
  }

  public Condition between(T low, T high) {
    return new Comparison(this, Operator.BETWEEN, low, high);
  }

  /*
   * Updates
   */
  public Update set(T value) {
    return new SetUpdate(this, value, false);
  }

  public Update setIfNotExists(T value) {
    return new SetUpdate(this, value, true);
  }

  public Update remove() {
    return new RemoveUpdate(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Attribute<?> attribute = (Attribute<?>) o;

    if (required != attribute.required) {
      return false;
    }
    if (kind != attribute.kind) {
      return false;
    }
    if (role != attribute.role) {
      return false;
    }
    return getPath().equals(attribute.getPath());
  }

  @Override
  public int hashCode() {
    int result = getPath().hashCode();
    result = 31 * result + kind.hashCode();
    result = 31 * result + role.hashCode();
    result = 31 * result + (required ? 1 : 0);
    return result;
  }

  @Override
  public String toString() {
    return getName();
  }
}
