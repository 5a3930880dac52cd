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

import io.fineo.dynamo.mapper.update.ListExtendUpdate;
import io.fineo.dynamo.mapper.update.Update;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An ordered list of values, each converted by the element attribute
 *
 * @param <E> logical type of the elements
 */
public class ListAttribute<E> extends Attribute<List<E>> {

  private final Attribute<E> element;

  public ListAttribute(String name, Attribute<E> element) {
    this(name, element, false);
  }

  public ListAttribute(String name, Attribute<E> element, boolean required) {
    super(name, PrimitiveKind.LIST, KeyRole.NONE, required);
    this.element = checkNotNull(element, "element");
  }

  public Attribute<E> getElement() {
    return element;
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (!(value instanceof List)) {
      throw unsupported(value);
    }
    List<Object> out = new ArrayList<>();
    for (Object v : (List<?>) value) {
      out.add(element.encode(v));
    }
    return out;
  }

  @Override
  public Object encodeOperand(Object value) {
    if (value instanceof List) {
      return encode(value);
    }
    return element.encode(value);
  }

  @Override
  protected List<E> fromPrimitive(Object primitive) {
    List<E> out = new ArrayList<>();
    for (Object v : (List<?>) primitive) {
      out.add(element.decode(v));
    }
    return out;
  }

  public Update append(List<E> values) {
    return new ListExtendUpdate(this, values, true);
  }

  @SafeVarargs
  public final Update append(E... values) {
    return append(Arrays.asList(values));
  }

  public Update prepend(List<E> values) {
    return new ListExtendUpdate(this, values, false);
  }

  @SafeVarargs
  public final Update prepend(E... values) {
    return prepend(Arrays.asList(values));
  }
}
