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

import io.fineo.dynamo.mapper.update.AddUpdate;
import io.fineo.dynamo.mapper.update.Update;

import java.math.BigDecimal;

/**
 * Numeric attribute. Values are stored (and decoded) as {@link BigDecimal}s so no precision is
 * lost on the way through dynamo.
 */
public class NumberAttribute extends Attribute<Number> {

  public NumberAttribute(String name) {
    this(name, KeyRole.NONE, false);
  }

  public NumberAttribute(String name, boolean required) {
    this(name, KeyRole.NONE, required);
  }

  public NumberAttribute(String name, KeyRole role) {
    this(name, role, true);
  }

  private NumberAttribute(String name, KeyRole role, boolean required) {
    super(name, PrimitiveKind.NUMBER, role, required);
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (value instanceof BigDecimal) {
      return value;
    }
    if (value instanceof Number) {
      return new BigDecimal(value.toString());
    }
    if (value instanceof String) {
      return new BigDecimal((String) value);
    }
    throw unsupported(value);
  }

  @Override
  protected Number fromPrimitive(Object primitive) {
    if (primitive instanceof BigDecimal) {
      return (BigDecimal) primitive;
    }
    return new BigDecimal(primitive.toString());
  }

  public Update add(Number delta) {
    return new AddUpdate(this, delta);
  }

  public Update subtract(Number delta) {
    if (delta == null) {
      return add(null);
    }
    return add(((BigDecimal) encode(delta)).negate());
  }

  public Update increment() {
    return add(BigDecimal.ONE);
  }

  public Update decrement() {
    return add(BigDecimal.ONE.negate());
  }
}
