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

public class BooleanAttribute extends Attribute<Boolean> {

  public BooleanAttribute(String name) {
    this(name, false);
  }

  public BooleanAttribute(String name, boolean required) {
    super(name, PrimitiveKind.BOOLEAN, KeyRole.NONE, required);
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (value instanceof Boolean) {
      return value;
    }
    throw unsupported(value);
  }

  @Override
  protected Boolean fromPrimitive(Object primitive) {
    return (Boolean) primitive;
  }
}
