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

public class StringAttribute extends Attribute<String> {

  public StringAttribute(String name) {
    this(name, KeyRole.NONE, false);
  }

  public StringAttribute(String name, boolean required) {
    this(name, KeyRole.NONE, required);
  }

  public StringAttribute(String name, KeyRole role) {
    this(name, role, true);
  }

  private StringAttribute(String name, KeyRole role, boolean required) {
    super(name, PrimitiveKind.STRING, role, required);
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (value instanceof String) {
      return value;
    }
    if (value instanceof CharSequence || value instanceof Enum) {
      return value.toString();
    }
    throw unsupported(value);
  }

  @Override
  protected String fromPrimitive(Object primitive) {
    return (String) primitive;
  }
}
