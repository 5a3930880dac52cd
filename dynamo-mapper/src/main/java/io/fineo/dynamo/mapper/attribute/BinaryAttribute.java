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

import java.nio.ByteBuffer;

public class BinaryAttribute extends Attribute<byte[]> {

  public BinaryAttribute(String name) {
    this(name, KeyRole.NONE, false);
  }

  public BinaryAttribute(String name, KeyRole role) {
    this(name, role, true);
  }

  private BinaryAttribute(String name, KeyRole role, boolean required) {
    super(name, PrimitiveKind.BINARY, role, required);
  }

  @Override
  protected Object toPrimitive(Object value) {
    if (value instanceof byte[]) {
      return value;
    }
    if (value instanceof ByteBuffer) {
      ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    }
    throw unsupported(value);
  }

  @Override
  protected byte[] fromPrimitive(Object primitive) {
    if (primitive instanceof ByteBuffer) {
      return (byte[]) toPrimitive(primitive);
    }
    return (byte[]) primitive;
  }
}
