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

/**
 * The dynamo type an attribute is stored as
 */
public enum PrimitiveKind {
  STRING("S"),
  NUMBER("N"),
  BINARY("B"),
  BOOLEAN("BOOL"),
  LIST("L"),
  MAP("M");

  private final String code;

  PrimitiveKind(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /**
   * @return <tt>true</tt> if dynamo allows this type as a hash or range key
   */
  public boolean isKeyKind() {
    return this == STRING || this == NUMBER || this == BINARY;
  }
}
