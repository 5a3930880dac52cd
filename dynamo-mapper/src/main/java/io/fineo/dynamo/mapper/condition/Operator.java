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

package io.fineo.dynamo.mapper.condition;

import com.google.common.base.Joiner;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Comparison operators and how each renders into dynamo's expression grammar. Arguments to the
 * format are: attribute name, operator token, then the value placeholders.
 */
public enum Operator {
  EQ("=", 1, true, Formats.BINARY),
  NE("<>", 1, false, Formats.BINARY),
  LT("<", 1, true, Formats.BINARY),
  LTE("<=", 1, true, Formats.BINARY),
  GT(">", 1, true, Formats.BINARY),
  GTE(">=", 1, true, Formats.BINARY),
  // single operand is the collection of candidate values
  IN("IN", 1, false, null),
  CONTAINS("contains", 1, false, Formats.FUNC1),
  BEGINS_WITH("begins_with", 1, true, Formats.FUNC1),
  EXISTS("attribute_exists", 0, false, Formats.FUNC0),
  NOT_EXISTS("attribute_not_exists", 0, false, Formats.FUNC0),
  BETWEEN("BETWEEN", 2, true, Formats.BETWEEN);

  private static final Joiner COMMAS = Joiner.on(", ");

  private final String token;
  private final int arity;
  private final boolean keyOperator;
  private final String format;

  Operator(String token, int arity, boolean keyOperator, String format) {
    this.token = token;
    this.arity = arity;
    this.keyOperator = keyOperator;
    this.format = format;
  }

  public String getToken() {
    return token;
  }

  public int getArity() {
    return arity;
  }

  /**
   * @return <tt>true</tt> if dynamo accepts this operator in a key condition expression
   */
  public boolean isKeyOperator() {
    return keyOperator;
  }

  public String render(String name, List<String> values) {
    if (this == IN) {
      return name + " IN (" + COMMAS.join(values) + ")";
    }
    checkArgument(values.size() == arity, "%s needs %s values, got %s", this, arity, values);
    Object[] args = new Object[values.size() + 2];
    args[0] = name;
    args[1] = token;
    for (int i = 0; i < values.size(); i++) {
      args[i + 2] = values.get(i);
    }
    return String.format(format, args);
  }

  private static class Formats {
    private static final String BINARY = "%1$s %2$s %3$s";
    private static final String FUNC0 = "%2$s(%1$s)";
    private static final String FUNC1 = "%2$s(%1$s, %3$s)";
    private static final String BETWEEN = "%1$s %2$s %3$s AND %4$s";
  }
}
