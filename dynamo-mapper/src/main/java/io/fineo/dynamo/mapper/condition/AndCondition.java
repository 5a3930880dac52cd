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

public class AndCondition extends JoinCondition {

  public static final String AND = "AND";

  public AndCondition(Condition left, Condition right) {
    super(AND, left, right);
    checkJoinable(left, AND);
    checkJoinable(right, AND);
  }

  @Override
  public Condition and(Condition other) {
    return append(other);
  }

  @Override
  public <T> T visit(ConditionVisitor<T> visitor) {
    return visitor.visitAnd(this);
  }
}
