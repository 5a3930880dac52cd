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

public class OrCondition extends JoinCondition {

  public static final String OR = "OR";

  public OrCondition(Condition left, Condition right) {
    super(OR, left, right);
    checkJoinable(left, OR);
    checkJoinable(right, OR);
  }

  @Override
  public Condition or(Condition other) {
    return append(other);
  }

  @Override
  public <T> T visit(ConditionVisitor<T> visitor) {
    return visitor.visitOr(this);
  }
}
