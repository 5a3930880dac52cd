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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A predicate over the attributes of an item. Built from the comparison methods on an attribute
 * and joined with {@link #and(Condition)} and {@link #or(Condition)}.
 * <p>
 * Nothing is rendered until the condition is used: it can then be projected either as a key
 * condition (only the operators dynamo allows on keys) or as a filter/condition expression.
 */
public abstract class Condition {

  public Condition and(Condition other) {
    checkJoinable(other, "AND");
    return new AndCondition(this, other);
  }

  public Condition or(Condition other) {
    checkJoinable(other, "OR");
    return new OrCondition(this, other);
  }

  protected static void checkJoinable(Condition other, String join) {
    checkArgument(other != null, "Can only %s with another condition", join);
  }

  public String asKeyExpression(NameMapper mapper) {
    return visit(new ExpressionRenderer(mapper, true));
  }

  public String asFilterExpression(NameMapper mapper) {
    return visit(new ExpressionRenderer(mapper, false));
  }

  public abstract <T> T visit(ConditionVisitor<T> visitor);
}
