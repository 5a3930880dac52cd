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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N-ary boolean join of conditions. Joining again with the same operator appends to this node,
 * so chains like <tt>a.and(b).and(c)</tt> stay flat.
 */
public abstract class JoinCondition extends Condition {

  private final String join;
  private final List<Condition> children = new ArrayList<>();

  protected JoinCondition(String join, Condition left, Condition right) {
    this.join = join;
    this.children.add(left);
    this.children.add(right);
  }

  protected JoinCondition append(Condition other) {
    checkJoinable(other, join);
    children.add(other);
    return this;
  }

  public List<Condition> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public String getJoin() {
    return join;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return children.equals(((JoinCondition) o).children);
  }

  @Override
  public int hashCode() {
    return 31 * join.hashCode() + children.hashCode();
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    for (Condition child : children) {
      parts.add("(" + child + ")");
    }
    return Joiner.on(" " + join + " ").join(parts);
  }
}
