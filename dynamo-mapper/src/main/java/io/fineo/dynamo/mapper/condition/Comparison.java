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

import io.fineo.dynamo.mapper.attribute.Attribute;
import io.fineo.dynamo.mapper.exception.ExpressionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Single comparison of an attribute against zero, one or two operands, depending on the operator
 */
public class Comparison extends Condition {

  private final Attribute<?> attribute;
  private final Operator operator;
  private final List<Object> operands;

  public Comparison(Attribute<?> attribute, Operator operator, Object... operands) {
    this.attribute = checkNotNull(attribute, "attribute");
    this.operator = checkNotNull(operator, "operator");
    int count = operands == null ? 0 : operands.length;
    if (count != operator.getArity()) {
      throw new ExpressionException(
        operator + " takes " + operator.getArity() + " operand(s), but got " + count,
        attribute + " " + operator.getToken() + " " + Arrays.toString(operands));
    }
    this.operands = count == 0 ? Collections.emptyList() :
                    Collections.unmodifiableList(new ArrayList<>(Arrays.asList(operands)));
    if (operator == Operator.IN) {
      Object values = this.operands.get(0);
      if (!(values instanceof Collection) || ((Collection<?>) values).isEmpty()) {
        throw new ExpressionException("IN needs a non-empty collection of values",
          attribute + " IN " + values);
      }
    }
  }

  public Attribute<?> getAttribute() {
    return attribute;
  }

  public Operator getOperator() {
    return operator;
  }

  public List<Object> getOperands() {
    return operands;
  }

  /**
   * @return the candidate values of an <tt>IN</tt> comparison, otherwise the operands
   */
  public List<Object> getValues() {
    if (operator == Operator.IN) {
      return new ArrayList<>((Collection<?>) operands.get(0));
    }
    return operands;
  }

  @Override
  public <T> T visit(ConditionVisitor<T> visitor) {
    return visitor.visitComparison(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Comparison that = (Comparison) o;

    if (!attribute.equals(that.attribute)) {
      return false;
    }
    if (operator != that.operator) {
      return false;
    }
    return operands.equals(that.operands);
  }

  @Override
  public int hashCode() {
    int result = attribute.hashCode();
    result = 31 * result + operator.hashCode();
    result = 31 * result + operands.hashCode();
    return result;
  }

  @Override
  public String toString() {
    List<String> values = new ArrayList<>();
    for (Object value : getValues()) {
      values.add(String.valueOf(value));
    }
    return operator.render(attribute.getName(), values);
  }
}
