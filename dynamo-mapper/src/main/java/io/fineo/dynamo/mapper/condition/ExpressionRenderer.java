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
import io.fineo.dynamo.mapper.exception.MultipleKeyLookupException;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders a condition tree into a dynamo expression, replacing names and values with
 * placeholders from the {@link NameMapper}.
 */
class ExpressionRenderer implements ConditionVisitor<String> {

  private final NameMapper mapper;
  private final boolean keyCondition;

  ExpressionRenderer(NameMapper mapper, boolean keyCondition) {
    this.mapper = checkNotNull(mapper, "mapper");
    this.keyCondition = keyCondition;
  }

  @Override
  public String visitComparison(Comparison comparison) {
    Operator operator = comparison.getOperator();
    if (keyCondition && !operator.isKeyOperator()) {
      if (operator == Operator.IN) {
        throw new MultipleKeyLookupException("Key conditions cannot use IN", comparison);
      }
      throw new ExpressionException(operator + " cannot be used in a key condition", comparison);
    }
    Attribute<?> attribute = comparison.getAttribute();
    String name = mapper.name(attribute.getPath());
    List<String> values = new ArrayList<>();
    for (Object value : comparison.getValues()) {
      values.add(mapper.value(attribute.encodeOperand(value)));
    }
    return operator.render(name, values);
  }

  @Override
  public String visitAnd(AndCondition and) {
    return join(and);
  }

  @Override
  public String visitOr(OrCondition or) {
    if (keyCondition) {
      throw new ExpressionException("OR cannot be used in a key condition", or);
    }
    return join(or);
  }

  private String join(JoinCondition node) {
    StringBuilder sb = new StringBuilder();
    for (Condition child : node.getChildren()) {
      if (sb.length() > 0) {
        sb.append(' ').append(node.getJoin()).append(' ');
      }
      String rendered = child.visit(this);
      // key conditions are a flat conjunction and dynamo does not accept grouping there
      if (!keyCondition && child instanceof JoinCondition) {
        sb.append('(').append(rendered).append(')');
      } else {
        sb.append(rendered);
      }
    }
    return sb.toString();
  }
}
