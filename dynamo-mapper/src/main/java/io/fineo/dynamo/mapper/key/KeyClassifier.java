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

package io.fineo.dynamo.mapper.key;

import com.google.common.base.Joiner;
import io.fineo.dynamo.mapper.attribute.Attribute;
import io.fineo.dynamo.mapper.condition.AndCondition;
import io.fineo.dynamo.mapper.condition.Comparison;
import io.fineo.dynamo.mapper.condition.Condition;
import io.fineo.dynamo.mapper.condition.ConditionVisitor;
import io.fineo.dynamo.mapper.condition.NameMapper;
import io.fineo.dynamo.mapper.condition.Operator;
import io.fineo.dynamo.mapper.condition.OrCondition;
import io.fineo.dynamo.mapper.exception.ExpressionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits a condition into the comparisons on the primary key and everything else.
 * <p>
 * Only a comparison on its own, or the direct children of a top-level AND, can be used as a key
 * condition. Anything under an OR always stays in the filter.
 */
public class KeyClassifier {

  private static final Joiner AND = Joiner.on(" " + AndCondition.AND + " ");

  // the comparisons that could take part in a key condition
  private static final ConditionVisitor<List<Condition>> CANDIDATES =
    new ConditionVisitor<List<Condition>>() {
      @Override
      public List<Condition> visitComparison(Comparison comparison) {
        return Collections.<Condition>singletonList(comparison);
      }

      @Override
      public List<Condition> visitAnd(AndCondition and) {
        return and.getChildren();
      }

      @Override
      public List<Condition> visitOr(OrCondition or) {
        return Collections.emptyList();
      }
    };

  private final KeySpec keys;

  public KeyClassifier(KeySpec keys) {
    this.keys = checkNotNull(keys, "keys");
  }

  public KeySpec getKeys() {
    return keys;
  }

  /**
   * Find the comparisons on key attributes in the condition.
   *
   * @param strictness key attributes that must be compared with equality
   * @param allRequired if there must be a comparison for every key attribute
   * @return the key comparisons, in the order they appear in the condition, or <tt>null</tt> if
   * there are none
   * @throws ExpressionException if the key comparisons do not follow the rules above
   */
  public List<Comparison> classify(Condition condition, KeyStrictness strictness,
    boolean allRequired) {
    if (condition == null) {
      return null;
    }

    List<Comparison> comparisons = new ArrayList<>();
    for (Condition candidate : condition.visit(CANDIDATES)) {
      if (isKeyComparison(candidate)) {
        comparisons.add((Comparison) candidate);
      }
    }

    Set<String> names = new HashSet<>();
    for (Comparison comparison : comparisons) {
      names.add(comparison.getAttribute().getName());
    }
    if (names.size() != comparisons.size()) {
      throw new ExpressionException("Cannot repeat keys in the same expression", condition);
    }

    for (Comparison comparison : comparisons) {
      boolean hash = keys.isHash(comparison.getAttribute());
      if (strictness.requiresEquality(hash) && comparison.getOperator() != Operator.EQ) {
        throw new ExpressionException(
          "An equality expression was required for the " + (hash ? "hash" : "range") + " key '"
          + comparison.getAttribute() + "'", condition);
      }
    }

    if (allRequired && comparisons.size() != keys.size()) {
      String msg = keys.hasRange() ?
                   "Conditions on both hash and range key must be specified joined with AND" :
                   "Condition on hash key attribute must be specified";
      throw new ExpressionException(msg, condition);
    }

    if (comparisons.isEmpty()) {
      return null;
    }

    if (comparisons.size() == 1 && keys.isRange(comparisons.get(0).getAttribute())) {
      throw new ExpressionException(
        "range key (" + keys.getRange() + ") expression can't be used without hash key ("
        + keys.getHash() + ") expression", condition);
    }
    return comparisons;
  }

  /**
   * Resolve a condition that names exactly one item into its primary key. Every key attribute
   * must be compared with equality.
   *
   * @return the encoded key values, by attribute name
   */
  public Map<String, Object> keyMap(Condition condition) {
    List<Comparison> comparisons = classify(condition, KeyStrictness.BOTH, true);
    if (comparisons == null) {
      throw new ExpressionException("No key conditions found", condition);
    }
    Map<String, Object> key = new LinkedHashMap<>();
    for (Comparison comparison : comparisons) {
      Attribute<?> attribute = comparison.getAttribute();
      Object value = comparison.getOperands().get(0);
      attribute.validate(value);
      key.put(attribute.getName(), attribute.encode(value));
    }
    return key;
  }

  /**
   * @return the part of the condition that is not on the primary key, or <tt>null</tt> if the
   * condition is entirely on the key
   */
  public Condition filterOf(Condition condition) {
    if (condition == null) {
      return null;
    }
    return condition.visit(new ConditionVisitor<Condition>() {
      @Override
      public Condition visitComparison(Comparison comparison) {
        return isKeyComparison(comparison) ? null : comparison;
      }

      @Override
      public Condition visitAnd(AndCondition and) {
        List<Condition> rest = new ArrayList<>();
        for (Condition child : and.getChildren()) {
          if (!isKeyComparison(child)) {
            rest.add(child);
          }
        }
        if (rest.isEmpty()) {
          return null;
        }
        if (rest.size() == 1) {
          return rest.get(0);
        }
        // build a new node so the caller's condition is never appended to
        Condition filter = new AndCondition(rest.get(0), rest.get(1));
        for (Condition child : rest.subList(2, rest.size())) {
          filter = filter.and(child);
        }
        return filter;
      }

      @Override
      public Condition visitOr(OrCondition or) {
        return or;
      }
    });
  }

  public String renderKeyCondition(List<Comparison> comparisons, NameMapper mapper) {
    List<String> parts = new ArrayList<>();
    for (Comparison comparison : comparisons) {
      parts.add(comparison.asKeyExpression(mapper));
    }
    return AND.join(parts);
  }

  private boolean isKeyComparison(Condition condition) {
    return condition instanceof Comparison && keys.isKey(((Comparison) condition).getAttribute());
  }
}
