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

import com.google.common.collect.ImmutableMap;
import io.fineo.dynamo.mapper.UserSchema;
import io.fineo.dynamo.mapper.exception.ExpressionException;
import io.fineo.dynamo.mapper.exception.MultipleKeyLookupException;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestCondition {

  private final UserSchema users = new UserSchema();

  @Test
  public void testArityMismatchFails() throws Exception {
    for (Operator op : Operator.values()) {
      Object[] tooMany = new Object[op.getArity() + 1];
      for (int i = 0; i < tooMany.length; i++) {
        tooMany[i] = Collections.singletonList("v" + i);
      }
      try {
        new Comparison(users.name, op, tooMany);
        fail(op + " accepted " + tooMany.length + " operands");
      } catch (ExpressionException e) {
        // expected
      }

      if (op.getArity() > 0) {
        try {
          new Comparison(users.name, op, new Object[op.getArity() - 1]);
          fail(op + " accepted too few operands");
        } catch (ExpressionException e) {
          // expected
        }
      }
    }
  }

  @Test(expected = ExpressionException.class)
  public void testInNeedsValues() throws Exception {
    users.name.in(Collections.<String>emptyList());
  }

  @Test
  public void testAndFlattens() throws Exception {
    Condition a = users.name.eq("a");
    Condition b = users.age.gt(1);
    Condition c = users.nickname.exists();

    Condition ab = a.and(b);
    Condition abc = ab.and(c);
    assertSame(ab, abc);
    assertTrue(abc instanceof AndCondition);
    assertEquals(3, ((AndCondition) abc).getChildren().size());
  }

  @Test
  public void testOrFlattens() throws Exception {
    Condition or = users.name.eq("a").or(users.name.eq("b")).or(users.name.eq("c"));
    assertTrue(or instanceof OrCondition);
    assertEquals(3, ((OrCondition) or).getChildren().size());
  }

  @Test
  public void testMixingJoinsWraps() throws Exception {
    Condition and = users.name.eq("a").and(users.age.gt(1));
    Condition or = and.or(users.nickname.exists());
    assertTrue(or instanceof OrCondition);
    assertEquals(2, ((OrCondition) or).getChildren().size());
    assertSame(and, ((OrCondition) or).getChildren().get(0));
    // the inner AND is left alone
    assertEquals(2, ((AndCondition) and).getChildren().size());
  }

  @Test
  public void testJoinWithNothingFails() throws Exception {
    try {
      users.name.eq("a").and(null);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      users.name.eq("a").and(users.age.gt(1)).or(null);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testRenderOperators() throws Exception {
    assertFilter("#n0 = :v1", users.name.eq("a"));
    assertFilter("#n0 <> :v1", users.name.ne("a"));
    assertFilter("#n0 < :v1", users.age.lt(1));
    assertFilter("#n0 <= :v1", users.age.lte(1));
    assertFilter("#n0 > :v1", users.age.gt(1));
    assertFilter("#n0 >= :v1", users.age.gte(1));
    assertFilter("#n0 IN (:v1, :v2)", users.name.in("a", "b"));
    assertFilter("contains(#n0, :v1)", users.tags.contains("red"));
    assertFilter("begins_with(#n0, :v1)", users.name.beginsWith("a"));
    assertFilter("attribute_exists(#n0)", users.name.exists());
    assertFilter("attribute_not_exists(#n0)", users.name.notExists());
    assertFilter("#n0 BETWEEN :v1 AND :v2", users.age.between(1, 5));
  }

  @Test
  public void testRenderPlaceholders() throws Exception {
    NameMapper mapper = new NameMapper();
    Condition condition = users.name.eq("bob").and(users.age.gt(3));
    assertEquals("#n0 = :v1 AND #n2 > :v3", condition.asFilterExpression(mapper));
    assertEquals(ImmutableMap.of("#n0", "name", "#n2", "age"), mapper.getNameMap());
    assertEquals(ImmutableMap.<String, Object>of(":v1", "bob", ":v3", new BigDecimal("3")),
      mapper.getValueMap());
  }

  @Test
  public void testRepeatedValuesShareAPlaceholder() throws Exception {
    NameMapper mapper = new NameMapper();
    Condition condition = users.name.eq("x").or(users.nickname.eq("x"));
    assertEquals("#n0 = :v1 OR #n2 = :v1", condition.asFilterExpression(mapper));
    assertEquals(1, mapper.getValueMap().size());
  }

  @Test
  public void testNestedJoinsAreGrouped() throws Exception {
    Condition condition =
      users.name.eq("a").or(users.nickname.eq("b")).and(users.age.gt(1));
    assertFilter("(#n0 = :v1 OR #n2 = :v3) AND #n4 > :v5", condition);
  }

  @Test
  public void testNestedAttributePath() throws Exception {
    NameMapper mapper = new NameMapper();
    assertEquals("#n0.#n1 = :v2", users.city.eq("Paris").asFilterExpression(mapper));
    assertEquals(ImmutableMap.of("#n0", "address", "#n1", "city"), mapper.getNameMap());
  }

  @Test
  public void testKeyProjection() throws Exception {
    Condition key = users.userId.eq("u1").and(users.email.beginsWith("a"));
    assertEquals("#n0 = :v1 AND begins_with(#n2, :v3)", key.asKeyExpression(new NameMapper()));
  }

  @Test
  public void testInIsNotAKeyCondition() throws Exception {
    try {
      users.userId.in("a", "b").asKeyExpression(new NameMapper());
      fail();
    } catch (MultipleKeyLookupException e) {
      // expected
    }
  }

  @Test
  public void testOtherNonKeyOperators() throws Exception {
    for (Condition condition : new Condition[]{users.userId.ne("a"), users.userId.exists(),
      users.userId.eq("a").or(users.userId.eq("b"))}) {
      try {
        condition.asKeyExpression(new NameMapper());
        fail(condition + " should not be a key condition");
      } catch (ExpressionException e) {
        assertFalse(e instanceof MultipleKeyLookupException);
      }
    }
  }

  @Test
  public void testToString() throws Exception {
    assertEquals("user_id = u1", users.userId.eq("u1").toString());
    assertEquals("(user_id = u1) AND (age BETWEEN 1 AND 2)",
      users.userId.eq("u1").and(users.age.between(1, 2)).toString());
  }

  @Test
  public void testEquality() throws Exception {
    assertEquals(users.userId.eq("u1"), users.userId.eq("u1"));
    assertFalse(users.userId.eq("u1").equals(users.userId.eq("u2")));
    assertFalse(users.userId.eq("u1").equals(users.userId.ne("u1")));
  }

  private static void assertFilter(String expected, Condition condition) {
    assertEquals(expected, condition.asFilterExpression(new NameMapper()));
  }
}
