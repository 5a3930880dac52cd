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

package io.fineo.dynamo.mapper.update;

import com.google.common.collect.ImmutableMap;
import io.fineo.dynamo.mapper.UserSchema;
import io.fineo.dynamo.mapper.attribute.MapAttribute;
import io.fineo.dynamo.mapper.attribute.NumberAttribute;
import io.fineo.dynamo.mapper.exception.ExpressionException;
import io.fineo.dynamo.mapper.exception.ValidationException;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestUpdateCompiler {

  private final UserSchema users = new UserSchema();
  private final UpdateCompiler compiler = new UpdateCompiler(new PlaceholderSequence());

  @Test
  public void testSet() throws Exception {
    CompiledUpdate update = compile(users.name.set("X"));
    assertEquals("SET #att0 = :val1", update.getExpression());
    assertEquals(ImmutableMap.of("#att0", "name"), update.getNames());
    assertEquals(ImmutableMap.<String, Object>of(":val1", "X"), update.getValues());
  }

  @Test
  public void testSetIfNotExists() throws Exception {
    assertEquals("SET #att0 = if_not_exists(#att0, :val1)",
      compile(users.name.setIfNotExists("X")).getExpression());
  }

  @Test
  public void testSetNothingRemoves() throws Exception {
    assertEquals("REMOVE #att0", compile(users.name.set(null)).getExpression());
    assertEquals("REMOVE #att1", compile(users.name.set("")).getExpression());
  }

  @Test
  public void testSetNothingIfNotExistsIsANoop() throws Exception {
    CompiledUpdate update = compile(users.name.setIfNotExists(null));
    assertTrue(update.isEmpty());
    assertTrue(update.getValues().isEmpty());
  }

  @Test
  public void testAddNothingIsANoop() throws Exception {
    assertTrue(compile(users.age.add(0)).isEmpty());
    assertTrue(compile(users.age.add(0.0)).isEmpty());
    assertTrue(compile(users.age.add(BigDecimal.ZERO)).isEmpty());
    assertTrue(compile(users.age.add(null)).isEmpty());
  }

  @Test
  public void testAdd() throws Exception {
    CompiledUpdate update = compile(users.age.subtract(2));
    assertEquals("ADD #att0 :val1", update.getExpression());
    assertEquals(new BigDecimal("-2"), update.getValues().get(":val1"));
  }

  @Test
  public void testAddOnlyOnTopLevelAttributes() throws Exception {
    NumberAttribute nested = new MapAttribute("stats").child(new NumberAttribute("count"));
    try {
      nested.add(1);
      fail("Should not be able to ADD to a nested attribute");
    } catch (ExpressionException e) {
      // expected
    }
  }

  @Test
  public void testExtendList() throws Exception {
    assertTrue(compile(users.tags.append(Collections.<String>emptyList())).isEmpty());

    CompiledUpdate prepend = compile(users.tags.prepend("a", "b"));
    assertEquals("SET #att0 = list_append(:val1, #att0)", prepend.getExpression());
    assertEquals(Arrays.asList("a", "b"), prepend.getValues().get(":val1"));

    CompiledUpdate append = compile(users.tags.append("c"));
    assertEquals("SET #att2 = list_append(#att2, :val3)", append.getExpression());
  }

  @Test
  public void testClauseGroupsAreOrdered() throws Exception {
    CompiledUpdate update =
      compile(users.nickname.remove(), users.age.add(1), users.name.set("X"));
    assertEquals("SET #att3 = :val4 ADD #att1 :val2 REMOVE #att0", update.getExpression());
    assertEquals(3, update.getNames().size());
    assertEquals(2, update.getValues().size());
    Set<String> placeholders = new HashSet<>(update.getNames().keySet());
    placeholders.addAll(update.getValues().keySet());
    assertEquals(5, placeholders.size());
  }

  @Test
  public void testMultipleClausesInAGroup() throws Exception {
    CompiledUpdate update = compile(users.name.set("X"), users.city.set("Paris"));
    assertEquals("SET #att0 = :val1, #att2.#att3 = :val4", update.getExpression());
    assertEquals(ImmutableMap.of("#att0", "name", "#att2", "address", "#att3", "city"),
      update.getNames());
  }

  @Test
  public void testLastUpdateToAnAttributeWins() throws Exception {
    CompiledUpdate update = compile(users.name.set("a"), users.name.set("b"));
    assertEquals("SET #att2 = :val3", update.getExpression());
    assertEquals(ImmutableMap.<String, Object>of(":val3", "b"), update.getValues());

    // no-ops do not replace a real update
    update = compile(users.name.set("c"), users.name.setIfNotExists(null));
    assertEquals(ImmutableMap.<String, Object>of(":val5", "c"), update.getValues());

    // the winning clause can be in a different group
    update = compile(users.nickname.set("d"), users.nickname.remove());
    assertEquals("REMOVE #att8", update.getExpression());
    assertTrue(update.getValues().isEmpty());
  }

  @Test
  public void testCannotRemoveRequiredAttributes() throws Exception {
    for (Update update : Arrays.asList(users.country.remove(), users.country.set(null),
      users.userId.remove())) {
      try {
        compile(update);
        fail("Removed a required attribute with " + update);
      } catch (ValidationException e) {
        // expected
      }
    }
  }

  @Test
  public void testPlaceholdersAreNotReusedAcrossCompilers() throws Exception {
    CompiledUpdate first = new UpdateCompiler().compile(Arrays.asList(users.name.set("X")));
    CompiledUpdate second = new UpdateCompiler().compile(Arrays.asList(users.name.set("X")));
    Set<String> values = new HashSet<>(first.getValues().keySet());
    assertFalse(values.removeAll(second.getValues().keySet()));
    Set<String> names = new HashSet<>(first.getNames().keySet());
    assertFalse(names.removeAll(second.getNames().keySet()));
  }

  @Test
  public void testSequenceIsThreadSafe() throws Exception {
    PlaceholderSequence sequence = new PlaceholderSequence();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<Set<String>>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(pool.submit(() -> {
          Set<String> seen = new HashSet<>();
          for (int j = 0; j < 1000; j++) {
            seen.add(sequence.nextValue());
          }
          return seen;
        }));
      }
      Set<String> all = new HashSet<>();
      for (Future<Set<String>> future : futures) {
        all.addAll(future.get());
      }
      assertEquals(4000, all.size());
    } finally {
      pool.shutdown();
      pool.awaitTermination(10, TimeUnit.SECONDS);
    }
  }

  private CompiledUpdate compile(Update... updates) {
    return compiler.compile(Arrays.asList(updates));
  }
}
