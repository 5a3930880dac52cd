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

package io.fineo.dynamo.mapper.table;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import io.fineo.dynamo.mapper.AccountSchema;
import io.fineo.dynamo.mapper.ScriptedDynamoTransport;
import io.fineo.dynamo.mapper.UserSchema;
import io.fineo.dynamo.mapper.dispatch.LookupStrategy;
import io.fineo.dynamo.mapper.dispatch.ReadOptions;
import io.fineo.dynamo.mapper.exception.ConditionalCheckFailedException;
import io.fineo.dynamo.mapper.exception.ValidationException;
import io.fineo.dynamo.mapper.schema.DynamoRecord;
import io.fineo.dynamo.mapper.update.PlaceholderSequence;
import io.fineo.dynamo.mapper.update.Update;
import io.fineo.dynamo.mapper.update.UpdateCompiler;
import io.fineo.dynamo.transport.UpdateRequest;
import io.fineo.dynamo.transport.WriteCondition;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestDynamoTable {

  private final UserSchema users = new UserSchema();
  private ScriptedDynamoTransport transport;
  private DynamoTable table;

  @Before
  public void setup() {
    transport = new ScriptedDynamoTransport("user_id", "email");
    table = new DynamoTable(users.schema, () -> transport, "test_users", true,
      new UpdateCompiler(new PlaceholderSequence()));
  }

  @Test
  public void testSaveAndGet() throws Exception {
    DynamoRecord saved = table.saveOne(user("u1", "e1").with(users.name, "bob"));
    assertEquals("bob", saved.get(users.name));
    assertNull(transport.writeConditions.get(0));

    DynamoRecord read = table.getOne(LookupStrategy.keyPair("u1", "e1"));
    assertEquals(saved, read);
    assertEquals(Arrays.asList(true), transport.consistentReads);

    assertNull(table.getOne(LookupStrategy.keyPair("u1", "e2")));
  }

  @Test
  public void testSaveWithoutOverwrite() throws Exception {
    table.saveOne(user("u1", "e1"), false);
    WriteCondition condition = transport.writeConditions.get(0);
    assertEquals("attribute_not_exists(#n0) AND attribute_not_exists(#n1)",
      condition.getExpression());
    assertEquals(ImmutableMap.of("#n0", "user_id", "#n1", "email"), condition.getNameMap());
    assertTrue(condition.getValueMap().isEmpty());

    transport.failConditionFor(key("u1", "e1"));
    try {
      table.saveOne(user("u1", "e1"), false);
      fail("Overwrote an existing item");
    } catch (ConditionalCheckFailedException e) {
      assertTrue(e.getCause() instanceof
        com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException);
    }
  }

  @Test
  public void testSaveWithGuard() throws Exception {
    table.saveOne(user("u1", "e1"), users.age.lt(18));
    assertEquals("#n0 < :v1", transport.writeConditions.get(0).getExpression());
    assertEquals(ImmutableMap.<String, Object>of(":v1", new BigDecimal("18")),
      transport.writeConditions.get(0).getValueMap());
  }

  @Test
  public void testSaveValidatesFirst() throws Exception {
    try {
      table.saveOne(new DynamoRecord().with(users.userId, "u1").with(users.email, "e1"));
      fail("Saved a record without a required attribute");
    } catch (ValidationException e) {
      // expected
    }
    try {
      table.saveMany(Arrays.asList(user("u1", "e1"), new DynamoRecord().with(users.userId,
        "u2")));
      fail("Saved a record without a key");
    } catch (ValidationException e) {
      // expected
    }
    assertTrue(transport.operations.isEmpty());
  }

  @Test
  public void testSaveMany() throws Exception {
    BatchResult<DynamoRecord> result =
      table.saveMany(Arrays.asList(user("u1", "e1"), user("u2", "e2")));
    assertEquals(2, result.getSucceeded().size());
    assertFalse(result.hasFailures());
    assertEquals(Arrays.asList("batchWrite"), transport.operations);
    assertEquals(2, transport.batchPuts.get(0).size());
    assertEquals(2, transport.size());
  }

  @Test
  public void testSaveManyWritesARepeatedKeyOnce() throws Exception {
    BatchResult<DynamoRecord> result = table.saveMany(Arrays.asList(
      user("u1", "e1").with(users.name, "first"), user("u2", "e2"),
      user("u1", "e1").with(users.name, "second")));
    assertEquals(1, transport.batchPuts.size());
    List<Map<String, Object>> puts = transport.batchPuts.get(0);
    assertEquals(2, puts.size());
    assertEquals("second", puts.get(0).get("name"));
    assertEquals("u2", puts.get(1).get("user_id"));
    assertEquals(2, result.getSucceeded().size());
    assertEquals("second", transport.stored(key("u1", "e1")).get("name"));
  }

  @Test
  public void testSaveManyCollectsFailedGuards() throws Exception {
    transport.failConditionFor(key("u2", "e2"));
    DynamoRecord first = user("u1", "e1");
    DynamoRecord second = user("u2", "e2");
    BatchResult<DynamoRecord> result = table.saveMany(Arrays.asList(first, second), false);
    assertEquals(Arrays.asList(first), result.getSucceeded());
    assertEquals(Arrays.asList(second), result.getFailed());
    assertEquals(2, transport.count("put"));
    assertEquals(1, transport.size());
  }

  @Test
  public void testGetOneOnlyTakesKeys() throws Exception {
    try {
      table.getOne(LookupStrategy.search(
        users.userId.eq("u1").and(users.email.eq("e1")).and(users.name.eq("bob"))));
      fail("Got an item with a non-key condition");
    } catch (ValidationException e) {
      // expected
    }
    try {
      table.getOne(LookupStrategy.keys(LookupStrategy.keyPair("u1", "e1")));
      fail("Got a single item from a list of keys");
    } catch (ValidationException e) {
      // expected
    }
    assertTrue(transport.operations.isEmpty());
  }

  @Test
  public void testGetManyByKeys() throws Exception {
    DynamoTable inconsistent = new DynamoTable(users.schema, transport, "test_users", false);
    transport.store(item("u1", "e1")).store(item("u2", "e2"));
    List<Pair<String, String>> pairs = Arrays.asList(Pair.of("u1", "e1"), Pair.of("u2", "e2"),
      Pair.of("u3", "e3"));
    List<DynamoRecord> records =
      Lists.newArrayList(inconsistent.getMany(DynamoTable.keysIn(pairs)));
    assertEquals(2, records.size());
    assertEquals(Arrays.asList("batchGet"), transport.operations);
    assertEquals(Arrays.asList(false), transport.consistentReads);

    // the caller can still ask for a consistent read
    Lists.newArrayList(inconsistent.getMany(DynamoTable.keysIn(pairs),
      ReadOptions.defaults().withConsistentRead(true)));
    assertEquals(Arrays.asList(false, true), transport.consistentReads);
  }

  @Test
  public void testGetManyWithSearch() throws Exception {
    transport.page(Arrays.asList(item("u1", "e1"), item("u1", "e2")), null);
    List<DynamoRecord> records = Lists.newArrayList(table.getMany(LookupStrategy.search(
      users.userId.eq("u1").and(users.email.beginsWith("e")))));
    assertEquals(2, records.size());
    assertEquals("e2", records.get(1).get(users.email));
    assertEquals(Arrays.asList("query"), transport.operations);
  }

  @Test
  public void testDeleteOne() throws Exception {
    transport.store(item("u1", "e1"));
    DynamoRecord deleted = table.deleteOne(LookupStrategy.keyPair("u1", "e1"));
    assertEquals("fr", deleted.get(users.country));
    assertNull(transport.writeConditions.get(0));
    assertNull(table.deleteOne(LookupStrategy.keyPair("u1", "e1")));
  }

  @Test
  public void testDeleteOneWithGuard() throws Exception {
    transport.store(item("u1", "e1")).failConditionFor(key("u1", "e1"));
    try {
      table.deleteOne(LookupStrategy.search(
        users.userId.eq("u1").and(users.email.eq("e1")).and(users.name.eq("bob"))));
      fail("Deleted an item that did not meet the guard");
    } catch (ConditionalCheckFailedException e) {
      // expected
    }
    assertEquals("#n0 = :v1", transport.writeConditions.get(0).getExpression());
    assertEquals(1, transport.size());
  }

  @Test
  public void testDeleteManyByKeys() throws Exception {
    transport.store(item("u1", "e1")).store(item("u2", "e2"));
    BatchResult<DynamoRecord> result = table.deleteMany(
      LookupStrategy.keys(LookupStrategy.keyPair("u1", "e1"), LookupStrategy.keyPair("u2",
        "e2")));
    assertEquals(Arrays.asList("batchWrite"), transport.operations);
    assertEquals(Arrays.asList(key("u1", "e1"), key("u2", "e2")), transport.batchDeletes.get(0));
    assertEquals(2, result.getSucceeded().size());
    assertEquals("u1", result.getSucceeded().get(0).get(users.userId));
    assertEquals(0, transport.size());
  }

  @Test
  public void testDeleteManyDeletesARepeatedKeyOnce() throws Exception {
    transport.store(item("u1", "e1")).store(item("u2", "e2"));
    BatchResult<DynamoRecord> result = table.deleteMany(LookupStrategy.keys(
      LookupStrategy.keyPair("u1", "e1"), LookupStrategy.keyPair("u2", "e2"),
      LookupStrategy.keyPair("u1", "e1")));
    assertEquals(Arrays.asList(key("u1", "e1"), key("u2", "e2")), transport.batchDeletes.get(0));
    assertEquals(2, result.getSucceeded().size());
  }

  @Test
  public void testDeleteManyWithGuards() throws Exception {
    transport.store(item("u1", "e1")).store(item("u2", "e2"))
             .failConditionFor(key("u1", "e1"));
    BatchResult<DynamoRecord> result = table.deleteMany(LookupStrategy.keys(
      LookupStrategy.search(users.userId.eq("u1").and(users.email.eq("e1"))
                                        .and(users.name.eq("bob"))),
      LookupStrategy.keyPair("u2", "e2")));
    assertEquals(Arrays.asList("delete", "batchWrite"), transport.operations);
    assertEquals(1, result.getFailed().size());
    assertEquals("u1", result.getFailed().get(0).get(users.userId));
    assertEquals(1, result.getSucceeded().size());
    assertEquals("u2", result.getSucceeded().get(0).get(users.userId));
  }

  @Test
  public void testDeleteManyWithSearch() throws Exception {
    transport.store(item("u1", "e1")).store(item("u1", "e2"));
    transport.page(Arrays.asList(item("u1", "e1"), item("u1", "e2")), null);
    BatchResult<DynamoRecord> result = table.deleteMany(LookupStrategy.search(
      users.userId.eq("u1")));
    assertEquals(Arrays.asList("query", "batchWrite"), transport.operations);
    assertEquals(Arrays.asList(key("u1", "e1"), key("u1", "e2")), transport.batchDeletes.get(0));
    assertEquals(2, result.getSucceeded().size());
    assertEquals(0, transport.size());
  }

  @Test
  public void testDeleteManyInOnHashKeyNeedsNoRead() throws Exception {
    AccountSchema accounts = new AccountSchema();
    ScriptedDynamoTransport accountStore = new ScriptedDynamoTransport("id");
    DynamoTable accountTable = new DynamoTable(accounts.schema, accountStore, "accounts", true);
    accountTable.deleteMany(LookupStrategy.search(accounts.id.in("a", "b")));
    assertEquals(Arrays.asList("batchWrite"), accountStore.operations);
    assertEquals(2, accountStore.batchDeletes.get(0).size());
  }

  @Test
  public void testDeleteManyInReportsEveryRequestedKey() throws Exception {
    AccountSchema accounts = new AccountSchema();
    ScriptedDynamoTransport accountStore = new ScriptedDynamoTransport("id");
    accountStore.store(ImmutableMap.<String, Object>of("id", "a"));
    DynamoTable accountTable = new DynamoTable(accounts.schema, accountStore, "accounts", true);
    BatchResult<DynamoRecord> result =
      accountTable.deleteMany(LookupStrategy.search(accounts.id.in("a", "missing", "a")));
    assertEquals(Arrays.asList(ImmutableMap.of("id", "a"), ImmutableMap.of("id", "missing")),
      accountStore.batchDeletes.get(0));
    // no read first, so a key without an item still counts as deleted
    assertEquals(2, result.getSucceeded().size());
    assertEquals("missing", result.getSucceeded().get(1).get(accounts.id));
    assertEquals(0, accountStore.size());
  }

  @Test
  public void testUpdateOne() throws Exception {
    transport.store(item("u1", "e1"));
    DynamoRecord updated = table.updateOne(LookupStrategy.keyPair("u1", "e1"),
      users.name.set("X"), users.age.add(1));
    assertEquals("u1", updated.get(users.userId));

    UpdateRequest request = transport.updates.get(0);
    assertEquals("SET #att0 = :val1 ADD #att2 :val3", request.getUpdateExpression());
    assertEquals("attribute_exists(#n0) AND attribute_exists(#n1)",
      request.getConditionExpression());
    Map<String, String> names = new HashMap<>();
    names.put("#att0", "name");
    names.put("#att2", "age");
    names.put("#n0", "user_id");
    names.put("#n1", "email");
    assertEquals(names, request.getNameMap());
    assertEquals(ImmutableMap.<String, Object>of(":val1", "X", ":val3", new BigDecimal("1")),
      request.getValueMap());
  }

  @Test
  public void testUpdateMissingItem() throws Exception {
    try {
      table.updateOne(LookupStrategy.keyPair("u1", "e1"), users.name.set("X"));
      fail("Updated an item that does not exist");
    } catch (ConditionalCheckFailedException e) {
      // expected
    }
  }

  @Test
  public void testNoopUpdateReadsTheItem() throws Exception {
    transport.store(item("u1", "e1"));
    DynamoRecord current = table.updateOne(LookupStrategy.keyPair("u1", "e1"),
      users.age.add(0), users.nickname.setIfNotExists(null));
    assertEquals("fr", current.get(users.country));
    assertEquals(Arrays.asList("get"), transport.operations);
  }

  @Test
  public void testInvalidUpdates() throws Exception {
    try {
      table.updateOne(LookupStrategy.keyPair("u1", "e1"), Collections.<Update>emptyList());
      fail("Updated with no updates");
    } catch (ValidationException e) {
      // expected
    }
    try {
      table.updateOne(LookupStrategy.search(
        users.userId.eq("u1").and(users.email.eq("e1")).and(users.name.eq("bob"))),
        users.name.set("X"));
      fail("Updated with a non-key condition");
    } catch (ValidationException e) {
      // expected
    }
    try {
      table.updateOne(LookupStrategy.keyPair("u1", "e1"), users.country.remove());
      fail("Removed a required attribute");
    } catch (ValidationException e) {
      // expected
    }
    assertTrue(transport.operations.isEmpty());
  }

  @Test
  public void testUpdateFromMap() throws Exception {
    transport.store(item("u1", "e1"));
    Map<String, Object> values = new HashMap<>();
    values.put("user_id", "u1");
    values.put("email", "e1");
    values.put("nickname", null);
    table.updateFromMap(values);
    assertEquals("REMOVE #att0", transport.updates.get(0).getUpdateExpression());

    values.put("unknown", "x");
    try {
      table.updateFromMap(values);
      fail("Updated an unknown attribute");
    } catch (ValidationException e) {
      // expected
    }
  }

  private DynamoRecord user(String id, String email) {
    return new DynamoRecord().with(users.userId, id).with(users.email, email)
                             .with(users.country, "fr");
  }

  private static Map<String, Object> item(String id, String email) {
    return ImmutableMap.<String, Object>of("user_id", id, "email", email, "country", "fr");
  }

  private static Map<String, Object> key(String id, String email) {
    return ImmutableMap.<String, Object>of("user_id", id, "email", email);
  }
}
