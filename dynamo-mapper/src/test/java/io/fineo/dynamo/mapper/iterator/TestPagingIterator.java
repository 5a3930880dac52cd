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

package io.fineo.dynamo.mapper.iterator;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import io.fineo.dynamo.mapper.ScriptedDynamoTransport;
import io.fineo.dynamo.transport.ReadRequest;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestPagingIterator {

  private static final Function<Map<String, Object>, Object> ID = item -> item.get("id");

  @Test
  public void testFollowsContinuationKeys() throws Exception {
    ScriptedDynamoTransport transport = new ScriptedDynamoTransport("id");
    Map<String, Object> first = ImmutableMap.<String, Object>of("id", "b");
    Map<String, Object> second = ImmutableMap.<String, Object>of("id", "d");
    transport.page(items("a", "b"), first)
             .page(items("c", "d"), second)
             .page(items("e"), null);

    ReadRequest request = new ReadRequest().withFilterExpression("#n0 = :v1");
    PagingIterator<Object> iter =
      new PagingIterator<>(transport, "t", request, PagingIterator.Mode.SCAN, null, ID);
    assertEquals(Arrays.<Object>asList("a", "b", "c", "d", "e"), Lists.newArrayList(iter));
    assertEquals(3, iter.getRoundTrips());
    assertEquals(Arrays.asList("scan", "scan", "scan"), transport.operations);

    assertNull(transport.reads.get(0).getExclusiveStartKey());
    assertEquals(first, transport.reads.get(1).getExclusiveStartKey());
    assertEquals(second, transport.reads.get(2).getExclusiveStartKey());
    for (ReadRequest sent : transport.reads) {
      assertEquals("#n0 = :v1", sent.getFilterExpression());
      assertNull(sent.getLimit());
    }
    // the caller's request is never changed
    assertNull(request.getExclusiveStartKey());
    assertTrue(iter.getUnprocessedKeys().isEmpty());
  }

  @Test
  public void testEmptyPagesWithContinuationAreFollowed() throws Exception {
    ScriptedDynamoTransport transport = new ScriptedDynamoTransport("id");
    transport.page(new ArrayList<Map<String, Object>>(), ImmutableMap.<String, Object>of("id",
      "a"))
             .page(items("b"), null);
    PagingIterator<Object> iter = new PagingIterator<>(transport, "t", new ReadRequest(),
      PagingIterator.Mode.QUERY, null, ID);
    assertEquals(Arrays.<Object>asList("b"), Lists.newArrayList(iter));
    assertEquals(Arrays.asList("query", "query"), transport.operations);
  }

  @Test
  public void testLimitShrinksWithEachPage() throws Exception {
    ScriptedDynamoTransport transport = new ScriptedDynamoTransport("id");
    transport.page(items("a", "b"), ImmutableMap.<String, Object>of("id", "b"))
             .page(items("c", "d", "e"), ImmutableMap.<String, Object>of("id", "e"))
             .page(items("f"), null);
    PagingIterator<Object> iter = new PagingIterator<>(transport, "t", new ReadRequest(),
      PagingIterator.Mode.QUERY, 4, ID);
    assertEquals(Arrays.<Object>asList("a", "b", "c", "d"), Lists.newArrayList(iter));
    // limit reached inside the second page, so the third is never requested
    assertEquals(2, iter.getRoundTrips());
    assertEquals(Integer.valueOf(4), transport.reads.get(0).getLimit());
    assertEquals(Integer.valueOf(2), transport.reads.get(1).getLimit());
  }

  @Test
  public void testNoResults() throws Exception {
    ScriptedDynamoTransport transport = new ScriptedDynamoTransport("id");
    PagingIterator<Object> iter = new PagingIterator<>(transport, "t", new ReadRequest(),
      PagingIterator.Mode.SCAN, null, ID);
    assertFalse(iter.hasNext());
    assertFalse(iter.hasNext());
    assertEquals(1, transport.operations.size());
  }

  @Test
  public void testPointGetReadsOnce() throws Exception {
    ScriptedDynamoTransport transport = new ScriptedDynamoTransport("id");
    transport.store(ImmutableMap.<String, Object>of("id", "a"));
    PointGetIterator<Object> iter = new PointGetIterator<>(transport, "t",
      ImmutableMap.<String, Object>of("id", "a"), false, ID);
    assertTrue(transport.operations.isEmpty());
    assertTrue(iter.hasNext());
    assertEquals("a", iter.next());
    assertFalse(iter.hasNext());
    assertEquals(1, transport.count("get"));
    assertEquals(Arrays.asList(false), transport.consistentReads);

    PointGetIterator<Object> missing = new PointGetIterator<>(transport, "t",
      ImmutableMap.<String, Object>of("id", "b"), true, ID);
    assertFalse(missing.hasNext());
    assertTrue(missing.getUnprocessedKeys().isEmpty());
  }

  private static List<Map<String, Object>> items(String... ids) {
    List<Map<String, Object>> items = new ArrayList<>();
    for (String id : ids) {
      items.add(ImmutableMap.<String, Object>of("id", id));
    }
    return items;
  }
}
