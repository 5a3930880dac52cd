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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.AbstractIterator;
import io.fineo.dynamo.transport.BatchGetPage;
import io.fineo.dynamo.transport.DynamoTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads items by key with batch gets, at most {@value #MAX_BATCH_GET} keys per round trip.
 * <p>
 * Dynamo can decline to process some keys in a round; those are sent again in the next round. A
 * round that returns nothing while keys are still declined is retried once, but only if the
 * previous round returned items (the first round counts as following a successful one). A
 * second empty round in a row stops the iterator and the outstanding keys are reported by
 * {@link #getUnprocessedKeys()}.
 */
public class BatchGetIterator<T> extends AbstractIterator<T> implements ResultIterator<T> {

  private static final Logger LOG = LoggerFactory.getLogger(BatchGetIterator.class);
  // limit imposed by AWS on the number of keys in a single batch get
  @VisibleForTesting
  static final int MAX_BATCH_GET = 100;

  private final DynamoTransport transport;
  private final String table;
  private final boolean consistentRead;
  private final Integer limit;
  private final Function<Map<String, Object>, T> decoder;
  private final LinkedList<Map<String, Object>> remaining;

  private Iterator<Map<String, Object>> round = Collections.emptyIterator();
  private boolean retryAllowed = true;
  private boolean abandoned = false;
  private int produced = 0;
  private int roundTrips = 0;

  public BatchGetIterator(DynamoTransport transport, String table,
    List<Map<String, Object>> keys, boolean consistentRead, Integer limit,
    Function<Map<String, Object>, T> decoder) {
    this.transport = transport;
    this.table = table;
    this.remaining = new LinkedList<>(keys);
    this.consistentRead = consistentRead;
    this.limit = limit;
    this.decoder = decoder;
  }

  @Override
  protected T computeNext() {
    while (true) {
      if (limit != null && produced >= limit) {
        return endOfData();
      }
      if (round.hasNext()) {
        produced++;
        return decoder.apply(round.next());
      }
      if (abandoned || remaining.isEmpty()) {
        return endOfData();
      }
      fetch();
    }
  }

  private void fetch() {
    List<Map<String, Object>> keys = new ArrayList<>();
    while (keys.size() < MAX_BATCH_GET && !remaining.isEmpty()) {
      keys.add(remaining.removeFirst());
    }
    roundTrips++;
    BatchGetPage page = transport.batchGet(table, keys, consistentRead);

    // declined keys go ahead of the ones we have not asked for yet
    List<Map<String, Object>> unprocessed = page.getUnprocessedKeys();
    for (int i = unprocessed.size() - 1; i >= 0; i--) {
      remaining.addFirst(unprocessed.get(i));
    }

    if (!page.getItems().isEmpty()) {
      retryAllowed = true;
      round = page.getItems().iterator();
      return;
    }
    // nothing declined, so none of the requested keys exist
    if (unprocessed.isEmpty()) {
      return;
    }
    if (retryAllowed) {
      retryAllowed = false;
      LOG.debug("Batch get on {} returned no items, retrying {} unprocessed keys", table,
        unprocessed.size());
      return;
    }
    abandoned = true;
    LOG.warn("Giving up on {} unprocessed keys from {} after {} round trips", remaining.size(),
      table, roundTrips);
  }

  @Override
  public List<Map<String, Object>> getUnprocessedKeys() {
    if (!abandoned) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(remaining));
  }

  @VisibleForTesting
  int getRoundTrips() {
    return roundTrips;
  }
}
