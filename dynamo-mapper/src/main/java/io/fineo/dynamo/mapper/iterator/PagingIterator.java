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
import io.fineo.dynamo.transport.DynamoTransport;
import io.fineo.dynamo.transport.ItemPage;
import io.fineo.dynamo.transport.ReadRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Pages through a query or scan, following the continuation key until dynamo reports no more
 * pages. Once the limit is reached no further pages are requested, even if the current page
 * had more items.
 */
public class PagingIterator<T> extends AbstractIterator<T> implements ResultIterator<T> {

  private static final Logger LOG = LoggerFactory.getLogger(PagingIterator.class);

  public enum Mode {
    QUERY, SCAN
  }

  private final DynamoTransport transport;
  private final String table;
  private final ReadRequest request;
  private final Mode mode;
  private final Integer limit;
  private final Function<Map<String, Object>, T> decoder;

  private Iterator<Map<String, Object>> page = Collections.emptyIterator();
  private Map<String, Object> cursor;
  private boolean finished = false;
  private int produced = 0;
  private int roundTrips = 0;

  public PagingIterator(DynamoTransport transport, String table, ReadRequest request, Mode mode,
    Integer limit, Function<Map<String, Object>, T> decoder) {
    this.transport = transport;
    this.table = table;
    this.request = request;
    this.mode = mode;
    this.limit = limit;
    this.decoder = decoder;
    this.cursor = request.getExclusiveStartKey();
  }

  @Override
  protected T computeNext() {
    while (true) {
      if (limit != null && produced >= limit) {
        return endOfData();
      }
      if (page.hasNext()) {
        produced++;
        return decoder.apply(page.next());
      }
      if (finished) {
        return endOfData();
      }
      fetch();
    }
  }

  private void fetch() {
    ReadRequest next = request.copy().withExclusiveStartKey(cursor);
    if (limit != null) {
      next.withLimit(limit - produced);
    }
    if (roundTrips > 0) {
      LOG.debug("Continuing {} on {} from {}", mode, table, cursor);
    }
    roundTrips++;
    ItemPage result = mode == Mode.QUERY ? transport.query(table, next) :
                      transport.scan(table, next);
    page = result.getItems().iterator();
    cursor = result.getLastEvaluatedKey();
    finished = !result.hasNextPage();
  }

  @Override
  public List<Map<String, Object>> getUnprocessedKeys() {
    return Collections.emptyList();
  }

  @VisibleForTesting
  int getRoundTrips() {
    return roundTrips;
  }
}
