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

import com.google.common.collect.AbstractIterator;
import io.fineo.dynamo.transport.DynamoTransport;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads a single item by its key, on the first call to {@link #hasNext()}
 */
public class PointGetIterator<T> extends AbstractIterator<T> implements ResultIterator<T> {

  private final DynamoTransport transport;
  private final String table;
  private final Map<String, Object> key;
  private final boolean consistentRead;
  private final Function<Map<String, Object>, T> decoder;
  private boolean ran = false;

  public PointGetIterator(DynamoTransport transport, String table, Map<String, Object> key,
    boolean consistentRead, Function<Map<String, Object>, T> decoder) {
    this.transport = transport;
    this.table = table;
    this.key = key;
    this.consistentRead = consistentRead;
    this.decoder = decoder;
  }

  @Override
  protected T computeNext() {
    if (ran) {
      return endOfData();
    }
    ran = true;
    Map<String, Object> item = transport.get(table, key, consistentRead);
    if (item == null) {
      return endOfData();
    }
    return decoder.apply(item);
  }

  @Override
  public List<Map<String, Object>> getUnprocessedKeys() {
    return Collections.emptyList();
  }
}
