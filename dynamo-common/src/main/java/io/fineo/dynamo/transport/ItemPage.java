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

package io.fineo.dynamo.transport;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of a query or scan
 */
public class ItemPage {

  private final List<Map<String, Object>> items;
  private final Map<String, Object> lastEvaluatedKey;

  public ItemPage(List<Map<String, Object>> items, Map<String, Object> lastEvaluatedKey) {
    this.items = items == null ? Collections.emptyList() : items;
    this.lastEvaluatedKey =
      lastEvaluatedKey == null || lastEvaluatedKey.isEmpty() ? null : lastEvaluatedKey;
  }

  public List<Map<String, Object>> getItems() {
    return items;
  }

  /**
   * @return the continuation cursor, or <tt>null</tt> if this was the last page
   */
  public Map<String, Object> getLastEvaluatedKey() {
    return lastEvaluatedKey;
  }

  public boolean hasNextPage() {
    return lastEvaluatedKey != null;
  }

  @Override
  public String toString() {
    return "ItemPage{" +
           "items=" + items.size() +
           ", lastEvaluatedKey=" + lastEvaluatedKey +
           '}';
  }
}
