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
 * Result of a single batch get round trip
 */
public class BatchGetPage {

  private final List<Map<String, Object>> items;
  private final List<Map<String, Object>> unprocessedKeys;

  public BatchGetPage(List<Map<String, Object>> items,
    List<Map<String, Object>> unprocessedKeys) {
    this.items = items == null ? Collections.emptyList() : items;
    this.unprocessedKeys = unprocessedKeys == null ? Collections.emptyList() : unprocessedKeys;
  }

  public List<Map<String, Object>> getItems() {
    return items;
  }

  public List<Map<String, Object>> getUnprocessedKeys() {
    return unprocessedKeys;
  }

  @Override
  public String toString() {
    return "BatchGetPage{" +
           "items=" + items.size() +
           ", unprocessedKeys=" + unprocessedKeys +
           '}';
  }
}
