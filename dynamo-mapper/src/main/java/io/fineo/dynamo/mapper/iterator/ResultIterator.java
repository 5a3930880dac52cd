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

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Lazy, single-use iterator over the results of a read. Round trips to dynamo happen as the
 * iterator is consumed.
 */
public interface ResultIterator<T> extends Iterator<T> {

  /**
   * @return keys that dynamo never returned before the iterator gave up on them. Always empty
   * for reads that are not batch gets.
   */
  List<Map<String, Object>> getUnprocessedKeys();
}
