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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a bulk write: the items that were written and the ones whose guard condition failed
 */
public class BatchResult<T> {

  private final List<T> succeeded = new ArrayList<>();
  private final List<T> failed = new ArrayList<>();

  void succeeded(T item) {
    succeeded.add(item);
  }

  void failed(T item) {
    failed.add(item);
  }

  public List<T> getSucceeded() {
    return Collections.unmodifiableList(succeeded);
  }

  public List<T> getFailed() {
    return Collections.unmodifiableList(failed);
  }

  public boolean hasFailures() {
    return !failed.isEmpty();
  }

  @Override
  public String toString() {
    return "BatchResult{" +
           "succeeded=" + succeeded.size() +
           ", failed=" + failed.size() +
           '}';
  }
}
