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

package io.fineo.dynamo.mapper.dispatch;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Caller options for a multi-item read
 */
public class ReadOptions {

  private Integer limit;
  private boolean descending = false;
  private Boolean consistentRead;

  public static ReadOptions defaults() {
    return new ReadOptions();
  }

  /**
   * Stop after this many items have been read
   */
  public ReadOptions withLimit(int limit) {
    checkArgument(limit > 0, "Limit must be positive, got %s", limit);
    this.limit = limit;
    return this;
  }

  /**
   * Return query results in descending range key order
   */
  public ReadOptions withDescending(boolean descending) {
    this.descending = descending;
    return this;
  }

  public ReadOptions withConsistentRead(boolean consistentRead) {
    this.consistentRead = consistentRead;
    return this;
  }

  /**
   * @return a copy with consistent reads set to the default, if the caller did not pick
   */
  public ReadOptions withDefaultConsistentRead(boolean consistentRead) {
    ReadOptions copy = new ReadOptions();
    copy.limit = limit;
    copy.descending = descending;
    copy.consistentRead = this.consistentRead == null ? consistentRead : this.consistentRead;
    return copy;
  }

  public Integer getLimit() {
    return limit;
  }

  public boolean isDescending() {
    return descending;
  }

  /**
   * @return if reads should be consistent. Reads are consistent unless turned off.
   */
  public boolean isConsistentRead() {
    return consistentRead == null || consistentRead;
  }

  @Override
  public String toString() {
    return "ReadOptions{" +
           "limit=" + limit +
           ", descending=" + descending +
           ", consistentRead=" + consistentRead +
           '}';
  }
}
