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

package io.fineo.dynamo.mapper.update;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of placeholder names for update expressions. Names are never handed out twice by the
 * same sequence, so value tables from separate compilations can be merged safely. Thread-safe.
 */
public class PlaceholderSequence {

  private static final PlaceholderSequence GLOBAL = new PlaceholderSequence();

  private final AtomicLong counter;

  public PlaceholderSequence() {
    this(0);
  }

  public PlaceholderSequence(long start) {
    this.counter = new AtomicLong(start);
  }

  /**
   * @return the sequence shared by the whole process
   */
  public static PlaceholderSequence global() {
    return GLOBAL;
  }

  public String nextValue() {
    return ":val" + counter.getAndIncrement();
  }

  public String nextName() {
    return "#att" + counter.getAndIncrement();
  }
}
