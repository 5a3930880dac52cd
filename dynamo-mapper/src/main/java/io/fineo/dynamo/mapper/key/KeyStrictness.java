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

package io.fineo.dynamo.mapper.key;

/**
 * Which key attributes must be compared with equality when classifying a condition
 */
public enum KeyStrictness {
  NONE(false, false),
  HASH_ONLY(true, false),
  RANGE_ONLY(false, true),
  BOTH(true, true);

  private final boolean hash;
  private final boolean range;

  KeyStrictness(boolean hash, boolean range) {
    this.hash = hash;
    this.range = range;
  }

  public boolean requiresEquality(boolean hashKey) {
    return hashKey ? hash : range;
  }
}
