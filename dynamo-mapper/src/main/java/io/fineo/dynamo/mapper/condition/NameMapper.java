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

package io.fineo.dynamo.mapper.condition;

import com.google.common.base.Joiner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces attribute names and values in an expression with placeholders, so reserved words and
 * arbitrary values can be used safely. Names and values seen before reuse their placeholder.
 * <p>
 * One mapper should be used for all the expressions of a single request.
 */
public class NameMapper {

  private static final Joiner DOT = Joiner.on('.');

  private int counter = 0;
  private final Map<String, String> nameMap = new LinkedHashMap<>();
  private final Map<String, Object> valueMap = new LinkedHashMap<>();

  public String name(String name) {
    return add("#n", name, nameMap);
  }

  /**
   * Map a document path. Each segment gets its own placeholder, so <tt>a.b</tt> becomes
   * <tt>#n0.#n1</tt>.
   */
  public String name(List<String> path) {
    String[] parts = new String[path.size()];
    for (int i = 0; i < parts.length; i++) {
      parts[i] = name(path.get(i));
    }
    return DOT.join(parts);
  }

  public String value(Object value) {
    return add(":v", value, valueMap);
  }

  public Map<String, String> getNameMap() {
    return Collections.unmodifiableMap(nameMap);
  }

  public Map<String, Object> getValueMap() {
    return Collections.unmodifiableMap(valueMap);
  }

  private <IN> String add(String prefix, IN in, Map<String, IN> map) {
    // look for the value in the map. Assumes that we have few names/values to remap and this
    // search is trivial
    for (Map.Entry<String, IN> ob : map.entrySet()) {
      if (Objects.equals(ob.getValue(), in)) {
        return ob.getKey();
      }
    }
    String out = prefix + (counter++);
    map.put(out, in);
    return out;
  }
}
