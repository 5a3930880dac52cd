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

import io.fineo.dynamo.mapper.attribute.Attribute;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A change to a single attribute of an item. Updates are created from the attributes
 * themselves, e.g. <tt>name.set("bob")</tt>, and turned into an expression by the
 * {@link UpdateCompiler}.
 */
public abstract class Update {

  protected final Attribute<?> attribute;

  protected Update(Attribute<?> attribute) {
    this.attribute = checkNotNull(attribute, "attribute");
  }

  public Attribute<?> getAttribute() {
    return attribute;
  }

  /**
   * @return the rendered clause, or <tt>null</tt> if the update has nothing to do
   */
  public abstract UpdateClause compile(PlaceholderSequence sequence);

  /**
   * Map each segment of the attribute's path to a new name placeholder
   */
  protected String path(PlaceholderSequence sequence, Map<String, String> names) {
    StringBuilder sb = new StringBuilder();
    for (String segment : attribute.getPath()) {
      if (sb.length() > 0) {
        sb.append('.');
      }
      String placeholder = sequence.nextName();
      names.put(placeholder, segment);
      sb.append(placeholder);
    }
    return sb.toString();
  }
}
