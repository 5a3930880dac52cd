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
import io.fineo.dynamo.mapper.exception.ValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class RemoveUpdate extends Update {

  public RemoveUpdate(Attribute<?> attribute) {
    super(attribute);
  }

  @Override
  public UpdateClause compile(PlaceholderSequence sequence) {
    if (attribute.isRequired()) {
      throw new ValidationException("Cannot remove required attribute '" + attribute + "'");
    }
    Map<String, String> names = new HashMap<>();
    String path = path(sequence, names);
    return new UpdateClause(UpdateAction.REMOVE, attribute, path, names,
      Collections.<String, Object>emptyMap());
  }
}
