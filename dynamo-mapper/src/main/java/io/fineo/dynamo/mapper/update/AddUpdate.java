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
import io.fineo.dynamo.mapper.attribute.PrimitiveKind;
import io.fineo.dynamo.mapper.exception.ExpressionException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Atomically add a (possibly negative) number to a top-level numeric attribute. Adding nothing,
 * or zero, is skipped.
 */
public class AddUpdate extends Update {

  private final Number delta;

  public AddUpdate(Attribute<?> attribute, Number delta) {
    super(attribute);
    if (attribute.getKind() != PrimitiveKind.NUMBER) {
      throw new ExpressionException("ADD needs a numeric attribute", attribute + " ADD " + delta);
    }
    if (attribute.isNested()) {
      throw new ExpressionException("ADD can only be used on top-level attributes",
        attribute + " ADD " + delta);
    }
    this.delta = delta;
  }

  public Number getDelta() {
    return delta;
  }

  @Override
  public UpdateClause compile(PlaceholderSequence sequence) {
    if (Attribute.isEmpty(delta)) {
      return null;
    }
    BigDecimal encoded = (BigDecimal) attribute.encode(delta);
    if (encoded.signum() == 0) {
      return null;
    }

    Map<String, String> names = new HashMap<>();
    Map<String, Object> values = new HashMap<>();
    String path = path(sequence, names);
    String placeholder = sequence.nextValue();
    values.put(placeholder, encoded);
    return new UpdateClause(UpdateAction.ADD, attribute, path + " " + placeholder, names, values);
  }
}
