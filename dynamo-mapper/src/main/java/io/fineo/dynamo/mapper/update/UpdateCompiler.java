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

import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compile a list of updates into a single dynamo update expression. Clauses are grouped by action
 * and the groups always come out as <tt>SET ... ADD ... REMOVE ...</tt>.
 * <p>
 * When more than one update targets the same attribute, the last one wins and the earlier
 * clauses are dropped.
 */
public class UpdateCompiler {

  private static final Logger LOG = LoggerFactory.getLogger(UpdateCompiler.class);
  private static final Joiner COMMAS = Joiner.on(", ");
  private static final Joiner SPACES = Joiner.on(' ');

  private final PlaceholderSequence sequence;

  public UpdateCompiler() {
    this(PlaceholderSequence.global());
  }

  public UpdateCompiler(PlaceholderSequence sequence) {
    this.sequence = checkNotNull(sequence, "sequence");
  }

  public CompiledUpdate compile(List<? extends Update> updates) {
    Map<String, UpdateClause> byTarget = new LinkedHashMap<>();
    for (Update update : updates) {
      checkNotNull(update, "Cannot compile a null update");
      UpdateClause clause = update.compile(sequence);
      if (clause == null) {
        LOG.trace("Skipping no-op update on {}", update.getAttribute());
        continue;
      }
      String target = update.getAttribute().getName();
      UpdateClause previous = byTarget.remove(target);
      if (previous != null) {
        LOG.warn("Multiple updates to '{}', replacing [{}] with [{}]", target, previous, clause);
      }
      byTarget.put(target, clause);
    }

    Map<UpdateAction, List<String>> groups = new EnumMap<>(UpdateAction.class);
    Map<String, String> names = new LinkedHashMap<>();
    Map<String, Object> values = new LinkedHashMap<>();
    for (UpdateClause clause : byTarget.values()) {
      List<String> group = groups.get(clause.getAction());
      if (group == null) {
        group = new ArrayList<>();
        groups.put(clause.getAction(), group);
      }
      group.add(clause.getExpression());
      names.putAll(clause.getNames());
      values.putAll(clause.getValues());
    }

    // EnumMap iterates in declaration order, which is the order dynamo needs
    List<String> parts = new ArrayList<>();
    for (Map.Entry<UpdateAction, List<String>> group : groups.entrySet()) {
      parts.add(group.getKey().name() + " " + COMMAS.join(group.getValue()));
    }
    String expression = SPACES.join(parts);
    LOG.debug("Compiled {} updates to: {}", updates.size(), expression);
    return new CompiledUpdate(expression, names, values);
  }
}
