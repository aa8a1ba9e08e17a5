/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dpc.ic.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.Pattern;

/**
 * A table entry: when the key matches the pattern, run the action with
 * its parameters bound to the given arguments.
 */
public class Rule {
  private final Pattern pattern;
  private final int actionId;
  private final Map<Var, Arg> bindings;

  public Rule(Pattern pattern, int actionId) {
    this(pattern, actionId, Collections.<Var, Arg>emptyMap());
  }

  public Rule(Pattern pattern, int actionId, Map<Var, Arg> bindings) {
    this.pattern = pattern;
    this.actionId = actionId;
    this.bindings = Collections.unmodifiableMap(
                                  new LinkedHashMap<Var, Arg>(bindings));
  }

  public Pattern pattern() {
    return pattern;
  }

  public int actionId() {
    return actionId;
  }

  /**
   * @return map from formal parameter of action to argument
   */
  public Map<Var, Arg> bindings() {
    return bindings;
  }

  @Override
  public int hashCode() {
    return (pattern.hashCode() * 31 + actionId) * 31 + bindings.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Rule))
      return false;
    Rule other = (Rule)obj;
    return pattern.equals(other.pattern) && actionId == other.actionId &&
           bindings.equals(other.bindings);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(pattern + " -> " + actionId);
    if (!bindings.isEmpty()) {
      sb.append(" [");
      boolean first = true;
      for (Map.Entry<Var, Arg> e: bindings.entrySet()) {
        if (!first) sb.append(", ");
        sb.append(e.getKey().name() + "=" + e.getValue());
        first = false;
      }
      sb.append("]");
    }
    return sb.toString();
  }
}
