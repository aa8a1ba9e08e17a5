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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.dpc.common.lang.Arg;
import exm.dpc.ic.tree.Pattern;

/**
 * Condition under which a table call is applied: an ordered list of
 * patterns over the keys of the enclosing branches, each either applying
 * the table or skipping it.  The first matching entry decides; if none
 * matches, the table is skipped.
 */
public class Guard {
  private final List<Arg> keys;
  private final List<Pattern> patterns = new ArrayList<Pattern>();
  private final List<Boolean> applies = new ArrayList<Boolean>();

  public Guard(List<Arg> keys) {
    this.keys = Collections.unmodifiableList(new ArrayList<Arg>(keys));
  }

  public static Guard always() {
    Guard g = new Guard(Collections.<Arg>emptyList());
    g.addEntry(Pattern.wildcard(0), true);
    return g;
  }

  public void addEntry(Pattern pattern, boolean apply) {
    assert(pattern.size() == keys.size()) : pattern + " " + keys;
    patterns.add(pattern);
    applies.add(apply);
  }

  public List<Arg> keys() {
    return keys;
  }

  public int size() {
    return patterns.size();
  }

  public Pattern pattern(int i) {
    return patterns.get(i);
  }

  public boolean applies(int i) {
    return applies.get(i);
  }

  public boolean isAlways() {
    return keys.isEmpty();
  }

  @Override
  public String toString() {
    if (isAlways()) {
      return "always";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < keys.size(); i++) {
      if (i > 0) sb.append(" ");
      sb.append(keys.get(i));
    }
    sb.append(":");
    for (int i = 0; i < patterns.size(); i++) {
      sb.append(i == 0 ? " " : ", ");
      sb.append(patterns.get(i) + (applies.get(i) ? " -> apply" : " -> skip"));
    }
    return sb.toString();
  }
}
