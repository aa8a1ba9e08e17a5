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
package exm.dpc.ic.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Match pattern over a list of keys: each element is an exact integer
 * value or a wildcard.  Immutable.
 */
public class Pattern {
  public static final String WILDCARD = "_";

  /** null elements are wildcards */
  private final List<Long> elems;

  public Pattern(List<Long> elems) {
    this.elems = Collections.unmodifiableList(new ArrayList<Long>(elems));
  }

  public static Pattern wildcard(int size) {
    List<Long> elems = new ArrayList<Long>(size);
    for (int i = 0; i < size; i++) {
      elems.add(null);
    }
    return new Pattern(elems);
  }

  public static Pattern exact(long ...vals) {
    List<Long> elems = new ArrayList<Long>(vals.length);
    for (long v: vals) {
      elems.add(v);
    }
    return new Pattern(elems);
  }

  public static Pattern concat(List<Pattern> parts) {
    List<Long> elems = new ArrayList<Long>();
    for (Pattern p: parts) {
      elems.addAll(p.elems);
    }
    return new Pattern(elems);
  }

  public int size() {
    return elems.size();
  }

  /**
   * @return true if matches any key values
   */
  public boolean matchesAll() {
    for (Long e: elems) {
      if (e != null) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return elems.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Pattern))
      return false;
    return elems.equals(((Pattern)obj).elems);
  }

  @Override
  public String toString() {
    if (elems.isEmpty()) {
      return "*";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < elems.size(); i++) {
      if (i > 0) sb.append(" ");
      sb.append(elems.get(i) == null ? WILDCARD : elems.get(i).toString());
    }
    return sb.toString();
  }
}
