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
package exm.dpc.ic.graph;

import exm.dpc.common.lang.Var;

/**
 * Directed dependency between two statement ids
 */
public class DepEdge {
  public final int src;
  public final int dst;
  public final EdgeKind kind;
  /** Variable causing a data edge, null for control edges */
  public final Var var;

  public DepEdge(int src, int dst, EdgeKind kind, Var var) {
    assert(kind.isData() == (var != null)) : kind + " " + var;
    this.src = src;
    this.dst = dst;
    this.kind = kind;
    this.var = var;
  }

  public static DepEdge control(int src, int dst, boolean call) {
    return new DepEdge(src, dst, call ? EdgeKind.CONTROL_CALL
                                      : EdgeKind.CONTROL, null);
  }

  public static DepEdge data(int src, int dst, EdgeKind kind, Var var) {
    return new DepEdge(src, dst, kind, var);
  }

  public boolean isStrict() {
    return kind.isStrict();
  }

  public String label() {
    if (var == null) {
      return kind.shortName();
    }
    return kind.shortName() + " " + var.name();
  }

  @Override
  public int hashCode() {
    int result = 31 * src + dst;
    result = 31 * result + kind.hashCode();
    return 31 * result + (var == null ? 0 : var.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof DepEdge))
      return false;
    DepEdge other = (DepEdge) obj;
    return src == other.src && dst == other.dst && kind == other.kind &&
        (var == null ? other.var == null : var.equals(other.var));
  }

  @Override
  public String toString() {
    return src + " -> " + dst + " (" + label() + ")";
  }
}
