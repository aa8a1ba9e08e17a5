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
package exm.dpc.common.lang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import exm.dpc.common.exceptions.InternalInvariantError;

/**
 * Instruction operand: either a variable or an integer constant
 */
public class Arg {
  public static enum ArgKind {
    INTVAL,
    VAR,
  }

  public final ArgKind kind;
  private final long intlit;
  private final Var var;

  private Arg(ArgKind kind, long intlit, Var var) {
    this.kind = kind;
    this.intlit = intlit;
    this.var = var;
  }

  public static Arg newInt(long v) {
    return new Arg(ArgKind.INTVAL, v, null);
  }

  public static Arg newVar(Var var) {
    assert(var != null);
    return new Arg(ArgKind.VAR, 0, var);
  }

  public boolean isVar() {
    return kind == ArgKind.VAR;
  }

  public boolean isInt() {
    return kind == ArgKind.INTVAL;
  }

  public Var getVar() {
    if (kind != ArgKind.VAR) {
      throw new InternalInvariantError("Not a variable: " + this);
    }
    return var;
  }

  public long getInt() {
    if (kind != ArgKind.INTVAL) {
      throw new InternalInvariantError("Not an integer: " + this);
    }
    return intlit;
  }

  /**
   * @return variables among args, in order
   */
  public static List<Var> varsOf(Collection<Arg> args) {
    List<Var> result = new ArrayList<Var>();
    for (Arg a: args) {
      if (a.isVar()) {
        result.add(a.var);
      }
    }
    return result;
  }

  @Override
  public int hashCode() {
    return isVar() ? var.hashCode() : Long.hashCode(intlit);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Arg))
      return false;
    Arg other = (Arg)obj;
    if (kind != other.kind)
      return false;
    return isVar() ? var.equals(other.var) : intlit == other.intlit;
  }

  @Override
  public String toString() {
    return isVar() ? var.name() : Long.toString(intlit);
  }
}
