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

import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.ICInstructions.Instruction;

/**
 * Straight-line sequence of primitive instructions run when a table rule
 * matches.  Formal parameters are substituted by the bindings of the
 * rule that invokes the action.
 */
public class Action {
  public static final int NOOP_ID = 0;
  public static final Action NOOP = new Action(NOOP_ID, -1, Var.NONE,
                                      Collections.<Instruction>emptyList());

  private final int id;
  private final int stage;
  private final List<Var> params;
  private final List<Instruction> body;

  public Action(int id, int stage, List<Var> params, List<Instruction> body) {
    this.id = id;
    this.stage = stage;
    this.params = Collections.unmodifiableList(new ArrayList<Var>(params));
    this.body = Collections.unmodifiableList(
                                  new ArrayList<Instruction>(body));
  }

  public int id() {
    return id;
  }

  public int stage() {
    return stage;
  }

  public List<Var> params() {
    return params;
  }

  public List<Instruction> body() {
    return body;
  }

  public boolean isNoop() {
    return id == NOOP_ID;
  }

  /**
   * @return true if contains an operation on a scarce hardware unit
   */
  public boolean usesScarce() {
    for (Instruction inst: body) {
      if (inst.op.isScarce()) {
        return true;
      }
    }
    return false;
  }

  public int aluSlots() {
    int count = 0;
    for (Instruction inst: body) {
      if (inst.op.isRegisterOp()) {
        count++;
      }
    }
    return count;
  }

  public int hashUnits() {
    int count = 0;
    for (Instruction inst: body) {
      if (inst.op.isHashOp()) {
        count++;
      }
    }
    return count;
  }

  public Action withParams(List<Var> newParams) {
    return new Action(id, stage, newParams, body);
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append("action " + id + " stage " + stage + " (");
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(params.get(i).name());
    }
    sb.append(") {\n");
    for (Instruction inst: body) {
      sb.append("  " + inst + "\n");
    }
    sb.append("}\n");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
