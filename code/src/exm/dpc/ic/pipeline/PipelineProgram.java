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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Var;

/**
 * The scheduled program: tables with their stages and rules, and the
 * actions they invoke.  This is what the code generator consumes.
 */
public class PipelineProgram {
  private final String handlerName;
  private final int numStages;
  private final List<Var> registers;
  private final List<Table> tables = new ArrayList<Table>();
  private final Map<Integer, Action> actions = new TreeMap<Integer, Action>();

  public PipelineProgram(String handlerName, int numStages,
                         List<Var> registers) {
    this.handlerName = handlerName;
    this.numStages = numStages;
    this.registers = Collections.unmodifiableList(
                                    new ArrayList<Var>(registers));
    actions.put(Action.NOOP_ID, Action.NOOP);
  }

  public String handlerName() {
    return handlerName;
  }

  /**
   * @return stages available in the target
   */
  public int numStages() {
    return numStages;
  }

  public List<Var> registers() {
    return registers;
  }

  public void addTable(Table table) {
    tables.add(table);
  }

  /**
   * @return tables ordered by stage
   */
  public List<Table> tables() {
    return Collections.unmodifiableList(tables);
  }

  public Table lookupTable(String name) {
    for (Table t: tables) {
      if (t.name().equals(name)) {
        return t;
      }
    }
    return null;
  }

  public void putAction(Action action) {
    actions.put(action.id(), action);
  }

  public void removeAction(int id) {
    if (id == Action.NOOP_ID) {
      throw new InternalInvariantError("Cannot remove no-op action");
    }
    actions.remove(id);
  }

  public Action action(int id) {
    Action a = actions.get(id);
    if (a == null) {
      throw new InternalInvariantError("No action with id " + id);
    }
    return a;
  }

  /**
   * @return actions ordered by id, including the no-op
   */
  public Collection<Action> actions() {
    return Collections.unmodifiableCollection(actions.values());
  }

  public int stagesUsed() {
    int used = 0;
    for (Table t: tables) {
      used = Math.max(used, t.stage() + 1);
    }
    return used;
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append("pipeline " + handlerName + " stages " + stagesUsed() + "/"
              + numStages + "\n");
    for (Var reg: registers) {
      sb.append("register " + reg.name() + " " + reg.width() + " "
                + reg.initVal() + "\n");
    }
    for (Action a: actions.values()) {
      if (!a.isNoop()) {
        a.prettyPrint(sb);
      }
    }
    for (Table t: tables) {
      t.prettyPrint(sb);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
