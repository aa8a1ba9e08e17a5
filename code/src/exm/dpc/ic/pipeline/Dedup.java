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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.ICInstructions.Instruction;

/**
 * Merge actions in the same stage that are identical up to renaming of
 * local variables.  The action with the lowest id is kept, with its
 * locals as formal parameters, and every rule that invoked a merged
 * action invokes the kept one with its own variables bound to the
 * parameters.
 *
 * By default only actions using scarce units (hash units, register ALUs)
 * are candidates.  Running the pass on its own output changes nothing.
 */
public class Dedup {

  private Dedup() {
    // static methods only
  }

  /**
   * @return number of actions removed
   */
  public static int dedup(Logger logger, CompileOptions opts,
                          PipelineProgram program) {
    boolean all = opts.getBoolean(Settings.OPT_DEDUP_ALL);

    // Candidate actions grouped by stage and shape, in id order
    Map<String, List<Action>> classes = new LinkedHashMap<String, List<Action>>();
    for (Action a: program.actions()) {
      if (a.isNoop() || !(all || a.usesScarce())) {
        continue;
      }
      String key = a.stage() + "|" + signature(a);
      List<Action> members = classes.get(key);
      if (members == null) {
        members = new ArrayList<Action>();
        classes.put(key, members);
      }
      members.add(a);
    }

    int removed = 0;
    for (List<Action> members: classes.values()) {
      if (members.size() > 1) {
        merge(logger, program, members);
        removed += members.size() - 1;
      }
    }
    logger.debug("Dedup removed " + removed + " actions");
    return removed;
  }

  private static void merge(Logger logger, PipelineProgram program,
                            List<Action> members) {
    Action kept = members.get(0);
    List<Var> params = locals(kept);
    program.putAction(kept.withParams(params));

    for (Action a: members) {
      List<Var> actuals = locals(a);
      if (actuals.size() != params.size()) {
        throw new InternalInvariantError("Actions " + kept.id() + " and "
            + a.id() + " have same shape but different locals");
      }
      rebindRules(program, a.id(), kept.id(), params, actuals);
      if (a != kept) {
        program.removeAction(a.id());
        if (logger.isTraceEnabled()) {
          logger.trace("Merged action " + a.id() + " into " + kept.id());
        }
      }
    }
  }

  /**
   * Point all rules invoking action from at action to, binding params to
   * the corresponding variables of the old action.
   */
  private static void rebindRules(PipelineProgram program, int from, int to,
                                  List<Var> params, List<Var> actuals) {
    for (Table t: program.tables()) {
      List<Rule> rules = t.rules();
      for (int i = 0; i < rules.size(); i++) {
        Rule r = rules.get(i);
        if (r.actionId() != from) {
          continue;
        }
        Map<Var, Arg> bindings = new LinkedHashMap<Var, Arg>();
        for (int p = 0; p < params.size(); p++) {
          Var actual = actuals.get(p);
          Arg prev = r.bindings().get(actual);
          bindings.put(params.get(p), prev != null ? prev
                                                   : Arg.newVar(actual));
        }
        t.setRule(i, new Rule(r.pattern(), to, bindings));
      }
    }
  }

  /**
   * @return non-register variables of action in order of first use
   */
  static List<Var> locals(Action a) {
    List<Var> locals = new ArrayList<Var>();
    for (Instruction inst: a.body()) {
      for (Var v: inst.getOutputs()) {
        addLocal(locals, v);
      }
      for (Arg in: inst.getInputs()) {
        if (in.isVar()) {
          addLocal(locals, in.getVar());
        }
      }
    }
    return locals;
  }

  private static void addLocal(List<Var> locals, Var v) {
    if (!v.isRegister() && !locals.contains(v)) {
      locals.add(v);
    }
  }

  /**
   * Canonical form of action body with locals numbered by first use.
   * Equal signatures mean equal actions up to renaming of locals.
   */
  static String signature(Action a) {
    List<Var> locals = locals(a);
    StringBuilder sb = new StringBuilder();
    for (Instruction inst: a.body()) {
      sb.append(inst.op.mnemonic());
      if (inst.getTable() != null) {
        sb.append(" " + inst.getTable());
      }
      for (Var out: inst.getOutputs()) {
        sb.append(" " + canonical(locals, out));
      }
      sb.append(" <-");
      for (Arg in: inst.getInputs()) {
        sb.append(" " + (in.isVar() ? canonical(locals, in.getVar())
                                    : "#" + in.getInt()));
      }
      sb.append(";");
    }
    return sb.toString();
  }

  private static String canonical(List<Var> locals, Var v) {
    if (v.isRegister()) {
      return "@" + v.name();
    }
    return "$" + locals.indexOf(v) + ":" + v.width();
  }
}
