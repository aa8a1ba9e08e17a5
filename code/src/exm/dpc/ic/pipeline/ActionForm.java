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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.exceptions.UnsupportedConstructException;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.graph.ControlDependence;
import exm.dpc.ic.graph.ControlDependence.Decision;
import exm.dpc.ic.layout.Layout;
import exm.dpc.ic.layout.LayoutNode;
import exm.dpc.ic.layout.LayoutProblem;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;
import exm.dpc.ic.tree.ICTree.TableDecl;
import exm.dpc.ic.tree.Opcode;
import exm.dpc.ic.tree.Pattern;

/**
 * Turns the laid out statement tree into tables and actions.
 *
 * The instructions directly inside the arms of one branch that were put
 * in the same stage become one table keyed on the keys of that branch
 * and of all branches enclosing it.  Each arm's instructions form one
 * action.  The rules reproduce first-match semantics of every enclosing
 * match: for each enclosing branch, packets that take an earlier arm
 * than the one on the path hit a no-op rule first.  Top level
 * instructions in a stage form a keyless table with one action.
 *
 * Actions cannot apply tables, so every table_match becomes a separate
 * call table, applied under a guard on the enclosing branch keys.
 */
public class ActionForm {
  private final Program program;
  private final ControlDependence cdg;
  private final LayoutProblem problem;
  private final Layout layout;
  private final PipelineProgram result;

  private int nextActionId = Action.NOOP_ID + 1;

  private ActionForm(Program program, ControlDependence cdg,
                     LayoutProblem problem, Layout layout) {
    this.program = program;
    this.cdg = cdg;
    this.problem = problem;
    this.layout = layout;
    List<Var> registers = new ArrayList<Var>();
    for (Var v: program.getVars()) {
      if (v.isRegister()) {
        registers.add(v);
      }
    }
    this.result = new PipelineProgram(program.getHandlerName(),
                                      problem.model().stages, registers);
  }

  /**
   * Statements of one table before it is built
   */
  private static class PendingTable {
    final int stage;
    final int firstStmt;
    final String group;
    /** Branch whose arms the table implements, -1 for top level */
    final int branch;
    /** Instructions of each arm, by arm index */
    final TreeMap<Integer, List<Instruction>> arms =
                                new TreeMap<Integer, List<Instruction>>();
    final List<Integer> stmts = new ArrayList<Integer>();
    /** Set for call tables */
    final Instruction call;

    PendingTable(int stage, int firstStmt, String group, int branch,
                 Instruction call) {
      this.stage = stage;
      this.firstStmt = firstStmt;
      this.group = group;
      this.branch = branch;
      this.call = call;
    }
  }

  /**
   * Reject statements that cannot be expressed with tables and actions.
   * Run before layout so that errors are reported early.
   */
  public static void checkLegal(Logger logger, CompileOptions opts,
        Program program, ControlDependence cdg)
              throws UnsupportedConstructException {
    int maxCallDepth = opts.getInt(Settings.LAYOUT_MAX_CALL_DEPTH);
    for (Statement stmt: program.statements()) {
      if (stmt.type() == StatementType.CONDITIONAL) {
        for (Var key: Arg.varsOf(stmt.conditional().getKeys())) {
          if (key.isRegister()) {
            throw new UnsupportedConstructException(stmt.pos(), "register "
                + key.name() + " used as match key in " + stmt.label());
          }
        }
        continue;
      }

      Instruction inst = stmt.instruction();
      List<Var> plainOperands = new ArrayList<Var>(inst.getOutputs());
      plainOperands.addAll(Arg.varsOf(inst.getValueInputs()));
      for (Var v: plainOperands) {
        if (v.isRegister()) {
          throw new UnsupportedConstructException(stmt.pos(), "register "
              + v.name() + " used as plain operand in " + stmt.label()
              + ": registers are only accessible through register ALU ops");
        }
      }
      if (inst.op.isRegisterOp() && !inst.getRegister().isRegister()) {
        throw new UnsupportedConstructException(stmt.pos(),
            inst.getRegister().name() + " is not a register in "
            + stmt.label());
      }
      if (inst.op == Opcode.TABLE_MATCH) {
        checkTableCall(program, cdg, inst, maxCallDepth);
      }
    }
    logger.debug("Checked " + program.statementCount() +
                 " statements for legality");
  }

  private static void checkTableCall(Program program, ControlDependence cdg,
      Instruction inst, int maxCallDepth)
          throws UnsupportedConstructException {
    TableDecl decl = program.lookupTable(inst.getTable());
    if (decl == null) {
      throw new UnsupportedConstructException(inst.pos(), "table "
          + inst.getTable() + " applied in " + inst.label()
          + " was not declared");
    }
    if (decl.keyWidths().size() != inst.getInputs().size()) {
      throw new UnsupportedConstructException(inst.pos(), "table "
          + decl.name() + " has " + decl.keyWidths().size() + " keys but "
          + inst.label() + " passes " + inst.getInputs().size());
    }
    int depth = cdg.depth(inst.id());
    if (depth > maxCallDepth) {
      throw new UnsupportedConstructException(inst.pos(), "call of table "
          + decl.name() + " in " + inst.label() + " is nested under " + depth
          + " branch decisions, at most " + maxCallDepth + " supported");
    }
  }

  public static PipelineProgram form(Logger logger, Program program,
          ControlDependence cdg, LayoutProblem problem, Layout layout) {
    ActionForm af = new ActionForm(program, cdg, problem, layout);
    for (PendingTable pending: af.collectTables()) {
      Table t;
      if (pending.call != null) {
        t = af.buildCallTable(pending);
      } else {
        t = af.buildActionTable(pending);
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Formed " + t);
      }
      af.result.addTable(t);
    }
    logger.debug("Formed " + af.result.tables().size() + " tables and " +
                (af.result.actions().size() - 1) + " actions");
    return af.result;
  }

  /**
   * @return tables ordered by stage, then by first statement
   */
  private List<PendingTable> collectTables() {
    Map<String, PendingTable> groups = new LinkedHashMap<String, PendingTable>();
    List<PendingTable> all = new ArrayList<PendingTable>();
    for (Statement stmt: program.statements()) {
      if (stmt.type() != StatementType.INSTRUCTION) {
        continue;
      }
      Instruction inst = stmt.instruction();
      int id = inst.id();
      int stage = layout.stageOf(id);
      LayoutNode node = problem.node(id);
      if (inst.op == Opcode.TABLE_MATCH) {
        PendingTable call = new PendingTable(stage, id, node.group, -1, inst);
        call.stmts.add(id);
        all.add(call);
        continue;
      }

      String key = stage + "/" + node.group;
      PendingTable pending = groups.get(key);
      if (pending == null) {
        pending = new PendingTable(stage, id, node.group,
                                   cdg.innermostBranch(id), null);
        groups.put(key, pending);
        all.add(pending);
      }
      List<Decision> ds = cdg.decisions(id);
      int arm = ds.isEmpty() ? 0 : ds.get(ds.size() - 1).arm;
      List<Instruction> armInsts = pending.arms.get(arm);
      if (armInsts == null) {
        armInsts = new ArrayList<Instruction>();
        pending.arms.put(arm, armInsts);
      }
      armInsts.add(inst);
      pending.stmts.add(id);
    }

    Collections.sort(all, new Comparator<PendingTable>() {
      @Override
      public int compare(PendingTable a, PendingTable b) {
        if (a.stage != b.stage) {
          return a.stage < b.stage ? -1 : 1;
        }
        return Integer.compare(a.firstStmt, b.firstStmt);
      }
    });
    return all;
  }

  private Table buildActionTable(PendingTable pending) {
    String name = "s" + pending.stage + "_" + pending.group;
    int keyWidth = problem.node(pending.firstStmt).groupKeyWidth;
    if (pending.branch < 0) {
      Table t = Table.actionTable(name, pending.stage,
                  Collections.<Arg>emptyList(), keyWidth, pending.stmts);
      Action a = newAction(pending.stage, pending.arms.get(0));
      t.addRule(new Rule(Pattern.wildcard(0), a.id()));
      return t;
    }

    Conditional branch = branch(pending.branch);
    List<Decision> levels = cdg.decisions(pending.branch);
    List<Arg> keys = keysOf(levels);
    keys.addAll(branch.getKeys());
    Table t = Table.actionTable(name, pending.stage, keys, keyWidth,
                                pending.stmts);

    for (Pattern p: skipEarlierArms(levels, branch.getKeys().size())) {
      t.addRule(new Rule(p, Action.NOOP_ID));
    }

    List<Rule> armRules = new ArrayList<Rule>();
    Pattern path = pathPattern(levels);
    for (int arm = 0; arm < branch.getArms().size(); arm++) {
      List<Instruction> insts = pending.arms.get(arm);
      int actionId = insts == null ? Action.NOOP_ID
                          : newAction(pending.stage, insts).id();
      armRules.add(new Rule(Pattern.concat(
                    listOf(path, armPattern(branch, arm))), actionId));
    }
    // Default action is the no-op, so trailing no-op rules are redundant
    while (!armRules.isEmpty() &&
           armRules.get(armRules.size() - 1).actionId() == Action.NOOP_ID) {
      armRules.remove(armRules.size() - 1);
    }
    for (Rule r: armRules) {
      t.addRule(r);
    }
    return t;
  }

  private Table buildCallTable(PendingTable pending) {
    Instruction call = pending.call;
    TableDecl decl = program.lookupTable(call.getTable());
    if (decl == null) {
      throw new InternalInvariantError("Undeclared table " + call.getTable()
                                       + " should have been rejected");
    }
    List<Decision> levels = cdg.decisions(call.id());
    Guard guard;
    if (levels.isEmpty()) {
      guard = Guard.always();
    } else {
      guard = new Guard(keysOf(levels));
      for (Pattern p: skipEarlierArms(levels, 0)) {
        guard.addEntry(p, false);
      }
      guard.addEntry(pathPattern(levels), true);
    }
    return Table.callTable(decl.name() + "_" + call.id(), pending.stage, decl,
                call.getInputs(), call.getOutputs(), guard,
                problem.node(call.id()).groupKeyWidth, call.id());
  }

  private Action newAction(int stage, List<Instruction> body) {
    Action a = new Action(nextActionId++, stage, Var.NONE, body);
    result.putAction(a);
    return a;
  }

  private Conditional branch(int id) {
    return program.getStatement(id).conditional();
  }

  private static Pattern armPattern(Conditional branch, int arm) {
    if (!(branch instanceof MatchStatement)) {
      throw new InternalInvariantError("Expected only match statements " +
          "after normalization: " + branch.label());
    }
    return ((MatchStatement)branch).casePattern(arm);
  }

  private List<Arg> keysOf(List<Decision> levels) {
    List<Arg> keys = new ArrayList<Arg>();
    for (Decision d: levels) {
      keys.addAll(branch(d.branch).getKeys());
    }
    return keys;
  }

  /**
   * @return pattern matching the arm taken at every level
   */
  private Pattern pathPattern(List<Decision> levels) {
    List<Pattern> parts = new ArrayList<Pattern>();
    for (Decision d: levels) {
      parts.add(armPattern(branch(d.branch), d.arm));
    }
    return Pattern.concat(parts);
  }

  /**
   * Patterns catching packets that take an arm before the one on the
   * path at some level.  Must come before any pattern for the path.
   * @param trailingKeys wildcard elements to append
   */
  private List<Pattern> skipEarlierArms(List<Decision> levels,
                                        int trailingKeys) {
    List<Pattern> result = new ArrayList<Pattern>();
    for (int i = 0; i < levels.size(); i++) {
      Conditional b = branch(levels.get(i).branch);
      for (int earlier = 0; earlier < levels.get(i).arm; earlier++) {
        List<Pattern> parts = new ArrayList<Pattern>();
        for (int j = 0; j < levels.size(); j++) {
          Conditional other = branch(levels.get(j).branch);
          parts.add(j == i ? armPattern(b, earlier)
                           : Pattern.wildcard(other.getKeys().size()));
        }
        parts.add(Pattern.wildcard(trailingKeys));
        result.add(Pattern.concat(parts));
      }
    }
    return result;
  }

  private static List<Pattern> listOf(Pattern a, Pattern b) {
    List<Pattern> l = new ArrayList<Pattern>(2);
    l.add(a);
    l.add(b);
    return l;
  }
}
