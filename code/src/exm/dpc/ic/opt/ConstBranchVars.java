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
package exm.dpc.ic.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Settings;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;

/**
 * A match whose arms are spread over several stages re-matches its keys
 * in every stage.  If an arm overwrites a key variable, the later stages
 * would see the new value and take a different arm.  This pass copies
 * such keys into fresh locals before the match and matches on the copy.
 */
public class ConstBranchVars implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Constant branch variables";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_CONST_BRANCH_VARS;
  }

  @Override
  public void optimize(Logger logger, CompileOptions opts, Program program) {
    fixBlock(logger, program, program.mainBlock());
  }

  private void fixBlock(Logger logger, Program program, Block block) {
    List<Statement> newStmts = new ArrayList<Statement>();
    for (Statement stmt: block.getStatements()) {
      if (stmt.type() == StatementType.CONDITIONAL) {
        Conditional cond = stmt.conditional();
        for (Block arm: cond.getArms()) {
          fixBlock(logger, program, arm);
        }
        if (cond instanceof MatchStatement) {
          newStmts.addAll(copyKeys(logger, program, (MatchStatement)cond));
        }
      }
      newStmts.add(stmt);
    }
    block.replaceStatements(newStmts);
  }

  /**
   * @return assignments to insert before the match
   */
  private List<Statement> copyKeys(Logger logger, Program program,
                                   MatchStatement match) {
    List<Statement> copies = new ArrayList<Statement>();
    List<Var> written = new ArrayList<Var>();
    for (Block arm: match.getArms()) {
      collectWrites(arm, written);
    }

    List<Arg> keys = match.getKeys();
    for (int i = 0; i < keys.size(); i++) {
      Arg key = keys.get(i);
      if (key.isVar() && !key.getVar().isRegister() &&
          written.contains(key.getVar())) {
        Var orig = key.getVar();
        Var copy = program.createLocal(orig.name(), orig.width());
        Instruction assign = Instruction.assign(copy, key);
        assign.setPos(match.pos());
        copies.add(assign);
        match.replaceKey(i, Arg.newVar(copy));
        logger.trace("Copied branch key " + orig + " to " + copy);
      }
    }
    return copies;
  }

  private static void collectWrites(Block block, List<Var> written) {
    for (Statement stmt: block.getStatements()) {
      written.addAll(stmt.getWrites());
      if (stmt.type() == StatementType.CONDITIONAL) {
        for (Block arm: stmt.conditional().getArms()) {
          collectWrites(arm, written);
        }
      }
    }
  }
}
