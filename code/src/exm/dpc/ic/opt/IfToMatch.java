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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.Conditionals.IfStatement;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;
import exm.dpc.ic.tree.Pattern;

/**
 * Replace every if statement with the equivalent match:
 * <pre>
 *   match c {
 *     case 0 { else-block }
 *     case _ { then-block }
 *   }
 * </pre>
 * so that later passes only need to deal with one kind of branch.
 */
public class IfToMatch implements OptimizerPass {

  @Override
  public String getPassName() {
    return "If to match";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public void optimize(Logger logger, CompileOptions opts, Program program) {
    int converted = convertBlock(program.mainBlock());
    logger.debug("Converted " + converted + " if statements");
  }

  private int convertBlock(Block block) {
    int converted = 0;
    List<Statement> newStmts = new ArrayList<Statement>();
    for (Statement stmt: block.getStatements()) {
      if (stmt.type() == StatementType.CONDITIONAL) {
        Conditional cond = stmt.conditional();
        for (Block arm: cond.getArms()) {
          converted += convertBlock(arm);
        }
        if (cond instanceof IfStatement) {
          newStmts.add(toMatch((IfStatement)cond));
          converted++;
          continue;
        }
      }
      newStmts.add(stmt);
    }
    block.replaceStatements(newStmts);
    return converted;
  }

  static MatchStatement toMatch(IfStatement ifStmt) {
    MatchStatement match = new MatchStatement(
                  Collections.singletonList(ifStmt.getCondition()));
    // Zero case must come first: the wildcard case would also match it
    match.addCase(Pattern.exact(0), ifStmt.elseBlock());
    match.addCase(Pattern.wildcard(1), ifStmt.thenBlock());
    match.setPos(ifStmt.pos());
    return match;
  }
}
