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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.Opcode;
import exm.dpc.ic.tree.Pattern;

/**
 * Perform some sanity checks on the statement tree:
 * - Check all variable references match a declaration
 * - Check no statement object appears twice in the tree
 * - Check operand shapes of instructions and patterns of matches
 */
public class Validate implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public void optimize(Logger logger, CompileOptions opts, Program program) {
    Map<Statement, Statement> seen = new IdentityHashMap<Statement, Statement>();
    checkBlock(program, program.mainBlock(), seen);
    logger.debug("Validated " + seen.size() + " statements");
  }

  private void checkBlock(Program program, Block block,
                          Map<Statement, Statement> seen) {
    for (Statement stmt: block.getStatements()) {
      if (seen.put(stmt, stmt) != null) {
        throw new InternalInvariantError("Statement appears twice in tree: "
                                          + stmt.label());
      }
      switch (stmt.type()) {
        case INSTRUCTION:
          checkInstruction(program, stmt.instruction());
          break;
        case CONDITIONAL:
          checkConditional(program, stmt.conditional());
          for (Block arm: stmt.conditional().getArms()) {
            checkBlock(program, arm, seen);
          }
          break;
        default:
          throw new InternalInvariantError("Unknown statement type " +
                                           stmt.type());
      }
    }
  }

  private void checkInstruction(Program program, Instruction inst) {
    for (Var out: inst.getOutputs()) {
      checkVarReference(program, out, inst);
    }
    for (Var in: Arg.varsOf(inst.getInputs())) {
      checkVarReference(program, in, inst);
    }

    List<Arg> inputs = inst.getInputs();
    switch (inst.op) {
      case ASSIGN:
        checkArity(inst, 1, 1);
        break;
      case HASH:
      case CHECKSUM:
        if (inputs.size() < 2 || !inputs.get(0).isInt()) {
          throw new InternalInvariantError("Hash needs seed constant and "
                                           + "inputs: " + inst);
        }
        checkArity(inst, 1, inputs.size());
        break;
      case REG_GET:
      case REG_SET:
      case REG_UPDATE:
        if (inputs.isEmpty() || !inputs.get(0).isVar()) {
          throw new InternalInvariantError("Register op without register: "
                                           + inst);
        }
        int outs = inst.op == Opcode.REG_SET ? 0 : 1;
        int ins = inst.op == Opcode.REG_GET ? 1 : 2;
        checkArity(inst, outs, ins);
        break;
      case TABLE_MATCH:
        if (inst.getTable() == null) {
          throw new InternalInvariantError("Table match without table: "
                                           + inst);
        }
        break;
      default:
        if (inst.op.isBinaryOp()) {
          checkArity(inst, 1, 2);
        }
        break;
    }
  }

  private void checkArity(Instruction inst, int outputs, int inputs) {
    if (inst.getOutputs().size() != outputs ||
        inst.getInputs().size() != inputs) {
      throw new InternalInvariantError("Expected " + outputs + " outputs and "
          + inputs + " inputs: " + inst);
    }
  }

  private void checkConditional(Program program, Conditional cond) {
    for (Var key: Arg.varsOf(cond.getKeys())) {
      checkVarReference(program, key, cond);
    }
    if (cond instanceof MatchStatement) {
      MatchStatement match = (MatchStatement)cond;
      for (Pattern p: match.casePatterns()) {
        if (p.size() != match.getKeys().size()) {
          throw new InternalInvariantError("Pattern " + p + " does not " +
              "have one element per key in " + match.label());
        }
      }
    }
  }

  private void checkVarReference(Program program, Var v, Statement context) {
    Var declared = program.lookupVar(v.name());
    if (declared == null) {
      throw new InternalInvariantError("Variable " + v.name() + " referenced"
          + " in " + context.label() + " was not declared");
    }
    if (declared.kind() != v.kind() || declared.width() != v.width()) {
      throw new InternalInvariantError("Reference to " + v.name() + " in "
          + context.label() + " does not match declaration " + declared);
    }
  }
}
