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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;

/**
 * Atomic instructions of the normalized program
 */
public class ICInstructions {

  public static class Instruction extends Statement {
    public final Opcode op;
    private final List<Var> outputs;
    private final List<Arg> inputs;
    /** Applied table for TABLE_MATCH, otherwise null */
    private final String table;

    public Instruction(Opcode op, List<Var> outputs, List<Arg> inputs,
                       String table) {
      super();
      this.op = op;
      this.outputs = Collections.unmodifiableList(
                                  new ArrayList<Var>(outputs));
      this.inputs = Collections.unmodifiableList(
                                  new ArrayList<Arg>(inputs));
      this.table = table;
      assert((op == Opcode.TABLE_MATCH) == (table != null)) : op + " " + table;
    }

    public static Instruction assign(Var out, Arg in) {
      return new Instruction(Opcode.ASSIGN, Arrays.asList(out),
                             Arrays.asList(in), null);
    }

    public static Instruction binaryOp(Opcode op, Var out, Arg in1, Arg in2) {
      assert(op.isBinaryOp()) : op;
      return new Instruction(op, Arrays.asList(out),
                             Arrays.asList(in1, in2), null);
    }

    public static Instruction hash(Opcode op, Var out, long seed,
                                   List<Arg> hashed) {
      assert(op.isHashOp()) : op;
      List<Arg> in = new ArrayList<Arg>();
      in.add(Arg.newInt(seed));
      in.addAll(hashed);
      return new Instruction(op, Arrays.asList(out), in, null);
    }

    public static Instruction regGet(Var out, Var reg) {
      return new Instruction(Opcode.REG_GET, Arrays.asList(out),
                             Arrays.asList(Arg.newVar(reg)), null);
    }

    public static Instruction regSet(Var reg, Arg val) {
      return new Instruction(Opcode.REG_SET, Var.NONE,
                             Arrays.asList(Arg.newVar(reg), val), null);
    }

    public static Instruction regUpdate(Var out, Var reg, Arg val) {
      return new Instruction(Opcode.REG_UPDATE, Arrays.asList(out),
                             Arrays.asList(Arg.newVar(reg), val), null);
    }

    public static Instruction tableMatch(List<Var> outs, String table,
                                         List<Arg> keys) {
      return new Instruction(Opcode.TABLE_MATCH, outs, keys, table);
    }

    @Override
    public StatementType type() {
      return StatementType.INSTRUCTION;
    }

    @Override
    public Instruction instruction() {
      return this;
    }

    public List<Var> getOutputs() {
      return outputs;
    }

    public List<Arg> getInputs() {
      return inputs;
    }

    public String getTable() {
      return table;
    }

    /**
     * @return register accessed by a register op
     */
    public Var getRegister() {
      if (!op.isRegisterOp()) {
        throw new InternalInvariantError("Not a register op: " + this);
      }
      return inputs.get(0).getVar();
    }

    /**
     * @return registers this instruction reads with a register ALU
     */
    public List<Var> getRegisterReads() {
      if (op.readsRegister()) {
        return Collections.singletonList(getRegister());
      }
      return Var.NONE;
    }

    /**
     * @return registers this instruction writes with a register ALU
     */
    public List<Var> getRegisterWrites() {
      if (op.writesRegister()) {
        return Collections.singletonList(getRegister());
      }
      return Var.NONE;
    }

    /**
     * Operands that are not the register of a register op
     */
    public List<Arg> getValueInputs() {
      if (op.isRegisterOp()) {
        return inputs.subList(1, inputs.size());
      }
      return inputs;
    }

    @Override
    public List<Var> getReads() {
      List<Var> reads = new ArrayList<Var>();
      reads.addAll(getRegisterReads());
      for (Var v: Arg.varsOf(getValueInputs())) {
        if (!reads.contains(v)) {
          reads.add(v);
        }
      }
      return reads;
    }

    @Override
    public List<Var> getWrites() {
      List<Var> writes = new ArrayList<Var>(outputs);
      for (Var reg: getRegisterWrites()) {
        if (!writes.contains(reg)) {
          writes.add(reg);
        }
      }
      return writes;
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append(this.toString());
      sb.append("\n");
    }

    @Override
    protected String summary() {
      return toString();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < outputs.size(); i++) {
        if (i > 0) sb.append(" ");
        sb.append(outputs.get(i).name());
      }
      if (!outputs.isEmpty()) {
        sb.append(" = ");
      }
      sb.append(op.mnemonic());
      if (table != null) {
        sb.append(" " + table);
      }
      for (Arg in: inputs) {
        sb.append(" " + in);
      }
      return sb.toString();
    }
  }
}
