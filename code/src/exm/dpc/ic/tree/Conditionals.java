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

import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;

public class Conditionals {
  public static final String indent = ICTree.indent;

  /**
   * A branch: exactly one of the arms executes, decided by the values
   * of the keys.
   */
  public static abstract class Conditional extends Statement {
    @Override
    public StatementType type() {
      return StatementType.CONDITIONAL;
    }

    @Override
    public Conditional conditional() {
      return this;
    }

    public abstract List<Block> getArms();

    /**
     * @return label describing the decision that selects arm i
     */
    public abstract String armLabel(int i);

    /**
     * @return args the decision is made on
     */
    public abstract List<Arg> getKeys();

    @Override
    public List<Var> getReads() {
      List<Var> reads = new ArrayList<Var>();
      for (Var v: Arg.varsOf(getKeys())) {
        if (!reads.contains(v)) {
          reads.add(v);
        }
      }
      return reads;
    }

    @Override
    public List<Var> getWrites() {
      return Var.NONE;
    }
  }

  public static class IfStatement extends Conditional {
    private final Arg condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public IfStatement(Arg condition) {
      this(condition, new Block(), new Block());
    }

    public IfStatement(Arg condition, Block thenBlock, Block elseBlock) {
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
    }

    public Arg getCondition() {
      return condition;
    }

    public Block thenBlock() {
      return thenBlock;
    }

    public Block elseBlock() {
      return elseBlock;
    }

    @Override
    public List<Block> getArms() {
      return Arrays.asList(thenBlock, elseBlock);
    }

    @Override
    public String armLabel(int i) {
      return i == 0 ? "true" : "false";
    }

    @Override
    public List<Arg> getKeys() {
      return Collections.singletonList(condition);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String currentIndent) {
      sb.append(currentIndent + "if " + condition + " {\n");
      thenBlock.prettyPrint(sb, currentIndent + indent);
      if (!elseBlock.isEmpty()) {
        sb.append(currentIndent + "} else {\n");
        elseBlock.prettyPrint(sb, currentIndent + indent);
      }
      sb.append(currentIndent + "}\n");
    }

    @Override
    protected String summary() {
      return "if " + condition;
    }
  }

  /**
   * Match on a list of keys. Cases are tried in order and the first
   * whose pattern matches executes.  If none matches nothing executes.
   */
  public static class MatchStatement extends Conditional {
    private final ArrayList<Arg> keys;
    private final ArrayList<Pattern> casePatterns = new ArrayList<Pattern>();
    private final ArrayList<Block> caseBlocks = new ArrayList<Block>();

    public MatchStatement(List<Arg> keys) {
      this.keys = new ArrayList<Arg>(keys);
    }

    /**
     * @return new empty block for case
     */
    public Block addCase(Pattern pattern) {
      assert(pattern.size() == keys.size()) : pattern + " " + keys;
      Block b = new Block();
      addCase(pattern, b);
      return b;
    }

    public void addCase(Pattern pattern, Block block) {
      casePatterns.add(pattern);
      caseBlocks.add(block);
    }

    @Override
    public List<Arg> getKeys() {
      return Collections.unmodifiableList(keys);
    }

    public void replaceKey(int i, Arg newKey) {
      keys.set(i, newKey);
    }

    public List<Pattern> casePatterns() {
      return Collections.unmodifiableList(casePatterns);
    }

    public Pattern casePattern(int i) {
      return casePatterns.get(i);
    }

    @Override
    public List<Block> getArms() {
      return Collections.unmodifiableList(caseBlocks);
    }

    @Override
    public String armLabel(int i) {
      return casePatterns.get(i).toString();
    }

    @Override
    public void prettyPrint(StringBuilder sb, String currentIndent) {
      String caseIndent = currentIndent + indent;
      sb.append(currentIndent + summary() + " {\n");
      for (int i = 0; i < caseBlocks.size(); i++) {
        sb.append(caseIndent + "case " + casePatterns.get(i) + " {\n");
        caseBlocks.get(i).prettyPrint(sb, caseIndent + indent);
        sb.append(caseIndent + "}\n");
      }
      sb.append(currentIndent + "}\n");
    }

    @Override
    protected String summary() {
      StringBuilder sb = new StringBuilder("match");
      for (Arg k: keys) {
        sb.append(" " + k);
      }
      return sb.toString();
    }
  }
}
