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
package exm.dpc.ic.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;
import exm.dpc.ic.tree.Opcode;

/**
 * Control dependences of a structured, loop-free program.  A statement
 * depends on the decision of each enclosing branch: the innermost one
 * directly, the rest transitively.
 */
public class ControlDependence {

  /**
   * Branch statement id and index of the arm taken
   */
  public static class Decision {
    public final int branch;
    public final int arm;

    public Decision(int branch, int arm) {
      this.branch = branch;
      this.arm = arm;
    }

    @Override
    public int hashCode() {
      return 31 * branch + arm;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Decision))
        return false;
      Decision other = (Decision)obj;
      return branch == other.branch && arm == other.arm;
    }

    @Override
    public String toString() {
      return "s" + branch + "#" + arm;
    }
  }

  /** Decisions for each statement, outermost first */
  private final List<List<Decision>> decisions;
  private final List<DepEdge> edges = new ArrayList<DepEdge>();
  private final List<String> labels;

  private ControlDependence(int size) {
    decisions = new ArrayList<List<Decision>>(size);
    labels = new ArrayList<String>(size);
    for (int i = 0; i < size; i++) {
      decisions.add(null);
      labels.add(null);
    }
  }

  public static ControlDependence build(Logger logger, Program program) {
    ControlDependence cdg = new ControlDependence(program.statementCount());
    cdg.buildBlock(program.mainBlock(), new ArrayList<Decision>());
    for (int i = 0; i < program.statementCount(); i++) {
      if (cdg.decisions.get(i) == null) {
        throw new InternalInvariantError("Statement " + i + " not reached "
                                        + "building control dependences");
      }
    }
    logger.debug("Built CDG with " + cdg.edges.size() + " edges");
    return cdg;
  }

  private void buildBlock(Block block, List<Decision> enclosing) {
    Decision parent = enclosing.isEmpty() ? null
                              : enclosing.get(enclosing.size() - 1);
    for (Statement stmt: block.getStatements()) {
      int id = stmt.id();
      decisions.set(id, Collections.unmodifiableList(
                                  new ArrayList<Decision>(enclosing)));
      labels.set(id, stmt.label());
      if (parent != null) {
        edges.add(DepEdge.control(parent.branch, id, isTableCall(stmt)));
      }

      if (stmt.type() == StatementType.CONDITIONAL) {
        Conditional cond = stmt.conditional();
        List<Block> arms = cond.getArms();
        for (int i = 0; i < arms.size(); i++) {
          List<Decision> inner = new ArrayList<Decision>(enclosing);
          inner.add(new Decision(id, i));
          buildBlock(arms.get(i), inner);
        }
      }
    }
  }

  private static boolean isTableCall(Statement stmt) {
    return stmt.type() == StatementType.INSTRUCTION &&
           stmt.instruction().op == Opcode.TABLE_MATCH;
  }

  public int size() {
    return decisions.size();
  }

  /**
   * @return decisions guarding statement, outermost first
   */
  public List<Decision> decisions(int stmt) {
    if (stmt < 0 || stmt >= decisions.size()) {
      throw new InternalInvariantError("No control dependences for " + stmt);
    }
    return decisions.get(stmt);
  }

  /**
   * @return id of innermost enclosing branch, or -1 if top level
   */
  public int innermostBranch(int stmt) {
    List<Decision> ds = decisions(stmt);
    return ds.isEmpty() ? -1 : ds.get(ds.size() - 1).branch;
  }

  public int depth(int stmt) {
    return decisions(stmt).size();
  }

  /**
   * @return true if the two statements are in different arms of some
   *        branch, so never both execute
   */
  public boolean mutuallyExclusive(int a, int b) {
    List<Decision> da = decisions(a);
    List<Decision> db = decisions(b);
    for (int i = 0; i < Math.min(da.size(), db.size()); i++) {
      Decision x = da.get(i);
      Decision y = db.get(i);
      if (x.branch != y.branch) {
        // Diverged in sequence, not in arms
        return false;
      } else if (x.arm != y.arm) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return edges from each branch to statements directly inside its arms
   */
  public List<DepEdge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public String toDot() {
    DotWriter dot = new DotWriter("cdg");
    for (int i = 0; i < labels.size(); i++) {
      dot.node(i, labels.get(i));
    }
    for (DepEdge e: edges) {
      List<Decision> ds = decisions(e.dst);
      String armLabel = "arm " + ds.get(ds.size() - 1).arm;
      dot.edge(e.src, e.dst, armLabel, false);
    }
    return dot.toString();
  }
}
