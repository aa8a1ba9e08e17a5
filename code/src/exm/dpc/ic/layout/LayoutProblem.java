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
package exm.dpc.ic.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Arg;
import exm.dpc.ic.graph.ControlDependence;
import exm.dpc.ic.graph.ControlDependence.Decision;
import exm.dpc.ic.graph.DepEdge;
import exm.dpc.ic.graph.DependencyGraph;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;
import exm.dpc.ic.tree.ICTree.TableDecl;
import exm.dpc.ic.tree.Opcode;

/**
 * Input to a layout strategy: one node per statement with its resource
 * demand, the acyclic dependency graph over them, and the resource model.
 */
public class LayoutProblem {
  private final List<LayoutNode> nodes;
  private final DependencyGraph deps;
  private final ResourceModel model;
  private final List<Integer> order;
  /** Null if no branch structure is known */
  private final ControlDependence cdg;

  public LayoutProblem(List<LayoutNode> nodes, DependencyGraph deps,
                       ResourceModel model) {
    this(nodes, deps, model, null);
  }

  public LayoutProblem(List<LayoutNode> nodes, DependencyGraph deps,
                       ResourceModel model, ControlDependence cdg) {
    if (nodes.size() != deps.size()) {
      throw new InternalInvariantError(nodes.size() + " layout nodes but "
                          + deps.size() + " dependency graph nodes");
    }
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).id != i) {
        throw new InternalInvariantError("Layout node " + i + " has id "
                                         + nodes.get(i).id);
      }
    }
    this.nodes = Collections.unmodifiableList(
                                  new ArrayList<LayoutNode>(nodes));
    this.deps = deps;
    this.model = model;
    this.cdg = cdg;
    this.order = Collections.unmodifiableList(deps.topologicalOrder());
  }

  public static LayoutProblem build(Logger logger, Program program,
          ControlDependence cdg, DependencyGraph deps, ResourceModel model) {
    List<LayoutNode> nodes = new ArrayList<LayoutNode>();
    for (Statement stmt: program.statements()) {
      LayoutNode node;
      if (stmt.type() == StatementType.CONDITIONAL) {
        node = LayoutNode.branch(stmt.id(), stmt.label());
      } else {
        node = instructionNode(program, cdg, stmt.instruction());
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Layout node " + node + ": " + node.demand());
      }
      nodes.add(node);
    }
    return new LayoutProblem(nodes, deps, model, cdg);
  }

  private static LayoutNode instructionNode(Program program,
                          ControlDependence cdg, Instruction inst) {
    int id = inst.id();
    int keyWidth = pathKeyWidth(program, cdg, id);
    String group;
    if (inst.op == Opcode.TABLE_MATCH) {
      group = tableCallGroup(id);
      TableDecl decl = program.lookupTable(inst.getTable());
      if (decl != null) {
        keyWidth += decl.keyWidth();
      }
    } else {
      group = branchGroup(cdg.innermostBranch(id));
    }
    return new LayoutNode(id, inst.label(), group, keyWidth,
                          inst.op.isRegisterOp() ? 1 : 0,
                          inst.op.isHashOp() ? 1 : 0,
                          inst.getRegisterReads(), inst.getRegisterWrites());
  }

  /**
   * @param branch id of branch, or -1 for top level
   * @return name of table group for instructions directly inside branch
   */
  public static String branchGroup(int branch) {
    return branch < 0 ? LayoutNode.ROOT_GROUP : "b" + branch;
  }

  public static String tableCallGroup(int stmt) {
    return "call" + stmt;
  }

  /**
   * Total width of the keys of all branches enclosing a statement.
   * Constant keys take no key bits.
   */
  public static int pathKeyWidth(Program program, ControlDependence cdg,
                                 int stmt) {
    int width = 0;
    for (Decision d: cdg.decisions(stmt)) {
      Statement branch = program.getStatement(d.branch);
      for (Arg key: branch.conditional().getKeys()) {
        if (key.isVar()) {
          width += key.getVar().width();
        }
      }
    }
    return width;
  }

  public int size() {
    return nodes.size();
  }

  public LayoutNode node(int id) {
    return nodes.get(id);
  }

  public DependencyGraph deps() {
    return deps;
  }

  public ResourceModel model() {
    return model;
  }

  /**
   * @return nodes in dependency order, smallest id first among ready nodes
   */
  public List<Integer> topologicalOrder() {
    return order;
  }

  /**
   * @param stageOf stages of nodes placed so far, -1 if not placed
   * @return earliest stage allowed by dependences, or -1 if some
   *        predecessor is not placed yet
   */
  public int earliestStage(int node, int stageOf[]) {
    int earliest = 0;
    for (DepEdge e: deps.predEdges(node)) {
      int predStage = stageOf[e.src];
      if (predStage < 0) {
        return -1;
      }
      earliest = Math.max(earliest, e.isStrict() ? predStage + 1 : predStage);
    }
    return earliest;
  }

  /**
   * @return true if the two nodes sit in different arms of one branch
   */
  public boolean mutuallyExclusive(int a, int b) {
    return cdg != null && cdg.mutuallyExclusive(a, b);
  }

  /**
   * @return true if the node fits in an otherwise empty stage
   */
  public boolean fitsEmptyStage(LayoutNode node) {
    return new StageState(0, this).fits(node);
  }
}
