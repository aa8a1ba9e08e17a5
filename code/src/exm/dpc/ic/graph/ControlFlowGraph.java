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
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.util.Pair;
import exm.dpc.common.util.StackLite;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.StatementType;

/**
 * Control flow graph over statements.  Nodes are statement ids, each
 * edge goes from a statement to a possible direct successor.  A branch
 * has one edge per arm, labelled with the arm's pattern; an arm's last
 * statement (or the branch itself, for an empty arm) has an edge to the
 * statement after the branch.
 *
 * Graphs built from a program are acyclic, but graphs assembled with
 * {@link #addEdge(int, int, String)} need not be.
 */
public class ControlFlowGraph {
  private final int size;
  private final List<String> nodeLabels;
  private final BitSet succs[];
  private final BitSet preds[];
  private final Map<Pair<Integer, Integer>, String> edgeLabels =
                              new HashMap<Pair<Integer, Integer>, String>();

  /** Lazily computed transitive successors, reset on modification */
  private BitSet reachable[] = null;

  public ControlFlowGraph(int size) {
    this(defaultLabels(size));
  }

  public ControlFlowGraph(List<String> nodeLabels) {
    this.size = nodeLabels.size();
    this.nodeLabels = new ArrayList<String>(nodeLabels);
    this.succs = new BitSet[size];
    this.preds = new BitSet[size];
    for (int i = 0; i < size; i++) {
      succs[i] = new BitSet(size);
      preds[i] = new BitSet(size);
    }
  }

  private static List<String> defaultLabels(int size) {
    List<String> labels = new ArrayList<String>(size);
    for (int i = 0; i < size; i++) {
      labels.add("s" + i);
    }
    return labels;
  }

  /**
   * Build graph for numbered program
   */
  public static ControlFlowGraph build(Logger logger, Program program) {
    List<String> labels = new ArrayList<String>();
    for (Statement stmt: program.statements()) {
      labels.add(stmt.label());
    }
    ControlFlowGraph cfg = new ControlFlowGraph(labels);
    List<Pair<Integer, String>> exits = cfg.buildBlock(program.mainBlock(),
                              new ArrayList<Pair<Integer, String>>());
    if (logger.isTraceEnabled()) {
      logger.trace("CFG exits: " + exits);
    }
    logger.debug("Built CFG with " + cfg.size() + " nodes and " +
                 cfg.edgeCount() + " edges");
    return cfg;
  }

  /**
   * Add edges for block.
   * @param entries nodes (and edge labels) flowing into the block
   * @return nodes (and edge labels) flowing out of the block
   */
  private List<Pair<Integer, String>> buildBlock(Block block,
                          List<Pair<Integer, String>> entries) {
    List<Pair<Integer, String>> pending = entries;
    for (Statement stmt: block.getStatements()) {
      int id = stmt.id();
      if (id < 0 || id >= size) {
        throw new InternalInvariantError("Statement not numbered: " + stmt);
      }
      for (Pair<Integer, String> from: pending) {
        addEdge(from.val1, id, from.val2);
      }
      pending = new ArrayList<Pair<Integer, String>>();
      if (stmt.type() == StatementType.CONDITIONAL) {
        Conditional cond = stmt.conditional();
        List<Block> arms = cond.getArms();
        for (int i = 0; i < arms.size(); i++) {
          List<Pair<Integer, String>> armEntry =
                                    new ArrayList<Pair<Integer, String>>();
          armEntry.add(Pair.create(id, cond.armLabel(i)));
          pending.addAll(buildBlock(arms.get(i), armEntry));
        }
      } else {
        pending.add(Pair.create(id, (String)null));
      }
    }
    return pending;
  }

  public int size() {
    return size;
  }

  public String nodeLabel(int node) {
    return nodeLabels.get(node);
  }

  public void addEdge(int from, int to, String label) {
    checkNode(from);
    checkNode(to);
    succs[from].set(to);
    preds[to].set(from);
    if (label != null) {
      Pair<Integer, Integer> key = Pair.create(from, to);
      String prev = edgeLabels.get(key);
      edgeLabels.put(key, prev == null ? label : prev + "," + label);
    }
    reachable = null;
  }

  public BitSet succs(int node) {
    checkNode(node);
    return (BitSet)succs[node].clone();
  }

  public BitSet preds(int node) {
    checkNode(node);
    return (BitSet)preds[node].clone();
  }

  public String edgeLabel(int from, int to) {
    return edgeLabels.get(Pair.create(from, to));
  }

  public int edgeCount() {
    int count = 0;
    for (BitSet s: succs) {
      count += s.cardinality();
    }
    return count;
  }

  /**
   * @return true if a path of one or more edges leads from a to b
   */
  public boolean pathExists(int from, int to) {
    checkNode(from);
    checkNode(to);
    if (reachable == null) {
      reachable = new BitSet[size];
    }
    if (reachable[from] == null) {
      reachable[from] = computeReachable(from);
    }
    return reachable[from].get(to);
  }

  private BitSet computeReachable(int from) {
    BitSet visited = new BitSet(size);
    StackLite<Integer> stack = new StackLite<Integer>();
    stack.push(from);
    while (!stack.isEmpty()) {
      int curr = stack.pop();
      BitSet next = succs[curr];
      for (int dst = next.nextSetBit(0); dst >= 0;
           dst = next.nextSetBit(dst + 1)) {
        if (!visited.get(dst)) {
          visited.set(dst);
          stack.push(dst);
        }
      }
    }
    return visited;
  }

  private void checkNode(int node) {
    if (node < 0 || node >= size) {
      throw new InternalInvariantError("Node " + node + " not in CFG " +
                                       "of size " + size);
    }
  }

  public String toDot() {
    DotWriter dot = new DotWriter("cfg");
    for (int i = 0; i < size; i++) {
      dot.node(i, nodeLabels.get(i));
    }
    for (int i = 0; i < size; i++) {
      for (int j = succs[i].nextSetBit(0); j >= 0;
           j = succs[i].nextSetBit(j + 1)) {
        dot.edge(i, j, edgeLabel(i, j), false);
      }
    }
    return dot.toString();
  }
}
