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
import java.util.PriorityQueue;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.DependencyCycleException;
import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.util.StackLite;

/**
 * Union of control and data dependences over statement ids.  At most one
 * edge is kept per pair of nodes: a strict edge replaces a non-strict
 * one, and a data edge replaces a control edge of equal strictness so
 * that the variable involved can be reported.
 */
public class DependencyGraph {
  private final List<String> labels;
  private final List<List<DepEdge>> succs;
  private final List<List<DepEdge>> preds;
  private int edgeCount = 0;

  private static enum VisitState {
    NEW,
    ON_PATH,
    DONE,
  }

  public DependencyGraph(List<String> labels) {
    this.labels = new ArrayList<String>(labels);
    this.succs = new ArrayList<List<DepEdge>>(labels.size());
    this.preds = new ArrayList<List<DepEdge>>(labels.size());
    for (int i = 0; i < labels.size(); i++) {
      succs.add(new ArrayList<DepEdge>());
      preds.add(new ArrayList<DepEdge>());
    }
  }

  public static DependencyGraph merge(Logger logger, List<String> labels,
            List<DepEdge> controlEdges, List<DepEdge> dataEdges) {
    DependencyGraph g = new DependencyGraph(labels);
    for (DepEdge e: controlEdges) {
      g.addEdge(e);
    }
    for (DepEdge e: dataEdges) {
      g.addEdge(e);
    }
    logger.debug("Dependency graph has " + g.size() + " nodes and "
                 + g.edgeCount() + " edges");
    return g;
  }

  public void addEdge(DepEdge edge) {
    checkNode(edge.src);
    checkNode(edge.dst);
    List<DepEdge> out = succs.get(edge.src);
    for (int i = 0; i < out.size(); i++) {
      DepEdge existing = out.get(i);
      if (existing.dst == edge.dst) {
        if (replaces(edge, existing)) {
          out.set(i, edge);
          List<DepEdge> in = preds.get(edge.dst);
          in.set(in.indexOf(existing), edge);
        }
        return;
      }
    }
    out.add(edge);
    preds.get(edge.dst).add(edge);
    edgeCount++;
  }

  private static boolean replaces(DepEdge edge, DepEdge existing) {
    if (edge.isStrict() != existing.isStrict()) {
      return edge.isStrict();
    }
    return edge.kind.isData() && !existing.kind.isData();
  }

  public int size() {
    return labels.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  public String label(int node) {
    checkNode(node);
    return labels.get(node);
  }

  public List<DepEdge> predEdges(int node) {
    checkNode(node);
    return Collections.unmodifiableList(preds.get(node));
  }

  public List<DepEdge> succEdges(int node) {
    checkNode(node);
    return Collections.unmodifiableList(succs.get(node));
  }

  public List<DepEdge> edges() {
    List<DepEdge> all = new ArrayList<DepEdge>(edgeCount);
    for (List<DepEdge> out: succs) {
      all.addAll(out);
    }
    return all;
  }

  /**
   * Check for cycles with a depth first search from each node in id order.
   * @throws DependencyCycleException with the first cycle found
   */
  public void checkAcyclic() throws DependencyCycleException {
    int n = size();
    VisitState state[] = new VisitState[n];
    int nextEdge[] = new int[n];
    DepEdge enteredBy[] = new DepEdge[n];
    for (int i = 0; i < n; i++) {
      state[i] = VisitState.NEW;
    }

    for (int start = 0; start < n; start++) {
      if (state[start] != VisitState.NEW) {
        continue;
      }
      StackLite<Integer> path = new StackLite<Integer>();
      path.push(start);
      state[start] = VisitState.ON_PATH;
      while (!path.isEmpty()) {
        int curr = path.peek();
        List<DepEdge> out = succs.get(curr);
        if (nextEdge[curr] < out.size()) {
          DepEdge e = out.get(nextEdge[curr]++);
          if (state[e.dst] == VisitState.ON_PATH) {
            throw cycleError(path, enteredBy, e);
          } else if (state[e.dst] == VisitState.NEW) {
            state[e.dst] = VisitState.ON_PATH;
            enteredBy[e.dst] = e;
            path.push(e.dst);
          }
        } else {
          state[curr] = VisitState.DONE;
          path.pop();
        }
      }
    }
  }

  private DependencyCycleException cycleError(StackLite<Integer> path,
                                   DepEdge enteredBy[], DepEdge closing) {
    int cycleStart = path.indexOf(closing.dst);
    List<DepEdge> cycleEdges = new ArrayList<DepEdge>();
    List<String> chain = new ArrayList<String>();
    for (int i = cycleStart; i < path.size(); i++) {
      int node = path.get(i);
      if (i > cycleStart) {
        cycleEdges.add(enteredBy[node]);
      }
      chain.add(labels.get(node));
    }
    cycleEdges.add(closing);
    chain.add(labels.get(closing.dst));

    List<String> vars = new ArrayList<String>();
    for (DepEdge e: cycleEdges) {
      if (e.var != null && !vars.contains(e.var.name())) {
        vars.add(e.var.name());
      }
    }
    return new DependencyCycleException(chain, vars);
  }

  /**
   * Kahn's algorithm, always taking the ready node with the smallest id,
   * so the order is the source order wherever dependences allow.
   */
  public List<Integer> topologicalOrder() {
    int n = size();
    int remainingPreds[] = new int[n];
    PriorityQueue<Integer> ready = new PriorityQueue<Integer>();
    for (int i = 0; i < n; i++) {
      remainingPreds[i] = preds.get(i).size();
      if (remainingPreds[i] == 0) {
        ready.add(i);
      }
    }

    List<Integer> order = new ArrayList<Integer>(n);
    while (!ready.isEmpty()) {
      int curr = ready.poll();
      order.add(curr);
      for (DepEdge e: succs.get(curr)) {
        if (--remainingPreds[e.dst] == 0) {
          ready.add(e.dst);
        }
      }
    }
    if (order.size() != n) {
      throw new InternalInvariantError("Dependency graph has cycle: " +
          "only ordered " + order.size() + " of " + n + " nodes");
    }
    return order;
  }

  private void checkNode(int node) {
    if (node < 0 || node >= labels.size()) {
      throw new InternalInvariantError("Node " + node + " not in " +
                            "dependency graph of size " + labels.size());
    }
  }

  public String toDot() {
    DotWriter dot = new DotWriter("dfg");
    for (int i = 0; i < labels.size(); i++) {
      dot.node(i, labels.get(i));
    }
    for (DepEdge e: edges()) {
      dot.edge(e.src, e.dst, e.label(), e.kind.isData());
    }
    return dot.toString();
  }
}
