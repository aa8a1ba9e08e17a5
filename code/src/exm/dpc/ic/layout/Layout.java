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

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.ic.graph.DepEdge;

/**
 * Result of a layout strategy: the stage of every node and the
 * resources used in every stage.
 */
public class Layout {
  private final String strategy;
  private final ResourceModel model;
  private final int stageOf[];
  private final List<StageState> stages;

  public Layout(String strategy, ResourceModel model, int stageOf[],
                List<StageState> stages) {
    this.strategy = strategy;
    this.model = model;
    this.stageOf = stageOf.clone();
    this.stages = Collections.unmodifiableList(
                                  new ArrayList<StageState>(stages));
  }

  public String strategy() {
    return strategy;
  }

  public int size() {
    return stageOf.length;
  }

  public int stageOf(int node) {
    return stageOf[node];
  }

  public int[] stageAssignment() {
    return stageOf.clone();
  }

  public StageState stage(int stage) {
    return stages.get(stage);
  }

  public int numStages() {
    return stages.size();
  }

  /**
   * @return number of stages up to and including the last one holding a
   *         table
   */
  public int stagesUsed() {
    int used = 0;
    for (StageState s: stages) {
      if (s.usage().tables > 0) {
        used = s.stage + 1;
      }
    }
    return used;
  }

  /**
   * Check every dependence and every stage capacity from scratch
   * @throws InternalInvariantError if the layout is invalid
   */
  public void verify(LayoutProblem problem) {
    if (problem.size() != stageOf.length) {
      throw new InternalInvariantError("Layout of " + stageOf.length +
                        " nodes for problem of " + problem.size());
    }
    List<StageState> check = new ArrayList<StageState>();
    for (int s = 0; s < model.stages; s++) {
      check.add(new StageState(s, problem));
    }
    for (int i = 0; i < stageOf.length; i++) {
      int s = stageOf[i];
      if (s < 0 || s >= model.stages) {
        throw new InternalInvariantError("Node " + problem.node(i) +
                                " assigned to invalid stage " + s);
      }
      LayoutNode node = problem.node(i);
      String problemDesc = check.get(s).whyNot(node);
      if (problemDesc != null) {
        throw new InternalInvariantError("Node " + node + " in stage " + s
                                         + ": " + problemDesc);
      }
      check.get(s).place(node);
    }

    for (DepEdge e: problem.deps().edges()) {
      int src = stageOf[e.src];
      int dst = stageOf[e.dst];
      if (src > dst || (e.isStrict() && src == dst)) {
        throw new InternalInvariantError("Dependence " + e + " violated: "
              + "stage " + src + " to stage " + dst);
      }
    }
  }

  public UtilizationReport utilization() {
    return new UtilizationReport(strategy, model, stages, stagesUsed());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (StageState s: stages) {
      if (!s.nodes().isEmpty()) {
        sb.append(s + ": " + s.nodes() + "\n");
      }
    }
    return sb.toString();
  }
}
