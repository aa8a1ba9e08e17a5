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
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.ResourceExhaustionException;

/**
 * Current layout strategy: take nodes in topological order and put each
 * in the first stage at or after its earliest feasible stage that still
 * has room for it.
 */
public class AsapLayout implements LayoutStrategy {

  @Override
  public String getName() {
    return Settings.STRATEGY_CURRENT;
  }

  @Override
  public Layout layout(Logger logger, LayoutProblem problem)
                                  throws ResourceExhaustionException {
    ResourceModel model = problem.model();
    List<StageState> stages = new ArrayList<StageState>(model.stages);
    for (int s = 0; s < model.stages; s++) {
      stages.add(new StageState(s, problem));
    }
    int stageOf[] = new int[problem.size()];
    Arrays.fill(stageOf, -1);

    for (int id: problem.topologicalOrder()) {
      LayoutNode node = problem.node(id);
      if (!problem.fitsEmptyStage(node)) {
        throw new ResourceExhaustionException("layout", node.label, -1,
            "needs more than a whole stage: " + node.demand());
      }
      int earliest = problem.earliestStage(id, stageOf);
      assert(earliest >= 0) : "Topological order broken at " + node;

      int chosen = -1;
      for (int s = earliest; s < model.stages; s++) {
        StageState stage = stages.get(s);
        String whyNot = stage.whyNot(node);
        if (whyNot == null) {
          chosen = s;
          break;
        } else if (logger.isTraceEnabled()) {
          logger.trace(node + " not in stage " + s + ": " + whyNot);
        }
      }

      if (chosen < 0) {
        throw exhausted(node, earliest, stages, model);
      }
      stages.get(chosen).place(node);
      stageOf[id] = chosen;
      if (logger.isTraceEnabled()) {
        logger.trace("Placed " + node + " in stage " + chosen +
                     " (earliest " + earliest + ")");
      }
    }
    return new Layout(getName(), model, stageOf, stages);
  }

  static ResourceExhaustionException exhausted(LayoutNode node,
          int earliest, List<StageState> stages, ResourceModel model) {
    String detail;
    if (earliest >= model.stages) {
      detail = "dependences need stage " + earliest + " but there are only "
             + model.stages + " stages";
    } else {
      StageState last = stages.get(model.stages - 1);
      detail = "no room in stages " + earliest + " to " + (model.stages - 1)
             + ", last " + last + " " + last.whyNot(node);
    }
    return new ResourceExhaustionException("layout", node.label,
                                    Math.min(earliest, model.stages - 1), detail);
  }
}
