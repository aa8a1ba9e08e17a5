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
 * Legacy layout strategy: fill one stage at a time.  For each stage,
 * repeatedly sweep the unplaced nodes in id order and add every node
 * whose predecessors allow it in this stage and that still fits, until a
 * sweep adds nothing.  Then move on to the next stage.
 */
public class ListLayout implements LayoutStrategy {

  @Override
  public String getName() {
    return Settings.STRATEGY_LEGACY;
  }

  @Override
  public Layout layout(Logger logger, LayoutProblem problem)
                                  throws ResourceExhaustionException {
    ResourceModel model = problem.model();
    List<StageState> stages = new ArrayList<StageState>(model.stages);
    int stageOf[] = new int[problem.size()];
    Arrays.fill(stageOf, -1);
    int placed = 0;

    for (int id = 0; id < problem.size(); id++) {
      LayoutNode node = problem.node(id);
      if (!problem.fitsEmptyStage(node)) {
        throw new ResourceExhaustionException("layout", node.label, -1,
            "needs more than a whole stage: " + node.demand());
      }
    }

    for (int s = 0; s < model.stages; s++) {
      StageState stage = new StageState(s, problem);
      stages.add(stage);
      boolean progress = true;
      while (progress && placed < problem.size()) {
        progress = false;
        for (int id = 0; id < problem.size(); id++) {
          if (stageOf[id] >= 0) {
            continue;
          }
          int earliest = problem.earliestStage(id, stageOf);
          LayoutNode node = problem.node(id);
          if (earliest >= 0 && earliest <= s && stage.fits(node)) {
            stage.place(node);
            stageOf[id] = s;
            placed++;
            progress = true;
            if (logger.isTraceEnabled()) {
              logger.trace("Placed " + node + " in stage " + s);
            }
          }
        }
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Filled stage " + s + ": " + stage);
      }
    }

    if (placed < problem.size()) {
      // Report first node in dependency order that could not be placed
      for (int id: problem.topologicalOrder()) {
        if (stageOf[id] < 0) {
          int earliest = problem.earliestStage(id, stageOf);
          if (earliest < 0) {
            earliest = model.stages;
          }
          throw AsapLayout.exhausted(problem.node(id), earliest, stages,
                                     model);
        }
      }
    }
    return new Layout(getName(), model, stageOf, stages);
  }
}
