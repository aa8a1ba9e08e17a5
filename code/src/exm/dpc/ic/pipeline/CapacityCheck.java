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
package exm.dpc.ic.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.ResourceExhaustionException;
import exm.dpc.ic.layout.ResourceModel;
import exm.dpc.ic.layout.StageUsage;

/**
 * Final check of per-stage resources on the lowered program.  Actions
 * shared between rules or tables in a stage are only counted once.
 */
public class CapacityCheck {

  private CapacityCheck() {
    // static methods only
  }

  public static List<StageUsage> usage(PipelineProgram program,
                                       int numStages) {
    List<StageUsage> usage = new ArrayList<StageUsage>(numStages);
    for (int s = 0; s < numStages; s++) {
      usage.add(new StageUsage());
    }
    for (Table t: program.tables()) {
      usage.get(t.stage()).addTable(t.keyWidth());
    }
    for (Action a: program.actions()) {
      if (!a.isNoop()) {
        StageUsage u = usage.get(a.stage());
        u.alu += a.aluSlots();
        u.hash += a.hashUnits();
      }
    }
    return usage;
  }

  public static void check(Logger logger, ResourceModel model,
        PipelineProgram program) throws ResourceExhaustionException {
    int used = program.stagesUsed();
    if (used > model.stages) {
      throw new ResourceExhaustionException("capacity check", null,
          used - 1, "only " + model.stages + " stages available");
    }
    List<StageUsage> usage = usage(program, model.stages);
    for (int s = 0; s < usage.size(); s++) {
      String over = usage.get(s).overCapacity(model);
      if (over != null) {
        throw new ResourceExhaustionException("capacity check", null, s,
                                              over);
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Stage " + s + ": " + usage.get(s));
      }
    }
    logger.debug("Capacity check passed for " + used + " stages");
  }
}
