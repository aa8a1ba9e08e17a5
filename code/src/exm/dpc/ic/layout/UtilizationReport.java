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

import org.apache.commons.lang3.StringUtils;

/**
 * Per-stage resource utilization of a layout, for tuning the resource
 * model and comparing layout strategies.
 */
public class UtilizationReport {
  private final String strategy;
  private final ResourceModel model;
  private final List<StageUsage> usage;
  private final List<Integer> nodeCounts;
  private final int stagesUsed;

  public UtilizationReport(String strategy, ResourceModel model,
                           List<StageState> stages, int stagesUsed) {
    this.strategy = strategy;
    this.model = model;
    this.stagesUsed = stagesUsed;
    List<StageUsage> u = new ArrayList<StageUsage>();
    List<Integer> counts = new ArrayList<Integer>();
    for (StageState s: stages) {
      u.add(s.usage());
      counts.add(s.nodes().size());
    }
    this.usage = Collections.unmodifiableList(u);
    this.nodeCounts = Collections.unmodifiableList(counts);
  }

  public int stagesUsed() {
    return stagesUsed;
  }

  public StageUsage stageUsage(int stage) {
    return usage.get(stage);
  }

  public String summary() {
    int tables = 0;
    for (StageUsage u: usage) {
      tables += u.tables;
    }
    return "layout (" + strategy + ") uses " + stagesUsed + " of " +
            model.stages + " stages with " + tables + " tables";
  }

  /**
   * @return table with one row per stage
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append(summary() + "\n");
    sb.append(row("stage", "stmts", "tables", "key bits", "alu", "hash"));
    for (int s = 0; s < usage.size(); s++) {
      StageUsage u = usage.get(s);
      sb.append(row(Integer.toString(s), nodeCounts.get(s).toString(),
                    u.tables + "/" + model.maxTables,
                    u.keyWidth + "/" + model.maxKeyWidth,
                    u.alu + "/" + model.maxAlu,
                    u.hash + "/" + model.maxHash));
    }
    return sb.toString();
  }

  private static String row(String ...cols) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cols.length; i++) {
      sb.append(i == 0 ? StringUtils.rightPad(cols[i], 6)
                       : StringUtils.leftPad(cols[i], 10));
    }
    sb.append("\n");
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
