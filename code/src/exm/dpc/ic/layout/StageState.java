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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.dpc.common.lang.Var;

/**
 * Resources used so far in one stage.
 *
 * Register accesses follow a conservative rule: a stage never holds two
 * writers of the same register, nor a writer and a reader of the same
 * register, since the order of evaluation within a stage is not known.
 * Accesses from mutually exclusive branch arms are exempt, since at most
 * one of them runs for any packet.
 */
public class StageState {
  public final int stage;
  private final LayoutProblem problem;
  private final ResourceModel model;
  private final StageUsage usage = new StageUsage();
  private final Set<String> groups = new LinkedHashSet<String>();
  /** Register -> ids of nodes in this stage accessing it */
  private final SetMultimap<Var, Integer> regReaders =
                                            LinkedHashMultimap.create();
  private final SetMultimap<Var, Integer> regWriters =
                                            LinkedHashMultimap.create();
  private final List<Integer> nodes = new ArrayList<Integer>();

  public StageState(int stage, LayoutProblem problem) {
    this.stage = stage;
    this.problem = problem;
    this.model = problem.model();
  }

  public boolean fits(LayoutNode node) {
    return whyNot(node) == null;
  }

  /**
   * @return reason the node does not fit, or null if it fits
   */
  public String whyNot(LayoutNode node) {
    if (opensTable(node)) {
      if (usage.tables + 1 > model.maxTables) {
        return "no table left";
      }
      if (usage.keyWidth + node.groupKeyWidth > model.maxKeyWidth) {
        return "no key width left for " + node.groupKeyWidth + " bits";
      }
    }
    if (usage.alu + node.alu > model.maxAlu) {
      return "no register ALU left";
    }
    if (usage.hash + node.hash > model.maxHash) {
      return "no hash unit left";
    }
    for (Var w: node.regWrites) {
      if (conflicts(node, regWriters.get(w))
          || conflicts(node, regReaders.get(w))) {
        return "register " + w.name() + " already accessed";
      }
    }
    for (Var r: node.regReads) {
      if (conflicts(node, regWriters.get(r))) {
        return "register " + r.name() + " already written";
      }
    }
    return null;
  }

  private boolean conflicts(LayoutNode node, Set<Integer> accessors) {
    for (int other: accessors) {
      if (!problem.mutuallyExclusive(node.id, other)) {
        return true;
      }
    }
    return false;
  }

  private boolean opensTable(LayoutNode node) {
    return node.needsTable() && !groups.contains(node.group);
  }

  public void place(LayoutNode node) {
    assert(fits(node)) : node + " " + this;
    if (opensTable(node)) {
      groups.add(node.group);
      usage.addTable(node.groupKeyWidth);
    }
    usage.alu += node.alu;
    usage.hash += node.hash;
    for (Var r: node.regReads) {
      regReaders.put(r, node.id);
    }
    for (Var w: node.regWrites) {
      regWriters.put(w, node.id);
    }
    nodes.add(node.id);
  }

  public StageUsage usage() {
    return usage;
  }

  public List<Integer> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  @Override
  public String toString() {
    return "stage " + stage + " [" + usage + "]";
  }
}
