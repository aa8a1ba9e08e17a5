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

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.graph.ControlDependence.Decision;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;

/**
 * Variables read and written by each statement, and the inverse maps
 * from variable to the statements reading and writing it.
 */
public class UseDefMap {
  private final List<List<Var>> reads;
  private final List<List<Var>> writes;

  /** Insertion ordered to keep edge order deterministic */
  private final SetMultimap<Var, Integer> readers = LinkedHashMultimap.create();
  private final SetMultimap<Var, Integer> writers = LinkedHashMultimap.create();

  public UseDefMap(int size) {
    reads = new ArrayList<List<Var>>(size);
    writes = new ArrayList<List<Var>>(size);
    for (int i = 0; i < size; i++) {
      reads.add(null);
      writes.add(null);
    }
  }

  /**
   * Build from numbered program.  The reads of a statement include the
   * keys of all enclosing branches, since a statement placed in a later
   * stage than its branch has to match those keys again.
   */
  public static UseDefMap build(Program program, ControlDependence cdg) {
    UseDefMap map = new UseDefMap(program.statementCount());
    for (Statement stmt: program.statements()) {
      List<Var> stmtReads = new ArrayList<Var>(stmt.getReads());
      for (Decision d: cdg.decisions(stmt.id())) {
        Statement branch = program.getStatement(d.branch);
        for (Var key: Arg.varsOf(branch.conditional().getKeys())) {
          if (!stmtReads.contains(key)) {
            stmtReads.add(key);
          }
        }
      }
      map.put(stmt.id(), stmtReads, stmt.getWrites());
    }
    return map;
  }

  public void put(int node, List<Var> nodeReads, List<Var> nodeWrites) {
    if (node < 0 || node >= reads.size()) {
      throw new InternalInvariantError("Node " + node + " out of range");
    }
    reads.set(node, Collections.unmodifiableList(
                                 new ArrayList<Var>(nodeReads)));
    writes.set(node, Collections.unmodifiableList(
                                 new ArrayList<Var>(nodeWrites)));
    for (Var v: nodeReads) {
      readers.put(v, node);
    }
    for (Var v: nodeWrites) {
      writers.put(v, node);
    }
  }

  public int size() {
    return reads.size();
  }

  public List<Var> getReads(int node) {
    return checkEntry(node, reads);
  }

  public List<Var> getWrites(int node) {
    return checkEntry(node, writes);
  }

  private List<Var> checkEntry(int node, List<List<Var>> entries) {
    if (node < 0 || node >= entries.size() || entries.get(node) == null) {
      throw new InternalInvariantError("Statement " + node + " missing " +
                                       "from use/def map");
    }
    return entries.get(node);
  }

  public List<Integer> readers(Var v) {
    return new ArrayList<Integer>(readers.get(v));
  }

  public List<Integer> writers(Var v) {
    return new ArrayList<Integer>(writers.get(v));
  }
}
