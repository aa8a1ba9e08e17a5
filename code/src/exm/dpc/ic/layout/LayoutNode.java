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

import exm.dpc.common.lang.Var;

/**
 * A statement as seen by the layout strategies: its resource demand and
 * the table group it is charged to.
 */
public class LayoutNode {
  public static final String ROOT_GROUP = "root";

  public final int id;
  public final String label;
  /**
   * Statements in the same group and stage share a table.  Null for
   * nodes that need no table.
   */
  public final String group;
  /** Key width of the group's table */
  public final int groupKeyWidth;
  public final int alu;
  public final int hash;
  public final List<Var> regReads;
  public final List<Var> regWrites;

  public LayoutNode(int id, String label, String group, int groupKeyWidth,
                    int alu, int hash, List<Var> regReads,
                    List<Var> regWrites) {
    this.id = id;
    this.label = label;
    this.group = group;
    this.groupKeyWidth = groupKeyWidth;
    this.alu = alu;
    this.hash = hash;
    this.regReads = Collections.unmodifiableList(
                                  new ArrayList<Var>(regReads));
    this.regWrites = Collections.unmodifiableList(
                                  new ArrayList<Var>(regWrites));
  }

  /**
   * Branches are evaluated as part of the tables of the statements
   * inside them, so have no demand of their own
   */
  public static LayoutNode branch(int id, String label) {
    return new LayoutNode(id, label, null, 0, 0, 0, Var.NONE, Var.NONE);
  }

  public boolean needsTable() {
    return group != null;
  }

  public String demand() {
    return "table " + group + " (" + groupKeyWidth + " key bits), "
        + alu + " register ALU, " + hash + " hash";
  }

  @Override
  public String toString() {
    return label;
  }
}
