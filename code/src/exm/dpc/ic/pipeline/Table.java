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
import java.util.Collections;
import java.util.List;

import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.ICTree.TableDecl;

/**
 * A match-action table placed in one stage
 */
public class Table {
  public static enum TableKind {
    /** Table generated to evaluate branches, rules fixed at compile time */
    ACTION,
    /** Call of a user table, rules installed by the control plane */
    CALL,
  }

  private final String name;
  private final int stage;
  private final TableKind kind;
  private final List<Arg> keys;
  private final int keyWidth;
  private final List<Integer> statements;
  private final ArrayList<Rule> rules = new ArrayList<Rule>();

  // Only for CALL tables
  private final TableDecl callee;
  private final List<Var> outputs;
  private final Guard guard;

  private Table(String name, int stage, TableKind kind, List<Arg> keys,
                int keyWidth, List<Integer> statements, TableDecl callee,
                List<Var> outputs, Guard guard) {
    this.name = name;
    this.stage = stage;
    this.kind = kind;
    this.keys = Collections.unmodifiableList(new ArrayList<Arg>(keys));
    this.keyWidth = keyWidth;
    this.statements = Collections.unmodifiableList(
                                  new ArrayList<Integer>(statements));
    this.callee = callee;
    this.outputs = outputs;
    this.guard = guard;
  }

  public static Table actionTable(String name, int stage, List<Arg> keys,
                            int keyWidth, List<Integer> statements) {
    return new Table(name, stage, TableKind.ACTION, keys, keyWidth,
                     statements, null, null, null);
  }

  public static Table callTable(String name, int stage, TableDecl callee,
        List<Arg> keys, List<Var> outputs, Guard guard, int keyWidth,
        int statement) {
    return new Table(name, stage, TableKind.CALL, keys, keyWidth,
                     Collections.singletonList(statement), callee,
                     Collections.unmodifiableList(new ArrayList<Var>(outputs)),
                     guard);
  }

  public String name() {
    return name;
  }

  public int stage() {
    return stage;
  }

  public TableKind kind() {
    return kind;
  }

  public List<Arg> keys() {
    return keys;
  }

  /**
   * @return key bits used in the stage, including any guard keys
   */
  public int keyWidth() {
    return keyWidth;
  }

  /**
   * @return ids of statements implemented by this table
   */
  public List<Integer> statements() {
    return statements;
  }

  public List<Rule> rules() {
    return Collections.unmodifiableList(rules);
  }

  public void addRule(Rule rule) {
    rules.add(rule);
  }

  public void setRule(int i, Rule rule) {
    rules.set(i, rule);
  }

  public TableDecl callee() {
    return callee;
  }

  public List<Var> outputs() {
    return outputs;
  }

  public Guard guard() {
    return guard;
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append("table " + name + " stage " + stage);
    if (kind == TableKind.CALL) {
      sb.append(" call " + callee.name() + "(");
      appendArgs(sb, keys);
      sb.append(")");
      if (!outputs.isEmpty()) {
        sb.append(" ->");
        for (Var out: outputs) {
          sb.append(" " + out.name());
        }
      }
      sb.append(" actions " + callee.actions());
      sb.append(" guard " + guard + "\n");
      return;
    }
    sb.append(" key (");
    appendArgs(sb, keys);
    sb.append(") {\n");
    for (Rule r: rules) {
      sb.append("  " + r + "\n");
    }
    sb.append("}\n");
  }

  private static void appendArgs(StringBuilder sb, List<Arg> args) {
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(args.get(i));
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
