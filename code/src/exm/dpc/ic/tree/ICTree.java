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
package exm.dpc.ic.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.FilePosition;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.tree.Conditionals.Conditional;
import exm.dpc.ic.tree.ICInstructions.Instruction;

/**
 * This has the definitions for the top-level constructs of the
 * normalized program handed to the backend: the handler body with its
 * globals and table declarations.
 *
 * The tree looks like:
 *
 * Program -> Var (local or register)
 *         -> TableDecl
 *         -> Block (handler body)
 *
 * Block -> Instruction
 *       -> Instruction
 *       -> Conditional  -> Block (one per arm)
 *                       -> Block
 *       -> Instruction
 *
 * The program is loop-free: control flow only branches and rejoins.
 */
public class ICTree {

  public static final String indent = "  ";

  public static class Program {
    private final String fileName;
    private final String handlerName;

    private final Map<String, Var> globals = new LinkedHashMap<String, Var>();
    private final Map<String, TableDecl> tables =
                                    new LinkedHashMap<String, TableDecl>();

    private final Block mainBlock = new Block();

    /** Statements indexed by id, valid after renumber() */
    private final ArrayList<Statement> statements = new ArrayList<Statement>();

    private int freshCounter = 0;

    public Program(String fileName, String handlerName) {
      this.fileName = fileName;
      this.handlerName = handlerName;
    }

    public String getFileName() {
      return fileName;
    }

    public String getHandlerName() {
      return handlerName;
    }

    public Block mainBlock() {
      return mainBlock;
    }

    /**
     * @return false if a variable with the name already exists
     */
    public boolean addGlobal(Var v) {
      if (globals.containsKey(v.name())) {
        return false;
      }
      globals.put(v.name(), v);
      return true;
    }

    public Var lookupVar(String name) {
      return globals.get(name);
    }

    public Collection<Var> getVars() {
      return Collections.unmodifiableCollection(globals.values());
    }

    /**
     * @return false if a table with the name already exists
     */
    public boolean addTable(TableDecl table) {
      if (tables.containsKey(table.name())) {
        return false;
      }
      tables.put(table.name(), table);
      return true;
    }

    public TableDecl lookupTable(String name) {
      return tables.get(name);
    }

    /**
     * Create and declare a new local variable with unique name
     */
    public Var createLocal(String prefix, int width) {
      String name;
      do {
        freshCounter++;
        name = prefix + "~" + freshCounter;
      } while (globals.containsKey(name));
      Var v = Var.local(name, width);
      addGlobal(v);
      return v;
    }

    /**
     * Assign every statement a unique id in pre-order, i.e. source
     * order with each conditional ahead of its arms.  Ids are dense
     * and index the node arrays of all graphs built afterwards.
     */
    public void renumber() {
      statements.clear();
      renumberRec(mainBlock);
    }

    private void renumberRec(Block block) {
      for (Statement stmt: block.getStatements()) {
        stmt.setId(statements.size());
        statements.add(stmt);
        if (stmt.type() == StatementType.CONDITIONAL) {
          for (Block arm: stmt.conditional().getArms()) {
            renumberRec(arm);
          }
        }
      }
    }

    public int statementCount() {
      return statements.size();
    }

    public List<Statement> statements() {
      return Collections.unmodifiableList(statements);
    }

    public Statement getStatement(int id) {
      if (id < 0 || id >= statements.size()) {
        throw new InternalInvariantError("No statement with id " + id +
            " (" + statements.size() + " statements numbered)");
      }
      return statements.get(id);
    }

    public void prettyPrint(StringBuilder out) {
      for (Var v: globals.values()) {
        if (v.isRegister()) {
          out.append("register " + v.name() + " " + v.width() + " "
                     + v.initVal() + "\n");
        } else {
          out.append("local " + v.name() + " " + v.width() + "\n");
        }
      }
      for (TableDecl t: tables.values()) {
        t.prettyPrint(out);
      }
      out.append("handler " + handlerName + " {\n");
      mainBlock.prettyPrint(out, indent);
      out.append("}\n");
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  /**
   * Declaration of a user table, applied with a table_match instruction.
   * Its rules are installed at run time by the control plane.
   */
  public static class TableDecl {
    private final String name;
    private final List<Integer> keyWidths;
    private final List<String> actions;

    public TableDecl(String name, List<Integer> keyWidths,
                     List<String> actions) {
      this.name = name;
      this.keyWidths = new ArrayList<Integer>(keyWidths);
      this.actions = new ArrayList<String>(actions);
    }

    public String name() {
      return name;
    }

    public List<Integer> keyWidths() {
      return Collections.unmodifiableList(keyWidths);
    }

    /**
     * @return total key width in bits
     */
    public int keyWidth() {
      int total = 0;
      for (int w: keyWidths) {
        total += w;
      }
      return total;
    }

    public List<String> actions() {
      return Collections.unmodifiableList(actions);
    }

    public void prettyPrint(StringBuilder sb) {
      sb.append("table " + name + " ");
      for (int i = 0; i < keyWidths.size(); i++) {
        if (i > 0) sb.append(",");
        sb.append(keyWidths.get(i));
      }
      sb.append(" ");
      for (int i = 0; i < actions.size(); i++) {
        if (i > 0) sb.append(",");
        sb.append(actions.get(i));
      }
      sb.append("\n");
    }
  }

  public static class Block {
    private final ArrayList<Statement> statements = new ArrayList<Statement>();

    public List<Statement> getStatements() {
      return Collections.unmodifiableList(statements);
    }

    public void addStatement(Statement stmt) {
      statements.add(stmt);
    }

    public void replaceStatements(List<Statement> newStatements) {
      statements.clear();
      statements.addAll(newStatements);
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }

    public void prettyPrint(StringBuilder sb, String currentIndent) {
      for (Statement stmt: statements) {
        stmt.prettyPrint(sb, currentIndent);
      }
    }
  }

  public static enum StatementType {
    INSTRUCTION,
    CONDITIONAL,
  }

  /**
   * An atomic instruction or a conditional.  Read and write sets are
   * those of the statement itself, not of nested statements.
   */
  public static abstract class Statement {
    private int id = -1;
    private FilePosition pos = null;

    public abstract StatementType type();

    public Instruction instruction() {
      throw new InternalInvariantError("Not an instruction: " + this);
    }

    public Conditional conditional() {
      throw new InternalInvariantError("Not a conditional: " + this);
    }

    /**
     * @return unique id, or -1 if not yet numbered
     */
    public int id() {
      return id;
    }

    void setId(int id) {
      this.id = id;
    }

    public FilePosition pos() {
      return pos;
    }

    public void setPos(FilePosition pos) {
      this.pos = pos;
    }

    public abstract List<Var> getReads();

    public abstract List<Var> getWrites();

    public abstract void prettyPrint(StringBuilder sb, String indent);

    /**
     * @return short single-line description for diagnostics
     */
    public String label() {
      String full = summary();
      full = full.substring(0, Math.min(40, full.length()));
      return "s" + id + ": " + full;
    }

    protected abstract String summary();
  }
}
