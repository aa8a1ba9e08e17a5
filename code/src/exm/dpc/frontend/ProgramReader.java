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
package exm.dpc.frontend;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import exm.dpc.common.exceptions.InvalidSyntaxException;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.FilePosition;
import exm.dpc.common.lang.Var;
import exm.dpc.common.util.StackLite;
import exm.dpc.ic.tree.Conditionals.IfStatement;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.ICTree.TableDecl;
import exm.dpc.ic.tree.Opcode;
import exm.dpc.ic.tree.Pattern;

/**
 * Reads the line-oriented text form of a normalized handler, e.g.
 * <pre>
 * register count 32 0
 * local x 32
 * table route 32 fwd,drop
 * handler main {
 *   x = add x 1
 *   match x {
 *     case 1 {
 *       reg_set count x
 *     }
 *   }
 * }
 * </pre>
 * One declaration or statement per line; '#' starts a comment.
 */
public class ProgramReader {
  private static final java.util.regex.Pattern NAME =
                    java.util.regex.Pattern.compile("[A-Za-z_][A-Za-z0-9_~.]*");

  private final String fileName;
  private Program program = null;
  private boolean handlerDone = false;
  private int lineNum = 0;

  private final StackLite<Frame> frames = new StackLite<Frame>();

  private static enum FrameKind {
    BLOCK,
    IF_THEN,
    IF_ELSE,
    MATCH,
  }

  /** An open brace */
  private static class Frame {
    final FrameKind kind;
    final Block block;
    final Statement stmt;

    Frame(FrameKind kind, Block block, Statement stmt) {
      this.kind = kind;
      this.block = block;
      this.stmt = stmt;
    }
  }

  private final List<Var> pendingVars = new ArrayList<Var>();
  private final List<TableDecl> pendingTables = new ArrayList<TableDecl>();

  private ProgramReader(String fileName) {
    this.fileName = fileName;
  }

  public static Program readFile(File file)
                        throws IOException, InvalidSyntaxException {
    List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    return parse(file.getPath(), lines);
  }

  public static Program parse(String fileName, String text)
                                    throws InvalidSyntaxException {
    return parse(fileName, Arrays.asList(text.split("\r?\n", -1)));
  }

  public static Program parse(String fileName, List<String> lines)
                                    throws InvalidSyntaxException {
    ProgramReader reader = new ProgramReader(fileName);
    for (String line: lines) {
      reader.lineNum++;
      reader.parseLine(line);
    }
    return reader.finish();
  }

  private Program finish() throws InvalidSyntaxException {
    if (!frames.isEmpty()) {
      throw error("unexpected end of file: missing }");
    }
    if (program == null) {
      throw error("no handler defined");
    }
    return program;
  }

  private void parseLine(String line) throws InvalidSyntaxException {
    int comment = line.indexOf('#');
    if (comment >= 0) {
      line = line.substring(0, comment);
    }
    String tokens[] = StringUtils.split(line);
    if (tokens.length == 0) {
      return;
    }

    if (frames.isEmpty()) {
      parseTopLevel(tokens);
      return;
    }

    Frame top = frames.peek();
    if (top.kind == FrameKind.MATCH) {
      parseMatchBody(tokens, (MatchStatement)top.stmt);
    } else if (tokens[0].equals("}")) {
      parseClose(tokens, top);
    } else if (tokens[0].equals("if")) {
      expectOpenBrace(tokens, 3);
      IfStatement ifStmt = new IfStatement(parseArg(tokens[1]));
      add(top.block, ifStmt);
      frames.push(new Frame(FrameKind.IF_THEN, ifStmt.thenBlock(), ifStmt));
    } else if (tokens[0].equals("match")) {
      if (tokens.length < 3) {
        throw error("match needs at least one key");
      }
      expectOpenBrace(tokens, tokens.length);
      List<Arg> keys = new ArrayList<Arg>();
      for (int i = 1; i < tokens.length - 1; i++) {
        keys.add(parseArg(tokens[i]));
      }
      MatchStatement match = new MatchStatement(keys);
      add(top.block, match);
      frames.push(new Frame(FrameKind.MATCH, null, match));
    } else {
      add(top.block, parseInstruction(tokens));
    }
  }

  private void parseTopLevel(String tokens[]) throws InvalidSyntaxException {
    if (handlerDone) {
      throw error("unexpected text after handler: " + tokens[0]);
    }
    String kw = tokens[0];
    if (kw.equals("register")) {
      checkTokens(tokens, 3, 4);
      long init = tokens.length == 4 ? parseLong(tokens[3]) : 0;
      pendingVars.add(Var.register(parseName(tokens[1]),
                                   parseWidth(tokens[2]), init));
    } else if (kw.equals("local")) {
      checkTokens(tokens, 3, 3);
      pendingVars.add(Var.local(parseName(tokens[1]), parseWidth(tokens[2])));
    } else if (kw.equals("table")) {
      checkTokens(tokens, 4, 4);
      List<Integer> widths = new ArrayList<Integer>();
      for (String w: StringUtils.split(tokens[2], ',')) {
        widths.add(parseWidth(w));
      }
      List<String> actions = new ArrayList<String>();
      for (String a: StringUtils.split(tokens[3], ',')) {
        actions.add(parseName(a));
      }
      pendingTables.add(new TableDecl(parseName(tokens[1]), widths, actions));
    } else if (kw.equals("handler")) {
      checkTokens(tokens, 3, 3);
      expectOpenBrace(tokens, 3);
      program = new Program(fileName, parseName(tokens[1]));
      for (Var v: pendingVars) {
        if (!program.addGlobal(v)) {
          throw error("variable " + v.name() + " declared twice");
        }
      }
      for (TableDecl t: pendingTables) {
        if (!program.addTable(t)) {
          throw error("table " + t.name() + " declared twice");
        }
      }
      frames.push(new Frame(FrameKind.BLOCK, program.mainBlock(), null));
    } else {
      throw error("expected declaration or handler but got " + kw);
    }
  }

  private void parseMatchBody(String tokens[], MatchStatement match)
                                          throws InvalidSyntaxException {
    if (tokens.length == 1 && tokens[0].equals("}")) {
      frames.pop();
      return;
    }
    if (!tokens[0].equals("case")) {
      throw error("expected case or } in match but got " + tokens[0]);
    }
    expectOpenBrace(tokens, tokens.length);
    int size = tokens.length - 2;
    if (size != match.getKeys().size()) {
      throw error("case has " + size + " patterns but match has " +
                  match.getKeys().size() + " keys");
    }
    List<Long> elems = new ArrayList<Long>();
    for (int i = 1; i < tokens.length - 1; i++) {
      if (tokens[i].equals(Pattern.WILDCARD)) {
        elems.add(null);
      } else {
        elems.add(parseLong(tokens[i]));
      }
    }
    Block caseBlock = new Block();
    match.addCase(new Pattern(elems), caseBlock);
    frames.push(new Frame(FrameKind.BLOCK, caseBlock, null));
  }

  private void parseClose(String tokens[], Frame top)
                                      throws InvalidSyntaxException {
    if (tokens.length == 1) {
      frames.pop();
      if (frames.isEmpty()) {
        handlerDone = true;
      }
    } else if (tokens.length == 3 && tokens[1].equals("else") &&
               tokens[2].equals("{")) {
      if (top.kind != FrameKind.IF_THEN) {
        throw error("else without if");
      }
      frames.pop();
      IfStatement ifStmt = (IfStatement)top.stmt;
      frames.push(new Frame(FrameKind.IF_ELSE, ifStmt.elseBlock(), ifStmt));
    } else {
      throw error("unexpected text after }");
    }
  }

  private Instruction parseInstruction(String tokens[])
                                    throws InvalidSyntaxException {
    int eq = Arrays.asList(tokens).indexOf("=");
    List<Var> outs = new ArrayList<Var>();
    int opIx = 0;
    if (eq >= 0) {
      if (eq == 0 || eq == tokens.length - 1) {
        throw error("malformed assignment");
      }
      for (int i = 0; i < eq; i++) {
        outs.add(parseVar(tokens[i]));
      }
      opIx = eq + 1;
    }
    Opcode op = Opcode.fromMnemonic(tokens[opIx]);
    if (op == null) {
      throw error("unknown operation " + tokens[opIx]);
    }
    List<String> argToks = Arrays.asList(tokens).subList(opIx + 1,
                                                         tokens.length);
    Instruction inst;
    switch (op) {
      case ASSIGN:
        checkShape(op, outs, argToks, 1, 1);
        inst = Instruction.assign(outs.get(0), parseArg(argToks.get(0)));
        break;
      case HASH:
      case CHECKSUM: {
        if (outs.size() != 1 || argToks.size() < 2) {
          throw error(op.mnemonic() + " needs one output, a seed " +
                      "and at least one input");
        }
        List<Arg> hashed = new ArrayList<Arg>();
        for (String a: argToks.subList(1, argToks.size())) {
          hashed.add(parseArg(a));
        }
        inst = Instruction.hash(op, outs.get(0), parseLong(argToks.get(0)),
                                hashed);
        break;
      }
      case REG_GET:
        checkShape(op, outs, argToks, 1, 1);
        inst = Instruction.regGet(outs.get(0), parseVar(argToks.get(0)));
        break;
      case REG_SET:
        checkShape(op, outs, argToks, 0, 2);
        inst = Instruction.regSet(parseVar(argToks.get(0)),
                                  parseArg(argToks.get(1)));
        break;
      case REG_UPDATE:
        checkShape(op, outs, argToks, 1, 2);
        inst = Instruction.regUpdate(outs.get(0), parseVar(argToks.get(0)),
                                     parseArg(argToks.get(1)));
        break;
      case TABLE_MATCH: {
        if (argToks.isEmpty()) {
          throw error("table_match needs a table name");
        }
        List<Arg> keys = new ArrayList<Arg>();
        for (String a: argToks.subList(1, argToks.size())) {
          keys.add(parseArg(a));
        }
        inst = Instruction.tableMatch(outs, parseName(argToks.get(0)), keys);
        break;
      }
      default:
        assert(op.isBinaryOp()) : op;
        checkShape(op, outs, argToks, 1, 2);
        inst = Instruction.binaryOp(op, outs.get(0),
                    parseArg(argToks.get(0)), parseArg(argToks.get(1)));
        break;
    }
    return inst;
  }

  private void checkShape(Opcode op, List<Var> outs, List<String> args,
              int expectedOuts, int expectedArgs)
                  throws InvalidSyntaxException {
    if (outs.size() != expectedOuts || args.size() != expectedArgs) {
      throw error(op.mnemonic() + " takes " + expectedOuts + " outputs and "
          + expectedArgs + " arguments, got " + outs.size() + " and "
          + args.size());
    }
  }

  private void add(Block block, Statement stmt) {
    stmt.setPos(new FilePosition(fileName, lineNum));
    block.addStatement(stmt);
  }

  private void expectOpenBrace(String tokens[], int length)
                                  throws InvalidSyntaxException {
    if (tokens.length != length || !tokens[length - 1].equals("{")) {
      throw error("expected { at end of " + tokens[0]);
    }
  }

  private void checkTokens(String tokens[], int min, int max)
                                  throws InvalidSyntaxException {
    if (tokens.length < min || tokens.length > max) {
      throw error("wrong number of fields for " + tokens[0]);
    }
  }

  private String parseName(String tok) throws InvalidSyntaxException {
    if (!NAME.matcher(tok).matches()) {
      throw error("invalid name: " + tok);
    }
    return tok;
  }

  private int parseWidth(String tok) throws InvalidSyntaxException {
    long w = parseLong(tok);
    if (w <= 0 || w > 128) {
      throw error("width must be between 1 and 128: " + tok);
    }
    return (int)w;
  }

  private long parseLong(String tok) throws InvalidSyntaxException {
    try {
      return Long.decode(tok);
    } catch (NumberFormatException e) {
      throw error("invalid integer: " + tok);
    }
  }

  private Var parseVar(String tok) throws InvalidSyntaxException {
    Var v = program.lookupVar(parseName(tok));
    if (v == null) {
      throw error("undeclared variable " + tok);
    }
    return v;
  }

  private Arg parseArg(String tok) throws InvalidSyntaxException {
    char c = tok.charAt(0);
    if (Character.isDigit(c) || c == '-') {
      return Arg.newInt(parseLong(tok));
    }
    return Arg.newVar(parseVar(tok));
  }

  private InvalidSyntaxException error(String msg) {
    return new InvalidSyntaxException(fileName, lineNum, msg);
  }
}
