package exm.dpc.ic.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.DiagnosticSink;
import exm.dpc.common.Logging;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.UnsupportedConstructException;
import exm.dpc.common.exceptions.UserException;
import exm.dpc.ic.PipelineBackend;
import exm.dpc.ic.Programs;
import exm.dpc.ic.pipeline.Table.TableKind;
import exm.dpc.ic.tree.Opcode;

public class ActionFormTest {

  @Test
  public void testBranchTable() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local c 8",
        "local x 32",
        "local y 32",
        "handler h {",
        "  x = add x 1",
        "  match c {",
        "    case 1 {",
        "      y = add y 2",
        "    }",
        "    case 2 {",
        "    }",
        "    case _ {",
        "      y = sub y 3",
        "    }",
        "  }",
        "}");
    assertEquals(2, pipe.tables().size());

    Table root = pipe.tables().get(0);
    assertEquals("s0_root", root.name());
    assertTrue(root.keys().isEmpty());
    assertEquals(Arrays.asList("* -> 1"), rules(root));
    assertEquals(Opcode.ADD, pipe.action(1).body().get(0).op);

    Table branch = pipe.lookupTable("s0_b1");
    assertEquals(TableKind.ACTION, branch.kind());
    assertEquals("[c]", branch.keys().toString());
    assertEquals(8, branch.keyWidth());
    assertEquals(Arrays.asList("1 -> 2", "2 -> 0", "_ -> 3"), rules(branch));
    assertEquals(Opcode.SUB, pipe.action(3).body().get(0).op);
    assertEquals(Arrays.asList(2, 3), branch.statements());
  }

  @Test
  public void testEarlierArmsSkipped() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local a 8",
        "local b 8",
        "local y 32",
        "handler h {",
        "  match a {",
        "    case 1 {",
        "    }",
        "    case _ {",
        "      match b {",
        "        case 5 {",
        "          y = add y 1",
        "        }",
        "      }",
        "    }",
        "  }",
        "}");
    Table t = pipe.lookupTable("s0_b1");
    assertEquals("[a, b]", t.keys().toString());
    assertEquals(16, t.keyWidth());
    // Packets taking the first arm of the outer match must not run the
    // inner action even though they match the wildcard
    assertEquals(Arrays.asList("1 _ -> 0", "_ 5 -> 1"), rules(t));
  }

  @Test
  public void testTrailingNoopsDropped() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local c 8",
        "local y 32",
        "handler h {",
        "  match c {",
        "    case 1 {",
        "      y = add y 1",
        "    }",
        "    case 2 {",
        "    }",
        "    case _ {",
        "    }",
        "  }",
        "}");
    assertEquals(Arrays.asList("1 -> 1"), rules(pipe.lookupTable("s0_b0")));
  }

  @Test
  public void testIfBecomesTable() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local c 1",
        "local y 32",
        "handler h {",
        "  if c {",
        "    y = add y 1",
        "  } else {",
        "    y = sub y 1",
        "  }",
        "}");
    assertEquals(Arrays.asList("0 -> 1", "_ -> 2"),
                 rules(pipe.lookupTable("s0_b0")));
    assertEquals(Opcode.SUB, pipe.action(1).body().get(0).op);
  }

  @Test
  public void testCallTable() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local c 8",
        "local k 32",
        "local o 16",
        "table route 32 fwd,drop",
        "handler h {",
        "  match c {",
        "    case 3 {",
        "      o = table_match route k",
        "    }",
        "  }",
        "}");
    Table call = pipe.lookupTable("route_1");
    assertEquals(TableKind.CALL, call.kind());
    // The call needs the branch decided in an earlier stage
    assertEquals(1, call.stage());
    assertEquals("route", call.callee().name());
    assertEquals("[k]", call.keys().toString());
    assertEquals("[o]", call.outputs().toString());
    assertEquals("c: 3 -> apply", call.guard().toString());
    assertEquals(1, call.guard().size());
    assertEquals("3", call.guard().pattern(0).toString());
    assertTrue(call.guard().applies(0));
    assertEquals(40, call.keyWidth());
    assertEquals(2, pipe.stagesUsed());
  }

  @Test
  public void testTopLevelCall() throws Exception {
    PipelineProgram pipe = compile(CompileOptions.defaults(),
        "local k 32",
        "local o 16",
        "table route 32 fwd,drop",
        "handler h {",
        "  o = table_match route k",
        "}");
    Table call = pipe.lookupTable("route_0");
    assertTrue(call.guard().isAlways());
    assertEquals(0, call.stage());
  }

  @Test
  public void testRegisterKey() throws Exception {
    checkUnsupported(CompileOptions.defaults(), "used as match key",
        "register R 8",
        "local y 32",
        "handler h {",
        "  match R {",
        "    case 1 {",
        "      y = add y 1",
        "    }",
        "  }",
        "}");
  }

  @Test
  public void testRegisterOperand() throws Exception {
    checkUnsupported(CompileOptions.defaults(), "used as plain operand",
        "register R 32",
        "local y 32",
        "handler h {",
        "  y = add R 1",
        "}");
  }

  @Test
  public void testLocalInRegisterOp() throws Exception {
    checkUnsupported(CompileOptions.defaults(), "y is not a register",
        "local y 32",
        "handler h {",
        "  reg_set y 1",
        "}");
  }

  @Test
  public void testUndeclaredTable() throws Exception {
    checkUnsupported(CompileOptions.defaults(), "was not declared",
        "local k 32",
        "handler h {",
        "  table_match nosuch k",
        "}");
  }

  @Test
  public void testTableKeyCount() throws Exception {
    checkUnsupported(CompileOptions.defaults(), "has 1 keys but",
        "local k 32",
        "table route 32 fwd",
        "handler h {",
        "  table_match route k k",
        "}");
  }

  @Test
  public void testCallDepth() throws Exception {
    CompileOptions opts = CompileOptions.defaults().with(
                                Settings.LAYOUT_MAX_CALL_DEPTH, "0");
    checkUnsupported(opts, "nested under 1 branch decisions",
        "local c 8",
        "local k 32",
        "table route 32 fwd",
        "handler h {",
        "  match c {",
        "    case 1 {",
        "      table_match route k",
        "    }",
        "  }",
        "}");
  }

  private static void checkUnsupported(CompileOptions opts, String expected,
                                       String ...lines) throws Exception {
    try {
      compile(opts, lines);
      fail("Expected unsupported construct: " + expected);
    } catch (UnsupportedConstructException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expected));
      assertTrue(e.getMessage(), e.getMessage().contains("action formation"));
    }
  }

  static PipelineProgram compile(CompileOptions opts, String ...lines)
                                                   throws UserException {
    PipelineBackend backend = new PipelineBackend(Logging.getDPCLogger(),
                                      opts, DiagnosticSink.NONE);
    return backend.compile(Programs.parse(lines)).pipeline;
  }

  static List<String> rules(Table t) {
    List<String> result = new ArrayList<String>();
    for (Rule r: t.rules()) {
      result.add(r.toString());
    }
    return result;
  }
}
