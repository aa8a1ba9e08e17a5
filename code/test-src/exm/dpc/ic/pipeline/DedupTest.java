package exm.dpc.ic.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Logging;
import exm.dpc.common.Settings;
import exm.dpc.common.lang.Arg;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.layout.ResourceModel;
import exm.dpc.ic.tree.ICInstructions.Instruction;
import exm.dpc.ic.tree.Opcode;

public class DedupTest {

  private static final Logger logger = Logging.getDPCLogger();

  private static final String[] TWO_HASHES = {
    "local c 8",
    "local d 8",
    "local x 32",
    "local y 32",
    "local p 32",
    "local q 32",
    "local h1 32",
    "local h2 32",
    "handler h {",
    "  match c {",
    "    case 1 {",
    "      h1 = hash 7 x y",
    "    }",
    "  }",
    "  match d {",
    "    case 1 {",
    "      h2 = hash 7 p q",
    "    }",
    "  }",
    "}",
  };

  private static CompileOptions noDedup() throws Exception {
    return CompileOptions.defaults().with(Settings.OPT_DEDUP, "false");
  }

  @Test
  public void testMergeSameShape() throws Exception {
    PipelineProgram pipe = ActionFormTest.compile(noDedup(), TWO_HASHES);
    assertEquals(3, pipe.actions().size());

    int removed = Dedup.dedup(logger, noDedup(), pipe);
    assertEquals(1, removed);
    assertEquals(2, pipe.actions().size());

    Action kept = pipe.action(1);
    assertEquals("[h1, x, y]", kept.params().toString());

    Table first = pipe.lookupTable("s0_b0");
    Table second = pipe.lookupTable("s0_b2");
    assertEquals(Arrays.asList("1 -> 1 [h1=h1, x=x, y=y]"),
                 ActionFormTest.rules(first));
    assertEquals(Arrays.asList("1 -> 1 [h1=h2, x=p, y=q]"),
                 ActionFormTest.rules(second));
    CapacityCheck.check(logger, new ResourceModel(
                                          12, 16, 4, 512, 1), pipe);
  }

  @Test
  public void testIdempotent() throws Exception {
    PipelineProgram pipe = ActionFormTest.compile(noDedup(), TWO_HASHES);
    Dedup.dedup(logger, noDedup(), pipe);
    String once = pipe.toString();
    assertEquals(0, Dedup.dedup(logger, noDedup(), pipe));
    assertEquals(once, pipe.toString());
  }

  @Test
  public void testNoMergeAcrossStages() throws Exception {
    PipelineProgram pipe = ActionFormTest.compile(noDedup(),
        "local c 8",
        "local d 8",
        "local x 32",
        "local y 32",
        "local q 32",
        "local h1 32",
        "local h2 32",
        "handler h {",
        "  match c {",
        "    case 1 {",
        "      h1 = hash 7 x y",
        "    }",
        "  }",
        "  match d {",
        "    case 1 {",
        "      h2 = hash 7 h1 q",
        "    }",
        "  }",
        "}");
    assertNotEquals(pipe.action(1).stage(), pipe.action(2).stage());
    assertEquals(0, Dedup.dedup(logger, noDedup(), pipe));
  }

  @Test
  public void testPlainActionsOnlyWhenAsked() throws Exception {
    String lines[] = {
      "local c 8",
      "local d 8",
      "local x 32",
      "local y 32",
      "handler h {",
      "  match c {",
      "    case 1 {",
      "      x = add x 1",
      "    }",
      "  }",
      "  match d {",
      "    case 1 {",
      "      y = add y 1",
      "    }",
      "  }",
      "}",
    };
    PipelineProgram pipe = ActionFormTest.compile(noDedup(), lines);
    assertEquals(0, Dedup.dedup(logger, noDedup(), pipe));

    CompileOptions all = noDedup().with(Settings.OPT_DEDUP_ALL, "true");
    assertEquals(1, Dedup.dedup(logger, all, pipe));
    assertEquals(Arrays.asList("1 -> 1 [x=y]"),
                 ActionFormTest.rules(pipe.lookupTable("s0_b2")));
  }

  @Test
  public void testDifferentConstantsNotMerged() throws Exception {
    Var x = Var.local("x", 32);
    Var y = Var.local("y", 32);
    Action a = new Action(1, 0, Var.NONE, Arrays.asList(Instruction.hash(
        Opcode.HASH, x, 7, Arrays.asList(Arg.newVar(y)))));
    Action b = new Action(2, 0, Var.NONE, Arrays.asList(Instruction.hash(
        Opcode.HASH, y, 8, Arrays.asList(Arg.newVar(x)))));
    assertNotEquals(Dedup.signature(a), Dedup.signature(b));
    assertEquals(Arrays.asList(x, y), Dedup.locals(a));
  }

  @Test
  public void testRegistersKeptByName() throws Exception {
    Var r = Var.register("R", 32, 0);
    Var s = Var.register("S", 32, 0);
    Var v = Var.local("v", 32);
    Action a = new Action(1, 0, Var.NONE, Arrays.asList(
                              Instruction.regGet(v, r)));
    Action b = new Action(2, 0, Var.NONE, Arrays.asList(
                              Instruction.regGet(v, s)));
    assertNotEquals(Dedup.signature(a), Dedup.signature(b));
    assertTrue(Dedup.signature(a).contains("@R"));
  }

  @Test
  public void testBackendDedupsByDefault() throws Exception {
    PipelineProgram pipe = ActionFormTest.compile(CompileOptions.defaults(),
                                                  TWO_HASHES);
    assertEquals(2, pipe.actions().size());
  }
}
