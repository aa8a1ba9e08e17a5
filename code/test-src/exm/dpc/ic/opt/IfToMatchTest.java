package exm.dpc.ic.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Logging;
import exm.dpc.ic.Programs;
import exm.dpc.ic.tree.Conditionals.MatchStatement;
import exm.dpc.ic.tree.ICTree.Block;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;
import exm.dpc.ic.tree.Opcode;

public class IfToMatchTest {

  @Test
  public void testIfElse() throws Exception {
    Program p = Programs.parse(
        "local c 1",
        "local x 32",
        "handler h {",
        "  if c {",
        "    x = add x 1",
        "  } else {",
        "    x = sub x 1",
        "  }",
        "}");
    new IfToMatch().optimize(Logging.getDPCLogger(),
                             CompileOptions.defaults(), p);

    List<Statement> top = p.mainBlock().getStatements();
    assertEquals(1, top.size());
    assertTrue(top.get(0) instanceof MatchStatement);
    MatchStatement m = (MatchStatement)top.get(0);
    assertEquals("c", m.getKeys().get(0).toString());
    // Zero must be tested before the wildcard
    assertEquals("0", m.casePattern(0).toString());
    assertEquals("_", m.casePattern(1).toString());
    assertEquals(Opcode.SUB, firstOp(m.getArms().get(0)));
    assertEquals(Opcode.ADD, firstOp(m.getArms().get(1)));
  }

  @Test
  public void testNested() throws Exception {
    Program p = Programs.parse(
        "local c 1",
        "local d 8",
        "local x 32",
        "handler h {",
        "  match d {",
        "    case 4 {",
        "      if c {",
        "        x = add x 1",
        "      }",
        "    }",
        "  }",
        "}");
    new IfToMatch().optimize(Logging.getDPCLogger(),
                             CompileOptions.defaults(), p);
    MatchStatement outer = (MatchStatement)p.mainBlock().getStatements()
                                                        .get(0);
    Statement inner = outer.getArms().get(0).getStatements().get(0);
    assertTrue(inner instanceof MatchStatement);
    MatchStatement innerMatch = (MatchStatement)inner;
    assertTrue(innerMatch.getArms().get(0).isEmpty());
    assertEquals(Opcode.ADD, firstOp(innerMatch.getArms().get(1)));
  }

  private static Opcode firstOp(Block b) {
    return b.getStatements().get(0).instruction().op;
  }
}
