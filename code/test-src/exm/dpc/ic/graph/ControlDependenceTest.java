package exm.dpc.ic.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.dpc.common.Logging;
import exm.dpc.ic.Programs;
import exm.dpc.ic.graph.ControlDependence.Decision;
import exm.dpc.ic.tree.ICTree.Program;

public class ControlDependenceTest {

  private static final String[] NESTED = {
    "local x 8",
    "local y 8",
    "local z 32",
    "handler h {",
    "  match x {",
    "    case 1 {",
    "      z = add z 1",
    "      match y {",
    "        case 2 {",
    "          z = sub z 1",
    "        }",
    "      }",
    "    }",
    "    case _ {",
    "      z = xor z 5",
    "    }",
    "  }",
    "}",
  };

  @Test
  public void testDecisions() throws Exception {
    ControlDependence cdg = build(NESTED);
    assertEquals(Collections.<Decision>emptyList(), cdg.decisions(0));
    assertEquals(Arrays.asList(new Decision(0, 0), new Decision(2, 0)),
                 cdg.decisions(3));
    assertEquals(Arrays.asList(new Decision(0, 1)), cdg.decisions(4));
    assertEquals(2, cdg.innermostBranch(3));
    assertEquals(0, cdg.innermostBranch(1));
    assertEquals(-1, cdg.innermostBranch(0));
    assertEquals(2, cdg.depth(3));
  }

  @Test
  public void testMutuallyExclusive() throws Exception {
    ControlDependence cdg = build(NESTED);
    assertTrue(cdg.mutuallyExclusive(3, 4));
    assertTrue(cdg.mutuallyExclusive(1, 4));
    assertFalse(cdg.mutuallyExclusive(1, 3));
    assertFalse(cdg.mutuallyExclusive(0, 3));
  }

  @Test
  public void testEdges() throws Exception {
    List<DepEdge> edges = build(NESTED).edges();
    assertEquals(4, edges.size());
    assertTrue(edges.contains(DepEdge.control(0, 1, false)));
    assertTrue(edges.contains(DepEdge.control(0, 2, false)));
    assertTrue(edges.contains(DepEdge.control(2, 3, false)));
    assertTrue(edges.contains(DepEdge.control(0, 4, false)));
    for (DepEdge e: edges) {
      assertEquals(EdgeKind.CONTROL, e.kind);
      assertFalse(e.isStrict());
    }
  }

  @Test
  public void testTableCallIsStrict() throws Exception {
    ControlDependence cdg = build(
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
    DepEdge e = cdg.edges().get(0);
    assertEquals(EdgeKind.CONTROL_CALL, e.kind);
    assertTrue(e.isStrict());
  }

  @Test
  public void testDot() throws Exception {
    String dot = build(NESTED).toDot();
    assertTrue(dot, dot.startsWith("digraph cdg {"));
    assertTrue(dot, dot.contains("n0 -> n4 [label=\"arm 1\"];"));
  }

  private static ControlDependence build(String ...lines) throws Exception {
    Program p = Programs.numbered(lines);
    return ControlDependence.build(Logging.getDPCLogger(), p);
  }
}
