package exm.dpc.ic.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.dpc.common.Logging;
import exm.dpc.common.exceptions.DependencyCycleException;
import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.exceptions.InvalidWriteException;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.Programs;
import exm.dpc.ic.tree.ICTree.Program;

public class DataDependenceTest {

  private static final Logger logger = Logging.getDPCLogger();

  @Test
  public void testReadAfterWrite() throws Exception {
    Program p = Programs.numbered(
        "local a 32",
        "local b 32",
        "local c 32",
        "handler h {",
        "  a = add b 1",
        "  c = add a 1",
        "}");
    List<DepEdge> edges = analyze(p);
    assertEquals(Collections.singletonList(
        DepEdge.data(0, 1, EdgeKind.DATA_RAW, p.lookupVar("a"))), edges);
  }

  @Test
  public void testWriteAfterReadAndWrite() throws Exception {
    Program p = Programs.numbered(
        "local a 32",
        "local b 32",
        "handler h {",
        "  a = add b 1",
        "  b = add 2 3",
        "  a = add 4 5",
        "}");
    List<DepEdge> edges = analyze(p);
    Var a = p.lookupVar("a");
    Var b = p.lookupVar("b");
    assertTrue(edges.toString(),
               edges.contains(DepEdge.data(0, 1, EdgeKind.DATA_WAR, b)));
    assertTrue(edges.toString(),
               edges.contains(DepEdge.data(0, 2, EdgeKind.DATA_WAW, a)));
    assertEquals(2, edges.size());
  }

  @Test
  public void testBranchKeysAreRead() throws Exception {
    Program p = Programs.numbered(
        "local c 8",
        "local x 32",
        "handler h {",
        "  c = add c 1",
        "  match c {",
        "    case 1 {",
        "      x = add x 1",
        "    }",
        "  }",
        "}");
    ControlDependence cdg = ControlDependence.build(logger, p);
    UseDefMap useDef = UseDefMap.build(p, cdg);
    assertTrue(useDef.getReads(2).contains(p.lookupVar("c")));
    assertTrue(analyze(p).contains(
        DepEdge.data(0, 2, EdgeKind.DATA_RAW, p.lookupVar("c"))));
  }

  @Test
  public void testExclusiveArmsIndependent() throws Exception {
    Program p = Programs.numbered(
        "register R 32",
        "local c 8",
        "local v 32",
        "handler h {",
        "  match c {",
        "    case 1 {",
        "      reg_set R 1",
        "    }",
        "    case _ {",
        "      reg_set R 2",
        "    }",
        "  }",
        "  v = reg_get R",
        "}");
    List<DepEdge> edges = analyze(p);
    Var r = p.lookupVar("R");
    assertTrue(edges.contains(DepEdge.data(1, 3, EdgeKind.DATA_RAW, r)));
    assertTrue(edges.contains(DepEdge.data(2, 3, EdgeKind.DATA_RAW, r)));
    for (DepEdge e: edges) {
      assertTrue(e.toString(), !(e.src == 1 && e.dst == 2));
    }
  }

  @Test
  public void testRegisterWrittenTwice() throws Exception {
    Program p = Programs.numbered(
        "register R 32",
        "local a 32",
        "handler h {",
        "  reg_set R a",
        "  reg_set R 3",
        "}");
    try {
      analyze(p);
      fail("Expected invalid write");
    } catch (InvalidWriteException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
                 "register R may be written more than once per pass"));
    }
  }

  @Test
  public void testCycle() throws Exception {
    // Only possible on a graph with a back edge
    ControlFlowGraph cfg = new ControlFlowGraph(2);
    cfg.addEdge(0, 1, null);
    cfg.addEdge(1, 0, null);
    Var x = Var.local("x", 32);
    Var y = Var.local("y", 32);
    UseDefMap useDef = new UseDefMap(2);
    useDef.put(0, Arrays.asList(y), Arrays.asList(x));
    useDef.put(1, Arrays.asList(x), Arrays.asList(y));

    List<DepEdge> edges = DataDependence.analyze(logger, cfg, useDef);
    DependencyGraph g = DependencyGraph.merge(logger,
        Arrays.asList("T1", "T2"), Collections.<DepEdge>emptyList(), edges);
    try {
      g.checkAcyclic();
      fail("Expected cycle");
    } catch (DependencyCycleException e) {
      assertEquals(Arrays.asList("T1", "T2", "T1"), e.getChain());
      assertEquals(Arrays.asList("x", "y"), e.getVariables());
      assertTrue(e.getMessage(), e.getMessage().startsWith(
                                    "dependency analysis: cyclic"));
    }
  }

  @Test(expected=InternalInvariantError.class)
  public void testMissingUseDef() throws Exception {
    ControlFlowGraph cfg = new ControlFlowGraph(2);
    cfg.addEdge(0, 1, null);
    UseDefMap useDef = new UseDefMap(2);
    useDef.put(0, Var.NONE, Arrays.asList(Var.local("x", 8)));
    DataDependence.analyze(logger, cfg, useDef);
  }

  private static List<DepEdge> analyze(Program p) throws Exception {
    ControlFlowGraph cfg = ControlFlowGraph.build(logger, p);
    ControlDependence cdg = ControlDependence.build(logger, p);
    return DataDependence.analyze(logger, cfg, UseDefMap.build(p, cdg));
  }
}
