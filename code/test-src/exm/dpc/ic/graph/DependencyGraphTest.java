package exm.dpc.ic.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.lang.Var;

public class DependencyGraphTest {

  @Test
  public void testStrictEdgeWins() {
    DependencyGraph g = new DependencyGraph(Arrays.asList("a", "b"));
    Var v = Var.local("v", 8);
    g.addEdge(DepEdge.control(0, 1, false));
    g.addEdge(DepEdge.data(0, 1, EdgeKind.DATA_RAW, v));
    g.addEdge(DepEdge.control(0, 1, false));
    assertEquals(1, g.edgeCount());
    DepEdge e = g.succEdges(0).get(0);
    assertEquals(EdgeKind.DATA_RAW, e.kind);
    assertEquals(e, g.predEdges(1).get(0));
  }

  @Test
  public void testTopologicalOrderPrefersSmallIds() {
    DependencyGraph g = new DependencyGraph(
                            Arrays.asList("a", "b", "c", "d"));
    g.addEdge(DepEdge.control(3, 0, false));
    g.addEdge(DepEdge.control(2, 1, false));
    assertEquals(Arrays.asList(2, 1, 3, 0), g.topologicalOrder());
  }

  @Test(expected=InternalInvariantError.class)
  public void testTopologicalOrderCycle() {
    DependencyGraph g = new DependencyGraph(Arrays.asList("a", "b"));
    g.addEdge(DepEdge.control(0, 1, false));
    g.addEdge(DepEdge.control(1, 0, false));
    g.topologicalOrder();
  }

  @Test
  public void testDot() {
    DependencyGraph g = new DependencyGraph(Arrays.asList("a", "b"));
    g.addEdge(DepEdge.data(0, 1, EdgeKind.DATA_WAR, Var.local("v", 8)));
    String dot = g.toDot();
    assertTrue(dot, dot.contains(
        "n0 -> n1 [label=\"war v\", style=dashed];"));
  }
}
