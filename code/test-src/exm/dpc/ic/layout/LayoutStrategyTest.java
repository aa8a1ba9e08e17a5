package exm.dpc.ic.layout;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.log4j.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import exm.dpc.common.Logging;
import exm.dpc.common.exceptions.ResourceExhaustionException;
import exm.dpc.common.lang.Var;
import exm.dpc.ic.Programs;
import exm.dpc.ic.graph.ControlDependence;
import exm.dpc.ic.graph.ControlFlowGraph;
import exm.dpc.ic.graph.DataDependence;
import exm.dpc.ic.graph.DepEdge;
import exm.dpc.ic.graph.DependencyGraph;
import exm.dpc.ic.graph.EdgeKind;
import exm.dpc.ic.graph.UseDefMap;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;

/**
 * Behaviour both layout strategies must share
 */
@RunWith(Parameterized.class)
public class LayoutStrategyTest {

  private static final Logger logger = Logging.getDPCLogger();

  private static final Var R = Var.register("R", 32, 0);
  private static final Var S = Var.register("S", 32, 0);

  @Parameters(name="{0}")
  public static Collection<Object[]> strategies() {
    return Arrays.asList(new Object[][] {
        { new AsapLayout() },
        { new ListLayout() },
    });
  }

  private final LayoutStrategy strategy;

  public LayoutStrategyTest(LayoutStrategy strategy) {
    this.strategy = strategy;
  }

  private static ResourceModel model(int stages, int maxTables) {
    return new ResourceModel(stages, maxTables, 4, 512, 6);
  }

  private static LayoutNode node(int id, String group, int alu,
                                 List<Var> regReads, List<Var> regWrites) {
    return new LayoutNode(id, "n" + id, group, 8, alu, 0,
                          regReads, regWrites);
  }

  private static LayoutNode plain(int id, String group) {
    return node(id, group, 0, Var.NONE, Var.NONE);
  }

  private static DependencyGraph graph(int size, DepEdge ...edges) {
    List<String> labels = new ArrayList<String>();
    for (int i = 0; i < size; i++) {
      labels.add("n" + i);
    }
    DependencyGraph g = new DependencyGraph(labels);
    for (DepEdge e: edges) {
      g.addEdge(e);
    }
    return g;
  }

  /**
   * A writes R, B reads R and writes S, C reads S
   */
  private static LayoutProblem chain(ResourceModel model) {
    List<LayoutNode> nodes = Arrays.asList(
        node(0, "tA", 1, Var.NONE, Arrays.asList(R)),
        node(1, "tB", 2, Arrays.asList(R), Arrays.asList(S)),
        node(2, "tC", 1, Arrays.asList(S), Var.NONE));
    DependencyGraph g = graph(3,
        DepEdge.data(0, 1, EdgeKind.DATA_RAW, R),
        DepEdge.data(1, 2, EdgeKind.DATA_RAW, S));
    return new LayoutProblem(nodes, g, model);
  }

  @Test
  public void testChain() throws Exception {
    LayoutProblem problem = chain(model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1, 2}, layout.stageAssignment());
    assertEquals(3, layout.stagesUsed());
    assertEquals(strategy.getName(), layout.strategy());
    layout.verify(problem);
  }

  @Test
  public void testParallel() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Arrays.asList(plain(0, "tD"), plain(1, "tE")), graph(2),
        model(12, 2));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 0}, layout.stageAssignment());
    assertEquals(2, layout.stage(0).usage().tables);
  }

  @Test
  public void testTableLimit() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Arrays.asList(plain(0, "tD"), plain(1, "tE")), graph(2),
        model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1}, layout.stageAssignment());
  }

  @Test
  public void testSharedGroup() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Arrays.asList(plain(0, "t"), plain(1, "t")), graph(2),
        model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 0}, layout.stageAssignment());
    assertEquals(1, layout.stage(0).usage().tables);
  }

  @Test
  public void testControlEdgeSameStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Arrays.asList(LayoutNode.branch(0, "b"), plain(1, "b0")),
        graph(2, DepEdge.control(0, 1, false)), model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 0}, layout.stageAssignment());
  }

  @Test
  public void testCallEdgeNextStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Arrays.asList(LayoutNode.branch(0, "b"), plain(1, "call1")),
        graph(2, DepEdge.control(0, 1, true)), model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1}, layout.stageAssignment());
  }

  @Test
  public void testRegisterWritersSeparated() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          node(0, "t0", 1, Var.NONE, Arrays.asList(R)),
          node(1, "t1", 1, Var.NONE, Arrays.asList(R))),
        graph(2), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    assertNotEquals(layout.stageOf(0), layout.stageOf(1));
  }

  @Test
  public void testRegisterReadersShareStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          node(0, "t0", 1, Arrays.asList(R), Var.NONE),
          node(1, "t1", 1, Arrays.asList(R), Var.NONE)),
        graph(2), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 0}, layout.stageAssignment());
  }

  @Test
  public void testRegisterWriterThenReader() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          node(0, "t0", 1, Var.NONE, Arrays.asList(R)),
          node(1, "t1", 1, Arrays.asList(R), Var.NONE)),
        graph(2), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1}, layout.stageAssignment());
    layout.verify(problem);
  }

  @Test
  public void testRegisterReaderThenWriter() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          node(0, "t0", 1, Arrays.asList(R), Var.NONE),
          node(1, "t1", 1, Var.NONE, Arrays.asList(R)),
          node(2, "t2", 1, Arrays.asList(S), Var.NONE)),
        graph(3), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    // Other registers are unaffected
    assertArrayEquals(new int[] {0, 1, 0}, layout.stageAssignment());
  }

  @Test
  public void testAluFullPushesToNextStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          node(0, "t0", 3, Var.NONE, Var.NONE),
          node(1, "t1", 2, Var.NONE, Var.NONE),
          node(2, "t2", 1, Var.NONE, Var.NONE)),
        graph(3), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1, 0}, layout.stageAssignment());

    UtilizationReport report = layout.utilization();
    assertEquals(2, report.stagesUsed());
    assertEquals(4, report.stageUsage(0).alu);
    assertEquals(2, report.stageUsage(1).alu);
    assertEquals(1, report.stageUsage(1).tables);
  }

  @Test
  public void testHashFullPushesToNextStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          new LayoutNode(0, "h0", "t0", 8, 0, 4, Var.NONE, Var.NONE),
          new LayoutNode(1, "h1", "t1", 8, 0, 3, Var.NONE, Var.NONE)),
        graph(2), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    assertArrayEquals(new int[] {0, 1}, layout.stageAssignment());
    assertEquals(4, layout.utilization().stageUsage(0).hash);
    assertEquals(3, layout.utilization().stageUsage(1).hash);
  }

  @Test
  public void testKeyWidthPushesToNextStage() throws Exception {
    LayoutProblem problem = new LayoutProblem(Arrays.asList(
          new LayoutNode(0, "a0", "tA", 300, 0, 0, Var.NONE, Var.NONE),
          new LayoutNode(1, "b0", "tB", 300, 0, 0, Var.NONE, Var.NONE),
          new LayoutNode(2, "a1", "tA", 300, 0, 0, Var.NONE, Var.NONE)),
        graph(3), model(12, 4));
    Layout layout = strategy.layout(logger, problem);
    // Second statement of tA reuses the table already opened in stage 0
    assertArrayEquals(new int[] {0, 1, 0}, layout.stageAssignment());
    StageUsage first = layout.utilization().stageUsage(0);
    assertEquals(1, first.tables);
    assertEquals(300, first.keyWidth);
  }

  @Test
  public void testExclusiveArmsShareRegister() throws Exception {
    Program p = Programs.numbered(
        "register R 32",
        "local c 8",
        "local a 32",
        "local b 32",
        "handler h {",
        "  match c {",
        "    case 1 {",
        "      reg_set R a",
        "    }",
        "    case _ {",
        "      reg_set R b",
        "    }",
        "  }",
        "}");
    LayoutProblem problem = fromProgram(model(12, 4), p);
    assertTrue(problem.mutuallyExclusive(1, 2));
    assertFalse(problem.mutuallyExclusive(0, 1));
    Layout layout = strategy.layout(logger, problem);
    // Only one arm runs, so both writes fit in one stage
    assertArrayEquals(new int[] {0, 0, 0}, layout.stageAssignment());
    layout.verify(problem);
  }

  @Test
  public void testOutOfStages() {
    try {
      strategy.layout(logger, chain(model(2, 1)));
      fail("Expected resource exhaustion");
    } catch (ResourceExhaustionException e) {
      assertEquals("n2", e.getStatement());
      assertTrue(e.getMessage(), e.getMessage().startsWith("layout: "));
    }
  }

  @Test
  public void testNodeTooBig() {
    LayoutNode wide = new LayoutNode(0, "wide", "t", 600, 0, 0,
                                     Var.NONE, Var.NONE);
    LayoutProblem problem = new LayoutProblem(Arrays.asList(wide),
                                              graph(1), model(12, 1));
    try {
      strategy.layout(logger, problem);
      fail("Expected resource exhaustion");
    } catch (ResourceExhaustionException e) {
      assertEquals("wide", e.getStatement());
      assertTrue(e.getMessage(), e.getMessage().contains(
                                  "needs more than a whole stage"));
    }
  }

  @Test
  public void testDeterministic() throws Exception {
    ResourceModel model = model(12, 2);
    Layout first = strategy.layout(logger, fromProgram(model));
    Layout second = strategy.layout(logger, fromProgram(model));
    assertArrayEquals(first.stageAssignment(), second.stageAssignment());
    assertEquals(first.toString(), second.toString());
  }

  @Test
  public void testProgramLayoutValid() throws Exception {
    ResourceModel model = model(12, 2);
    LayoutProblem problem = fromProgram(model);
    Layout layout = strategy.layout(logger, problem);
    layout.verify(problem);
    // Hash reads what the register update wrote
    assertTrue(layout.stageOf(4) > layout.stageOf(3));
    assertTrue(layout.utilization().summary().startsWith(
              "layout (" + strategy.getName() + ") uses "));
  }

  @Test
  public void testRandomProblemsValid() throws Exception {
    Random random = new Random(42);
    List<Var> regs = Arrays.asList(R, S, Var.register("T", 8, 0));
    for (int round = 0; round < 50; round++) {
      int n = 5 + random.nextInt(20);
      // Statements of one group share its table, so share its key width
      int groupWidths[] = new int[4];
      for (int g = 0; g < groupWidths.length; g++) {
        groupWidths[g] = random.nextInt(64);
      }
      List<LayoutNode> nodes = new ArrayList<LayoutNode>();
      for (int i = 0; i < n; i++) {
        List<Var> reads = new ArrayList<Var>();
        List<Var> writes = new ArrayList<Var>();
        int alu = 0;
        if (random.nextInt(3) == 0) {
          Var r = regs.get(random.nextInt(regs.size()));
          (random.nextBoolean() ? reads : writes).add(r);
          alu = 1;
        }
        int group = random.nextInt(groupWidths.length);
        nodes.add(new LayoutNode(i, "n" + i, "g" + group,
            groupWidths[group], alu, random.nextInt(2), reads, writes));
      }
      DependencyGraph g = graph(n);
      for (int e = 0; e < n; e++) {
        int a = random.nextInt(n);
        int b = random.nextInt(n);
        if (a < b) {
          switch (random.nextInt(3)) {
            case 0:
              g.addEdge(DepEdge.control(a, b, false));
              break;
            case 1:
              g.addEdge(DepEdge.control(a, b, true));
              break;
            default:
              g.addEdge(DepEdge.data(a, b, EdgeKind.DATA_RAW, R));
              break;
          }
        }
      }
      LayoutProblem problem = new LayoutProblem(nodes, g,
                            new ResourceModel(40, 2, 2, 128, 1));
      Layout layout = strategy.layout(logger, problem);
      layout.verify(problem);
    }
  }

  private static LayoutProblem fromProgram(ResourceModel model)
                                                    throws Exception {
    Program p = Programs.numbered(
        "register count 32",
        "local flow 32",
        "local c 8",
        "local old 32",
        "local h1 32",
        "local o 16",
        "table acl 32 permit,deny",
        "handler h {",
        "  flow = add flow 1",
        "  match c {",
        "    case 1 {",
        "      o = table_match acl flow",
        "      old = reg_update count 1",
        "      h1 = hash 9 old flow",
        "    }",
        "    case _ {",
        "      h1 = xor flow 3",
        "    }",
        "  }",
        "}");
    return fromProgram(model, p);
  }

  private static LayoutProblem fromProgram(ResourceModel model, Program p)
                                                    throws Exception {
    ControlFlowGraph cfg = ControlFlowGraph.build(logger, p);
    ControlDependence cdg = ControlDependence.build(logger, p);
    List<DepEdge> data = DataDependence.analyze(logger, cfg,
                                          UseDefMap.build(p, cdg));
    List<String> labels = new ArrayList<String>();
    for (Statement stmt: p.statements()) {
      labels.add(stmt.label());
    }
    DependencyGraph deps = DependencyGraph.merge(logger, labels,
                                                 cdg.edges(), data);
    deps.checkAcyclic();
    return LayoutProblem.build(logger, p, cdg, deps, model);
  }

  @Test
  public void testEmptyProblem() throws Exception {
    LayoutProblem problem = new LayoutProblem(
        Collections.<LayoutNode>emptyList(), graph(0), model(12, 1));
    Layout layout = strategy.layout(logger, problem);
    assertEquals(0, layout.stagesUsed());
  }
}
