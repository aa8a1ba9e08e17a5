package exm.dpc.ic;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.DiagnosticSink;
import exm.dpc.common.Logging;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.InvalidWriteException;
import exm.dpc.common.exceptions.ResourceExhaustionException;
import exm.dpc.ic.pipeline.Table;

@RunWith(Parameterized.class)
public class PipelineBackendTest {

  @Parameters(name="{0}")
  public static Collection<Object[]> strategies() {
    return Arrays.asList(new Object[][] {
        { Settings.STRATEGY_CURRENT },
        { Settings.STRATEGY_LEGACY },
    });
  }

  private final String strategy;

  public PipelineBackendTest(String strategy) {
    this.strategy = strategy;
  }

  /** Each statement reads what the previous one wrote */
  private static final String[] REGISTER_CHAIN = {
    "register R 32",
    "register S 32",
    "local a 32",
    "local b 32",
    "local v 32",
    "handler h {",
    "  reg_set R a",
    "  v = reg_get R",
    "  reg_set S v",
    "  b = reg_get S",
    "}",
  };

  private CompileOptions opts() throws Exception {
    return CompileOptions.defaults().with(Settings.LAYOUT_STRATEGY,
                                          strategy);
  }

  private PipelineBackend.Result compile(CompileOptions opts,
        DiagnosticSink sink, String ...lines) throws Exception {
    PipelineBackend backend = new PipelineBackend(Logging.getDPCLogger(),
                                                  opts, sink);
    return backend.compile(Programs.parse(lines));
  }

  @Test
  public void testChain() throws Exception {
    PipelineBackend.Result r = compile(opts(), DiagnosticSink.NONE,
                                       REGISTER_CHAIN);
    assertEquals(strategy, r.layout.strategy());
    assertArrayEquals(new int[] {0, 1, 2, 3}, r.layout.stageAssignment());
    List<String> names = new ArrayList<String>();
    for (Table t: r.pipeline.tables()) {
      names.add(t.name());
    }
    assertEquals(Arrays.asList("s0_root", "s1_root", "s2_root", "s3_root"),
                 names);
    assertEquals("h", r.pipeline.handlerName());
    assertEquals(4, r.pipeline.stagesUsed());
    assertEquals(4, r.utilization.stagesUsed());
    assertEquals(Arrays.asList("R", "S"),
                 Arrays.asList(r.pipeline.registers().get(0).name(),
                               r.pipeline.registers().get(1).name()));
  }

  @Test
  public void testOutOfStages() throws Exception {
    CompileOptions opts = opts().with(Settings.LAYOUT_STAGES, "2");
    try {
      compile(opts, DiagnosticSink.NONE, REGISTER_CHAIN);
      fail("Expected resource exhaustion");
    } catch (ResourceExhaustionException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("reg_set S v"));
    }
  }

  @Test
  public void testDoubleRegisterWrite() throws Exception {
    try {
      compile(opts(), DiagnosticSink.NONE,
          "register R 32",
          "local c 8",
          "handler h {",
          "  reg_set R 1",
          "  match c {",
          "    case 1 {",
          "      reg_set R 2",
          "    }",
          "  }",
          "}");
      fail("Expected invalid write");
    } catch (InvalidWriteException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(
                                    "dependency analysis: "));
    }
  }

  @Test
  public void testUpdatedKeyStillSelectsArm() throws Exception {
    // The arm writes its own key; the copy made before the match keeps
    // later stages on the same arm
    PipelineBackend.Result r = compile(opts(), DiagnosticSink.NONE,
        "register R 32",
        "local k 8",
        "local v 32",
        "local w 32",
        "handler h {",
        "  match k {",
        "    case 1 {",
        "      k = add k 1",
        "      v = reg_get R",
        "      w = add v 1",
        "    }",
        "  }",
        "}");
    int keyed = 0;
    for (Table t: r.pipeline.tables()) {
      if (t.keys().isEmpty()) {
        // Top level copy of the key
        continue;
      }
      keyed++;
      assertEquals(t.name(), 1, t.keys().size());
      assertTrue(t.keys().get(0).toString().startsWith("k~"));
    }
    // Arm is split over two stages
    assertEquals(2, keyed);
  }

  @Test
  public void testDiagnostics() throws Exception {
    final List<String> graphs = new ArrayList<String>();
    final List<String> phases = new ArrayList<String>();
    final List<String> reports = new ArrayList<String>();
    DiagnosticSink sink = new DiagnosticSink() {
      @Override
      public void graph(String name, String dot) {
        graphs.add(name);
        assertTrue(dot, dot.startsWith("digraph " + name));
      }

      @Override
      public void program(String phase, String text) {
        phases.add(phase);
      }

      @Override
      public void utilization(String report) {
        reports.add(report);
      }
    };
    compile(opts(), sink, REGISTER_CHAIN);
    assertEquals(Arrays.asList("cfg", "cdg", "dfg"), graphs);
    assertEquals("input", phases.get(0));
    assertTrue(phases.toString(), phases.contains("action form"));
    assertEquals("dedup", phases.get(phases.size() - 1));
    assertEquals(1, reports.size());
    assertTrue(reports.get(0), reports.get(0).startsWith(
        "layout (" + strategy + ") uses 4 of 12 stages with 4 tables"));
  }
}
