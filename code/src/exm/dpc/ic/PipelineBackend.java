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
package exm.dpc.ic;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.DiagnosticSink;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.UserException;
import exm.dpc.ic.graph.ControlDependence;
import exm.dpc.ic.graph.ControlFlowGraph;
import exm.dpc.ic.graph.DataDependence;
import exm.dpc.ic.graph.DepEdge;
import exm.dpc.ic.graph.DependencyGraph;
import exm.dpc.ic.graph.UseDefMap;
import exm.dpc.ic.layout.AsapLayout;
import exm.dpc.ic.layout.Layout;
import exm.dpc.ic.layout.LayoutProblem;
import exm.dpc.ic.layout.LayoutStrategy;
import exm.dpc.ic.layout.ListLayout;
import exm.dpc.ic.layout.ResourceModel;
import exm.dpc.ic.layout.UtilizationReport;
import exm.dpc.ic.opt.ConstBranchVars;
import exm.dpc.ic.opt.IfToMatch;
import exm.dpc.ic.opt.OptimizerPipeline;
import exm.dpc.ic.opt.Validate;
import exm.dpc.ic.pipeline.ActionForm;
import exm.dpc.ic.pipeline.CapacityCheck;
import exm.dpc.ic.pipeline.Dedup;
import exm.dpc.ic.pipeline.PipelineProgram;
import exm.dpc.ic.tree.ICTree.Program;
import exm.dpc.ic.tree.ICTree.Statement;

/**
 * Lowers a normalized handler to a scheduled pipeline program:
 * normalize the tree, build control flow, control dependence and data
 * dependence graphs, lay statements out in stages, form tables and
 * actions, and merge duplicate actions.  Any failure aborts the whole
 * compilation.
 */
public class PipelineBackend {

  private final Logger logger;
  private final CompileOptions opts;
  private final DiagnosticSink sink;

  public PipelineBackend(Logger logger, CompileOptions opts,
                         DiagnosticSink sink) {
    this.logger = logger;
    this.opts = opts;
    this.sink = sink;
  }

  /**
   * Everything produced by one compilation
   */
  public static class Result {
    public final PipelineProgram pipeline;
    public final Layout layout;
    public final LayoutProblem problem;
    public final UtilizationReport utilization;

    private Result(PipelineProgram pipeline, Layout layout,
                   LayoutProblem problem, UtilizationReport utilization) {
      this.pipeline = pipeline;
      this.layout = layout;
      this.problem = problem;
      this.utilization = utilization;
    }
  }

  public static LayoutStrategy strategyFor(CompileOptions opts) {
    if (opts.legacyLayout()) {
      return new ListLayout();
    } else {
      return new AsapLayout();
    }
  }

  public Result compile(Program program) throws UserException {
    logger.debug("Compiling handler " + program.getHandlerName());
    sink.program("input", program.toString());

    normalize(program);
    program.renumber();

    ControlFlowGraph cfg = ControlFlowGraph.build(logger, program);
    ControlDependence cdg = ControlDependence.build(logger, program);
    sink.graph("cfg", cfg.toDot());
    sink.graph("cdg", cdg.toDot());

    ActionForm.checkLegal(logger, opts, program, cdg);

    UseDefMap useDef = UseDefMap.build(program, cdg);
    List<DepEdge> dataEdges = DataDependence.analyze(logger, cfg, useDef);
    DependencyGraph deps = DependencyGraph.merge(logger, labels(program),
                                            cdg.edges(), dataEdges);
    sink.graph("dfg", deps.toDot());
    deps.checkAcyclic();

    ResourceModel model = ResourceModel.fromOptions(opts);
    LayoutProblem problem = LayoutProblem.build(logger, program, cdg, deps,
                                                model);
    LayoutStrategy strategy = strategyFor(opts);
    logger.debug("Layout with strategy " + strategy.getName() + " on " +
                 model);
    Layout layout = strategy.layout(logger, problem);
    if (opts.debug()) {
      layout.verify(problem);
    }
    UtilizationReport report = layout.utilization();
    logger.info(report.summary());
    sink.utilization(report.render());

    PipelineProgram pipeline = ActionForm.form(logger, program, cdg,
                                               problem, layout);
    sink.program("action form", pipeline.toString());
    if (opts.getBoolean(Settings.OPT_DEDUP)) {
      Dedup.dedup(logger, opts, pipeline);
      sink.program("dedup", pipeline.toString());
    }
    CapacityCheck.check(logger, model, pipeline);
    return new Result(pipeline, layout, problem, report);
  }

  private void normalize(Program program) throws UserException {
    OptimizerPipeline pipeline = new OptimizerPipeline(sink);
    pipeline.addPass(new IfToMatch());
    pipeline.addPass(new ConstBranchVars());
    if (opts.debug()) {
      pipeline.addPass(new Validate());
    }
    pipeline.runPipeline(logger, opts, program);
  }

  private static List<String> labels(Program program) {
    List<String> labels = new ArrayList<String>();
    for (Statement stmt: program.statements()) {
      labels.add(stmt.label());
    }
    return labels;
  }
}
