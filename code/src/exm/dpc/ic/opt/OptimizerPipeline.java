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
package exm.dpc.ic.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.DiagnosticSink;
import exm.dpc.common.exceptions.UserException;
import exm.dpc.ic.tree.ICTree.Program;


public class OptimizerPipeline {

  public OptimizerPipeline(DiagnosticSink sink) {
    this.sink = sink;
  }

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();
  private final DiagnosticSink sink;

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  public void runPipeline(Logger logger, CompileOptions opts,
                          Program program) throws UserException {
    for (OptimizerPass pass: passes) {
      if (passEnabled(opts, pass)) {
        logger.debug("Pass: " + pass.getPassName());
        pass.optimize(logger, opts, program);
        sink.program("after " + pass.getPassName(), program.toString());
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(CompileOptions opts, OptimizerPass pass) {
    String key = pass.getConfigEnabledKey();
    return key == null || opts.getBoolean(key);
  }
}
