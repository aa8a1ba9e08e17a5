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
package exm.dpc.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.DiagnosticSink;
import exm.dpc.common.exceptions.DPCFatal;
import exm.dpc.common.exceptions.InvalidSyntaxException;
import exm.dpc.common.exceptions.UserException;
import exm.dpc.common.util.Misc;
import exm.dpc.frontend.ProgramReader;
import exm.dpc.ic.PipelineBackend;
import exm.dpc.ic.tree.ICTree.Program;

/**
 * This is the main entry point to the compiler
 */
public class DPCompiler {

  private final Logger logger;

  public DPCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Compile the normalized program in the input file and write the
   * scheduled pipeline program to the output file.
   * @throws DPCFatal with exit code if compilation fails
   */
  public PipelineBackend.Result compile(File inputFile, File outputFile,
                      CompileOptions opts, DiagnosticSink sink) {
    try {
      logger.info("DPC starting: " + Misc.timestamp());
      Program program = ProgramReader.readFile(inputFile);

      PipelineBackend backend = new PipelineBackend(logger, opts, sink);
      PipelineBackend.Result result = backend.compile(program);

      FileUtils.writeStringToFile(outputFile, result.pipeline.toString(),
                                  StandardCharsets.UTF_8);
      logger.debug("DPC done: " + Misc.timestamp());
      return result;
    }
    catch (DPCFatal e) {
      // Rethrow
      throw e;
    }
    catch (IOException e) {
      System.err.println("dpc I/O error:");
      System.err.println(e.getMessage());
      throw new DPCFatal(ExitCode.ERROR_IO.code());
    }
    catch (InvalidSyntaxException e) {
      System.err.println("dpc syntax error:");
      System.err.println(e.getMessage());
      throw new DPCFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      System.err.println("dpc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new DPCFatal(ExitCode.ERROR_USER.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new DPCFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new DPCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("DPC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
