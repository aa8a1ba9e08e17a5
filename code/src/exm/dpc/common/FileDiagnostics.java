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
package exm.dpc.common;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

/**
 * Writes diagnostics to the files named by the options: dot graphs
 * into the graph directory, the program after each phase into the
 * IC output file and the utilization report into the report file.
 * Anything not configured is dropped.
 *
 * Write failures are warned about once per distinct message and
 * otherwise ignored.  The set of warned messages lives as long as this
 * object, so each compilation starts with a fresh one.
 */
public class FileDiagnostics implements DiagnosticSink {

  private final File graphDir;
  private final PrintStream icOutput;
  private final File reportFile;
  private final Logger logger;

  /** Warnings already emitted */
  private final Set<String> warned = new HashSet<String>();

  public FileDiagnostics(Logger logger, File graphDir, PrintStream icOutput,
                         File reportFile) {
    this.logger = logger;
    this.graphDir = graphDir;
    this.icOutput = icOutput;
    this.reportFile = reportFile;
  }

  public static FileDiagnostics open(Logger logger, CompileOptions opts)
      throws IOException {
    File graphDir = fileOrNull(opts.get(Settings.GRAPH_DIR));
    if (graphDir != null) {
      FileUtils.forceMkdir(graphDir);
    }
    File icFile = fileOrNull(opts.get(Settings.IC_OUTPUT_FILE));
    PrintStream icOutput = null;
    if (icFile != null) {
      icOutput = new PrintStream(new BufferedOutputStream(
                      new FileOutputStream(icFile)), false, "UTF-8");
    }
    return new FileDiagnostics(logger, graphDir, icOutput,
                   fileOrNull(opts.get(Settings.LAYOUT_REPORT_FILE)));
  }

  private static File fileOrNull(String name) {
    if (name == null || name.length() == 0) {
      return null;
    }
    return new File(name);
  }

  @Override
  public void graph(String name, String dot) {
    if (graphDir != null) {
      write(new File(graphDir, name + ".dot"), dot);
    }
  }

  @Override
  public void program(String phase, String text) {
    if (icOutput != null) {
      icOutput.println("// after phase: " + phase);
      icOutput.println(text);
      icOutput.flush();
    }
  }

  @Override
  public void utilization(String report) {
    if (reportFile != null) {
      write(reportFile, report);
    }
  }

  private void write(File f, String contents) {
    try {
      FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
    } catch (IOException e) {
      uniqueWarn("Could not write diagnostic file " + f + ": "
                 + e.getMessage());
    }
  }

  /**
   * @param msg
   * @return true if the warning was emitted, false if it was a duplicate
   */
  boolean uniqueWarn(String msg) {
    if (warned.add(msg)) {
      logger.warn(msg);
      return true;
    }
    logger.debug("Duplicate Warning: " + msg);
    return false;
  }

  public void close() {
    IOUtils.closeQuietly(icOutput);
  }
}
