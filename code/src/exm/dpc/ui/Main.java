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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.dpc.common.CompileOptions;
import exm.dpc.common.FileDiagnostics;
import exm.dpc.common.Logging;
import exm.dpc.common.Settings;
import exm.dpc.common.exceptions.DPCFatal;
import exm.dpc.common.exceptions.InvalidOptionException;

/**
 * Command line interface to the DPC compiler.  Most compiler options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String LEGACY_LAYOUT_FLAG = "L";
  private static final String GRAPH_DIR_FLAG = "g";
  private static final String REPORT_FLAG = "r";
  private static final String UPDATE_FLAG = "u";

  private static final String INPUT_EXT = ".dpt";
  private static final String OUTPUT_EXT = ".pipe";

  public static void main(String[] args) {
    try {
      Settings.initDPCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args dpcArgs = processArgs(args);

    Logger logger = null;
    CompileOptions opts = null;
    try {
      opts = CompileOptions.fromSettings();
      logger = Logging.setupLogging(opts.get(Settings.LOG_FILE),
                                    opts.getBoolean(Settings.LOG_TRACE));
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File inputFile = new File(dpcArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    File outputFile = selectOutputFile(dpcArgs);

    if (skipCompile(logger, dpcArgs, inputFile, outputFile)) {
      System.exit(ExitCode.SUCCESS.code());
    }

    FileDiagnostics diagnostics = null;
    try {
      diagnostics = FileDiagnostics.open(logger, opts);
    } catch (IOException ex) {
      System.err.println("Error opening diagnostic output: "
                         + ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
    }

    try {
      DPCompiler dpc = new DPCompiler(logger);
      dpc.compile(inputFile, outputFile, opts, diagnostics);
      diagnostics.close();
    } catch (DPCFatal ex) {
      diagnostics.close();
      // Don't leave partial output behind
      if (outputFile.exists()) {
        outputFile.delete();
      }
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(LEGACY_LAYOUT_FLAG, "legacy-layout", false,
                   "Use legacy stage-by-stage layout strategy");

    Option graphDir = new Option(GRAPH_DIR_FLAG, "graph-dir", true,
                   "Write dependency graphs in dot format to directory");
    opts.addOption(graphDir);

    Option report = new Option(REPORT_FLAG, "report", true,
                   "Write stage utilization report to file");
    opts.addOption(report);

    opts.addOption(UPDATE_FLAG, false, "Update output only if out of date");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(LEGACY_LAYOUT_FLAG)) {
      Settings.set(Settings.LAYOUT_STRATEGY, Settings.STRATEGY_LEGACY);
    }
    if (cmd.hasOption(GRAPH_DIR_FLAG)) {
      Settings.set(Settings.GRAPH_DIR, cmd.getOptionValue(GRAPH_DIR_FLAG));
    }
    if (cmd.hasOption(REPORT_FLAG)) {
      Settings.set(Settings.LAYOUT_REPORT_FILE,
                   cmd.getOptionValue(REPORT_FLAG));
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, "
              + "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = remainingArgs.length == 2 ? remainingArgs[1] : null;
    Args result = new Args(input, output, cmd.hasOption(UPDATE_FLAG));

    // Store in properties for later logging
    Settings.set(Settings.INPUT_FILENAME, result.inputFilename);
    if (result.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, result.outputFilename);
    }
    return result;
  }

  private static boolean skipCompile(Logger logger, Args args,
                                     File infile, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, infile)) {
      logger.debug("Output up to date. Done.");
      return true;
    }
    return false;
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("dpc [options] <input> [<output>]", opts, false);
  }

  static File selectOutputFile(Args args) {
    if (args.outputFilename != null) {
      return new File(args.outputFilename);
    }
    String infile = args.inputFilename;
    String prefix;
    if (infile.endsWith(INPUT_EXT)) {
      prefix = infile.substring(0, infile.length() - INPUT_EXT.length());
    } else {
      prefix = infile;
    }
    return new File(prefix + OUTPUT_EXT);
  }

  private static boolean olderThan(File file1, File file2) {
    long modTime1 = file1.lastModified();
    long modTime2 = file2.lastModified();
    return modTime1 < modTime2;
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean updateOutput;

    public Args(String inputFilename, String outputFilename,
                boolean updateOutput) {
      super();
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.updateOutput = updateOutput;
    }
  }
}
