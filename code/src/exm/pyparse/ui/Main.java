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
package exm.pyparse.ui;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.pyparse.common.Logging;
import exm.pyparse.common.Settings;
import exm.pyparse.common.exceptions.InvalidOptionException;
import exm.pyparse.common.exceptions.PyParseFatal;
import exm.pyparse.ui.PyParseRunner.OutputMode;

/**
 * Command line interface to the parser.  Some options are passed
 * indirectly through Java properties.  See Settings.java for handling
 * of these options.
 */
public class Main {
  private static final String TOKENS_FLAG = "t";
  private static final String INDENT_FLAG = "i";
  private static final String ATTRIBUTES_FLAG = "a";
  private static final String STATS_FLAG = "s";

  public static void main(String[] args) {
    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args pyArgs;
    try {
      pyArgs = processArgs(args);
    } catch (PyParseFatal ex) {
      System.exit(ex.exitCode);
      return;
    }

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    PrintStream output = openOutput(pyArgs.outputFilename);
    try {
      PyParseRunner runner = new PyParseRunner(logger);
      runner.run(pyArgs.inputFilename, pyArgs.mode, pyArgs.indent,
                 pyArgs.attributes, output);
    } catch (PyParseFatal ex) {
      closeOutput(output);
      System.exit(ex.exitCode);
    }
    closeOutput(output);
    System.exit(ExitCode.SUCCESS.code());
  }

  static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(TOKENS_FLAG, "tokens", false,
                              "Print tokens instead of the tree"));
    opts.addOption(new Option(STATS_FLAG, "stats", false,
                              "Print node counts per node type"));
    opts.addOption(new Option(INDENT_FLAG, "indent", true,
                              "Indent the tree dump by n spaces per level"));
    opts.addOption(new Option(ATTRIBUTES_FLAG, "attributes", false,
                              "Include positions in the tree dump"));
    return opts;
  }

  /**
   * Parse the command line.  Defaults for the dump options come from
   * Settings.
   * @throws PyParseFatal if the arguments are invalid
   */
  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new PyParseFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(TOKENS_FLAG) && cmd.hasOption(STATS_FLAG)) {
      System.err.println("Options -" + TOKENS_FLAG + " and -" +
                         STATS_FLAG + " cannot be combined");
      usage(opts);
      throw new PyParseFatal(ExitCode.ERROR_COMMAND.code());
    }

    OutputMode mode = OutputMode.TREE;
    if (cmd.hasOption(TOKENS_FLAG)) {
      mode = OutputMode.TOKENS;
    } else if (cmd.hasOption(STATS_FLAG)) {
      mode = OutputMode.STATS;
    }

    if (cmd.hasOption(INDENT_FLAG)) {
      Settings.set(Settings.DUMP_INDENT, cmd.getOptionValue(INDENT_FLAG));
    }
    if (cmd.hasOption(ATTRIBUTES_FLAG)) {
      Settings.set(Settings.DUMP_ATTRIBUTES, "true");
    }
    int indent;
    boolean attributes;
    try {
      indent = Settings.getInt(Settings.DUMP_INDENT, Settings.MIN_DUMP_INDENT,
                              Settings.MAX_DUMP_INDENT);
      attributes = Settings.getBoolean(Settings.DUMP_ATTRIBUTES);
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      usage(opts);
      throw new PyParseFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
                         "but got " + remainingArgs.length + " arguments");
      usage(opts);
      throw new PyParseFatal(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output, mode, indent, attributes);
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
   * @param args
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("pyparse [options] <input.py> [<output>]", opts);
  }

  private static PrintStream openOutput(String outputFilename) {
    if (outputFilename == null) {
      return System.out;
    }
    File outfile = new File(outputFilename);
    try {
      return new PrintStream(new FileOutputStream(outfile), false, "UTF-8");
    } catch (FileNotFoundException e) {
      System.err.println("Error opening " + outfile.getAbsolutePath() +
                         " for output: " + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    } catch (UnsupportedEncodingException e) {
      PyParseRunner.reportInternalError(e);
      System.exit(ExitCode.ERROR_INTERNAL.code());
      return null;
    }
  }

  private static void closeOutput(PrintStream output) {
    if (output != System.out) {
      output.close();
    }
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final OutputMode mode;
    public final int indent;
    public final boolean attributes;

    public Args(String inputFilename, String outputFilename,
                OutputMode mode, int indent, boolean attributes) {
      super();
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.mode = mode;
      this.indent = indent;
      this.attributes = attributes;
    }
  }
}
