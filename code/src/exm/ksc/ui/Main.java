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
package exm.ksc.ui;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.ksc.common.Logging;
import exm.ksc.common.Settings;
import exm.ksc.common.exceptions.InvalidOptionException;
import exm.ksc.common.exceptions.KSCFatal;

/**
 * Command line interface to the KSC front end.  Options may also be
 * passed as Java properties.  See Settings.java for handling of these
 * options.
 */
public class Main {
  private static final String PARSER_DEBUG_FLAG = "d";
  private static final String DUMP_TOKENS_FLAG = "t";
  private static final String DUMP_AST_FLAG = "a";
  private static final String DUMP_CFG_FLAG = "c";
  private static final String LOG_FILE_FLAG = "l";

  public static void main(String[] args) {
    String inputFile = processArgs(args);

    try {
      Settings.initKSCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      KSCompiler ksc = new KSCompiler(logger);
      ksc.compile(inputFile, System.out);
    } catch (KSCFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(PARSER_DEBUG_FLAG, "debug", false,
                   "Print syntax errors as the parser skips them");
    opts.addOption(DUMP_TOKENS_FLAG, "tokens", false, "Print token list");
    opts.addOption(DUMP_AST_FLAG, "ast", false, "Print syntax tree");
    opts.addOption(DUMP_CFG_FLAG, "cfg", false,
                   "Print control flow graph of each function");

    Option logFile = new Option(LOG_FILE_FLAG, "log", true,
                                "Write debug log to file");
    logFile.setArgName("logfile");
    opts.addOption(logFile);
    return opts;
  }

  /**
   * Record options in Settings
   * @return the input file name
   */
  private static String processArgs(String[] args) {
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

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    recordFlag(cmd, PARSER_DEBUG_FLAG, Settings.PARSER_DEBUG);
    recordFlag(cmd, DUMP_TOKENS_FLAG, Settings.DUMP_TOKENS);
    recordFlag(cmd, DUMP_AST_FLAG, Settings.DUMP_AST);
    recordFlag(cmd, DUMP_CFG_FLAG, Settings.DUMP_CFG);
    if (cmd.hasOption(LOG_FILE_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FILE_FLAG));
    }

    return remainingArgs[0];
  }

  private static void recordFlag(CommandLine cmd, String flag, String key) {
    if (cmd.hasOption(flag)) {
      Settings.set(key, "true");
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("ksc [options] <input>", opts);
  }
}
