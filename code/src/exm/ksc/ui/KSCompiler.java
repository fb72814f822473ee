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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.KernelLexer;
import exm.ksc.ast.KernelParser;
import exm.ksc.ast.Token;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.ast.tree.Program;
import exm.ksc.common.Logging;
import exm.ksc.common.Settings;
import exm.ksc.common.exceptions.InvalidOptionException;
import exm.ksc.common.exceptions.InvalidSyntaxException;
import exm.ksc.common.exceptions.KSCFatal;
import exm.ksc.common.exceptions.UserException;
import exm.ksc.frontend.SemanticAnalyzer;
import exm.ksc.ic.CFGBuilder;
import exm.ksc.ic.CFGPrinter;

/**
 * This is the main entry point to the front end
 */
public class KSCompiler {

  private final Logger logger;

  /**
   * Output of a successful front end run
   */
  public static class Result {
    private final List<Token> tokens;
    private final Program program;
    private final List<InvalidSyntaxException> syntaxErrors;
    private final SemanticAnalyzer analyzer;

    private Result(List<Token> tokens, Program program,
        List<InvalidSyntaxException> syntaxErrors, SemanticAnalyzer analyzer) {
      this.tokens = tokens;
      this.program = program;
      this.syntaxErrors = syntaxErrors;
      this.analyzer = analyzer;
    }

    public List<Token> getTokens() {
      return tokens;
    }

    public Program getProgram() {
      return program;
    }

    /**
     * @return declarations the parser skipped over
     */
    public List<InvalidSyntaxException> getSyntaxErrors() {
      return syntaxErrors;
    }

    public SemanticAnalyzer getAnalyzer() {
      return analyzer;
    }

    public List<String> getWarnings() {
      return analyzer.getWarnings();
    }
  }

  public KSCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Check a source file and print any dumps requested in Settings.
   * Warnings and errors go to the log and stderr.
   * @param inputFile path of source file
   * @param out destination for dumps
   * @throws KSCFatal with the process exit code if checking failed
   */
  public void compile(String inputFile, PrintStream out) {
    try {
      logger.info("KSC starting: " + inputFile);

      String source;
      try {
        source = FileUtils.readFileToString(new File(inputFile),
                                            StandardCharsets.UTF_8);
      } catch (IOException e) {
        System.err.println("ksc error:");
        System.err.println("could not read " + inputFile + ": " +
                           e.getMessage());
        throw new KSCFatal(ExitCode.ERROR_IO.code());
      }

      Result result = runFrontend(source, inputFile,
                        Settings.getBoolean(Settings.PARSER_DEBUG),
                        Settings.getBoolean(Settings.DUMP_TOKENS),
                        Settings.getBoolean(Settings.DUMP_AST), out);
      for (String warning: result.getWarnings()) {
        Logging.uniqueWarn(inputFile + ": " + warning);
      }
      if (Settings.getBoolean(Settings.DUMP_CFG)) {
        dumpCFGs(result.getProgram(), out);
      }
      out.flush();

      if (!result.getSyntaxErrors().isEmpty()) {
        reportSyntaxErrors(inputFile, result.getSyntaxErrors());
        throw new KSCFatal(ExitCode.ERROR_PARSER.code());
      }
      logger.debug("KSC done: " + inputFile);
    }
    catch (KSCFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidOptionException e) {
      System.err.println("ksc error:");
      System.err.println(e.getMessage());
      throw new KSCFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (UserException e) {
      System.err.println("ksc error:");
      System.err.println(inputFile + ": " + e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new KSCFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new KSCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Lex, parse and analyze source held in memory
   * @param fileName name for diagnostics, may be null
   * @throws UserException if lexing or analysis failed
   */
  public Result frontend(String source, String fileName)
      throws UserException {
    return runFrontend(source, fileName, false, false, false, null);
  }

  /**
   * @param dumpOut destination for token and AST dumps
   */
  private Result runFrontend(String source, String fileName,
      boolean parserDebug, boolean dumpTokens, boolean dumpAst,
      PrintStream dumpOut) throws UserException {
    List<Token> tokens = KernelLexer.lex(source, fileName);
    if (dumpTokens) {
      for (Token tok: tokens) {
        dumpOut.println(tok);
      }
    }

    KernelParser parser = new KernelParser(tokens);
    parser.setDebug(parserDebug);
    Program program = parser.parse();
    logger.debug("Parsed " + program.getDeclarations().size() +
                 " top-level declarations");
    if (dumpAst) {
      dumpOut.print(program.printTree());
    }

    SemanticAnalyzer analyzer = new SemanticAnalyzer();
    analyzer.analyze(program);
    return new Result(tokens, program, parser.getRecoveredErrors(),
                      analyzer);
  }

  private void dumpCFGs(Program program, PrintStream out) {
    for (KernelAST decl: program.getDeclarations()) {
      if (decl instanceof FunctionDecl &&
          ((FunctionDecl)decl).getBody() != null) {
        CFGBuilder builder = new CFGBuilder();
        builder.build(decl);
        out.println("# " + ((FunctionDecl)decl).getName());
        CFGPrinter.print(builder.getBlocks(), out);
      }
    }
  }

  private static void reportSyntaxErrors(String inputFile,
                                  List<InvalidSyntaxException> errors) {
    System.err.println("ksc error:");
    for (InvalidSyntaxException e: errors) {
      System.err.println(inputFile + ": " + e.getMessage());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("KSC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
