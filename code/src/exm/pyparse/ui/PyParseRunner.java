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
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

import exm.pyparse.ast.AstDump;
import exm.pyparse.ast.Node;
import exm.pyparse.ast.TreeWalk;
import exm.pyparse.ast.TreeWalk.TreeWalker;
import exm.pyparse.common.exceptions.PyParseFatal;
import exm.pyparse.common.exceptions.UserException;
import exm.pyparse.frontend.ParsedModule;
import exm.pyparse.lexer.Token;

/**
 * Runs the tokenizer and parser on one input file and prints the
 * requested view of the result
 */
public class PyParseRunner {

  public static enum OutputMode {
    /** ast.dump text of the tree */
    TREE,
    /** One line per token */
    TOKENS,
    /** Node counts per node type */
    STATS,
  }

  private final Logger logger;

  public PyParseRunner(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Process a file, writing the result to output.
   * @param inputFile
   * @param mode what to print
   * @param indent dump indent, negative for a single line
   * @param attributes include node positions in the dump
   * @param output
   * @throws PyParseFatal with the exit code on any error
   */
  public void run(String inputFile, OutputMode mode, int indent,
                  boolean attributes, PrintStream output) {
    try {
      logger.debug("pyparse starting: " + inputFile);
      if (mode == OutputMode.TOKENS) {
        String source = FileUtils.readFileToString(new File(inputFile),
                                                   "UTF-8");
        printTokens(ParsedModule.tokenize(inputFile, source), output);
      } else {
        ParsedModule parsed = ParsedModule.parseFile(inputFile);
        if (mode == OutputMode.STATS) {
          printStats(nodeCounts(parsed.ast), output);
        } else {
          output.println(AstDump.dump(parsed.ast, indent, attributes));
        }
      }
      output.flush();
      logger.debug("pyparse done: " + inputFile);
    } catch (PyParseFatal e) {
      // Rethrow
      throw e;
    } catch (IOException e) {
      System.err.println("pyparse error:");
      System.err.println("Could not read " + inputFile + ": " +
                         e.getMessage());
      throw new PyParseFatal(ExitCode.ERROR_IO.code());
    } catch (UserException e) {
      System.err.println("pyparse error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug("Parse failed", e);
      }
      throw new PyParseFatal(ExitCode.ERROR_USER.code());
    } catch (AssertionError e) {
      reportInternalError(e);
      throw new PyParseFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (Throwable e) {
      // Other error, possibly ParserRuntimeError
      reportInternalError(logger, e);
      throw new PyParseFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Count nodes of each type in a tree, keyed by node name
   */
  public static Multiset<String> nodeCounts(Node root) {
    final Multiset<String> counts = TreeMultiset.create();
    TreeWalk.walk(root, new TreeWalker() {
      @Override
      public void visitNode(Node node) {
        counts.add(node.nodeName());
      }
    });
    return counts;
  }

  private static void printTokens(List<Token> tokens, PrintStream output) {
    for (Token t: tokens) {
      output.println(t);
    }
  }

  private static void printStats(Multiset<String> counts,
                                 PrintStream output) {
    for (Multiset.Entry<String> e: counts.entrySet()) {
      output.println(e.getElement() + "\t" + e.getCount());
    }
    output.println("total\t" + counts.size());
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("PYPARSE INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    logger.error("Internal error", e);
    reportInternalError(e);
  }
}
