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
package exm.pyparse.frontend;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.pyparse.ast.Module;
import exm.pyparse.common.Logging;
import exm.pyparse.common.Settings;
import exm.pyparse.common.exceptions.InvalidOptionException;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.common.exceptions.ParserRuntimeError;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.Tokenizer;
import exm.pyparse.parser.ParserState;
import exm.pyparse.parser.StatementParser;

/**
 * Represents a parsed Python source module
 */
public class ParsedModule {

  /** File name used in messages when parsing a string */
  public static final String STRING_INPUT = "<string>";

  /** Stack size for the parser thread: bracket nesting costs many frames */
  public static final long PARSER_STACK_SIZE = 16L * 1024 * 1024;

  public ParsedModule(String moduleName, String filePath, Module ast,
                      int tokenCount) {
    this.moduleName = moduleName;
    this.inputFilePath = filePath;
    this.ast = ast;
    this.tokenCount = tokenCount;
  }

  /** Canonical name for module */
  public final String moduleName;
  public final String inputFilePath;
  public final Module ast;
  /** Tokens consumed, including ENDMARKER */
  public final int tokenCount;

  /**
   * Tokenize and parse module source text
   * @param moduleName name recorded for the module
   * @param filePath file name used in error messages
   * @param source module text
   * @throws InvalidSyntaxException
   */
  public static ParsedModule parse(String moduleName, String filePath,
                         String source) throws InvalidSyntaxException {
    Logger logger = Logging.getLogger();
    logger.debug("Parsing module " + moduleName + " from " + filePath);
    Logging.clearEmitted();
    Tokenizer tokenizer = new Tokenizer(filePath, source, tabSize());
    List<Token> tokens = tokenizer.tokenize();
    Module ast = parseTokens(filePath, tokenizer.getSource(), tokens,
                             memoize());
    logger.debug("Done parsing module " + moduleName + ": " +
                 ast.body.size() + " top-level statements");
    return new ParsedModule(moduleName, filePath, ast, tokens.size());
  }

  public static ParsedModule parse(String moduleName, String source)
                                        throws InvalidSyntaxException {
    return parse(moduleName, STRING_INPUT, source);
  }

  /**
   * Read a UTF-8 file and parse it.  The module is named after the file.
   */
  public static ParsedModule parseFile(String path)
                              throws IOException, InvalidSyntaxException {
    File f = new File(path);
    String source = FileUtils.readFileToString(f, "UTF-8");
    return parse(moduleNameFor(f), path, source);
  }

  /**
   * Shortest way from source text to a tree
   */
  public static Module parseSource(String source)
                                        throws InvalidSyntaxException {
    return parse("__main__", source).ast;
  }

  /**
   * Tokenize with the configured tab size
   */
  public static List<Token> tokenize(String file, String source)
                                        throws InvalidSyntaxException {
    return new Tokenizer(file, source, tabSize()).tokenize();
  }

  /**
   * Run the parser over an existing token list.  The parser runs on its
   * own thread with a large stack and the caller waits for it.
   * @param source normalized source text the token offsets refer to
   * @param memoize enable the packrat cache
   */
  public static Module parseTokens(String file, String source,
        List<Token> tokens, boolean memoize) throws InvalidSyntaxException {
    final ParserState state = new ParserState(file, source, tokens, memoize);
    final Module result[] = new Module[1];
    final Throwable failure[] = new Throwable[1];
    Thread parserThread = new Thread(null, new Runnable() {
      @Override
      public void run() {
        try {
          result[0] = new StatementParser(state).file();
        } catch (Throwable e) {
          failure[0] = e;
        }
      }
    }, "pyparse-parser", PARSER_STACK_SIZE);
    parserThread.start();
    try {
      parserThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParserRuntimeError("Interrupted while parsing " + file, e);
    }

    if (failure[0] instanceof InvalidSyntaxException) {
      throw (InvalidSyntaxException) failure[0];
    } else if (failure[0] instanceof RuntimeException) {
      throw (RuntimeException) failure[0];
    } else if (failure[0] instanceof Error) {
      throw (Error) failure[0];
    } else if (failure[0] != null) {
      throw new ParserRuntimeError("Parser failed on " + file, failure[0]);
    }

    Logger logger = Logging.getLogger();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + tokens.size() + " tokens, memo entries: " +
                   state.memoSize() + " hits: " + state.memoHits());
    }
    return result[0];
  }

  public String moduleName() {
    return this.moduleName;
  }

  private static String moduleNameFor(File f) {
    String name = f.getName();
    if (name.endsWith(".py")) {
      name = name.substring(0, name.length() - 3);
    }
    return name;
  }

  private static int tabSize() {
    try {
      return Settings.getInt(Settings.TAB_SIZE, 1, Settings.MAX_TAB_SIZE);
    } catch (InvalidOptionException e) {
      throw new ParserRuntimeError(e.getMessage());
    }
  }

  private static boolean memoize() {
    try {
      return Settings.getBoolean(Settings.PARSER_MEMOIZE);
    } catch (InvalidOptionException e) {
      throw new ParserRuntimeError(e.getMessage());
    }
  }
}
