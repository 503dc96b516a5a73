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
package exm.pyparse.parser;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.pyparse.ast.Node;
import exm.pyparse.ast.Span;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.common.exceptions.ParserRuntimeError;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

/**
 * Token matching, backtracking, memoization and error helpers shared
 * by the grammar layers.
 *
 * Rule methods return null when they do not match, with the cursor
 * restored to where the rule started.  Exceptions are only thrown for
 * input that no alternative can accept.
 */
public abstract class AbstractParser {

  public static final Set<String> KEYWORDS = new HashSet<String>(
      Arrays.asList("False", "None", "True", "and", "as", "assert",
          "async", "await", "break", "class", "continue", "def", "del",
          "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
          "pass", "raise", "return", "try", "while", "with", "yield"));

  /** Max expected alternatives listed in an error message */
  private static final int MAX_EXPECTED_SHOWN = 6;

  protected final ParserState state;

  /** Rule nesting for trace output */
  private int traceDepth = 0;

  protected AbstractParser(ParserState state) {
    this.state = state;
  }

  protected int mark() {
    return state.mark();
  }

  protected void reset(int mark) {
    state.reset(mark);
  }

  protected Token peek() {
    return state.peek(0);
  }

  protected Token peek(int ahead) {
    return state.peek(ahead);
  }

  /**
   * @return most recently consumed token
   */
  protected Token previous() {
    return state.get(state.mark() - 1);
  }

  protected Token advance() {
    Token t = peek();
    state.advance();
    return t;
  }

  /**
   * Test the next token without recording an expectation
   */
  protected boolean peekIs(TokenType type) {
    return peek().type == type;
  }

  protected boolean peekKeyword(String keyword) {
    return peek().isName(keyword);
  }

  protected boolean check(TokenType type) {
    if (peek().type == type) {
      return true;
    }
    state.expected(mark(), type.describe());
    return false;
  }

  protected boolean checkKeyword(String keyword) {
    if (peek().isName(keyword)) {
      return true;
    }
    state.expected(mark(), "'" + keyword + "'");
    return false;
  }

  /**
   * Consume a token of the given type
   * @return the token, or null if the next token differs
   */
  protected Token expect(TokenType type) {
    if (check(type)) {
      return advance();
    }
    return null;
  }

  protected boolean match(TokenType type) {
    return expect(type) != null;
  }

  /**
   * Consume a hard or soft keyword
   */
  protected Token expectKeyword(String keyword) {
    if (checkKeyword(keyword)) {
      return advance();
    }
    return null;
  }

  protected boolean matchKeyword(String keyword) {
    return expectKeyword(keyword) != null;
  }

  /**
   * Consume an identifier: a NAME that is not a hard keyword
   */
  protected Token expectName() {
    Token t = peek();
    if (t.type == TokenType.NAME && !KEYWORDS.contains(t.text)) {
      return advance();
    }
    state.expected(mark(), "NAME");
    return null;
  }

  protected static boolean isKeyword(Token t) {
    return t.type == TokenType.NAME && KEYWORDS.contains(t.text);
  }

  /**
   * Apply a rule through the memo cache
   */
  protected <T> T memoized(Rule rule, Class<T> type)
                                        throws InvalidSyntaxException {
    assert(rule.memoized) : rule;
    int start = mark();
    boolean trace = LogHelper.isTraceEnabled();
    if (state.memoEnabled()) {
      ParserState.Memo m = state.getMemo(rule, start);
      if (m != null) {
        if (trace) {
          LogHelper.trace(traceDepth, peek(), rule + " memo " +
                          (m.result == null ? "fail" : "hit"));
        }
        reset(m.end);
        return checkType(rule, m.result, type);
      }
    }

    if (trace) {
      LogHelper.trace(traceDepth, peek(), "> " + rule);
    }
    traceDepth++;
    Object result;
    try {
      result = invoke(rule);
    } finally {
      traceDepth--;
    }
    if (result == null) {
      reset(start);
    }
    if (trace) {
      LogHelper.trace(traceDepth, peek(), "< " + rule +
                      (result == null ? " failed" : " matched"));
    }
    if (state.memoEnabled()) {
      state.putMemo(rule, start, new ParserState.Memo(result, mark()));
    }
    return checkType(rule, result, type);
  }

  private static <T> T checkType(Rule rule, Object result, Class<T> type) {
    if (result != null && !type.isInstance(result)) {
      throw new ParserRuntimeError("Rule " + rule + " produced " +
            result.getClass().getName() + ", expected " + type.getName());
    }
    return type.cast(result);
  }

  /**
   * Test whether a rule matches here without consuming input
   * @param positive true for &rule, false for !rule
   */
  protected boolean lookahead(boolean positive, Rule rule)
                                        throws InvalidSyntaxException {
    int start = mark();
    Object result = invoke(rule);
    reset(start);
    return (result != null) == positive;
  }

  /**
   * Run the rule method for a rule constant.  Each grammar layer
   * handles its own rules and delegates the rest.
   */
  protected Object invoke(Rule rule) throws InvalidSyntaxException {
    throw new ParserRuntimeError("No method for rule " + rule);
  }

  /**
   * @return last consumed token that is not NEWLINE, INDENT or DEDENT
   */
  protected Token lastRealToken() {
    int i = mark() - 1;
    while (i > 0) {
      Token t = state.get(i);
      if (t.type != TokenType.NEWLINE && t.type != TokenType.INDENT &&
          t.type != TokenType.DEDENT) {
        return t;
      }
      i--;
    }
    return state.get(0);
  }

  /**
   * @return span from start token to end of the last consumed token
   */
  protected Span spanFrom(Token start) {
    Token end = lastRealToken();
    return new Span(start.line, start.col, end.endLine, end.endCol);
  }

  protected Span spanFrom(Node start) {
    Token end = lastRealToken();
    Span s = start.getSpan();
    return new Span(s.lineno, s.colOffset, end.endLine, end.endCol);
  }

  protected static Span spanOf(Token t) {
    return new Span(t.line, t.col, t.endLine, t.endCol);
  }

  protected InvalidSyntaxException error(Token t, String msg) {
    return new InvalidSyntaxException(state.getFile(), t.line, t.col, msg);
  }

  protected InvalidSyntaxException error(Node n, String msg) {
    Span s = n.getSpan();
    return new InvalidSyntaxException(state.getFile(), s.lineno,
                                      s.colOffset, msg);
  }

  /**
   * Build the error for a failed parse, positioned at the furthest
   * token any rule examined
   */
  protected InvalidSyntaxException furthestError() {
    Token t = state.furthestToken();
    switch (t.type) {
      case ERRORTOKEN: {
        int cp = t.text.codePointAt(0);
        return error(t, String.format("invalid character '%s' (U+%04X)",
                                      t.text, cp));
      }
      case INDENT:
        return error(t, "unexpected indent");
      case DEDENT:
        return error(t, "unexpected unindent");
      default:
        break;
    }
    StringBuilder msg = new StringBuilder("invalid syntax: unexpected ");
    msg.append(t.describe());
    List<String> expected = state.expectedAtFurthest();
    if (!expected.isEmpty()) {
      msg.append(", expected ");
      if (expected.size() > MAX_EXPECTED_SHOWN) {
        msg.append(StringUtils.join(expected.subList(0, MAX_EXPECTED_SHOWN),
                                    ", "));
        msg.append(", ...");
      } else {
        msg.append(StringUtils.join(expected, ", "));
      }
    }
    return error(t, msg.toString());
  }
}
