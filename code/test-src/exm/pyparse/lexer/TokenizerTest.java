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
package exm.pyparse.lexer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.common.exceptions.LexException;

public class TokenizerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TokenizerTest.pyparse.log", true);
  }

  private static List<Token> tokenize(String source)
                                        throws InvalidSyntaxException {
    return new Tokenizer("<test>", source).tokenize();
  }

  private static List<TokenType> types(String source)
                                        throws InvalidSyntaxException {
    List<TokenType> result = new ArrayList<TokenType>();
    for (Token t: tokenize(source)) {
      result.add(t.type);
    }
    return result;
  }

  @Test
  public void testIndentDedent() throws Exception {
    assertEquals(Arrays.asList(TokenType.NAME, TokenType.NAME,
        TokenType.COLON, TokenType.NEWLINE, TokenType.INDENT, TokenType.NAME,
        TokenType.NEWLINE, TokenType.DEDENT, TokenType.NAME,
        TokenType.NEWLINE, TokenType.ENDMARKER),
        types("if x:\n    y\nz\n"));
  }

  @Test
  public void testDedentsAtEndOfFile() throws Exception {
    List<TokenType> t = types("if a:\n  if b:\n    c");
    int indents = 0;
    int dedents = 0;
    for (TokenType type: t) {
      if (type == TokenType.INDENT) {
        indents++;
      } else if (type == TokenType.DEDENT) {
        dedents++;
      }
    }
    assertEquals(2, indents);
    assertEquals(2, dedents);
    // Missing final newline is supplied
    assertEquals(TokenType.NEWLINE, t.get(t.size() - 4));
    assertEquals(TokenType.ENDMARKER, t.get(t.size() - 1));
  }

  @Test
  public void testBlankAndCommentLines() throws Exception {
    assertEquals(Arrays.asList(TokenType.NAME, TokenType.NEWLINE,
                               TokenType.NAME, TokenType.NEWLINE,
                               TokenType.ENDMARKER),
                 types("a\n\n   # comment\n\nb  # trailing\n"));
  }

  @Test
  public void testImplicitLineJoining() throws Exception {
    assertEquals(Arrays.asList(TokenType.LPAR, TokenType.NAME,
        TokenType.COMMA, TokenType.NAME, TokenType.RPAR, TokenType.NEWLINE,
        TokenType.ENDMARKER), types("(a,\n     b)\n"));
  }

  @Test
  public void testBackslashContinuation() throws Exception {
    assertEquals(Arrays.asList(TokenType.NAME, TokenType.PLUS,
        TokenType.NAME, TokenType.NEWLINE, TokenType.ENDMARKER),
        types("a + \\\n  b\n"));
  }

  @Test
  public void testPositions() throws Exception {
    List<Token> tokens = tokenize("x = 10\n");
    Token x = tokens.get(0);
    assertEquals(1, x.line);
    assertEquals(0, x.col);
    assertEquals(1, x.endCol);
    Token eq = tokens.get(1);
    assertEquals(TokenType.EQUAL, eq.type);
    assertEquals(2, eq.col);
    Token num = tokens.get(2);
    assertEquals(TokenType.NUMBER, num.type);
    assertEquals("10", num.text);
    assertEquals(4, num.col);
    assertEquals(6, num.endCol);
  }

  @Test
  public void testOperatorsLongestMatch() throws Exception {
    assertEquals(Arrays.asList(TokenType.NAME, TokenType.DOUBLESTAREQUAL,
        TokenType.NAME, TokenType.DOUBLESLASH, TokenType.NAME,
        TokenType.NEWLINE, TokenType.ENDMARKER),
        types("a **= b // c"));
    assertEquals(Arrays.asList(TokenType.NAME, TokenType.RARROW,
        TokenType.ELLIPSIS, TokenType.COLONEQUAL, TokenType.NEWLINE,
        TokenType.ENDMARKER), types("f -> ... :="));
  }

  @Test
  public void testStringPrefixes() throws Exception {
    List<Token> tokens = tokenize("rb'x' u\"y\" '''a\nb'''\n");
    assertEquals(TokenType.STRING, tokens.get(0).type);
    assertEquals("rb'x'", tokens.get(0).text);
    assertEquals("u\"y\"", tokens.get(1).text);
    assertEquals(TokenType.STRING, tokens.get(2).type);
    assertEquals(2, tokens.get(2).endLine);
  }

  @Test
  public void testFStringTokens() throws Exception {
    assertEquals(Arrays.asList(TokenType.FSTRING_START,
        TokenType.FSTRING_MIDDLE, TokenType.LBRACE, TokenType.NAME,
        TokenType.RBRACE, TokenType.FSTRING_MIDDLE, TokenType.FSTRING_END,
        TokenType.NEWLINE, TokenType.ENDMARKER),
        types("f\"a{b}c\""));
  }

  @Test
  public void testNestedFString() throws Exception {
    List<TokenType> t = types("f\"{a + f'{b}'}\"");
    assertEquals(TokenType.FSTRING_START, t.get(0));
    assertEquals(TokenType.LBRACE, t.get(1));
    assertEquals(TokenType.NAME, t.get(2));
    assertEquals(TokenType.PLUS, t.get(3));
    assertEquals(TokenType.FSTRING_START, t.get(4));
    assertEquals(TokenType.LBRACE, t.get(5));
    assertEquals(TokenType.NAME, t.get(6));
    assertEquals(TokenType.RBRACE, t.get(7));
    assertEquals(TokenType.FSTRING_END, t.get(8));
    assertEquals(TokenType.RBRACE, t.get(9));
    assertEquals(TokenType.FSTRING_END, t.get(10));
  }

  @Test
  public void testCrLfAndBom() throws Exception {
    assertEquals(types("a\nb\n"), types("\uFEFFa\r\nb\r\n"));
  }

  @Test
  public void testDeterministic() throws Exception {
    String src = "def f(x):\n    return [y for y in x if y]\n";
    assertEquals(tokenize(src), tokenize(src));
  }

  @Test
  public void testUnterminatedString() throws Exception {
    try {
      tokenize("x = 'abc\n");
      fail("Expected exception");
    } catch (LexException e) {
      assertTrue(e.getDetail(),
          e.getDetail().startsWith("unterminated string literal"));
      assertEquals(1, e.getLine());
      assertEquals(4, e.getColumn());
    }
  }

  private static LexException lexError(String source) throws Exception {
    try {
      tokenize(source);
    } catch (LexException e) {
      return e;
    }
    fail("Expected exception for: " + source);
    return null;
  }

  @Test
  public void testUnterminatedFString() throws Exception {
    LexException e = lexError("x = f\"{x\n");
    assertTrue(e.getDetail(),
        e.getDetail().startsWith("unterminated f-string literal"));
    assertEquals(1, e.getLine());
    assertEquals(4, e.getColumn());

    e = lexError("x = f'''a\nb\n");
    assertTrue(e.getDetail(), e.getDetail().startsWith(
                    "unterminated triple-quoted f-string literal"));
    assertEquals(1, e.getLine());
    assertEquals(4, e.getColumn());

    e = lexError("t'abc\n");
    assertTrue(e.getDetail(),
        e.getDetail().startsWith("unterminated t-string literal"));
  }

  @Test
  public void testSingleClosingBrace() throws Exception {
    LexException e = lexError("x = f'a}b'\n");
    assertEquals("f-string: single '}' is not allowed", e.getDetail());
    assertEquals(1, e.getLine());
    assertEquals(7, e.getColumn());

    // Doubled braces are literal text
    assertEquals(TokenType.FSTRING_END, tokenize("f'a}}b'\n").get(2).type);
  }

  @Test
  public void testUnclosedBracket() throws Exception {
    try {
      tokenize("foo(1, 2\n");
      fail("Expected exception");
    } catch (LexException e) {
      assertEquals("'(' was never closed", e.getDetail());
      assertEquals(3, e.getColumn());
    }
  }

  @Test
  public void testMismatchedBracket() throws Exception {
    try {
      tokenize("[1, 2)\n");
      fail("Expected exception");
    } catch (InvalidSyntaxException e) {
      assertEquals("closing parenthesis ')' does not match opening " +
                   "parenthesis '['", e.getDetail());
    }
  }

  @Test
  public void testInconsistentDedent() throws Exception {
    try {
      tokenize("if x:\n    a\n  b\n");
      fail("Expected exception");
    } catch (LexException e) {
      assertEquals("unindent does not match any outer indentation level",
                   e.getDetail());
      assertEquals(3, e.getLine());
    }
  }

  @Test
  public void testTabsAndSpacesMixed() throws Exception {
    List<TokenType> t = types("if x:\n\ta\n\tb\n");
    assertEquals(1, countOf(t, TokenType.INDENT));
    assertEquals(1, countOf(t, TokenType.DEDENT));
    try {
      // Same width with the default tab size, but ambiguous
      tokenize("if x:\n\ta\n        b\n");
      fail("Expected exception");
    } catch (LexException e) {
      assertEquals("inconsistent use of tabs and spaces in indentation",
                   e.getDetail());
    }
  }

  private static int countOf(List<TokenType> types, TokenType type) {
    int n = 0;
    for (TokenType t: types) {
      if (t == type) {
        n++;
      }
    }
    return n;
  }
}
