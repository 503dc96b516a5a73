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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.common.exceptions.LexException;
import exm.pyparse.frontend.ParsedModule;

/**
 * Check messages and positions of syntax errors
 */
public class ErrorReportingTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ErrorReportingTest.pyparse.log", true);
  }

  private static InvalidSyntaxException parseError(String source) {
    try {
      ParsedModule.parseSource(source);
    } catch (InvalidSyntaxException e) {
      return e;
    }
    fail("Expected syntax error for: " + source);
    return null;
  }

  private static void assertError(String source, String msg) {
    InvalidSyntaxException e = parseError(source);
    assertTrue("Message was: " + e.getDetail(),
               e.getDetail().contains(msg));
  }

  private static void assertError(String source, int line, int col,
                                  String msg) {
    InvalidSyntaxException e = parseError(source);
    assertTrue("Message was: " + e.getDetail(),
               e.getDetail().contains(msg));
    assertEquals("line of: " + e.getMessage(), line, e.getLine());
    assertEquals("column of: " + e.getMessage(), col, e.getColumn());
  }

  @Test
  public void testFurthestToken() {
    InvalidSyntaxException e = parseError("x = = 1\n");
    assertEquals(1, e.getLine());
    assertEquals(4, e.getColumn());
    assertTrue(e.getDetail(), e.getDetail().startsWith("invalid syntax"));
    assertEquals("<string>:1:5: " + e.getDetail(), e.getMessage());

    assertError("print 'hello'\n", 1, 6, "invalid syntax");
  }

  @Test
  public void testIndentation() {
    assertError("x = 1\n    y = 2\n", 2, 0, "unexpected indent");
    assertError("if x:\npass\n", 2, 0,
                "expected an indented block after 'if' statement on line 1");
    assertError("def f():\n\nx = 1\n",
                "expected an indented block after function definition");
  }

  @Test
  public void testInvalidTargets() {
    assertError("1 = x\n", 1, 0, "cannot assign to literal");
    assertError("f() = 1\n", 1, 0, "cannot assign to function call");
    assertError("a, b + 1 = 2\n", 1, 3, "cannot assign to expression");
    assertError("a + 1 += 2\n", 1, 0,
                "'expression' is an illegal expression for augmented " +
                "assignment");
    assertError("a, b: int\n", "only single target (not tuple) can be " +
                "annotated");
    assertError("del f()\n", 1, 4, "cannot delete function call");
  }

  @Test
  public void testCallArguments() {
    assertError("f(x for x in y, 1)\n",
                "Generator expression must be parenthesized");
    assertError("f(a=1, b)\n", 1, 7,
                "positional argument follows keyword argument");
    assertError("f(**k, *a)\n", "iterable argument unpacking follows " +
                "keyword argument unpacking");
    assertError("f(a + 1 = 2)\n", "expression cannot contain assignment");
  }

  @Test
  public void testParameters() {
    assertError("def f(a=1, b): pass\n",
                "parameter without a default follows parameter with a " +
                "default");
    assertError("def f(*): pass\n", "named arguments must follow bare *");
    assertError("def f(/, a): pass\n",
                "at least one argument must precede /");
    assertError("def f(**k, a): pass\n",
                "arguments cannot follow var-keyword argument");
    assertError("def f[](): pass\n", "Type parameter list cannot be empty");
  }

  @Test
  public void testStatements() {
    assertError("from m import a, b,\n",
                "trailing comma not allowed without surrounding parentheses");
    assertError("try:\n    pass\nexcept A, B:\n    pass\n", 3, 7,
                "multiple exception types must be parenthesized");
    assertError("try:\n    pass\nx = 1\n",
                "expected 'except' or 'finally' block");
    assertError("x = 1 if y\n", "expected 'else' after 'if' expression");
    assertError("[*a for a in b]\n",
                "iterable unpacking cannot be used in comprehension");
  }

  @Test
  public void testInvalidCharacter() {
    assertError("x = $\n", 1, 4, "invalid character '$' (U+0024)");
  }

  @Test
  public void testTokenizerErrors() {
    InvalidSyntaxException e = parseError("x = (1, 2\n");
    assertTrue(e instanceof LexException);
    assertEquals("'(' was never closed", e.getDetail());
    assertEquals(4, e.getColumn());
  }

  @Test
  public void testLiteralErrors() {
    assertError("x = 012\n", 1, 4,
                "leading zeros in decimal integer literals are not " +
                "permitted");
    assertError("b'caf\u00e9'\n",
                "bytes can only contain ASCII literal characters");
    assertError("'\\x4'\n", "truncated \\xXX escape");
  }
}
