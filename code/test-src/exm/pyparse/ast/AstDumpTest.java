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
package exm.pyparse.ast;

import static org.junit.Assert.assertEquals;

import java.math.BigInteger;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.common.Logging;
import exm.pyparse.frontend.ParsedModule;

public class AstDumpTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/AstDumpTest.pyparse.log", true);
  }

  @Test
  public void testIndented() throws Exception {
    Module m = ParsedModule.parseSource("x = 1\n");
    assertEquals("Module(\n" +
                 "  body=[\n" +
                 "    Assign(\n" +
                 "      targets=[\n" +
                 "        Name(id='x', ctx=Store())],\n" +
                 "      value=Constant(value=1))],\n" +
                 "  type_ignores=[])",
                 AstDump.dump(m, 2, false));
  }

  @Test
  public void testAttributes() throws Exception {
    Module m = ParsedModule.parseSource("x = 1\n");
    assertEquals("Module(body=[Assign(targets=[Name(id='x', ctx=Store(), " +
        "lineno=1, col_offset=0, end_lineno=1, end_col_offset=1)], " +
        "value=Constant(value=1, lineno=1, col_offset=4, end_lineno=1, " +
        "end_col_offset=5), lineno=1, col_offset=0, end_lineno=1, " +
        "end_col_offset=5)], type_ignores=[])",
        AstDump.dump(m, -1, true));
  }

  @Test
  public void testMultiLineSpan() throws Exception {
    Module m = ParsedModule.parseSource("if a:\n    b = (1,\n  2)\n");
    Stmt.If s = (Stmt.If) m.body.get(0);
    assertEquals(1, s.lineno());
    assertEquals(0, s.colOffset());
    assertEquals(3, s.endLineno());
    assertEquals(4, s.endColOffset());
    Stmt.Assign assign = (Stmt.Assign) s.body.get(0);
    assertEquals(new Span(2, 4, 3, 4), assign.getSpan());
    assertEquals(new Span(2, 8, 3, 4), assign.value.getSpan());
  }

  private static Span exprSpan(String source) throws Exception {
    Module m = ParsedModule.parseSource(source);
    return ((Stmt.ExprStmt) m.body.get(0)).value.getSpan();
  }

  @Test
  public void testParenthesizedOperandSpans() throws Exception {
    Module m = ParsedModule.parseSource("x = (a + b) * 2\n");
    assertEquals("Module(body=[Assign(targets=[Name(id='x', ctx=Store(), " +
        "lineno=1, col_offset=0, end_lineno=1, end_col_offset=1)], " +
        "value=BinOp(left=BinOp(left=Name(id='a', ctx=Load(), lineno=1, " +
        "col_offset=5, end_lineno=1, end_col_offset=6), op=Add(), " +
        "right=Name(id='b', ctx=Load(), lineno=1, col_offset=9, " +
        "end_lineno=1, end_col_offset=10), lineno=1, col_offset=5, " +
        "end_lineno=1, end_col_offset=10), op=Mult(), right=Constant(" +
        "value=2, lineno=1, col_offset=14, end_lineno=1, " +
        "end_col_offset=15), lineno=1, col_offset=4, end_lineno=1, " +
        "end_col_offset=15), lineno=1, col_offset=0, end_lineno=1, " +
        "end_col_offset=15)], type_ignores=[])",
        AstDump.dump(m, -1, true));

    assertEquals(new Span(1, 0, 1, 5), exprSpan("(a).b\n"));
    assertEquals(new Span(1, 0, 1, 6), exprSpan("(a)(b)\n"));
    assertEquals(new Span(1, 0, 1, 6), exprSpan("(a)[b]\n"));
    assertEquals(new Span(1, 0, 1, 7), exprSpan("(a) < b\n"));
    assertEquals(new Span(1, 0, 1, 8), exprSpan("(a) or b\n"));
    assertEquals(new Span(1, 0, 1, 8), exprSpan("(a) ** 2\n"));
    assertEquals(new Span(1, 0, 1, 15), exprSpan("(a) if b else c\n"));

    Stmt.If s = (Stmt.If) ParsedModule.parseSource(
                                  "if (n := 10) > 5: pass\n").body.get(0);
    assertEquals(new Span(1, 3, 1, 16), s.test.getSpan());

    Stmt.Assign assign = (Stmt.Assign) ParsedModule.parseSource(
                                  "(a).b = 1\n").body.get(0);
    assertEquals(new Span(1, 0, 1, 5), assign.targets.get(0).getSpan());
  }

  @Test
  public void testReprString() {
    assertEquals("'abc'", AstDump.repr("abc"));
    assertEquals("\"it's\"", AstDump.repr("it's"));
    assertEquals("'both \\' \"'", AstDump.repr("both ' \""));
    assertEquals("'a\\nb\\tc\\\\'", AstDump.repr("a\nb\tc\\"));
    assertEquals("'\\x00\\x7f'", AstDump.repr("\u0000\u007f"));
    assertEquals("'caf\u00e9'", AstDump.repr("caf\u00e9"));
    assertEquals("'\\xa0'", AstDump.repr("\u00a0"));
    assertEquals("'\\u200b'", AstDump.repr("\u200b"));
  }

  @Test
  public void testReprBytes() {
    assertEquals("b'A\\x00\\xff'",
        AstDump.repr(new PyBytes(new byte[] {'A', 0, (byte) 0xff})));
    assertEquals("b\"'\"", AstDump.repr(new PyBytes(new byte[] {'\''})));
  }

  @Test
  public void testReprNumbers() {
    assertEquals("10", AstDump.repr(BigInteger.TEN));
    assertEquals("1.5", AstDump.repr(1.5));
    assertEquals("1500.0", AstDump.repr(1500.0));
    assertEquals("1e+16", AstDump.repr(1e16));
    assertEquals("1.5e-05", AstDump.repr(1.5e-5));
    assertEquals("0.0001", AstDump.repr(1e-4));
    assertEquals("-0.0", AstDump.repr(-0.0));
    assertEquals("inf", AstDump.repr(Double.POSITIVE_INFINITY));
    assertEquals("2j", AstDump.repr(new Imaginary(2.0)));
    assertEquals("1.5j", AstDump.repr(new Imaginary(1.5)));
    assertEquals("None", AstDump.repr(PyConstant.NONE));
    assertEquals("Ellipsis", AstDump.repr(PyConstant.ELLIPSIS));
    assertEquals("True", AstDump.repr(Boolean.TRUE));
  }

  @Test
  public void testToString() throws Exception {
    Module m = ParsedModule.parseSource("pass\n");
    assertEquals("Pass()", m.body.get(0).toString());
  }
}
