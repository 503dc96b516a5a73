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

import exm.pyparse.ast.AstDump;
import exm.pyparse.ast.Module;
import exm.pyparse.ast.Stmt;
import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.frontend.ParsedModule;

public class PatternParserTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/PatternParserTest.pyparse.log", true);
  }

  /**
   * Dump the only case of a match statement
   */
  private static String caseOf(String pattern) throws InvalidSyntaxException {
    Module m = ParsedModule.parseSource("match p:\n    case " + pattern +
                                        ":\n        pass\n");
    Stmt.Match match = (Stmt.Match) m.body.get(0);
    assertEquals(1, match.cases.size());
    return AstDump.dump(match.cases.get(0));
  }

  private static String patternOf(String pattern)
                                        throws InvalidSyntaxException {
    String dump = caseOf(pattern);
    String prefix = "match_case(pattern=";
    String suffix = ", body=[Pass()])";
    assertTrue(dump, dump.startsWith(prefix) && dump.endsWith(suffix));
    return dump.substring(prefix.length(), dump.length() - suffix.length());
  }

  private static void assertPatternError(String pattern, String msg) {
    try {
      caseOf(pattern);
      fail("Expected syntax error for: " + pattern);
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(msg));
    }
  }

  @Test
  public void testMatchStatement() throws Exception {
    Module m = ParsedModule.parseSource(
        "match command.split():\n" +
        "    case [action]:\n" +
        "        pass\n" +
        "    case [action, obj]:\n" +
        "        pass\n" +
        "    case _:\n" +
        "        pass\n");
    assertEquals(1, m.body.size());
    Stmt.Match match = (Stmt.Match) m.body.get(0);
    assertEquals(3, match.cases.size());
    assertEquals("Call(func=Attribute(value=Name(id='command', " +
        "ctx=Load()), attr='split', ctx=Load()), args=[], keywords=[])",
        AstDump.dump(match.subject));
  }

  @Test
  public void testCaptureAndWildcard() throws Exception {
    assertEquals("MatchAs(name='x')", patternOf("x"));
    assertEquals("MatchAs()", patternOf("_"));
    assertEquals("MatchAs(pattern=MatchClass(cls=Name(id='str', " +
        "ctx=Load()), patterns=[], kwd_attrs=[], kwd_patterns=[]), " +
        "name='s')", patternOf("str() as s"));
  }

  @Test
  public void testLiterals() throws Exception {
    assertEquals("MatchSingleton(value=None)", patternOf("None"));
    assertEquals("MatchSingleton(value=True)", patternOf("True"));
    assertEquals("MatchValue(value=Constant(value='s'))",
                 patternOf("'s'"));
    assertEquals("MatchValue(value=UnaryOp(op=USub(), " +
        "operand=Constant(value=1)))", patternOf("-1"));
    assertEquals("MatchValue(value=BinOp(left=UnaryOp(op=USub(), " +
        "operand=Constant(value=1)), op=Add(), right=Constant(value=2j)))",
        patternOf("-1 + 2j"));
    assertEquals("MatchValue(value=Attribute(value=Name(id='Color', " +
        "ctx=Load()), attr='RED', ctx=Load()))", patternOf("Color.RED"));
  }

  @Test
  public void testOrPattern() throws Exception {
    assertEquals("MatchOr(patterns=[MatchValue(value=Constant(value=0)), " +
        "MatchValue(value=Constant(value=1))])", patternOf("0 | 1"));
  }

  @Test
  public void testSequences() throws Exception {
    assertEquals("MatchSequence(patterns=[MatchAs(name='x'), " +
        "MatchStar(name='rest')])", patternOf("[x, *rest]"));
    assertEquals("MatchSequence(patterns=[MatchValue(value=" +
        "Constant(value=1)), MatchStar()])", patternOf("(1, *_)"));
    assertEquals("MatchSequence(patterns=[MatchValue(value=" +
        "Constant(value=1)), MatchValue(value=Constant(value=2))])",
        patternOf("1, 2"));
    assertEquals("MatchSequence(patterns=[])", patternOf("()"));
    // Parentheses alone only group
    assertEquals("MatchAs(name='y')", patternOf("(y)"));
  }

  @Test
  public void testMapping() throws Exception {
    assertEquals("MatchMapping(keys=[Constant(value='k')], " +
        "patterns=[MatchAs(name='v')], rest='kw')",
        patternOf("{'k': v, **kw}"));
    assertEquals("MatchMapping(keys=[], patterns=[])", patternOf("{}"));
  }

  @Test
  public void testClassPattern() throws Exception {
    assertEquals("MatchClass(cls=Name(id='Point', ctx=Load()), " +
        "patterns=[], kwd_attrs=['x', 'y'], kwd_patterns=[" +
        "MatchValue(value=Constant(value=0)), MatchAs()])",
        patternOf("Point(x=0, y=_)"));
    assertEquals("MatchClass(cls=Attribute(value=Name(id='shapes', " +
        "ctx=Load()), attr='Circle', ctx=Load()), patterns=[" +
        "MatchAs(name='r')], kwd_attrs=[], kwd_patterns=[])",
        patternOf("shapes.Circle(r)"));
  }

  @Test
  public void testGuard() throws Exception {
    assertEquals("match_case(pattern=MatchSequence(patterns=[" +
        "MatchAs(name='a'), MatchAs(name='b')]), guard=Compare(" +
        "left=Name(id='a', ctx=Load()), ops=[Gt()], comparators=[" +
        "Name(id='b', ctx=Load())]), body=[Pass()])",
        caseOf("(a, b) if a > b"));
  }

  @Test
  public void testPatternErrors() {
    assertPatternError("x as _", "cannot use '_' as a target");
    assertPatternError("Point(x=1, 2)",
                       "positional patterns follow keyword patterns");
    assertPatternError("1j + 2j", "real number required in complex literal");
    assertPatternError("1 + 2", "imaginary number required in complex " +
                                "literal");
    assertPatternError("{a: 1}",
                       "patterns may only match literals and attribute " +
                       "lookups");
  }
}
