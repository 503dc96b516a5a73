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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;

import org.apache.log4j.Level;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.ast.AstDump;
import exm.pyparse.ast.Module;
import exm.pyparse.ast.Stmt;
import exm.pyparse.common.Logging;
import exm.pyparse.common.Settings;
import exm.pyparse.common.exceptions.InvalidSyntaxException;

public class ParsedModuleTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ParsedModuleTest.pyparse.log", true);
  }

  static String fixture(String name) throws URISyntaxException {
    return new File(ParsedModuleTest.class.getResource(
                          "/fixtures/" + name).toURI()).getPath();
  }

  @Test
  public void testParseFile() throws Exception {
    ParsedModule parsed = ParsedModule.parseFile(fixture("shapes.py"));
    assertEquals("shapes", parsed.moduleName());
    assertTrue(parsed.inputFilePath.endsWith("shapes.py"));
    assertTrue(parsed.tokenCount > 100);

    Module m = parsed.ast;
    assertEquals(13, m.body.size());
    assertEquals("Expr(value=Constant(value='Geometry helpers.'))",
                 AstDump.dump(m.body.get(0)));
    assertEquals("ImportFrom(module='__future__', names=[alias(" +
                 "name='annotations')], level=0)",
                 AstDump.dump(m.body.get(1)));
    assertTrue(m.body.get(5) instanceof Stmt.ClassDef);
    Stmt.FunctionDef load = (Stmt.FunctionDef) m.body.get(7);
    assertEquals("load", load.name);
    assertTrue(load.isAsync);
    assertTrue(m.body.get(12) instanceof Stmt.While);
  }

  @Test
  public void testTypeParameterFile() throws Exception {
    Module m = ParsedModule.parseFile(fixture("generics.py")).ast;
    assertEquals(3, m.body.size());
    assertEquals("TypeAlias(name=Name(id='Pair', ctx=Store()), " +
        "type_params=[TypeVar(name='T')], value=Subscript(value=" +
        "Name(id='tuple', ctx=Load()), slice=Tuple(elts=[Name(id='T', " +
        "ctx=Load()), Name(id='T', ctx=Load())], ctx=Load()), " +
        "ctx=Load()))", AstDump.dump(m.body.get(0)));
    Stmt.ClassDef box = (Stmt.ClassDef) m.body.get(2);
    assertEquals("[TypeVar(name='T', default_value=Name(id='int', " +
                 "ctx=Load()))]", box.typeParams.toString());
  }

  @Test
  public void testBadIndentFile() throws Exception {
    try {
      ParsedModule.parseFile(fixture("bad_indent.py"));
      fail("Expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertEquals("unexpected indent", e.getDetail());
      assertEquals(3, e.getLine());
      assertTrue(e.getFile().endsWith("bad_indent.py"));
    }
  }

  @Test(expected=IOException.class)
  public void testMissingFile() throws Exception {
    ParsedModule.parseFile("target/no-such-file.py");
  }

  @Test
  public void testTabSizeSetting() throws Exception {
    // Nested only when a tab stop is four columns wide
    String source = "if x:\n  \tif y:\n    \tz\n";
    try {
      ParsedModule.parseSource(source);
      fail("Expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertEquals("inconsistent use of tabs and spaces in indentation",
                   e.getDetail());
    }
    Settings.set(Settings.TAB_SIZE, "4");
    try {
      Module m = ParsedModule.parseSource(source);
      assertEquals(1, m.body.size());
      Stmt.If outer = (Stmt.If) m.body.get(0);
      assertTrue(outer.body.get(0) instanceof Stmt.If);
    } finally {
      Settings.reset(Settings.TAB_SIZE);
    }
  }

  @Test
  public void testWarningsPerParse() throws Exception {
    String msg = "invalid escape sequence '\\q'";
    ParsedModule.parseSource("s = '\\q'\n");
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    // A later input warns again
    ParsedModule.parseSource("s = 1\n");
    assertTrue(Logging.addEmitted(Level.WARN, msg));
  }

  @Test
  public void testMemoizeSetting() throws Exception {
    String source = "x = [a for a in f(b, c=d)]\n";
    String expected = AstDump.dump(ParsedModule.parseSource(source));
    Settings.set(Settings.PARSER_MEMOIZE, "false");
    try {
      assertEquals(expected, AstDump.dump(ParsedModule.parseSource(source)));
    } finally {
      Settings.reset(Settings.PARSER_MEMOIZE);
    }
  }
}
