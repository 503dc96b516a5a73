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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.Multiset;

import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.PyParseFatal;
import exm.pyparse.frontend.ParsedModule;
import exm.pyparse.ui.PyParseRunner.OutputMode;

public class PyParseRunnerTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("target/PyParseRunnerTest.pyparse.log",
                                  true);
  }

  private static String writeInput(String name, String source)
                                                    throws IOException {
    File f = new File("target/runner-test/" + name);
    FileUtils.writeStringToFile(f, source, "UTF-8");
    return f.getPath();
  }

  private static String run(String input, OutputMode mode, int indent,
                            boolean attributes) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    new PyParseRunner(logger).run(input, mode, indent, attributes, out);
    return bytes.toString("UTF-8");
  }

  @Test
  public void testNodeCounts() throws Exception {
    Multiset<String> counts = PyParseRunner.nodeCounts(
                      ParsedModule.parseSource("x = f(y, y)\n"));
    assertEquals(1, counts.count("Module"));
    assertEquals(1, counts.count("Assign"));
    assertEquals(1, counts.count("Call"));
    assertEquals(4, counts.count("Name"));
    assertEquals(7, counts.size());
  }

  @Test
  public void testTreeOutput() throws Exception {
    String input = writeInput("tree.py", "pass\n");
    assertEquals("Module(body=[Pass()], type_ignores=[])\n".replace("\n",
                 System.lineSeparator()),
                 run(input, OutputMode.TREE, -1, false));
  }

  @Test
  public void testStatsOutput() throws Exception {
    String input = writeInput("stats.py", "a = b\n");
    String out = run(input, OutputMode.STATS, -1, false);
    String[] lines = out.trim().split("\\r?\\n");
    assertEquals(4, lines.length);
    assertEquals("Assign\t1", lines[0]);
    assertEquals("Module\t1", lines[1]);
    assertEquals("Name\t2", lines[2]);
    assertEquals("total\t4", lines[3]);
  }

  @Test
  public void testTokensOutput() throws Exception {
    String input = writeInput("tokens.py", "x = 1\n");
    String out = run(input, OutputMode.TOKENS, -1, false);
    String[] lines = out.trim().split("\\r?\\n");
    // x = 1 NEWLINE ENDMARKER
    assertEquals(5, lines.length);
    assertTrue(lines[0], lines[0].contains("NAME"));
    assertTrue(lines[4], lines[4].contains("ENDMARKER"));
  }

  @Test
  public void testSyntaxErrorExitCode() throws Exception {
    String input = writeInput("bad.py", "def f(:\n");
    try {
      run(input, OutputMode.TREE, -1, false);
      fail("Expected PyParseFatal");
    } catch (PyParseFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }

  @Test
  public void testMissingFileExitCode() throws Exception {
    try {
      run("target/runner-test/missing.py", OutputMode.TREE, -1, false);
      fail("Expected PyParseFatal");
    } catch (PyParseFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
  }
}
