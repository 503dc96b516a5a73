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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Test;

import exm.pyparse.common.Settings;
import exm.pyparse.common.exceptions.PyParseFatal;
import exm.pyparse.ui.Main.Args;
import exm.pyparse.ui.PyParseRunner.OutputMode;

public class MainTest {

  @After
  public void restoreSettings() {
    Settings.reset(Settings.DUMP_INDENT);
    Settings.reset(Settings.DUMP_ATTRIBUTES);
    Settings.reset(Settings.INPUT_FILENAME);
    Settings.reset(Settings.OUTPUT_FILENAME);
  }

  private static void assertCommandError(String ...args) {
    try {
      Main.processArgs(args);
      fail("Expected PyParseFatal");
    } catch (PyParseFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
    }
  }

  @Test
  public void testDefaults() {
    Args args = Main.processArgs(new String[] {"in.py"});
    assertEquals("in.py", args.inputFilename);
    assertNull(args.outputFilename);
    assertEquals(OutputMode.TREE, args.mode);
    assertEquals(-1, args.indent);
    assertFalse(args.attributes);
    assertEquals("in.py", Settings.get(Settings.INPUT_FILENAME));
  }

  @Test
  public void testOptions() {
    Args args = Main.processArgs(new String[] {"-i", "4", "-a", "in.py",
                                               "out.txt"});
    assertEquals(OutputMode.TREE, args.mode);
    assertEquals(4, args.indent);
    assertTrue(args.attributes);
    assertEquals("out.txt", args.outputFilename);
    assertEquals("out.txt", Settings.get(Settings.OUTPUT_FILENAME));

    assertEquals(OutputMode.TOKENS,
                 Main.processArgs(new String[] {"--tokens", "in.py"}).mode);
    assertEquals(OutputMode.STATS,
                 Main.processArgs(new String[] {"-s", "in.py"}).mode);
  }

  @Test
  public void testBadArguments() {
    assertCommandError();
    assertCommandError("a.py", "b.txt", "c");
    assertCommandError("-t", "-s", "in.py");
    assertCommandError("-i", "wide", "in.py");
    assertCommandError("-i", "4294967298", "in.py");
    assertCommandError("-x", "in.py");
  }
}
