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

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.ast.AstDump;
import exm.pyparse.ast.Module;
import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.ParserRuntimeError;
import exm.pyparse.frontend.ParsedModule;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

public class ParserStateTest {

  private static final String SOURCE =
      "def f(a, b=2, *args, **kw):\n" +
      "    with open(a) as y, z:\n" +
      "        return [i * j for i in a if i for j in b]\n" +
      "x = {k: (v, w) for k, v, w in items}\n" +
      "print(f(1)(2)[3].attr, *rest, sep='')\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ParserStateTest.pyparse.log", true);
  }

  @Test
  public void testMemoDoesNotChangeTree() throws Exception {
    List<Token> tokens = ParsedModule.tokenize("memo.py", SOURCE);
    Module withMemo = ParsedModule.parseTokens("memo.py", SOURCE,
                                               tokens, true);
    Module withoutMemo = ParsedModule.parseTokens("memo.py", SOURCE,
                                                  tokens, false);
    assertEquals(AstDump.dump(withMemo, 2, true),
                 AstDump.dump(withoutMemo, 2, true));
  }

  @Test
  public void testMemoHits() throws Exception {
    List<Token> tokens = ParsedModule.tokenize("memo.py", SOURCE);
    ParserState state = new ParserState("memo.py", SOURCE, tokens, true);
    new StatementParser(state).file();
    assertTrue(state.memoSize() > 0);
    assertTrue(state.memoHits() > 0);

    ParserState noMemo = new ParserState("memo.py", SOURCE, tokens, false);
    new StatementParser(noMemo).file();
    assertEquals(0, noMemo.memoSize());
    assertEquals(0, noMemo.memoHits());
  }

  @Test
  public void testCursor() throws Exception {
    List<Token> tokens = ParsedModule.tokenize("t.py", "a + b\n");
    ParserState state = new ParserState("t.py", "a + b\n", tokens, true);
    assertEquals(0, state.mark());
    state.advance();
    state.advance();
    assertEquals("b", state.peek(0).text);
    assertEquals(2, state.furthest());
    state.reset(0);
    assertEquals("a", state.peek(0).text);
    // Furthest position never moves back
    assertEquals(2, state.furthest());

    // Never moves past ENDMARKER
    for (int i = 0; i < 10; i++) {
      state.advance();
    }
    assertEquals(TokenType.ENDMARKER, state.peek(0).type);
    assertEquals(TokenType.ENDMARKER, state.peek(5).type);
  }

  @Test
  public void testExpected() throws Exception {
    List<Token> tokens = ParsedModule.tokenize("t.py", "a b\n");
    ParserState state = new ParserState("t.py", "a b\n", tokens, true);
    state.expected(1, "'='");
    state.expected(1, "NEWLINE");
    state.expected(0, "NAME");
    assertEquals(1, state.furthest());
    assertEquals("['=', NEWLINE]",
                 state.expectedAtFurthest().toString());
    state.expected(2, "':'");
    assertEquals(1, state.expectedAtFurthest().size());
  }

  @Test(expected=ParserRuntimeError.class)
  public void testRequiresEndMarker() {
    new ParserState("t.py", "", new ArrayList<Token>(), true);
  }
}
