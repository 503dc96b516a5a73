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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

import exm.pyparse.common.exceptions.ParserRuntimeError;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

/**
 * Mutable state of one parse: cursor over an immutable token list,
 * furthest position examined, and the packrat memo cache.
 * Not shared between parses.
 */
public class ParserState {

  /**
   * Cached outcome of a rule at a start position.  A null result
   * records failure.
   */
  public static class Memo {
    public final Object result;
    public final int end;

    public Memo(Object result, int end) {
      this.result = result;
      this.end = end;
    }
  }

  private final String file;
  private final String source;
  private final List<Token> tokens;
  private final boolean memoEnabled;

  private int pos = 0;
  private int furthest = 0;
  /** Descriptions of tokens that would have matched at furthest */
  private final Set<String> expected = new LinkedHashSet<String>();

  private final Table<Integer, Rule, Memo> memo = HashBasedTable.create();
  private int memoHits = 0;

  public ParserState(String file, String source, List<Token> tokens,
                     boolean memoEnabled) {
    if (tokens.isEmpty() ||
        tokens.get(tokens.size() - 1).type != TokenType.ENDMARKER) {
      throw new ParserRuntimeError("Token list must end with ENDMARKER");
    }
    this.file = file;
    this.source = source;
    this.tokens = tokens;
    this.memoEnabled = memoEnabled;
  }

  public String getFile() {
    return file;
  }

  /**
   * @return source text that token offsets refer to
   */
  public String getSource() {
    return source;
  }

  public int mark() {
    return pos;
  }

  public void reset(int mark) {
    assert(mark >= 0 && mark < tokens.size());
    pos = mark;
  }

  /**
   * Look at a token without consuming.  Never moves past ENDMARKER.
   */
  public Token peek(int ahead) {
    int i = Math.min(pos + ahead, tokens.size() - 1);
    if (i > furthest) {
      furthest = i;
      expected.clear();
    }
    return tokens.get(i);
  }

  public void advance() {
    if (pos < tokens.size() - 1) {
      pos++;
    }
  }

  /**
   * @param i token index
   * @return token at index, clamped to the list
   */
  public Token get(int i) {
    return tokens.get(Math.max(0, Math.min(i, tokens.size() - 1)));
  }

  /**
   * Record that the token at index i failed to match what
   */
  public void expected(int i, String what) {
    if (i > furthest) {
      furthest = i;
      expected.clear();
    }
    if (i == furthest) {
      expected.add(what);
    }
  }

  public Token furthestToken() {
    return tokens.get(furthest);
  }

  public int furthest() {
    return furthest;
  }

  public List<String> expectedAtFurthest() {
    return new ArrayList<String>(expected);
  }

  public boolean memoEnabled() {
    return memoEnabled;
  }

  public Memo getMemo(Rule rule, int position) {
    Memo m = memo.get(position, rule);
    if (m != null) {
      memoHits++;
    }
    return m;
  }

  public void putMemo(Rule rule, int position, Memo m) {
    memo.put(position, rule, m);
  }

  public int memoSize() {
    return memo.size();
  }

  public int memoHits() {
    return memoHits;
  }
}
