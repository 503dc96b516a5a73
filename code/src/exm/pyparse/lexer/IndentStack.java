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

import java.util.ArrayList;

/**
 * Stack of open indentation levels, strictly increasing from the
 * base level 0.  Each level records its width twice: once with the
 * configured tab size and once counting a tab as one column, so that
 * indentation depending on the tab size can be rejected.
 */
public class IndentStack {

  private final ArrayList<int[]> levels = new ArrayList<int[]>();

  public IndentStack() {
    levels.add(new int[] {0, 0});
  }

  public boolean atBase() {
    return levels.size() == 1;
  }

  public int top() {
    return levels.get(levels.size() - 1)[0];
  }

  public int topAlt() {
    return levels.get(levels.size() - 1)[1];
  }

  public void push(int width, int altWidth) {
    assert(width > top()) : width + " <= " + top();
    levels.add(new int[] {width, altWidth});
  }

  public void pop() {
    assert(!atBase());
    levels.remove(levels.size() - 1);
  }
}
