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

/**
 * Source range of a node: 1-based lines, 0-based columns,
 * end column exclusive.
 */
public class Span {
  public final int lineno;
  public final int colOffset;
  public final int endLineno;
  public final int endColOffset;

  public Span(int lineno, int colOffset, int endLineno, int endColOffset) {
    this.lineno = lineno;
    this.colOffset = colOffset;
    this.endLineno = endLineno;
    this.endColOffset = endColOffset;
  }

  /**
   * @return span from start of first to end of last
   */
  public static Span between(Span first, Span last) {
    return new Span(first.lineno, first.colOffset,
                    last.endLineno, last.endColOffset);
  }

  @Override
  public int hashCode() {
    return ((lineno * 31 + colOffset) * 31 + endLineno) * 31 + endColOffset;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Span)) {
      return false;
    }
    Span o = (Span) obj;
    return lineno == o.lineno && colOffset == o.colOffset &&
           endLineno == o.endLineno && endColOffset == o.endColOffset;
  }

  @Override
  public String toString() {
    return lineno + ":" + colOffset + "-" + endLineno + ":" + endColOffset;
  }
}
