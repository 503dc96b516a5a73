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

/**
 * Immutable lexical unit.  Lines are 1-based, columns 0-based.
 * Offsets index the (newline-normalized) source text, end exclusive.
 */
public class Token {
  public final TokenType type;
  public final String text;
  public final int line;
  public final int col;
  public final int endLine;
  public final int endCol;
  public final int startOffset;
  public final int endOffset;

  public Token(TokenType type, String text, int line, int col,
               int endLine, int endCol, int startOffset, int endOffset) {
    assert(type != null);
    assert(text != null);
    this.type = type;
    this.text = text;
    this.line = line;
    this.col = col;
    this.endLine = endLine;
    this.endCol = endCol;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  /**
   * @return true if this is a NAME with the given text
   */
  public boolean isName(String name) {
    return type == TokenType.NAME && text.equals(name);
  }

  /**
   * Description for error messages
   */
  public String describe() {
    switch (type) {
      case NEWLINE:
        return "newline";
      case INDENT:
        return "indent";
      case DEDENT:
        return "dedent";
      case ENDMARKER:
        return "end of file";
      default:
        return "'" + text + "'";
    }
  }

  @Override
  public int hashCode() {
    int result = type.hashCode();
    result = 31 * result + text.hashCode();
    result = 31 * result + line;
    result = 31 * result + col;
    result = 31 * result + endLine;
    result = 31 * result + endCol;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Token)) {
      return false;
    }
    Token other = (Token) obj;
    return type == other.type && text.equals(other.text) &&
           line == other.line && col == other.col &&
           endLine == other.endLine && endCol == other.endCol &&
           startOffset == other.startOffset && endOffset == other.endOffset;
  }

  @Override
  public String toString() {
    return line + "," + col + "-" + endLine + "," + endCol + ":\t" +
           type.name() + "\t'" + escape(text) + "'";
  }

  private static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\t') {
        sb.append("\\t");
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
