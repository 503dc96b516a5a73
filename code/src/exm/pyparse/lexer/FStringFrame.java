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
 * Lexer state for one f-string or t-string being tokenized.
 *
 * A frame is in literal mode when no replacement field is open, or
 * when the innermost field has entered its format spec.  Otherwise
 * it is in expression mode and ordinary tokens are produced.
 */
public class FStringFrame {

  /**
   * An open replacement field
   */
  static class Field {
    /** Bracket nesting depth when the field's '{' was seen */
    final int bracketDepth;
    boolean inFormatSpec = false;

    Field(int bracketDepth) {
      this.bracketDepth = bracketDepth;
    }
  }

  final char quote;
  final int quoteLength;
  final boolean raw;
  final boolean template;
  final Token start;

  private final ArrayList<Field> fields = new ArrayList<Field>();

  FStringFrame(char quote, int quoteLength, boolean raw, boolean template,
               Token start) {
    this.quote = quote;
    this.quoteLength = quoteLength;
    this.raw = raw;
    this.template = template;
    this.start = start;
  }

  boolean inLiteral() {
    return fields.isEmpty() || currentField().inFormatSpec;
  }

  boolean hasOpenField() {
    return !fields.isEmpty();
  }

  Field currentField() {
    return fields.get(fields.size() - 1);
  }

  void openField(int bracketDepth) {
    fields.add(new Field(bracketDepth));
  }

  void closeField() {
    fields.remove(fields.size() - 1);
  }

  TokenType middleType() {
    return template ? TokenType.TSTRING_MIDDLE : TokenType.FSTRING_MIDDLE;
  }

  TokenType endType() {
    return template ? TokenType.TSTRING_END : TokenType.FSTRING_END;
  }

  String kind() {
    return template ? "t-string" : "f-string";
  }
}
