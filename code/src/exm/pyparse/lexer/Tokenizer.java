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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.common.exceptions.LexException;

/**
 * Converts module source text into a token list ending in ENDMARKER.
 *
 * Indentation is measured at the start of each logical line outside
 * brackets and produces INDENT/DEDENT tokens.  f-strings and t-strings
 * are split into START/MIDDLE/END tokens with ordinary tokens for the
 * expressions in their replacement fields.
 *
 * A tokenizer instance is single-use: {@link #tokenize()} caches its
 * result.
 */
public class Tokenizer {

  public static final int DEFAULT_TAB_SIZE = 8;

  private static final Logger logger = Logging.getLogger();

  private static final Set<String> STRING_PREFIXES = new HashSet<String>(
      Arrays.asList("r", "u", "b", "br", "rb", "f", "fr", "rf",
                    "t", "tr", "rt"));

  /** Keywords that may directly follow a number literal */
  private static final List<String> KEYWORDS_AFTER_NUMBER = Arrays.asList(
      "and", "else", "for", "if", "in", "is", "not", "or");

  private final String file;
  private final String src;
  private final int tabSize;

  private int pos = 0;
  private int line = 1;
  private int lineStart = 0;
  private boolean atLineStart = true;

  private final IndentStack indents = new IndentStack();
  /** Open bracket tokens, innermost last */
  private final ArrayList<Token> brackets = new ArrayList<Token>();
  /** Brackets may nest at most this deep */
  public static final int MAX_BRACKET_DEPTH = 200;
  /** Open f-strings, innermost last */
  private final ArrayList<FStringFrame> fstrings =
                                        new ArrayList<FStringFrame>();
  private final ArrayList<Token> tokens = new ArrayList<Token>();
  private List<Token> result = null;

  public Tokenizer(String file, String source) {
    this(file, source, DEFAULT_TAB_SIZE);
  }

  public Tokenizer(String file, String source, int tabSize) {
    this.file = file;
    this.src = normalizeSource(source);
    this.tabSize = tabSize;
  }

  /**
   * Drop a byte order mark and convert all line endings to '\n'
   */
  public static String normalizeSource(String source) {
    String s = source;
    if (s.length() > 0 && s.charAt(0) == '\uFEFF') {
      s = s.substring(1);
    }
    if (s.indexOf('\r') >= 0) {
      s = s.replace("\r\n", "\n").replace('\r', '\n');
    }
    return s;
  }

  /**
   * @return the source text that token offsets refer to
   */
  public String getSource() {
    return src;
  }

  public String getFile() {
    return file;
  }

  public List<Token> tokenize() throws InvalidSyntaxException {
    if (result != null) {
      return result;
    }
    while (true) {
      FStringFrame frame = currentFString();
      if (frame != null && frame.inLiteral()) {
        scanFStringLiteral(frame);
        continue;
      }

      if (atLineStart) {
        atLineStart = false;
        handleIndentation();
      }

      skipWhitespace();
      if (pos >= src.length()) {
        break;
      }

      char c = src.charAt(pos);
      int cp = src.codePointAt(pos);
      if (c == '#') {
        skipComment();
      } else if (c == '\\') {
        lineContinuation();
      } else if (c == '\n') {
        newline();
      } else if (frame != null && fieldBoundary(frame, c)) {
        // Handled
      } else if (isIdentifierStart(cp)) {
        scanNameOrString();
      } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
        scanNumber();
      } else if (c == '"' || c == '\'') {
        scanString(pos, line, col(), "");
      } else {
        scanOperator();
      }
    }
    finish();
    if (logger.isDebugEnabled()) {
      logger.debug("Tokenized " + file + ": " + tokens.size() + " tokens");
    }
    result = Collections.unmodifiableList(tokens);
    return result;
  }

  private FStringFrame currentFString() {
    if (fstrings.isEmpty()) {
      return null;
    }
    return fstrings.get(fstrings.size() - 1);
  }

  private int col() {
    return pos - lineStart;
  }

  private char peek(int ahead) {
    int i = pos + ahead;
    if (i < src.length()) {
      return src.charAt(i);
    }
    return '\0';
  }

  /**
   * Consume one char, tracking line numbers
   */
  private void advance() {
    char c = src.charAt(pos++);
    if (c == '\n') {
      line++;
      lineStart = pos;
    }
  }

  private Token emit(TokenType type, int startPos, int startLine,
                     int startCol) {
    Token t = new Token(type, src.substring(startPos, pos), startLine,
                        startCol, line, col(), startPos, pos);
    tokens.add(t);
    return t;
  }

  private Token emitEmpty(TokenType type) {
    Token t = new Token(type, "", line, col(), line, col(), pos, pos);
    tokens.add(t);
    return t;
  }

  private Token lastToken() {
    if (tokens.isEmpty()) {
      return null;
    }
    return tokens.get(tokens.size() - 1);
  }

  private LexException error(int errLine, int errCol, String msg) {
    return new LexException(file, errLine, errCol, msg);
  }

  /**
   * Measure indentation of the next non-blank line and emit
   * INDENT or DEDENT tokens.  Blank and comment-only lines are skipped.
   */
  private void handleIndentation() throws LexException {
    while (true) {
      int start = pos;
      int width = 0;
      int altWidth = 0;
      while (pos < src.length()) {
        char c = src.charAt(pos);
        if (c == ' ') {
          width++;
          altWidth++;
        } else if (c == '\t') {
          width = (width / tabSize + 1) * tabSize;
          altWidth++;
        } else if (c == '\f') {
          width = 0;
          altWidth = 0;
        } else {
          break;
        }
        pos++;
      }
      if (pos >= src.length()) {
        return;
      }
      char c = src.charAt(pos);
      if (c == '#') {
        skipComment();
        if (pos < src.length()) {
          advance();
        }
        continue;
      }
      if (c == '\n') {
        advance();
        continue;
      }

      if (width == indents.top()) {
        if (altWidth != indents.topAlt()) {
          throw inconsistentTabs();
        }
      } else if (width > indents.top()) {
        if (altWidth <= indents.topAlt()) {
          throw inconsistentTabs();
        }
        indents.push(width, altWidth);
        emit(TokenType.INDENT, start, line, 0);
      } else {
        while (!indents.atBase() && width < indents.top()) {
          indents.pop();
          emitEmpty(TokenType.DEDENT);
        }
        if (width != indents.top()) {
          throw error(line, col(),
                      "unindent does not match any outer indentation level");
        }
        if (altWidth != indents.topAlt()) {
          throw inconsistentTabs();
        }
      }
      return;
    }
  }

  private LexException inconsistentTabs() {
    return error(line, col(),
                 "inconsistent use of tabs and spaces in indentation");
  }

  private void skipWhitespace() {
    while (pos < src.length()) {
      char c = src.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
      } else {
        break;
      }
    }
  }

  private void skipComment() {
    while (pos < src.length() && src.charAt(pos) != '\n') {
      pos++;
    }
  }

  private void lineContinuation() throws LexException {
    if (pos + 1 >= src.length()) {
      throw error(line, col(), "unexpected EOF while parsing");
    }
    if (src.charAt(pos + 1) != '\n') {
      throw error(line, col(),
          "unexpected character after line continuation character");
    }
    pos++;
    advance();
  }

  private void newline() {
    if (!brackets.isEmpty() || !fstrings.isEmpty()) {
      // Implicit line joining
      advance();
      return;
    }
    Token last = lastToken();
    int startPos = pos;
    int startLine = line;
    int startCol = col();
    advance();
    if (last != null && last.type != TokenType.NEWLINE) {
      tokens.add(new Token(TokenType.NEWLINE, "\n", startLine, startCol,
                     startLine, startCol + 1, startPos, startPos + 1));
    }
    atLineStart = true;
  }

  private void finish() throws LexException {
    if (!fstrings.isEmpty()) {
      FStringFrame frame = fstrings.get(0);
      throw unterminatedFString(frame);
    }
    if (!brackets.isEmpty()) {
      Token open = brackets.get(brackets.size() - 1);
      throw error(open.line, open.col, "'" + open.text +
                                       "' was never closed");
    }
    Token last = lastToken();
    if (last != null && last.type != TokenType.NEWLINE) {
      emitEmpty(TokenType.NEWLINE);
    }
    while (!indents.atBase()) {
      indents.pop();
      emitEmpty(TokenType.DEDENT);
    }
    emitEmpty(TokenType.ENDMARKER);
  }

  private void scanNameOrString() throws LexException {
    int start = pos;
    int startLine = line;
    int startCol = col();
    while (pos < src.length()) {
      int cp = src.codePointAt(pos);
      if (!isIdentifierPart(cp)) {
        break;
      }
      pos += Character.charCount(cp);
    }
    if (pos < src.length()) {
      char c = src.charAt(pos);
      if (c == '"' || c == '\'') {
        String prefix = src.substring(start, pos).toLowerCase();
        if (STRING_PREFIXES.contains(prefix)) {
          scanString(start, startLine, startCol, prefix);
          return;
        }
      }
    }
    emit(TokenType.NAME, start, startLine, startCol);
  }

  /**
   * @return true if the quote at pos ends a string of the given quoting
   */
  private boolean closesString(char quote, int quoteLength) {
    if (src.charAt(pos) != quote) {
      return false;
    }
    if (quoteLength == 1) {
      return true;
    }
    return peek(1) == quote && peek(2) == quote;
  }

  /**
   * Scan a string literal whose prefix has already been consumed
   * @param start offset of the prefix
   * @param prefix lower-cased prefix letters
   */
  private void scanString(int start, int startLine, int startCol,
                          String prefix) throws LexException {
    char quote = src.charAt(pos);
    int quoteLength = 1;
    if (peek(1) == quote && peek(2) == quote) {
      quoteLength = 3;
    }
    pos += quoteLength;
    boolean raw = prefix.indexOf('r') >= 0;

    if (prefix.indexOf('f') >= 0 || prefix.indexOf('t') >= 0) {
      boolean template = prefix.indexOf('t') >= 0;
      TokenType type = template ? TokenType.TSTRING_START
                                : TokenType.FSTRING_START;
      Token startTok = emit(type, start, startLine, startCol);
      fstrings.add(new FStringFrame(quote, quoteLength, raw, template,
                                    startTok));
      return;
    }

    while (true) {
      if (pos >= src.length()) {
        throw unterminatedString(startLine, startCol, quoteLength, "string");
      }
      char c = src.charAt(pos);
      if (c == '\\') {
        advance();
        if (pos < src.length()) {
          advance();
        }
      } else if (c == '\n' && quoteLength == 1) {
        throw unterminatedString(startLine, startCol, quoteLength, "string");
      } else if (closesString(quote, quoteLength)) {
        pos += quoteLength;
        break;
      } else {
        advance();
      }
    }
    emit(TokenType.STRING, start, startLine, startCol);
  }

  private LexException unterminatedString(int startLine, int startCol,
                                  int quoteLength, String kind) {
    String what = quoteLength == 3 ? "triple-quoted " + kind : kind;
    return error(startLine, startCol, "unterminated " + what +
                 " literal (detected at line " + line + ")");
  }

  private LexException unterminatedFString(FStringFrame frame) {
    return unterminatedString(frame.start.line, frame.start.col,
                              frame.quoteLength, frame.kind());
  }

  /**
   * Scan literal text of an f-string up to the next replacement field,
   * the end of the current format spec, or the closing quote.
   */
  private void scanFStringLiteral(FStringFrame frame) throws LexException {
    int start = pos;
    int startLine = line;
    int startCol = col();
    while (true) {
      if (pos >= src.length()) {
        throw unterminatedFString(frame);
      }
      char c = src.charAt(pos);
      if (closesString(frame.quote, frame.quoteLength)) {
        if (frame.hasOpenField()) {
          throw error(line, col(), frame.kind() + ": expecting '}'");
        }
        flushMiddle(frame, start, startLine, startCol);
        int endStart = pos;
        int endCol = col();
        pos += frame.quoteLength;
        emit(frame.endType(), endStart, line, endCol);
        fstrings.remove(fstrings.size() - 1);
        return;
      }
      if (c == '\n' && frame.quoteLength == 1) {
        throw unterminatedFString(frame);
      }
      if (c == '\\') {
        advance();
        if (pos >= src.length()) {
          continue;
        }
        char next = src.charAt(pos);
        if (!frame.raw && next == 'N' && peek(1) == '{') {
          // Named unicode escape: braces are not a field
          while (pos < src.length() && src.charAt(pos) != '}' &&
                 src.charAt(pos) != '\n') {
            advance();
          }
          if (pos < src.length() && src.charAt(pos) == '}') {
            advance();
          }
        } else if (next != '{' && next != '}') {
          advance();
        }
        continue;
      }
      if (c == '{') {
        if (!frame.hasOpenField() && peek(1) == '{') {
          pos += 2;
          continue;
        }
        flushMiddle(frame, start, startLine, startCol);
        int braceStart = pos;
        int braceCol = col();
        pos++;
        emit(TokenType.LBRACE, braceStart, line, braceCol);
        frame.openField(brackets.size());
        return;
      }
      if (c == '}') {
        if (!frame.hasOpenField()) {
          if (peek(1) == '}') {
            pos += 2;
            continue;
          }
          throw error(line, col(), frame.kind() +
                                   ": single '}' is not allowed");
        }
        // End of a format spec closes its field
        flushMiddle(frame, start, startLine, startCol);
        int braceStart = pos;
        int braceCol = col();
        pos++;
        emit(TokenType.RBRACE, braceStart, line, braceCol);
        frame.closeField();
        return;
      }
      advance();
    }
  }

  private void flushMiddle(FStringFrame frame, int start, int startLine,
                           int startCol) {
    if (pos > start) {
      emit(frame.middleType(), start, startLine, startCol);
    }
  }

  /**
   * Handle '}' and ':' at the top bracket level of an open
   * replacement field.
   * @return true if a token was produced
   */
  private boolean fieldBoundary(FStringFrame frame, char c) {
    if (!frame.hasOpenField()) {
      return false;
    }
    FStringFrame.Field field = frame.currentField();
    if (brackets.size() != field.bracketDepth) {
      return false;
    }
    int start = pos;
    int startCol = col();
    if (c == '}') {
      pos++;
      emit(TokenType.RBRACE, start, line, startCol);
      frame.closeField();
      return true;
    } else if (c == ':') {
      pos++;
      emit(TokenType.COLON, start, line, startCol);
      field.inFormatSpec = true;
      return true;
    }
    return false;
  }

  private void scanNumber() throws LexException {
    int start = pos;
    int startLine = line;
    int startCol = col();
    char c = src.charAt(pos);
    char kind = Character.toLowerCase(peek(1));
    String desc = "decimal";
    if (c == '0' && (kind == 'x' || kind == 'o' || kind == 'b')) {
      pos += 2;
      int radix = kind == 'x' ? 16 : (kind == 'o' ? 8 : 2);
      desc = kind == 'x' ? "hexadecimal" : (kind == 'o' ? "octal" : "binary");
      if (peek(0) == '_') {
        pos++;
      }
      if (Character.digit(peek(0), radix) < 0) {
        throw error(line, col(), "invalid " + desc + " literal");
      }
      scanDigits(radix, desc);
    } else {
      if (c != '.') {
        scanDigits(10, desc);
      }
      if (peek(0) == '.') {
        pos++;
        if (isDigit(peek(0))) {
          scanDigits(10, desc);
        }
      }
      char e = peek(0);
      if (e == 'e' || e == 'E') {
        char sign = peek(1);
        if (isDigit(sign)) {
          pos++;
          scanDigits(10, desc);
        } else if ((sign == '+' || sign == '-') && isDigit(peek(2))) {
          pos += 2;
          scanDigits(10, desc);
        }
      }
      char j = peek(0);
      if (j == 'j' || j == 'J') {
        pos++;
      }
    }
    if (pos < src.length() && isIdentifierPart(src.codePointAt(pos))) {
      boolean keywordFollows = false;
      for (String kw: KEYWORDS_AFTER_NUMBER) {
        if (src.startsWith(kw, pos)) {
          keywordFollows = true;
          break;
        }
      }
      if (!keywordFollows) {
        throw error(startLine, startCol, "invalid " + desc + " literal");
      }
    }
    emit(TokenType.NUMBER, start, startLine, startCol);
  }

  /**
   * Scan digits of radix with single underscores between digits
   */
  private void scanDigits(int radix, String desc) throws LexException {
    while (pos < src.length()) {
      char c = src.charAt(pos);
      if (Character.digit(c, radix) >= 0 && c < 128) {
        pos++;
      } else if (c == '_') {
        if (Character.digit(peek(1), radix) < 0) {
          throw error(line, col(), "invalid " + desc + " literal");
        }
        pos++;
      } else {
        break;
      }
    }
  }

  private void scanOperator() throws InvalidSyntaxException {
    int start = pos;
    int startCol = col();
    TokenType type = null;
    for (int n = TokenType.MAX_OPERATOR_LENGTH; n >= 1; n--) {
      if (pos + n <= src.length()) {
        type = TokenType.forOperator(src.substring(pos, pos + n));
        if (type != null) {
          pos += n;
          break;
        }
      }
    }
    if (type == null) {
      int cp = src.codePointAt(pos);
      pos += Character.charCount(cp);
      emit(TokenType.ERRORTOKEN, start, line, startCol);
      return;
    }

    Token tok = emit(type, start, line, startCol);
    switch (type) {
      case LPAR:
      case LSQB:
      case LBRACE:
        if (brackets.size() >= MAX_BRACKET_DEPTH) {
          throw error(tok.line, tok.col, "too many nested parentheses");
        }
        brackets.add(tok);
        break;
      case RPAR:
      case RSQB:
      case RBRACE:
        closeBracket(tok);
        break;
      default:
        break;
    }
  }

  private void closeBracket(Token close) throws InvalidSyntaxException {
    int floor = 0;
    FStringFrame frame = currentFString();
    if (frame != null && frame.hasOpenField()) {
      floor = frame.currentField().bracketDepth;
    }
    if (brackets.size() <= floor) {
      String prefix = frame != null ? frame.kind() + ": " : "";
      throw new InvalidSyntaxException(file, close.line, close.col,
                          prefix + "unmatched '" + close.text + "'");
    }
    Token open = brackets.remove(brackets.size() - 1);
    if (!matches(open.type, close.type)) {
      String msg = "closing parenthesis '" + close.text +
          "' does not match opening parenthesis '" + open.text + "'";
      if (open.line != close.line) {
        msg += " on line " + open.line;
      }
      throw new InvalidSyntaxException(file, close.line, close.col, msg);
    }
  }

  private static boolean matches(TokenType open, TokenType close) {
    switch (open) {
      case LPAR:
        return close == TokenType.RPAR;
      case LSQB:
        return close == TokenType.RSQB;
      case LBRACE:
        return close == TokenType.RBRACE;
      default:
        return false;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isIdentifierStart(int cp) {
    if (cp < 128) {
      return cp == '_' || (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z');
    }
    return Character.isUnicodeIdentifierStart(cp);
  }

  public static boolean isIdentifierPart(int cp) {
    if (cp < 128) {
      return cp == '_' || (cp >= 'a' && cp <= 'z') ||
             (cp >= 'A' && cp <= 'Z') || (cp >= '0' && cp <= '9');
    }
    return Character.isUnicodeIdentifierPart(cp) &&
           !Character.isIdentifierIgnorable(cp);
  }
}
