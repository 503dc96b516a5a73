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

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import exm.pyparse.ast.Imaginary;
import exm.pyparse.ast.PyBytes;
import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.lexer.Token;

/**
 * Decoding of number and string literal tokens into constant values
 */
public class Literals {

  /**
   * Prefix letters, body and quoting of a string token
   */
  public static class StringParts {
    public final String prefix;
    public final String body;

    StringParts(String prefix, String body) {
      this.prefix = prefix;
      this.body = body;
    }

    public boolean isBytes() {
      return prefix.indexOf('b') >= 0;
    }

    public boolean isRaw() {
      return prefix.indexOf('r') >= 0;
    }

    public boolean isUnicode() {
      return prefix.indexOf('u') >= 0;
    }
  }

  /**
   * Lower-cased prefix letters of a STRING or f-/t-string start token
   */
  public static String stringPrefix(Token t) {
    String text = t.text;
    int q = 0;
    while (q < text.length() && text.charAt(q) != '\'' &&
           text.charAt(q) != '"') {
      q++;
    }
    return text.substring(0, q).toLowerCase();
  }

  /**
   * Split a STRING token into lower-cased prefix and body between quotes
   */
  public static StringParts splitString(Token t) {
    String text = t.text;
    int q = 0;
    while (text.charAt(q) != '\'' && text.charAt(q) != '"') {
      q++;
    }
    String prefix = text.substring(0, q).toLowerCase();
    char quote = text.charAt(q);
    int quoteLength = 1;
    if (text.length() - q >= 6 && text.charAt(q + 1) == quote &&
        text.charAt(q + 2) == quote) {
      quoteLength = 3;
    }
    String body = text.substring(q + quoteLength,
                                 text.length() - quoteLength);
    return new StringParts(prefix, body);
  }

  /**
   * @return String, or PyBytes for a bytes literal
   */
  public static Object decodeString(String file, Token t)
                                        throws InvalidSyntaxException {
    StringParts parts = splitString(t);
    if (parts.isBytes()) {
      for (int i = 0; i < parts.body.length(); i++) {
        if (parts.body.charAt(i) >= 128) {
          throw new InvalidSyntaxException(file, t.line, t.col,
                "bytes can only contain ASCII literal characters");
        }
      }
      String decoded = parts.isRaw() ? parts.body
                    : decodeEscapes(file, t, parts.body, true);
      return new PyBytes(decoded.getBytes(StandardCharsets.ISO_8859_1));
    }
    if (parts.isRaw()) {
      return parts.body;
    }
    return decodeEscapes(file, t, parts.body, false);
  }

  /**
   * Decode literal text of an f-string or t-string
   * @param raw true if the string has an r prefix
   */
  public static String decodeFStringMiddle(String file, Token t, boolean raw)
                                        throws InvalidSyntaxException {
    String text = t.text.replace("{{", "{").replace("}}", "}");
    if (raw) {
      return text;
    }
    return decodeEscapes(file, t, text, false);
  }

  /**
   * Process backslash escapes
   * @param bytes true for a bytes literal: each result char is one byte
   */
  static String decodeEscapes(String file, Token t, String s, boolean bytes)
                                        throws InvalidSyntaxException {
    if (s.indexOf('\\') < 0) {
      return s;
    }
    StringBuilder sb = new StringBuilder(s.length());
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= s.length()) {
        sb.append(c);
        break;
      }
      int escStart = i;
      char e = s.charAt(i + 1);
      i += 2;
      switch (e) {
        case '\n':
          break;
        case '\\':
        case '\'':
        case '"':
          sb.append(e);
          break;
        case 'a':
          sb.append('\u0007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'v':
          sb.append('\u000b');
          break;
        case '0': case '1': case '2': case '3':
        case '4': case '5': case '6': case '7': {
          int value = e - '0';
          int digits = 1;
          while (digits < 3 && i < s.length() &&
                 s.charAt(i) >= '0' && s.charAt(i) <= '7') {
            value = value * 8 + (s.charAt(i) - '0');
            i++;
            digits++;
          }
          if (value > 0377) {
            Logging.uniqueWarn("invalid octal escape sequence '" +
                               s.substring(escStart, i) + "'");
            if (bytes) {
              value &= 0xff;
            }
          }
          sb.appendCodePoint(value);
          break;
        }
        case 'x':
          i = hexEscape(file, t, s, escStart, i, 2, bytes, sb);
          break;
        case 'u':
          if (bytes) {
            unknownEscape(e, sb);
          } else {
            i = hexEscape(file, t, s, escStart, i, 4, bytes, sb);
          }
          break;
        case 'U':
          if (bytes) {
            unknownEscape(e, sb);
          } else {
            i = hexEscape(file, t, s, escStart, i, 8, bytes, sb);
          }
          break;
        case 'N':
          if (bytes) {
            unknownEscape(e, sb);
          } else {
            i = namedEscape(file, t, s, escStart, i, sb);
          }
          break;
        default:
          unknownEscape(e, sb);
          break;
      }
    }
    return sb.toString();
  }

  private static void unknownEscape(char e, StringBuilder sb) {
    Logging.uniqueWarn("invalid escape sequence '\\" + e + "'");
    sb.append('\\');
    sb.append(e);
  }

  /**
   * Decode a fixed-width hex escape whose digits start at i
   * @return index after the escape
   */
  private static int hexEscape(String file, Token t, String s, int escStart,
        int i, int width, boolean bytes, StringBuilder sb)
                                        throws InvalidSyntaxException {
    int end = i;
    while (end < s.length() && end - i < width &&
           Character.digit(s.charAt(end), 16) >= 0) {
      end++;
    }
    if (end - i < width) {
      if (bytes) {
        throw escapeError(file, t, "(value error) invalid \\x escape at " +
                          "position " + escStart);
      }
      String kind = width == 2 ? "\\xXX" : (width == 4 ? "\\uXXXX"
                                                       : "\\UXXXXXXXX");
      throw escapeError(file, t, unicodeError(escStart, end - 1,
                                              "truncated " + kind + " escape"));
    }
    int value = Integer.parseInt(s.substring(i, end), 16);
    if (width == 8 && (value < 0 || value > Character.MAX_CODE_POINT)) {
      throw escapeError(file, t, unicodeError(escStart, end - 1,
                                              "illegal Unicode character"));
    }
    sb.appendCodePoint(value);
    return end;
  }

  /**
   * Decode \N{name}
   * @return index after the closing brace
   */
  private static int namedEscape(String file, Token t, String s,
        int escStart, int i, StringBuilder sb) throws InvalidSyntaxException {
    int close = s.indexOf('}', i);
    if (i >= s.length() || s.charAt(i) != '{' || close < 0) {
      throw escapeError(file, t, unicodeError(escStart, i - 1,
                                              "malformed \\N character escape"));
    }
    String name = s.substring(i + 1, close);
    int cp;
    try {
      cp = Character.codePointOf(name);
    } catch (IllegalArgumentException ex) {
      throw escapeError(file, t, unicodeError(escStart, close,
                                        "unknown Unicode character name"));
    }
    sb.appendCodePoint(cp);
    return close + 1;
  }

  private static String unicodeError(int start, int end, String what) {
    return "(unicode error) 'unicodeescape' codec can't decode bytes in " +
           "position " + start + "-" + end + ": " + what;
  }

  private static InvalidSyntaxException escapeError(String file, Token t,
                                                    String msg) {
    return new InvalidSyntaxException(file, t.line, t.col, msg);
  }

  /**
   * @return BigInteger, Double or Imaginary
   */
  public static Object decodeNumber(String file, Token t)
                                        throws InvalidSyntaxException {
    String text = t.text.replace("_", "").toLowerCase();
    if (text.endsWith("j")) {
      return new Imaginary(Double.parseDouble(
                              text.substring(0, text.length() - 1)));
    }
    if (text.length() > 2 && text.charAt(0) == '0') {
      char kind = text.charAt(1);
      if (kind == 'x') {
        return new BigInteger(text.substring(2), 16);
      } else if (kind == 'o') {
        return new BigInteger(text.substring(2), 8);
      } else if (kind == 'b') {
        return new BigInteger(text.substring(2), 2);
      }
    }
    if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0) {
      return Double.valueOf(text);
    }
    if (text.length() > 1 && text.charAt(0) == '0' &&
        !text.matches("0+")) {
      throw new InvalidSyntaxException(file, t.line, t.col,
          "leading zeros in decimal integer literals are not permitted; " +
          "use an 0o prefix for octal integers");
    }
    return new BigInteger(text);
  }
}
