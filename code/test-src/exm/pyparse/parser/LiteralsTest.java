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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.ast.Imaginary;
import exm.pyparse.ast.PyBytes;
import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

public class LiteralsTest {

  private static final String FILE = "literals.py";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/LiteralsTest.pyparse.log", true);
  }

  private static Token token(TokenType type, String text) {
    return new Token(type, text, 1, 0, 1, text.length(), 0, text.length());
  }

  private static Object string(String text) throws InvalidSyntaxException {
    return Literals.decodeString(FILE, token(TokenType.STRING, text));
  }

  private static Object number(String text) throws InvalidSyntaxException {
    return Literals.decodeNumber(FILE, token(TokenType.NUMBER, text));
  }

  @Test
  public void testStringPrefix() {
    assertEquals("rf", Literals.stringPrefix(
                          token(TokenType.FSTRING_START, "Rf\"")));
    assertEquals("f", Literals.stringPrefix(
                          token(TokenType.FSTRING_START, "f'''")));
    assertEquals("t", Literals.stringPrefix(
                          token(TokenType.TSTRING_START, "t'")));
    assertEquals("", Literals.stringPrefix(
                          token(TokenType.STRING, "'abc'")));
  }

  @Test
  public void testSplitString() {
    Literals.StringParts parts = Literals.splitString(
                                    token(TokenType.STRING, "Rb'''x'''"));
    assertEquals("rb", parts.prefix);
    assertEquals("x", parts.body);
    assertTrue(parts.isBytes());
    assertTrue(parts.isRaw());
    assertFalse(parts.isUnicode());

    parts = Literals.splitString(token(TokenType.STRING, "\"\""));
    assertEquals("", parts.prefix);
    assertEquals("", parts.body);
  }

  @Test
  public void testEscapes() throws Exception {
    assertEquals("a\tb\n", string("'a\\tb\\n'"));
    assertEquals("A", string("'\\101'"));
    assertEquals("A", string("'\\x41'"));
    assertEquals("é", string("'\\u00e9'"));
    assertEquals(new String(Character.toChars(0x1F600)),
                 string("'\\U0001F600'"));
    assertEquals("•", string("'\\N{BULLET}'"));
    // Line continuation inside the literal
    assertEquals("ab", string("'a\\\nb'"));
    // Unknown escapes keep the backslash
    assertEquals("\\d", string("'\\d'"));
    assertEquals("it's", string("\"it's\""));
    assertEquals("a'b", string("'''a'b'''"));
  }

  @Test
  public void testRawAndUnicode() throws Exception {
    assertEquals("\\n", string("r'\\n'"));
    assertEquals("x", string("u'x'"));
  }

  @Test
  public void testBytes() throws Exception {
    Object b = string("b'A\\x00\\xff'");
    assertTrue(b instanceof PyBytes);
    assertArrayEquals(new byte[] {'A', 0, (byte) 0xff},
                      ((PyBytes) b).toByteArray());
    // \\u is not an escape in bytes
    assertEquals(new PyBytes(new byte[] {'\\', 'u'}), string("b'\\u'"));
    assertEquals(new PyBytes(new byte[] {'\\', 'n'}), string("br'\\n'"));
  }

  @Test
  public void testNumbers() throws Exception {
    assertEquals(BigInteger.valueOf(31), number("0x1F"));
    assertEquals(BigInteger.valueOf(31), number("0X1f"));
    assertEquals(BigInteger.valueOf(15), number("0o17"));
    assertEquals(BigInteger.valueOf(5), number("0b101"));
    assertEquals(BigInteger.valueOf(1000000), number("1_000_000"));
    assertEquals(BigInteger.ZERO, number("000"));
    assertEquals(new BigInteger("123456789012345678901234567890"),
                 number("123456789012345678901234567890"));
    assertEquals(Double.valueOf(1500.0), number("1.5e3"));
    assertEquals(Double.valueOf(0.5), number(".5"));
    assertEquals(Double.valueOf(1.0), number("1."));
    assertEquals(new Imaginary(10.0), number("10j"));
    assertEquals(new Imaginary(0.25), number("0.25J"));
  }

  @Test(expected=InvalidSyntaxException.class)
  public void testLeadingZeros() throws Exception {
    number("0123");
  }
}
