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

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical categories.  Keywords are NAME tokens: the parser
 * distinguishes them by text so that soft keywords stay usable as names.
 * Each operator and delimiter has its own type.
 */
public enum TokenType {
  ENDMARKER,
  NAME,
  NUMBER,
  STRING,
  NEWLINE,
  INDENT,
  DEDENT,

  LPAR("("),
  RPAR(")"),
  LSQB("["),
  RSQB("]"),
  COLON(":"),
  COMMA(","),
  SEMI(";"),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  VBAR("|"),
  AMPER("&"),
  LESS("<"),
  GREATER(">"),
  EQUAL("="),
  DOT("."),
  PERCENT("%"),
  LBRACE("{"),
  RBRACE("}"),
  EQEQUAL("=="),
  NOTEQUAL("!="),
  LESSEQUAL("<="),
  GREATEREQUAL(">="),
  TILDE("~"),
  CIRCUMFLEX("^"),
  LEFTSHIFT("<<"),
  RIGHTSHIFT(">>"),
  DOUBLESTAR("**"),
  PLUSEQUAL("+="),
  MINEQUAL("-="),
  STAREQUAL("*="),
  SLASHEQUAL("/="),
  PERCENTEQUAL("%="),
  AMPEREQUAL("&="),
  VBAREQUAL("|="),
  CIRCUMFLEXEQUAL("^="),
  LEFTSHIFTEQUAL("<<="),
  RIGHTSHIFTEQUAL(">>="),
  DOUBLESTAREQUAL("**="),
  DOUBLESLASH("//"),
  DOUBLESLASHEQUAL("//="),
  AT("@"),
  ATEQUAL("@="),
  RARROW("->"),
  ELLIPSIS("..."),
  COLONEQUAL(":="),
  EXCLAMATION("!"),

  FSTRING_START,
  FSTRING_MIDDLE,
  FSTRING_END,
  TSTRING_START,
  TSTRING_MIDDLE,
  TSTRING_END,

  /** Character that cannot start any token */
  ERRORTOKEN;

  private final String operator;

  private TokenType() {
    this(null);
  }

  private TokenType(String operator) {
    this.operator = operator;
  }

  /**
   * @return operator text, or null if not an operator type
   */
  public String operator() {
    return operator;
  }

  public boolean isOperator() {
    return operator != null;
  }

  /**
   * Text used in error messages
   */
  public String describe() {
    if (operator != null) {
      return "'" + operator + "'";
    }
    return name();
  }

  private static final Map<String, TokenType> OPERATORS =
                                      new HashMap<String, TokenType>();
  static {
    for (TokenType t: values()) {
      if (t.operator != null) {
        OPERATORS.put(t.operator, t);
      }
    }
  }

  /** Longest operator text */
  public static final int MAX_OPERATOR_LENGTH = 3;

  /**
   * @return operator type for exact text, or null
   */
  public static TokenType forOperator(String text) {
    return OPERATORS.get(text);
  }
}
