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
import java.util.List;

import exm.pyparse.ast.Expr;
import exm.pyparse.ast.Imaginary;
import exm.pyparse.ast.Operators.ExprContext;
import exm.pyparse.ast.Operators.Operator;
import exm.pyparse.ast.Operators.UnaryOperator;
import exm.pyparse.ast.Pattern;
import exm.pyparse.ast.PyConstant;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

/**
 * Patterns of match statement case clauses
 */
public class PatternParser extends ExpressionParser {

  protected PatternParser(ParserState state) {
    super(state);
  }

  @Override
  protected Object invoke(Rule rule) throws InvalidSyntaxException {
    switch (rule) {
      case NAME_PATTERN_FOLLOW:
        return namePatternFollow();
      default:
        return super.invoke(rule);
    }
  }

  /**
   * Pattern of a case clause: an open sequence or a single pattern
   */
  public Pattern patterns() throws InvalidSyntaxException {
    Token start = peek();
    int m = mark();
    Pattern first = maybeStarPattern();
    if (first == null) {
      return null;
    }
    if (peekIs(TokenType.COMMA)) {
      List<Pattern> elts = new ArrayList<Pattern>();
      elts.add(first);
      while (match(TokenType.COMMA)) {
        if (peekIs(TokenType.COLON) || peekKeyword("if")) {
          break;
        }
        Pattern p = maybeStarPattern();
        if (p == null) {
          throw furthestError();
        }
        elts.add(p);
      }
      return new Pattern.MatchSequence(spanFrom(start), elts);
    }
    if (first instanceof Pattern.MatchStar) {
      reset(m);
      return null;
    }
    return first;
  }

  /**
   * or_pattern ['as' NAME]
   */
  public Pattern pattern() throws InvalidSyntaxException {
    Token start = peek();
    Pattern alternatives = orPattern();
    if (alternatives == null) {
      return null;
    }
    if (peekKeyword("as")) {
      advance();
      Token n = peek();
      if (n.isName("_")) {
        throw error(n, "cannot use '_' as a target");
      }
      Token name = captureTarget();
      if (name == null) {
        throw error(n, "invalid pattern target");
      }
      return new Pattern.MatchAs(spanFrom(start), alternatives, name.text);
    }
    return alternatives;
  }

  private Pattern orPattern() throws InvalidSyntaxException {
    Token start = peek();
    Pattern first = closedPattern();
    if (first == null) {
      return null;
    }
    if (!peekIs(TokenType.VBAR)) {
      return first;
    }
    List<Pattern> alternatives = new ArrayList<Pattern>();
    alternatives.add(first);
    while (match(TokenType.VBAR)) {
      Pattern p = closedPattern();
      if (p == null) {
        throw furthestError();
      }
      alternatives.add(p);
    }
    return new Pattern.MatchOr(spanFrom(start), alternatives);
  }

  private Pattern maybeStarPattern() throws InvalidSyntaxException {
    if (peekIs(TokenType.STAR)) {
      return starPattern();
    }
    return pattern();
  }

  private Pattern starPattern() throws InvalidSyntaxException {
    int m = mark();
    Token star = advance();
    if (peekKeyword("_")) {
      advance();
      return new Pattern.MatchStar(spanFrom(star), null);
    }
    Token name = captureTarget();
    if (name == null) {
      reset(m);
      return null;
    }
    return new Pattern.MatchStar(spanFrom(star), name.text);
  }

  private Object namePatternFollow() {
    TokenType t = peek().type;
    if (t == TokenType.DOT || t == TokenType.LPAR || t == TokenType.EQUAL) {
      return Boolean.TRUE;
    }
    return null;
  }

  /**
   * A name that binds the subject: not '_', not a keyword, and not
   * the start of a value or class pattern
   */
  private Token captureTarget() throws InvalidSyntaxException {
    Token t = peek();
    if (t.type != TokenType.NAME || isKeyword(t) || t.text.equals("_")) {
      state.expected(mark(), "NAME");
      return null;
    }
    int m = mark();
    advance();
    if (!lookahead(false, Rule.NAME_PATTERN_FOLLOW)) {
      reset(m);
      return null;
    }
    return t;
  }

  private Pattern closedPattern() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.type) {
      case NAME: {
        if (t.text.equals("None")) {
          advance();
          return new Pattern.MatchSingleton(spanOf(t), PyConstant.NONE);
        } else if (t.text.equals("True")) {
          advance();
          return new Pattern.MatchSingleton(spanOf(t), Boolean.TRUE);
        } else if (t.text.equals("False")) {
          advance();
          return new Pattern.MatchSingleton(spanOf(t), Boolean.FALSE);
        } else if (t.text.equals("_")) {
          advance();
          return new Pattern.MatchAs(spanOf(t), null, null);
        }
        Token capture = captureTarget();
        if (capture != null) {
          return new Pattern.MatchAs(spanOf(capture), null, capture.text);
        }
        return valueOrClassPattern();
      }
      case NUMBER:
      case MINUS:
      case STRING:
      case FSTRING_START:
      case TSTRING_START: {
        Expr value = literalExpr();
        if (value == null) {
          return null;
        }
        return new Pattern.MatchValue(value.getSpan(), value);
      }
      case LPAR:
        return groupOrSequencePattern();
      case LSQB:
        return listPattern();
      case LBRACE:
        return mappingPattern();
      default:
        state.expected(mark(), "pattern");
        return null;
    }
  }

  /**
   * Number, complex number, string or singleton as an expression
   */
  private Expr literalExpr() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.type) {
      case NUMBER:
      case MINUS:
        return numberLiteral();
      case STRING:
      case FSTRING_START:
      case TSTRING_START: {
        Expr s = strings();
        if (s != null && !(s instanceof Expr.Constant)) {
          throw error(s, "patterns may only match literals and " +
                         "attribute lookups");
        }
        return s;
      }
      case NAME:
        if (t.text.equals("None")) {
          advance();
          return new Expr.Constant(spanOf(t), PyConstant.NONE);
        } else if (t.text.equals("True")) {
          advance();
          return new Expr.Constant(spanOf(t), Boolean.TRUE);
        } else if (t.text.equals("False")) {
          advance();
          return new Expr.Constant(spanOf(t), Boolean.FALSE);
        }
        return null;
      default:
        return null;
    }
  }

  /**
   * ['-'] NUMBER, optionally followed by ('+' | '-') imaginary NUMBER
   */
  private Expr numberLiteral() throws InvalidSyntaxException {
    Token start = peek();
    int m = mark();
    boolean negative = match(TokenType.MINUS);
    Token num = expect(TokenType.NUMBER);
    if (num == null) {
      reset(m);
      return null;
    }
    Object value = Literals.decodeNumber(state.getFile(), num);
    Expr real = new Expr.Constant(spanOf(num), value);
    if (negative) {
      real = new Expr.UnaryOp(spanFrom(start), UnaryOperator.USUB, real);
    }
    if (!peekIs(TokenType.PLUS) && !peekIs(TokenType.MINUS)) {
      return real;
    }

    Token op = advance();
    Token imagTok = expect(TokenType.NUMBER);
    if (imagTok == null) {
      throw furthestError();
    }
    if (value instanceof Imaginary) {
      throw error(num, "real number required in complex literal");
    }
    Object imagValue = Literals.decodeNumber(state.getFile(), imagTok);
    if (!(imagValue instanceof Imaginary)) {
      throw error(imagTok, "imaginary number required in complex literal");
    }
    Expr imag = new Expr.Constant(spanOf(imagTok), imagValue);
    Operator binop = op.type == TokenType.PLUS ? Operator.ADD : Operator.SUB;
    return new Expr.BinOp(spanFrom(start), real, binop, imag);
  }

  /**
   * NAME ('.' NAME)*
   */
  private Expr nameOrAttr() {
    Token first = expectName();
    if (first == null) {
      return null;
    }
    Expr e = new Expr.Name(spanOf(first), first.text, ExprContext.LOAD);
    while (peekIs(TokenType.DOT)) {
      int m = mark();
      advance();
      Token name = expectName();
      if (name == null) {
        reset(m);
        break;
      }
      e = new Expr.Attribute(spanFrom(first), e, name.text,
                             ExprContext.LOAD);
    }
    return e;
  }

  private Pattern valueOrClassPattern() throws InvalidSyntaxException {
    int m = mark();
    Expr dotted = nameOrAttr();
    if (dotted == null) {
      return null;
    }
    if (peekIs(TokenType.LPAR)) {
      return classPattern(dotted);
    }
    if (dotted instanceof Expr.Attribute && !peekIs(TokenType.EQUAL)) {
      return new Pattern.MatchValue(dotted.getSpan(), dotted);
    }
    reset(m);
    return null;
  }

  private Pattern classPattern(Expr cls) throws InvalidSyntaxException {
    advance();
    List<Pattern> positional = new ArrayList<Pattern>();
    List<String> kwdAttrs = new ArrayList<String>();
    List<Pattern> kwdPatterns = new ArrayList<Pattern>();
    while (!peekIs(TokenType.RPAR)) {
      Token t = peek();
      if (t.type == TokenType.NAME && !isKeyword(t) &&
          peek(1).type == TokenType.EQUAL) {
        advance();
        advance();
        Pattern p = pattern();
        if (p == null) {
          throw furthestError();
        }
        kwdAttrs.add(t.text);
        kwdPatterns.add(p);
      } else {
        Pattern p = pattern();
        if (p == null) {
          throw furthestError();
        }
        if (!kwdAttrs.isEmpty()) {
          throw error(p, "positional patterns follow keyword patterns");
        }
        positional.add(p);
      }
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    if (!match(TokenType.RPAR)) {
      throw furthestError();
    }
    return new Pattern.MatchClass(spanFrom(cls), cls, positional, kwdAttrs,
                                  kwdPatterns);
  }

  /**
   * '(' pattern ')' is the pattern itself; with a comma or empty
   * parentheses it is a sequence
   */
  private Pattern groupOrSequencePattern() throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    if (match(TokenType.RPAR)) {
      return new Pattern.MatchSequence(spanFrom(open),
                                       new ArrayList<Pattern>());
    }
    Pattern first = maybeStarPattern();
    if (first == null) {
      reset(m);
      return null;
    }
    if (peekIs(TokenType.RPAR)) {
      if (first instanceof Pattern.MatchStar) {
        reset(m);
        return null;
      }
      advance();
      return first;
    }
    if (!peekIs(TokenType.COMMA)) {
      check(TokenType.RPAR);
      reset(m);
      return null;
    }
    List<Pattern> elts = new ArrayList<Pattern>();
    elts.add(first);
    if (!sequenceRest(elts, TokenType.RPAR)) {
      reset(m);
      return null;
    }
    return new Pattern.MatchSequence(spanFrom(open), elts);
  }

  private Pattern listPattern() throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    List<Pattern> elts = new ArrayList<Pattern>();
    if (!match(TokenType.RSQB)) {
      Pattern first = maybeStarPattern();
      if (first == null) {
        reset(m);
        return null;
      }
      elts.add(first);
      if (!sequenceRest(elts, TokenType.RSQB)) {
        reset(m);
        return null;
      }
    }
    return new Pattern.MatchSequence(spanFrom(open), elts);
  }

  /**
   * Remaining ',' pattern pairs through the closing token
   */
  private boolean sequenceRest(List<Pattern> elts, TokenType closer)
                                        throws InvalidSyntaxException {
    while (match(TokenType.COMMA)) {
      if (peekIs(closer)) {
        break;
      }
      Pattern p = maybeStarPattern();
      if (p == null) {
        return false;
      }
      elts.add(p);
    }
    return match(closer);
  }

  private Pattern mappingPattern() throws InvalidSyntaxException {
    Token open = advance();
    List<Expr> keys = new ArrayList<Expr>();
    List<Pattern> values = new ArrayList<Pattern>();
    String rest = null;
    while (!peekIs(TokenType.RBRACE)) {
      if (match(TokenType.DOUBLESTAR)) {
        Token name = captureTarget();
        if (name == null) {
          throw furthestError();
        }
        rest = name.text;
        match(TokenType.COMMA);
        break;
      }
      Expr key = mappingKey();
      if (!match(TokenType.COLON)) {
        throw furthestError();
      }
      Pattern value = pattern();
      if (value == null) {
        throw furthestError();
      }
      keys.add(key);
      values.add(value);
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    if (!match(TokenType.RBRACE)) {
      throw furthestError();
    }
    return new Pattern.MatchMapping(spanFrom(open), keys, values, rest);
  }

  /**
   * Literal or dotted name key of a mapping pattern
   */
  private Expr mappingKey() throws InvalidSyntaxException {
    Expr key = literalExpr();
    if (key != null) {
      return key;
    }
    int m = mark();
    key = nameOrAttr();
    if (key instanceof Expr.Attribute) {
      return key;
    }
    reset(m);
    Expr other = bitwiseOr();
    if (other != null) {
      throw error(other, "patterns may only match literals and attribute " +
                         "lookups");
    }
    throw furthestError();
  }
}
