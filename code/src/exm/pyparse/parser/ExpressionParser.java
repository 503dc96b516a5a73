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

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.pyparse.ast.Arg;
import exm.pyparse.ast.Arguments;
import exm.pyparse.ast.Comprehension;
import exm.pyparse.ast.Expr;
import exm.pyparse.ast.Keyword;
import exm.pyparse.ast.Operators.BoolOperator;
import exm.pyparse.ast.Operators.CmpOperator;
import exm.pyparse.ast.Operators.ExprContext;
import exm.pyparse.ast.Operators.Operator;
import exm.pyparse.ast.Operators.UnaryOperator;
import exm.pyparse.ast.PyBytes;
import exm.pyparse.ast.PyConstant;
import exm.pyparse.ast.Span;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

/**
 * Expression, target, parameter and string literal rules
 */
public class ExpressionParser extends AbstractParser {

  /**
   * Binary operator levels from loosest to tightest.  Each level is
   * left associative; the operands of the last level are factors.
   */
  private static final TokenType[][] LEVEL_TOKENS = {
    { TokenType.VBAR },
    { TokenType.CIRCUMFLEX },
    { TokenType.AMPER },
    { TokenType.LEFTSHIFT, TokenType.RIGHTSHIFT },
    { TokenType.PLUS, TokenType.MINUS },
    { TokenType.STAR, TokenType.SLASH, TokenType.DOUBLESLASH,
      TokenType.PERCENT, TokenType.AT },
  };

  private static final Operator[][] LEVEL_OPS = {
    { Operator.BITOR },
    { Operator.BITXOR },
    { Operator.BITAND },
    { Operator.LSHIFT, Operator.RSHIFT },
    { Operator.ADD, Operator.SUB },
    { Operator.MULT, Operator.DIV, Operator.FLOORDIV, Operator.MOD,
      Operator.MATMULT },
  };

  /**
   * Positional and keyword arguments of a call or class definition
   */
  protected static class CallArgs {
    public final List<Expr> args = new ArrayList<Expr>();
    public final List<Keyword> keywords = new ArrayList<Keyword>();
  }

  protected ExpressionParser(ParserState state) {
    super(state);
  }

  @Override
  protected Object invoke(Rule rule) throws InvalidSyntaxException {
    switch (rule) {
      case EXPRESSION:
        return expressionRule();
      case STAR_EXPRESSIONS:
        return starExpressionsRule();
      case STAR_NAMED_EXPRESSION:
        return starNamedExpressionRule();
      case DISJUNCTION:
        return disjunctionRule();
      case CONJUNCTION:
        return conjunctionRule();
      case INVERSION:
        return inversionRule();
      case BITWISE_OR:
        return binaryLevel(0);
      case AWAIT_PRIMARY:
        return awaitPrimaryRule();
      case STRINGS:
        return stringsRule();
      case T_PRIMARY:
        return tPrimaryRule();
      case STAR_TARGET:
        return starTargetRule();
      case T_LOOKAHEAD:
        return tLookahead();
      default:
        return super.invoke(rule);
    }
  }

  public Expr expression() throws InvalidSyntaxException {
    return memoized(Rule.EXPRESSION, Expr.class);
  }

  public Expr starExpressions() throws InvalidSyntaxException {
    return memoized(Rule.STAR_EXPRESSIONS, Expr.class);
  }

  protected Expr starNamedExpression() throws InvalidSyntaxException {
    return memoized(Rule.STAR_NAMED_EXPRESSION, Expr.class);
  }

  protected Expr disjunction() throws InvalidSyntaxException {
    return memoized(Rule.DISJUNCTION, Expr.class);
  }

  protected Expr conjunction() throws InvalidSyntaxException {
    return memoized(Rule.CONJUNCTION, Expr.class);
  }

  protected Expr inversion() throws InvalidSyntaxException {
    return memoized(Rule.INVERSION, Expr.class);
  }

  protected Expr bitwiseOr() throws InvalidSyntaxException {
    return memoized(Rule.BITWISE_OR, Expr.class);
  }

  protected Expr awaitPrimary() throws InvalidSyntaxException {
    return memoized(Rule.AWAIT_PRIMARY, Expr.class);
  }

  protected Expr strings() throws InvalidSyntaxException {
    return memoized(Rule.STRINGS, Expr.class);
  }

  protected Expr tPrimary() throws InvalidSyntaxException {
    return memoized(Rule.T_PRIMARY, Expr.class);
  }

  protected Expr starTarget() throws InvalidSyntaxException {
    return memoized(Rule.STAR_TARGET, Expr.class);
  }

  private Expr starExpressionsRule() throws InvalidSyntaxException {
    Token start = peek();
    Expr first = starExpression();
    if (first == null) {
      return null;
    }
    if (!peekIs(TokenType.COMMA)) {
      return first;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    while (match(TokenType.COMMA)) {
      Expr e = starExpression();
      if (e == null) {
        break;
      }
      elts.add(e);
    }
    return new Expr.Tuple(spanFrom(start), elts, ExprContext.LOAD);
  }

  protected Expr starExpression() throws InvalidSyntaxException {
    if (peekIs(TokenType.STAR)) {
      int m = mark();
      Token star = advance();
      Expr value = bitwiseOr();
      if (value == null) {
        reset(m);
        return null;
      }
      return new Expr.Starred(spanFrom(star), value, ExprContext.LOAD);
    }
    return expression();
  }

  private Expr starNamedExpressionRule() throws InvalidSyntaxException {
    if (peekIs(TokenType.STAR)) {
      int m = mark();
      Token star = advance();
      Expr value = bitwiseOr();
      if (value == null) {
        reset(m);
        return null;
      }
      return new Expr.Starred(spanFrom(star), value, ExprContext.LOAD);
    }
    return namedExpression();
  }

  /**
   * NAME ':=' expression, or an expression
   */
  public Expr namedExpression() throws InvalidSyntaxException {
    if (peekIs(TokenType.NAME) && peek(1).type == TokenType.COLONEQUAL) {
      int m = mark();
      Token name = expectName();
      if (name != null) {
        advance();
        Expr value = expression();
        if (value == null) {
          throw furthestError();
        }
        Expr target = new Expr.Name(spanOf(name), name.text,
                                    ExprContext.STORE);
        return new Expr.NamedExpr(spanFrom(name), target, value);
      }
      reset(m);
    }
    Expr e = expression();
    if (e != null && peekIs(TokenType.COLONEQUAL)) {
      throw error(e, "cannot use assignment expressions with " +
                     e.describe());
    }
    return e;
  }

  private Expr expressionRule() throws InvalidSyntaxException {
    if (peekKeyword("lambda")) {
      return lambdef();
    }
    Token start = peek();
    Expr body = disjunction();
    if (body == null) {
      return null;
    }
    if (!peekKeyword("if")) {
      return body;
    }
    advance();
    Expr test = disjunction();
    if (test == null) {
      throw furthestError();
    }
    if (!matchKeyword("else")) {
      throw error(peek(), "expected 'else' after 'if' expression");
    }
    Expr orelse = expression();
    if (orelse == null) {
      throw furthestError();
    }
    return new Expr.IfExp(spanFrom(start), test, body, orelse);
  }

  public Expr yieldExpr() throws InvalidSyntaxException {
    Token yield = expectKeyword("yield");
    if (yield == null) {
      return null;
    }
    if (matchKeyword("from")) {
      Expr value = expression();
      if (value == null) {
        throw furthestError();
      }
      return new Expr.YieldFrom(spanFrom(yield), value);
    }
    Expr value = starExpressions();
    return new Expr.Yield(spanFrom(yield), value);
  }

  private Expr lambdef() throws InvalidSyntaxException {
    Token lambda = advance();
    Arguments args;
    if (peekIs(TokenType.COLON)) {
      args = Arguments.empty();
    } else {
      args = parameters(false, TokenType.COLON);
    }
    if (!match(TokenType.COLON)) {
      throw furthestError();
    }
    Expr body = expression();
    if (body == null) {
      throw furthestError();
    }
    return new Expr.Lambda(spanFrom(lambda), args, body);
  }

  private Expr disjunctionRule() throws InvalidSyntaxException {
    return boolOp(BoolOperator.OR);
  }

  private Expr conjunctionRule() throws InvalidSyntaxException {
    return boolOp(BoolOperator.AND);
  }

  private Expr boolOp(BoolOperator op) throws InvalidSyntaxException {
    Token start = peek();
    Expr first = op == BoolOperator.OR ? conjunction() : inversion();
    if (first == null) {
      return null;
    }
    List<Expr> values = new ArrayList<Expr>();
    values.add(first);
    while (peekKeyword(op.symbol)) {
      int m = mark();
      advance();
      Expr next = op == BoolOperator.OR ? conjunction() : inversion();
      if (next == null) {
        reset(m);
        break;
      }
      values.add(next);
    }
    if (values.size() == 1) {
      return first;
    }
    return new Expr.BoolOp(spanFrom(start), op, values);
  }

  private Expr inversionRule() throws InvalidSyntaxException {
    if (peekKeyword("not")) {
      int m = mark();
      Token not = advance();
      Expr operand = inversion();
      if (operand == null) {
        reset(m);
        return null;
      }
      return new Expr.UnaryOp(spanFrom(not), UnaryOperator.NOT, operand);
    }
    return comparison();
  }

  /**
   * A comparison chain collected into one Compare node
   */
  private Expr comparison() throws InvalidSyntaxException {
    Token start = peek();
    Expr left = bitwiseOr();
    if (left == null) {
      return null;
    }
    List<CmpOperator> ops = new ArrayList<CmpOperator>();
    List<Expr> comparators = new ArrayList<Expr>();
    while (true) {
      int m = mark();
      CmpOperator op = compareOp();
      if (op == null) {
        break;
      }
      Expr right = bitwiseOr();
      if (right == null) {
        reset(m);
        break;
      }
      ops.add(op);
      comparators.add(right);
    }
    if (ops.isEmpty()) {
      return left;
    }
    return new Expr.Compare(spanFrom(start), left, ops, comparators);
  }

  /**
   * Consume a comparison operator
   * @return the operator, or null with nothing consumed
   */
  private CmpOperator compareOp() {
    Token t = peek();
    CmpOperator op = null;
    switch (t.type) {
      case EQEQUAL:
        op = CmpOperator.EQ;
        break;
      case NOTEQUAL:
        op = CmpOperator.NOTEQ;
        break;
      case LESS:
        op = CmpOperator.LT;
        break;
      case LESSEQUAL:
        op = CmpOperator.LTE;
        break;
      case GREATER:
        op = CmpOperator.GT;
        break;
      case GREATEREQUAL:
        op = CmpOperator.GTE;
        break;
      case NAME:
        if (t.text.equals("in")) {
          op = CmpOperator.IN;
        } else if (t.text.equals("not") && peek(1).isName("in")) {
          advance();
          op = CmpOperator.NOTIN;
        } else if (t.text.equals("is")) {
          if (peek(1).isName("not")) {
            advance();
            op = CmpOperator.ISNOT;
          } else {
            op = CmpOperator.IS;
          }
        }
        break;
      default:
        break;
    }
    if (op != null) {
      advance();
    }
    return op;
  }

  private Expr binaryLevel(int level) throws InvalidSyntaxException {
    Token start = peek();
    Expr left = binaryOperand(level);
    if (left == null) {
      return null;
    }
    while (true) {
      Operator op = binaryOp(peek().type, level);
      if (op == null) {
        return left;
      }
      int m = mark();
      advance();
      Expr right = binaryOperand(level);
      if (right == null) {
        reset(m);
        return left;
      }
      left = new Expr.BinOp(spanFrom(start), left, op, right);
    }
  }

  private Expr binaryOperand(int level) throws InvalidSyntaxException {
    if (level + 1 < LEVEL_TOKENS.length) {
      return binaryLevel(level + 1);
    }
    return factor();
  }

  private static Operator binaryOp(TokenType type, int level) {
    TokenType[] tokens = LEVEL_TOKENS[level];
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] == type) {
        return LEVEL_OPS[level][i];
      }
    }
    return null;
  }

  private Expr factor() throws InvalidSyntaxException {
    Token t = peek();
    UnaryOperator op;
    switch (t.type) {
      case PLUS:
        op = UnaryOperator.UADD;
        break;
      case MINUS:
        op = UnaryOperator.USUB;
        break;
      case TILDE:
        op = UnaryOperator.INVERT;
        break;
      default:
        return power();
    }
    int m = mark();
    advance();
    Expr operand = factor();
    if (operand == null) {
      reset(m);
      return null;
    }
    return new Expr.UnaryOp(spanFrom(t), op, operand);
  }

  private Expr power() throws InvalidSyntaxException {
    Token start = peek();
    Expr base = awaitPrimary();
    if (base == null) {
      return null;
    }
    if (peekIs(TokenType.DOUBLESTAR)) {
      int m = mark();
      advance();
      Expr exponent = factor();
      if (exponent == null) {
        reset(m);
        return base;
      }
      return new Expr.BinOp(spanFrom(start), base, Operator.POW,
                             exponent);
    }
    return base;
  }

  private Expr awaitPrimaryRule() throws InvalidSyntaxException {
    if (peekKeyword("await")) {
      int m = mark();
      Token await = advance();
      Expr value = primary();
      if (value == null) {
        reset(m);
        return null;
      }
      return new Expr.Await(spanFrom(await), value);
    }
    return primary();
  }

  protected Expr primary() throws InvalidSyntaxException {
    Token start = peek();
    Expr a = atom();
    if (a == null) {
      return null;
    }
    while (true) {
      Expr next = trailer(start, a);
      if (next == null) {
        return a;
      }
      a = next;
    }
  }

  /**
   * Apply one attribute, subscript or call trailer to base
   * @param start first token of base, including any parentheses
   * @return the new expression, or null with the cursor unchanged
   */
  private Expr trailer(Token start, Expr base)
                                        throws InvalidSyntaxException {
    int m = mark();
    switch (peek().type) {
      case DOT: {
        advance();
        Token name = expectName();
        if (name == null) {
          reset(m);
          return null;
        }
        return new Expr.Attribute(spanFrom(start), base, name.text,
                                  ExprContext.LOAD);
      }
      case LSQB: {
        advance();
        Expr slice = slices();
        if (slice == null || !match(TokenType.RSQB)) {
          reset(m);
          return null;
        }
        return new Expr.Subscript(spanFrom(start), base, slice,
                                  ExprContext.LOAD);
      }
      case LPAR:
        return call(start, base);
      default:
        return null;
    }
  }

  private Expr call(Token start, Expr base)
                                        throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    int afterOpen = mark();

    // Generator expression as the sole argument
    Expr elt = namedExpression();
    if (elt != null && atComprehension()) {
      List<Comprehension> generators = forIfClauses();
      if (match(TokenType.RPAR)) {
        Expr genexp = new Expr.GeneratorExp(spanFrom(open), elt, generators);
        return new Expr.Call(spanFrom(start), base,
                             Collections.singletonList(genexp),
                             Collections.<Keyword>emptyList());
      }
      if (peekIs(TokenType.COMMA)) {
        throw error(elt, "Generator expression must be parenthesized");
      }
      reset(m);
      return null;
    }
    reset(afterOpen);

    CallArgs args = arguments(TokenType.RPAR);
    if (args == null || !match(TokenType.RPAR)) {
      reset(m);
      return null;
    }
    return new Expr.Call(spanFrom(start), base, args.args, args.keywords);
  }

  /**
   * Argument list up to but not including the closing token
   * @return arguments, or null if they do not parse
   */
  protected CallArgs arguments(TokenType closer)
                                        throws InvalidSyntaxException {
    CallArgs result = new CallArgs();
    boolean seenKeyword = false;
    boolean seenDoubleStar = false;
    while (!peekIs(closer)) {
      Token t = peek();
      if (t.type == TokenType.STAR) {
        advance();
        Expr value = expression();
        if (value == null) {
          return null;
        }
        if (seenDoubleStar) {
          throw error(t, "iterable argument unpacking follows keyword " +
                         "argument unpacking");
        }
        result.args.add(new Expr.Starred(spanFrom(t), value,
                                         ExprContext.LOAD));
      } else if (t.type == TokenType.DOUBLESTAR) {
        advance();
        Expr value = expression();
        if (value == null) {
          return null;
        }
        result.keywords.add(new Keyword(spanFrom(t), null, value));
        seenDoubleStar = true;
      } else if (t.type == TokenType.NAME && !isKeyword(t) &&
                 peek(1).type == TokenType.EQUAL) {
        advance();
        advance();
        Expr value = expression();
        if (value == null) {
          return null;
        }
        result.keywords.add(new Keyword(spanFrom(t), t.text, value));
        seenKeyword = true;
      } else {
        Expr e = namedExpression();
        if (e == null) {
          return null;
        }
        if (peekIs(TokenType.EQUAL)) {
          throw error(e, "expression cannot contain assignment, " +
                         "perhaps you meant \"==\"?");
        }
        if (atComprehension()) {
          throw error(e, "Generator expression must be parenthesized");
        }
        if (seenDoubleStar) {
          throw error(e, "positional argument follows keyword argument " +
                         "unpacking");
        }
        if (seenKeyword) {
          throw error(e, "positional argument follows keyword argument");
        }
        result.args.add(e);
      }
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    return result;
  }

  /**
   * Contents of a subscript: one slice or expression, or a tuple of them
   */
  protected Expr slices() throws InvalidSyntaxException {
    Token start = peek();
    Expr first = sliceItem();
    if (first == null) {
      return null;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    if (!peekIs(TokenType.COMMA)) {
      if (first instanceof Expr.Starred) {
        // x[*a] indexes with a one-element tuple
        return new Expr.Tuple(spanFrom(start), elts, ExprContext.LOAD);
      }
      return first;
    }
    while (match(TokenType.COMMA)) {
      Expr e = sliceItem();
      if (e == null) {
        break;
      }
      elts.add(e);
    }
    return new Expr.Tuple(spanFrom(start), elts, ExprContext.LOAD);
  }

  private Expr sliceItem() throws InvalidSyntaxException {
    Token start = peek();
    int m = mark();
    if (start.type == TokenType.STAR) {
      advance();
      Expr value = expression();
      if (value == null) {
        reset(m);
        return null;
      }
      return new Expr.Starred(spanFrom(start), value, ExprContext.LOAD);
    }
    Expr lower = expression();
    if (peekIs(TokenType.COLON)) {
      advance();
      Expr upper = expression();
      Expr step = null;
      if (match(TokenType.COLON)) {
        step = expression();
      }
      return new Expr.Slice(spanFrom(start), lower, upper, step);
    }
    reset(m);
    return namedExpression();
  }

  protected Expr atom() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.type) {
      case NAME:
        if (t.text.equals("True")) {
          advance();
          return new Expr.Constant(spanOf(t), Boolean.TRUE);
        } else if (t.text.equals("False")) {
          advance();
          return new Expr.Constant(spanOf(t), Boolean.FALSE);
        } else if (t.text.equals("None")) {
          advance();
          return new Expr.Constant(spanOf(t), PyConstant.NONE);
        } else if (isKeyword(t)) {
          state.expected(mark(), "expression");
          return null;
        }
        advance();
        return new Expr.Name(spanOf(t), t.text, ExprContext.LOAD);
      case NUMBER:
        advance();
        return new Expr.Constant(spanOf(t),
                                 Literals.decodeNumber(state.getFile(), t));
      case STRING:
      case FSTRING_START:
      case TSTRING_START:
        return strings();
      case ELLIPSIS:
        advance();
        return new Expr.Constant(spanOf(t), PyConstant.ELLIPSIS);
      case LPAR:
        return tupleGroupOrGenexp();
      case LSQB:
        return listOrListComp();
      case LBRACE:
        return dictOrSet();
      default:
        state.expected(mark(), "expression");
        return null;
    }
  }

  protected boolean atComprehension() {
    return peekKeyword("for") ||
           (peekKeyword("async") && peek(1).isName("for"));
  }

  private Expr tupleGroupOrGenexp() throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    if (match(TokenType.RPAR)) {
      return new Expr.Tuple(spanFrom(open), Collections.<Expr>emptyList(),
                            ExprContext.LOAD);
    }
    if (peekKeyword("yield")) {
      Expr y = yieldExpr();
      if (!match(TokenType.RPAR)) {
        reset(m);
        return null;
      }
      return y;
    }
    Expr first = starNamedExpression();
    if (first == null) {
      reset(m);
      return null;
    }
    if (atComprehension()) {
      checkComprehensionElement(first);
      List<Comprehension> generators = forIfClauses();
      if (!match(TokenType.RPAR)) {
        reset(m);
        return null;
      }
      return new Expr.GeneratorExp(spanFrom(open), first, generators);
    }
    if (peekIs(TokenType.RPAR)) {
      if (first instanceof Expr.Starred) {
        throw error(first, "cannot use starred expression here");
      }
      advance();
      return first;
    }
    if (!peekIs(TokenType.COMMA)) {
      check(TokenType.RPAR);
      reset(m);
      return null;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    if (!elementsAfterFirst(elts, TokenType.RPAR)) {
      reset(m);
      return null;
    }
    return new Expr.Tuple(spanFrom(open), elts, ExprContext.LOAD);
  }

  /**
   * Parse ',' element pairs up to and including the closing token
   * @return false if the closing token is missing
   */
  private boolean elementsAfterFirst(List<Expr> elts, TokenType closer)
                                        throws InvalidSyntaxException {
    while (match(TokenType.COMMA)) {
      if (peekIs(closer)) {
        break;
      }
      Expr e = starNamedExpression();
      if (e == null) {
        return false;
      }
      elts.add(e);
    }
    return match(closer);
  }

  private void checkComprehensionElement(Expr elt)
                                        throws InvalidSyntaxException {
    if (elt instanceof Expr.Starred) {
      throw error(elt, "iterable unpacking cannot be used in comprehension");
    }
  }

  private Expr listOrListComp() throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    if (match(TokenType.RSQB)) {
      return new Expr.List(spanFrom(open), Collections.<Expr>emptyList(),
                           ExprContext.LOAD);
    }
    Expr first = starNamedExpression();
    if (first == null) {
      reset(m);
      return null;
    }
    if (atComprehension()) {
      checkComprehensionElement(first);
      List<Comprehension> generators = forIfClauses();
      if (!match(TokenType.RSQB)) {
        reset(m);
        return null;
      }
      return new Expr.ListComp(spanFrom(open), first, generators);
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    if (!elementsAfterFirst(elts, TokenType.RSQB)) {
      reset(m);
      return null;
    }
    return new Expr.List(spanFrom(open), elts, ExprContext.LOAD);
  }

  private Expr dictOrSet() throws InvalidSyntaxException {
    int m = mark();
    Token open = advance();
    if (match(TokenType.RBRACE)) {
      return new Expr.Dict(spanFrom(open), Collections.<Expr>emptyList(),
                           Collections.<Expr>emptyList());
    }
    if (!peekIs(TokenType.DOUBLESTAR)) {
      int afterOpen = mark();
      Expr first = starNamedExpression();
      if (first == null) {
        reset(m);
        return null;
      }
      if (!peekIs(TokenType.COLON)) {
        Expr set = setBody(open, first);
        if (set == null) {
          reset(m);
        }
        return set;
      }
      reset(afterOpen);
    }
    Expr dict = dictBody(open);
    if (dict == null) {
      reset(m);
    }
    return dict;
  }

  private Expr setBody(Token open, Expr first)
                                        throws InvalidSyntaxException {
    if (atComprehension()) {
      checkComprehensionElement(first);
      List<Comprehension> generators = forIfClauses();
      if (!match(TokenType.RBRACE)) {
        return null;
      }
      return new Expr.SetComp(spanFrom(open), first, generators);
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    if (!elementsAfterFirst(elts, TokenType.RBRACE)) {
      return null;
    }
    return new Expr.Set(spanFrom(open), elts);
  }

  private Expr dictBody(Token open) throws InvalidSyntaxException {
    List<Expr> keys = new ArrayList<Expr>();
    List<Expr> values = new ArrayList<Expr>();
    do {
      if (peekIs(TokenType.RBRACE)) {
        break;
      }
      if (peekIs(TokenType.DOUBLESTAR)) {
        Token stars = advance();
        Expr value = bitwiseOr();
        if (value == null) {
          return null;
        }
        if (keys.isEmpty() && atComprehension()) {
          throw error(stars, "dict unpacking cannot be used in dict " +
                             "comprehension");
        }
        keys.add(null);
        values.add(value);
        continue;
      }
      Expr key = expression();
      if (key == null || !match(TokenType.COLON)) {
        return null;
      }
      Expr value = expression();
      if (value == null) {
        return null;
      }
      if (keys.isEmpty() && atComprehension()) {
        List<Comprehension> generators = forIfClauses();
        if (!match(TokenType.RBRACE)) {
          return null;
        }
        return new Expr.DictComp(spanFrom(open), key, value, generators);
      }
      keys.add(key);
      values.add(value);
    } while (match(TokenType.COMMA));
    if (!match(TokenType.RBRACE)) {
      return null;
    }
    return new Expr.Dict(spanFrom(open), keys, values);
  }

  /**
   * One or more ['async'] 'for' targets 'in' iter ('if' cond)* clauses
   */
  protected List<Comprehension> forIfClauses()
                                        throws InvalidSyntaxException {
    List<Comprehension> generators = new ArrayList<Comprehension>();
    while (atComprehension()) {
      boolean isAsync = false;
      if (peekKeyword("async")) {
        advance();
        isAsync = true;
      }
      advance();
      int afterFor = mark();
      Expr target = starTargets();
      if (target == null || !matchKeyword("in")) {
        reset(afterFor);
        throw invalidForTarget();
      }
      Expr iter = disjunction();
      if (iter == null) {
        throw furthestError();
      }
      List<Expr> ifs = new ArrayList<Expr>();
      while (peekKeyword("if")) {
        advance();
        Expr cond = disjunction();
        if (cond == null) {
          throw furthestError();
        }
        ifs.add(cond);
      }
      generators.add(new Comprehension(target, iter, ifs, isAsync));
    }
    return generators;
  }

  /**
   * Report a bad target after 'for'.  The cursor is just after the
   * 'for' keyword.
   */
  protected InvalidSyntaxException invalidForTarget()
                                        throws InvalidSyntaxException {
    Expr e = starExpressions();
    if (e != null) {
      Expr bad = Targets.findInvalid(e, Targets.TargetKind.FOR_TARGETS);
      if (bad != null) {
        return error(bad, "cannot assign to " + bad.describe());
      }
    }
    return furthestError();
  }

  /**
   * Adjacent string literals concatenated into one constant, or a
   * JoinedStr / TemplateStr if any part is an f-string or t-string
   */
  private Expr stringsRule() throws InvalidSyntaxException {
    Token first = peek();
    List<Expr> pieces = new ArrayList<Expr>();
    boolean anyBytes = false;
    boolean anyStr = false;
    boolean anyF = false;
    boolean anyT = false;
    String kind = null;
    int count = 0;
    while (true) {
      Token t = peek();
      if (t.type == TokenType.STRING) {
        advance();
        if (count == 0 && Literals.splitString(t).isUnicode()) {
          kind = "u";
        }
        Object value = Literals.decodeString(state.getFile(), t);
        if (value instanceof PyBytes) {
          anyBytes = true;
        } else {
          anyStr = true;
        }
        pieces.add(new Expr.Constant(spanOf(t), value));
      } else if (t.type == TokenType.FSTRING_START ||
                 t.type == TokenType.TSTRING_START) {
        advance();
        if (t.type == TokenType.TSTRING_START) {
          anyT = true;
        } else {
          anyF = true;
        }
        fstringBody(t, pieces);
      } else {
        break;
      }
      count++;
    }
    if (count == 0) {
      state.expected(mark(), "STRING");
      return null;
    }

    Span span = spanFrom(first);
    if (anyBytes && (anyStr || anyF || anyT)) {
      throw error(first, "cannot mix bytes and nonbytes literals");
    }
    if (anyT && (anyStr || anyF)) {
      throw error(first, "cannot mix t-string literals with string or " +
                         "bytes literals");
    }
    if (anyBytes) {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      for (Expr piece: pieces) {
        byte[] b = ((PyBytes) ((Expr.Constant) piece).value).toByteArray();
        bytes.write(b, 0, b.length);
      }
      return new Expr.Constant(span, new PyBytes(bytes.toByteArray()));
    }
    if (!anyF && !anyT) {
      StringBuilder sb = new StringBuilder();
      for (Expr piece: pieces) {
        sb.append((String) ((Expr.Constant) piece).value);
      }
      return new Expr.Constant(span, sb.toString(), kind);
    }
    List<Expr> values = mergeConstants(pieces);
    if (anyT) {
      return new Expr.TemplateStr(span, values);
    }
    return new Expr.JoinedStr(span, values);
  }

  /**
   * Join runs of adjacent string constants and drop empty ones
   */
  private static List<Expr> mergeConstants(List<Expr> pieces) {
    List<Expr> result = new ArrayList<Expr>();
    StringBuilder pending = null;
    Span pendingStart = null;
    Span pendingEnd = null;
    for (Expr piece: pieces) {
      if (piece instanceof Expr.Constant &&
          ((Expr.Constant) piece).isString()) {
        String s = (String) ((Expr.Constant) piece).value;
        if (s.isEmpty()) {
          continue;
        }
        if (pending == null) {
          pending = new StringBuilder();
          pendingStart = piece.getSpan();
        }
        pending.append(s);
        pendingEnd = piece.getSpan();
      } else {
        if (pending != null) {
          result.add(new Expr.Constant(Span.between(pendingStart,
                                       pendingEnd), pending.toString()));
          pending = null;
        }
        result.add(piece);
      }
    }
    if (pending != null) {
      result.add(new Expr.Constant(Span.between(pendingStart, pendingEnd),
                                   pending.toString()));
    }
    return result;
  }

  private static String stringKind(boolean template) {
    return template ? "t-string" : "f-string";
  }

  /**
   * Parse the parts of an f-string or t-string after its start token
   */
  private void fstringBody(Token start, List<Expr> parts)
                                        throws InvalidSyntaxException {
    boolean template = start.type == TokenType.TSTRING_START;
    boolean raw = Literals.stringPrefix(start).indexOf('r') >= 0;
    TokenType middle = template ? TokenType.TSTRING_MIDDLE
                                : TokenType.FSTRING_MIDDLE;
    TokenType end = template ? TokenType.TSTRING_END
                             : TokenType.FSTRING_END;
    while (true) {
      Token t = peek();
      if (t.type == middle) {
        advance();
        String text = Literals.decodeFStringMiddle(state.getFile(), t, raw);
        if (!text.isEmpty()) {
          parts.add(new Expr.Constant(spanOf(t), text));
        }
      } else if (t.type == TokenType.LBRACE) {
        replacementField(template, raw, parts);
      } else if (t.type == end) {
        advance();
        return;
      } else {
        throw error(t, stringKind(template) + ": expecting '}'");
      }
    }
  }

  /**
   * Parse '{' expression ['='] ['!' conversion] [':' spec] '}'
   */
  private void replacementField(boolean template, boolean raw,
                    List<Expr> parts) throws InvalidSyntaxException {
    String kind = stringKind(template);
    Token open = advance();
    Token exprStart = peek();
    switch (exprStart.type) {
      case RBRACE:
      case EXCLAMATION:
      case COLON:
      case EQUAL:
        throw error(exprStart, kind + ": valid expression required " +
                               "before '" + exprStart.text + "'");
      default:
        break;
    }
    Expr value;
    if (peekKeyword("yield")) {
      value = yieldExpr();
    } else {
      value = starExpressions();
    }
    if (value == null) {
      throw furthestError();
    }
    String source = state.getSource();
    String exprText = source.substring(exprStart.startOffset,
                                       lastRealToken().endOffset);

    String debugText = null;
    if (peekIs(TokenType.EQUAL)) {
      advance();
      debugText = source.substring(open.endOffset, peek().startOffset);
    }

    int conversion = Expr.CONVERSION_NONE;
    if (peekIs(TokenType.EXCLAMATION)) {
      advance();
      Token c = peek();
      if (c.type != TokenType.NAME) {
        throw error(c, kind + ": missing conversion character");
      }
      if (!c.text.equals("s") && !c.text.equals("r") &&
          !c.text.equals("a")) {
        throw error(c, kind + ": invalid conversion character '" + c.text +
                       "': expected 's', 'r', or 'a'");
      }
      advance();
      conversion = c.text.charAt(0);
    }

    Expr spec = null;
    if (peekIs(TokenType.COLON)) {
      Token colon = advance();
      spec = formatSpec(colon, template, raw);
    }

    if (!peekIs(TokenType.RBRACE)) {
      throw error(peek(), kind + ": expecting '}'");
    }
    advance();

    Span span = spanFrom(open);
    if (debugText != null) {
      parts.add(new Expr.Constant(span, debugText));
      if (conversion == Expr.CONVERSION_NONE && spec == null) {
        conversion = 'r';
      }
    }
    if (template) {
      parts.add(new Expr.Interpolation(span, value, exprText, conversion,
                                       spec));
    } else {
      parts.add(new Expr.FormattedValue(span, value, conversion, spec));
    }
  }

  private Expr formatSpec(Token colon, boolean template, boolean raw)
                                        throws InvalidSyntaxException {
    TokenType middle = template ? TokenType.TSTRING_MIDDLE
                                : TokenType.FSTRING_MIDDLE;
    List<Expr> parts = new ArrayList<Expr>();
    while (true) {
      Token t = peek();
      if (t.type == middle) {
        advance();
        String text = Literals.decodeFStringMiddle(state.getFile(), t, raw);
        if (!text.isEmpty()) {
          parts.add(new Expr.Constant(spanOf(t), text));
        }
      } else if (t.type == TokenType.LBRACE) {
        replacementField(template, raw, parts);
      } else {
        break;
      }
    }
    Token close = peek();
    Span span = new Span(colon.endLine, colon.endCol, close.line, close.col);
    return new Expr.JoinedStr(span, mergeConstants(parts));
  }

  /* Assignment targets */

  private Object tLookahead() {
    TokenType t = peek().type;
    if (t == TokenType.LPAR || t == TokenType.LSQB || t == TokenType.DOT) {
      return Boolean.TRUE;
    }
    return null;
  }

  /**
   * A primary that is followed by another trailer, so that the last
   * trailer can become the target
   */
  private Expr tPrimaryRule() throws InvalidSyntaxException {
    int m = mark();
    Token start = peek();
    Expr a = atom();
    if (a == null) {
      return null;
    }
    if (!lookahead(true, Rule.T_LOOKAHEAD)) {
      reset(m);
      return null;
    }
    while (true) {
      int before = mark();
      Expr next = trailer(start, a);
      if (next == null) {
        break;
      }
      if (!lookahead(true, Rule.T_LOOKAHEAD)) {
        reset(before);
        break;
      }
      a = next;
    }
    return a;
  }

  /**
   * Attribute or subscript target in the given context
   */
  protected Expr subscriptAttributeTarget(ExprContext ctx)
                                        throws InvalidSyntaxException {
    int m = mark();
    Token start = peek();
    Expr p = tPrimary();
    if (p == null) {
      return null;
    }
    int afterPrimary = mark();
    if (match(TokenType.DOT)) {
      Token name = expectName();
      if (name != null && !lookahead(true, Rule.T_LOOKAHEAD)) {
        return new Expr.Attribute(spanFrom(start), p, name.text, ctx);
      }
    }
    reset(afterPrimary);
    if (match(TokenType.LSQB)) {
      Expr slice = slices();
      if (slice != null && match(TokenType.RSQB) &&
          !lookahead(true, Rule.T_LOOKAHEAD)) {
        return new Expr.Subscript(spanFrom(start), p, slice, ctx);
      }
    }
    reset(m);
    return null;
  }

  /**
   * Comma-separated targets; a Tuple if there is a comma
   */
  public Expr starTargets() throws InvalidSyntaxException {
    Token start = peek();
    Expr first = starTarget();
    if (first == null) {
      return null;
    }
    if (!peekIs(TokenType.COMMA)) {
      return first;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    while (match(TokenType.COMMA)) {
      Expr e = starTarget();
      if (e == null) {
        break;
      }
      elts.add(e);
    }
    return new Expr.Tuple(spanFrom(start), elts, ExprContext.STORE);
  }

  private Expr starTargetRule() throws InvalidSyntaxException {
    if (peekIs(TokenType.STAR)) {
      int m = mark();
      Token star = advance();
      if (peekIs(TokenType.STAR)) {
        reset(m);
        return null;
      }
      Expr value = starTarget();
      if (value == null) {
        reset(m);
        return null;
      }
      return new Expr.Starred(spanFrom(star), value, ExprContext.STORE);
    }
    return targetAtom(ExprContext.STORE);
  }

  /**
   * Attribute, subscript, name, or bracketed target sequence.
   * Starred elements are allowed in a sequence unless ctx is DEL.
   */
  private Expr targetAtom(ExprContext ctx) throws InvalidSyntaxException {
    Expr t = subscriptAttributeTarget(ctx);
    if (t != null) {
      return t;
    }
    Token tok = peek();
    if (tok.type == TokenType.NAME) {
      if (isKeyword(tok)) {
        return null;
      }
      advance();
      return new Expr.Name(spanOf(tok), tok.text, ctx);
    }
    int m = mark();
    if (tok.type == TokenType.LPAR) {
      advance();
      int inner = mark();
      Expr single = targetAtom(ctx);
      if (single != null && match(TokenType.RPAR)) {
        return single;
      }
      reset(inner);
      List<Expr> elts = targetSequence(TokenType.RPAR, ctx);
      if (elts != null && elts.size() == 1 &&
          previous().type != TokenType.COMMA) {
        elts = null;
      }
      if (elts != null && match(TokenType.RPAR)) {
        return new Expr.Tuple(spanFrom(tok), elts, ctx);
      }
    } else if (tok.type == TokenType.LSQB) {
      advance();
      List<Expr> elts = targetSequence(TokenType.RSQB, ctx);
      if (elts != null && match(TokenType.RSQB)) {
        return new Expr.List(spanFrom(tok), elts, ctx);
      }
    }
    reset(m);
    return null;
  }

  /**
   * Targets separated by commas, stopping before closer
   * @return possibly empty list, or null if an element does not parse
   */
  private List<Expr> targetSequence(TokenType closer, ExprContext ctx)
                                        throws InvalidSyntaxException {
    List<Expr> elts = new ArrayList<Expr>();
    while (!peekIs(closer)) {
      Expr e = ctx == ExprContext.DEL ? targetAtom(ctx) : starTarget();
      if (e == null) {
        return null;
      }
      elts.add(e);
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    return elts;
  }

  /**
   * Targets of a del statement
   * @return list of targets, or null
   */
  public List<Expr> delTargets() throws InvalidSyntaxException {
    Expr first = targetAtom(ExprContext.DEL);
    if (first == null) {
      return null;
    }
    List<Expr> targets = new ArrayList<Expr>();
    targets.add(first);
    while (match(TokenType.COMMA)) {
      Expr e = targetAtom(ExprContext.DEL);
      if (e == null) {
        break;
      }
      targets.add(e);
    }
    return targets;
  }

  /* Parameters */

  /**
   * Parameter list of a def or lambda, stopping before closer
   * @param annotations true to allow ': annotation' after names
   */
  public Arguments parameters(boolean annotations, TokenType closer)
                                        throws InvalidSyntaxException {
    List<Arg> posonly = new ArrayList<Arg>();
    List<Arg> args = new ArrayList<Arg>();
    List<Expr> defaults = new ArrayList<Expr>();
    List<Arg> kwonly = new ArrayList<Arg>();
    List<Expr> kwDefaults = new ArrayList<Expr>();
    Arg vararg = null;
    Arg kwarg = null;
    boolean seenSlash = false;
    boolean seenDefault = false;
    Token star = null;
    boolean bareStar = false;

    while (!peekIs(closer)) {
      Token t = peek();
      if (t.type == TokenType.SLASH) {
        advance();
        if (seenSlash) {
          throw error(t, "/ may appear only once");
        }
        if (star != null) {
          throw error(t, "/ must be ahead of *");
        }
        if (args.isEmpty()) {
          throw error(t, "at least one argument must precede /");
        }
        posonly.addAll(args);
        args.clear();
        seenSlash = true;
      } else if (t.type == TokenType.STAR) {
        advance();
        if (star != null) {
          throw error(t, "* argument may appear only once");
        }
        star = t;
        if (peekIs(TokenType.COMMA) || peekIs(closer)) {
          bareStar = true;
        } else {
          vararg = parameter(annotations, true);
          if (vararg == null) {
            throw furthestError();
          }
          if (peekIs(TokenType.EQUAL)) {
            throw error(peek(), "var-positional argument cannot have " +
                                "default value");
          }
        }
      } else if (t.type == TokenType.DOUBLESTAR) {
        advance();
        kwarg = parameter(annotations, false);
        if (kwarg == null) {
          throw furthestError();
        }
        if (peekIs(TokenType.EQUAL)) {
          throw error(peek(), "var-keyword argument cannot have " +
                              "default value");
        }
        if (match(TokenType.COMMA) && !peekIs(closer)) {
          throw error(peek(), "arguments cannot follow var-keyword " +
                              "argument");
        }
        break;
      } else {
        Arg a = parameter(annotations, false);
        if (a == null) {
          throw furthestError();
        }
        Expr dflt = null;
        if (match(TokenType.EQUAL)) {
          dflt = expression();
          if (dflt == null) {
            throw furthestError();
          }
        }
        if (star != null) {
          kwonly.add(a);
          kwDefaults.add(dflt);
        } else {
          if (dflt != null) {
            defaults.add(dflt);
            seenDefault = true;
          } else if (seenDefault) {
            throw error(a, "parameter without a default follows " +
                           "parameter with a default");
          }
          args.add(a);
        }
      }
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    if (bareStar && kwonly.isEmpty()) {
      throw error(star, "named arguments must follow bare *");
    }
    return new Arguments(posonly, args, vararg, kwonly, kwDefaults, kwarg,
                         defaults);
  }

  /**
   * @param starAnnotation allow '*Ts' as the annotation of *args
   */
  private Arg parameter(boolean annotations, boolean starAnnotation)
                                        throws InvalidSyntaxException {
    Token name = expectName();
    if (name == null) {
      return null;
    }
    Expr annotation = null;
    if (annotations && match(TokenType.COLON)) {
      annotation = starAnnotation ? starExpression() : expression();
      if (annotation == null) {
        throw furthestError();
      }
    }
    return new Arg(spanFrom(name), name.text, annotation);
  }
}
