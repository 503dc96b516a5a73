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
import java.util.Collections;
import java.util.List;

import exm.pyparse.ast.Alias;
import exm.pyparse.ast.Arguments;
import exm.pyparse.ast.ExceptHandler;
import exm.pyparse.ast.Expr;
import exm.pyparse.ast.MatchCase;
import exm.pyparse.ast.Module;
import exm.pyparse.ast.Operators.ExprContext;
import exm.pyparse.ast.Operators.Operator;
import exm.pyparse.ast.Pattern;
import exm.pyparse.ast.Stmt;
import exm.pyparse.ast.TypeParam;
import exm.pyparse.ast.WithItem;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.lexer.Token;
import exm.pyparse.lexer.TokenType;

/**
 * Statement rules and the module entry point
 */
public class StatementParser extends PatternParser {

  public StatementParser(ParserState state) {
    super(state);
  }

  @Override
  protected Object invoke(Rule rule) throws InvalidSyntaxException {
    switch (rule) {
      case BLOCK:
        return blockRule();
      case WITH_ITEMS_PAREN:
        return withItemsParen();
      default:
        return super.invoke(rule);
    }
  }

  /**
   * Parse a whole module.  All tokens through ENDMARKER must be consumed.
   */
  public Module file() throws InvalidSyntaxException {
    List<Stmt> body;
    try {
      body = statements();
    } catch (StackOverflowError e) {
      LogHelper.debug(0, "Parser stack overflow: " + e);
      throw error(state.furthestToken(), "source too complex to parse");
    }
    if (!check(TokenType.ENDMARKER)) {
      throw furthestError();
    }
    return new Module(body);
  }

  private List<Stmt> statements() throws InvalidSyntaxException {
    List<Stmt> result = new ArrayList<Stmt>();
    while (!peekIs(TokenType.ENDMARKER) && !peekIs(TokenType.DEDENT)) {
      List<Stmt> stmts = statement();
      if (stmts == null) {
        break;
      }
      result.addAll(stmts);
    }
    return result;
  }

  private List<Stmt> statement() throws InvalidSyntaxException {
    Stmt compound = compoundStatement();
    if (compound != null) {
      return Collections.singletonList(compound);
    }
    return simpleStatements();
  }

  /**
   * Simple statements separated by ';' and ending in NEWLINE
   */
  private List<Stmt> simpleStatements() throws InvalidSyntaxException {
    Stmt first = simpleStatement();
    if (first == null) {
      return null;
    }
    List<Stmt> stmts = new ArrayList<Stmt>();
    stmts.add(first);
    while (match(TokenType.SEMI)) {
      if (peekIs(TokenType.NEWLINE)) {
        break;
      }
      Stmt s = simpleStatement();
      if (s == null) {
        throw furthestError();
      }
      stmts.add(s);
    }
    if (!match(TokenType.NEWLINE)) {
      throw furthestError();
    }
    return stmts;
  }

  @SuppressWarnings("unchecked")
  private List<Stmt> block() throws InvalidSyntaxException {
    return memoized(Rule.BLOCK, List.class);
  }

  /**
   * Body after a compound statement header's ':'
   * @param what statement description for the error message
   * @param header first token of the header
   */
  private List<Stmt> block(String what, Token header)
                                        throws InvalidSyntaxException {
    if (peekIs(TokenType.NEWLINE) && peek(1).type != TokenType.INDENT) {
      advance();
      throw error(peek(), "expected an indented block after " + what +
                          " on line " + header.line);
    }
    List<Stmt> body = block();
    if (body == null) {
      throw furthestError();
    }
    return body;
  }

  private List<Stmt> blockRule() throws InvalidSyntaxException {
    if (match(TokenType.NEWLINE)) {
      if (!match(TokenType.INDENT)) {
        return null;
      }
      List<Stmt> stmts = statements();
      if (stmts.isEmpty() || !match(TokenType.DEDENT)) {
        throw furthestError();
      }
      return stmts;
    }
    return simpleStatements();
  }

  private void expectColon() throws InvalidSyntaxException {
    if (!match(TokenType.COLON)) {
      throw furthestError();
    }
  }

  /* Compound statements */

  private Stmt compoundStatement() throws InvalidSyntaxException {
    Token t = peek();
    if (t.type == TokenType.AT) {
      return decorated();
    }
    if (t.type != TokenType.NAME) {
      return null;
    }
    String kw = t.text;
    if (kw.equals("def")) {
      return functionDef(Collections.<Expr>emptyList(), t, false);
    } else if (kw.equals("class")) {
      return classDef(Collections.<Expr>emptyList());
    } else if (kw.equals("if")) {
      return ifStatement();
    } else if (kw.equals("while")) {
      return whileStatement();
    } else if (kw.equals("for")) {
      return forStatement(t, false);
    } else if (kw.equals("with")) {
      return withStatement(t, false);
    } else if (kw.equals("try")) {
      return tryStatement();
    } else if (kw.equals("async")) {
      Token next = peek(1);
      advance();
      if (next.isName("def")) {
        return functionDef(Collections.<Expr>emptyList(), t, true);
      } else if (next.isName("for")) {
        return forStatement(t, true);
      } else if (next.isName("with")) {
        return withStatement(t, true);
      }
      checkKeyword("def");
      checkKeyword("for");
      checkKeyword("with");
      throw furthestError();
    } else if (kw.equals("match")) {
      return matchStatement();
    }
    return null;
  }

  private Stmt decorated() throws InvalidSyntaxException {
    List<Expr> decorators = new ArrayList<Expr>();
    while (match(TokenType.AT)) {
      Expr d = namedExpression();
      if (d == null || !match(TokenType.NEWLINE)) {
        throw furthestError();
      }
      decorators.add(d);
    }
    Token t = peek();
    if (t.isName("def")) {
      return functionDef(decorators, t, false);
    } else if (t.isName("class")) {
      return classDef(decorators);
    } else if (t.isName("async") && peek(1).isName("def")) {
      advance();
      return functionDef(decorators, t, true);
    }
    checkKeyword("def");
    checkKeyword("class");
    checkKeyword("async");
    throw furthestError();
  }

  /**
   * @param start 'def' token, or 'async' before it
   */
  private Stmt functionDef(List<Expr> decorators, Token start,
                           boolean isAsync) throws InvalidSyntaxException {
    Token def = advance();
    Token name = expectName();
    if (name == null) {
      throw furthestError();
    }
    List<TypeParam> typeParams = typeParams();
    if (!match(TokenType.LPAR)) {
      throw furthestError();
    }
    Arguments args;
    if (peekIs(TokenType.RPAR)) {
      args = Arguments.empty();
    } else {
      args = parameters(true, TokenType.RPAR);
    }
    if (!match(TokenType.RPAR)) {
      throw furthestError();
    }
    Expr returns = null;
    if (match(TokenType.RARROW)) {
      returns = expression();
      if (returns == null) {
        throw furthestError();
      }
    }
    expectColon();
    List<Stmt> body = block("function definition", def);
    return new Stmt.FunctionDef(spanFrom(start), name.text, args, body,
                                decorators, returns, typeParams, isAsync);
  }

  private Stmt classDef(List<Expr> decorators)
                                        throws InvalidSyntaxException {
    Token start = advance();
    Token name = expectName();
    if (name == null) {
      throw furthestError();
    }
    List<TypeParam> typeParams = typeParams();
    CallArgs bases = new CallArgs();
    if (match(TokenType.LPAR)) {
      bases = arguments(TokenType.RPAR);
      if (bases == null || !match(TokenType.RPAR)) {
        throw furthestError();
      }
    }
    expectColon();
    List<Stmt> body = block("class definition", start);
    return new Stmt.ClassDef(spanFrom(start), name.text, bases.args,
                    bases.keywords, body, decorators, typeParams);
  }

  /**
   * Optional '[' type_param (',' type_param)* [','] ']'
   */
  private List<TypeParam> typeParams() throws InvalidSyntaxException {
    List<TypeParam> params = new ArrayList<TypeParam>();
    if (!match(TokenType.LSQB)) {
      return params;
    }
    if (peekIs(TokenType.RSQB)) {
      throw error(peek(), "Type parameter list cannot be empty");
    }
    while (!peekIs(TokenType.RSQB)) {
      Token start = peek();
      if (match(TokenType.STAR)) {
        Token name = expectName();
        if (name == null) {
          throw furthestError();
        }
        if (peekIs(TokenType.COLON)) {
          throw error(peek(), "cannot use bound with TypeVarTuple");
        }
        Expr dflt = null;
        if (match(TokenType.EQUAL)) {
          dflt = starExpression();
          if (dflt == null) {
            throw furthestError();
          }
        }
        params.add(new TypeParam.TypeVarTuple(spanFrom(start), name.text,
                                              dflt));
      } else if (match(TokenType.DOUBLESTAR)) {
        Token name = expectName();
        if (name == null) {
          throw furthestError();
        }
        if (peekIs(TokenType.COLON)) {
          throw error(peek(), "cannot use bound with ParamSpec");
        }
        Expr dflt = typeParamDefault();
        params.add(new TypeParam.ParamSpec(spanFrom(start), name.text,
                                           dflt));
      } else {
        Token name = expectName();
        if (name == null) {
          throw furthestError();
        }
        Expr bound = null;
        if (match(TokenType.COLON)) {
          bound = expression();
          if (bound == null) {
            throw furthestError();
          }
        }
        Expr dflt = typeParamDefault();
        params.add(new TypeParam.TypeVar(spanFrom(start), name.text, bound,
                                         dflt));
      }
      if (!match(TokenType.COMMA)) {
        break;
      }
    }
    if (!match(TokenType.RSQB)) {
      throw furthestError();
    }
    return params;
  }

  private Expr typeParamDefault() throws InvalidSyntaxException {
    if (!match(TokenType.EQUAL)) {
      return null;
    }
    Expr dflt = expression();
    if (dflt == null) {
      throw furthestError();
    }
    return dflt;
  }

  /**
   * 'if' or 'elif' clause with the rest of its chain
   */
  private Stmt ifStatement() throws InvalidSyntaxException {
    Token start = advance();
    Expr test = namedExpression();
    if (test == null) {
      throw furthestError();
    }
    expectColon();
    List<Stmt> body = block("'" + start.text + "' statement", start);
    List<Stmt> orelse;
    if (peekKeyword("elif")) {
      orelse = Collections.singletonList(ifStatement());
    } else {
      orelse = elseBlock();
    }
    return new Stmt.If(spanFrom(start), test, body, orelse);
  }

  /**
   * Optional 'else' ':' block
   */
  private List<Stmt> elseBlock() throws InvalidSyntaxException {
    if (!peekKeyword("else")) {
      return Collections.emptyList();
    }
    Token e = advance();
    expectColon();
    return block("'else' statement", e);
  }

  private Stmt whileStatement() throws InvalidSyntaxException {
    Token start = advance();
    Expr test = namedExpression();
    if (test == null) {
      throw furthestError();
    }
    expectColon();
    List<Stmt> body = block("'while' statement", start);
    List<Stmt> orelse = elseBlock();
    return new Stmt.While(spanFrom(start), test, body, orelse);
  }

  /**
   * @param start 'for' token, or 'async' before it
   */
  private Stmt forStatement(Token start, boolean isAsync)
                                        throws InvalidSyntaxException {
    Token forTok = advance();
    int afterFor = mark();
    Expr target = starTargets();
    if (target == null || !matchKeyword("in")) {
      reset(afterFor);
      throw invalidForTarget();
    }
    Expr iter = starExpressions();
    if (iter == null) {
      throw furthestError();
    }
    expectColon();
    List<Stmt> body = block("'for' statement", forTok);
    List<Stmt> orelse = elseBlock();
    return new Stmt.For(spanFrom(start), target, iter, body, orelse,
                        isAsync);
  }

  /**
   * @param start 'with' token, or 'async' before it
   */
  private Stmt withStatement(Token start, boolean isAsync)
                                        throws InvalidSyntaxException {
    Token with = advance();
    List<WithItem> items;
    if (peekIs(TokenType.LPAR) && lookahead(true, Rule.WITH_ITEMS_PAREN)) {
      advance();
      items = withItems(true);
      if (!match(TokenType.RPAR)) {
        throw furthestError();
      }
    } else {
      items = withItems(false);
    }
    if (items == null) {
      throw furthestError();
    }
    expectColon();
    List<Stmt> body = block("'with' statement", with);
    return new Stmt.With(spanFrom(start), items, body, isAsync);
  }

  /**
   * Matches '(' with_item (',' with_item)* [','] ')' ':'
   */
  private Object withItemsParen() throws InvalidSyntaxException {
    advance();
    List<WithItem> items = withItems(true);
    if (items == null || !match(TokenType.RPAR) ||
        !peekIs(TokenType.COLON)) {
      return null;
    }
    return Boolean.TRUE;
  }

  /**
   * @param parenthesized allow a trailing comma
   */
  private List<WithItem> withItems(boolean parenthesized)
                                        throws InvalidSyntaxException {
    List<WithItem> items = new ArrayList<WithItem>();
    do {
      if (parenthesized && !items.isEmpty() && peekIs(TokenType.RPAR)) {
        break;
      }
      WithItem item = withItem();
      if (item == null) {
        return null;
      }
      items.add(item);
    } while (match(TokenType.COMMA));
    return items;
  }

  private WithItem withItem() throws InvalidSyntaxException {
    Expr context = expression();
    if (context == null) {
      return null;
    }
    if (!peekKeyword("as")) {
      return new WithItem(context, null);
    }
    advance();
    int afterAs = mark();
    Expr target = starTarget();
    if (target != null && (peekIs(TokenType.COMMA) ||
        peekIs(TokenType.RPAR) || peekIs(TokenType.COLON))) {
      return new WithItem(context, target);
    }
    reset(afterAs);
    Expr e = expression();
    if (e != null) {
      Expr bad = Targets.findInvalid(e, Targets.TargetKind.STAR_TARGETS);
      if (bad != null) {
        throw error(bad, "cannot assign to " + bad.describe());
      }
    }
    throw furthestError();
  }

  private Stmt tryStatement() throws InvalidSyntaxException {
    Token start = advance();
    expectColon();
    List<Stmt> body = block("'try' statement", start);
    List<ExceptHandler> handlers = new ArrayList<ExceptHandler>();
    Boolean star = null;
    while (peekKeyword("except")) {
      Token except = advance();
      boolean isStar = match(TokenType.STAR);
      if (star != null && star.booleanValue() != isStar) {
        throw error(except, "cannot have both 'except' and 'except*' " +
                            "on the same 'try'");
      }
      star = isStar;
      Expr type = null;
      String name = null;
      if (!peekIs(TokenType.COLON)) {
        type = expression();
        if (type == null) {
          throw furthestError();
        }
        if (peekIs(TokenType.COMMA)) {
          throw error(type, "multiple exception types must be " +
                            "parenthesized");
        }
        if (matchKeyword("as")) {
          Token n = expectName();
          if (n == null) {
            throw furthestError();
          }
          name = n.text;
        }
      } else if (isStar) {
        throw error(peek(), "expected one or more exception types");
      }
      expectColon();
      String what = isStar ? "'except*' statement" : "'except' statement";
      List<Stmt> handlerBody = block(what, except);
      handlers.add(new ExceptHandler(spanFrom(except), type, name,
                                     handlerBody));
    }
    List<Stmt> orelse = Collections.emptyList();
    if (!handlers.isEmpty()) {
      orelse = elseBlock();
    }
    List<Stmt> finalbody = Collections.emptyList();
    if (peekKeyword("finally")) {
      Token f = advance();
      expectColon();
      finalbody = block("'finally' statement", f);
    }
    if (handlers.isEmpty() && finalbody.isEmpty()) {
      throw error(peek(), "expected 'except' or 'finally' block");
    }
    return new Stmt.Try(spanFrom(start), body, handlers, orelse, finalbody,
                        star != null && star.booleanValue());
  }

  /**
   * Soft keyword 'match': returns null with the cursor restored if
   * this line is not a match statement
   */
  private Stmt matchStatement() throws InvalidSyntaxException {
    int m = mark();
    Token start = advance();
    Expr subject = subjectExpr();
    if (subject == null || !match(TokenType.COLON) ||
        !peekIs(TokenType.NEWLINE)) {
      reset(m);
      return null;
    }
    advance();
    if (!match(TokenType.INDENT)) {
      throw error(peek(), "expected an indented block after 'match' " +
                          "statement on line " + start.line);
    }
    List<MatchCase> cases = new ArrayList<MatchCase>();
    while (peekKeyword("case")) {
      cases.add(caseBlock());
    }
    if (cases.isEmpty()) {
      checkKeyword("case");
      throw furthestError();
    }
    if (!match(TokenType.DEDENT)) {
      throw furthestError();
    }
    return new Stmt.Match(spanFrom(start), subject, cases);
  }

  private Expr subjectExpr() throws InvalidSyntaxException {
    Token start = peek();
    Expr first = starNamedExpression();
    if (first == null) {
      return null;
    }
    if (peekIs(TokenType.COMMA)) {
      List<Expr> elts = new ArrayList<Expr>();
      elts.add(first);
      while (match(TokenType.COMMA)) {
        if (peekIs(TokenType.COLON)) {
          break;
        }
        Expr e = starNamedExpression();
        if (e == null) {
          return null;
        }
        elts.add(e);
      }
      return new Expr.Tuple(spanFrom(start), elts, ExprContext.LOAD);
    }
    if (first instanceof Expr.Starred) {
      return null;
    }
    return first;
  }

  private MatchCase caseBlock() throws InvalidSyntaxException {
    Token c = advance();
    Pattern pattern = patterns();
    if (pattern == null) {
      throw furthestError();
    }
    Expr guard = null;
    if (matchKeyword("if")) {
      guard = namedExpression();
      if (guard == null) {
        throw furthestError();
      }
    }
    expectColon();
    List<Stmt> body = block("'case' statement", c);
    return new MatchCase(pattern, guard, body);
  }

  /* Simple statements */

  private Stmt simpleStatement() throws InvalidSyntaxException {
    Token t = peek();
    if (t.type == TokenType.NAME) {
      String kw = t.text;
      if (kw.equals("pass")) {
        advance();
        return new Stmt.Pass(spanOf(t));
      } else if (kw.equals("break")) {
        advance();
        return new Stmt.Break(spanOf(t));
      } else if (kw.equals("continue")) {
        advance();
        return new Stmt.Continue(spanOf(t));
      } else if (kw.equals("return")) {
        advance();
        Expr value = starExpressions();
        return new Stmt.Return(spanFrom(t), value);
      } else if (kw.equals("raise")) {
        return raiseStatement();
      } else if (kw.equals("global") || kw.equals("nonlocal")) {
        return globalStatement();
      } else if (kw.equals("del")) {
        return delStatement();
      } else if (kw.equals("assert")) {
        return assertStatement();
      } else if (kw.equals("import")) {
        return importName();
      } else if (kw.equals("from")) {
        return importFrom();
      } else if (kw.equals("type") && peek(1).type == TokenType.NAME) {
        Stmt alias = typeAlias();
        if (alias != null) {
          return alias;
        }
      }
    }
    return assignmentOrExpression();
  }

  private Expr yieldOrStarExpressions() throws InvalidSyntaxException {
    if (peekKeyword("yield")) {
      return yieldExpr();
    }
    return starExpressions();
  }

  /**
   * Expression statement, or one of the three assignment forms
   * selected by the token after the first expression
   */
  private Stmt assignmentOrExpression() throws InvalidSyntaxException {
    Token start = peek();
    int m = mark();
    Expr first = yieldOrStarExpressions();
    if (first == null) {
      return null;
    }
    Token next = peek();
    if (next.type == TokenType.COLON) {
      return annotatedAssignment(start, first);
    }
    Operator augOp = augmentedOperator(next);
    if (augOp != null) {
      if (!(first instanceof Expr.Name || first instanceof Expr.Attribute ||
            first instanceof Expr.Subscript)) {
        throw error(first, "'" + first.describe() + "' is an illegal " +
                           "expression for augmented assignment");
      }
      advance();
      Expr value = yieldOrStarExpressions();
      if (value == null) {
        throw furthestError();
      }
      Expr target = Targets.withContext(first, ExprContext.STORE);
      return new Stmt.AugAssign(spanFrom(start), target, augOp, value);
    }
    if (next.type == TokenType.EQUAL) {
      reset(m);
      return assignment(start, first);
    }
    return new Stmt.ExprStmt(spanFrom(start), first);
  }

  private static Operator augmentedOperator(Token t) {
    if (!t.type.isOperator() || t.text.length() < 2 ||
        !t.text.endsWith("=")) {
      return null;
    }
    return Operator.fromSymbol(t.text);
  }

  private Stmt annotatedAssignment(Token start, Expr target)
                                        throws InvalidSyntaxException {
    if (target instanceof Expr.Tuple) {
      throw error(target, "only single target (not tuple) can be annotated");
    } else if (target instanceof Expr.List) {
      throw error(target, "only single target (not list) can be annotated");
    } else if (!(target instanceof Expr.Name ||
                 target instanceof Expr.Attribute ||
                 target instanceof Expr.Subscript)) {
      throw error(target, "illegal target for annotation");
    }
    advance();
    Expr annotation = expression();
    if (annotation == null) {
      throw furthestError();
    }
    Expr value = null;
    if (match(TokenType.EQUAL)) {
      value = yieldOrStarExpressions();
      if (value == null) {
        throw furthestError();
      }
    }
    boolean simple = target instanceof Expr.Name &&
                     start.type != TokenType.LPAR;
    return new Stmt.AnnAssign(spanFrom(start),
                  Targets.withContext(target, ExprContext.STORE),
                  annotation, value, simple);
  }

  /**
   * (star_targets '=')+ value, re-parsed through the target grammar
   * @param first the statement's leading expression, for error reports
   */
  private Stmt assignment(Token start, Expr first)
                                        throws InvalidSyntaxException {
    List<Expr> targets = new ArrayList<Expr>();
    while (true) {
      int before = mark();
      Expr target = starTargets();
      if (target != null && match(TokenType.EQUAL)) {
        targets.add(target);
        continue;
      }
      reset(before);
      break;
    }
    if (targets.isEmpty()) {
      throw invalidAssignment(first);
    }
    Expr value = yieldOrStarExpressions();
    if (value == null) {
      throw furthestError();
    }
    if (peekIs(TokenType.EQUAL)) {
      throw invalidAssignment(value);
    }
    return new Stmt.Assign(spanFrom(start), targets, value);
  }

  private InvalidSyntaxException invalidAssignment(Expr e) {
    Expr bad = Targets.findInvalid(e, Targets.TargetKind.STAR_TARGETS);
    if (bad == null) {
      bad = e;
    }
    return error(bad, "cannot assign to " + bad.describe());
  }

  private Stmt raiseStatement() throws InvalidSyntaxException {
    Token start = advance();
    Expr exc = expression();
    Expr cause = null;
    if (exc != null && matchKeyword("from")) {
      cause = expression();
      if (cause == null) {
        throw furthestError();
      }
    }
    return new Stmt.Raise(spanFrom(start), exc, cause);
  }

  private Stmt globalStatement() throws InvalidSyntaxException {
    Token start = advance();
    List<String> names = new ArrayList<String>();
    do {
      Token name = expectName();
      if (name == null) {
        throw furthestError();
      }
      names.add(name.text);
    } while (match(TokenType.COMMA));
    if (start.text.equals("global")) {
      return new Stmt.Global(spanFrom(start), names);
    }
    return new Stmt.Nonlocal(spanFrom(start), names);
  }

  private Stmt delStatement() throws InvalidSyntaxException {
    Token start = advance();
    int m = mark();
    List<Expr> targets = delTargets();
    if (targets != null &&
        (peekIs(TokenType.NEWLINE) || peekIs(TokenType.SEMI))) {
      return new Stmt.Delete(spanFrom(start), targets);
    }
    reset(m);
    Expr e = starExpressions();
    if (e != null) {
      Expr bad = Targets.findInvalid(e, Targets.TargetKind.DEL_TARGETS);
      if (bad != null) {
        throw error(bad, "cannot delete " + bad.describe());
      }
    }
    throw furthestError();
  }

  private Stmt assertStatement() throws InvalidSyntaxException {
    Token start = advance();
    Expr test = expression();
    if (test == null) {
      throw furthestError();
    }
    Expr msg = null;
    if (match(TokenType.COMMA)) {
      msg = expression();
      if (msg == null) {
        throw furthestError();
      }
    }
    return new Stmt.Assert(spanFrom(start), test, msg);
  }

  /**
   * Soft keyword 'type': returns null with the cursor restored if
   * this is not a type alias
   */
  private Stmt typeAlias() throws InvalidSyntaxException {
    int m = mark();
    Token start = advance();
    Token name = expectName();
    if (name == null || !(peekIs(TokenType.EQUAL) ||
                          peekIs(TokenType.LSQB))) {
      reset(m);
      return null;
    }
    List<TypeParam> typeParams = typeParams();
    if (!match(TokenType.EQUAL)) {
      reset(m);
      return null;
    }
    Expr value = expression();
    if (value == null) {
      throw furthestError();
    }
    Expr target = new Expr.Name(spanOf(name), name.text, ExprContext.STORE);
    return new Stmt.TypeAlias(spanFrom(start), target, typeParams, value);
  }

  private Stmt importName() throws InvalidSyntaxException {
    Token start = advance();
    List<Alias> names = new ArrayList<Alias>();
    do {
      Token first = peek();
      String dotted = dottedName();
      if (dotted == null) {
        throw furthestError();
      }
      String asname = asName();
      names.add(new Alias(spanFrom(first), dotted, asname));
    } while (match(TokenType.COMMA));
    return new Stmt.Import(spanFrom(start), names);
  }

  /**
   * Optional 'as' NAME
   */
  private String asName() throws InvalidSyntaxException {
    if (!matchKeyword("as")) {
      return null;
    }
    Token name = expectName();
    if (name == null) {
      throw furthestError();
    }
    return name.text;
  }

  /**
   * NAME ('.' NAME)*
   * @return the dotted name text, or null
   */
  private String dottedName() throws InvalidSyntaxException {
    Token first = expectName();
    if (first == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(first.text);
    while (match(TokenType.DOT)) {
      Token next = expectName();
      if (next == null) {
        throw furthestError();
      }
      sb.append('.').append(next.text);
    }
    return sb.toString();
  }

  private Stmt importFrom() throws InvalidSyntaxException {
    Token start = advance();
    int level = 0;
    while (peekIs(TokenType.DOT) || peekIs(TokenType.ELLIPSIS)) {
      level += peekIs(TokenType.DOT) ? 1 : 3;
      advance();
    }
    String module = null;
    if (!peekKeyword("import")) {
      module = dottedName();
      if (module == null) {
        throw furthestError();
      }
    }
    if (!matchKeyword("import")) {
      throw furthestError();
    }
    List<Alias> names;
    if (peekIs(TokenType.STAR)) {
      Token star = advance();
      names = Collections.singletonList(new Alias(spanOf(star), "*", null));
    } else if (match(TokenType.LPAR)) {
      names = importAsNames();
      match(TokenType.COMMA);
      if (!match(TokenType.RPAR)) {
        throw furthestError();
      }
    } else {
      names = importAsNames();
      if (peekIs(TokenType.COMMA)) {
        throw error(peek(), "trailing comma not allowed without " +
                            "surrounding parentheses");
      }
    }
    return new Stmt.ImportFrom(spanFrom(start), module, names, level);
  }

  /**
   * NAME ['as' NAME] (',' NAME ['as' NAME])*
   */
  private List<Alias> importAsNames() throws InvalidSyntaxException {
    List<Alias> names = new ArrayList<Alias>();
    while (true) {
      Token name = expectName();
      if (name == null) {
        throw furthestError();
      }
      String asname = asName();
      names.add(new Alias(spanFrom(name), name.text, asname));
      if (!(peekIs(TokenType.COMMA) && peek(1).type == TokenType.NAME)) {
        break;
      }
      advance();
    }
    return names;
  }
}
