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

import java.util.List;

import exm.pyparse.ast.Operators.Operator;

/**
 * Statement nodes.  The async forms of def, for and with, and the
 * except* form of try, share a class with their plain form and are
 * told apart by a flag.
 */
public abstract class Stmt extends Node {

  protected Stmt(Span span) {
    super(span);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static interface Visitor<R> {
    R visit(FunctionDef s);
    R visit(ClassDef s);
    R visit(Return s);
    R visit(Delete s);
    R visit(Assign s);
    R visit(TypeAlias s);
    R visit(AugAssign s);
    R visit(AnnAssign s);
    R visit(For s);
    R visit(While s);
    R visit(If s);
    R visit(With s);
    R visit(Match s);
    R visit(Raise s);
    R visit(Try s);
    R visit(Assert s);
    R visit(Import s);
    R visit(ImportFrom s);
    R visit(Global s);
    R visit(Nonlocal s);
    R visit(ExprStmt s);
    R visit(Pass s);
    R visit(Break s);
    R visit(Continue s);
  }

  public static class FunctionDef extends Stmt {
    public final String name;
    public final Arguments args;
    public final List<Stmt> body;
    public final List<Expr> decoratorList;
    public final Expr returns;
    public final List<TypeParam> typeParams;
    public final boolean isAsync;

    public FunctionDef(Span span, String name, Arguments args,
                       List<Stmt> body, List<Expr> decoratorList,
                       Expr returns, List<TypeParam> typeParams,
                       boolean isAsync) {
      super(span);
      this.name = name;
      this.args = args;
      this.body = freeze(body);
      this.decoratorList = freeze(decoratorList);
      this.returns = returns;
      this.typeParams = freeze(typeParams);
      this.isAsync = isAsync;
    }

    public boolean hasReturns() {
      return returns != null;
    }

    @Override
    public String nodeName() {
      return isAsync ? "AsyncFunctionDef" : "FunctionDef";
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name), Field.of("args", args),
                       Field.of("body", body),
                       Field.of("decorator_list", decoratorList),
                       Field.of("returns", returns),
                       Field.of("type_params", typeParams));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class ClassDef extends Stmt {
    public final String name;
    public final List<Expr> bases;
    public final List<Keyword> keywords;
    public final List<Stmt> body;
    public final List<Expr> decoratorList;
    public final List<TypeParam> typeParams;

    public ClassDef(Span span, String name, List<Expr> bases,
                    List<Keyword> keywords, List<Stmt> body,
                    List<Expr> decoratorList, List<TypeParam> typeParams) {
      super(span);
      this.name = name;
      this.bases = freeze(bases);
      this.keywords = freeze(keywords);
      this.body = freeze(body);
      this.decoratorList = freeze(decoratorList);
      this.typeParams = freeze(typeParams);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name), Field.of("bases", bases),
                       Field.of("keywords", keywords),
                       Field.of("body", body),
                       Field.of("decorator_list", decoratorList),
                       Field.of("type_params", typeParams));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Return extends Stmt {
    public final Expr value;

    public Return(Span span, Expr value) {
      super(span);
      this.value = value;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Delete extends Stmt {
    public final List<Expr> targets;

    public Delete(Span span, List<Expr> targets) {
      super(span);
      this.targets = freeze(targets);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("targets", targets));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * {@code t1 = t2 = value}: one entry in targets per '='
   */
  public static class Assign extends Stmt {
    public final List<Expr> targets;
    public final Expr value;

    public Assign(Span span, List<Expr> targets, Expr value) {
      super(span);
      this.targets = freeze(targets);
      this.value = value;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("targets", targets), Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class TypeAlias extends Stmt {
    public final Expr name;
    public final List<TypeParam> typeParams;
    public final Expr value;

    public TypeAlias(Span span, Expr name, List<TypeParam> typeParams,
                     Expr value) {
      super(span);
      this.name = name;
      this.typeParams = freeze(typeParams);
      this.value = value;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name),
                       Field.of("type_params", typeParams),
                       Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class AugAssign extends Stmt {
    public final Expr target;
    public final Operator op;
    public final Expr value;

    public AugAssign(Span span, Expr target, Operator op, Expr value) {
      super(span);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("target", target), Field.of("op", op),
                       Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Annotated assignment.  simple is true for a target that is a
   * plain name without parentheses.
   */
  public static class AnnAssign extends Stmt {
    public final Expr target;
    public final Expr annotation;
    public final Expr value;
    public final boolean simple;

    public AnnAssign(Span span, Expr target, Expr annotation, Expr value,
                     boolean simple) {
      super(span);
      this.target = target;
      this.annotation = annotation;
      this.value = value;
      this.simple = simple;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("target", target),
                       Field.of("annotation", annotation),
                       Field.of("value", value),
                       Field.of("simple", simple ? 1 : 0));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class For extends Stmt {
    public final Expr target;
    public final Expr iter;
    public final List<Stmt> body;
    public final List<Stmt> orelse;
    public final boolean isAsync;

    public For(Span span, Expr target, Expr iter, List<Stmt> body,
               List<Stmt> orelse, boolean isAsync) {
      super(span);
      this.target = target;
      this.iter = iter;
      this.body = freeze(body);
      this.orelse = freeze(orelse);
      this.isAsync = isAsync;
    }

    @Override
    public String nodeName() {
      return isAsync ? "AsyncFor" : "For";
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("target", target), Field.of("iter", iter),
                       Field.of("body", body), Field.of("orelse", orelse));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class While extends Stmt {
    public final Expr test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    public While(Span span, Expr test, List<Stmt> body, List<Stmt> orelse) {
      super(span);
      this.test = test;
      this.body = freeze(body);
      this.orelse = freeze(orelse);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("test", test), Field.of("body", body),
                       Field.of("orelse", orelse));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * An elif chain is nested: orelse holds a single If.
   */
  public static class If extends Stmt {
    public final Expr test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    public If(Span span, Expr test, List<Stmt> body, List<Stmt> orelse) {
      super(span);
      this.test = test;
      this.body = freeze(body);
      this.orelse = freeze(orelse);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("test", test), Field.of("body", body),
                       Field.of("orelse", orelse));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class With extends Stmt {
    public final List<WithItem> items;
    public final List<Stmt> body;
    public final boolean isAsync;

    public With(Span span, List<WithItem> items, List<Stmt> body,
                boolean isAsync) {
      super(span);
      this.items = freeze(items);
      this.body = freeze(body);
      this.isAsync = isAsync;
    }

    @Override
    public String nodeName() {
      return isAsync ? "AsyncWith" : "With";
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("items", items), Field.of("body", body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Match extends Stmt {
    public final Expr subject;
    public final List<MatchCase> cases;

    public Match(Span span, Expr subject, List<MatchCase> cases) {
      super(span);
      this.subject = subject;
      this.cases = freeze(cases);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("subject", subject),
                       Field.of("cases", cases));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Raise extends Stmt {
    public final Expr exc;
    public final Expr cause;

    public Raise(Span span, Expr exc, Expr cause) {
      super(span);
      this.exc = exc;
      this.cause = cause;
    }

    public boolean hasExc() {
      return exc != null;
    }

    public boolean hasCause() {
      return cause != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("exc", exc), Field.of("cause", cause));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * try statement; isStar for except* handlers
   */
  public static class Try extends Stmt {
    public final List<Stmt> body;
    public final List<ExceptHandler> handlers;
    public final List<Stmt> orelse;
    public final List<Stmt> finalbody;
    public final boolean isStar;

    public Try(Span span, List<Stmt> body, List<ExceptHandler> handlers,
               List<Stmt> orelse, List<Stmt> finalbody, boolean isStar) {
      super(span);
      this.body = freeze(body);
      this.handlers = freeze(handlers);
      this.orelse = freeze(orelse);
      this.finalbody = freeze(finalbody);
      this.isStar = isStar;
    }

    @Override
    public String nodeName() {
      return isStar ? "TryStar" : "Try";
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("body", body),
                       Field.of("handlers", handlers),
                       Field.of("orelse", orelse),
                       Field.of("finalbody", finalbody));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Assert extends Stmt {
    public final Expr test;
    public final Expr msg;

    public Assert(Span span, Expr test, Expr msg) {
      super(span);
      this.test = test;
      this.msg = msg;
    }

    public boolean hasMsg() {
      return msg != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("test", test), Field.of("msg", msg));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Import extends Stmt {
    public final List<Alias> names;

    public Import(Span span, List<Alias> names) {
      super(span);
      this.names = freeze(names);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("names", names));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * {@code from ..module import names}: level counts the leading dots,
   * module is null if only dots were given
   */
  public static class ImportFrom extends Stmt {
    public final String module;
    public final List<Alias> names;
    public final int level;

    public ImportFrom(Span span, String module, List<Alias> names,
                      int level) {
      super(span);
      this.module = module;
      this.names = freeze(names);
      this.level = level;
    }

    public boolean hasModule() {
      return module != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("module", module), Field.of("names", names),
                       Field.of("level", level));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Global extends Stmt {
    public final List<String> names;

    public Global(Span span, List<String> names) {
      super(span);
      this.names = freeze(names);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("names", names));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Nonlocal extends Stmt {
    public final List<String> names;

    public Nonlocal(Span span, List<String> names) {
      super(span);
      this.names = freeze(names);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("names", names));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Expression evaluated as a statement.  Printed as "Expr".
   */
  public static class ExprStmt extends Stmt {
    public final Expr value;

    public ExprStmt(Span span, Expr value) {
      super(span);
      this.value = value;
    }

    @Override
    public String nodeName() {
      return "Expr";
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Pass extends Stmt {
    public Pass(Span span) {
      super(span);
    }

    @Override
    public List<Field> fields() {
      return fieldList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Break extends Stmt {
    public Break(Span span) {
      super(span);
    }

    @Override
    public List<Field> fields() {
      return fieldList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Continue extends Stmt {
    public Continue(Span span) {
      super(span);
    }

    @Override
    public List<Field> fields() {
      return fieldList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
