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

import exm.pyparse.ast.Operators.BoolOperator;
import exm.pyparse.ast.Operators.CmpOperator;
import exm.pyparse.ast.Operators.ExprContext;
import exm.pyparse.ast.Operators.Operator;
import exm.pyparse.ast.Operators.UnaryOperator;

/**
 * Expression nodes.
 *
 * The node classes below shadow some java.util names (List, Set), so
 * collection types are written fully qualified in this file.
 */
public abstract class Expr extends Node {

  protected Expr(Span span) {
    super(span);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * @return description of this kind of expression for error messages,
   *         e.g. "function call"
   */
  public abstract String describe();

  public static interface Visitor<R> {
    R visit(BoolOp e);
    R visit(NamedExpr e);
    R visit(BinOp e);
    R visit(UnaryOp e);
    R visit(Lambda e);
    R visit(IfExp e);
    R visit(Dict e);
    R visit(Set e);
    R visit(ListComp e);
    R visit(SetComp e);
    R visit(DictComp e);
    R visit(GeneratorExp e);
    R visit(Await e);
    R visit(Yield e);
    R visit(YieldFrom e);
    R visit(Compare e);
    R visit(Call e);
    R visit(FormattedValue e);
    R visit(Interpolation e);
    R visit(JoinedStr e);
    R visit(TemplateStr e);
    R visit(Constant e);
    R visit(Attribute e);
    R visit(Subscript e);
    R visit(Starred e);
    R visit(Name e);
    R visit(List e);
    R visit(Tuple e);
    R visit(Slice e);
  }

  public static class BoolOp extends Expr {
    public final BoolOperator op;
    public final java.util.List<Expr> values;

    public BoolOp(Span span, BoolOperator op,
                  java.util.List<? extends Expr> values) {
      super(span);
      this.op = op;
      this.values = freeze(values);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("op", op), Field.of("values", values));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "expression";
    }
  }

  public static class NamedExpr extends Expr {
    public final Expr target;
    public final Expr value;

    public NamedExpr(Span span, Expr target, Expr value) {
      super(span);
      this.target = target;
      this.value = value;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("target", target), Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "named expression";
    }
  }

  public static class BinOp extends Expr {
    public final Expr left;
    public final Operator op;
    public final Expr right;

    public BinOp(Span span, Expr left, Operator op, Expr right) {
      super(span);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("left", left), Field.of("op", op),
                       Field.of("right", right));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "expression";
    }
  }

  public static class UnaryOp extends Expr {
    public final UnaryOperator op;
    public final Expr operand;

    public UnaryOp(Span span, UnaryOperator op, Expr operand) {
      super(span);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("op", op), Field.of("operand", operand));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "expression";
    }
  }

  public static class Lambda extends Expr {
    public final Arguments args;
    public final Expr body;

    public Lambda(Span span, Arguments args, Expr body) {
      super(span);
      this.args = args;
      this.body = body;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("args", args), Field.of("body", body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "lambda";
    }
  }

  public static class IfExp extends Expr {
    public final Expr test;
    public final Expr body;
    public final Expr orelse;

    public IfExp(Span span, Expr test, Expr body, Expr orelse) {
      super(span);
      this.test = test;
      this.body = body;
      this.orelse = orelse;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("test", test), Field.of("body", body),
                       Field.of("orelse", orelse));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "conditional expression";
    }
  }

  /**
   * Dict display.  A null key marks a {@code **mapping} entry.
   */
  public static class Dict extends Expr {
    public final java.util.List<Expr> keys;
    public final java.util.List<Expr> values;

    public Dict(Span span, java.util.List<? extends Expr> keys,
                java.util.List<? extends Expr> values) {
      super(span);
      assert(keys.size() == values.size());
      this.keys = freeze(keys);
      this.values = freeze(values);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("keys", keys), Field.of("values", values));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "dict literal";
    }
  }

  public static class Set extends Expr {
    public final java.util.List<Expr> elts;

    public Set(Span span, java.util.List<? extends Expr> elts) {
      super(span);
      this.elts = freeze(elts);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elts", elts));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "set display";
    }
  }

  public static class ListComp extends Expr {
    public final Expr elt;
    public final java.util.List<Comprehension> generators;

    public ListComp(Span span, Expr elt,
                    java.util.List<Comprehension> generators) {
      super(span);
      this.elt = elt;
      this.generators = freeze(generators);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elt", elt),
                       Field.of("generators", generators));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "list comprehension";
    }
  }

  public static class SetComp extends Expr {
    public final Expr elt;
    public final java.util.List<Comprehension> generators;

    public SetComp(Span span, Expr elt,
                   java.util.List<Comprehension> generators) {
      super(span);
      this.elt = elt;
      this.generators = freeze(generators);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elt", elt),
                       Field.of("generators", generators));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "set comprehension";
    }
  }

  public static class DictComp extends Expr {
    public final Expr key;
    public final Expr value;
    public final java.util.List<Comprehension> generators;

    public DictComp(Span span, Expr key, Expr value,
                    java.util.List<Comprehension> generators) {
      super(span);
      this.key = key;
      this.value = value;
      this.generators = freeze(generators);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("key", key), Field.of("value", value),
                       Field.of("generators", generators));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "dict comprehension";
    }
  }

  public static class GeneratorExp extends Expr {
    public final Expr elt;
    public final java.util.List<Comprehension> generators;

    public GeneratorExp(Span span, Expr elt,
                        java.util.List<Comprehension> generators) {
      super(span);
      this.elt = elt;
      this.generators = freeze(generators);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elt", elt),
                       Field.of("generators", generators));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "generator expression";
    }
  }

  public static class Await extends Expr {
    public final Expr value;

    public Await(Span span, Expr value) {
      super(span);
      this.value = value;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "await expression";
    }
  }

  public static class Yield extends Expr {
    /** Yielded value, or null for a bare yield */
    public final Expr value;

    public Yield(Span span, Expr value) {
      super(span);
      this.value = value;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "yield expression";
    }
  }

  public static class YieldFrom extends Expr {
    public final Expr value;

    public YieldFrom(Span span, Expr value) {
      super(span);
      this.value = value;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "yield expression";
    }
  }

  /**
   * Comparison chain: {@code left ops[0] comparators[0] ops[1] ...}
   */
  public static class Compare extends Expr {
    public final Expr left;
    public final java.util.List<CmpOperator> ops;
    public final java.util.List<Expr> comparators;

    public Compare(Span span, Expr left, java.util.List<CmpOperator> ops,
                   java.util.List<? extends Expr> comparators) {
      super(span);
      assert(ops.size() == comparators.size());
      assert(!ops.isEmpty());
      this.left = left;
      this.ops = freeze(ops);
      this.comparators = freeze(comparators);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("left", left), Field.of("ops", ops),
                       Field.of("comparators", comparators));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "comparison";
    }
  }

  public static class Call extends Expr {
    public final Expr func;
    public final java.util.List<Expr> args;
    public final java.util.List<Keyword> keywords;

    public Call(Span span, Expr func, java.util.List<? extends Expr> args,
                java.util.List<Keyword> keywords) {
      super(span);
      this.func = func;
      this.args = freeze(args);
      this.keywords = freeze(keywords);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("func", func), Field.of("args", args),
                       Field.of("keywords", keywords));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "function call";
    }
  }

  /** No conversion in a replacement field */
  public static final int CONVERSION_NONE = -1;

  /**
   * Replacement field of an f-string.  conversion is -1 or the
   * character code of 's', 'r' or 'a'.
   */
  public static class FormattedValue extends Expr {
    public final Expr value;
    public final int conversion;
    /** JoinedStr, or null */
    public final Expr formatSpec;

    public FormattedValue(Span span, Expr value, int conversion,
                          Expr formatSpec) {
      super(span);
      this.value = value;
      this.conversion = conversion;
      this.formatSpec = formatSpec;
    }

    public boolean hasFormatSpec() {
      return formatSpec != null;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value),
                       Field.of("conversion", conversion),
                       Field.of("format_spec", formatSpec));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "f-string expression";
    }
  }

  /**
   * Replacement field of a t-string.  str holds the expression's
   * source text.
   */
  public static class Interpolation extends Expr {
    public final Expr value;
    public final String str;
    public final int conversion;
    public final Expr formatSpec;

    public Interpolation(Span span, Expr value, String str, int conversion,
                         Expr formatSpec) {
      super(span);
      this.value = value;
      this.str = str;
      this.conversion = conversion;
      this.formatSpec = formatSpec;
    }

    public boolean hasFormatSpec() {
      return formatSpec != null;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value), Field.of("str", str),
                       Field.of("conversion", conversion),
                       Field.of("format_spec", formatSpec));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "t-string expression";
    }
  }

  public static class JoinedStr extends Expr {
    public final java.util.List<Expr> values;

    public JoinedStr(Span span, java.util.List<? extends Expr> values) {
      super(span);
      this.values = freeze(values);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("values", values));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "f-string expression";
    }
  }

  public static class TemplateStr extends Expr {
    public final java.util.List<Expr> values;

    public TemplateStr(Span span, java.util.List<? extends Expr> values) {
      super(span);
      this.values = freeze(values);
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("values", values));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "t-string expression";
    }
  }

  /**
   * Literal value: {@link PyConstant}, Boolean, BigInteger, Double,
   * {@link Imaginary}, String or {@link PyBytes}.
   */
  public static class Constant extends Expr {
    public final Object value;
    /** "u" for u-prefixed strings, otherwise null */
    public final String kind;

    public Constant(Span span, Object value, String kind) {
      super(span);
      assert(value != null);
      this.value = value;
      this.kind = kind;
    }

    public Constant(Span span, Object value) {
      this(span, value, null);
    }

    public boolean hasKind() {
      return kind != null;
    }

    public boolean isString() {
      return value instanceof String;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value), Field.of("kind", kind));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      if (value == PyConstant.NONE) {
        return "None";
      } else if (value == PyConstant.ELLIPSIS) {
        return "ellipsis";
      } else if (Boolean.TRUE.equals(value)) {
        return "True";
      } else if (Boolean.FALSE.equals(value)) {
        return "False";
      }
      return "literal";
    }
  }

  public static class Attribute extends Expr {
    public final Expr value;
    public final String attr;
    public final ExprContext ctx;

    public Attribute(Span span, Expr value, String attr, ExprContext ctx) {
      super(span);
      this.value = value;
      this.attr = attr;
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value), Field.of("attr", attr),
                       Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "attribute";
    }
  }

  public static class Subscript extends Expr {
    public final Expr value;
    public final Expr slice;
    public final ExprContext ctx;

    public Subscript(Span span, Expr value, Expr slice, ExprContext ctx) {
      super(span);
      this.value = value;
      this.slice = slice;
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value), Field.of("slice", slice),
                       Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "subscript";
    }
  }

  public static class Starred extends Expr {
    public final Expr value;
    public final ExprContext ctx;

    public Starred(Span span, Expr value, ExprContext ctx) {
      super(span);
      this.value = value;
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("value", value), Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "starred";
    }
  }

  public static class Name extends Expr {
    public final String id;
    public final ExprContext ctx;

    public Name(Span span, String id, ExprContext ctx) {
      super(span);
      this.id = id;
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("id", id), Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "name";
    }
  }

  public static class List extends Expr {
    public final java.util.List<Expr> elts;
    public final ExprContext ctx;

    public List(Span span, java.util.List<? extends Expr> elts,
                ExprContext ctx) {
      super(span);
      this.elts = freeze(elts);
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elts", elts), Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "list";
    }
  }

  public static class Tuple extends Expr {
    public final java.util.List<Expr> elts;
    public final ExprContext ctx;

    public Tuple(Span span, java.util.List<? extends Expr> elts,
                 ExprContext ctx) {
      super(span);
      this.elts = freeze(elts);
      this.ctx = ctx;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("elts", elts), Field.of("ctx", ctx));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "tuple";
    }
  }

  public static class Slice extends Expr {
    public final Expr lower;
    public final Expr upper;
    public final Expr step;

    public Slice(Span span, Expr lower, Expr upper, Expr step) {
      super(span);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    public boolean hasLower() {
      return lower != null;
    }

    public boolean hasUpper() {
      return upper != null;
    }

    public boolean hasStep() {
      return step != null;
    }

    @Override
    public java.util.List<Field> fields() {
      return fieldList(Field.of("lower", lower), Field.of("upper", upper),
                       Field.of("step", step));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String describe() {
      return "slice";
    }
  }
}
