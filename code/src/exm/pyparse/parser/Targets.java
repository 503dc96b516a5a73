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
import exm.pyparse.ast.Operators.CmpOperator;
import exm.pyparse.ast.Operators.ExprContext;

/**
 * Checks and conversions for expressions used as assignment or
 * deletion targets.
 */
public class Targets {

  public static enum TargetKind {
    STAR_TARGETS,
    DEL_TARGETS,
    FOR_TARGETS,
  }

  /**
   * Copy a target expression with a new context
   * @return the copy, or null if e cannot be a target
   */
  public static Expr withContext(Expr e, ExprContext ctx) {
    return e.accept(new ContextSetter(ctx));
  }

  /**
   * Find the innermost part of e that makes it invalid as a target
   * @return offending sub-expression, or null if e is a valid target
   */
  public static Expr findInvalid(Expr e, TargetKind kind) {
    if (e instanceof Expr.Tuple || e instanceof Expr.List) {
      List<Expr> elts = (e instanceof Expr.Tuple) ? ((Expr.Tuple) e).elts
                                                  : ((Expr.List) e).elts;
      for (Expr elt: elts) {
        Expr bad = findInvalid(elt, kind);
        if (bad != null) {
          return bad;
        }
      }
      return null;
    } else if (e instanceof Expr.Starred) {
      if (kind == TargetKind.DEL_TARGETS) {
        return e;
      }
      return findInvalid(((Expr.Starred) e).value, kind);
    } else if (e instanceof Expr.Compare) {
      // "for x in y" read as one comparison
      Expr.Compare cmp = (Expr.Compare) e;
      if (kind == TargetKind.FOR_TARGETS &&
          cmp.ops.get(0) == CmpOperator.IN) {
        return findInvalid(cmp.left, kind);
      }
      return e;
    } else if (e instanceof Expr.Name || e instanceof Expr.Attribute ||
               e instanceof Expr.Subscript) {
      return null;
    }
    return e;
  }

  private static class ContextSetter implements Expr.Visitor<Expr> {
    private final ExprContext ctx;

    ContextSetter(ExprContext ctx) {
      this.ctx = ctx;
    }

    private List<Expr> all(List<Expr> elts) {
      List<Expr> result = new ArrayList<Expr>(elts.size());
      for (Expr elt: elts) {
        Expr converted = elt.accept(this);
        if (converted == null) {
          return null;
        }
        result.add(converted);
      }
      return result;
    }

    @Override
    public Expr visit(Expr.Name e) {
      return new Expr.Name(e.getSpan(), e.id, ctx);
    }

    @Override
    public Expr visit(Expr.Attribute e) {
      return new Expr.Attribute(e.getSpan(), e.value, e.attr, ctx);
    }

    @Override
    public Expr visit(Expr.Subscript e) {
      return new Expr.Subscript(e.getSpan(), e.value, e.slice, ctx);
    }

    @Override
    public Expr visit(Expr.Starred e) {
      Expr value = e.value.accept(this);
      if (value == null) {
        return null;
      }
      return new Expr.Starred(e.getSpan(), value, ctx);
    }

    @Override
    public Expr visit(Expr.List e) {
      List<Expr> elts = all(e.elts);
      return elts == null ? null : new Expr.List(e.getSpan(), elts, ctx);
    }

    @Override
    public Expr visit(Expr.Tuple e) {
      List<Expr> elts = all(e.elts);
      return elts == null ? null : new Expr.Tuple(e.getSpan(), elts, ctx);
    }

    @Override
    public Expr visit(Expr.BoolOp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.NamedExpr e) {
      return null;
    }

    @Override
    public Expr visit(Expr.BinOp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.UnaryOp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Lambda e) {
      return null;
    }

    @Override
    public Expr visit(Expr.IfExp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Dict e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Set e) {
      return null;
    }

    @Override
    public Expr visit(Expr.ListComp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.SetComp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.DictComp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.GeneratorExp e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Await e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Yield e) {
      return null;
    }

    @Override
    public Expr visit(Expr.YieldFrom e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Compare e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Call e) {
      return null;
    }

    @Override
    public Expr visit(Expr.FormattedValue e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Interpolation e) {
      return null;
    }

    @Override
    public Expr visit(Expr.JoinedStr e) {
      return null;
    }

    @Override
    public Expr visit(Expr.TemplateStr e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Constant e) {
      return null;
    }

    @Override
    public Expr visit(Expr.Slice e) {
      return null;
    }
  }
}
