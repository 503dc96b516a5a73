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

/**
 * Generic type parameter of a function, class or type alias
 */
public abstract class TypeParam extends Node {
  public final String name;
  /** Default after '=', or null */
  public final Expr defaultValue;

  protected TypeParam(Span span, String name, Expr defaultValue) {
    super(span);
    this.name = name;
    this.defaultValue = defaultValue;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  /**
   * Plain type variable {@code T} or {@code T: bound}
   */
  public static class TypeVar extends TypeParam {
    public final Expr bound;

    public TypeVar(Span span, String name, Expr bound, Expr defaultValue) {
      super(span, name, defaultValue);
      this.bound = bound;
    }

    public boolean hasBound() {
      return bound != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name), Field.of("bound", bound),
                       Field.of("default_value", defaultValue));
    }
  }

  /** {@code **P} */
  public static class ParamSpec extends TypeParam {
    public ParamSpec(Span span, String name, Expr defaultValue) {
      super(span, name, defaultValue);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name),
                       Field.of("default_value", defaultValue));
    }
  }

  /** {@code *Ts} */
  public static class TypeVarTuple extends TypeParam {
    public TypeVarTuple(Span span, String name, Expr defaultValue) {
      super(span, name, defaultValue);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name),
                       Field.of("default_value", defaultValue));
    }
  }
}
