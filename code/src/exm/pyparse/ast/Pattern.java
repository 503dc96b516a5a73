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
 * Patterns of match statement cases
 */
public abstract class Pattern extends Node {

  protected Pattern(Span span) {
    super(span);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static interface Visitor<R> {
    R visit(MatchValue p);
    R visit(MatchSingleton p);
    R visit(MatchSequence p);
    R visit(MatchMapping p);
    R visit(MatchClass p);
    R visit(MatchStar p);
    R visit(MatchAs p);
    R visit(MatchOr p);
  }

  /** Literal or dotted name compared by equality */
  public static class MatchValue extends Pattern {
    public final Expr value;

    public MatchValue(Span span, Expr value) {
      super(span);
      this.value = value;
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

  /** None, True or False, compared by identity */
  public static class MatchSingleton extends Pattern {
    public final Object value;

    public MatchSingleton(Span span, Object value) {
      super(span);
      this.value = value;
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

  public static class MatchSequence extends Pattern {
    public final List<Pattern> patterns;

    public MatchSequence(Span span, List<Pattern> patterns) {
      super(span);
      this.patterns = freeze(patterns);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("patterns", patterns));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class MatchMapping extends Pattern {
    public final List<Expr> keys;
    public final List<Pattern> patterns;
    /** Name bound by {@code **rest}, or null */
    public final String rest;

    public MatchMapping(Span span, List<Expr> keys, List<Pattern> patterns,
                        String rest) {
      super(span);
      assert(keys.size() == patterns.size());
      this.keys = freeze(keys);
      this.patterns = freeze(patterns);
      this.rest = rest;
    }

    public boolean hasRest() {
      return rest != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("keys", keys), Field.of("patterns", patterns),
                       Field.of("rest", rest));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class MatchClass extends Pattern {
    public final Expr cls;
    public final List<Pattern> patterns;
    public final List<String> kwdAttrs;
    public final List<Pattern> kwdPatterns;

    public MatchClass(Span span, Expr cls, List<Pattern> patterns,
                      List<String> kwdAttrs, List<Pattern> kwdPatterns) {
      super(span);
      assert(kwdAttrs.size() == kwdPatterns.size());
      this.cls = cls;
      this.patterns = freeze(patterns);
      this.kwdAttrs = freeze(kwdAttrs);
      this.kwdPatterns = freeze(kwdPatterns);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("cls", cls), Field.of("patterns", patterns),
                       Field.of("kwd_attrs", kwdAttrs),
                       Field.of("kwd_patterns", kwdPatterns));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code *name} or {@code *_} inside a sequence pattern */
  public static class MatchStar extends Pattern {
    public final String name;

    public MatchStar(Span span, String name) {
      super(span);
      this.name = name;
    }

    public boolean hasName() {
      return name != null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("name", name));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Capture: {@code pattern as name}, a bare name (no pattern),
   * or the wildcard {@code _} (neither)
   */
  public static class MatchAs extends Pattern {
    public final Pattern pattern;
    public final String name;

    public MatchAs(Span span, Pattern pattern, String name) {
      super(span);
      this.pattern = pattern;
      this.name = name;
    }

    public boolean isWildcard() {
      return pattern == null && name == null;
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("pattern", pattern), Field.of("name", name));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  public static class MatchOr extends Pattern {
    public final List<Pattern> patterns;

    public MatchOr(Span span, List<Pattern> patterns) {
      super(span);
      this.patterns = freeze(patterns);
    }

    @Override
    public List<Field> fields() {
      return fieldList(Field.of("patterns", patterns));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
