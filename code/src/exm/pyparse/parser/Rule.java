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

/**
 * Grammar rules that are memoized or used in lookaheads.  The parser
 * maps each constant to its rule method in invoke().
 */
public enum Rule {
  EXPRESSION(true),
  STAR_EXPRESSIONS(true),
  STAR_NAMED_EXPRESSION(true),
  DISJUNCTION(true),
  CONJUNCTION(true),
  INVERSION(true),
  BITWISE_OR(true),
  AWAIT_PRIMARY(true),
  STRINGS(true),
  T_PRIMARY(true),
  STAR_TARGET(true),
  BLOCK(true),

  /** Token that continues a target primary: '(', '[' or '.' */
  T_LOOKAHEAD(false),
  /** Start of a parenthesized with-item list */
  WITH_ITEMS_PAREN(false),
  /** Continuation that makes a name a value or class pattern */
  NAME_PATTERN_FOLLOW(false);

  public final boolean memoized;

  private Rule(boolean memoized) {
    this.memoized = memoized;
  }
}
