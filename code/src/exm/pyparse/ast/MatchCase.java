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

public class MatchCase extends Node {
  public final Pattern pattern;
  public final Expr guard;
  public final List<Stmt> body;

  public MatchCase(Pattern pattern, Expr guard, List<Stmt> body) {
    super(null);
    this.pattern = pattern;
    this.guard = guard;
    this.body = freeze(body);
  }

  public boolean hasGuard() {
    return guard != null;
  }

  @Override
  public String nodeName() {
    return "match_case";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("pattern", pattern), Field.of("guard", guard),
                     Field.of("body", body));
  }
}
