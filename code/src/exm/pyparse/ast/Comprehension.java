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
 * One {@code for ... in ... if ...} clause of a comprehension
 */
public class Comprehension extends Node {
  public final Expr target;
  public final Expr iter;
  public final List<Expr> ifs;
  public final boolean isAsync;

  public Comprehension(Expr target, Expr iter, List<Expr> ifs,
                       boolean isAsync) {
    super(null);
    this.target = target;
    this.iter = iter;
    this.ifs = freeze(ifs);
    this.isAsync = isAsync;
  }

  @Override
  public String nodeName() {
    return "comprehension";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("target", target), Field.of("iter", iter),
                     Field.of("ifs", ifs),
                     Field.of("is_async", isAsync ? 1 : 0));
  }
}
