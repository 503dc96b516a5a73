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

public class ExceptHandler extends Node {
  /** Exception type expression, or null for a bare except */
  public final Expr type;
  public final String name;
  public final List<Stmt> body;

  public ExceptHandler(Span span, Expr type, String name, List<Stmt> body) {
    super(span);
    this.type = type;
    this.name = name;
    this.body = freeze(body);
  }

  public boolean hasType() {
    return type != null;
  }

  public boolean hasName() {
    return name != null;
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("type", type), Field.of("name", name),
                     Field.of("body", body));
  }
}
