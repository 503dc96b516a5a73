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

import java.util.Collections;
import java.util.List;

/**
 * Root of a parsed source file
 */
public class Module extends Node {
  public final List<Stmt> body;

  public Module(List<Stmt> body) {
    super(null);
    this.body = freeze(body);
  }

  @Override
  public List<Field> fields() {
    List<Object> typeIgnores = Collections.emptyList();
    return fieldList(Field.of("body", body),
                     Field.of("type_ignores", typeIgnores));
  }
}
