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

public class Alias extends Node {
  /** Dotted module or imported name, or "*" */
  public final String name;
  public final String asname;

  public Alias(Span span, String name, String asname) {
    super(span);
    this.name = name;
    this.asname = asname;
  }

  public boolean hasAsname() {
    return asname != null;
  }

  @Override
  public String nodeName() {
    return "alias";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("name", name), Field.of("asname", asname));
  }
}
