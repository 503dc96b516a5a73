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
 * Keyword argument of a call or class definition.
 * A null arg marks {@code **mapping}.
 */
public class Keyword extends Node {
  public final String arg;
  public final Expr value;

  public Keyword(Span span, String arg, Expr value) {
    super(span);
    this.arg = arg;
    this.value = value;
  }

  public boolean hasArg() {
    return arg != null;
  }

  @Override
  public String nodeName() {
    return "keyword";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("arg", arg), Field.of("value", value));
  }
}
