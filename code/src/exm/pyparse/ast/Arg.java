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
 * Single parameter with optional annotation
 */
public class Arg extends Node {
  public final String arg;
  public final Expr annotation;

  public Arg(Span span, String arg, Expr annotation) {
    super(span);
    this.arg = arg;
    this.annotation = annotation;
  }

  public boolean hasAnnotation() {
    return annotation != null;
  }

  @Override
  public String nodeName() {
    return "arg";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("arg", arg), Field.of("annotation", annotation));
  }
}
