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
 * Parameter list of a function or lambda.  kwDefaults is parallel to
 * kwonlyargs, with null where a keyword-only parameter has no default.
 * defaults belong to the last positional parameters.
 */
public class Arguments extends Node {
  public final List<Arg> posonlyargs;
  public final List<Arg> args;
  public final Arg vararg;
  public final List<Arg> kwonlyargs;
  public final List<Expr> kwDefaults;
  public final Arg kwarg;
  public final List<Expr> defaults;

  public Arguments(List<Arg> posonlyargs, List<Arg> args, Arg vararg,
                   List<Arg> kwonlyargs, List<Expr> kwDefaults, Arg kwarg,
                   List<Expr> defaults) {
    super(null);
    assert(kwonlyargs.size() == kwDefaults.size());
    this.posonlyargs = freeze(posonlyargs);
    this.args = freeze(args);
    this.vararg = vararg;
    this.kwonlyargs = freeze(kwonlyargs);
    this.kwDefaults = freeze(kwDefaults);
    this.kwarg = kwarg;
    this.defaults = freeze(defaults);
  }

  public static Arguments empty() {
    List<Arg> noArgs = Collections.emptyList();
    List<Expr> noExprs = Collections.emptyList();
    return new Arguments(noArgs, noArgs, null, noArgs, noExprs, null,
                         noExprs);
  }

  public boolean hasVararg() {
    return vararg != null;
  }

  public boolean hasKwarg() {
    return kwarg != null;
  }

  @Override
  public String nodeName() {
    return "arguments";
  }

  @Override
  public List<Field> fields() {
    return fieldList(Field.of("posonlyargs", posonlyargs),
                     Field.of("args", args),
                     Field.of("vararg", vararg),
                     Field.of("kwonlyargs", kwonlyargs),
                     Field.of("kw_defaults", kwDefaults),
                     Field.of("kwarg", kwarg),
                     Field.of("defaults", defaults));
  }
}
