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

/**
 * Operator and context enumerations.  Each constant knows the
 * node name it is printed as.
 */
public class Operators {

  public static interface PyEnum {
    String pyName();
  }

  public static enum ExprContext implements PyEnum {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del");

    private final String pyName;

    private ExprContext(String pyName) {
      this.pyName = pyName;
    }

    @Override
    public String pyName() {
      return pyName;
    }
  }

  public static enum BoolOperator implements PyEnum {
    AND("And", "and"),
    OR("Or", "or");

    private final String pyName;
    public final String symbol;

    private BoolOperator(String pyName, String symbol) {
      this.pyName = pyName;
      this.symbol = symbol;
    }

    @Override
    public String pyName() {
      return pyName;
    }
  }

  public static enum Operator implements PyEnum {
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MULT("Mult", "*"),
    MATMULT("MatMult", "@"),
    DIV("Div", "/"),
    MOD("Mod", "%"),
    POW("Pow", "**"),
    LSHIFT("LShift", "<<"),
    RSHIFT("RShift", ">>"),
    BITOR("BitOr", "|"),
    BITXOR("BitXor", "^"),
    BITAND("BitAnd", "&"),
    FLOORDIV("FloorDiv", "//");

    private final String pyName;
    public final String symbol;

    private Operator(String pyName, String symbol) {
      this.pyName = pyName;
      this.symbol = symbol;
    }

    @Override
    public String pyName() {
      return pyName;
    }

    /**
     * @param symbol binary operator text, or augmented assignment
     *        text such as "+="
     * @return matching operator, or null
     */
    public static Operator fromSymbol(String symbol) {
      String s = symbol;
      if (s.length() > 1 && s.endsWith("=")) {
        s = s.substring(0, s.length() - 1);
      }
      for (Operator op: values()) {
        if (op.symbol.equals(s)) {
          return op;
        }
      }
      return null;
    }
  }

  public static enum UnaryOperator implements PyEnum {
    INVERT("Invert", "~"),
    NOT("Not", "not"),
    UADD("UAdd", "+"),
    USUB("USub", "-");

    private final String pyName;
    public final String symbol;

    private UnaryOperator(String pyName, String symbol) {
      this.pyName = pyName;
      this.symbol = symbol;
    }

    @Override
    public String pyName() {
      return pyName;
    }
  }

  public static enum CmpOperator implements PyEnum {
    EQ("Eq", "=="),
    NOTEQ("NotEq", "!="),
    LT("Lt", "<"),
    LTE("LtE", "<="),
    GT("Gt", ">"),
    GTE("GtE", ">="),
    IS("Is", "is"),
    ISNOT("IsNot", "is not"),
    IN("In", "in"),
    NOTIN("NotIn", "not in");

    private final String pyName;
    public final String symbol;

    private CmpOperator(String pyName, String symbol) {
      this.pyName = pyName;
      this.symbol = symbol;
    }

    @Override
    public String pyName() {
      return pyName;
    }
  }
}
