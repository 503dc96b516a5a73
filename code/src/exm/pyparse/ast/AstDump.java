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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.pyparse.ast.Operators.PyEnum;

/**
 * Renders a tree in the format of Python's {@code ast.dump}:
 * {@code Name(id='x', ctx=Load())}.  Absent optional fields are
 * left out, lists are always shown, and values use Python repr syntax.
 */
public class AstDump {

  private final String indent;
  private final boolean includeAttributes;

  /**
   * @param indent spaces per nesting level, or negative for a single line
   * @param includeAttributes if true, print node positions
   */
  public AstDump(int indent, boolean includeAttributes) {
    this.indent = indent < 0 ? null : StringUtils.repeat(' ', indent);
    this.includeAttributes = includeAttributes;
  }

  public static String dump(Node node) {
    return new AstDump(-1, false).format(node);
  }

  public static String dump(Node node, int indent,
                            boolean includeAttributes) {
    return new AstDump(indent, includeAttributes).format(node);
  }

  public String format(Node node) {
    return format(node, 0).text;
  }

  private static class Formatted {
    final String text;
    /** True if no line breaks needed inside */
    final boolean simple;

    Formatted(String text, boolean simple) {
      this.text = text;
      this.simple = simple;
    }
  }

  private Formatted format(Object value, int level) {
    String prefix;
    String sep;
    if (indent != null) {
      level++;
      prefix = "\n" + StringUtils.repeat(indent, level);
      sep = ",\n" + StringUtils.repeat(indent, level);
    } else {
      prefix = "";
      sep = ", ";
    }

    if (value instanceof Node) {
      Node node = (Node) value;
      List<String> args = new ArrayList<String>();
      boolean allSimple = true;
      for (Field f: node.fields()) {
        if (f.value == null) {
          continue;
        }
        Formatted v = format(f.value, level);
        allSimple = allSimple && v.simple;
        args.add(f.name + "=" + v.text);
      }
      if (includeAttributes && node.hasPosition()) {
        Span s = node.getSpan();
        args.add("lineno=" + s.lineno);
        args.add("col_offset=" + s.colOffset);
        args.add("end_lineno=" + s.endLineno);
        args.add("end_col_offset=" + s.endColOffset);
      }
      if (allSimple && args.size() <= 3) {
        return new Formatted(node.nodeName() + "(" +
                    StringUtils.join(args, ", ") + ")", args.isEmpty());
      }
      return new Formatted(node.nodeName() + "(" + prefix +
                           StringUtils.join(args, sep) + ")", false);
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      if (list.isEmpty()) {
        return new Formatted("[]", true);
      }
      List<String> elems = new ArrayList<String>(list.size());
      for (Object o: list) {
        elems.add(format(o, level).text);
      }
      return new Formatted("[" + prefix + StringUtils.join(elems, sep) + "]",
                           false);
    } else if (value instanceof PyEnum) {
      return new Formatted(((PyEnum) value).pyName() + "()", true);
    }
    return new Formatted(repr(value), true);
  }

  /**
   * Python repr of a constant or identifier value
   */
  public static String repr(Object value) {
    if (value == null) {
      return "None";
    } else if (value instanceof String) {
      return reprString((String) value);
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? "True" : "False";
    } else if (value instanceof Double) {
      return formatFloat((Double) value, true);
    } else if (value instanceof Imaginary) {
      return formatFloat(((Imaginary) value).imag, false) + "j";
    } else if (value instanceof PyBytes) {
      return reprBytes((PyBytes) value);
    }
    // PyConstant, BigInteger, Integer
    return value.toString();
  }

  public static String reprString(String s) {
    char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    int i = 0;
    while (i < s.length()) {
      int cp = s.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == quote || cp == '\\') {
        sb.append('\\').append((char) cp);
      } else if (cp == '\t') {
        sb.append("\\t");
      } else if (cp == '\n') {
        sb.append("\\n");
      } else if (cp == '\r') {
        sb.append("\\r");
      } else if (cp < ' ' || cp == 0x7f) {
        sb.append(String.format("\\x%02x", cp));
      } else if (cp < 0x7f || isPrintable(cp)) {
        sb.appendCodePoint(cp);
      } else if (cp <= 0xff) {
        sb.append(String.format("\\x%02x", cp));
      } else if (cp <= 0xffff) {
        sb.append(String.format("\\u%04x", cp));
      } else {
        sb.append(String.format("\\U%08x", cp));
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  private static boolean isPrintable(int cp) {
    switch (Character.getType(cp)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.SURROGATE:
      case Character.PRIVATE_USE:
      case Character.UNASSIGNED:
      case Character.LINE_SEPARATOR:
      case Character.PARAGRAPH_SEPARATOR:
      case Character.SPACE_SEPARATOR:
        return false;
      default:
        return true;
    }
  }

  public static String reprBytes(PyBytes bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (int i = 0; i < bytes.length(); i++) {
      hasSingle = hasSingle || bytes.get(i) == '\'';
      hasDouble = hasDouble || bytes.get(i) == '"';
    }
    char quote = (hasSingle && !hasDouble) ? '"' : '\'';
    StringBuilder sb = new StringBuilder(bytes.length() + 3);
    sb.append('b').append(quote);
    for (int i = 0; i < bytes.length(); i++) {
      int b = bytes.get(i);
      if (b == quote || b == '\\') {
        sb.append('\\').append((char) b);
      } else if (b == '\t') {
        sb.append("\\t");
      } else if (b == '\n') {
        sb.append("\\n");
      } else if (b == '\r') {
        sb.append("\\r");
      } else if (b < ' ' || b >= 0x7f) {
        sb.append(String.format("\\x%02x", b));
      } else {
        sb.append((char) b);
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  /**
   * Shortest round-trip representation, switching to exponent
   * notation outside 1e-4 <= |d| < 1e16
   * @param pointFloat if true, integral values get a trailing ".0"
   */
  public static String formatFloat(double d, boolean pointFloat) {
    if (Double.isNaN(d)) {
      return "nan";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    String zero = pointFloat ? "0.0" : "0";
    if (d == 0.0) {
      return (1.0 / d < 0) ? "-" + zero : zero;
    }

    String sign = d < 0 ? "-" : "";
    BigDecimal bd = new BigDecimal(Double.toString(Math.abs(d)))
                                                .stripTrailingZeros();
    String digits = bd.unscaledValue().toString();
    int exp = digits.length() - 1 - bd.scale();
    StringBuilder sb = new StringBuilder(sign);
    if (exp >= -4 && exp < 16) {
      if (exp >= digits.length() - 1) {
        sb.append(digits);
        sb.append(StringUtils.repeat('0', exp - (digits.length() - 1)));
        if (pointFloat) {
          sb.append(".0");
        }
      } else if (exp >= 0) {
        sb.append(digits, 0, exp + 1).append('.');
        sb.append(digits, exp + 1, digits.length());
      } else {
        sb.append("0.").append(StringUtils.repeat('0', -exp - 1));
        sb.append(digits);
      }
    } else {
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exp < 0 ? '-' : '+');
      int absExp = Math.abs(exp);
      if (absExp < 10) {
        sb.append('0');
      }
      sb.append(absExp);
    }
    return sb.toString();
  }
}
