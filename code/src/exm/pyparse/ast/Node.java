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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of all syntax tree nodes.
 *
 * Nodes are immutable and own their children exclusively.  Child lists
 * are unmodifiable but may contain null entries where the grammar
 * allows a missing element (dict unpacking keys, keyword-only
 * parameters without defaults).
 */
public abstract class Node {

  private final Span span;

  protected Node(Span span) {
    this.span = span;
  }

  /**
   * @return source range, or null for node kinds without positions
   */
  public Span getSpan() {
    return span;
  }

  public boolean hasPosition() {
    return span != null;
  }

  public int lineno() {
    return span.lineno;
  }

  public int colOffset() {
    return span.colOffset;
  }

  public int endLineno() {
    return span.endLineno;
  }

  public int endColOffset() {
    return span.endColOffset;
  }

  /**
   * @return node kind name as printed in tree dumps
   */
  public String nodeName() {
    return getClass().getSimpleName();
  }

  /**
   * @return fields in declaration order
   */
  public abstract List<Field> fields();

  /**
   * @return direct child nodes in field order, skipping absent ones
   */
  public List<Node> children() {
    List<Node> result = new ArrayList<Node>();
    for (Field f: fields()) {
      if (f.value instanceof Node) {
        result.add((Node) f.value);
      } else if (f.value instanceof List) {
        for (Object o: (List<?>) f.value) {
          if (o instanceof Node) {
            result.add((Node) o);
          }
        }
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return AstDump.dump(this);
  }

  protected static <T> List<T> freeze(List<? extends T> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<T>(list));
  }

  protected static List<Field> fieldList(Field ...fields) {
    List<Field> result = new ArrayList<Field>(fields.length);
    Collections.addAll(result, fields);
    return result;
  }
}
