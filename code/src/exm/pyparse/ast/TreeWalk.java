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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class TreeWalk {

  /**
   * Walk pre-order, visiting every node including root
   * @param root
   * @param walker
   */
  public static void walk(Node root, TreeWalker walker) {
    Deque<Node> stack = new ArrayDeque<Node>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node curr = stack.pop();
      walker.visitNode(curr);
      List<Node> children = curr.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  public static abstract class TreeWalker {
    public void visitNode(Node node) {
      if (node instanceof Stmt) {
        visit((Stmt) node);
      } else if (node instanceof Expr) {
        visit((Expr) node);
      } else if (node instanceof Pattern) {
        visit((Pattern) node);
      } else {
        visitOther(node);
      }
    }

    protected void visit(Stmt stmt) {
      // Nothing
    }

    protected void visit(Expr expr) {
      // Nothing
    }

    protected void visit(Pattern pattern) {
      // Nothing
    }

    /**
     * Module and helper nodes
     */
    protected void visitOther(Node node) {
      // Nothing
    }
  }
}
