/*
 * Copyright 2026 The Iced Compiler Authors.
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
 * limitations under the License.
 */

package com.google.iced.compiler;

import com.google.iced.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * optimizations on the parse tree.
 */
public final class NodeTraversal {
  private final Callback callback;

  /** Functions entered on the way down, innermost first. */
  private final Deque<Node> functionStack = new ArrayDeque<>();

  /**
   * Callback for tree-based traversals.
   */
  public interface Callback {
    /**
     * Visits a node in pre order (before visiting its children) and decides whether this node's
     * children should be traversed. If children are traversed, they will be visited by {@link
     * #visit(NodeTraversal, Node, Node)} in postorder.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /** Visits a node in postorder (after its children have been visited). */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /**
   * Abstract callback that does not descend into nested functions. The function node itself is
   * still visited.
   */
  public abstract static class AbstractShallowCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return parent == null || !parent.isCode();
    }
  }

  private NodeTraversal(Callback cb) {
    this.callback = cb;
  }

  /** Traverses the tree rooted at {@code root}. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverseBranch(root, null);
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    boolean isFunction = n.isCode();
    if (isFunction) {
      functionStack.push(n);
    }
    for (Node child = n.getFirstChild(); child != null; ) {
      // The callback may detach or replace the child.
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
    callback.visit(this, n, parent);
    if (isFunction) {
      functionStack.pop();
    }
  }

  /**
   * The innermost function whose body is being traversed, or null outside of functions. A
   * function node being visited counts as its own enclosing function.
   */
  public @Nullable Node getEnclosingFunction() {
    return functionStack.peek();
  }

  public int getFunctionDepth() {
    return functionStack.size();
  }

  /**
   * Whether any descendant of {@code root} within the same function matches {@code predicate}.
   * Nested function nodes are tested but not entered.
   */
  public static boolean contains(Node root, Predicate<Node> predicate) {
    for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
      if (predicate.test(c) || (!c.isCode() && contains(c, predicate))) {
        return true;
      }
    }
    return false;
  }

  /** Whether any descendant of {@code root}, nested functions included, matches. */
  public static boolean containsCrossScope(Node root, Predicate<Node> predicate) {
    for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
      if (predicate.test(c) || containsCrossScope(c, predicate)) {
        return true;
      }
    }
    return false;
  }
}
