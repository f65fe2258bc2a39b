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

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import java.util.List;
import java.util.function.Predicate;

/**
 * Wraps statements in an immediately invoked function so that they can stand where an expression
 * is required. The call forwards {@code this} and {@code arguments} when the statements use them.
 */
final class ClosureWrapper {

  private static final Predicate<Node> USES_ARGUMENTS = n -> n.matchesName("arguments");

  private static final Predicate<Node> USES_THIS =
      n -> n.isThis() || (n.isCode() && n.getBooleanProp(Node.Prop.BOUND));

  private ClosureWrapper() {}

  /** Returns the call; {@code expressions} becomes the body of the invoked function. */
  static Node wrap(Node expressions) {
    Node body = expressions.isBlock() ? expressions : IR.block(expressions);
    boolean usesArguments = mentions(body, USES_ARGUMENTS);
    boolean usesThis = !usesArguments && mentions(body, USES_THIS);
    Node func = IR.code(List.of(), body);
    if (usesArguments) {
      return IR.call(IR.value(func, IR.access("apply")), IR.thisNode(), IR.name("arguments"));
    }
    if (usesThis) {
      return IR.call(IR.value(func, IR.access("call")), IR.thisNode());
    }
    return IR.call(func);
  }

  /** The function node a call built by {@link #wrap} invokes. */
  static Node function(Node call) {
    Node callee = call.getFirstChild();
    return callee.isValue() ? callee.getFirstChild() : callee;
  }

  private static boolean mentions(Node block, Predicate<Node> predicate) {
    return NodeTraversal.contains(block, predicate);
  }
}
