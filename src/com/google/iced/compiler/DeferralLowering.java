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

import static com.google.iced.compiler.IcedTransform.ASSIGN_FN;
import static com.google.iced.compiler.IcedTransform.CONTINUATION;
import static com.google.iced.compiler.IcedTransform.DEFERRALS;
import static com.google.iced.compiler.IcedTransform.DEFERRALS_CLASS;
import static com.google.iced.compiler.IcedTransform.DEFER_METHOD;
import static com.google.iced.compiler.IcedTransform.FILENAME;
import static com.google.iced.compiler.IcedTransform.FULFILL;
import static com.google.iced.compiler.IcedTransform.FUNCNAME;
import static com.google.iced.compiler.IcedTransform.LINENO;
import static com.google.iced.compiler.IcedTransform.NOOP;
import static com.google.iced.compiler.IcedTransform.NS;
import static com.google.iced.compiler.IcedTransform.SLOT;

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import com.google.iced.compiler.CodeContext.Level;
import com.google.iced.compiler.CompilerOptions.RuntimeMode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Emits the suspension constructs against the {@code iced} runtime.
 *
 * <p>An {@code await} block creates a deferral counter bound to the current continuation, runs its
 * body, and releases its own hold on the counter; the continuation runs once every {@code defer}
 * made in the body has been called:
 *
 * <pre>
 * __iced_deferrals = new iced.Deferrals(__iced_k, {funcname: "f"});
 * setTimeout(__iced_deferrals.defer({lineno: 2}), 10);
 * __iced_deferrals._fulfill();
 * </pre>
 *
 * <p>Each {@code defer} slot is assigned from the arguments the callback is eventually called
 * with. Slots that are properties capture their object when the callback is created.
 */
final class DeferralLowering {
  private static final Logger logger = Logger.getLogger(DeferralLowering.class.getName());

  static final DiagnosticType BAD_DEFER_SLOT =
      DiagnosticType.syntax("ICED_BAD_DEFER_SLOT", "cannot defer into a non-assignable value");

  private final CodeGenerator generator;

  DeferralLowering(CodeGenerator generator) {
    this.generator = generator;
  }

  String compileAwait(Node n, CodeContext o) {
    Node body = n.getFirstChild();
    Scope scope = o.getScope();
    scope.add(DEFERRALS, Scope.Kind.VAR, false);

    Node trace = IR.obj();
    String filename = generator.getOptions().getSourceName();
    if (filename != null) {
      trace.addChildToBack(IR.prop(FILENAME, IR.string(filename)));
    }
    String funcname = functionName(scope.sourceMethod());
    if (funcname != null) {
      trace.addChildToBack(IR.prop(FUNCNAME, IR.string(funcname)));
    }
    Node deferrals = IR.newCall(IR.path(NS, DEFERRALS_CLASS), IR.name(CONTINUATION), trace);
    body.addChildToFront(IR.assign(IR.name(DEFERRALS), deferrals));
    body.addChildToBack(IR.call(IR.path(DEFERRALS, FULFILL)));
    return generator.compileBlock(body, o.withLevel(Level.TOP));
  }

  /** {@code Klass.method}, or the bare name of a function, for traces. */
  private static @Nullable String functionName(@Nullable Node method) {
    if (method == null) {
      return null;
    }
    Object name = method.getProp(Node.Prop.METHOD_NAME);
    if (name == null) {
      return null;
    }
    Object klass = method.getProp(Node.Prop.CLASS_NAME);
    return klass == null ? (String) name : klass + "." + name;
  }

  String compileDefer(Node n, CodeContext o) {
    List<Node> slots = n.childList();
    Node trace = IR.obj();
    if (!slots.isEmpty()) {
      trace.addChildToBack(IR.prop(ASSIGN_FN, assignFunction(n, slots, o.getScope())));
    }
    if (n.getLineno() >= 0) {
      trace.addChildToBack(IR.prop(LINENO, IR.number(n.getLineno())));
    }
    Node call = IR.call(IR.path(DEFERRALS, DEFER_METHOD), trace);
    return generator.compile(NodeUtil.substitute(n, d -> call), o);
  }

  /**
   * Builds {@code (function(__slot_1, ...) { return function() { ... }; })(captured, ...)}. The
   * inner function assigns its arguments to the slots in order; a splat slot takes the rest.
   */
  private Node assignFunction(Node defer, List<Node> slots, Scope scope) {
    List<Node> params = new ArrayList<>();
    List<Node> captured = new ArrayList<>();
    Node assignments = IR.block();
    for (int i = 0; i < slots.size(); i++) {
      Node slot = slots.get(i);
      Node received;
      if (slot.isSplat()) {
        String slice = scope.useHelper(RuntimeHelper.SLICE);
        received = IR.call(IR.path(slice, "call"), IR.name("arguments"), IR.number(i));
        slot = slot.getFirstChild();
      } else {
        received = IR.value(IR.name("arguments"), IR.index(IR.number(i)));
      }
      assignments.addChildToBack(IR.assign(target(defer, slot, params, captured, scope), received));
    }
    Node inner = IR.code(assignments);
    Node outer = IR.code(params, IR.block(IR.returnNode(inner)));
    return IR.call(outer, captured);
  }

  /** The assignable the callback writes a slot through. */
  private Node target(
      Node defer, Node slot, List<Node> params, List<Node> captured, Scope scope) {
    String name = NodeUtil.identifierOf(slot);
    if (name != null && !NodeUtil.hasProperties(slot)) {
      scope.declare(name);
      return IR.name(name);
    }
    if (!NodeUtil.hasProperties(slot) || !NodeUtil.isAssignable(slot)) {
      throw generator.error(defer, BAD_DEFER_SLOT);
    }
    Node last = slot.getLastChild().detach();
    Node base = slot.hasMoreThanOneChild() ? slot : slot.getFirstChild();
    Node target = IR.value(IR.name(capture(base, params, captured)));
    if (last.isIndex() && !isLiteralKey(last.getFirstChild())) {
      String index = capture(last.getFirstChild(), params, captured);
      last = IR.index(IR.name(index));
    }
    target.addChildToBack(last);
    return target;
  }

  private static boolean isLiteralKey(Node key) {
    return key.isNumber() || key.isString();
  }

  /** Passes {@code value} into the outer function under a fresh slot parameter. */
  private static String capture(Node value, List<Node> params, List<Node> captured) {
    String param = SLOT + "_" + (params.size() + 1);
    params.add(IR.param(param));
    captured.add(value);
    return param;
  }

  /** The runtime setup at the top of a program that awaits or defers. */
  String compileRuntime(Node n, CodeContext o) {
    RuntimeMode mode = (RuntimeMode) n.getProp(Node.Prop.RUNTIME_MODE);
    List<Node> statements = new ArrayList<>();
    switch (mode) {
      case INLINE:
        statements.add(InlineRuntime.generate());
        break;
      case NODE:
        Node require = IR.call(IR.value(IR.name("require")), IR.string("iced-coffee-script"));
        statements.add(IR.assign(IR.name(NS), IR.value(require, IR.access(NS))));
        break;
      case NONE:
        break;
    }
    if (n.getBooleanProp(Node.Prop.FOUND_AWAIT)) {
      Node noop = IR.assign(IR.name(NOOP), IR.code(IR.block()));
      statements.add(IR.assign(IR.name(CONTINUATION), noop));
    }
    logger.finer(() -> "emitting " + mode.directive() + " runtime");
    return generator.compileStatements(statements, o.withLevel(Level.TOP), false);
  }
}
