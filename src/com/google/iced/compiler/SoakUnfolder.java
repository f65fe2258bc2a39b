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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites soaked accesses, indexes and calls into conditionals. {@code a?.b.c} becomes an
 * {@code if} whose condition tests that {@code a} exists and whose body is {@code a.b.c}; a soak
 * anywhere inside a call, assignment target or increment lifts the whole enclosing expression
 * into the body.
 *
 * <p>Each rewrite happens in place: the returned {@code IF} stands where the soaked node stood.
 */
final class SoakUnfolder {

  private final CodeGenerator generator;
  private final Map<Node, Node> unfolded = new IdentityHashMap<>();

  SoakUnfolder(CodeGenerator generator) {
    this.generator = generator;
  }

  /** Returns the conditional that replaced {@code n}, or null if {@code n} has no soak. */
  @Nullable Node unfold(Node n, CodeContext o) {
    switch (n.getToken()) {
      case VALUE:
        return unfoldValue(n, o);
      case CALL:
        return unfoldCall(n, o);
      case ASSIGN:
        return unfoldChild(n, n.getFirstChild(), o);
      case OP:
        {
          String op = n.getString();
          boolean mutates = op.equals("++") || op.equals("--") || op.equals("delete");
          return mutates && NodeUtil.isUnary(n) ? unfoldChild(n, n.getFirstChild(), o) : null;
        }
      case IF:
        return n.getBooleanProp(Node.Prop.SOAK) ? n : null;
      default:
        return null;
    }
  }

  private @Nullable Node unfoldValue(Node v, CodeContext o) {
    Node cached = unfolded.get(v);
    if (cached != null) {
      return cached;
    }
    Node ifn = unfoldBase(v, o);
    if (ifn == null) {
      ifn = unfoldProperties(v, o);
    }
    if (ifn != null) {
      unfolded.put(v, ifn);
    }
    return ifn;
  }

  /** A soak in the base lifts the rest of the chain into its body. */
  private @Nullable Node unfoldBase(Node v, CodeContext o) {
    Node ifn = unfold(v.getFirstChild(), o);
    if (ifn == null) {
      return null;
    }
    Node target = soakTarget(ifn);
    for (Node prop : v.childList().subList(1, v.getChildCount())) {
      target.addChildToBack(prop);
    }
    if (v.hasParent()) {
      v.replaceWith(ifn);
    } else {
      ifn.detach();
    }
    return ifn;
  }

  private @Nullable Node unfoldProperties(Node v, CodeContext o) {
    List<Node> children = v.childList();
    for (int i = 1; i < children.size(); i++) {
      Node prop = children.get(i);
      if (!prop.getBooleanProp(Node.Prop.SOAK)) {
        continue;
      }
      prop.putBooleanProp(Node.Prop.SOAK, false);
      Node fst = IR.value(children.get(0));
      for (Node head : children.subList(1, i)) {
        fst.addChildToBack(head);
      }
      Node snd;
      if (NodeUtil.isComplex(fst)) {
        String ref = o.getScope().freshName("ref");
        fst = IR.parens(IR.assign(IR.name(ref), fst));
        snd = IR.value(IR.name(ref));
      } else {
        snd = IR.value(fst.getFirstChild().cloneTree());
      }
      for (Node tail : children.subList(i, children.size())) {
        snd.addChildToBack(tail);
      }
      Node ifn = soakIf(IR.existence(fst), snd);
      if (v.hasParent()) {
        v.replaceWith(ifn);
      }
      return ifn;
    }
    return null;
  }

  private @Nullable Node unfoldCall(Node call, CodeContext o) {
    Node callee = call.getFirstChild();
    Node ifn = unfoldChild(call, callee, o);
    if (ifn != null || !call.getBooleanProp(Node.Prop.SOAK)) {
      return ifn;
    }
    // f?() calls f only if it is a function.
    Node[] refs = generator.cacheReference(callee, o);
    List<Node> args = call.childList();
    Node rite = IR.call(refs[1], args.subList(1, args.size()));
    rite.putBooleanProp(Node.Prop.NEW, call.getBooleanProp(Node.Prop.NEW));
    String test = "typeof " + generator.compile(refs[0], o) + " === \"function\"";
    Node result = soakIf(IR.js(test), IR.value(rite));
    return NodeUtil.substitute(call, c -> result);
  }

  /**
   * Unfolds a soak in {@code child}, then lifts {@code parent} into the body of the resulting
   * conditional.
   */
  private @Nullable Node unfoldChild(Node parent, Node child, CodeContext o) {
    Node ifn = unfold(child, o);
    if (ifn == null) {
      return null;
    }
    if (ifn.hasParent()) {
      ifn.replaceWith(soakTarget(ifn));
    } else {
      soakTarget(ifn).detach();
    }
    return NodeUtil.substitute(
        parent,
        p -> {
          ifn.getSecondChild().addChildToBack(IR.value(p));
          return ifn;
        });
  }

  private static Node soakIf(Node condition, Node body) {
    return IR.ifNode(condition, IR.block(body)).putBooleanProp(Node.Prop.SOAK, true);
  }

  /** The value a soak conditional evaluates when its test passes. */
  private static Node soakTarget(Node ifn) {
    return ifn.getSecondChild().getOnlyChild();
  }
}
