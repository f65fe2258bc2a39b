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
import com.google.iced.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lowers a class to a constructor function and prototype assignments, evaluated inside a closure
 * that returns the constructor.
 *
 * <pre>
 * Animal = (function(_super) {
 *   __extends(Animal, _super);
 *   function Animal(name) { this.name = name; }
 *   Animal.prototype.move = function() { ... };
 *   return Animal;
 * })(Base);
 * </pre>
 *
 * <p>Object literals directly in the class body supply the members: {@code constructor} becomes
 * the constructor, {@code @name} keys become static members, and every other key a prototype
 * member. Prototype members declared with the fat arrow are bound to the instance in the
 * constructor.
 */
final class ClassLowering {

  static final DiagnosticType DUPLICATE_CONSTRUCTOR =
      DiagnosticType.syntax(
          "ICED_DUPLICATE_CONSTRUCTOR", "cannot define more than one constructor in a class");

  static final DiagnosticType BOUND_CONSTRUCTOR =
      DiagnosticType.syntax(
          "ICED_BOUND_CONSTRUCTOR", "cannot define a constructor as a bound function");

  static final DiagnosticType RESERVED_CLASS_NAME =
      DiagnosticType.syntax("ICED_RESERVED_CLASS_NAME", "variable name may not be {0}");

  private static final String DEFAULT_NAME = "_Class";

  private final CodeGenerator generator;

  ClassLowering(CodeGenerator generator) {
    this.generator = generator;
  }

  String compile(Node n, CodeContext o) {
    return new ClassBody(n, o).compile();
  }

  /** The state of lowering one class. */
  private final class ClassBody {
    private final Node cls;
    private final CodeContext o;
    private final String name;
    private @Nullable Node ctor;
    private @Nullable String externalCtor;
    private final List<String> boundFuncs = new ArrayList<>();

    ClassBody(Node cls, CodeContext o) {
      this.cls = cls;
      this.o = o;
      String decl = determineName(cls.getFirstChild());
      String className = decl != null ? decl : DEFAULT_NAME;
      this.name = NodeUtil.RESERVED.contains(className) ? "_" + className : className;
    }

    String compile() {
      Node variable = cls.getFirstChild();
      Node parent = cls.getSecondChild();
      Node body = cls.getLastChild();
      walkBody(body);
      setContext(body);
      ensureConstructor(body, !parent.isEmpty());
      generator.markSpaced(body);
      body.addChildToBack(IR.name(name));
      addBoundFunctions();
      Node call = ClosureWrapper.wrap(body);
      if (!parent.isEmpty()) {
        String superName = o.getScope().freshName("super", false);
        body.addChildToFront(IR.extendsNode(IR.name(name), IR.name(superName)));
        call.addChildToBack(parent);
        ClosureWrapper.function(call).getFirstChild().addChildToBack(IR.param(superName));
      }
      Node klass = IR.parens(call);
      Node result = variable.isEmpty() ? klass : IR.assign(variable, klass);
      return generator.compile(NodeUtil.substitute(cls, c -> result), o);
    }

    private @Nullable String determineName(Node variable) {
      if (variable.isEmpty()) {
        return null;
      }
      String decl;
      if (NodeUtil.hasProperties(variable)) {
        Node tail = variable.getLastChild();
        decl = tail.isAccess() ? tail.getFirstChild().getString() : null;
      } else {
        decl = NodeUtil.identifierOf(variable);
      }
      if (decl != null && NodeUtil.STRICT_PROSCRIBED.contains(decl)) {
        throw generator.error(variable, RESERVED_CLASS_NAME, decl);
      }
      return decl != null && NodeUtil.isIdentifier(decl) ? decl : null;
    }

    /** Replaces member-declaring object literals with the assignments they stand for. */
    private void walkBody(Node n) {
      for (Node child : n.childList()) {
        if (child.isCode() || child.isClass()) {
          continue;
        }
        if (n.isBlock() && NodeUtil.isObject(child)) {
          for (Node expr : addProperties(NodeUtil.baseOf(child))) {
            expr.insertBefore(child);
          }
          child.detach();
          continue;
        }
        walkBody(child);
      }
    }

    private List<Node> addProperties(Node obj) {
      List<Node> exprs = new ArrayList<>();
      for (Node prop : obj.childList()) {
        if (!prop.isAssign()) {
          exprs.add(prop);
          continue;
        }
        Node key = prop.getFirstChild();
        Node base = NodeUtil.baseOf(key);
        Node func = prop.getSecondChild();
        prop.putProp(Node.Prop.CONTEXT, null);
        if (base.matchesName("constructor")) {
          if (ctor != null) {
            throw generator.error(prop, DUPLICATE_CONSTRUCTOR);
          }
          if (func.getBooleanProp(Node.Prop.BOUND)) {
            throw generator.error(prop, BOUND_CONSTRUCTOR);
          }
          if (func.isCode()) {
            ctor = func;
            exprs.add(func);
          } else {
            externalCtor = o.getScope().freshName("class");
            exprs.add(IR.assign(IR.name(externalCtor), func));
          }
        } else if (NodeUtil.isThisProperty(key)) {
          if (func.isCode()) {
            func.putBooleanProp(Node.Prop.STATIC, true);
          }
          exprs.add(prop);
        } else {
          Node member = new Node(Token.ACCESS, base);
          key.replaceWith(IR.value(IR.name(name), IR.access("prototype"), member));
          if (func.isCode() && func.getBooleanProp(Node.Prop.BOUND)) {
            boundFuncs.add(base.getString());
            func.putBooleanProp(Node.Prop.BOUND, false);
          }
          exprs.add(prop);
        }
      }
      return exprs;
    }

    /** {@code this} in the class body refers to the class itself. */
    private void setContext(Node n) {
      for (Node child : n.childList()) {
        if (child.isClass()) {
          visitContext(child.getFirstChild());
          visitContext(child.getSecondChild());
        } else {
          visitContext(child);
        }
      }
    }

    private void visitContext(Node child) {
      if (child.isThis()) {
        child.replaceWith(IR.name(name));
      } else if (child.isCode()) {
        child.putProp(Node.Prop.CLASS_NAME, name);
        if (child.getBooleanProp(Node.Prop.BOUND)) {
          generator.setThisAlias(child, name);
        }
      } else {
        setContext(child);
      }
    }

    private void ensureConstructor(Node body, boolean hasParent) {
      if (ctor == null) {
        ctor = IR.code(IR.block());
        Node ctorBody = ctor.getLastChild();
        if (hasParent) {
          ctorBody.addChildToBack(IR.js(name + ".__super__.constructor.apply(this, arguments)"));
        }
        if (externalCtor != null) {
          ctorBody.addChildToBack(IR.js(externalCtor + ".apply(this, arguments)"));
        }
        NodeUtil.makeReturn(ctorBody, null);
        body.addChildToFront(ctor);
      }
      ctor.putBooleanProp(Node.Prop.CTOR, true)
          .putProp(Node.Prop.METHOD_NAME, name)
          .putProp(Node.Prop.CLASS_NAME, null)
          .putBooleanProp(Node.Prop.NO_RETURN, true);
    }

    /** Fat-arrow prototype members are rebound to each instance on construction. */
    private void addBoundFunctions() {
      if (boundFuncs.isEmpty()) {
        return;
      }
      String bind = o.getScope().useHelper(RuntimeHelper.BIND);
      Node ctorBody = ctor.getLastChild();
      for (String member : boundFuncs) {
        String lhs = NodeUtil.isIdentifier(member) ? "this." + member : "this[" + member + "]";
        ctorBody.addChildToFront(IR.js(lhs + " = " + bind + "(" + lhs + ", this)"));
      }
    }
  }
}
