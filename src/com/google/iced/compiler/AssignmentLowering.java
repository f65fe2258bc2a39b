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
import com.google.iced.compiler.CodeContext.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Emits assignments: plain and compound ones, object literal properties, destructuring
 * patterns, slice splices and the conditional forms {@code ||=}, {@code &&=} and {@code ?=}.
 */
final class AssignmentLowering {

  static final DiagnosticType NOT_ASSIGNABLE =
      DiagnosticType.syntax("ICED_NOT_ASSIGNABLE", "\"{0}\" cannot be assigned.");

  static final DiagnosticType UNDEFINED_CONDITIONAL =
      DiagnosticType.syntax(
          "ICED_UNDEFINED_CONDITIONAL",
          "the variable \"{0}\" can''t be assigned with {1} because it has not been defined.");

  static final DiagnosticType MULTIPLE_SPLATS =
      DiagnosticType.syntax(
          "ICED_MULTIPLE_SPLATS", "multiple splats are disallowed in an assignment: {0}...");

  /** Targets that name a method: {@code name}, {@code obj.name}, {@code Klass.prototype.name}. */
  private static final Pattern METHOD_DEF =
      Pattern.compile("^(?:(\\S+)\\.prototype\\.|\\S+?)?\\b([$A-Za-z_][\\w\\x7f-\\uffff]*)$");

  private final CodeGenerator generator;

  AssignmentLowering(CodeGenerator generator) {
    this.generator = generator;
  }

  String compile(Node n, CodeContext o) {
    Node target = n.getFirstChild();
    Node value = n.getSecondChild();
    String context = (String) n.getProp(Node.Prop.CONTEXT);
    if (NodeUtil.isArray(target) || NodeUtil.isObject(target)) {
      return compilePatternMatch(n, o);
    }
    if (NodeUtil.isSplice(target)) {
      return compileSplice(n, o);
    }
    if ("||=".equals(context) || "&&=".equals(context) || "?=".equals(context)) {
      return compileConditional(n, o);
    }
    String name = generator.compile(target, o, Level.LIST);
    if (context == null) {
      Node base = NodeUtil.unwrapAll(target);
      if (!NodeUtil.isAssignable(base)) {
        throw generator.error(n, NOT_ASSIGNABLE, name);
      }
      if (!NodeUtil.hasProperties(base)) {
        if (NodeUtil.RESERVED.contains(name)) {
          throw generator.error(n, CodeGenerator.RESERVED_NAME, name);
        }
        Scope scope = o.getScope();
        if (n.getBooleanProp(Node.Prop.LOCAL)) {
          scope.add(name, Scope.Kind.VAR, true);
        } else if (n.getBooleanProp(Node.Prop.PARAM)) {
          scope.add(name, Scope.Kind.VAR, false);
        } else {
          scope.declare(name);
        }
      }
    }
    if (value.isCode()) {
      nameMethod(value, name);
    }
    String val = generator.compile(value, o, Level.LIST);
    if ("object".equals(context)) {
      return name + ": " + val;
    }
    String code = name + " " + (context == null ? "=" : context) + " " + val;
    return o.getLevel().atMost(Level.LIST) ? code : "(" + code + ")";
  }

  /** Functions take the name, and the class, of the slot they are assigned to. */
  private static void nameMethod(Node code, String target) {
    if (code.getBooleanProp(Node.Prop.GENERATED)) {
      return;
    }
    Matcher m = METHOD_DEF.matcher(target);
    if (!m.matches()) {
      return;
    }
    if (m.group(1) != null && code.getProp(Node.Prop.CLASS_NAME) == null) {
      code.putProp(Node.Prop.CLASS_NAME, m.group(1));
    }
    if (code.getProp(Node.Prop.METHOD_NAME) == null) {
      code.putProp(Node.Prop.METHOD_NAME, m.group(2));
    }
  }

  /** {@code a ||= b} becomes {@code a || (a = b)}, reading {@code a} once. */
  private String compileConditional(Node n, CodeContext o) {
    String context = (String) n.getProp(Node.Prop.CONTEXT);
    Node value = n.getSecondChild();
    Node[] refs = generator.cacheReference(n.getFirstChild(), o);
    Node left = refs[0];
    if (!NodeUtil.hasProperties(left)) {
      String name = NodeUtil.identifierOf(left);
      if (name != null && !o.getScope().isDeclared(name)) {
        throw generator.error(n, UNDEFINED_CONDITIONAL, name, context);
      }
    }
    String op = context.substring(0, context.length() - 1);
    Node rewritten =
        NodeUtil.substitute(n, a -> IR.op(op, left, IR.assign(refs[1], value)));
    return generator.compile(rewritten, o.withExistentialEquals(op.equals("?")));
  }

  /** {@code a[i..j] = v} becomes a call to {@code splice}, and evaluates to {@code v}. */
  private String compileSplice(Node n, CodeContext o) {
    Node target = n.getFirstChild();
    Node value = n.getSecondChild();
    Node range = target.getLastChild().detach().getFirstChild();
    Node from = range.getFirstChild();
    Node to = range.getSecondChild();
    boolean exclusive = range.getBooleanProp(Node.Prop.EXCLUSIVE);
    String name = generator.compile(target, o);
    String fromDecl = "0";
    String fromRef = "0";
    if (!from.isEmpty()) {
      String[] cached = generator.cacheCompiled(from, o, Level.OP);
      fromDecl = cached[0];
      fromRef = cached[1];
    }
    String toCode;
    if (to.isEmpty()) {
      toCode = "9e9";
    } else {
      String compiledTo = generator.compile(to, o, Level.ACCESS);
      if (NodeUtil.isSimpleNumber(fromRef) && NodeUtil.isSimpleNumber(compiledTo)) {
        long count = Long.parseLong(compiledTo) - Long.parseLong(fromRef);
        toCode = String.valueOf(exclusive ? count : count + 1);
      } else {
        toCode = compiledTo + " - " + fromRef + (exclusive ? "" : " + 1");
      }
    }
    String[] val = generator.cacheCompiled(value, o, Level.LIST);
    String code =
        "[].splice.apply(" + name + ", [" + fromDecl + ", " + toCode + "].concat(" + val[0]
            + ")), " + val[1];
    return o.getLevel().atLeast(Level.PAREN) ? "(" + code + ")" : code;
  }

  /**
   * Destructuring. A single target at statement level is unrolled into one plain assignment;
   * otherwise the value is cached and each target is assigned from it in turn.
   */
  private String compilePatternMatch(Node n, CodeContext o) {
    boolean top = o.isTop();
    Node value = n.getSecondChild();
    Node pattern = NodeUtil.baseOf(n.getFirstChild());
    boolean isObject = pattern.isObj();
    List<Node> objects = pattern.childList();
    boolean param = n.getBooleanProp(Node.Prop.PARAM);
    boolean subpattern = n.getBooleanProp(Node.Prop.SUBPATTERN);
    if (objects.isEmpty()) {
      String code = generator.compile(value, o);
      return o.getLevel().atLeast(Level.OP) ? "(" + code + ")" : code;
    }

    if (top && objects.size() == 1 && !objects.get(0).isSplat()) {
      Node obj = objects.get(0);
      Node key;
      if (NodeUtil.isObjectProperty(obj)) {
        key = NodeUtil.baseOf(obj.getFirstChild());
        obj = obj.getSecondChild();
      } else if (isObject) {
        key = NodeUtil.isThisProperty(obj)
            ? IR.name(CodeGenerator.thisPropertyName(obj))
            : NodeUtil.unwrapAll(obj).cloneTree();
      } else {
        key = IR.number(0);
      }
      checkReserved(obj, n);
      Node val = value.isValue() ? value : NodeUtil.substitute(value, IR::value);
      val.addChildToBack(accessor(key));
      Node assign = IR.assign(obj, val).putBooleanProp(Node.Prop.PARAM, param);
      return generator.compile(NodeUtil.substitute(n, a -> assign), o, Level.TOP);
    }

    Scope scope = o.getScope();
    String vvar = generator.compile(value, o, Level.LIST);
    List<String> assigns = new ArrayList<>();
    if (!NodeUtil.isIdentifier(vvar) || NodeUtil.assigns(n.getFirstChild(), vvar)) {
      String ref = scope.freshName("ref");
      assigns.add(ref + " = " + vvar);
      vvar = ref;
    }
    int olen = objects.size();
    String splatIndex = null;
    for (int i = 0; i < olen; i++) {
      Node obj = objects.get(i);
      Node target = obj;
      Node val;
      if (splatIndex == null && obj.isSplat()) {
        target = obj.getFirstChild();
        StringBuilder code = new StringBuilder();
        code.append(olen).append(" <= ").append(vvar).append(".length ? ");
        code.append(scope.useHelper(RuntimeHelper.SLICE)).append(".call(").append(vvar);
        code.append(", ").append(i);
        int rest = olen - i - 1;
        if (rest != 0) {
          String ivar = scope.freshName("i");
          code.append(", ").append(ivar).append(" = ").append(vvar).append(".length - ");
          code.append(rest).append(") : (").append(ivar).append(" = ").append(i).append(", [])");
          splatIndex = ivar + "++";
        } else {
          code.append(") : []");
          splatIndex = "";
        }
        val = IR.js(code.toString());
      } else {
        if (obj.isSplat()) {
          String first = generator.compile(obj.getFirstChild(), o);
          throw generator.error(obj, MULTIPLE_SPLATS, first);
        }
        Node key;
        if (isObject) {
          if (NodeUtil.isObjectProperty(obj)) {
            key = NodeUtil.baseOf(obj.getFirstChild());
            target = obj.getSecondChild();
          } else if (NodeUtil.isThisProperty(obj)) {
            key = IR.name(CodeGenerator.thisPropertyName(obj));
          } else {
            key = NodeUtil.unwrapAll(obj).cloneTree();
          }
        } else {
          key = splatIndex != null ? IR.js(splatIndex) : IR.number(i);
        }
        val = IR.value(IR.name(vvar), accessor(key));
      }
      checkReserved(target, n);
      Node assign =
          IR.assign(target, val)
              .putBooleanProp(Node.Prop.PARAM, param)
              .putBooleanProp(Node.Prop.SUBPATTERN, true);
      assigns.add(generator.compile(assign, o, Level.LIST));
    }
    if (!top && !subpattern) {
      assigns.add(vvar);
    }
    String code = String.join(", ", assigns);
    return o.getLevel().compareTo(Level.LIST) < 0 ? code : "(" + code + ")";
  }

  /** {@code .name} for identifier keys, {@code [key]} for everything else. */
  private static Node accessor(Node key) {
    if (key.isName() && NodeUtil.isIdentifier(key.getString())) {
      return IR.access(key.getString());
    }
    return IR.index(key);
  }

  private void checkReserved(Node target, Node assign) {
    @Nullable String name = NodeUtil.identifierOf(target);
    if (name != null && NodeUtil.RESERVED.contains(name)) {
      throw generator.error(assign, CodeGenerator.RESERVED_NAME, name);
    }
  }
}
