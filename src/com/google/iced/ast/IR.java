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

package com.google.iced.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class. These are the constructors the grammar invokes bottom-up as it
 * reduces; the compiler uses the same methods to synthesize auxiliary fragments.
 */
public final class IR {

  private static final ImmutableMap<String, String> OPERATOR_CONVERSIONS =
      ImmutableMap.of("==", "===", "!=", "!==", "of", "in");

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node block(Node... statements) {
    return block(Arrays.asList(statements));
  }

  public static Node block(List<Node> statements) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : statements) {
      block.addChildToBack(stmt);
    }
    return block;
  }

  /** Wraps {@code node} in a BLOCK unless it already is one. */
  public static Node ensureBlock(Node node) {
    return node.isBlock() ? node : block(node);
  }

  // Literals

  public static Node name(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.NAME, name);
  }

  public static Node number(String raw) {
    return Node.newString(Token.NUMBER, raw);
  }

  public static Node number(long value) {
    return number(Long.toString(value));
  }

  /** A string literal for {@code value}, quoted and escaped. */
  public static Node string(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        default:
          sb.append(c);
      }
    }
    return rawString(sb.append('"').toString());
  }

  /** A string literal whose quoted source text is already known. */
  public static Node rawString(String quoted) {
    checkArgument(quoted.length() >= 2, quoted);
    return Node.newString(Token.STRING, quoted);
  }

  public static Node regexp(String raw) {
    return Node.newString(Token.REGEXP, raw);
  }

  public static Node js(String code) {
    return Node.newString(Token.JS_LITERAL, code);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node undefined() {
    return new Node(Token.UNDEFINED);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node debuggerNode() {
    return new Node(Token.DEBUGGER);
  }

  public static Node comment(String text) {
    return Node.newString(Token.COMMENT, text);
  }

  // Statements

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    return new Node(Token.THROW, expr);
  }

  // Values and property chains

  public static Node value(Node base, Node... properties) {
    Node value = new Node(Token.VALUE, base);
    for (Node prop : properties) {
      checkArgument(isProperty(prop), "Not a property: %s", prop);
      value.addChildToBack(prop);
    }
    return value;
  }

  /** A dotted chain of names: {@code path("a", "b")} is {@code a.b}. */
  public static Node path(String base, String... names) {
    Node value = value(name(base));
    for (String name : names) {
      value.addChildToBack(access(name));
    }
    return value;
  }

  /** {@code @name}. */
  public static Node thisProperty(String name) {
    return value(thisNode(), access(name));
  }

  public static Node access(String name) {
    return new Node(Token.ACCESS, name(name));
  }

  public static Node soakAccess(String name) {
    return access(name).putBooleanProp(Node.Prop.SOAK, true);
  }

  /** {@code ::}, the prototype shorthand. */
  public static Node protoAccess() {
    return access("prototype").putBooleanProp(Node.Prop.PROTO, true);
  }

  public static Node index(Node expr) {
    return new Node(Token.INDEX, expr);
  }

  public static Node soakIndex(Node expr) {
    return index(expr).putBooleanProp(Node.Prop.SOAK, true);
  }

  public static Node slice(Node range) {
    checkArgument(range.isRange(), range);
    return new Node(Token.SLICE, range);
  }

  public static Node range(@Nullable Node from, @Nullable Node to, boolean exclusive) {
    return new Node(Token.RANGE, orEmpty(from), orEmpty(to))
        .putBooleanProp(Node.Prop.EXCLUSIVE, exclusive);
  }

  // Calls

  public static Node call(Node callee, Node... args) {
    return call(callee, Arrays.asList(args));
  }

  public static Node call(Node callee, List<Node> args) {
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newCall(Node callee, Node... args) {
    return call(callee, args).putBooleanProp(Node.Prop.NEW, true);
  }

  public static Node soakCall(Node callee, Node... args) {
    return call(callee, args).putBooleanProp(Node.Prop.SOAK, true);
  }

  public static Node superCall(Node... args) {
    Node call = new Node(Token.SUPER_CALL);
    for (Node arg : args) {
      call.addChildToBack(arg);
    }
    return call;
  }

  /** Bare {@code super}, which forwards the enclosing function's arguments. */
  public static Node implicitSuperCall() {
    return superCall().putBooleanProp(Node.Prop.IMPLICIT_ARGS, true);
  }

  public static Node extendsNode(Node child, Node parent) {
    return new Node(Token.EXTENDS, child, parent);
  }

  // Literals with structure

  public static Node obj(Node... properties) {
    Node obj = new Node(Token.OBJ);
    for (Node prop : properties) {
      obj.addChildToBack(prop);
    }
    return obj;
  }

  /** An object literal property {@code key: value}. */
  public static Node prop(String key, Node value) {
    return assign(value(name(key)), value, "object");
  }

  public static Node arr(Node... elements) {
    return arr(Arrays.asList(elements));
  }

  public static Node arr(List<Node> elements) {
    Node arr = new Node(Token.ARR);
    for (Node e : elements) {
      arr.addChildToBack(e);
    }
    return arr;
  }

  public static Node classNode(@Nullable Node variable, @Nullable Node parent, Node body) {
    return new Node(Token.CLASS, orEmpty(variable), orEmpty(parent), ensureBlock(body));
  }

  public static Node assign(Node target, Node value) {
    return new Node(Token.ASSIGN, target, value);
  }

  /**
   * An assignment with an operator context: {@code "object"} for object literal properties, or a
   * compound operator such as {@code "+="}, {@code "||="} or {@code "?="}.
   */
  public static Node assign(Node target, Node value, @Nullable String context) {
    Node assign = assign(target, value);
    if (context != null && !context.equals("=")) {
      assign.putProp(Node.Prop.CONTEXT, context);
    }
    return assign;
  }

  // Functions

  public static Node code(List<Node> params, Node body) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkArgument(param.isParam(), param);
      paramList.addChildToBack(param);
    }
    return new Node(Token.CODE, paramList, ensureBlock(body));
  }

  public static Node code(Node body) {
    return code(List.of(), body);
  }

  public static Node boundCode(List<Node> params, Node body) {
    return code(params, body).putBooleanProp(Node.Prop.BOUND, true);
  }

  public static Node param(Node name) {
    return new Node(Token.PARAM, name, empty());
  }

  public static Node param(String name) {
    return param(name(name));
  }

  public static Node param(Node name, Node defaultValue) {
    return new Node(Token.PARAM, name, defaultValue);
  }

  public static Node splatParam(Node name) {
    return param(name).putBooleanProp(Node.Prop.SPLAT, true);
  }

  public static Node splat(Node expr) {
    return new Node(Token.SPLAT, expr);
  }

  // Operators

  public static Node op(String operator, Node operand) {
    if (operator.equals("new") && operand.isCall() && !operand.getBooleanProp(Node.Prop.NEW)) {
      return operand.putBooleanProp(Node.Prop.NEW, true);
    }
    Node op = Node.newString(Token.OP, convert(operator));
    op.addChildToBack(operand);
    return op;
  }

  public static Node op(String operator, Node first, Node second) {
    Node op = Node.newString(Token.OP, convert(operator));
    op.addChildToBack(first);
    op.addChildToBack(second);
    return op;
  }

  /** A postfix increment or decrement. */
  public static Node postfix(String operator, Node operand) {
    checkArgument(operator.equals("++") || operator.equals("--"), operator);
    return op(operator, operand).putBooleanProp(Node.Prop.FLIP, true);
  }

  private static String convert(String operator) {
    return OPERATOR_CONVERSIONS.getOrDefault(operator, operator);
  }

  public static Node in(Node object, Node array) {
    return new Node(Token.IN, object, array);
  }

  public static Node notIn(Node object, Node array) {
    return in(object, array).putBooleanProp(Node.Prop.NEGATED, true);
  }

  public static Node existence(Node expr) {
    return new Node(Token.EXISTENCE, expr);
  }

  public static Node parens(Node expr) {
    return new Node(Token.PARENS, expr);
  }

  // Control flow

  public static Node ifNode(Node condition, Node body) {
    return new Node(Token.IF, condition, ensureBlock(body), empty());
  }

  public static Node ifNode(Node condition, Node body, Node elseBody) {
    Node alt = elseBody.isIf() || elseBody.isEmpty() ? elseBody : ensureBlock(elseBody);
    return new Node(Token.IF, condition, ensureBlock(body), alt);
  }

  /** {@code unless cond}: an if with its condition negated. */
  public static Node unless(Node condition, Node body) {
    return ifNode(op("!", parens(condition)), body);
  }

  public static Node whileLoop(Node condition, Node body) {
    return new Node(Token.WHILE, condition, ensureBlock(body), empty());
  }

  public static Node whileLoop(Node condition, Node body, Node guard) {
    return new Node(Token.WHILE, condition, ensureBlock(body), guard);
  }

  /** {@code loop}: an infinite while. */
  public static Node loop(Node body) {
    return whileLoop(trueNode(), body);
  }

  /** {@code for name, index in source}. */
  public static Node forIn(Node body, Node source, @Nullable Node name, @Nullable Node index) {
    return forLoop(body, source, name, index, null, null, false, false);
  }

  /** {@code for key, value of source}. */
  public static Node forOf(Node body, Node source, Node key, @Nullable Node value) {
    return forLoop(body, source, value, key, null, null, true, false);
  }

  public static Node forLoop(
      Node body,
      Node source,
      @Nullable Node name,
      @Nullable Node index,
      @Nullable Node guard,
      @Nullable Node step,
      boolean object,
      boolean own) {
    checkState(!own || object, "`own` requires object iteration");
    return new Node(
            Token.FOR,
            ensureBlock(body),
            source,
            orEmpty(name),
            orEmpty(index),
            orEmpty(guard),
            orEmpty(step))
        .putBooleanProp(Node.Prop.OBJECT, object)
        .putBooleanProp(Node.Prop.OWN, own);
  }

  public static Node switchNode(
      @Nullable Node subject, List<Node> cases, @Nullable Node otherwise) {
    Node sw = new Node(Token.SWITCH, orEmpty(subject));
    for (Node c : cases) {
      checkArgument(c.getToken() == Token.CASE, c);
      sw.addChildToBack(c);
    }
    sw.addChildToBack(otherwise == null ? empty() : ensureBlock(otherwise));
    return sw;
  }

  public static Node caseNode(List<Node> conditions, Node body) {
    checkArgument(!conditions.isEmpty());
    Node c = new Node(Token.CASE);
    for (Node cond : conditions) {
      c.addChildToBack(cond);
    }
    return c.addChildToBack(ensureBlock(body));
  }

  public static Node caseNode(Node condition, Node body) {
    return caseNode(List.of(condition), body);
  }

  public static Node tryNode(
      Node attempt, @Nullable Node error, @Nullable Node recovery, @Nullable Node ensure) {
    return new Node(
        Token.TRY,
        ensureBlock(attempt),
        orEmpty(error),
        recovery == null ? empty() : ensureBlock(recovery),
        ensure == null ? empty() : ensureBlock(ensure));
  }

  // Suspension constructs

  public static Node await(Node body) {
    return new Node(Token.AWAIT, ensureBlock(body));
  }

  public static Node defer(Node... slots) {
    Node defer = new Node(Token.DEFER);
    for (Node slot : slots) {
      defer.addChildToBack(slot);
    }
    return defer;
  }

  /** A call to the continuation named {@code func}, optionally passing a value. */
  public static Node icedTailCall(String func, @Nullable Node value) {
    Node call = Node.newString(Token.ICED_TAIL_CALL, func);
    call.addChildToBack(orEmpty(value));
    return call;
  }

  /** The {@code tameRequire(mode)} directive. */
  public static Node tameRequire(String mode) {
    return Node.newString(Token.ICED_REQUIRE, mode);
  }

  public static Node icedRuntime(boolean foundAwait, boolean foundDefer) {
    return new Node(Token.ICED_RUNTIME)
        .putBooleanProp(Node.Prop.FOUND_AWAIT, foundAwait)
        .putBooleanProp(Node.Prop.FOUND_DEFER, foundDefer);
  }

  private static boolean isProperty(Node n) {
    return n.isAccess() || n.isIndex() || n.isSlice();
  }

  private static Node orEmpty(@Nullable Node n) {
    return n == null ? empty() : n;
  }
}
