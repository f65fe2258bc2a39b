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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import com.google.iced.ast.Token;
import com.google.iced.compiler.CodeContext.Level;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  /** A valid identifier in the target language. */
  static final Pattern IDENTIFIER =
      Pattern.compile("^[$A-Za-z_\\x7f-\\uffff][$\\w\\x7f-\\uffff]*$");

  /** An integer literal, optionally signed. */
  static final Pattern SIMPLENUM = Pattern.compile("^[+-]?\\d+$");

  /** Names that cannot be declared in strict code. */
  static final ImmutableSet<String> STRICT_PROSCRIBED = ImmutableSet.of("arguments", "eval");

  static final ImmutableSet<String> JS_KEYWORDS =
      ImmutableSet.of(
          "true", "false", "null", "this", "new", "delete", "typeof", "in", "instanceof",
          "return", "throw", "break", "continue", "debugger", "if", "else", "switch", "for",
          "while", "do", "try", "catch", "finally", "class", "extends", "super");

  /** Names that may not be assigned to or declared. */
  static final ImmutableSet<String> RESERVED =
      ImmutableSet.<String>builder()
          .addAll(JS_KEYWORDS)
          .add("undefined", "then", "unless", "until", "loop", "of", "by", "when")
          .add("and", "or", "is", "isnt", "not", "yes", "no", "on", "off")
          .add("case", "default", "function", "var", "void", "with", "const", "let", "enum")
          .add("export", "import", "native", "implements", "interface", "package", "private")
          .add("protected", "public", "static", "yield")
          .add("__hasProp", "__extends", "__slice", "__bind", "__indexOf")
          .add("await", "defer")
          .addAll(STRICT_PROSCRIBED)
          .build();

  private static final ImmutableMap<String, String> INVERSIONS =
      ImmutableMap.of("!==", "===", "===", "!==");

  private static final ImmutableSet<String> CHAINABLE =
      ImmutableSet.of("<", ">", ">=", "<=", "===", "!==");

  private NodeUtil() {}

  static boolean isIdentifier(String s) {
    return IDENTIFIER.matcher(s).matches();
  }

  static boolean isSimpleNumber(String s) {
    return SIMPLENUM.matcher(s).matches();
  }

  /** Whether {@code n} can only be emitted as a statement, given no particular level. */
  public static boolean isStatement(Node n) {
    return isStatement(n, null);
  }

  /** Whether {@code n} can only be emitted as a statement when compiled at {@code level}. */
  public static boolean isStatement(Node n, @Nullable Level level) {
    switch (n.getToken()) {
      case BLOCK:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (isStatement(child, level)) {
            return true;
          }
        }
        return false;
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
      case COMMENT:
      case RETURN:
      case THROW:
      case WHILE:
      case FOR:
      case SWITCH:
      case TRY:
      case AWAIT:
      case ICED_RUNTIME:
      case ICED_REQUIRE:
        return true;
      case CODE:
        return n.getBooleanProp(Node.Prop.CTOR);
      case VALUE:
        return !hasProperties(n) && isStatement(n.getFirstChild(), level);
      case ASSIGN:
        {
          String context = (String) n.getProp(Node.Prop.CONTEXT);
          return level == Level.TOP && context != null && context.contains("?");
        }
      case ICED_TAIL_CALL:
        return level == Level.TOP;
      case IF:
        return level == Level.TOP
            || isStatement(n.getSecondChild(), level)
            || isStatement(n.getLastChild(), level);
      default:
        return false;
    }
  }

  /**
   * Returns the jump that escapes {@code n}: a {@code return}, or a {@code break} or
   * {@code continue} with nothing around it to absorb it.
   */
  public static @Nullable Node jumps(Node n) {
    return jumps(n, false, false);
  }

  static @Nullable Node jumps(Node n, boolean inLoop, boolean inBlock) {
    switch (n.getToken()) {
      case BLOCK:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          Node jump = jumps(child, inLoop, inBlock);
          if (jump != null) {
            return jump;
          }
        }
        return null;
      case BREAK:
        return inLoop || inBlock ? null : n;
      case CONTINUE:
        return inLoop ? null : n;
      case RETURN:
        return n;
      case VALUE:
        return hasProperties(n) ? null : jumps(n.getFirstChild(), inLoop, inBlock);
      case WHILE:
      case FOR:
        return jumps(loopBody(n), true, false);
      case SWITCH:
        {
          boolean block = inLoop || inBlock ? inBlock : true;
          for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
            Node body = c.getToken() == Token.CASE ? c.getLastChild() : c;
            Node jump = jumps(body, inLoop, block);
            if (jump != null) {
              return jump;
            }
          }
          return null;
        }
      case IF:
        {
          Node jump = jumps(n.getSecondChild(), inLoop, inBlock);
          return jump != null ? jump : jumps(n.getLastChild(), inLoop, inBlock);
        }
      case TRY:
        {
          Node jump = jumps(n.getFirstChild(), inLoop, inBlock);
          return jump != null ? jump : jumps(n.getChildAtIndex(2), inLoop, inBlock);
        }
      default:
        return null;
    }
  }

  /** Whether evaluating {@code n} twice could differ from evaluating it once. */
  public static boolean isComplex(Node n) {
    switch (n.getToken()) {
      case NAME:
      case NUMBER:
      case STRING:
      case REGEXP:
      case JS_LITERAL:
      case THIS:
      case NULL:
      case UNDEFINED:
      case TRUE:
      case FALSE:
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
      case ACCESS:
        return false;
      case VALUE:
        return hasProperties(n) || isComplex(n.getFirstChild());
      case INDEX:
      case PARENS:
      case SPLAT:
        return isComplex(n.getFirstChild());
      case PARAM:
        return isComplex(n.getFirstChild());
      case OP:
        {
          // -1 and +x are as simple as their operand.
          String op = n.getString();
          return !(n.hasOneChild() && (op.equals("+") || op.equals("-")))
              || isComplex(n.getFirstChild());
        }
      default:
        return true;
    }
  }

  /** Whether {@code n} can appear on the left of an assignment. */
  public static boolean isAssignable(Node n) {
    switch (n.getToken()) {
      case NAME:
        return isIdentifier(n.getString());
      case VALUE:
        return hasProperties(n) || isAssignable(n.getFirstChild());
      case SPLAT:
        return isAssignable(n.getFirstChild());
      case ARR:
        for (Node e = n.getFirstChild(); e != null; e = e.getNext()) {
          if (!isAssignable(e)) {
            return false;
          }
        }
        return true;
      case OBJ:
        for (Node prop = n.getFirstChild(); prop != null; prop = prop.getNext()) {
          Node target = isObjectProperty(prop) ? prop.getSecondChild() : prop;
          if (!target.isComment() && !isAssignable(target)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} assigns to the plain variable {@code name}. */
  public static boolean assigns(Node n, String name) {
    switch (n.getToken()) {
      case NAME:
        return name.equals(n.getString());
      case VALUE:
        return !hasProperties(n) && assigns(n.getFirstChild(), name);
      case ASSIGN:
        return assigns(isObjectProperty(n) ? n.getSecondChild() : n.getFirstChild(), name);
      case PARAM:
      case SPLAT:
        return assigns(n.getFirstChild(), name);
      case ARR:
      case OBJ:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          if (assigns(c, name)) {
            return true;
          }
        }
        return false;
      default:
        return false;
    }
  }

  /** Strips one layer of wrapping: a property-less value, parentheses or a one-child block. */
  public static Node unwrap(Node n) {
    switch (n.getToken()) {
      case VALUE:
        return hasProperties(n) ? n : n.getFirstChild();
      case PARENS:
        return n.getFirstChild();
      case BLOCK:
        return n.hasOneChild() ? n.getFirstChild() : n;
      default:
        return n;
    }
  }

  public static Node unwrapAll(Node n) {
    Node unwrapped = unwrap(n);
    while (unwrapped != n) {
      n = unwrapped;
      unwrapped = unwrap(n);
    }
    return n;
  }

  /** The identifier {@code n} reduces to, or null if it is not a plain name. */
  static @Nullable String identifierOf(Node n) {
    Node base = unwrapAll(n);
    return base.isName() ? base.getString() : null;
  }

  static boolean hasProperties(Node value) {
    return value.isValue() && value.hasMoreThanOneChild();
  }

  /** The base of a VALUE, or the node itself. */
  static Node baseOf(Node n) {
    return n.isValue() ? n.getFirstChild() : n;
  }

  static boolean isArray(Node n) {
    return !hasProperties(n) && baseOf(n).isArr();
  }

  static boolean isObject(Node n) {
    return !hasProperties(n) && baseOf(n).isObj();
  }

  /** {@code a[i..j]} as an assignment target. */
  static boolean isSplice(Node n) {
    return hasProperties(n) && n.getLastChild().isSlice();
  }

  /** {@code @name}. */
  static boolean isThisProperty(Node n) {
    return n.isValue() && n.getFirstChild().isThis() && n.getChildCount() == 2
        && n.getLastChild().isAccess();
  }

  /** A value with no soaks and no calls anywhere in its chain. */
  static boolean isAtomic(Node value) {
    for (Node c = value.getFirstChild(); c != null; c = c.getNext()) {
      if (c.getBooleanProp(Node.Prop.SOAK) || c.isCall()) {
        return false;
      }
    }
    return true;
  }

  static boolean isObjectProperty(Node n) {
    return n.isAssign() && "object".equals(n.getProp(Node.Prop.CONTEXT));
  }

  static boolean isChainable(Node n) {
    return n.isOp() && n.hasMoreThanOneChild() && CHAINABLE.contains(n.getString());
  }

  static boolean isUnary(Node n) {
    return n.isOp() && n.hasOneChild();
  }

  /** The statements a loop repeats. */
  static Node loopBody(Node loop) {
    checkState(loop.isLoop(), loop);
    return loop.isWhile() ? loop.getSecondChild() : loop.getFirstChild();
  }

  static @Nullable Node lastNonComment(Node block) {
    for (Node c = block.getLastChild(); c != null; c = c.getPrevious()) {
      if (!c.isComment()) {
        return c;
      }
    }
    return null;
  }

  /**
   * Replaces {@code n} with {@code rewrite.apply(n)}. The rewrite sees {@code n} detached and may
   * build it into the node it returns.
   */
  static Node substitute(Node n, Function<Node, Node> rewrite) {
    Node placeholder = null;
    if (n.hasParent()) {
      placeholder = IR.empty();
      n.replaceWith(placeholder);
    }
    Node result = rewrite.apply(n);
    if (placeholder != null) {
      placeholder.replaceWith(result);
    }
    return result;
  }

  /**
   * Pushes the value of {@code n} out through a {@code return}, or, when {@code accumulator} is
   * given, through a call to {@code accumulator.push}. Rewrites in place and returns the node that
   * now stands where {@code n} was.
   */
  public static Node makeReturn(Node n, @Nullable String accumulator) {
    switch (n.getToken()) {
      case BLOCK:
        {
          Node last = lastNonComment(n);
          if (last != null) {
            Node result = substitute(last, e -> makeReturn(e, accumulator));
            if (result.isReturn() && !result.hasChildren()) {
              result.detach();
            }
          }
          return n;
        }
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
      case COMMENT:
      case RETURN:
      case THROW:
      case AWAIT:
      case ICED_TAIL_CALL:
      case ICED_RUNTIME:
      case ICED_REQUIRE:
      case EMPTY:
        return n;
      case IF:
        {
          if (accumulator != null && n.getLastChild().isEmpty()) {
            n.getLastChild().replaceWith(IR.block(IR.undefined()));
          }
          makeReturn(n.getSecondChild(), accumulator);
          if (!n.getLastChild().isEmpty()) {
            makeReturn(n.getLastChild(), accumulator);
          }
          return n;
        }
      case SWITCH:
        {
          for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
            if (c.getToken() == Token.CASE) {
              makeReturn(c.getLastChild(), accumulator);
            }
          }
          Node otherwise = n.getLastChild();
          if (accumulator != null && otherwise.isEmpty()) {
            otherwise.replaceWith(otherwise = IR.block(IR.undefined()));
          }
          if (otherwise.isBlock()) {
            makeReturn(otherwise, accumulator);
          }
          return n;
        }
      case TRY:
        makeReturn(n.getFirstChild(), accumulator);
        if (n.getChildAtIndex(2).isBlock()) {
          makeReturn(n.getChildAtIndex(2), accumulator);
        }
        return n;
      case VALUE:
        if (!hasProperties(n) && isStatement(n.getFirstChild())) {
          substitute(n.getFirstChild(), e -> makeReturn(e, accumulator));
          return n;
        }
        return pushValue(n, accumulator);
      case WHILE:
      case FOR:
        if (accumulator == null) {
          n.putBooleanProp(Node.Prop.RETURNS, jumps(loopBody(n), true, false) == null);
          return n;
        }
        return pushValue(n, accumulator);
      default:
        return pushValue(n, accumulator);
    }
  }

  private static Node pushValue(Node n, @Nullable String accumulator) {
    Node value = unwrapAll(n);
    return accumulator != null
        ? IR.call(IR.path(accumulator, "push"), value)
        : IR.returnNode(value);
  }

  /** Returns the logical negation of {@code n}, rewriting in place where possible. */
  public static Node invert(Node n) {
    return substitute(n, NodeUtil::negate);
  }

  private static Node negate(Node n) {
    switch (n.getToken()) {
      case IN:
      case EXISTENCE:
        return n.putBooleanProp(Node.Prop.NEGATED, !n.getBooleanProp(Node.Prop.NEGATED));
      case OP:
        {
          String op = n.getString();
          if (n.hasMoreThanOneChild()) {
            if (INVERSIONS.containsKey(op) && !isChainable(n.getFirstChild())) {
              n.setString(INVERSIONS.get(op));
              return n;
            }
            return IR.op("!", IR.parens(n));
          }
          Node operand = unwrap(n.getFirstChild());
          if (op.equals("!")
              && operand.isOp()
              && !operand.getString().equals("!")
              && !operand.getString().equals("in")
              && !operand.getString().equals("instanceof")) {
            return operand.detach();
          }
          return IR.op("!", n);
        }
      default:
        return IR.op("!", n);
    }
  }
}
