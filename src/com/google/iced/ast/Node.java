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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so that appends are constant time, and the last child's {@code next} is null.
 */
public final class Node {

  /** Typed properties attached to a node. */
  public enum Prop {
    // Soaked access, index or call: a?.b, a?[b], a?()
    SOAK,
    // CALL is a constructor invocation
    NEW,
    // RANGE excludes its upper bound (a...b)
    EXCLUSIVE,
    // SUPER_CALL written as bare `super`, forwarding `arguments`
    IMPLICIT_ARGS,
    // OBJ built from an implicit (brace-less) object, or CODE synthesized by the compiler
    GENERATED,
    // ASSIGN operator context: null for '=', "object", "+=", "||=", ...
    CONTEXT,
    // ASSIGN declares its target in the innermost scope even when shadowing
    LOCAL,
    // CODE declared with the fat arrow
    BOUND,
    // PARAM collects the remaining arguments
    SPLAT,
    // OP is postfix
    FLIP,
    // IN / EXISTENCE is negated
    NEGATED,
    // FOR own k of obj
    OWN,
    // FOR iterates object keys (`of`)
    OBJECT,
    // IF written in postfix or `unless` form by the parser
    STATEMENT,
    // WHILE / FOR collects its body values into a results array
    RETURNS,
    // ASSIGN target is a destructuring sub-pattern
    SUBPATTERN,
    // ASSIGN produced from a function parameter
    PARAM,
    // ICED_RUNTIME: the tree contains an await
    FOUND_AWAIT,
    // ICED_RUNTIME: the tree contains a defer
    FOUND_DEFER,
    // ICED_RUNTIME: resolved runtime mode name
    RUNTIME_MODE,
    // CODE: name the function is known by (class method, constructor or assigned variable)
    METHOD_NAME,
    // CODE: name of the class that owns the method
    CLASS_NAME,
    // CODE: static class member
    STATIC,
    // CODE: class constructor
    CTOR,
    // CODE: body must not get an implicit return
    NO_RETURN,
    // ACCESS: written with `::`
    PROTO,
  }

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable String string;
  private @Nullable Map<Prop, Object> props;

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    checkArgument(token.hasStringPayload(), token);
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  public void setToken(Token token) {
    this.token = checkNotNull(token);
  }

  public String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public void setString(String str) {
    checkState(token.hasStringPayload(), token);
    this.string = checkNotNull(str);
  }

  // Structure

  public boolean hasChildren() {
    return first != null;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public boolean hasParent() {
    return parent != null;
  }

  /** Gets the ith child; this is O(N) in the number of children. */
  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkState(n != null, "No child at index");
      n = n.next;
      i--;
    }
    checkState(n != null, "No child at index");
    return n;
  }

  public int getIndexOfChild(Node child) {
    int i = 0;
    for (Node n = first; n != null; n = n.next) {
      if (n == child) {
        return i;
      }
      i++;
    }
    return -1;
  }

  public int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public boolean hasMoreThanOneChild() {
    return first != null && first.next != null;
  }

  public boolean isDescendantOf(Node node) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** A live view of the children. Do not detach the current child while iterating. */
  public Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node n = current;
            current = current.next;
            return n;
          }
        };
  }

  /** A snapshot of the children, safe to iterate while the tree is being rewritten. */
  public ImmutableList<Node> childList() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = first; n != null; n = n.next) {
      builder.add(n);
    }
    return builder.build();
  }

  @CanIgnoreReturnValue
  public Node addChildToFront(Node child) {
    child.detachIfAttached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
    return this;
  }

  @CanIgnoreReturnValue
  public Node addChildToBack(Node child) {
    child.detachIfAttached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    return this;
  }

  @CanIgnoreReturnValue
  public Node addChildrenToBack(Iterable<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
    return this;
  }

  /** Moves this node to be the next sibling of {@code existing}. */
  public void insertAfter(Node existing) {
    existing.checkAttached();
    this.detachIfAttached();
    Node existingParent = existing.parent;
    Node existingNext = existing.next;
    this.parent = existingParent;
    existing.next = this;
    this.previous = existing;
    if (existingNext == null) {
      existingParent.first.previous = this;
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  /** Moves this node to be the previous sibling of {@code existing}. */
  public void insertBefore(Node existing) {
    existing.checkAttached();
    this.detachIfAttached();
    Node existingParent = existing.parent;
    if (existingParent.first == existing) {
      existingParent.addChildToFront(this);
      return;
    }
    Node existingPrevious = existing.previous;
    this.parent = existingParent;
    this.next = existing;
    this.previous = existingPrevious;
    existing.previous = this;
    existingPrevious.next = this;
  }

  /** Swaps {@code replacement} and its subtree into the position of this node. */
  public void replaceWith(Node replacement) {
    checkAttached();
    if (replacement == this) {
      return;
    }
    checkArgument(!isDescendantOf(replacement), "Cannot replace a node with its ancestor");
    replacement.detachIfAttached();
    replacement.srcrefIfMissing(this);
    Node existingNext = next;
    Node existingParent = parent;
    detach();
    if (existingNext == null) {
      existingParent.addChildToBack(replacement);
    } else {
      replacement.insertBefore(existingNext);
    }
  }

  /** Removes this node from its parent, retaining its subtree. */
  @CanIgnoreReturnValue
  public Node detach() {
    checkAttached();
    Node existingParent = parent;
    Node existingNext = next;
    Node existingPrevious = previous;

    if (existingParent.first == this) {
      existingParent.first = existingNext;
      if (existingNext != null) {
        existingNext.previous = existingPrevious == this ? existingNext : existingPrevious;
      }
    } else {
      existingPrevious.next = existingNext;
      if (existingNext == null) {
        existingParent.first.previous = existingPrevious;
      } else {
        existingNext.previous = existingPrevious;
      }
    }
    parent = null;
    next = null;
    previous = null;
    return this;
  }

  /** Detaches every child and returns them in order. */
  public ImmutableList<Node> removeChildren() {
    ImmutableList<Node> children = childList();
    for (Node child : children) {
      child.detach();
    }
    return children;
  }

  /** Detaches and returns the children that follow {@code child}. */
  public ImmutableList<Node> removeChildrenAfter(Node child) {
    checkArgument(child.parent == this, "Not a child: %s", child);
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    while (child.next != null) {
      builder.add(child.next.detach());
    }
    return builder.build();
  }

  private void checkAttached() {
    checkState(parent != null, "Has no parent: %s", this);
  }

  /** Nodes are owned by exactly one parent; attaching an attached node moves it. */
  private void detachIfAttached() {
    if (parent != null) {
      detach();
    }
  }

  // Properties

  public @Nullable Object getProp(Prop prop) {
    return props == null ? null : props.get(prop);
  }

  public boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(getProp(prop));
  }

  @CanIgnoreReturnValue
  public Node putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      if (props != null) {
        props.remove(prop);
      }
      return this;
    }
    if (props == null) {
      props = new EnumMap<>(Prop.class);
    }
    props.put(prop, value);
    return this;
  }

  @CanIgnoreReturnValue
  public Node putBooleanProp(Prop prop, boolean value) {
    return putProp(prop, value ? Boolean.TRUE : null);
  }

  // Source position

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Copies the source position of {@code other}. */
  @CanIgnoreReturnValue
  public Node srcref(Node other) {
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  @CanIgnoreReturnValue
  public Node srcrefIfMissing(Node other) {
    if (lineno < 0) {
      srcref(other);
    }
    return this;
  }

  // Copies

  /** Returns a detached deep copy of this subtree, properties and positions included. */
  public Node cloneTree() {
    Node copy = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      copy.addChildToBack(c.cloneTree());
    }
    return copy;
  }

  /** Returns a detached shallow copy of this node. */
  public Node cloneNode() {
    Node copy = new Node(token);
    copy.string = string;
    if (props != null) {
      copy.props = new EnumMap<>(props);
    }
    copy.lineno = lineno;
    copy.charno = charno;
    return copy;
  }

  // Kind predicates

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isString() {
    return token == Token.STRING;
  }

  public boolean isThis() {
    return token == Token.THIS;
  }

  public boolean isComment() {
    return token == Token.COMMENT;
  }

  public boolean isReturn() {
    return token == Token.RETURN;
  }

  public boolean isValue() {
    return token == Token.VALUE;
  }

  public boolean isAccess() {
    return token == Token.ACCESS;
  }

  public boolean isIndex() {
    return token == Token.INDEX;
  }

  public boolean isSlice() {
    return token == Token.SLICE;
  }

  public boolean isRange() {
    return token == Token.RANGE;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isObj() {
    return token == Token.OBJ;
  }

  public boolean isArr() {
    return token == Token.ARR;
  }

  public boolean isClass() {
    return token == Token.CLASS;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isCode() {
    return token == Token.CODE;
  }

  public boolean isParam() {
    return token == Token.PARAM;
  }

  public boolean isSplat() {
    return token == Token.SPLAT;
  }

  public boolean isWhile() {
    return token == Token.WHILE;
  }

  public boolean isFor() {
    return token == Token.FOR;
  }

  public boolean isOp() {
    return token == Token.OP;
  }

  public boolean isParens() {
    return token == Token.PARENS;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isSwitch() {
    return token == Token.SWITCH;
  }

  public boolean isAwait() {
    return token == Token.AWAIT;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isLoop() {
    return token == Token.WHILE || token == Token.FOR;
  }

  /** Whether this is a NAME with the given identifier. */
  public boolean matchesName(String name) {
    return token == Token.NAME && name.equals(string);
  }

  // Debugging

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (props != null) {
      for (Map.Entry<Prop, Object> e : props.entrySet()) {
        sb.append(" [").append(e.getKey().name().toLowerCase());
        if (!Boolean.TRUE.equals(e.getValue())) {
          sb.append(": ").append(e.getValue());
        }
        sb.append(']');
      }
    }
    if (lineno >= 0) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }
}
