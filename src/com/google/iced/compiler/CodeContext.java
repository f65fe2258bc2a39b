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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * The state handed down while emitting a subtree. Instances never change; each descent derives a
 * new context, so siblings never see each other's settings.
 */
@Immutable
public final class CodeContext {

  /**
   * How tightly the surrounding code binds the emitted text, from a statement at the top of a
   * block to the target of a property access. The deeper the level, the more likely the text
   * needs parentheses.
   */
  public enum Level {
    TOP,
    PAREN,
    LIST,
    COND,
    OP,
    ACCESS;

    public boolean atLeast(Level other) {
      return compareTo(other) >= 0;
    }

    public boolean atMost(Level other) {
      return compareTo(other) <= 0;
    }
  }

  @SuppressWarnings("Immutable") // Scopes are mutated only by strictly nested emission calls.
  private final Scope scope;

  private final Level level;
  private final String indent;
  private final String tab;
  private final boolean sharedScope;
  private final boolean existentialEquals;
  private final boolean chainChild;

  private CodeContext(
      Scope scope,
      Level level,
      String indent,
      String tab,
      boolean sharedScope,
      boolean existentialEquals,
      boolean chainChild) {
    this.scope = checkNotNull(scope);
    this.level = checkNotNull(level);
    this.indent = checkNotNull(indent);
    this.tab = tab;
    this.sharedScope = sharedScope;
    this.existentialEquals = existentialEquals;
    this.chainChild = chainChild;
  }

  /** A top-level context for a program compiled in {@code scope}. */
  public static CodeContext create(Scope scope, String indent, String tab) {
    return new CodeContext(scope, Level.TOP, indent, tab, false, false, false);
  }

  public Scope getScope() {
    return scope;
  }

  public Level getLevel() {
    return level;
  }

  public boolean isTop() {
    return level == Level.TOP;
  }

  public String getIndent() {
    return indent;
  }

  /** One step of indentation. */
  public String getTab() {
    return tab;
  }

  /** The next function compiled runs in a scope shared with the current one. */
  public boolean isSharedScope() {
    return sharedScope;
  }

  /** The conditional being compiled implements {@code a ?= b}. */
  public boolean isExistentialEquals() {
    return existentialEquals;
  }

  /** The conditional being compiled follows an {@code else}. */
  public boolean isChainChild() {
    return chainChild;
  }

  public CodeContext withLevel(Level level) {
    return level == this.level
        ? this
        : new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  public CodeContext withIndent(String indent) {
    return new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  /** This context, one indentation step deeper. */
  public CodeContext indented() {
    return withIndent(indent + tab);
  }

  public CodeContext withScope(Scope scope) {
    return new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  public CodeContext withSharedScope(boolean sharedScope) {
    return new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  public CodeContext withExistentialEquals(boolean existentialEquals) {
    return new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  public CodeContext withChainChild(boolean chainChild) {
    return new CodeContext(scope, level, indent, tab, sharedScope, existentialEquals, chainChild);
  }

  @Override
  public String toString() {
    return "CodeContext{level=" + level + ", indent=" + indent.length() + ", scope=" + scope + "}";
  }
}
