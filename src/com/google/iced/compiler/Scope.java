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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.iced.ast.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The variables of one function body, or of the whole program at the root.
 *
 * <p>Scopes are created during emission, one for each function compiled, and linked to their
 * parent for name resolution. A shared scope belongs to a function the compiler synthesized
 * (a closure wrapping a statement, or a continuation): its variables are declared in the parent
 * unless they are compiler temporaries.
 *
 * <p>The root scope also owns the {@link RuntimeHelper}s the compilation has referenced.
 */
public final class Scope {

  /** How a name came to be known in a scope. */
  public enum Kind {
    /** Implicitly available in every function. */
    ARGUMENTS,
    /** Declared with {@code var} at the top of the function. */
    VAR,
    /** A parameter of the function. */
    PARAM,
    /** Declared with {@code var} and initialized in the declaration, as in {@code _this = this}. */
    ASSIGNED,
  }

  private static final class Variable {
    Kind kind;
    @Nullable String value;

    Variable(Kind kind, @Nullable String value) {
      this.kind = kind;
      this.value = value;
    }
  }

  private final @Nullable Scope parent;
  private final Node block;
  private final @Nullable Node method;
  private final Map<String, Variable> variables = new LinkedHashMap<>();
  private final @Nullable EnumSet<RuntimeHelper> helpers;
  private boolean shared;
  private boolean hasAssignments;

  public Scope(@Nullable Scope parent, Node block, @Nullable Node method) {
    this.parent = parent;
    this.block = block;
    this.method = method;
    this.helpers = parent == null ? EnumSet.noneOf(RuntimeHelper.class) : null;
    variables.put("arguments", new Variable(Kind.ARGUMENTS, null));
  }

  /** Creates the scope of a whole program. */
  public static Scope createRoot(Node block) {
    return new Scope(null, block, null);
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  public Scope getRoot() {
    Scope s = this;
    while (s.parent != null) {
      s = s.parent;
    }
    return s;
  }

  /** The block whose {@code var} statement declares this scope's variables. */
  public Node getBlock() {
    return block;
  }

  /** The function that owns this scope, or null at the root. */
  public @Nullable Node getMethod() {
    return method;
  }

  public boolean isShared() {
    return shared;
  }

  void setShared(boolean shared) {
    this.shared = shared;
  }

  /**
   * Records {@code name}. Shared scopes forward to their parent unless {@code immediate} is set.
   */
  public void add(String name, Kind kind, boolean immediate) {
    if (shared && !immediate) {
      parent.add(name, kind, immediate);
      return;
    }
    Variable existing = variables.get(name);
    if (existing != null) {
      existing.kind = kind;
      existing.value = null;
    } else {
      variables.put(name, new Variable(kind, null));
    }
  }

  /**
   * Declares {@code name} as a variable unless it is already visible.
   *
   * @return whether the name was already visible
   */
  public boolean declare(String name) {
    if (isDeclared(name)) {
      return true;
    }
    add(name, Kind.VAR, false);
    return false;
  }

  public void declareParameter(String name) {
    if (shared && parent.isDeclared(name)) {
      return;
    }
    add(name, Kind.PARAM, false);
  }

  /** Whether {@code name} is visible from this scope. */
  public boolean isDeclared(String name) {
    return lookup(name) != null;
  }

  /** The kind {@code name} was declared with in the nearest scope that knows it. */
  public @Nullable Kind lookup(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Variable v = s.variables.get(name);
      if (v != null) {
        return v.kind;
      }
    }
    return null;
  }

  /**
   * Reserves a compiler temporary: {@code _ref}, {@code _ref1}, ... for multi-letter hints;
   * {@code _i}, {@code _j}, ... for single letters.
   */
  public String freshName(String hint) {
    return freshName(hint, true);
  }

  public String freshName(String hint, boolean reserve) {
    int index = 0;
    String temp = temporary(hint, index);
    while (isDeclared(temp)) {
      temp = temporary(hint, ++index);
    }
    if (reserve) {
      add(temp, Kind.VAR, true);
    }
    return temp;
  }

  @VisibleForTesting
  static String temporary(String name, int index) {
    if (name.length() > 1) {
      return "_" + name + (index > 1 ? String.valueOf(index - 1) : "");
    }
    int base = Character.digit(name.charAt(0), 36);
    if (base < 0) {
      return "_" + name + (index > 0 ? String.valueOf(index) : "");
    }
    return "_" + Integer.toString(index + base, 36).replaceAll("\\d", "a");
  }

  /** Declares {@code name} in this scope, initialized to {@code value}. */
  public void assign(String name, String value) {
    Variable existing = variables.get(name);
    if (existing != null) {
      existing.kind = Kind.ASSIGNED;
      existing.value = value;
    } else {
      variables.put(name, new Variable(Kind.ASSIGNED, value));
    }
    hasAssignments = true;
  }

  public boolean hasAssignments() {
    return hasAssignments;
  }

  public boolean hasDeclarations() {
    return !declaredNames().isEmpty();
  }

  /** Variables to declare: user names sorted, then compiler temporaries sorted. */
  public ImmutableList<String> declaredNames() {
    List<String> real = new ArrayList<>();
    List<String> temps = new ArrayList<>();
    for (Map.Entry<String, Variable> e : variables.entrySet()) {
      if (e.getValue().kind == Kind.VAR) {
        (e.getKey().startsWith("_") ? temps : real).add(e.getKey());
      }
    }
    Collections.sort(real);
    Collections.sort(temps);
    return ImmutableList.<String>builder().addAll(real).addAll(temps).build();
  }

  /** Initialized declarations, {@code name = value}, in the order they were made. */
  public ImmutableList<String> assignedNames() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Map.Entry<String, Variable> e : variables.entrySet()) {
      if (e.getValue().kind == Kind.ASSIGNED) {
        builder.add(e.getKey() + " = " + e.getValue().value);
      }
    }
    return builder.build();
  }

  /**
   * The function {@code super} resolves against: the nearest one with a name, else the nearest
   * anonymous function written by the programmer, else null at the top level.
   */
  public @Nullable Node namedMethod() {
    Node anonymous = null;
    for (Scope s = this; s != null; s = s.parent) {
      if (s.method == null) {
        continue;
      }
      if (s.method.getProp(Node.Prop.METHOD_NAME) != null) {
        return s.method;
      }
      if (anonymous == null && !s.method.getBooleanProp(Node.Prop.GENERATED)) {
        anonymous = s.method;
      }
    }
    return anonymous;
  }

  /** The nearest function written by the programmer, skipping compiler-made closures. */
  public @Nullable Node sourceMethod() {
    for (Scope s = this; s != null; s = s.parent) {
      if (s.method != null && !s.method.getBooleanProp(Node.Prop.GENERATED)) {
        return s.method;
      }
    }
    return null;
  }

  /** Declares {@code helper} in the root scope if needed and returns its reference name. */
  public String useHelper(RuntimeHelper helper) {
    Scope root = getRoot();
    checkState(root.helpers != null);
    String ref = helper.reference();
    if (root.helpers.add(helper)) {
      root.assign(ref, helper.source(root));
    }
    return ref;
  }

  @Override
  public String toString() {
    String owner =
        method == null ? "<root>" : String.valueOf(method.getProp(Node.Prop.METHOD_NAME));
    return "Scope(" + owner + ", " + variables.keySet() + ")";
  }
}
