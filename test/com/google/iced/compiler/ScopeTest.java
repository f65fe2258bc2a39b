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

import static com.google.common.truth.Truth.assertThat;

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeTest {

  private Scope root;

  @Before
  public void setUp() {
    root = Scope.createRoot(IR.block());
  }

  private Scope child(Scope parent, Node method) {
    return new Scope(parent, method.getLastChild(), method);
  }

  private static Node function(String name) {
    Node fn = IR.code(IR.block());
    return name == null ? fn : fn.putProp(Node.Prop.METHOD_NAME, name);
  }

  @Test
  public void testTemporaryNames() {
    assertThat(Scope.temporary("ref", 0)).isEqualTo("_ref");
    assertThat(Scope.temporary("ref", 2)).isEqualTo("_ref1");
    assertThat(Scope.temporary("i", 0)).isEqualTo("_i");
    assertThat(Scope.temporary("i", 1)).isEqualTo("_j");
  }

  @Test
  public void testFreshNames() {
    assertThat(root.freshName("ref")).isEqualTo("_ref");
    assertThat(root.freshName("ref")).isEqualTo("_ref1");
    assertThat(root.freshName("ref")).isEqualTo("_ref2");
    assertThat(root.freshName("i")).isEqualTo("_i");
    assertThat(root.freshName("i")).isEqualTo("_j");
    assertThat(root.freshName("i")).isEqualTo("_k");
  }

  @Test
  public void testFreshNameWithoutReserving() {
    assertThat(root.freshName("super", false)).isEqualTo("_super");
    assertThat(root.freshName("super", false)).isEqualTo("_super");
    assertThat(root.isDeclared("_super")).isFalse();
  }

  @Test
  public void testFreshNameAvoidsParentNames() {
    root.declare("_i");
    Scope inner = child(root, function("f"));
    assertThat(inner.freshName("i")).isEqualTo("_j");
  }

  @Test
  public void testDeclaredNamesOrder() {
    root.declare("b");
    root.freshName("ref");
    root.declare("a");
    root.declareParameter("p");
    assertThat(root.declaredNames()).containsExactly("a", "b", "_ref").inOrder();
    assertThat(root.hasDeclarations()).isTrue();
    assertThat(root.lookup("p")).isEqualTo(Scope.Kind.PARAM);
  }

  @Test
  public void testArgumentsAlwaysVisible() {
    assertThat(root.lookup("arguments")).isEqualTo(Scope.Kind.ARGUMENTS);
    assertThat(root.declaredNames()).isEmpty();
    assertThat(root.hasDeclarations()).isFalse();
  }

  @Test
  public void testDeclareReportsVisibility() {
    assertThat(root.declare("x")).isFalse();
    Scope inner = child(root, function("f"));
    assertThat(inner.declare("x")).isTrue();
    assertThat(inner.declare("y")).isFalse();
    assertThat(inner.declaredNames()).containsExactly("y");
    assertThat(root.isDeclared("y")).isFalse();
  }

  @Test
  public void testSharedScopeDeclaresInParent() {
    Scope closure = child(root, function(null));
    closure.setShared(true);
    closure.declare("x");
    String temp = closure.freshName("ref");
    assertThat(root.declaredNames()).containsExactly("x");
    assertThat(closure.declaredNames()).containsExactly(temp);
  }

  @Test
  public void testSharedScopeSkipsKnownParameters() {
    root.declare("a");
    Scope closure = child(root, function(null));
    closure.setShared(true);
    closure.declareParameter("a");
    assertThat(root.lookup("a")).isEqualTo(Scope.Kind.VAR);
  }

  @Test
  public void testAssignedNames() {
    root.declare("x");
    root.assign("_this", "this");
    root.assign("_a", "1");
    assertThat(root.assignedNames()).containsExactly("_this = this", "_a = 1").inOrder();
    assertThat(root.hasAssignments()).isTrue();
    assertThat(root.declaredNames()).containsExactly("x");
  }

  @Test
  public void testHelpersLiveInRoot() {
    Scope inner = child(root, function("f"));
    assertThat(inner.useHelper(RuntimeHelper.EXTENDS)).isEqualTo("__extends");
    assertThat(inner.useHelper(RuntimeHelper.EXTENDS)).isEqualTo("__extends");
    assertThat(inner.assignedNames()).isEmpty();
    assertThat(root.assignedNames()).hasSize(2);
    assertThat(root.assignedNames().get(0)).isEqualTo("__hasProp = {}.hasOwnProperty");
    assertThat(root.assignedNames().get(1)).startsWith("__extends = function(child, parent)");
  }

  @Test
  public void testNamedMethod() {
    Node named = function("run");
    Node anonymous = function(null);
    Node generated = function(null).putBooleanProp(Node.Prop.GENERATED, true);
    Scope method = child(root, named);
    Scope callback = child(method, anonymous);
    Scope closure = child(callback, generated);

    assertThat(closure.namedMethod()).isSameInstanceAs(named);
    assertThat(closure.sourceMethod()).isSameInstanceAs(anonymous);
    assertThat(child(root, anonymous.cloneTree()).namedMethod()).isNotNull();
    assertThat(child(root, generated).namedMethod()).isNull();
    assertThat(root.namedMethod()).isNull();
  }

  @Test
  public void testRoot() {
    Scope inner = child(child(root, function("f")), function("g"));
    assertThat(inner.getRoot()).isSameInstanceAs(root);
    assertThat(root.getParent()).isNull();
    assertThat(root.getMethod()).isNull();
  }
}
