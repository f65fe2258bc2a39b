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
import com.google.iced.compiler.NodeTraversal.AbstractPostOrderCallback;
import com.google.iced.compiler.NodeTraversal.AbstractShallowCallback;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  private static final class Recorder extends AbstractPostOrderCallback {
    final List<String> visited = new ArrayList<>();
    final List<Node> enclosing = new ArrayList<>();

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isName()) {
        visited.add(n.getString());
        enclosing.add(t.getEnclosingFunction());
      }
    }
  }

  @Test
  public void testPostOrder() {
    Recorder recorder = new Recorder();
    Node root = IR.block(IR.op("+", IR.name("a"), IR.name("b")), IR.name("c"));
    NodeTraversal.traverse(root, recorder);
    assertThat(recorder.visited).containsExactly("a", "b", "c").inOrder();
  }

  @Test
  public void testEnclosingFunction() {
    Node fn = IR.code(IR.block(IR.name("inner")));
    Node root = IR.block(IR.name("outer"), IR.assign(IR.name("f"), fn));
    Recorder recorder = new Recorder();
    NodeTraversal.traverse(root, recorder);
    assertThat(recorder.visited).containsExactly("outer", "f", "inner").inOrder();
    assertThat(recorder.enclosing.get(0)).isNull();
    assertThat(recorder.enclosing.get(1)).isNull();
    assertThat(recorder.enclosing.get(2)).isSameInstanceAs(fn);
  }

  @Test
  public void testFunctionIsItsOwnEnclosingFunction() {
    Node fn = IR.code(IR.block());
    List<Node> seen = new ArrayList<>();
    NodeTraversal.traverse(
        IR.block(fn),
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isCode()) {
              seen.add(t.getEnclosingFunction());
              assertThat(t.getFunctionDepth()).isEqualTo(1);
            }
          }
        });
    assertThat(seen).containsExactly(fn);
  }

  @Test
  public void testShallowCallbackSkipsNestedFunctions() {
    List<Node> visited = new ArrayList<>();
    Node fn = IR.code(IR.block(IR.name("hidden")));
    Node root = IR.block(IR.name("seen"), fn);
    NodeTraversal.traverse(
        root,
        new AbstractShallowCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            visited.add(n);
          }
        });
    assertThat(visited).contains(fn);
    assertThat(visited).contains(root.getFirstChild());
    assertThat(visited).doesNotContain(fn.getLastChild());
  }

  @Test
  public void testCallbackMayReplaceVisitedNode() {
    Node root = IR.block(IR.name("a"), IR.name("b"));
    NodeTraversal.traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName()) {
              n.replaceWith(IR.parens(IR.name(n.getString() + "1")));
            }
          }
        });
    assertThat(root.getChildCount()).isEqualTo(2);
    assertThat(root.getLastChild().getFirstChild().getString()).isEqualTo("b1");
  }

  @Test
  public void testContains() {
    Node fn = IR.code(IR.block(IR.name("deep")));
    Node root = IR.block(IR.assign(IR.name("f"), fn));
    assertThat(NodeTraversal.contains(root, n -> n.matchesName("f"))).isTrue();
    assertThat(NodeTraversal.contains(root, n -> n.matchesName("deep"))).isFalse();
    assertThat(NodeTraversal.contains(root, Node::isCode)).isTrue();
    assertThat(NodeTraversal.containsCrossScope(root, n -> n.matchesName("deep"))).isTrue();
  }
}
