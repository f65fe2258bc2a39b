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
import com.google.iced.ast.Token;
import com.google.iced.compiler.CodeContext.Level;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  private static Node name(String name) {
    return IR.name(name);
  }

  @Test
  public void testIsStatement() {
    assertThat(NodeUtil.isStatement(IR.returnNode())).isTrue();
    assertThat(NodeUtil.isStatement(IR.whileLoop(name("c"), IR.block()))).isTrue();
    assertThat(NodeUtil.isStatement(IR.value(name("x")))).isFalse();
    assertThat(NodeUtil.isStatement(IR.value(IR.parens(name("x"))))).isFalse();
    assertThat(NodeUtil.isStatement(IR.code(IR.block()))).isFalse();
    assertThat(NodeUtil.isStatement(IR.code(IR.block()).putBooleanProp(Node.Prop.CTOR, true)))
        .isTrue();
  }

  @Test
  public void testConditionalAssignmentIsStatementOnlyAtTop() {
    Node assign = IR.assign(name("a"), name("b"), "?=");
    assertThat(NodeUtil.isStatement(assign, Level.TOP)).isTrue();
    assertThat(NodeUtil.isStatement(assign, Level.LIST)).isFalse();
    assertThat(NodeUtil.isStatement(IR.assign(name("a"), name("b"), "||="), Level.TOP)).isFalse();
  }

  @Test
  public void testIfIsStatementWhenABranchIs() {
    Node expression = IR.ifNode(name("c"), IR.block(name("a")), IR.block(name("b")));
    assertThat(NodeUtil.isStatement(expression, Level.TOP)).isTrue();
    assertThat(NodeUtil.isStatement(expression, Level.LIST)).isFalse();

    Node returning = IR.ifNode(name("c"), IR.block(IR.returnNode(name("a"))));
    assertThat(NodeUtil.isStatement(returning, Level.LIST)).isTrue();
  }

  @Test
  public void testTailCallIsStatementAtTop() {
    Node call = IR.icedTailCall("k", null);
    assertThat(NodeUtil.isStatement(call, Level.TOP)).isTrue();
    assertThat(NodeUtil.isStatement(call, Level.LIST)).isFalse();
  }

  @Test
  public void testJumps() {
    Node ret = IR.returnNode();
    assertThat(NodeUtil.jumps(IR.block(name("a"), ret))).isSameInstanceAs(ret);

    Node brk = IR.breakNode();
    assertThat(NodeUtil.jumps(IR.block(brk))).isSameInstanceAs(brk);
    assertThat(NodeUtil.jumps(IR.block(IR.loop(IR.block(IR.breakNode()))))).isNull();

    Node inner = IR.returnNode(name("x"));
    assertThat(NodeUtil.jumps(IR.block(IR.loop(IR.block(inner))))).isSameInstanceAs(inner);
  }

  @Test
  public void testSwitchAbsorbsBreakButNotContinue() {
    Node cases = IR.caseNode(name("a"), IR.block(IR.breakNode()));
    assertThat(NodeUtil.jumps(IR.switchNode(name("x"), List.of(cases), null))).isNull();

    Node cont = IR.continueNode();
    Node other = IR.caseNode(name("a"), IR.block(cont));
    assertThat(NodeUtil.jumps(IR.switchNode(name("x"), List.of(other), null)))
        .isSameInstanceAs(cont);
  }

  @Test
  public void testIsComplex() {
    assertThat(NodeUtil.isComplex(name("a"))).isFalse();
    assertThat(NodeUtil.isComplex(IR.number(1))).isFalse();
    assertThat(NodeUtil.isComplex(IR.value(name("a")))).isFalse();
    assertThat(NodeUtil.isComplex(IR.op("-", IR.number(1)))).isFalse();
    assertThat(NodeUtil.isComplex(IR.path("a", "b"))).isTrue();
    assertThat(NodeUtil.isComplex(IR.op("+", name("a"), name("b")))).isTrue();
    assertThat(NodeUtil.isComplex(IR.op("!", name("a")))).isTrue();
    assertThat(NodeUtil.isComplex(IR.call(IR.value(name("f"))))).isTrue();
  }

  @Test
  public void testIsAssignable() {
    assertThat(NodeUtil.isAssignable(name("a"))).isTrue();
    assertThat(NodeUtil.isAssignable(IR.number(1))).isFalse();
    assertThat(NodeUtil.isAssignable(IR.path("a", "b"))).isTrue();
    assertThat(NodeUtil.isAssignable(IR.arr(name("a"), IR.splat(name("b"))))).isTrue();
    assertThat(NodeUtil.isAssignable(IR.arr(name("a"), IR.number(1)))).isFalse();
    assertThat(NodeUtil.isAssignable(IR.obj(IR.prop("k", name("v"))))).isTrue();
    assertThat(NodeUtil.isAssignable(IR.call(IR.value(name("f"))))).isFalse();
  }

  @Test
  public void testAssigns() {
    Node pattern = IR.arr(name("a"), IR.obj(IR.prop("k", name("v"))), IR.splat(name("rest")));
    assertThat(NodeUtil.assigns(pattern, "a")).isTrue();
    assertThat(NodeUtil.assigns(pattern, "v")).isTrue();
    assertThat(NodeUtil.assigns(pattern, "rest")).isTrue();
    assertThat(NodeUtil.assigns(pattern, "k")).isFalse();
    assertThat(NodeUtil.assigns(IR.path("a", "b"), "a")).isFalse();
  }

  @Test
  public void testUnwrapAll() {
    Node x = name("x");
    assertThat(NodeUtil.unwrapAll(IR.value(IR.parens(IR.block(x))))).isSameInstanceAs(x);
    Node chain = IR.path("a", "b");
    assertThat(NodeUtil.unwrapAll(chain)).isSameInstanceAs(chain);
    Node block = IR.block(name("a"), name("b"));
    assertThat(NodeUtil.unwrapAll(block)).isSameInstanceAs(block);
  }

  @Test
  public void testIdentifierOf() {
    assertThat(NodeUtil.identifierOf(IR.value(IR.parens(name("x"))))).isEqualTo("x");
    assertThat(NodeUtil.identifierOf(IR.path("a", "b"))).isNull();
  }

  @Test
  public void testIsThisProperty() {
    assertThat(NodeUtil.isThisProperty(IR.thisProperty("x"))).isTrue();
    Node deeper = IR.thisProperty("x");
    deeper.addChildToBack(IR.access("y"));
    assertThat(NodeUtil.isThisProperty(deeper)).isFalse();
    assertThat(NodeUtil.isThisProperty(IR.path("a", "x"))).isFalse();
  }

  @Test
  public void testInvertComparison() {
    Node eq = IR.op("==", name("a"), name("b"));
    Node block = IR.block(eq);
    Node inverted = NodeUtil.invert(eq);
    assertThat(inverted).isSameInstanceAs(eq);
    assertThat(inverted.getString()).isEqualTo("!==");
    assertThat(block.getFirstChild()).isSameInstanceAs(inverted);
  }

  @Test
  public void testInvertWrapsOtherOperators() {
    Node lt = IR.op("<", name("a"), name("b"));
    Node block = IR.block(lt);
    Node inverted = NodeUtil.invert(lt);
    assertThat(inverted.getString()).isEqualTo("!");
    assertThat(inverted.getFirstChild().isParens()).isTrue();
    assertThat(inverted.getFirstChild().getFirstChild()).isSameInstanceAs(lt);
    assertThat(block.getFirstChild()).isSameInstanceAs(inverted);
  }

  @Test
  public void testInvertRemovesNegation() {
    Node sum = IR.op("+", name("a"), name("b"));
    assertThat(NodeUtil.invert(IR.op("!", sum))).isSameInstanceAs(sum);

    Node in = IR.in(name("a"), name("b"));
    assertThat(NodeUtil.invert(IR.op("!", in)).getString()).isEqualTo("!");
  }

  @Test
  public void testInvertFlipsNegatedNodes() {
    Node existence = IR.existence(name("a"));
    assertThat(NodeUtil.invert(existence).getBooleanProp(Node.Prop.NEGATED)).isTrue();
    Node notIn = IR.notIn(name("a"), name("b"));
    assertThat(NodeUtil.invert(notIn).getBooleanProp(Node.Prop.NEGATED)).isFalse();
  }

  @Test
  public void testMakeReturn() {
    Node b = name("b");
    Node block = IR.block(name("a"), b, IR.comment("end"));
    NodeUtil.makeReturn(block, null);
    Node ret = block.getSecondChild();
    assertThat(ret.isReturn()).isTrue();
    assertThat(ret.getFirstChild()).isSameInstanceAs(b);
    assertThat(block.getLastChild().isComment()).isTrue();
  }

  @Test
  public void testMakeReturnLeavesJumps() {
    Node thrown = IR.throwNode(name("e"));
    Node block = IR.block(thrown);
    NodeUtil.makeReturn(block, null);
    assertThat(block.getOnlyChild()).isSameInstanceAs(thrown);
  }

  @Test
  public void testMakeReturnDropsBareReturn() {
    Node block = IR.block(name("a"), IR.returnNode());
    NodeUtil.makeReturn(block, null);
    assertThat(block.getChildCount()).isEqualTo(1);
    assertThat(block.getOnlyChild().isName()).isTrue();
  }

  @Test
  public void testMakeReturnWithAccumulator() {
    Node block = IR.block(name("x"));
    NodeUtil.makeReturn(block, "_results");
    Node push = block.getOnlyChild();
    assertThat(push.isCall()).isTrue();
    assertThat(push.getFirstChild().getLastChild().getFirstChild().getString()).isEqualTo("push");
  }

  @Test
  public void testMakeReturnThroughIf() {
    Node ifNode = IR.ifNode(name("c"), IR.block(name("a")));
    NodeUtil.makeReturn(IR.block(ifNode), "_results");
    assertThat(ifNode.getSecondChild().getOnlyChild().isCall()).isTrue();
    assertThat(ifNode.getLastChild().isBlock()).isTrue();
    assertThat(ifNode.getLastChild().getOnlyChild().isCall()).isTrue();
  }

  @Test
  public void testMakeReturnMarksLoop() {
    Node loop = IR.whileLoop(name("c"), IR.block(name("a")));
    NodeUtil.makeReturn(IR.block(loop), null);
    assertThat(loop.getBooleanProp(Node.Prop.RETURNS)).isTrue();

    Node escaping = IR.whileLoop(name("c"), IR.block(IR.returnNode(name("a"))));
    NodeUtil.makeReturn(IR.block(escaping), null);
    assertThat(escaping.getBooleanProp(Node.Prop.RETURNS)).isFalse();
  }

  @Test
  public void testSubstitute() {
    Node a = name("a");
    Node block = IR.block(a, name("b"));
    Node result = NodeUtil.substitute(a, IR::parens);
    assertThat(block.getFirstChild()).isSameInstanceAs(result);
    assertThat(result.getToken()).isEqualTo(Token.PARENS);
    assertThat(result.getFirstChild()).isSameInstanceAs(a);
    assertThat(NodeUtil.substitute(name("c"), IR::parens).hasParent()).isFalse();
  }
}
