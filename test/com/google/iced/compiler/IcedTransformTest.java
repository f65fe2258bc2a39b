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
import static org.junit.Assert.assertThrows;

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import com.google.iced.ast.Token;
import com.google.iced.compiler.CompilerOptions.RuntimeMode;
import com.google.iced.compiler.IcedFlags.Flag;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IcedTransformTest {

  private CompilerOptions options;
  private IcedFlags flags;
  private IcedTransform transform;

  @Before
  public void setUp() {
    options = new CompilerOptions();
    options.setBareOutput(true);
    flags = new IcedFlags();
    transform = new IcedTransform(options, flags);
  }

  private Node process(Node... statements) {
    Node root = IR.block(statements);
    transform.process(root);
    return root;
  }

  private static Node awaitCall(String f) {
    return IR.await(IR.block(call(f, IR.defer())));
  }

  private static Node call(String f, Node... args) {
    return IR.call(IR.value(IR.name(f)), args);
  }

  // Pass 1

  @Test
  public void testSuspensionStopsAtFunction() {
    Node await = awaitCall("f");
    Node fn = IR.code(IR.block(await));
    Node root = process(IR.assign(IR.name("g"), fn));

    assertThat(flags.has(await, Flag.SUSPEND)).isTrue();
    assertThat(flags.has(fn.getLastChild(), Flag.SUSPEND)).isTrue();
    assertThat(flags.has(fn, Flag.SUSPEND)).isFalse();
    assertThat(flags.has(root, Flag.SUSPEND)).isFalse();
    assertThat(flags.has(fn, Flag.FUNCTION_AWAITS)).isTrue();
    assertThat(flags.has(root, Flag.FUNCTION_AWAITS)).isFalse();
  }

  @Test
  public void testTopLevelAwait() {
    Node root = process(awaitCall("f"));
    assertThat(flags.has(root, Flag.SUSPEND)).isTrue();
    assertThat(flags.has(root, Flag.FUNCTION_AWAITS)).isTrue();
    assertThat(transform.foundAwait()).isTrue();
    assertThat(transform.foundDefer()).isTrue();
  }

  @Test
  public void testDeferWithoutAwait() {
    Node call = call("f", IR.defer(IR.name("x")));
    process(call);
    assertThat(transform.foundAwait()).isFalse();
    assertThat(transform.foundDefer()).isTrue();
    assertThat(flags.has(call, Flag.SUSPEND)).isFalse();
  }

  // Pass 2

  @Test
  public void testSuspendingLoopIsTamed() {
    Node inner = IR.code(IR.block(call("h")));
    Node body = IR.block(awaitCall("f"), IR.assign(IR.name("x"), inner));
    Node loop = IR.whileLoop(IR.name("c"), body);
    process(loop);

    assertThat(flags.has(loop, Flag.TAMED_LOOP)).isTrue();
    assertThat(flags.has(loop.getFirstChild(), Flag.TAMED_LOOP)).isTrue();
    assertThat(flags.has(body, Flag.TAMED_LOOP)).isTrue();
    assertThat(flags.has(inner, Flag.TAMED_LOOP)).isFalse();
    assertThat(flags.has(inner.getLastChild(), Flag.TAMED_LOOP)).isFalse();
  }

  @Test
  public void testFloodStopsAtQuietLoop() {
    Node quietBody = IR.block(call("h"));
    Node quiet = IR.whileLoop(IR.name("d"), quietBody);
    Node loop = IR.whileLoop(IR.name("c"), IR.block(awaitCall("f"), quiet));
    process(loop);

    assertThat(flags.has(loop, Flag.TAMED_LOOP)).isTrue();
    assertThat(flags.has(quiet, Flag.TAMED_LOOP)).isFalse();
    assertThat(flags.has(quietBody, Flag.TAMED_LOOP)).isFalse();
  }

  @Test
  public void testQuietLoopIsNotTamed() {
    Node loop = IR.whileLoop(IR.name("c"), IR.block(call("h")));
    process(awaitCall("f"), loop);
    assertThat(flags.has(loop, Flag.TAMED_LOOP)).isFalse();
  }

  // Pass 3

  @Test
  public void testBreakInTamedLoopIsPivot() {
    Node jump = IR.breakNode();
    Node test = IR.ifNode(IR.name("done"), IR.block(jump));
    Node await = awaitCall("f");
    Node loop = IR.loop(IR.block(await, test));
    process(loop);

    assertThat(flags.has(jump, Flag.PIVOT)).isTrue();
    assertThat(flags.has(test, Flag.PIVOT)).isTrue();
    assertThat(flags.has(await, Flag.PIVOT)).isTrue();
    assertThat(flags.has(loop, Flag.PIVOT)).isTrue();
  }

  @Test
  public void testBreakInQuietLoopIsNotPivot() {
    Node jump = IR.breakNode();
    Node loop = IR.loop(IR.block(call("h"), jump));
    process(awaitCall("f"), loop);
    assertThat(flags.has(jump, Flag.PIVOT)).isFalse();
    assertThat(flags.has(loop, Flag.PIVOT)).isFalse();
  }

  @Test
  public void testPivotStopsAtFunction() {
    Node fn = IR.code(IR.block(awaitCall("f")));
    Node assign = IR.assign(IR.name("g"), fn);
    process(assign);
    assertThat(flags.has(fn, Flag.PIVOT)).isFalse();
    assertThat(flags.has(assign, Flag.PIVOT)).isFalse();
  }

  // Pass 4

  @Test
  public void testAutocbFunctionIsMarked() {
    Node nested = IR.code(IR.block(call("h")));
    Node value = IR.name("result");
    Node body = IR.block(IR.assign(IR.name("k"), nested), value);
    Node fn = IR.code(List.of(IR.param(IcedTransform.AUTOCB)), body);
    process(IR.assign(IR.name("g"), fn));

    assertThat(IcedTransform.hasAutocbParam(fn)).isTrue();
    assertThat(flags.has(body, Flag.AUTOCB)).isTrue();
    assertThat(flags.has(nested, Flag.AUTOCB)).isTrue();
    assertThat(flags.has(nested.getLastChild(), Flag.AUTOCB)).isFalse();

    Node callback = body.getLastChild();
    assertThat(callback.getToken()).isEqualTo(Token.ICED_TAIL_CALL);
    assertThat(callback.getString()).isEqualTo(IcedTransform.AUTOCB);
    assertThat(callback.getFirstChild()).isSameInstanceAs(value);
    assertThat(flags.has(callback, Flag.AUTOCB)).isTrue();
  }

  @Test
  public void testFunctionWithoutAutocb() {
    Node fn = IR.code(List.of(IR.param("cb")), IR.block(IR.name("x")));
    process(IR.assign(IR.name("g"), fn));
    assertThat(IcedTransform.hasAutocbParam(fn)).isFalse();
    assertThat(fn.getLastChild().getFirstChild().isName()).isTrue();
  }

  // Pass 5

  @Test
  public void testRotation() {
    Node a = call("a");
    Node first = awaitCall("f");
    Node b = call("b");
    Node second = awaitCall("g");
    Node c = call("c");
    Node root = process(a, first, b, second, c);

    assertThat(transform.getRotationCount()).isEqualTo(2);
    assertThat(root.getChildCount()).isEqualTo(3);
    assertThat(root.getFirstChild().getToken()).isEqualTo(Token.ICED_RUNTIME);
    assertThat(root.getSecondChild()).isSameInstanceAs(a);
    assertThat(root.getLastChild()).isSameInstanceAs(first);

    Node afterFirst = flags.getContinuation(first);
    assertThat(afterFirst.childList()).containsExactly(b, second).inOrder();
    assertThat(flags.has(afterFirst, Flag.SUSPEND)).isTrue();
    assertThat(flags.getContinuation(second).childList()).containsExactly(c);
    assertThat(flags.getContinuation(a)).isNull();
  }

  @Test
  public void testNothingToRotateAfterLastPivot() {
    Node await = awaitCall("f");
    process(call("a"), await);
    assertThat(transform.getRotationCount()).isEqualTo(0);
    assertThat(flags.getContinuation(await)).isNull();
  }

  @Test
  public void testPivotIfCallsContinuationOnEveryPath() {
    Node pivot = IR.ifNode(IR.name("c"), IR.block(awaitCall("f")));
    process(pivot, call("after"));

    Node then = pivot.getSecondChild();
    assertThat(then.getLastChild().getToken()).isEqualTo(Token.ICED_TAIL_CALL);
    assertThat(then.getLastChild().getString()).isEqualTo(IcedTransform.CONTINUATION);
    Node otherwise = pivot.getLastChild();
    assertThat(otherwise.isBlock()).isTrue();
    assertThat(otherwise.getFirstChild().getString()).isEqualTo(IcedTransform.CONTINUATION);
  }

  @Test
  public void testTamedLoopBodyCallsNext() {
    Node await = awaitCall("f");
    Node body = IR.block(await, call("h"));
    process(IR.whileLoop(IR.name("c"), body));
    assertThat(body.getLastChild()).isSameInstanceAs(await);
    Node last = flags.getContinuation(await).getLastChild();
    assertThat(last.getToken()).isEqualTo(Token.ICED_TAIL_CALL);
    assertThat(last.getString()).isEqualTo(IcedTransform.LOOP_NEXT);
  }

  // Runtime

  @Test
  public void testNoRuntimeWithoutSuspension() {
    Node root = process(call("f"));
    assertThat(root.getChildCount()).isEqualTo(1);
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.NONE);
  }

  @Test
  public void testRuntimeNodeRecordsFindings() {
    Node root = process(awaitCall("f"));
    Node runtime = root.getFirstChild();
    assertThat(runtime.getToken()).isEqualTo(Token.ICED_RUNTIME);
    assertThat(runtime.getBooleanProp(Node.Prop.FOUND_AWAIT)).isTrue();
    assertThat(runtime.getBooleanProp(Node.Prop.FOUND_DEFER)).isTrue();
    assertThat(runtime.getProp(Node.Prop.RUNTIME_MODE)).isEqualTo(RuntimeMode.NONE);
  }

  @Test
  public void testRuntimeFollowsPrologue() {
    Node root = process(IR.string("use strict"), IR.comment("setup"), awaitCall("f"));
    assertThat(root.getChildAtIndex(2).getToken()).isEqualTo(Token.ICED_RUNTIME);
  }

  @Test
  public void testBareOutputNeedsNoRuntime() {
    process(call("f", IR.defer(IR.name("x"))));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.NONE);
  }

  @Test
  public void testWrappedDeferringProgramUsesNode() {
    options.setBareOutput(false);
    process(call("f", IR.defer(IR.name("x"))));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.NODE);
  }

  @Test
  public void testWrappedAwaitOnlyProgramUsesNone() {
    options.setBareOutput(false);
    process(IR.await(IR.block(call("f"))));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.NONE);
  }

  @Test
  public void testConfiguredMode() {
    options.setRuntimeMode(RuntimeMode.INLINE);
    process(awaitCall("f"));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.INLINE);
  }

  @Test
  public void testConfiguredModeUnusedWithoutSuspension() {
    options.setRuntimeMode(RuntimeMode.INLINE);
    process(call("f"));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.NONE);
  }

  @Test
  public void testDirectiveWins() {
    options.setRuntimeMode(RuntimeMode.NODE);
    process(IR.tameRequire("inline"), awaitCall("f"));
    assertThat(transform.resolveRuntimeMode()).isEqualTo(RuntimeMode.INLINE);
  }

  @Test
  public void testBadDirective() {
    CompilationException e =
        assertThrows(CompilationException.class, () -> process(IR.tameRequire("browser")));
    assertThat(e.getType()).isEqualTo(IcedTransform.BAD_RUNTIME_MODE);
    assertThat(e).hasMessageThat().contains("unexpected tameRequire mode \"browser\"");
  }

  // Return threading

  @Test
  public void testThreadReturnPassesTrailingValue() {
    Node value = IR.name("x");
    Node block = IR.block(call("f"), value);
    Node tail = IR.icedTailCall("k", null);
    IcedTransform.threadReturn(block, tail);
    assertThat(block.getChildCount()).isEqualTo(2);
    assertThat(block.getLastChild()).isSameInstanceAs(tail);
    assertThat(tail.getFirstChild()).isSameInstanceAs(value);
  }

  @Test
  public void testThreadReturnSkipsComments() {
    Node value = IR.name("x");
    Node comment = IR.comment("done");
    Node block = IR.block(value, comment);
    Node tail = IR.icedTailCall("k", null);
    IcedTransform.threadReturn(block, tail);
    assertThat(block.childList()).containsExactly(tail, comment).inOrder();
  }

  @Test
  public void testThreadReturnAppendsAfterStatement() {
    Node block = IR.block(IR.returnNode(IR.name("x")));
    Node tail = IR.icedTailCall("k", null);
    IcedTransform.threadReturn(block, tail);
    assertThat(block.getChildCount()).isEqualTo(2);
    assertThat(block.getLastChild()).isSameInstanceAs(tail);
    assertThat(tail.getFirstChild().isEmpty()).isTrue();
  }

  @Test
  public void testThreadReturnKeepsExistingTailCall() {
    Node existing = IR.icedTailCall("_next", null);
    Node block = IR.block(existing);
    Node tail = IR.icedTailCall("k", null);
    IcedTransform.threadReturn(block, tail);
    assertThat(block.childList()).containsExactly(existing, tail).inOrder();
  }

  @Test
  public void testThreadReturnIntoEmptyBlock() {
    Node block = IR.block();
    Node tail = IR.icedTailCall("k", null);
    IcedTransform.threadReturn(block, tail);
    assertThat(block.childList()).containsExactly(tail);
  }
}
