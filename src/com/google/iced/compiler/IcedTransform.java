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
import com.google.common.collect.Sets;
import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import com.google.iced.ast.Token;
import com.google.iced.compiler.CompilerOptions.RuntimeMode;
import com.google.iced.compiler.IcedFlags.Flag;
import com.google.iced.compiler.NodeTraversal.AbstractPostOrderCallback;
import com.google.iced.compiler.NodeTraversal.AbstractShallowCallback;
import com.google.iced.compiler.NodeTraversal.Callback;
import java.util.EnumSet;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Prepares {@code await} and {@code defer} for continuation-passing emission.
 *
 * <p>Five passes run in order, each reading what the previous one wrote:
 *
 * <ol>
 *   <li>Suspension discovery: every {@code await} and its ancestors within the same function are
 *       marked {@link Flag#SUSPEND}.
 *   <li>Loop flood: every node under a suspending loop is marked {@link Flag#TAMED_LOOP}, up to
 *       the next function or non-suspending loop.
 *   <li>Pivot marking: suspension points, jumps out of tamed loops, and their ancestors are
 *       marked {@link Flag#PIVOT}.
 *   <li>Implicit callback marking: nodes of functions with an {@code autocb} parameter are marked
 *       {@link Flag#AUTOCB}, and the callback is threaded onto the end of the function body.
 *   <li>Rotation: in each block, the statements after the first pivot are detached into a new
 *       block recorded as that pivot's continuation, and the pivot is made to call its
 *       continuation on every path.
 * </ol>
 *
 * <p>The program root also receives an {@link Token#ICED_RUNTIME} node when the runtime is
 * needed.
 */
public final class IcedTransform implements CompilerPass {
  private static final Logger logger = Logger.getLogger(IcedTransform.class.getName());

  static final DiagnosticType BAD_RUNTIME_MODE =
      DiagnosticType.configuration(
          "ICED_BAD_RUNTIME_MODE", "unexpected tameRequire mode \"{0}\"; use inline, node or none");

  // Names used by emitted code.
  static final String NS = "iced";
  static final String CONTINUATION = "__iced_k";
  static final String NOOP = "__iced_k_noop";
  static final String DEFERRALS = "__iced_deferrals";
  static final String DEFERRALS_CLASS = "Deferrals";
  static final String FULFILL = "_fulfill";
  static final String DEFER_METHOD = "defer";
  static final String ASSIGN_FN = "assign_fn";
  static final String LINENO = "lineno";
  static final String FILENAME = "filename";
  static final String FUNCNAME = "funcname";
  static final String SLOT = "__slot";
  static final String AUTOCB = "autocb";
  static final String LOOP_TOP = "_while";
  static final String LOOP_BREAK = "_break";
  static final String LOOP_CONTINUE = "_continue";
  static final String LOOP_NEXT = "_next";

  private static final EnumSet<Flag> INHERITED =
      EnumSet.of(Flag.SUSPEND, Flag.TAMED_LOOP, Flag.PIVOT, Flag.AUTOCB);

  private final CompilerOptions options;
  private final IcedFlags flags;

  private boolean foundAwait;
  private boolean foundDefer;
  private @Nullable RuntimeMode requiredMode;
  private int rotations;

  public IcedTransform(CompilerOptions options, IcedFlags flags) {
    this.options = options;
    this.flags = flags;
  }

  @Override
  public void process(Node root) {
    checkState(root.isBlock(), root);
    NodeTraversal.traverse(root, new FindSuspensions(root));
    NodeTraversal.traverse(root, new FloodLoops());
    NodeTraversal.traverse(root, new MarkPivots());
    NodeTraversal.traverse(root, new FindImplicitCallbacks());
    rotate(root);
    addRuntime(root);
    logger.fine(
        () -> "await: " + foundAwait + ", defer: " + foundDefer + ", rotations: " + rotations);
  }

  public boolean foundAwait() {
    return foundAwait;
  }

  public boolean foundDefer() {
    return foundDefer;
  }

  /** How many blocks were split at a pivot. */
  @VisibleForTesting
  int getRotationCount() {
    return rotations;
  }

  /** Pass 1. */
  private final class FindSuspensions extends AbstractPostOrderCallback {
    private final Node root;

    FindSuspensions(Node root) {
      this.root = root;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case AWAIT:
          foundAwait = true;
          flags.set(n, Flag.SUSPEND);
          Node fn = t.getEnclosingFunction();
          flags.set(fn == null ? root : fn, Flag.FUNCTION_AWAITS);
          return;
        case DEFER:
          foundDefer = true;
          break;
        case ICED_REQUIRE:
          RuntimeMode mode = RuntimeMode.fromDirective(n.getString());
          if (mode == null) {
            throw new CompilationException(
                IcedError.make(options.getSourceName(), n, BAD_RUNTIME_MODE, n.getString()));
          }
          requiredMode = mode;
          return;
        case CODE:
          return;
        default:
          break;
      }
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        if (flags.has(c, Flag.SUSPEND)) {
          flags.set(n, Flag.SUSPEND);
          return;
        }
      }
    }
  }

  /** Pass 2. */
  private final class FloodLoops implements Callback {
    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      boolean flood;
      if (n.isLoop()) {
        flood = flags.has(n, Flag.SUSPEND);
      } else if (n.isCode() || parent == null) {
        flood = false;
      } else {
        flood = flags.has(parent, Flag.TAMED_LOOP);
      }
      if (flood) {
        flags.set(n, Flag.TAMED_LOOP);
      }
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /** Pass 3. */
  private final class MarkPivots extends AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isCode()) {
        return;
      }
      boolean jump = n.getToken() == Token.BREAK || n.getToken() == Token.CONTINUE;
      if (flags.has(n, Flag.SUSPEND) || (jump && flags.has(n, Flag.TAMED_LOOP))) {
        flags.set(n, Flag.PIVOT);
        return;
      }
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        if (flags.has(c, Flag.PIVOT)) {
          flags.set(n, Flag.PIVOT);
          return;
        }
      }
    }
  }

  /** Pass 4. */
  private final class FindImplicitCallbacks extends AbstractPostOrderCallback {
    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (!n.isCode() || !hasAutocbParam(n)) {
        return;
      }
      Node body = n.getLastChild();
      NodeTraversal.traverse(
          body,
          new AbstractShallowCallback() {
            @Override
            public void visit(NodeTraversal t, Node inner, @Nullable Node parent) {
              flags.set(inner, Flag.AUTOCB);
            }
          });
      Node callback = IR.icedTailCall(AUTOCB, null);
      flags.set(callback, Flag.AUTOCB);
      threadReturn(body, callback);
    }
  }

  static boolean hasAutocbParam(Node code) {
    for (Node param = code.getFirstChild().getFirstChild();
        param != null;
        param = param.getNext()) {
      if (param.getFirstChild().matchesName(AUTOCB)) {
        return true;
      }
    }
    return false;
  }

  /** Pass 5. */
  private void rotate(Node n) {
    if (n.isBlock()) {
      rotateBlock(n);
      return;
    }
    for (Node child : n.childList()) {
      rotate(child);
    }
  }

  private void rotateBlock(Node block) {
    Node pivot = null;
    for (Node e = block.getFirstChild(); e != null; e = e.getNext()) {
      if (flags.has(e, Flag.PIVOT)) {
        pivot = e;
        callContinuation(e);
      }
      rotate(e);
      if (pivot != null) {
        break;
      }
    }
    if (pivot == null) {
      return;
    }
    ImmutableList<Node> rest = block.removeChildrenAfter(pivot);
    if (rest.isEmpty()) {
      return;
    }
    Node continuation = IR.block(rest);
    for (Node e : rest) {
      flags.addAll(continuation, Sets.intersection(flags.get(e), INHERITED));
    }
    flags.setContinuation(pivot, continuation);
    rotations++;
    rotateBlock(continuation);
  }

  /** Makes every path through {@code pivot} end by calling the current continuation. */
  private void callContinuation(Node pivot) {
    switch (pivot.getToken()) {
      case IF:
        {
          threadReturn(pivot.getSecondChild(), IR.icedTailCall(CONTINUATION, null));
          Node alt = pivot.getLastChild();
          if (alt.isIf()) {
            callContinuation(alt);
          } else if (alt.isBlock()) {
            threadReturn(alt, IR.icedTailCall(CONTINUATION, null));
          } else {
            alt.replaceWith(IR.block(IR.icedTailCall(CONTINUATION, null)));
          }
          break;
        }
      case SWITCH:
        {
          for (Node c = pivot.getSecondChild(); c != null; c = c.getNext()) {
            if (c.getToken() == Token.CASE) {
              threadReturn(c.getLastChild(), IR.icedTailCall(CONTINUATION, null));
            }
          }
          Node otherwise = pivot.getLastChild();
          if (otherwise.isBlock()) {
            threadReturn(otherwise, IR.icedTailCall(CONTINUATION, null));
          } else {
            otherwise.replaceWith(IR.block(IR.icedTailCall(CONTINUATION, null)));
          }
          break;
        }
      case WHILE:
      case FOR:
        threadReturn(NodeUtil.loopBody(pivot), IR.icedTailCall(LOOP_NEXT, null));
        break;
      case TRY:
        {
          threadReturn(pivot.getFirstChild(), IR.icedTailCall(CONTINUATION, null));
          Node recovery = pivot.getChildAtIndex(2);
          if (recovery.isBlock()) {
            threadReturn(recovery, IR.icedTailCall(CONTINUATION, null));
          }
          break;
        }
      default:
        // Awaits call the continuation through their deferrals; jumps leave the loop.
        break;
    }
  }

  /**
   * Ends {@code block} with {@code tailCall}. A trailing expression becomes the value passed to
   * the call; otherwise the call is appended.
   */
  static void threadReturn(Node block, Node tailCall) {
    for (Node e = block.getLastChild(); e != null; e = e.getPrevious()) {
      if (e.isComment()) {
        continue;
      }
      if (!NodeUtil.isStatement(e) && e.getToken() != Token.ICED_TAIL_CALL) {
        NodeUtil.substitute(
            e,
            value -> {
              tailCall.getFirstChild().replaceWith(value);
              return tailCall;
            });
        return;
      }
      break;
    }
    block.addChildToBack(tailCall);
  }

  private void addRuntime(Node root) {
    if (!foundAwait && !foundDefer) {
      return;
    }
    RuntimeMode mode = resolveRuntimeMode();
    logger.fine(() -> "iced runtime: " + mode);
    Node runtime = IR.icedRuntime(foundAwait, foundDefer);
    runtime.putProp(Node.Prop.RUNTIME_MODE, mode);
    Node prologueEnd = null;
    for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
      Node unwrapped = NodeUtil.unwrap(c);
      if (!unwrapped.isComment() && !unwrapped.isString()) {
        break;
      }
      prologueEnd = c;
    }
    if (prologueEnd == null) {
      root.addChildToFront(runtime);
    } else {
      runtime.insertAfter(prologueEnd);
    }
  }

  /**
   * A {@code tameRequire} directive wins; then the configured mode, used only when something is
   * deferred; then {@code node} for deferring programs that are not bare.
   */
  @VisibleForTesting
  RuntimeMode resolveRuntimeMode() {
    if (requiredMode != null) {
      return requiredMode;
    }
    boolean needed = foundDefer || foundAwait;
    if (options.getRuntimeMode() != null) {
      return needed ? options.getRuntimeMode() : RuntimeMode.NONE;
    }
    if (options.isBareOutput()) {
      return RuntimeMode.NONE;
    }
    return foundDefer ? RuntimeMode.NODE : RuntimeMode.NONE;
  }
}
