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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.iced.ast.Node;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Annotations computed by {@link IcedTransform} and consumed during emission, keyed by node
 * identity. Nodes themselves carry no analysis state.
 */
public final class IcedFlags {

  /** The per-node marks, each written by one pass of the transform. */
  public enum Flag {
    /** The node is or contains an {@code await} within its own function. Pass 1. */
    SUSPEND,
    /** The node is inside a loop that suspends. Pass 2. */
    TAMED_LOOP,
    /** The node is a suspension point, a jump out of a tamed loop, or contains one. Pass 3. */
    PIVOT,
    /** The node is inside a function with an {@code autocb} parameter. Pass 4. */
    AUTOCB,
    /** A function, or the program root, that directly contains an {@code await}. Pass 1. */
    FUNCTION_AWAITS,
  }

  private final Map<Node, EnumSet<Flag>> flags = new IdentityHashMap<>();
  private final Map<Node, Node> continuations = new IdentityHashMap<>();
  private final Set<Node> split = Collections.newSetFromMap(new IdentityHashMap<>());

  public boolean has(Node n, Flag flag) {
    EnumSet<Flag> set = flags.get(n);
    return set != null && set.contains(flag);
  }

  public void set(Node n, Flag flag) {
    flags.computeIfAbsent(n, k -> EnumSet.noneOf(Flag.class)).add(flag);
  }

  /** A copy of the flags on {@code n}. */
  public EnumSet<Flag> get(Node n) {
    EnumSet<Flag> set = flags.get(n);
    return set == null ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(set);
  }

  void addAll(Node n, Set<Flag> toAdd) {
    for (Flag flag : toAdd) {
      set(n, flag);
    }
  }

  /** Attaches the statements that run after {@code pivot} completes. Set once per pivot. */
  public void setContinuation(Node pivot, Node block) {
    checkArgument(block.isBlock(), block);
    checkState(!continuations.containsKey(pivot), "Continuation already set for %s", pivot);
    continuations.put(pivot, block);
  }

  public @Nullable Node getContinuation(Node pivot) {
    return continuations.get(pivot);
  }

  /** Whether emission must still split the tree at {@code n}. */
  public boolean needsSplit(Node n) {
    return continuations.containsKey(n) && !split.contains(n);
  }

  /** Records that {@code n} has been split; it will be emitted directly from now on. */
  public void markSplit(Node n) {
    checkState(continuations.containsKey(n), "No continuation for %s", n);
    split.add(n);
  }

  public boolean isSplit(Node n) {
    return split.contains(n);
  }
}
