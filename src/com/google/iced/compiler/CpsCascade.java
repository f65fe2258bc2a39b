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

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import java.util.List;

/**
 * Builds the call that splits a block at a pivot: the pivot runs inside a function that takes the
 * continuation as its parameter, and the statements that followed it become that continuation.
 *
 * <pre>
 * (function(__iced_k) { pivot })(function() { rest })
 * </pre>
 *
 * <p>Both functions are generated and bound, so {@code this} and declared variables keep meaning
 * what they meant in the enclosing function.
 */
final class CpsCascade {

  private CpsCascade() {}

  static Node wrap(Node pivot, Node rest) {
    Node body = pivot.isBlock() ? pivot : IR.block(pivot);
    Node func =
        generated(IR.code(List.of(IR.param(IcedTransform.CONTINUATION)), body));
    Node continuation = generated(IR.code(List.of(), rest));
    return IR.call(func, continuation).srcrefIfMissing(pivot);
  }

  static Node generated(Node code) {
    return code.putBooleanProp(Node.Prop.GENERATED, true)
        .putBooleanProp(Node.Prop.BOUND, true)
        .putBooleanProp(Node.Prop.NO_RETURN, true);
  }
}
