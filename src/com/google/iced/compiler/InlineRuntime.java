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

import static com.google.iced.compiler.IcedTransform.ASSIGN_FN;
import static com.google.iced.compiler.IcedTransform.DEFERRALS_CLASS;
import static com.google.iced.compiler.IcedTransform.DEFER_METHOD;
import static com.google.iced.compiler.IcedTransform.FULFILL;
import static com.google.iced.compiler.IcedTransform.NS;

import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import java.util.List;

/**
 * The runtime emitted into programs compiled in {@code inline} mode, built as a tree so that it is
 * emitted by the same code generator as the program around it.
 *
 * <pre>
 * iced =
 *   Deferrals: class
 *     constructor: (k, trace) -&gt; @continuation = k; @count = 1; @ret = null
 *     _call: (trace) -&gt; @continuation @ret
 *     _fulfill: (trace) -&gt; @_call trace if --@count is 0
 *     defer: (args) -&gt;
 *       @count++
 *       self = this
 *       (inner_params...) -&gt;
 *         args.assign_fn?.apply null, inner_params
 *         self._fulfill()
 *   findDeferral: -&gt; null
 *   trampoline: (_fn) -&gt; _fn()
 * </pre>
 */
final class InlineRuntime {

  private InlineRuntime() {}

  static Node generate() {
    Node runtime =
        IR.obj(
            IR.prop(DEFERRALS_CLASS, deferralsClass()),
            IR.prop("findDeferral", IR.code(IR.block(IR.nullNode()))),
            IR.prop(
                "trampoline",
                IR.code(List.of(IR.param("_fn")), IR.block(IR.call(IR.value(IR.name("_fn")))))));
    return IR.assign(IR.name(NS), runtime);
  }

  private static Node deferralsClass() {
    Node constructor =
        IR.code(
            List.of(IR.param("k"), IR.param("trace")),
            IR.block(
                IR.assign(IR.thisProperty("continuation"), IR.name("k")),
                IR.assign(IR.thisProperty("count"), IR.number(1)),
                IR.assign(IR.thisProperty("ret"), IR.nullNode())));
    Node call =
        IR.code(
            List.of(IR.param("trace")),
            IR.block(IR.call(IR.thisProperty("continuation"), IR.thisProperty("ret"))));
    Node fulfill =
        IR.code(
            List.of(IR.param("trace")),
            IR.block(
                IR.ifNode(
                    IR.op("===", IR.op("--", IR.thisProperty("count")), IR.number(0)),
                    IR.block(IR.call(IR.thisProperty("_call"), IR.name("trace"))))));
    Node fulfillSlot =
        IR.code(
            List.of(IR.splatParam(IR.name("inner_params"))),
            IR.block(
                IR.call(
                    IR.value(IR.name("args"), IR.access(ASSIGN_FN), IR.soakAccess("apply")),
                    IR.nullNode(),
                    IR.name("inner_params")),
                IR.call(IR.path("self", FULFILL))));
    Node defer =
        IR.code(
            List.of(IR.param("args")),
            IR.block(
                IR.postfix("++", IR.thisProperty("count")),
                IR.assign(IR.name("self"), IR.thisNode()),
                fulfillSlot));
    Node body =
        IR.block(
            IR.obj(
                IR.prop("constructor", constructor),
                IR.prop("_call", call),
                IR.prop(FULFILL, fulfill),
                IR.prop(DEFER_METHOD, defer)));
    return IR.classNode(null, null, body);
  }
}
