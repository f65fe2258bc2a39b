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
import com.google.iced.ast.Token;
import com.google.iced.compiler.CodeContext.Level;
import com.google.iced.compiler.IcedFlags.Flag;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Emits loops, ranges and slices.
 *
 * <p>A loop that suspends cannot be a native loop, since each iteration may finish in a later
 * turn of the event loop. It is lowered to a trampoline instead:
 *
 * <pre>
 * _while = function(__iced_k) {
 *   var _break, _continue, _next;
 *   _break = __iced_k;
 *   _continue = function() {
 *     step;
 *     return iced.trampoline(function() { return _while(__iced_k); });
 *   };
 *   _next = _continue;
 *   if (!condition) { return _break(); } else { body; return _next(); }
 * };
 * _while(__iced_k);
 * </pre>
 *
 * {@code break} and {@code continue} inside such a loop call {@code _break} and
 * {@code _continue}.
 */
final class LoopCompiler {

  static final DiagnosticType TAMED_RANGE_INDEX =
      DiagnosticType.syntax(
          "ICED_TAMED_RANGE_INDEX",
          "cannot use an index variable when iterating over a range with await in the loop body");

  private static final Predicate<Node> IS_ARGUMENTS = n -> n.matchesName("arguments");

  /** Ranges between number literals at most this far apart are written out in full. */
  private static final int MAX_INLINE_RANGE = 20;

  private final CodeGenerator generator;

  LoopCompiler(CodeGenerator generator) {
    this.generator = generator;
  }

  // Native loops

  String compileWhile(Node n, CodeContext o) {
    if (generator.getFlags().has(n, Flag.TAMED_LOOP)) {
      return compileTrampoline(n, tamedWhile(n), o);
    }
    Node condition = n.getFirstChild();
    Node body = n.getSecondChild();
    Node guard = n.getLastChild();
    String tab = o.getIndent();
    String set = "";
    String rvar = null;
    String bodyCode = "";
    if (body.hasChildren()) {
      if (n.getBooleanProp(Node.Prop.RETURNS)) {
        rvar = o.getScope().freshName("results");
        NodeUtil.makeReturn(body, rvar);
        set = tab + rvar + " = [];\n";
      }
      if (!guard.isEmpty()) {
        body = applyGuard(body, guard);
      }
      bodyCode = "\n" + generator.compile(body, o.indented(), Level.TOP) + "\n" + tab;
    }
    String code =
        set
            + tab
            + "while ("
            + generator.compile(condition, o, Level.PAREN)
            + ") {"
            + bodyCode
            + "}";
    return rvar == null ? code : code + "\n" + tab + "return " + rvar + ";";
  }

  String compileFor(Node n, CodeContext o) {
    if (generator.getFlags().has(n, Flag.TAMED_LOOP)) {
      return compileTrampoline(n, tamedFor(n, o), o);
    }
    Node body = n.getFirstChild();
    Node source = n.getSecondChild();
    Node nameNode = n.getChildAtIndex(2);
    Node indexNode = n.getChildAtIndex(3);
    Node guard = n.getChildAtIndex(4);
    Node step = n.getChildAtIndex(5);
    boolean object = n.getBooleanProp(Node.Prop.OBJECT);
    boolean returns = n.getBooleanProp(Node.Prop.RETURNS);
    Node range = rangeOf(source);
    boolean pattern = NodeUtil.isArray(nameNode) || NodeUtil.isObject(nameNode);

    Scope scope = o.getScope();
    String tab = o.getIndent();
    String idt1 = tab + generator.getTab();
    String name =
        nameNode.isEmpty() || pattern ? null : generator.compile(nameNode, o, Level.LIST);
    String index = indexNode.isEmpty() ? null : generator.compile(indexNode, o, Level.LIST);
    if (name != null) {
      scope.declare(name);
    }
    if (index != null) {
      scope.declare(index);
    }
    String rvar = returns ? scope.freshName("results") : null;
    String ivar = object && index != null ? index : scope.freshName("i");
    String kvar = range != null && name != null ? name : index != null ? index : ivar;
    String kvarAssign = kvar.equals(ivar) ? "" : kvar + " = ";
    String stepvar = !step.isEmpty() && range == null ? scope.freshName("step") : null;

    String defPart = "";
    String namePart = null;
    String forPart = null;
    String svar = null;
    if (range != null) {
      forPart = new RangeBounds(range, o, step.isEmpty() ? null : step).header(ivar, name);
    } else {
      svar = generator.compile(source, o, Level.LIST);
      if ((name != null || pattern || n.getBooleanProp(Node.Prop.OWN))
          && !NodeUtil.isIdentifier(svar)) {
        String ref = scope.freshName("ref");
        defPart = tab + ref + " = " + svar + ";\n";
        svar = ref;
      }
      if (name != null) {
        namePart = name + " = " + svar + "[" + kvar + "]";
      }
      if (!object) {
        String lvar = scope.freshName("len");
        String forVarPart = kvarAssign + ivar + " = 0, " + lvar + " = " + svar + ".length";
        if (stepvar != null) {
          forVarPart += ", " + stepvar + " = " + generator.compile(step, o, Level.OP);
        }
        String stepPart;
        if (stepvar != null) {
          stepPart = ivar + " += " + stepvar;
        } else {
          stepPart = kvar.equals(ivar) ? ivar + "++" : "++" + ivar;
        }
        forPart = forVarPart + "; " + ivar + " < " + lvar + "; " + kvarAssign + stepPart;
      }
    }
    String resultPart = "";
    String returnResult = "";
    if (returns) {
      resultPart = tab + rvar + " = [];\n";
      returnResult = "\n" + tab + "return " + rvar + ";";
      NodeUtil.makeReturn(body, rvar);
    }
    if (!guard.isEmpty()) {
      body = applyGuard(body, guard);
    }
    if (pattern) {
      body.addChildToFront(IR.assign(nameNode, IR.js(svar + "[" + kvar + "]")));
    }
    String guardPart = "";
    if (object) {
      forPart = kvar + " in " + svar;
      if (n.getBooleanProp(Node.Prop.OWN)) {
        String hasProp = scope.useHelper(RuntimeHelper.HAS_PROP);
        guardPart =
            "\n" + idt1 + "if (!" + hasProp + ".call(" + svar + ", " + kvar + ")) continue;";
      }
    }
    String varPart = namePart == null ? "" : "\n" + idt1 + namePart + ";";
    String bodyCode = generator.compile(body, o.withIndent(idt1), Level.TOP);
    String inside = guardPart + varPart + (bodyCode.isEmpty() ? "" : "\n" + bodyCode);
    if (!inside.isEmpty()) {
      inside += "\n" + tab;
    }
    return defPart + resultPart + tab + "for (" + forPart + ") {" + inside + "}" + returnResult;
  }

  /** Skips iterations where {@code guard} is false. */
  private static Node applyGuard(Node body, Node guard) {
    if (body.hasMoreThanOneChild()) {
      Node skip = IR.ifNode(NodeUtil.invert(IR.parens(guard)), IR.block(IR.js("continue")));
      body.addChildToFront(skip);
      return body;
    }
    return IR.block(IR.ifNode(guard, body));
  }

  private static @Nullable Node rangeOf(Node source) {
    return !NodeUtil.hasProperties(source) && NodeUtil.baseOf(source).isRange()
        ? NodeUtil.baseOf(source)
        : null;
  }

  // Ranges and slices

  /** The compiled endpoints and step of a range, each evaluated once. */
  private final class RangeBounds {
    final String fromC;
    final String fromVar;
    final String toC;
    final String toVar;
    final @Nullable String stepC;
    final @Nullable String stepVar;
    final @Nullable Long fromNum;
    final @Nullable Long toNum;
    final @Nullable Long stepNum;
    final String equals;

    RangeBounds(Node range, CodeContext o, @Nullable Node step) {
      String[] from = generator.cacheCompiled(range.getFirstChild(), o, Level.LIST);
      String[] to = generator.cacheCompiled(range.getSecondChild(), o, Level.LIST);
      fromC = from[0];
      fromVar = from[1];
      toC = to[0];
      toVar = to[1];
      if (step != null) {
        String[] cached = generator.cacheCompiled(step, o, Level.LIST);
        stepC = cached[0];
        stepVar = cached[1];
      } else {
        stepC = null;
        stepVar = null;
      }
      fromNum = parseNumber(fromVar);
      toNum = parseNumber(toVar);
      stepNum = parseNumber(stepVar);
      equals = range.getBooleanProp(Node.Prop.EXCLUSIVE) ? "" : "=";
    }

    boolean known() {
      return fromNum != null && toNum != null;
    }

    /** The three clauses of a {@code for} statement counting {@code idx} through the range. */
    String header(String idx, @Nullable String idxName) {
      boolean namedIndex = idxName != null && !idxName.equals(idx);
      String varPart = idx + " = " + fromC;
      if (!toC.equals(toVar)) {
        varPart += ", " + toC;
      }
      if (stepC != null && !stepC.equals(stepVar)) {
        varPart += ", " + stepC;
      }
      String lt = idx + " <" + equals;
      String gt = idx + " >" + equals;
      String cond = fromVar + " <= " + toVar;
      String condPart;
      if (stepNum != null) {
        condPart = stepNum > 0 ? lt + " " + toVar : gt + " " + toVar;
      } else if (known()) {
        condPart = fromNum <= toNum ? lt + " " + toNum : gt + " " + toNum;
      } else {
        condPart = cond + " ? " + lt + " " + toVar + " : " + gt + " " + toVar;
      }
      String stepPart;
      if (stepVar != null) {
        stepPart = idx + " += " + stepVar;
      } else if (known()) {
        boolean up = fromNum <= toNum;
        stepPart = namedIndex ? (up ? "++" : "--") + idx : idx + (up ? "++" : "--");
      } else {
        stepPart =
            namedIndex
                ? cond + " ? ++" + idx + " : --" + idx
                : cond + " ? " + idx + "++ : " + idx + "--";
      }
      if (namedIndex) {
        varPart = idxName + " = " + varPart;
        stepPart = idxName + " = " + stepPart;
      }
      return varPart + "; " + condPart + "; " + stepPart;
    }
  }

  private static @Nullable Long parseNumber(@Nullable String code) {
    return code != null && NodeUtil.isSimpleNumber(code) ? Long.parseLong(code) : null;
  }

  /** A range standing alone is the array of the integers it spans. */
  String compileRange(Node n, CodeContext o) {
    boolean hasArgs = mentionsArguments(n.getFirstChild()) || mentionsArguments(n.getSecondChild());
    RangeBounds bounds = new RangeBounds(n, o, null);
    if (bounds.known() && Math.abs(bounds.fromNum - bounds.toNum) <= MAX_INLINE_RANGE) {
      List<String> values = new ArrayList<>();
      long from = bounds.fromNum;
      long to = bounds.toNum;
      for (long i = from; from <= to ? i <= to : i >= to; i += from <= to ? 1 : -1) {
        values.add(String.valueOf(i));
      }
      if (n.getBooleanProp(Node.Prop.EXCLUSIVE)) {
        values.remove(values.size() - 1);
      }
      return "[" + String.join(", ", values) + "]";
    }
    Scope scope = o.getScope();
    String idt = o.getIndent() + generator.getTab();
    String i = scope.freshName("i");
    String result = scope.freshName("results");
    String pre = "\n" + idt + result + " = [];";
    String body;
    if (bounds.known()) {
      body = bounds.header(i, null);
    } else {
      String vars = i + " = " + bounds.fromC;
      if (!bounds.toC.equals(bounds.toVar)) {
        vars += ", " + bounds.toC;
      }
      String cond = bounds.fromVar + " <= " + bounds.toVar;
      String eq = bounds.equals;
      body =
          "var " + vars + "; "
              + cond + " ? " + i + " <" + eq + " " + bounds.toVar
              + " : " + i + " >" + eq + " " + bounds.toVar + "; "
              + cond + " ? " + i + "++ : " + i + "--";
    }
    String post =
        "{ " + result + ".push(" + i + "); }\n" + idt + "return " + result + ";\n"
            + o.getIndent();
    return "(function() {" + pre + "\n" + idt + "for (" + body + ")" + post + "}).apply(this"
        + (hasArgs ? ", arguments" : "") + ")";
  }

  private static boolean mentionsArguments(Node n) {
    return IS_ARGUMENTS.test(n) || NodeTraversal.contains(n, IS_ARGUMENTS);
  }

  /** {@code a[i..j]} as {@code a.slice(i, j + 1)}. */
  String compileSlice(Node n, CodeContext o) {
    Node range = n.getFirstChild();
    Node from = range.getFirstChild();
    Node to = range.getSecondChild();
    boolean exclusive = range.getBooleanProp(Node.Prop.EXCLUSIVE);
    String fromStr = from.isEmpty() ? "0" : generator.compile(from, o, Level.PAREN);
    String toStr = "";
    if (!to.isEmpty()) {
      Long number = simpleNumber(to);
      if (exclusive) {
        toStr = ", " + generator.compile(to, o, Level.PAREN);
      } else if (number != null) {
        if (number != -1) {
          toStr = ", " + (number + 1);
        }
      } else {
        toStr = ", " + generator.compile(to, o, Level.ACCESS) + " + 1 || 9e9";
      }
    }
    return ".slice(" + fromStr + toStr + ")";
  }

  /** The value of an integer literal, possibly signed, or null. */
  private static @Nullable Long simpleNumber(Node n) {
    Node e = NodeUtil.unwrapAll(n);
    if (e.isNumber()) {
      return parseNumber(e.getString());
    }
    if (NodeUtil.isUnary(e) && (e.getString().equals("-") || e.getString().equals("+"))) {
      Node operand = NodeUtil.unwrapAll(e.getFirstChild());
      return operand.isNumber() ? parseNumber(e.getString() + operand.getString()) : null;
    }
    return null;
  }

  // Loops that suspend

  /** The parts a suspending loop contributes to its trampoline. */
  private static final class Trampoline {
    final List<Node> init = new ArrayList<>();
    final List<Node> prefix = new ArrayList<>();
    Node condition;
    Node guard;
    @Nullable Node step;
  }

  private static Trampoline tamedWhile(Node loop) {
    Trampoline t = new Trampoline();
    t.condition = loop.getFirstChild();
    t.guard = loop.getLastChild();
    return t;
  }

  private Trampoline tamedFor(Node loop, CodeContext o) {
    Node source = loop.getSecondChild();
    Node name = loop.getChildAtIndex(2);
    Node index = loop.getChildAtIndex(3);
    Node step = loop.getChildAtIndex(5);
    Scope scope = o.getScope();
    Trampoline t = new Trampoline();
    t.guard = loop.getChildAtIndex(4);
    Node range = rangeOf(source);
    if (range != null) {
      if (!index.isEmpty()) {
        throw generator.error(index, TAMED_RANGE_INDEX);
      }
      String var = name.isEmpty() ? scope.freshName("i") : NodeUtil.identifierOf(name);
      String begin = scope.freshName("begin");
      String end = scope.freshName("end");
      String stepVar = scope.freshName("step");
      String eq = range.getBooleanProp(Node.Prop.EXCLUSIVE) ? "" : "=";
      Node from = range.getFirstChild();
      Node to = range.getSecondChild();
      t.init.add(IR.assign(IR.name(begin), from));
      t.init.add(IR.assign(IR.name(end), to));
      t.init.add(
          IR.assign(
              IR.name(stepVar),
              step.isEmpty() ? IR.js(begin + " <= " + end + " ? 1 : -1") : step));
      t.init.add(IR.assign(IR.name(var), IR.name(begin)));
      t.condition =
          IR.js(
              "(" + stepVar + " > 0 ? " + var + " <" + eq + " " + end
                  + " : " + var + " >" + eq + " " + end + ")");
      t.step = IR.js(var + " += " + stepVar);
      return t;
    }
    String ref = scope.freshName("ref");
    String i = scope.freshName("i");
    t.init.add(IR.assign(IR.name(ref), source));
    if (loop.getBooleanProp(Node.Prop.OBJECT)) {
      String keys = scope.freshName("keys");
      String k = scope.freshName("k");
      Node collect =
          IR.forLoop(
              IR.block(IR.name(k)),
              IR.name(ref),
              null,
              IR.name(k),
              null,
              null,
              true,
              loop.getBooleanProp(Node.Prop.OWN));
      t.init.add(IR.assign(IR.name(keys), IR.parens(collect)));
      t.init.add(IR.assign(IR.name(i), IR.number(0)));
      t.condition = IR.op("<", IR.name(i), IR.path(keys, "length"));
      String key = index.isEmpty() ? scope.freshName("key") : NodeUtil.identifierOf(index);
      t.prefix.add(IR.assign(IR.name(key), IR.js(keys + "[" + i + "]")));
      if (!name.isEmpty()) {
        t.prefix.add(IR.assign(name, IR.js(ref + "[" + key + "]")));
      }
    } else {
      String len = scope.freshName("len");
      t.init.add(IR.assign(IR.name(len), IR.js(ref + ".length")));
      t.init.add(IR.assign(IR.name(i), IR.number(0)));
      t.condition = IR.op("<", IR.name(i), IR.name(len));
      if (!name.isEmpty()) {
        t.prefix.add(IR.assign(name, IR.js(ref + "[" + i + "]")));
      }
      if (!index.isEmpty()) {
        t.prefix.add(IR.assign(index, IR.name(i)));
      }
    }
    t.step = step.isEmpty() ? IR.js("++" + i) : IR.assign(IR.name(i), step, "+=");
    return t;
  }

  private String compileTrampoline(Node loop, Trampoline t, CodeContext o) {
    Node body = NodeUtil.loopBody(loop);
    Node guard = t.guard;
    String top = o.getScope().freshName(IcedTransform.LOOP_TOP.substring(1));
    Node iteration = body.detach();
    if (!guard.isEmpty()) {
      Node skip = IR.block(IR.icedTailCall(IcedTransform.LOOP_NEXT, null));
      iteration = IR.block(IR.ifNode(guard, iteration, skip));
    }
    for (int i = t.prefix.size() - 1; i >= 0; i--) {
      iteration.addChildToFront(t.prefix.get(i));
    }

    Node again =
        CpsCascade.generated(
            IR.code(IR.block(IR.icedTailCall(top, IR.name(IcedTransform.CONTINUATION)))));
    Node continueBody = IR.block();
    if (t.step != null) {
      continueBody.addChildToBack(t.step);
    }
    continueBody.addChildToBack(
        IR.returnNode(IR.call(IR.path(IcedTransform.NS, "trampoline"), again)));

    Node exit = IR.block(IR.icedTailCall(IcedTransform.LOOP_BREAK, null));
    Node whileBody =
        IR.block(
            local(IcedTransform.LOOP_BREAK, IR.name(IcedTransform.CONTINUATION)),
            local(IcedTransform.LOOP_CONTINUE, CpsCascade.generated(IR.code(continueBody))),
            local(IcedTransform.LOOP_NEXT, IR.name(IcedTransform.LOOP_CONTINUE)),
            IR.ifNode(NodeUtil.invert(t.condition), exit, iteration));
    Node whileFn =
        CpsCascade.generated(
            IR.code(List.of(IR.param(IcedTransform.CONTINUATION)), whileBody));

    Node lowered = IR.block(t.init);
    lowered.addChildToBack(local(top, whileFn));
    lowered.addChildToBack(
        IR.call(IR.value(IR.name(top)), IR.name(IcedTransform.CONTINUATION)));
    return generator.compile(NodeUtil.substitute(loop, l -> lowered), o);
  }

  private static Node local(String name, Node value) {
    return IR.assign(IR.name(name), value).putBooleanProp(Node.Prop.LOCAL, true);
  }

  /** {@code break} and {@code continue} inside a suspending loop. */
  String compileTamedJump(Node n, CodeContext o) {
    String func =
        n.getToken() == Token.BREAK
            ? IcedTransform.LOOP_BREAK
            : IcedTransform.LOOP_CONTINUE;
    return o.isTop() ? o.getIndent() + "return " + func + "();" : func + "()";
  }
}
