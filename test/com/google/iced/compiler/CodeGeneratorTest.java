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
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodeGeneratorTest extends CompilerTestCase {

  @Test
  public void testAssignmentDeclaresVariable() {
    assertThat(compile(assign("x", num(1)))).isEqualTo("var x;\n\nx = 1;\n");
  }

  @Test
  public void testTopLevelWrapper() {
    options.setBareOutput(false);
    assertThat(compile(assign("x", num(1))))
        .isEqualTo(lines("(function() {", "  var x;", "", "  x = 1;", "", "}).call(this);", ""));
  }

  @Test
  public void testDirectivesHoistedAboveWrapper() {
    options.setBareOutput(false);
    assertThat(compile(IR.string("use strict"), assign("x", num(1))))
        .isEqualTo(
            lines(
                "\"use strict\";",
                "(function() {",
                "  var x;",
                "",
                "  x = 1;",
                "",
                "}).call(this);",
                ""));
  }

  @Test
  public void testLeadingCommentsStayAboveDeclarations() {
    assertThat(compile(IR.comment(" hi "), assign("x", num(1))))
        .isEqualTo(lines("/* hi */", "var x;", "", "x = 1;", ""));
    assertThat(compile(IR.string("use strict"), assign("x", num(1))))
        .isEqualTo(lines("\"use strict\";", "var x;", "", "x = 1;", ""));
  }

  @Test
  public void testFunction() {
    Node f = IR.code(List.of(IR.param("a")), IR.block(IR.op("+", name("a"), num(1))));
    assertThat(compile(assign("f", f)))
        .isEqualTo(lines("var f;", "", "f = function(a) {", "  return a + 1;", "};", ""));
  }

  @Test
  public void testIndentStyle() {
    options.setIndentStyle("    ");
    Node f = IR.code(IR.block(name("a")));
    assertThat(compile(assign("f", f)))
        .isEqualTo(lines("var f;", "", "f = function() {", "    return a;", "};", ""));
  }

  @Test
  public void testDefaultParameter() {
    Node f = IR.code(List.of(IR.param(name("a"), num(1))), IR.block(name("a")));
    assertThat(compile(assign("f", f)))
        .isEqualTo(
            lines(
                "var f;",
                "",
                "f = function(a) {",
                "  if (a == null) {",
                "    a = 1;",
                "  }",
                "  return a;",
                "};",
                ""));
  }

  @Test
  public void testThisParameter() {
    Node f = IR.code(List.of(IR.param(IR.thisProperty("name"))), IR.block());
    assertThat(compile(assign("f", f)))
        .isEqualTo(lines("var f;", "", "f = function(name) {", "  this.name = name;", "};", ""));
  }

  @Test
  public void testBoundFunctionCapturesThis() {
    Node f = IR.boundCode(List.of(), IR.block(IR.thisProperty("x")));
    assertThat(compile(assign("f", f)))
        .isEqualTo(
            lines(
                "var f,",
                "  _this = this;",
                "",
                "f = function() {",
                "  return _this.x;",
                "};",
                ""));
  }

  @Test
  public void testNestedBoundFunctionSharesAlias() {
    Node inner = IR.boundCode(List.of(), IR.block(IR.thisNode()));
    Node outer = IR.boundCode(List.of(), IR.block(inner));
    String code = compile(assign("f", outer));
    assertThat(code).contains("_this = this");
    assertThat(code).doesNotContain("_this1");
    assertThat(code).contains("return _this;");
  }

  @Test
  public void testSplatParameter() {
    Node f =
        IR.code(
            List.of(IR.param("first"), IR.splatParam(name("rest"))), IR.block(name("rest")));
    assertThat(run("f(1, 2, 3).join(',')", assign("f", f))).isEqualTo("2,3");
  }

  @Test
  public void testComparisonChain() {
    Node chain = IR.op("<", IR.op("<", name("a"), name("b")), name("c"));
    assertThat(compile(chain)).isEqualTo("\n(a < b && b < c);\n");
  }

  @Test
  public void testComparisonChainCachesMiddle() {
    Node chain = IR.op("<", IR.op("<", name("a"), call("f")), name("c"));
    assertThat(compile(chain)).isEqualTo("var _ref;\n\n(a < (_ref = f()) && _ref < c);\n");
  }

  @Test
  public void testEqualityIsStrict() {
    assertThat(compile(IR.op("==", name("a"), name("b")))).isEqualTo("\na === b;\n");
  }

  @Test
  public void testExistenceOfUndeclaredName() {
    assertThat(compile(IR.existence(name("a"))))
        .isEqualTo("\ntypeof a !== \"undefined\" && a !== null;\n");
  }

  @Test
  public void testExistenceOfDeclaredName() {
    assertThat(compile(assign("x", num(1)), IR.existence(name("x"))))
        .isEqualTo(lines("var x;", "", "x = 1;", "", "x != null;", ""));
  }

  @Test
  public void testExistenceOperator() {
    assertThat(run("y", assign("x", IR.nullNode()), assign("y", IR.op("?", name("x"), num(3)))))
        .isEqualTo("3");
    assertThat(run("y", assign("x", num(0)), assign("y", IR.op("?", name("x"), num(3)))))
        .isEqualTo("0");
  }

  @Test
  public void testSoakedAccess() {
    Node soak = IR.value(name("a"), IR.soakAccess("b"));
    assertThat(compile(assign("x", soak)))
        .isEqualTo("var x;\n\nx = typeof a !== \"undefined\" && a !== null ? a.b : void 0;\n");
  }

  @Test
  public void testSoakedAccessRuns() {
    Node soak = IR.value(name("a"), IR.soakAccess("b"), IR.access("c"));
    assertThat(run("String(x)", assign("a", IR.nullNode()), assign("x", soak)))
        .isEqualTo("undefined");
    Node obj = IR.obj(IR.prop("b", IR.obj(IR.prop("c", num(7)))));
    Node soak2 = IR.value(name("a"), IR.soakAccess("b"), IR.access("c"));
    assertThat(run("x", assign("a", obj), assign("x", soak2))).isEqualTo("7");
  }

  @Test
  public void testSoakedCall() {
    assertThat(compile(IR.soakCall(IR.value(name("f")))))
        .isEqualTo(lines("", "if (typeof f === \"function\") {", "  f();", "}", ""));
  }

  @Test
  public void testSplatCall() {
    assertThat(compile(IR.call(IR.value(name("f")), IR.splat(name("args")))))
        .isEqualTo("\nf.apply(null, args);\n");
    assertThat(compile(IR.call(IR.path("o", "m"), IR.splat(name("xs")))))
        .isEqualTo("\no.m.apply(o, xs);\n");
  }

  @Test
  public void testSplatCallWithLeadingArguments() {
    assertThat(compile(IR.call(IR.value(name("f")), num(1), IR.splat(name("xs")))))
        .isEqualTo(
            lines(
                "var __slice = [].slice;",
                "",
                "f.apply(null, [1].concat(__slice.call(xs)));",
                ""));
  }

  @Test
  public void testSplatArrayRuns() {
    Node arr = IR.arr(num(0), IR.splat(name("xs")), num(4));
    assertThat(run("ys.join(',')", assign("xs", IR.arr(num(1), num(2))), assign("ys", arr)))
        .isEqualTo("0,1,2,4");
  }

  @Test
  public void testNumberPropertyAccess() {
    assertThat(compile(IR.call(IR.value(num(5), IR.access("toString")))))
        .isEqualTo("\n5..toString();\n");
  }

  @Test
  public void testObjectLiteral() {
    Node obj = IR.obj(IR.prop("a", num(1)), IR.prop("b", num(2)));
    assertThat(compile(assign("o", obj)))
        .isEqualTo(lines("var o;", "", "o = {", "  a: 1,", "  b: 2", "};", ""));
  }

  @Test
  public void testEmptyObjectAsStatement() {
    assertThat(compile(IR.obj())).isEqualTo("\n({});\n");
  }

  @Test
  public void testIfExpression() {
    Node ifn = IR.ifNode(name("c"), IR.block(num(1)), IR.block(num(2)));
    assertThat(compile(assign("y", ifn))).isEqualTo("var y;\n\ny = c ? 1 : 2;\n");
  }

  @Test
  public void testElseIfChain() {
    Node ifn =
        IR.ifNode(
            name("a"),
            IR.block(call("f")),
            IR.ifNode(name("b"), IR.block(call("g")), IR.block(call("h"))));
    assertThat(compile(ifn))
        .isEqualTo(
            lines(
                "",
                "if (a) {",
                "  f();",
                "} else if (b) {",
                "  g();",
                "} else {",
                "  h();",
                "}",
                ""));
  }

  @Test
  public void testSwitch() {
    Node sw =
        IR.switchNode(
            name("x"),
            List.of(IR.caseNode(num(1), IR.block(call("a")))),
            IR.block(call("b")));
    assertThat(compile(sw))
        .isEqualTo(
            lines(
                "",
                "switch (x) {",
                "  case 1:",
                "    a();",
                "    break;",
                "  default:",
                "    b();",
                "}",
                ""));
  }

  @Test
  public void testSwitchWithoutSubjectRuns() {
    Node sw =
        IR.switchNode(
            null,
            List.of(
                IR.caseNode(
                    IR.op(">", name("n"), num(10)), IR.block(assign("r", IR.string("big")))),
                IR.caseNode(
                    IR.op(">", name("n"), num(0)), IR.block(assign("r", IR.string("pos"))))),
            IR.block(assign("r", IR.string("other"))));
    assertThat(run("r", assign("n", num(5)), sw)).isEqualTo("pos");
  }

  @Test
  public void testTryCatch() {
    Node t = IR.tryNode(IR.block(call("a")), name("e"), IR.block(call("b")), null);
    assertThat(compile(t))
        .isEqualTo(lines("", "try {", "  a();", "} catch (e) {", "  b();", "}", ""));
  }

  @Test
  public void testTryFinally() {
    Node t = IR.tryNode(IR.block(call("a")), null, null, IR.block(call("b")));
    assertThat(compile(t))
        .isEqualTo(lines("", "try {", "  a();", "} finally {", "  b();", "}", ""));
  }

  @Test
  public void testBareTry() {
    Node t = IR.tryNode(IR.block(call("a")), null, null, null);
    assertThat(compile(t)).isEqualTo(lines("", "try {", "  a();", "} catch (_error) {}", ""));
  }

  @Test
  public void testStatementAsExpressionIsWrapped() {
    Node t = IR.tryNode(IR.block(call("a")), null, null, null);
    assertThat(compile(assign("y", t)))
        .isEqualTo(
            lines(
                "var y;",
                "",
                "y = (function() {",
                "  try {",
                "    return a();",
                "  } catch (_error) {}",
                "})();",
                ""));
  }

  @Test
  public void testClosureForwardsThis() {
    Node t = IR.tryNode(IR.block(IR.thisProperty("x")), null, null, null);
    assertThat(compile(assign("y", t))).contains("}).call(this);");
  }

  @Test
  public void testJumpInExpressionFails() {
    assertThat(compileError(assign("y", IR.block(IR.returnNode(num(1))))))
        .isEqualTo(CodeGenerator.STATEMENT_IN_EXPRESSION);
  }

  @Test
  public void testMembershipInLiteralArray() {
    assertThat(compile(IR.in(name("x"), IR.arr(num(1), num(2)))))
        .isEqualTo("\nx === 1 || x === 2;\n");
    assertThat(compile(IR.notIn(name("x"), IR.arr(num(1), num(2)))))
        .isEqualTo("\nx !== 1 && x !== 2;\n");
  }

  @Test
  public void testMembershipInArrayRuns() {
    Node test = IR.in(num(2), name("xs"));
    assertThat(run("found", assign("xs", IR.arr(num(1), num(2))), assign("found", test)))
        .isEqualTo("true");
  }

  @Test
  public void testDuplicateParameter() {
    Node f = IR.code(List.of(IR.param("a"), IR.param("a")), IR.block());
    CompilationException e =
        assertThrows(CompilationException.class, () -> compile(assign("f", f)));
    assertThat(e.getType()).isEqualTo(CodeGenerator.DUPLICATE_PARAM);
    assertThat(e).hasMessageThat().isEqualTo("SyntaxError: multiple parameters named 'a'");
  }

  @Test
  public void testReservedParameter() {
    Node f = IR.code(List.of(IR.param("class")), IR.block());
    assertThat(compileError(assign("f", f))).isEqualTo(CodeGenerator.RESERVED_NAME);
  }

  @Test
  public void testMultipleSplatParameters() {
    Node f =
        IR.code(List.of(IR.splatParam(name("a")), IR.splatParam(name("b"))), IR.block());
    assertThat(compileError(assign("f", f))).isEqualTo(CodeGenerator.MULTIPLE_SPLAT_PARAMS);
  }

  @Test
  public void testDuplicateKey() {
    Node obj = IR.obj(IR.prop("a", num(1)), IR.prop("a", num(2)));
    assertThat(compileError(assign("o", obj))).isEqualTo(CodeGenerator.DUPLICATE_KEY);
  }

  @Test
  public void testSuperOutsideMethod() {
    assertThat(compileError(IR.superCall())).isEqualTo(CodeGenerator.SUPER_OUTSIDE_METHOD);
  }

  @Test
  public void testSuperInAnonymousFunction() {
    Node f = IR.code(IR.block(IR.superCall()));
    assertThat(compileError(IR.call(f))).isEqualTo(CodeGenerator.SUPER_ANONYMOUS);
  }

  @Test
  public void testErrorCarriesPosition() {
    options.setSourceName("input.iced");
    Node bad = IR.assign(num(1), num(2)).setLinenoCharno(3, 7);
    CompilationException e = assertThrows(CompilationException.class, () -> compile(bad));
    assertThat(e.getError().lineno()).isEqualTo(3);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("input.iced:3:7: SyntaxError: \"1\" cannot be assigned.");
  }
}
