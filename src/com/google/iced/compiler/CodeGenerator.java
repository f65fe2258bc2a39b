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

import com.google.common.annotations.VisibleForTesting;
import com.google.iced.ast.IR;
import com.google.iced.ast.Node;
import com.google.iced.ast.Token;
import com.google.iced.compiler.CodeContext.Level;
import com.google.iced.compiler.IcedFlags.Flag;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator emits the target-language source for a tree.
 *
 * <p>Every node compiles to a string fragment, given a {@link CodeContext} that carries the
 * precedence level it sits at, the current indent and the lexical {@link Scope}. A node that can
 * only be emitted as a statement but appears where an expression is needed is wrapped in an
 * immediately invoked function. Higher-level constructs are first rewritten into simpler nodes,
 * in place, and the rewritten nodes are compiled instead; a tree is therefore consumed by
 * compiling it.
 *
 * <p>Lowering of assignments, classes, loops and the suspension constructs lives in companion
 * classes that call back into this one.
 */
public final class CodeGenerator {

  static final DiagnosticType STATEMENT_IN_EXPRESSION =
      DiagnosticType.syntax(
          "ICED_STATEMENT_IN_EXPRESSION", "cannot use a pure statement in an expression.");

  static final DiagnosticType SUPER_OUTSIDE_METHOD =
      DiagnosticType.syntax(
          "ICED_SUPER_OUTSIDE_METHOD", "cannot call super outside of a function.");

  static final DiagnosticType SUPER_ANONYMOUS =
      DiagnosticType.syntax(
          "ICED_SUPER_ANONYMOUS", "cannot call super on an anonymous function.");

  static final DiagnosticType DUPLICATE_KEY =
      DiagnosticType.syntax(
          "ICED_DUPLICATE_KEY", "multiple object literal properties named \"{0}\"");

  static final DiagnosticType DUPLICATE_PARAM =
      DiagnosticType.syntax("ICED_DUPLICATE_PARAM", "multiple parameters named ''{0}''");

  static final DiagnosticType MULTIPLE_SPLAT_PARAMS =
      DiagnosticType.syntax(
          "ICED_MULTIPLE_SPLAT_PARAMS", "only one splat parameter is allowed per function");

  static final DiagnosticType RESERVED_NAME =
      DiagnosticType.syntax("ICED_RESERVED_NAME", "reserved word \"{0}\" cannot be declared");

  private final CompilerOptions options;
  private final IcedFlags flags;
  private final String tab;

  private final Set<Node> front = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Set<Node> spaced = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Map<Node, String> thisAliases = new IdentityHashMap<>();

  private final SoakUnfolder soaks;
  private final AssignmentLowering assignments;
  private final ClassLowering classes;
  private final LoopCompiler loops;
  private final DeferralLowering deferrals;

  public CodeGenerator(CompilerOptions options, IcedFlags flags) {
    this.options = options;
    this.flags = flags;
    this.tab = options.getIndentStyle();
    this.soaks = new SoakUnfolder(this);
    this.assignments = new AssignmentLowering(this);
    this.classes = new ClassLowering(this);
    this.loops = new LoopCompiler(this);
    this.deferrals = new DeferralLowering(this);
  }

  /**
   * Emits a whole program. Unless the output is bare, the program is wrapped in a function called
   * with the top-level {@code this}, and leading comments and directive strings are hoisted above
   * the wrapper.
   */
  public String compileRoot(Node root) {
    checkArgument(root.isBlock(), root);
    boolean bare = options.isBareOutput();
    CodeContext o = CodeContext.create(Scope.createRoot(root), bare ? "" : tab, tab);
    spaced.add(root);
    String prelude = "";
    if (!bare) {
      List<Node> prologue = new ArrayList<>();
      for (Node c = root.getFirstChild(); c != null; c = c.getNext()) {
        Node e = NodeUtil.unwrap(c);
        if (!e.isComment() && !e.isString()) {
          break;
        }
        prologue.add(c);
      }
      for (Node c : prologue) {
        c.detach();
      }
      if (!prologue.isEmpty()) {
        prelude = compileStatements(prologue, o.withIndent(""), false) + "\n";
      }
    }
    String code = compileWithDeclarations(root, o);
    if (bare) {
      return code;
    }
    return prelude + "(function() {\n" + code + "\n}).call(this);\n";
  }

  CompilerOptions getOptions() {
    return options;
  }

  IcedFlags getFlags() {
    return flags;
  }

  String getTab() {
    return tab;
  }

  String compile(Node n, CodeContext o, Level level) {
    return compile(n, o.withLevel(level));
  }

  /**
   * Compiles {@code n} at the context's level: splits it first if it is a pivot that still has a
   * continuation, and wraps it in a closure if it is a statement in expression position.
   */
  String compile(Node n, CodeContext o) {
    Node node = soaks.unfold(n, o);
    if (node == null) {
      node = n;
    }
    if (flags.needsSplit(node)) {
      return compileSplit(node, o);
    }
    if (o.isTop() || !NodeUtil.isStatement(node, o.getLevel())) {
      return compileNode(node, o);
    }
    return compileClosure(node, o);
  }

  private String compileSplit(Node pivot, CodeContext o) {
    flags.markSplit(pivot);
    Node rest = flags.getContinuation(pivot);
    Node call = NodeUtil.substitute(pivot, p -> CpsCascade.wrap(p, rest));
    String code = compileNode(call, o);
    return o.isTop() ? o.getIndent() + code + ";" : code;
  }

  private String compileClosure(Node n, CodeContext o) {
    Node jump = NodeUtil.jumps(n);
    if (jump != null) {
      throw error(jump, STATEMENT_IN_EXPRESSION);
    }
    Node call = NodeUtil.substitute(n, ClosureWrapper::wrap);
    return compileNode(call, o.withSharedScope(true));
  }

  String compileNode(Node n, CodeContext o) {
    switch (n.getToken()) {
      case BLOCK:
        return compileBlock(n, o);
      case NAME:
      case NUMBER:
      case STRING:
      case REGEXP:
      case JS_LITERAL:
        return n.getString();
      case THIS:
        return compileThis(o);
      case NULL:
        return "null";
      case UNDEFINED:
        return "void 0";
      case TRUE:
        return "true";
      case FALSE:
        return "false";
      case BREAK:
      case CONTINUE:
        return compileJump(n, o);
      case DEBUGGER:
        return o.getIndent() + "debugger;";
      case COMMENT:
        return compileComment(n, o);
      case RETURN:
        return compileReturn(n, o);
      case THROW:
        return o.getIndent() + "throw " + compile(n.getFirstChild(), o, Level.PAREN) + ";";
      case VALUE:
        return compileValue(n, o);
      case ACCESS:
        return compileAccess(n);
      case INDEX:
        return "[" + compile(n.getFirstChild(), o, Level.PAREN) + "]";
      case SLICE:
        return loops.compileSlice(n, o);
      case RANGE:
        return loops.compileRange(n, o);
      case CALL:
        return compileCall(n, o);
      case SUPER_CALL:
        return compileSuperCall(n, o);
      case EXTENDS:
        return compileExtends(n, o);
      case OBJ:
        return compileObj(n, o);
      case ARR:
        return compileArr(n, o);
      case CLASS:
        return classes.compile(n, o);
      case ASSIGN:
        return assignments.compile(n, o);
      case CODE:
        return compileCode(n, o);
      case PARAM:
      case SPLAT:
        return compile(n.getFirstChild(), o);
      case WHILE:
        return loops.compileWhile(n, o);
      case FOR:
        return loops.compileFor(n, o);
      case OP:
        return compileOp(n, o);
      case IN:
        return compileIn(n, o);
      case EXISTENCE:
        return compileExistence(n, o);
      case PARENS:
        return compileParens(n, o);
      case IF:
        return NodeUtil.isStatement(n, o.getLevel())
            ? compileIfStatement(n, o)
            : compileIfExpression(n, o);
      case SWITCH:
        return compileSwitch(n, o);
      case TRY:
        return compileTry(n, o);
      case AWAIT:
        return deferrals.compileAwait(n, o);
      case DEFER:
        return deferrals.compileDefer(n, o);
      case ICED_RUNTIME:
        return deferrals.compileRuntime(n, o);
      case ICED_TAIL_CALL:
        return compileTailCall(n, o);
      case ICED_REQUIRE:
      case EMPTY:
        return "";
      default:
        throw new IllegalStateException("Unexpected node: " + n);
    }
  }

  // Blocks

  String compileBlock(Node block, CodeContext o) {
    return compileStatements(block.childList(), o, spaced.contains(block));
  }

  /**
   * At the top level, emits one indented statement per line. Elsewhere, emits the statements as a
   * comma-separated expression list.
   */
  String compileStatements(List<Node> statements, CodeContext o, boolean spacedOut) {
    boolean top = o.isTop();
    List<String> codes = new ArrayList<>();
    for (Node child : statements) {
      if (child.isEmpty() || child.getToken() == Token.ICED_REQUIRE) {
        continue;
      }
      String code;
      if (flags.needsSplit(child)) {
        code = compile(child, o);
      } else {
        Node node = NodeUtil.unwrapAll(child);
        Node unfolded = soaks.unfold(node, o);
        if (unfolded != null) {
          node = unfolded;
        }
        if (node.isBlock()) {
          code = compileBlock(node, o);
        } else if (top) {
          front.add(node);
          code = compile(node, o);
          if (!NodeUtil.isStatement(node, Level.TOP)) {
            code = o.getIndent() + code + ";";
          }
        } else {
          code = compile(node, o, Level.LIST);
        }
      }
      if (!code.isEmpty()) {
        codes.add(code);
      }
    }
    if (top) {
      return spacedOut ? "\n" + String.join("\n\n", codes) + "\n" : String.join("\n", codes);
    }
    String code = codes.isEmpty() ? "void 0" : String.join(", ", codes);
    return codes.size() > 1 && o.getLevel().atLeast(Level.LIST) ? "(" + code + ")" : code;
  }

  /**
   * Compiles a function body or the program, followed by the {@code var} statement for the scope
   * that owns it. Leading comments and strings stay above the declarations.
   */
  String compileWithDeclarations(Node block, CodeContext o) {
    o = o.withLevel(Level.TOP);
    List<Node> statements = block.childList();
    int i = 0;
    while (i < statements.size()) {
      Node e = NodeUtil.unwrap(statements.get(i));
      if (!e.isComment() && !e.isString()) {
        break;
      }
      i++;
    }
    String code = i > 0 ? compileStatements(statements.subList(0, i), o, false) : "";
    String post =
        compileStatements(statements.subList(i, statements.size()), o, spaced.contains(block));
    Scope scope = o.getScope();
    if (scope.getBlock() == block) {
      boolean declars = scope.hasDeclarations();
      boolean assigns = scope.hasAssignments();
      if (declars || assigns) {
        StringBuilder sb = new StringBuilder(code);
        if (i > 0) {
          sb.append('\n');
        }
        String separator = ",\n" + o.getIndent() + tab;
        sb.append(o.getIndent()).append("var ");
        if (declars) {
          sb.append(String.join(", ", scope.declaredNames()));
        }
        if (assigns) {
          if (declars) {
            sb.append(separator);
          }
          sb.append(String.join(separator, scope.assignedNames()));
        }
        code = sb.append(";\n").toString();
      } else if (!code.isEmpty() && !post.isEmpty()) {
        code += "\n";
      }
    }
    return code + post;
  }

  void markFront(Node n) {
    front.add(n);
  }

  boolean isFront(Node n) {
    return front.contains(n);
  }

  /** Separates the statements of {@code block} with blank lines. */
  void markSpaced(Node block) {
    spaced.add(block);
  }

  // Literals and jumps

  private String compileThis(CodeContext o) {
    Node method = o.getScope().getMethod();
    return method != null && method.getBooleanProp(Node.Prop.BOUND) ? thisAlias(method) : "this";
  }

  /** The name {@code this} is captured as inside the bound function {@code code}. */
  String thisAlias(Node code) {
    String alias = thisAliases.get(code);
    return alias == null ? "_this" : alias;
  }

  void setThisAlias(Node code, String alias) {
    thisAliases.put(code, alias);
  }

  private String compileJump(Node n, CodeContext o) {
    if (flags.has(n, Flag.TAMED_LOOP)) {
      return loops.compileTamedJump(n, o);
    }
    return o.getIndent() + (n.getToken() == Token.BREAK ? "break" : "continue") + ";";
  }

  private static String compileComment(Node n, CodeContext o) {
    String code = "/*" + n.getString().replace("\n", "\n" + o.getIndent()) + "*/";
    return o.isTop() ? o.getIndent() + code : code;
  }

  private String compileReturn(Node n, CodeContext o) {
    Node expr = n.getFirstChild();
    boolean autocb = flags.has(n, Flag.AUTOCB);
    if (expr != null && distributesReturn(NodeUtil.unwrapAll(expr))) {
      Node target = NodeUtil.unwrapAll(expr);
      NodeUtil.substitute(n, r -> target);
      NodeUtil.makeReturn(target, null);
      if (autocb) {
        NodeTraversal.traverse(
            target,
            new NodeTraversal.AbstractShallowCallback() {
              @Override
              public void visit(NodeTraversal t, Node inner, @Nullable Node parent) {
                if (inner.isReturn()) {
                  flags.set(inner, Flag.AUTOCB);
                }
              }
            });
      }
      return compile(target, o);
    }
    String tab = o.getIndent();
    String value = expr == null ? "" : compile(expr, o, Level.PAREN);
    if (autocb) {
      return tab + IcedTransform.AUTOCB + "(" + value + ");\n" + tab + "return;";
    }
    return tab + "return" + (value.isEmpty() ? "" : " " + value) + ";";
  }

  private static boolean distributesReturn(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case IF:
      case SWITCH:
      case TRY:
      case WHILE:
      case FOR:
        return true;
      default:
        return false;
    }
  }

  /** A call to a continuation; in statement position it also leaves the current function. */
  private String compileTailCall(Node n, CodeContext o) {
    Node value = n.getFirstChild();
    String args = value.isEmpty() ? "" : compile(value, o, Level.LIST);
    String call = n.getString() + "(" + args + ")";
    return o.isTop() ? o.getIndent() + "return " + call + ";" : call;
  }

  // Values and calls

  private String compileValue(Node n, CodeContext o) {
    List<Node> children = n.childList();
    Node base = children.get(0);
    List<Node> props = children.subList(1, children.size());
    if (front.contains(n)) {
      front.add(base);
    }
    StringBuilder code =
        new StringBuilder(props.isEmpty() ? compile(base, o) : compile(base, o, Level.ACCESS));
    if ((base.isParens() || !props.isEmpty()) && NodeUtil.isSimpleNumber(code.toString())) {
      code.append('.');
    }
    for (Node prop : props) {
      code.append(compile(prop, o));
    }
    return code.toString();
  }

  private static String compileAccess(Node n) {
    String name = n.getFirstChild().getString();
    return NodeUtil.isIdentifier(name) ? "." + name : "[" + name + "]";
  }

  private String compileCall(Node n, CodeContext o) {
    List<Node> children = n.childList();
    Node callee = children.get(0);
    List<Node> args = children.subList(1, children.size());
    if (front.contains(n)) {
      front.add(callee);
    }
    String splatArgs = compileSplattedArray(args, o, true);
    if (splatArgs != null) {
      return compileSplatCall(n, callee, splatArgs, o);
    }
    List<String> codes = new ArrayList<>();
    for (Node arg : args) {
      codes.add(compile(arg, o, Level.LIST));
    }
    String prefix = n.getBooleanProp(Node.Prop.NEW) ? "new " : "";
    return prefix + compile(callee, o, Level.ACCESS) + "(" + String.join(", ", codes) + ")";
  }

  /** A call with splatted arguments goes through {@code apply}, keeping the receiver. */
  private String compileSplatCall(Node n, Node callee, String splatArgs, CodeContext o) {
    if (n.getBooleanProp(Node.Prop.NEW)) {
      String idt = o.getIndent() + tab;
      return "(function(func, args, ctor) {\n"
          + idt
          + "ctor.prototype = func.prototype;\n"
          + idt
          + "var child = new ctor, result = func.apply(child, args), t = typeof result;\n"
          + idt
          + "return t == \"object\" || t == \"function\" ? result || child : child;\n"
          + o.getIndent()
          + "})("
          + compile(callee, o, Level.LIST)
          + ", "
          + splatArgs
          + ", function(){})";
    }
    Node base = callee.isValue() ? callee : NodeUtil.substitute(callee, IR::value);
    Node name = NodeUtil.hasProperties(base) ? base.getLastChild().detach() : null;
    String fun;
    String ref;
    if (name != null && NodeUtil.isComplex(base)) {
      ref = o.getScope().freshName("ref");
      fun = "(" + ref + " = " + compile(base, o, Level.LIST) + ")" + compile(name, o);
    } else {
      fun = compile(base, o, Level.ACCESS);
      if (NodeUtil.isSimpleNumber(fun)) {
        fun = "(" + fun + ")";
      }
      if (name != null) {
        ref = fun;
        fun += compile(name, o);
      } else {
        ref = "null";
      }
    }
    return fun + ".apply(" + ref + ", " + splatArgs + ")";
  }

  private String compileSuperCall(Node n, CodeContext o) {
    String ref = superReference(n, o);
    if (n.getBooleanProp(Node.Prop.IMPLICIT_ARGS)) {
      return ref + ".apply(this, arguments)";
    }
    List<Node> args = n.childList();
    String splatArgs = compileSplattedArray(args, o, true);
    if (splatArgs != null) {
      return ref + ".apply(this, " + splatArgs + ")";
    }
    StringBuilder code = new StringBuilder(ref).append(".call(this");
    for (Node arg : args) {
      code.append(", ").append(compile(arg, o, Level.LIST));
    }
    return code.append(')').toString();
  }

  /** The parent implementation of the method {@code super} appears in. */
  private String superReference(Node n, CodeContext o) {
    Node method = o.getScope().namedMethod();
    if (method == null) {
      throw error(n, SUPER_OUTSIDE_METHOD);
    }
    String name = (String) method.getProp(Node.Prop.METHOD_NAME);
    if (name == null) {
      throw error(n, SUPER_ANONYMOUS);
    }
    String klass = (String) method.getProp(Node.Prop.CLASS_NAME);
    if (klass == null) {
      return name + ".__super__.constructor";
    }
    Node ref = IR.value(IR.name(klass), IR.access("__super__"));
    if (method.getBooleanProp(Node.Prop.STATIC)) {
      ref.addChildToBack(IR.access("constructor"));
    }
    ref.addChildToBack(IR.access(name));
    return compile(ref, o);
  }

  private String compileExtends(Node n, CodeContext o) {
    String helper = o.getScope().useHelper(RuntimeHelper.EXTENDS);
    Node child = n.getFirstChild();
    Node parent = n.getSecondChild();
    return compile(IR.call(IR.value(IR.name(helper)), child, parent), o);
  }

  /**
   * Compiles a list that contains splats into a single array expression, or returns null if it
   * contains none. With {@code apply}, a lone splat is passed through without copying.
   */
  @Nullable String compileSplattedArray(List<Node> list, CodeContext o, boolean apply) {
    int index = -1;
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).isSplat()) {
        index = i;
        break;
      }
    }
    if (index < 0) {
      return null;
    }
    if (list.size() == 1) {
      String code = compile(list.get(0).getFirstChild(), o, Level.LIST);
      return apply ? code : o.getScope().useHelper(RuntimeHelper.SLICE) + ".call(" + code + ")";
    }
    String slice = o.getScope().useHelper(RuntimeHelper.SLICE);
    List<String> args = new ArrayList<>();
    for (Node node : list.subList(index, list.size())) {
      if (node.isSplat()) {
        args.add(slice + ".call(" + compile(node.getFirstChild(), o, Level.LIST) + ")");
      } else {
        args.add("[" + compile(node, o, Level.LIST) + "]");
      }
    }
    if (index == 0) {
      return args.get(0) + ".concat(" + String.join(", ", args.subList(1, args.size())) + ")";
    }
    List<String> base = new ArrayList<>();
    for (Node node : list.subList(0, index)) {
      base.add(compile(node, o, Level.LIST));
    }
    return "[" + String.join(", ", base) + "].concat(" + String.join(", ", args) + ")";
  }

  // Object and array literals

  private String compileObj(Node n, CodeContext o) {
    List<Node> props = n.childList();
    checkDuplicateKeys(props);
    boolean isFront = front.contains(n);
    if (props.isEmpty()) {
      return isFront ? "({})" : "{}";
    }
    CodeContext inner = o.indented().withLevel(Level.TOP);
    Node lastNoncom = NodeUtil.lastNonComment(n);
    StringBuilder code = new StringBuilder();
    for (int i = 0; i < props.size(); i++) {
      Node prop = props.get(i);
      String join;
      if (i == props.size() - 1) {
        join = "";
      } else if (prop == lastNoncom || prop.isComment()) {
        join = "\n";
      } else {
        join = ",\n";
      }
      String indent = prop.isComment() ? "" : inner.getIndent();
      if (NodeUtil.isThisProperty(prop)) {
        String name = prop.getLastChild().getFirstChild().getString();
        prop = NodeUtil.substitute(prop, p -> IR.assign(IR.value(IR.name(name)), p, "object"));
      } else if (!prop.isComment() && !NodeUtil.isObjectProperty(prop)) {
        prop = NodeUtil.substitute(prop, p -> IR.assign(p.cloneTree(), p, "object"));
      }
      code.append(indent).append(compile(prop, inner)).append(join);
    }
    String obj = "{\n" + code + "\n" + o.getIndent() + "}";
    return isFront ? "(" + obj + ")" : obj;
  }

  private void checkDuplicateKeys(List<Node> props) {
    List<String> names = new ArrayList<>();
    for (Node prop : props) {
      String name = keyName(prop);
      if (name == null) {
        continue;
      }
      if (names.contains(name)) {
        throw error(prop, DUPLICATE_KEY, name);
      }
      names.add(name);
    }
  }

  private static @Nullable String keyName(Node prop) {
    if (prop.isComment()) {
      return null;
    }
    Node key;
    if (NodeUtil.isObjectProperty(prop)) {
      key = NodeUtil.unwrapAll(prop.getFirstChild());
    } else if (NodeUtil.isThisProperty(prop)) {
      key = prop.getLastChild().getFirstChild();
    } else {
      key = NodeUtil.unwrapAll(prop);
    }
    return key.getToken().hasStringPayload() ? key.getString() : null;
  }

  private String compileArr(Node n, CodeContext o) {
    if (!n.hasChildren()) {
      return "[]";
    }
    CodeContext inner = o.indented().withLevel(Level.LIST);
    List<Node> objects = n.childList();
    String splat = compileSplattedArray(objects, inner, false);
    if (splat != null) {
      return splat;
    }
    List<String> codes = new ArrayList<>();
    for (Node obj : objects) {
      codes.add(compile(obj, inner));
    }
    String code = String.join(", ", codes);
    if (code.contains("\n")) {
      return "[\n" + inner.getIndent() + code + "\n" + o.getIndent() + "]";
    }
    return "[" + code + "]";
  }

  // Functions

  private String compileCode(Node n, CodeContext o) {
    Node body = n.getLastChild();
    Scope scope = new Scope(o.getScope(), body, n);
    scope.setShared(o.isSharedScope() || n.getBooleanProp(Node.Prop.GENERATED));
    CodeContext inner = CodeContext.create(scope, o.getIndent() + tab, tab);

    List<Node> params = n.getFirstChild().childList();
    List<String> names = new ArrayList<>();
    for (Node param : params) {
      collectParamNames(param.getFirstChild(), names);
    }
    List<String> seen = new ArrayList<>();
    for (String name : names) {
      if (NodeUtil.RESERVED.contains(name)) {
        throw error(n, RESERVED_NAME, name);
      }
      if (seen.contains(name)) {
        throw error(n, DUPLICATE_PARAM, name);
      }
      seen.add(name);
      if (!scope.isDeclared(name)) {
        scope.declareParameter(name);
      }
    }
    int splats = 0;
    for (Node param : params) {
      if (param.getBooleanProp(Node.Prop.SPLAT)) {
        splats++;
      }
    }
    if (splats > 1) {
      throw error(n, MULTIPLE_SPLAT_PARAMS);
    }

    List<Node> refs = new ArrayList<>();
    for (Node param : params) {
      refs.add(asReference(param, scope));
    }
    List<Node> exprs = new ArrayList<>();
    if (flags.has(n, Flag.FUNCTION_AWAITS)) {
      exprs.add(
          IR.assign(IR.name(IcedTransform.CONTINUATION), IR.name(IcedTransform.NOOP))
              .putBooleanProp(Node.Prop.LOCAL, true));
    }
    if (splats > 0) {
      List<Node> elements = new ArrayList<>();
      for (int i = 0; i < params.size(); i++) {
        Node name = params.get(i).getFirstChild();
        String id =
            NodeUtil.isThisProperty(name)
                ? thisPropertyName(name)
                : NodeUtil.identifierOf(name);
        if (id != null) {
          scope.add(id, Scope.Kind.VAR, true);
        }
        elements.add(refs.get(i).cloneTree());
      }
      exprs.add(IR.assign(IR.value(IR.arr(elements)), IR.value(IR.name("arguments"))));
    }
    for (int i = 0; i < params.size(); i++) {
      Node param = params.get(i);
      Node name = param.getFirstChild();
      Node defaultValue = param.getSecondChild();
      if (NodeUtil.isComplex(param)) {
        Node val = refs.get(i).cloneTree();
        if (!defaultValue.isEmpty()) {
          val = IR.op("?", val, defaultValue);
        }
        exprs.add(IR.assign(name, val).putBooleanProp(Node.Prop.PARAM, true));
      } else if (!defaultValue.isEmpty()) {
        String id = NodeUtil.identifierOf(name);
        exprs.add(
            IR.ifNode(
                IR.js(id + " == null"),
                IR.block(IR.assign(IR.value(IR.name(id)), defaultValue))));
      }
    }
    boolean wasEmpty = !body.hasChildren();
    for (int i = exprs.size() - 1; i >= 0; i--) {
      body.addChildToFront(exprs.get(i));
    }
    List<String> compiledParams = new ArrayList<>();
    if (splats == 0) {
      for (Node ref : refs) {
        String p = compile(ref, inner, Level.LIST);
        scope.declareParameter(p);
        compiledParams.add(p);
      }
    }
    if (!wasEmpty && !n.getBooleanProp(Node.Prop.NO_RETURN)) {
      NodeUtil.makeReturn(body, null);
    }
    if (n.getBooleanProp(Node.Prop.BOUND)) {
      Node parentMethod = o.getScope().getMethod();
      if (parentMethod != null && parentMethod.getBooleanProp(Node.Prop.BOUND)) {
        thisAliases.put(n, thisAlias(parentMethod));
      } else if (!n.getBooleanProp(Node.Prop.STATIC)) {
        o.getScope().assign("_this", "this");
      }
    }

    boolean ctor = n.getBooleanProp(Node.Prop.CTOR);
    StringBuilder code = new StringBuilder("function");
    if (ctor) {
      code.append(' ').append(n.getProp(Node.Prop.METHOD_NAME));
    }
    code.append('(').append(String.join(", ", compiledParams)).append(") {");
    if (body.hasChildren()) {
      code.append('\n')
          .append(compileWithDeclarations(body, inner))
          .append('\n')
          .append(o.getIndent());
    }
    code.append('}');
    if (ctor) {
      return o.getIndent() + code;
    }
    boolean wrap = front.contains(n) || o.getLevel().atLeast(Level.ACCESS);
    return wrap ? "(" + code + ")" : code.toString();
  }

  /** The names a parameter binds, descending into destructuring patterns. */
  private static void collectParamNames(Node name, List<String> out) {
    switch (name.getToken()) {
      case NAME:
        out.add(name.getString());
        return;
      case SPLAT:
        collectParamNames(name.getFirstChild(), out);
        return;
      case VALUE:
        if (NodeUtil.isThisProperty(name)) {
          String id = thisPropertyName(name);
          if (!NodeUtil.RESERVED.contains(id)) {
            out.add(id);
          }
        } else if (!NodeUtil.hasProperties(name)) {
          collectParamNames(name.getFirstChild(), out);
        }
        return;
      case ARR:
        for (Node e = name.getFirstChild(); e != null; e = e.getNext()) {
          collectParamNames(e, out);
        }
        return;
      case OBJ:
        for (Node prop = name.getFirstChild(); prop != null; prop = prop.getNext()) {
          if (NodeUtil.isObjectProperty(prop)) {
            collectParamNames(prop.getSecondChild(), out);
          } else if (!prop.isComment()) {
            collectParamNames(prop, out);
          }
        }
        return;
      default:
        return;
    }
  }

  /** The local name a parameter is received under. */
  private static Node asReference(Node param, Scope scope) {
    Node name = param.getFirstChild();
    Node node;
    if (NodeUtil.isThisProperty(name)) {
      String id = thisPropertyName(name);
      node = IR.name(NodeUtil.RESERVED.contains(id) ? scope.freshName(id) : id);
    } else if (NodeUtil.isComplex(name)) {
      node = IR.name(scope.freshName("arg"));
    } else {
      node = name.cloneTree();
    }
    return param.getBooleanProp(Node.Prop.SPLAT) ? IR.splat(node) : node;
  }

  static String thisPropertyName(Node value) {
    return value.getLastChild().getFirstChild().getString();
  }

  // Operators

  private String compileOp(Node n, CodeContext o) {
    Node first = n.getFirstChild();
    boolean isChain = NodeUtil.isChainable(n) && NodeUtil.isChainable(first);
    if (!isChain && front.contains(n)) {
      front.add(first);
    }
    if (NodeUtil.isUnary(n)) {
      return compileUnary(n, o);
    }
    if (isChain) {
      return compileChain(n, o);
    }
    if (n.getString().equals("?")) {
      return compileExistenceOp(n, o);
    }
    Node second = n.getSecondChild();
    String code =
        compile(first, o, Level.OP) + " " + n.getString() + " " + compile(second, o, Level.OP);
    return o.getLevel().atMost(Level.OP) ? code : "(" + code + ")";
  }

  /** {@code a < b < c} becomes {@code a < b && b < c}, evaluating {@code b} once. */
  private String compileChain(Node n, CodeContext o) {
    Node first = n.getFirstChild();
    Node second = n.getSecondChild();
    Node[] cached = cache(first.getSecondChild(), o);
    if (!cached[0].hasParent()) {
      first.addChildToBack(cached[0]);
    }
    String fst = compile(first, o, Level.OP);
    String code =
        fst
            + " && "
            + compile(cached[1], o)
            + " "
            + n.getString()
            + " "
            + compile(second, o, Level.OP);
    return "(" + code + ")";
  }

  /** {@code a ? b}: {@code a} if it exists, else {@code b}. */
  private String compileExistenceOp(Node n, CodeContext o) {
    Node first = n.getFirstChild();
    Node second = n.getSecondChild();
    Node fst;
    Node ref;
    if (NodeUtil.isComplex(first)) {
      String name = o.getScope().freshName("ref");
      fst = IR.parens(IR.assign(IR.name(name), first));
      ref = IR.name(name);
    } else {
      fst = first;
      ref = first.cloneTree();
    }
    Node ifn = IR.ifNode(IR.existence(fst), IR.block(ref), IR.block(second));
    return compile(NodeUtil.substitute(n, x -> ifn), o);
  }

  private String compileUnary(Node n, CodeContext o) {
    if (o.getLevel().atLeast(Level.ACCESS)) {
      return compile(NodeUtil.substitute(n, IR::parens), o);
    }
    String op = n.getString();
    Node operand = n.getFirstChild();
    boolean plusMinus = op.equals("+") || op.equals("-");
    boolean sameOp = plusMinus && operand.isOp() && operand.getString().equals(op);
    String space =
        op.equals("new") || op.equals("typeof") || op.equals("delete") || sameOp ? " " : "";
    if ((plusMinus && operand.isOp())
        || (op.equals("new") && NodeUtil.isStatement(operand, o.getLevel()))) {
      operand = NodeUtil.substitute(operand, IR::parens);
    }
    String code = compile(operand, o, Level.OP);
    return n.getBooleanProp(Node.Prop.FLIP) ? code + op : op + space + code;
  }

  private String compileIn(Node n, CodeContext o) {
    Node object = n.getFirstChild();
    Node array = n.getSecondChild();
    boolean negated = n.getBooleanProp(Node.Prop.NEGATED);
    if (NodeUtil.isArray(array)) {
      boolean hasSplat = false;
      for (Node e = NodeUtil.baseOf(array).getFirstChild(); e != null; e = e.getNext()) {
        hasSplat |= e.isSplat();
      }
      if (!hasSplat) {
        return compileOrTest(object, NodeUtil.baseOf(array).childList(), negated, o);
      }
    }
    String[] cached = cacheCompiled(object, o, Level.LIST);
    String code =
        o.getScope().useHelper(RuntimeHelper.INDEX_OF)
            + ".call("
            + compile(array, o, Level.LIST)
            + ", "
            + cached[1]
            + ") "
            + (negated ? "< 0" : ">= 0");
    if (cached[0].equals(cached[1])) {
      return code;
    }
    code = cached[0] + ", " + code;
    return o.getLevel().compareTo(Level.LIST) < 0 ? code : "(" + code + ")";
  }

  /** Membership in a literal array tests each element in turn. */
  private String compileOrTest(Node object, List<Node> items, boolean negated, CodeContext o) {
    if (items.isEmpty()) {
      return String.valueOf(negated);
    }
    String[] cached = cacheCompiled(object, o, Level.OP);
    String cmp = negated ? " !== " : " === ";
    String cnj = negated ? " && " : " || ";
    List<String> tests = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      tests.add((i == 0 ? cached[0] : cached[1]) + cmp + compile(items.get(i), o, Level.ACCESS));
    }
    String code = String.join(cnj, tests);
    return o.getLevel().compareTo(Level.OP) < 0 ? code : "(" + code + ")";
  }

  private String compileExistence(Node n, CodeContext o) {
    Node expr = n.getFirstChild();
    boolean negated = n.getBooleanProp(Node.Prop.NEGATED);
    if (front.contains(n)) {
      front.add(expr);
    }
    String code = compile(expr, o, Level.OP);
    if (NodeUtil.isIdentifier(code) && !o.getScope().isDeclared(code)) {
      code =
          negated
              ? "typeof " + code + " === \"undefined\" || " + code + " === null"
              : "typeof " + code + " !== \"undefined\" && " + code + " !== null";
    } else {
      code = code + " " + (negated ? "==" : "!=") + " null";
    }
    return o.getLevel().atMost(Level.COND) ? code : "(" + code + ")";
  }

  private String compileParens(Node n, CodeContext o) {
    Node expr = n.getFirstChild();
    if (expr.isValue() && NodeUtil.isAtomic(expr)) {
      if (front.contains(n)) {
        front.add(expr);
      }
      return compile(expr, o);
    }
    String code = compile(expr, o, Level.PAREN);
    boolean bare =
        o.getLevel().compareTo(Level.OP) < 0
            && (expr.isOp()
                || expr.isCall()
                || (expr.isFor() && expr.getBooleanProp(Node.Prop.RETURNS)));
    return bare ? code : "(" + code + ")";
  }

  // Conditionals

  private String compileIfStatement(Node n, CodeContext o) {
    boolean child = o.isChainChild();
    o = o.withChainChild(false);
    Node condition = n.getFirstChild();
    Node body = n.getSecondChild();
    Node alt = n.getLastChild();
    if (o.isExistentialEquals()) {
      Node inverted = NodeUtil.invert(condition);
      Node ifn = IR.ifNode(inverted, alt.isEmpty() ? IR.block() : alt);
      return compile(NodeUtil.substitute(n, x -> ifn), o.withExistentialEquals(false));
    }
    String tab = o.getIndent();
    CodeContext inner = o.indented();
    String cond = compile(condition, o, Level.PAREN);
    String code = "if (" + cond + ") {\n" + compile(body, inner, Level.TOP) + "\n" + tab + "}";
    if (!child) {
      code = tab + code;
    }
    if (alt.isEmpty()) {
      return code;
    }
    if (alt.isIf()) {
      return code + " else " + compile(alt, o.withChainChild(true), Level.TOP);
    }
    return code + " else {\n" + compile(alt, inner, Level.TOP) + "\n" + tab + "}";
  }

  private String compileIfExpression(Node n, CodeContext o) {
    Node condition = n.getFirstChild();
    Node body = NodeUtil.unwrap(n.getSecondChild());
    Node alt = n.getLastChild();
    String cond = compile(condition, o, Level.COND);
    String code = compile(body, o, Level.LIST);
    String altCode = alt.isEmpty() ? "void 0" : compile(NodeUtil.unwrap(alt), o, Level.LIST);
    code = cond + " ? " + code + " : " + altCode;
    return o.getLevel().atLeast(Level.COND) ? "(" + code + ")" : code;
  }

  private String compileSwitch(Node n, CodeContext o) {
    String tab = o.getIndent();
    String idt1 = tab + this.tab;
    String idt2 = idt1 + this.tab;
    CodeContext inner = o.withIndent(idt2);
    List<Node> children = n.childList();
    Node subject = children.get(0);
    Node otherwise = children.get(children.size() - 1);
    List<Node> cases = children.subList(1, children.size() - 1);
    StringBuilder code = new StringBuilder(tab).append("switch (");
    code.append(subject.isEmpty() ? "false" : compile(subject, inner, Level.PAREN));
    code.append(") {\n");
    for (int i = 0; i < cases.size(); i++) {
      List<Node> parts = cases.get(i).childList();
      Node block = parts.get(parts.size() - 1);
      for (Node cond : parts.subList(0, parts.size() - 1)) {
        if (subject.isEmpty()) {
          cond = NodeUtil.invert(cond);
        }
        code.append(idt1).append("case ").append(compile(cond, inner, Level.PAREN)).append(":\n");
      }
      String body = compile(block, inner, Level.TOP);
      if (!body.isEmpty()) {
        code.append(body).append('\n');
      }
      if (i == cases.size() - 1 && !otherwise.isBlock()) {
        break;
      }
      Node last = NodeUtil.lastNonComment(block);
      if (last != null && endsCase(last)) {
        continue;
      }
      code.append(idt2).append("break;\n");
    }
    if (otherwise.isBlock() && otherwise.hasChildren()) {
      code.append(idt1).append("default:\n");
      code.append(compile(otherwise, inner, Level.TOP)).append('\n');
    }
    return code.append(tab).append('}').toString();
  }

  private static boolean endsCase(Node last) {
    switch (last.getToken()) {
      case RETURN:
      case BREAK:
      case CONTINUE:
      case THROW:
      case ICED_TAIL_CALL:
        return true;
      default:
        return false;
    }
  }

  private String compileTry(Node n, CodeContext o) {
    Node attempt = n.getFirstChild();
    Node error = n.getSecondChild();
    Node recovery = n.getChildAtIndex(2);
    Node ensure = n.getLastChild();
    String tab = o.getIndent();
    CodeContext inner = o.indented().withLevel(Level.TOP);
    StringBuilder code = new StringBuilder(tab).append("try {\n");
    code.append(compile(attempt, inner)).append('\n').append(tab).append('}');
    if (recovery.isBlock() || !error.isEmpty()) {
      String name = "_error";
      if (!error.isEmpty()) {
        name = compile(error, inner);
        if (NodeUtil.RESERVED.contains(name)) {
          throw error(error, RESERVED_NAME, name);
        }
      }
      if (!o.getScope().isDeclared(name)) {
        o.getScope().add(name, Scope.Kind.PARAM, false);
      }
      String recoveryCode = recovery.isBlock() ? compile(recovery, inner) : "";
      code.append(" catch (").append(name).append(") {\n").append(recoveryCode);
      code.append('\n').append(tab).append('}');
    } else if (!ensure.isBlock()) {
      code.append(" catch (_error) {}");
    }
    if (ensure.isBlock()) {
      code.append(" finally {\n").append(compile(ensure, inner)).append('\n');
      code.append(tab).append('}');
    }
    return code.toString();
  }

  // Caching

  /**
   * Returns two nodes for {@code n}: one to evaluate first and one for later uses. A complex node
   * is assigned to a fresh temporary on first use.
   */
  Node[] cache(Node n, CodeContext o) {
    if (!NodeUtil.isComplex(n)) {
      return new Node[] {n, n.cloneTree()};
    }
    String ref = o.getScope().freshName("ref");
    return new Node[] {IR.assign(IR.name(ref), n), IR.name(ref)};
  }

  /** Like {@link #cache}, compiling both uses at {@code level}. */
  String[] cacheCompiled(Node n, CodeContext o, Level level) {
    if (!NodeUtil.isComplex(n)) {
      String code = compile(n, o, level);
      return new String[] {code, code};
    }
    String ref = o.getScope().freshName("ref");
    return new String[] {compile(IR.assign(IR.name(ref), n), o, level), ref};
  }

  /**
   * Splits a property chain so that it can be both read and written while evaluating its object
   * and final key once.
   */
  Node[] cacheReference(Node value, CodeContext o) {
    Node v = value.isValue() ? value : NodeUtil.substitute(value, IR::value);
    List<Node> children = v.childList();
    Node base = children.get(0);
    Node last = children.size() > 1 ? children.get(children.size() - 1) : null;
    if (children.size() < 3
        && !NodeUtil.isComplex(base)
        && (last == null || !NodeUtil.isComplex(last))) {
      return new Node[] {v, v.cloneTree()};
    }
    Node head = IR.value(base);
    for (Node prop : children.subList(1, last == null ? 1 : children.size() - 1)) {
      head.addChildToBack(prop);
    }
    String baseRef = null;
    if (NodeUtil.isComplex(head)) {
      baseRef = o.getScope().freshName("base");
      head = IR.value(IR.parens(IR.assign(IR.name(baseRef), head)));
    }
    if (last == null) {
      return new Node[] {head, IR.name(baseRef)};
    }
    Node name = last;
    Node secondName = last.cloneTree();
    if (NodeUtil.isComplex(last)) {
      String nameRef = o.getScope().freshName("name");
      name = IR.index(IR.assign(IR.name(nameRef), last.getFirstChild()));
      secondName = IR.index(IR.name(nameRef));
    }
    head.addChildToBack(name);
    Node secondBase =
        baseRef != null ? IR.name(baseRef) : head.getFirstChild().cloneTree();
    return new Node[] {head, IR.value(secondBase, secondName)};
  }

  // Errors

  CompilationException error(Node n, DiagnosticType type, Object... arguments) {
    return new CompilationException(
        IcedError.make(options.getSourceName(), n, type, arguments));
  }

  @VisibleForTesting
  SoakUnfolder getSoakUnfolder() {
    return soaks;
  }
}
