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

package com.google.iced.ast;

/**
 * The closed set of node kinds produced by the parser.
 *
 * <p>Child layouts are fixed per kind; optional children are {@link #EMPTY} nodes so that every
 * child sits at a known position. See {@link IR} for the factory methods that build each kind.
 */
public enum Token {
  BLOCK, // statements...

  // Leaves carrying a raw string payload.
  NAME,
  NUMBER,
  STRING, // payload is the quoted source text
  REGEXP,
  JS_LITERAL, // embedded target code, emitted verbatim

  THIS,
  NULL,
  UNDEFINED,
  TRUE,
  FALSE,

  BREAK,
  CONTINUE,
  DEBUGGER,
  COMMENT,

  RETURN, // [expr]

  VALUE, // base, ACCESS | INDEX | SLICE ...
  ACCESS, // NAME
  INDEX, // expr
  SLICE, // RANGE
  RANGE, // from, to

  CALL, // callee, args...
  SUPER_CALL, // args...
  EXTENDS, // child, parent

  OBJ, // ASSIGN(object) | VALUE | COMMENT ...
  ARR, // elements...
  CLASS, // variable | EMPTY, parent | EMPTY, BLOCK
  ASSIGN, // target, value

  CODE, // PARAM_LIST, BLOCK
  PARAM_LIST, // PARAM...
  PARAM, // name, default | EMPTY
  SPLAT, // expr

  WHILE, // condition, BLOCK, guard | EMPTY
  OP, // operand, [operand]
  IN, // object, array
  TRY, // BLOCK, NAME | EMPTY, BLOCK | EMPTY, BLOCK | EMPTY
  THROW, // expr
  EXISTENCE, // expr
  PARENS, // expr
  FOR, // BLOCK, source, name | EMPTY, index | EMPTY, guard | EMPTY, step | EMPTY
  SWITCH, // subject | EMPTY, CASE..., BLOCK | EMPTY
  CASE, // condition..., BLOCK
  IF, // condition, BLOCK, BLOCK | IF | EMPTY

  // Suspension constructs.
  AWAIT, // BLOCK
  DEFER, // slot arguments...
  ICED_TAIL_CALL, // value | EMPTY
  ICED_RUNTIME,
  ICED_REQUIRE,

  EMPTY;

  /** Whether nodes of this kind carry a string payload. */
  public boolean hasStringPayload() {
    switch (this) {
      case NAME:
      case NUMBER:
      case STRING:
      case REGEXP:
      case JS_LITERAL:
      case COMMENT:
      case OP:
      case ICED_TAIL_CALL:
      case ICED_REQUIRE:
        return true;
      default:
        return false;
    }
  }
}
