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

/**
 * Support functions referenced by emitted code. Each one used by a compilation is declared once,
 * in the root scope's {@code var} statement, under its {@link #reference() reference} name.
 */
enum RuntimeHelper {
  HAS_PROP("hasProp") {
    @Override
    String source(Scope root) {
      return "{}.hasOwnProperty";
    }
  },
  SLICE("slice") {
    @Override
    String source(Scope root) {
      return "[].slice";
    }
  },
  BIND("bind") {
    @Override
    String source(Scope root) {
      return "function(fn, me){ return function(){ return fn.apply(me, arguments); }; }";
    }
  },
  INDEX_OF("indexOf") {
    @Override
    String source(Scope root) {
      return "[].indexOf || function(item) { for (var i = 0, l = this.length; i < l; i++) {"
          + " if (i in this && this[i] === item) return i; } return -1; }";
    }
  },
  EXTENDS("extends") {
    @Override
    String source(Scope root) {
      String hasProp = root.useHelper(HAS_PROP);
      return "function(child, parent) { for (var key in parent) { if ("
          + hasProp
          + ".call(parent, key)) child[key] = parent[key]; } function ctor() {"
          + " this.constructor = child; } ctor.prototype = parent.prototype;"
          + " child.prototype = new ctor(); child.__super__ = parent.prototype; return child; }";
    }
  };

  private final String name;

  RuntimeHelper(String name) {
    this.name = name;
  }

  /** The variable the helper is bound to. */
  String reference() {
    return "__" + name;
  }

  /** The helper's definition. May pull other helpers into {@code root}. */
  abstract String source(Scope root);
}
