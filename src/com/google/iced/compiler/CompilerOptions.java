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

import com.google.common.base.CharMatcher;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  static final String DEFAULT_INDENT = "  ";

  /** Where the await/defer support object {@code iced} comes from in the emitted program. */
  public enum RuntimeMode {
    /** The runtime is emitted inline at the top of the program. */
    INLINE("inline"),
    /** The runtime is loaded with {@code require('iced-coffee-script')}. */
    NODE("node"),
    /** The runtime is assumed to be present already. */
    NONE("none");

    private final String directive;

    RuntimeMode(String directive) {
      this.directive = directive;
    }

    /** The spelling used by the {@code tameRequire} directive. */
    public String directive() {
      return directive;
    }

    /** Returns the mode spelled {@code directive}, or null if there is none. */
    public static @Nullable RuntimeMode fromDirective(String directive) {
      for (RuntimeMode mode : values()) {
        if (mode.directive.equals(directive)) {
          return mode;
        }
      }
      return null;
    }
  }

  /** Omit the top-level function wrapper. */
  private boolean bareOutput = false;

  /** One level of indentation in the emitted program. */
  private String indentStyle = DEFAULT_INDENT;

  /** The runtime to use when the program does not pick one with {@code tameRequire}. */
  private @Nullable RuntimeMode runtimeMode = null;

  /** Name of the source, recorded in deferral traces and error messages. */
  private @Nullable String sourceName = null;

  public CompilerOptions() {}

  public boolean isBareOutput() {
    return bareOutput;
  }

  public void setBareOutput(boolean bareOutput) {
    this.bareOutput = bareOutput;
  }

  public String getIndentStyle() {
    return indentStyle;
  }

  public void setIndentStyle(String indentStyle) {
    checkArgument(
        !indentStyle.isEmpty() && CharMatcher.anyOf(" \t").matchesAllOf(indentStyle),
        "Indentation must be spaces or tabs: \"%s\"",
        indentStyle);
    this.indentStyle = indentStyle;
  }

  public @Nullable RuntimeMode getRuntimeMode() {
    return runtimeMode;
  }

  public void setRuntimeMode(@Nullable RuntimeMode runtimeMode) {
    this.runtimeMode = runtimeMode;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  public void setSourceName(@Nullable String sourceName) {
    this.sourceName = sourceName;
  }
}
