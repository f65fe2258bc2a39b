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

import static java.util.Objects.requireNonNull;

import com.google.iced.ast.Node;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, when the driver supplied one.
 * @param lineno Line number of the error location, or -1.
 * @param charno Column of the error location, or -1.
 */
public record IcedError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno)
    implements Serializable {
  public IcedError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /** Creates an error with no source information. */
  public static IcedError make(DiagnosticType type, Object... arguments) {
    return new IcedError(type, type.format(arguments), null, -1, -1);
  }

  /** Creates an error positioned at {@code n}. */
  public static IcedError make(
      @Nullable String sourceName, Node n, DiagnosticType type, Object... arguments) {
    return new IcedError(
        type, type.format(arguments), sourceName, n.getLineno(), n.getCharno());
  }

  /** Formats the error the way the command-line driver prints it. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(':');
    }
    if (lineno >= 0) {
      sb.append(lineno).append(':').append(charno).append(": ");
    } else if (sourceName != null) {
      sb.append(' ');
    }
    return sb.append(type.kind == DiagnosticType.Kind.SYNTAX ? "SyntaxError: " : "Error: ")
        .append(description)
        .toString();
  }

  @Override
  public String toString() {
    return type.key
        + ". "
        + description
        + " at "
        + (sourceName == null ? "(unknown source)" : sourceName)
        + " line "
        + (lineno < 0 ? "(unknown line)" : String.valueOf(lineno));
  }
}
