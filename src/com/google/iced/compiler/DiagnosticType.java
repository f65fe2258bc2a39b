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

import java.io.Serializable;
import java.text.MessageFormat;

/** The type of a compile error: a key, a message pattern and the class of failure it reports. */
public final class DiagnosticType implements Comparable<DiagnosticType>, Serializable {
  private static final long serialVersionUID = 1;

  /** The failure classes a compilation can abort with. */
  public enum Kind {
    /** A structural violation in the program being compiled. */
    SYNTAX,
    /** An invalid directive or option value. */
    CONFIGURATION,
    /** A tree the compiler cannot lower; usually a statement used where a value is needed. */
    INTERNAL,
  }

  /** The error type, unique across the compiler. */
  public final String key;

  /** The default way to format errors. The style of format is java.text.MessageFormat. */
  public final String format;

  public final Kind kind;

  public static DiagnosticType syntax(String name, String descriptionFormat) {
    return new DiagnosticType(name, Kind.SYNTAX, descriptionFormat);
  }

  public static DiagnosticType configuration(String name, String descriptionFormat) {
    return new DiagnosticType(name, Kind.CONFIGURATION, descriptionFormat);
  }

  public static DiagnosticType internal(String name, String descriptionFormat) {
    return new DiagnosticType(name, Kind.INTERNAL, descriptionFormat);
  }

  private DiagnosticType(String key, Kind kind, String format) {
    this.key = key;
    this.kind = kind;
    this.format = format;
  }

  String format(Object... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
