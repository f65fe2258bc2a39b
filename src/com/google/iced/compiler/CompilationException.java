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

import static com.google.common.base.Preconditions.checkNotNull;

/** Aborts a compilation. Thrown for the first error found; there is no recovery. */
public final class CompilationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final IcedError error;

  public CompilationException(IcedError error) {
    super(error.format());
    this.error = checkNotNull(error);
  }

  public IcedError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
