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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.iced.ast.Node;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiler (and the other classes in this package) compiles a parsed iced program to JavaScript.
 *
 * <p>The tree is analyzed by {@link IcedTransform} and then emitted by {@link CodeGenerator}. Both
 * rewrite the tree in place, so a tree can be compiled only once. The first error aborts the
 * compilation with a {@link CompilationException}.
 */
public final class Compiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private final CompilerOptions options;

  public Compiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  public Compiler() {
    this(new CompilerOptions());
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /**
   * Compiles the program rooted at {@code root}, a {@code BLOCK}, and returns the emitted source.
   *
   * @throws CompilationException for the first error found
   */
  public String compile(Node root) {
    checkArgument(root.isBlock(), "Expected a program block, got %s", root);
    Stopwatch stopwatch = Stopwatch.createStarted();
    IcedFlags flags = new IcedFlags();
    IcedTransform transform = new IcedTransform(options, flags);
    transform.process(root);
    String code = new CodeGenerator(options, flags).compileRoot(root);
    logger.fine(
        () ->
            "Compiled "
                + (options.getSourceName() == null ? "<input>" : options.getSourceName())
                + " in "
                + stopwatch.elapsed(TimeUnit.MILLISECONDS)
                + "ms");
    return code;
  }
}
