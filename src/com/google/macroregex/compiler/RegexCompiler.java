/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.macroregex.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.macroregex.asm.Expr;
import com.google.macroregex.asm.RegexAssembler;
import com.google.macroregex.ast.PatternNode;
import java.util.logging.Logger;

/**
 * Compiles pattern trees all the way to regex text: a {@link MacroCompiler} produces the assembly
 * representation and a {@link RegexAssembler} renders it for the configured flavor.
 *
 * <p>Instances hold only immutable state and may be shared between threads.
 */
public final class RegexCompiler {
  private static final Logger logger = Logger.getLogger(RegexCompiler.class.getName());

  private final CompilerOptions options;
  private final MacroCompiler compiler;
  private final RegexAssembler assembler;

  /** Creates a compiler with the default options and the standard builtin macros. */
  public RegexCompiler() {
    this(CompilerOptions.defaults());
  }

  public RegexCompiler(CompilerOptions options) {
    this(options, BuiltinMacros.standard());
  }

  public RegexCompiler(CompilerOptions options, BuiltinMacros builtins) {
    this.options = checkNotNull(options);
    this.assembler = new RegexAssembler(options.getFlavor());
    this.compiler = new MacroCompiler(builtins, new BuiltinOperators(assembler));
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /** Compiles {@code ast} to the assembly representation. */
  public CompileResult<Expr> compile(PatternNode ast) {
    return compiler.compile(ast);
  }

  /** Renders an already compiled expression. */
  public String assemble(Expr expr) {
    return assembler.assemble(expr);
  }

  /** Compiles {@code ast} and renders the result. */
  public CompileResult<String> toRegex(PatternNode ast) {
    CompileResult<String> result = compile(ast).map(assembler::assemble);
    if (result.isSuccess()) {
      logger.fine("Compiled pattern to " + result.getValue());
    }
    return result;
  }
}
