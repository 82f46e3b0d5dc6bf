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

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import com.google.macroregex.asm.Expr;
import com.google.macroregex.asm.Exprs;
import com.google.macroregex.asm.RegexAssembler;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The operators a pattern can apply: {@code capture}, {@code not}, and repetitions named by their
 * bounds, {@code n-m} for between n and m times and {@code n+} for at least n times.
 */
public final class BuiltinOperators {

  /** A unary transformation of compiled expressions. */
  @FunctionalInterface
  public interface Operator {
    CompileResult<Expr> apply(Expr operand);
  }

  private static final Pattern REPEAT_OPERATOR = Pattern.compile("(\\d+)-(\\d+)|(\\d+)\\+");

  private final RegexAssembler assembler;
  private final ImmutableMap<String, Operator> operators;

  /**
   * @param assembler renders operands that appear in error messages
   */
  public BuiltinOperators(RegexAssembler assembler) {
    this.assembler = checkNotNull(assembler);
    this.operators =
        ImmutableMap.of(
            "capture", operand -> CompileResult.success(Exprs.capture(null, operand)),
            "not", this::invert);
  }

  /** Applies the operator called {@code name} to {@code operand}. */
  public CompileResult<Expr> apply(String name, Expr operand) {
    Matcher m = REPEAT_OPERATOR.matcher(name);
    if (m.matches()) {
      return repeat(name, m, operand);
    }
    Operator operator = operators.get(name);
    if (operator == null) {
      return CompileResult.failure(DiagnosticType.UNKNOWN_OPERATOR, name);
    }
    return operator.apply(operand);
  }

  private static CompileResult<Expr> repeat(String name, Matcher m, Expr operand) {
    Integer min;
    Integer max;
    if (m.group(3) != null) {
      min = Ints.tryParse(m.group(3));
      max = null;
      if (min == null) {
        return CompileResult.failure(DiagnosticType.INVALID_REPETITION, name);
      }
    } else {
      min = Ints.tryParse(m.group(1));
      max = Ints.tryParse(m.group(2));
      if (min == null || max == null || min > max) {
        return CompileResult.failure(DiagnosticType.INVALID_REPETITION, name);
      }
    }
    return CompileResult.success(Exprs.multiple(min, max, true, operand));
  }

  private CompileResult<Expr> invert(Expr operand) {
    Optional<Expr> inverse = operand.invert();
    if (inverse.isEmpty()) {
      return CompileResult.failure(DiagnosticType.NOT_INVERTIBLE, assembler.assemble(operand));
    }
    return CompileResult.success(inverse.get());
  }
}
