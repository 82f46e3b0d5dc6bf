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

import static com.google.common.truth.Truth.assertThat;

import com.google.macroregex.asm.Expr;
import com.google.macroregex.asm.Exprs;
import com.google.macroregex.asm.RegexAssembler;
import com.google.macroregex.asm.RegexFlavor;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BuiltinOperators}. */
@RunWith(JUnit4.class)
public final class BuiltinOperatorsTest {

  private final BuiltinOperators operators =
      new BuiltinOperators(new RegexAssembler(RegexFlavor.JAVA));
  private final Expr a = Exprs.literal("a");

  @Test
  public void testRepetitions() {
    assertThat(operators.apply("0-1", a).getValue()).isEqualTo(Exprs.multiple(0, 1, true, a));
    assertThat(operators.apply("1+", a).getValue()).isEqualTo(Exprs.multiple(1, null, true, a));
    assertThat(operators.apply("10-20", a).getValue())
        .isEqualTo(Exprs.multiple(10, 20, true, a));
    assertThat(operators.apply("3-3", a).getValue()).isEqualTo(Exprs.multiple(3, 3, true, a));
  }

  @Test
  public void testInvalidRepetitions() {
    assertThat(operators.apply("3-1", a).getError().type())
        .isEqualTo(DiagnosticType.INVALID_REPETITION);
    assertThat(operators.apply("99999999999+", a).getError().type())
        .isEqualTo(DiagnosticType.INVALID_REPETITION);
    assertThat(operators.apply("3-1", a).getError().description())
        .isEqualTo(
            "Repetition 3-1 is invalid: the minimum must be a number no larger than the maximum");
  }

  @Test
  public void testRepetitionNamesMustMatchWhole() {
    assertThat(operators.apply("1+2", a).getError().type())
        .isEqualTo(DiagnosticType.UNKNOWN_OPERATOR);
    assertThat(operators.apply("1", a).getError().type())
        .isEqualTo(DiagnosticType.UNKNOWN_OPERATOR);
    assertThat(operators.apply("-1-2", a).getError().type())
        .isEqualTo(DiagnosticType.UNKNOWN_OPERATOR);
  }

  @Test
  public void testCapture() {
    assertThat(operators.apply("capture", a).getValue()).isEqualTo(Exprs.capture(null, a));
  }

  @Test
  public void testNot() {
    assertThat(operators.apply("not", Exprs.LETTER).getValue())
        .isEqualTo(Exprs.LETTER.invert().get());
    // Messages render the operand in the configured flavor.
    assertThat(operators.apply("not", Exprs.END_STRING).getError().description())
        .isEqualTo("Expression \\z cannot be inverted");
  }

  @Test
  public void testUnknown() {
    CompileError error = operators.apply("Capture", a).getError();
    assertThat(error.type()).isEqualTo(DiagnosticType.UNKNOWN_OPERATOR);
    assertThat(error.toString()).isEqualTo("UNKNOWN_OPERATOR. Operator Capture does not exist");
  }
}
