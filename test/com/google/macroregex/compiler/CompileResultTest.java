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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CompileResult}. */
@RunWith(JUnit4.class)
public final class CompileResultTest {

  private final CompileError error = CompileError.make(DiagnosticType.UNDEFINED_MACRO, "#x");

  @Test
  public void testSuccess() {
    CompileResult<String> result = CompileResult.success("a");
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getValue()).isEqualTo("a");
    assertThat(result.getOrThrow()).isEqualTo("a");
    assertThat(result.map(String::length).getValue()).isEqualTo(1);
    assertThrows(IllegalStateException.class, result::getError);
  }

  @Test
  public void testFailure() {
    CompileResult<String> result = CompileResult.failure(error);
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getError()).isEqualTo(error);
    assertThrows(IllegalStateException.class, result::getValue);
    assertThat(result.map(String::length).getError()).isEqualTo(error);
    assertThat(result.flatMap(s -> CompileResult.success(s.length())).getError())
        .isEqualTo(error);
  }

  @Test
  public void testGetOrThrow() {
    CompileException e =
        assertThrows(CompileException.class, () -> CompileResult.failure(error).getOrThrow());
    assertThat(e).hasMessageThat().isEqualTo("Macro #x does not exist");
    assertThat(e.getError()).isEqualTo(error);
  }

  @Test
  public void testFlatMapStopsAtFirstError() {
    CompileResult<Integer> result =
        CompileResult.success("a")
            .flatMap(s -> CompileResult.<Integer>failure(error))
            .map(i -> i + 1);
    assertThat(result.getError()).isEqualTo(error);
  }
}
