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

import com.google.common.collect.ImmutableMap;
import com.google.macroregex.asm.Exprs;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link MacroScope}. */
@RunWith(JUnit4.class)
public final class MacroScopeTest {

  private final MacroScope root =
      MacroScope.createRootScope(ImmutableMap.of("#digit", Exprs.DIGIT));

  @Test
  public void testRootScope() {
    assertThat(root.toString()).isEqualTo("MacroScope@0[#digit]");
    assertThat(root.lookup("#digit")).isEqualTo(Exprs.DIGIT);
    assertThat(root.lookup("#x")).isNull();
  }

  @Test
  public void testChildSeesParentBindings() {
    MacroScope child = root.createChildScope();
    assertThat(child.isDefined("#digit")).isTrue();
    assertThat(child.lookup("#digit")).isEqualTo(Exprs.DIGIT);
    assertThat(child.toString()).isEqualTo("MacroScope@1[]");
  }

  @Test
  public void testDefineLeavesOriginalUntouched() {
    MacroScope child = root.createChildScope();
    MacroScope extended = child.define("#x", Exprs.literal("a"));
    assertThat(extended.lookup("#x")).isEqualTo(Exprs.literal("a"));
    assertThat(extended.lookup("#digit")).isEqualTo(Exprs.DIGIT);
    assertThat(extended.toString()).isEqualTo("MacroScope@1[#x]");
    assertThat(child.isDefined("#x")).isFalse();
    assertThat(root.isDefined("#x")).isFalse();
  }

  @Test
  public void testRedefinitionIsRejected() {
    MacroScope child = root.createChildScope().define("#x", Exprs.literal("a"));
    assertThrows(IllegalStateException.class, () -> child.define("#x", Exprs.literal("b")));
    assertThrows(
        IllegalStateException.class,
        () -> child.createChildScope().define("#digit", Exprs.literal("1")));
  }
}
