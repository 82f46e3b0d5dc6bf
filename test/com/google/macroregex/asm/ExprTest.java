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

package com.google.macroregex.asm;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Expr} inversion and structural queries. */
@RunWith(JUnit4.class)
public final class ExprTest {

  @Test
  public void testSingleCharacterLiteralInvertsToClass() {
    assertThat(Exprs.literal("a").invert()).hasValue(Exprs.invertedClass(ClassItem.of('a')));
    assertThat(Exprs.literal("ab").invert()).isEmpty();
    assertThat(Exprs.EMPTY.invert()).isEmpty();
  }

  @Test
  public void testCharacterClassInversionFlipsFlag() {
    assertThat(Exprs.DIGIT.invert())
        .hasValue(Exprs.invertedClass(ClassItem.of(Shorthand.DIGIT)));
    assertThat(Exprs.DIGIT.invert().get().invert()).hasValue(Exprs.DIGIT);
  }

  @Test
  public void testOnlyWordBoundariesInvert() {
    assertThat(Exprs.WORD_BOUNDARY.invert())
        .hasValue(Exprs.special(Expr.Special.Kind.NOT_WORD_BOUNDARY));
    assertThat(Exprs.special(Expr.Special.Kind.NOT_WORD_BOUNDARY).invert())
        .hasValue(Exprs.WORD_BOUNDARY);
    assertThat(Exprs.ANY.invert()).isEmpty();
    assertThat(Exprs.START_LINE.invert()).isEmpty();
    assertThat(Exprs.END_STRING.invert()).isEmpty();
  }

  @Test
  public void testCompositesHaveNoInverse() {
    assertThat(Exprs.concat(Exprs.literal("a"), Exprs.literal("b")).invert()).isEmpty();
    assertThat(Exprs.capture(null, Exprs.DIGIT).invert()).isEmpty();
    assertThat(Exprs.multiple(0, 1, true, Exprs.DIGIT).invert()).isEmpty();
  }

  @Test
  public void testCharacterClassEqualityIgnoresOrder() {
    assertThat(Exprs.characterClass(ClassItem.of('a'), ClassItem.of('b')))
        .isEqualTo(Exprs.characterClass(ClassItem.of('b'), ClassItem.of('a')));
    assertThat(Exprs.characterClass(ClassItem.of('a')))
        .isNotEqualTo(Exprs.invertedClass(ClassItem.of('a')));
  }

  @Test
  public void testSingleCharacterExpressions() {
    assertThat(Exprs.literal("a").isSingleCharacter()).isTrue();
    assertThat(Exprs.literal("ab").isSingleCharacter()).isFalse();
    assertThat(Exprs.LETTER.isSingleCharacter()).isTrue();
    assertThat(Exprs.ANY.isSingleCharacter()).isFalse();
  }

  @Test
  public void testSupplementaryCharacterIsOneCharacter() {
    Expr.Literal clef = Exprs.literal(new String(Character.toChars(0x1D11E)));
    assertThat(clef.isSingleCharacter()).isTrue();
    assertThat(clef.invert()).hasValue(Exprs.invertedClass(ClassItem.of(0x1D11E)));
    assertThrows(IllegalArgumentException.class, () -> ClassItem.of(0x110000));
  }

  @Test
  public void testEmptyExpressions() {
    assertThat(Exprs.isEmpty(Exprs.literal(""))).isTrue();
    assertThat(Exprs.isEmpty(Exprs.concat())).isTrue();
    assertThat(Exprs.isEmpty(Exprs.either())).isFalse();
    assertThat(Exprs.isEmpty(Exprs.literal(" "))).isFalse();
  }

  @Test
  public void testMalformedNodesAreRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> Exprs.multiple(3, 2, true, Exprs.literal("a")));
    assertThrows(
        IllegalArgumentException.class, () -> Exprs.multiple(-1, null, true, Exprs.literal("a")));
    assertThrows(IllegalArgumentException.class, () -> Exprs.setting("", Exprs.literal("a")));
    assertThrows(IllegalArgumentException.class, () -> ClassItem.span('z', 'a'));
  }

  @Test
  public void testMultipleMinimumDefaultsToZero() {
    assertThat(Exprs.multiple(null, 4, true, Exprs.DIGIT).effectiveMin()).isEqualTo(0);
    assertThat(Exprs.multiple(2, 4, true, Exprs.DIGIT).effectiveMin()).isEqualTo(2);
  }
}
