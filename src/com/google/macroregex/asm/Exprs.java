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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Construction helpers and predefined nodes for the assembly representation. */
public final class Exprs {

  public static final Expr.Literal EMPTY = new Expr.Literal("");
  public static final Expr.Concat EMPTY_CONCAT = new Expr.Concat(ImmutableList.of());

  public static final Expr ANY = special(Expr.Special.Kind.ANY);
  public static final Expr START_STRING = special(Expr.Special.Kind.START_STRING);
  public static final Expr END_STRING = special(Expr.Special.Kind.END_STRING);
  public static final Expr START_LINE = special(Expr.Special.Kind.START_LINE);
  public static final Expr END_LINE = special(Expr.Special.Kind.END_LINE);
  public static final Expr WORD_BOUNDARY = special(Expr.Special.Kind.WORD_BOUNDARY);

  public static final Expr LINEFEED = characterClass(ClassItem.of('\n'));
  public static final Expr CARRIAGE_RETURN = characterClass(ClassItem.of('\r'));
  public static final Expr TAB = characterClass(ClassItem.of('\t'));
  public static final Expr DIGIT = characterClass(ClassItem.of(Shorthand.DIGIT));
  public static final Expr SPACE = characterClass(ClassItem.of(Shorthand.SPACE));
  public static final Expr TOKEN_CHARACTER = characterClass(ClassItem.of(Shorthand.WORD));
  public static final Expr LOWERCASE = characterClass(ClassItem.span('a', 'z'));
  public static final Expr UPPERCASE = characterClass(ClassItem.span('A', 'Z'));
  public static final Expr LETTER =
      characterClass(ClassItem.span('a', 'z'), ClassItem.span('A', 'Z'));

  private Exprs() {}

  public static Expr.Literal literal(String string) {
    return new Expr.Literal(string);
  }

  public static Expr.Concat concat(Expr... items) {
    return new Expr.Concat(ImmutableList.copyOf(items));
  }

  public static Expr.Concat concat(List<? extends Expr> items) {
    return new Expr.Concat(ImmutableList.copyOf(items));
  }

  public static Expr.Either either(Expr... items) {
    return new Expr.Either(ImmutableList.copyOf(items));
  }

  public static Expr.Either either(List<? extends Expr> items) {
    return new Expr.Either(ImmutableList.copyOf(items));
  }

  public static Expr.Multiple multiple(
      @Nullable Integer min, @Nullable Integer max, boolean greedy, Expr subexpr) {
    return new Expr.Multiple(min, max, greedy, subexpr);
  }

  public static Expr.CharacterClass characterClass(ClassItem... items) {
    return new Expr.CharacterClass(ImmutableSet.copyOf(items), false);
  }

  public static Expr.CharacterClass invertedClass(ClassItem... items) {
    return new Expr.CharacterClass(ImmutableSet.copyOf(items), true);
  }

  public static Expr.Capture capture(@Nullable String name, Expr subexpr) {
    return new Expr.Capture(name, subexpr);
  }

  public static Expr.Setting setting(String flags, Expr subexpr) {
    return new Expr.Setting(flags, subexpr);
  }

  public static Expr.Special special(Expr.Special.Kind kind) {
    return new Expr.Special(kind);
  }

  /** Whether {@code expr} matches only the empty string and can be dropped from a sequence. */
  public static boolean isEmpty(Expr expr) {
    return expr.equals(EMPTY) || expr.equals(EMPTY_CONCAT);
  }
}
