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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A node of the assembly representation: the renderable tree produced by the macro compiler and
 * turned into regex text by {@link RegexAssembler}.
 *
 * <p>Nodes are values. Two nodes are equal when they have the same kind and equal fields.
 */
@Immutable
public sealed interface Expr
    permits Expr.Literal,
        Expr.Concat,
        Expr.Either,
        Expr.Multiple,
        Expr.CharacterClass,
        Expr.Capture,
        Expr.Setting,
        Expr.Special {

  <T> T accept(Visitor<T> visitor);

  /**
   * Returns the expression matching exactly what this one does not, within the alphabet of this
   * expression, or empty if this kind of expression has no defined inverse.
   */
  default Optional<Expr> invert() {
    return Optional.empty();
  }

  /** Whether this expression always matches exactly one character. */
  default boolean isSingleCharacter() {
    return false;
  }

  /** Dispatch over the node kinds. */
  interface Visitor<T> {
    T visitLiteral(Literal literal);

    T visitConcat(Concat concat);

    T visitEither(Either either);

    T visitMultiple(Multiple multiple);

    T visitCharacterClass(CharacterClass characterClass);

    T visitCapture(Capture capture);

    T visitSetting(Setting setting);

    T visitSpecial(Special special);
  }

  /** Exact text. */
  record Literal(String string) implements Expr {
    public Literal {
      requireNonNull(string, "string");
    }

    public boolean isEmpty() {
      return string.isEmpty();
    }

    @Override
    public boolean isSingleCharacter() {
      return string.codePointCount(0, string.length()) == 1;
    }

    @Override
    public Optional<Expr> invert() {
      if (!isSingleCharacter()) {
        return Optional.empty();
      }
      return Optional.of(
          new CharacterClass(ImmutableSet.of(ClassItem.of(string.codePointAt(0))), true));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /** Sequential composition. */
  record Concat(ImmutableList<Expr> items) implements Expr {
    public Concat {
      requireNonNull(items, "items");
    }

    public boolean isEmpty() {
      return items.isEmpty();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConcat(this);
    }
  }

  /** Alternation. */
  record Either(ImmutableList<Expr> items) implements Expr {
    public Either {
      requireNonNull(items, "items");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitEither(this);
    }
  }

  /**
   * Repetition of {@code subexpr} between {@code min} and {@code max} times. A null {@code min}
   * means zero and a null {@code max} means unbounded.
   */
  record Multiple(@Nullable Integer min, @Nullable Integer max, boolean greedy, Expr subexpr)
      implements Expr {
    public Multiple {
      requireNonNull(subexpr, "subexpr");
      checkArgument(min == null || min >= 0, "Negative minimum %s", min);
      checkArgument(max == null || max >= 0, "Negative maximum %s", max);
      checkArgument(
          min == null || max == null || min <= max, "Minimum %s exceeds maximum %s", min, max);
    }

    /** The minimum with null read as zero. */
    public int effectiveMin() {
      return min == null ? 0 : min;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMultiple(this);
    }
  }

  /** A bracket expression over {@code characters}, or its complement if {@code inverted}. */
  record CharacterClass(ImmutableSet<ClassItem> characters, boolean inverted) implements Expr {
    public CharacterClass {
      requireNonNull(characters, "characters");
    }

    @Override
    public boolean isSingleCharacter() {
      return true;
    }

    @Override
    public Optional<Expr> invert() {
      return Optional.of(new CharacterClass(characters, !inverted));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCharacterClass(this);
    }
  }

  /** A capturing group, named if {@code name} is not null. */
  record Capture(@Nullable String name, Expr subexpr) implements Expr {
    public Capture {
      requireNonNull(subexpr, "subexpr");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCapture(this);
    }
  }

  /** Engine flags, e.g. {@code m} or {@code s}, in effect for {@code subexpr}. */
  record Setting(String flags, Expr subexpr) implements Expr {
    public Setting {
      requireNonNull(flags, "flags");
      requireNonNull(subexpr, "subexpr");
      checkArgument(!flags.isEmpty(), "No flags given");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSetting(this);
    }
  }

  /** The wildcard and the zero-width assertions. */
  record Special(Kind kind) implements Expr {
    public Special {
      requireNonNull(kind, "kind");
    }

    @Override
    public Optional<Expr> invert() {
      return kind.inverse().map(Special::new);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSpecial(this);
    }

    /** The constructs a {@link Special} can stand for. */
    public enum Kind {
      ANY,
      START_STRING,
      END_STRING,
      START_LINE,
      END_LINE,
      WORD_BOUNDARY,
      NOT_WORD_BOUNDARY;

      Optional<Kind> inverse() {
        switch (this) {
          case WORD_BOUNDARY:
            return Optional.of(NOT_WORD_BOUNDARY);
          case NOT_WORD_BOUNDARY:
            return Optional.of(WORD_BOUNDARY);
          default:
            return Optional.empty();
        }
      }

      /** Whether this construct matches a position rather than a character. */
      public boolean isZeroWidth() {
        return this != ANY;
      }
    }
  }
}
