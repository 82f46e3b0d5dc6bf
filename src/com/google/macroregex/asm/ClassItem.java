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

import com.google.errorprone.annotations.Immutable;

/** A member of a {@link Expr.CharacterClass}. */
@Immutable
public sealed interface ClassItem permits ClassItem.Single, ClassItem.Span, ClassItem.Builtin {

  static Single of(int codePoint) {
    return new Single(codePoint);
  }

  static Span span(char start, char end) {
    return new Span(start, end);
  }

  static Builtin of(Shorthand shorthand) {
    return new Builtin(shorthand);
  }

  /** One character, as a Unicode code point. */
  record Single(int codePoint) implements ClassItem {
    public Single {
      checkArgument(Character.isValidCodePoint(codePoint), "Invalid code point %s", codePoint);
    }
  }

  /** An inclusive range of characters. */
  record Span(char start, char end) implements ClassItem {
    public Span {
      checkArgument(start <= end, "Inverted span %s-%s", start, end);
    }
  }

  /** A predefined class such as {@code \d}. */
  record Builtin(Shorthand shorthand) implements ClassItem {
    public Builtin {
      requireNonNull(shorthand, "shorthand");
    }
  }
}
