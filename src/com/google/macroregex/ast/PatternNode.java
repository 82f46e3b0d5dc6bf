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

package com.google.macroregex.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/**
 * A node of the macro-pattern syntax tree handed to the compiler by the parser.
 *
 * <p>The set of node kinds is closed. Code that needs to handle every kind implements {@link
 * Visitor}, so that adding a kind breaks every consumer at compile time instead of at run time.
 */
@Immutable
public sealed interface PatternNode
    permits PatternNode.Literal,
        PatternNode.Concat,
        PatternNode.Either,
        PatternNode.Def,
        PatternNode.Operator,
        PatternNode.Macro,
        PatternNode.Range,
        PatternNode.Nothing {

  <T> T accept(Visitor<T> visitor);

  /** Dispatch over the node kinds. */
  interface Visitor<T> {
    T visitLiteral(Literal literal);

    T visitConcat(Concat concat);

    T visitEither(Either either);

    T visitDef(Def def);

    T visitOperator(Operator operator);

    T visitMacro(Macro macro);

    T visitRange(Range range);

    T visitNothing(Nothing nothing);
  }

  /** Exact text to match. */
  record Literal(String string) implements PatternNode {
    public Literal {
      requireNonNull(string, "string");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /** Sequential composition. Direct children may include {@link Def}s. */
  record Concat(ImmutableList<PatternNode> items) implements PatternNode {
    public Concat {
      requireNonNull(items, "items");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConcat(this);
    }
  }

  /** Alternation between at least one branch. */
  record Either(ImmutableList<PatternNode> items) implements PatternNode {
    public Either {
      requireNonNull(items, "items");
      checkArgument(!items.isEmpty(), "Either needs at least one branch");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitEither(this);
    }
  }

  /** Binds {@code name} to {@code subregex} for the rest of the enclosing {@link Concat}. */
  record Def(String name, PatternNode subregex) implements PatternNode {
    public Def {
      requireNonNull(name, "name");
      requireNonNull(subregex, "subregex");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitDef(this);
    }
  }

  /** A named unary transformation, e.g. {@code capture}, {@code not} or {@code 2-5}. */
  record Operator(String name, PatternNode subregex) implements PatternNode {
    public Operator {
      requireNonNull(name, "name");
      requireNonNull(subregex, "subregex");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitOperator(this);
    }
  }

  /** A reference to a builtin or user-defined macro, {@code #}-prefixed. */
  record Macro(String name) implements PatternNode {
    public Macro {
      requireNonNull(name, "name");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMacro(this);
    }
  }

  /** Inclusive character range. Validity is checked by the compiler, not here. */
  record Range(char start, char end) implements PatternNode {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRange(this);
    }
  }

  /** The empty pattern. */
  record Nothing() implements PatternNode {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNothing(this);
    }
  }
}
