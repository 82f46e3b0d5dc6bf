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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A pattern tree construction helper class.
 *
 * <p>Used by callers that build trees directly instead of parsing source text, such as the
 * self-hosted builtin macros.
 */
public final class Patterns {

  private static final PatternNode.Nothing NOTHING = new PatternNode.Nothing();

  private Patterns() {}

  public static PatternNode.Literal literal(String string) {
    return new PatternNode.Literal(string);
  }

  public static PatternNode.Concat concat(PatternNode... items) {
    return new PatternNode.Concat(ImmutableList.copyOf(items));
  }

  public static PatternNode.Concat concat(List<? extends PatternNode> items) {
    return new PatternNode.Concat(ImmutableList.copyOf(items));
  }

  public static PatternNode.Either either(PatternNode... items) {
    return new PatternNode.Either(ImmutableList.copyOf(items));
  }

  public static PatternNode.Either either(List<? extends PatternNode> items) {
    return new PatternNode.Either(ImmutableList.copyOf(items));
  }

  /** Builds an alternation of one-character literals, one per character of {@code chars}. */
  public static PatternNode.Either anyOf(String chars) {
    checkArgument(!chars.isEmpty(), "No characters given");
    ImmutableList.Builder<PatternNode> branches = ImmutableList.builder();
    chars.codePoints().forEach(c -> branches.add(literal(new String(Character.toChars(c)))));
    return new PatternNode.Either(branches.build());
  }

  public static PatternNode.Def def(String name, PatternNode subregex) {
    checkMacroName(name);
    return new PatternNode.Def(name, subregex);
  }

  public static PatternNode.Operator operator(String name, PatternNode subregex) {
    return new PatternNode.Operator(name, subregex);
  }

  /** Shorthand for the {@code 0-1} repetition operator. */
  public static PatternNode.Operator optional(PatternNode subregex) {
    return operator("0-1", subregex);
  }

  /** Shorthand for the {@code 1+} repetition operator. */
  public static PatternNode.Operator oneOrMore(PatternNode subregex) {
    return operator("1+", subregex);
  }

  public static PatternNode.Macro macro(String name) {
    checkMacroName(name);
    return new PatternNode.Macro(name);
  }

  public static PatternNode.Range range(char start, char end) {
    return new PatternNode.Range(start, end);
  }

  public static PatternNode.Nothing nothing() {
    return NOTHING;
  }

  private static void checkMacroName(String name) {
    checkArgument(
        name.length() > 1 && name.charAt(0) == '#', "Invalid macro name '%s'", name);
  }
}
