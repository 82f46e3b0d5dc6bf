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

import org.jspecify.annotations.Nullable;

/** The categories a range endpoint may belong to. Both endpoints must share one. */
enum CharacterCategory {
  LOWERCASE,
  UPPERCASE,
  DIGIT;

  /** Returns the category of {@code c}, or null if it belongs to none. */
  static @Nullable CharacterCategory of(char c) {
    if (Character.isLowerCase(c)) {
      return LOWERCASE;
    }
    if (Character.isUpperCase(c)) {
      return UPPERCASE;
    }
    if (Character.isDigit(c)) {
      return DIGIT;
    }
    return null;
  }
}
