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

/**
 * Target regular expression dialects. Only the constructs whose syntax differs between engines
 * are described here; everything else is rendered the same way for every flavor.
 */
public enum RegexFlavor {
  /** Python's {@code re} module. */
  PYTHON("(?P<", "\\Z", false),
  /** {@code java.util.regex.Pattern}. */
  JAVA("(?<", "\\z", true);

  private final String namedGroupOpen;
  private final String endOfString;
  private final boolean requiresExplicitMinimum;

  RegexFlavor(String namedGroupOpen, String endOfString, boolean requiresExplicitMinimum) {
    this.namedGroupOpen = namedGroupOpen;
    this.endOfString = endOfString;
    this.requiresExplicitMinimum = requiresExplicitMinimum;
  }

  /** Opening of a named capturing group, up to and including the {@code <}. */
  String namedGroupOpen() {
    return namedGroupOpen;
  }

  /** Assertion matching only at the very end of the input. */
  String endOfString() {
    return endOfString;
  }

  /** Whether {@code {,m}} must be spelled {@code {0,m}}. */
  boolean requiresExplicitMinimum() {
    return requiresExplicitMinimum;
  }
}
