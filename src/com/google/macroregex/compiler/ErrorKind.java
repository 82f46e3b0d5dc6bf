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

/** The families of semantic errors the macro compiler reports. */
public enum ErrorKind {
  /** A macro redefined in a scope where it is already visible, or used where it is not. */
  SCOPING,
  /** A range whose endpoints are of different character categories or out of order. */
  CATEGORY,
  /** An unknown operator name or a malformed repetition. */
  OPERATOR,
  /** An attempt to invert an expression that has no inverse. */
  INVERSION,
  /** A macro definition outside the direct items of a concatenation. */
  PLACEMENT
}
