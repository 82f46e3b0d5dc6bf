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

import static java.util.Objects.requireNonNull;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error, ready to show to the user.
 */
public record CompileError(DiagnosticType type, String description) {
  public CompileError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /**
   * Creates a CompileError.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static CompileError make(DiagnosticType type, Object... arguments) {
    return new CompileError(type, type.format(arguments));
  }

  public ErrorKind kind() {
    return type.kind;
  }

  @Override
  public String toString() {
    return type.key + ". " + description;
  }
}
