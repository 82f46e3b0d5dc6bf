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

import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;

/** The type of a compile error. */
public final class DiagnosticType {

  static final DiagnosticType MACRO_REDEFINED =
      make("MACRO_REDEFINED", ErrorKind.SCOPING, "Macro {0} already defined");

  static final DiagnosticType UNDEFINED_MACRO =
      make("UNDEFINED_MACRO", ErrorKind.SCOPING, "Macro {0} does not exist");

  static final DiagnosticType MACRO_OUT_OF_SCOPE =
      make(
          "MACRO_OUT_OF_SCOPE",
          ErrorKind.SCOPING,
          "Macro {0} is not visible here, it is defined in a different scope");

  static final DiagnosticType RANGE_CATEGORY_MISMATCH =
      make(
          "RANGE_CATEGORY_MISMATCH",
          ErrorKind.CATEGORY,
          "Range start and end not of the same category: ''{0}'' is a {1} but ''{2}'' is a {3}");

  static final DiagnosticType RANGE_UNKNOWN_CATEGORY =
      make(
          "RANGE_UNKNOWN_CATEGORY",
          ErrorKind.CATEGORY,
          "Range endpoint ''{0}'' is not a lowercase letter, an uppercase letter or a digit");

  static final DiagnosticType RANGE_NOT_ASCENDING =
      make(
          "RANGE_NOT_ASCENDING",
          ErrorKind.CATEGORY,
          "Range start not before range end: ''{0}'' >= ''{1}''");

  static final DiagnosticType UNKNOWN_OPERATOR =
      make("UNKNOWN_OPERATOR", ErrorKind.OPERATOR, "Operator {0} does not exist");

  static final DiagnosticType INVALID_REPETITION =
      make(
          "INVALID_REPETITION",
          ErrorKind.OPERATOR,
          "Repetition {0} is invalid: the minimum must be a number no larger than the maximum");

  static final DiagnosticType NOT_INVERTIBLE =
      make("NOT_INVERTIBLE", ErrorKind.INVERSION, "Expression {0} cannot be inverted");

  static final DiagnosticType MISPLACED_DEF =
      make(
          "MISPLACED_DEF",
          ErrorKind.PLACEMENT,
          "Macro definition {0} is only allowed directly inside a concatenation");

  /** An identifier for this type of error. */
  public final String key;

  /** The family this error belongs to. */
  public final ErrorKind kind;

  /** The default way to format errors. The style of format is java.text.MessageFormat. */
  public final String format;

  /**
   * Create a DiagnosticType.
   *
   * @param name An identifier
   * @param kind The error family
   * @param descriptionFormat A format string
   * @return A new DiagnosticType
   */
  public static DiagnosticType make(String name, ErrorKind kind, String descriptionFormat) {
    return new DiagnosticType(name, kind, descriptionFormat);
  }

  private DiagnosticType(String key, ErrorKind kind, String format) {
    this.key = checkNotNull(key);
    this.kind = checkNotNull(kind);
    this.format = checkNotNull(format);
  }

  String format(Object... arguments) {
    return MessageFormat.format(format, arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
