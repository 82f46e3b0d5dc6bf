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

import com.google.auto.value.AutoValue;
import com.google.macroregex.asm.RegexFlavor;

/** Compiler options. */
@AutoValue
public abstract class CompilerOptions {

  /** The regex dialect the assembled output is written in. */
  public abstract RegexFlavor getFlavor();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder().setFlavor(RegexFlavor.PYTHON);
  }

  /** Returns the default options, producing Python-flavored output. */
  public static CompilerOptions defaults() {
    return builder().build();
  }

  /** Builder for {@link CompilerOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFlavor(RegexFlavor flavor);

    public abstract CompilerOptions build();
  }
}
