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
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of a compilation step: either a value or the first {@link CompileError} that
 * stopped it. There is never a partial value alongside an error.
 */
public final class CompileResult<T> {
  private final @Nullable T value;
  private final @Nullable CompileError error;

  private CompileResult(@Nullable T value, @Nullable CompileError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> CompileResult<T> success(T value) {
    return new CompileResult<>(checkNotNull(value), null);
  }

  public static <T> CompileResult<T> failure(CompileError error) {
    return new CompileResult<>(null, checkNotNull(error));
  }

  static <T> CompileResult<T> failure(DiagnosticType type, Object... arguments) {
    return failure(CompileError.make(type, arguments));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** Returns the value. Only valid on a successful result. */
  public T getValue() {
    checkState(isSuccess(), "No value, compilation failed: %s", error);
    return value;
  }

  /** Returns the error. Only valid on a failed result. */
  public CompileError getError() {
    checkState(!isSuccess(), "No error, compilation succeeded");
    return error;
  }

  /** Returns the value, or throws a {@link CompileException} carrying the error. */
  public T getOrThrow() {
    if (error != null) {
      throw new CompileException(error);
    }
    return value;
  }

  public <R> CompileResult<R> map(Function<? super T, ? extends R> function) {
    if (error != null) {
      return failure(error);
    }
    return success(function.apply(value));
  }

  public <R> CompileResult<R> flatMap(Function<? super T, CompileResult<R>> function) {
    if (error != null) {
      return failure(error);
    }
    return function.apply(value);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof CompileResult)) {
      return false;
    }
    CompileResult<?> that = (CompileResult<?>) o;
    return Objects.equals(value, that.value) && Objects.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, error);
  }

  @Override
  public String toString() {
    return isSuccess() ? "success(" + value + ")" : "failure(" + error + ")";
  }
}
