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

import com.google.common.collect.ImmutableMap;
import com.google.macroregex.asm.Expr;
import org.jspecify.annotations.Nullable;

/**
 * An immutable layer of macro bindings. Scopes are nested: a scope points back to its parent and
 * lookups walk outwards. Each concatenation that defines macros compiles its items against a child
 * scope, which is dropped once the concatenation is done, so its bindings can never leak outwards.
 *
 * <p>{@link #define} returns a new scope instead of changing this one, so scopes can be shared
 * freely between threads.
 */
public final class MacroScope {
  private final @Nullable MacroScope parent;
  private final ImmutableMap<String, Expr> bindings;
  private final int depth;

  private MacroScope(@Nullable MacroScope parent, ImmutableMap<String, Expr> bindings) {
    this.parent = parent;
    this.bindings = bindings;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /** Creates the outermost scope, holding the builtin macros. */
  public static MacroScope createRootScope(ImmutableMap<String, Expr> builtins) {
    return new MacroScope(null, checkNotNull(builtins));
  }

  /** Returns a new, empty scope nested in this one. */
  public MacroScope createChildScope() {
    return new MacroScope(this, ImmutableMap.of());
  }

  /**
   * Returns a copy of this scope that also binds {@code name}. The name must not be visible yet,
   * neither here nor in an enclosing scope.
   */
  public MacroScope define(String name, Expr value) {
    checkState(!isDefined(name), "Macro %s already defined", name);
    return new MacroScope(
        parent,
        ImmutableMap.<String, Expr>builder().putAll(bindings).put(name, value).buildOrThrow());
  }

  /** Returns the binding of {@code name} in the closest scope that has one, or null. */
  public @Nullable Expr lookup(String name) {
    for (MacroScope s = this; s != null; s = s.parent) {
      Expr value = s.bindings.get(name);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  public boolean isDefined(String name) {
    return lookup(name) != null;
  }

  @Override
  public String toString() {
    return "MacroScope@" + depth + bindings.keySet();
  }
}
