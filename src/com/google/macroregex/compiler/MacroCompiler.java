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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.macroregex.asm.ClassItem;
import com.google.macroregex.asm.Expr;
import com.google.macroregex.asm.Exprs;
import com.google.macroregex.ast.PatternNode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * MacroCompiler turns a pattern tree into the assembly representation. It resolves macros against
 * lexically nested scopes, applies operators, validates ranges and performs a few structural
 * optimizations:
 *
 * <ul>
 *   <li>alternatives that each match a single character are folded into one character class;
 *   <li>items that match only the empty string are dropped from sequences;
 *   <li>a sequence with a single item is replaced by that item.
 * </ul>
 *
 * <p>Compilation stops at the first error; no partial output is produced.
 *
 * <p>A MacroCompiler holds no mutable state. Concurrent calls to {@link #compile} are safe.
 */
public final class MacroCompiler {
  private static final Logger logger = Logger.getLogger(MacroCompiler.class.getName());

  /**
   * Engine flags every compiled pattern runs under: {@code ^}/{@code $} match at line breaks and
   * {@code .} matches line breaks, so that both the line and the string anchors, and both {@code
   * #any} and {@code #not_linefeed}, mean what they say.
   */
  public static final String TOP_LEVEL_FLAGS = "ms";

  private final BuiltinMacros builtins;
  private final BuiltinOperators operators;

  public MacroCompiler(BuiltinMacros builtins, BuiltinOperators operators) {
    this.builtins = checkNotNull(builtins);
    this.operators = checkNotNull(operators);
  }

  /** Compiles a whole pattern, wrapped in the {@link #TOP_LEVEL_FLAGS} setting. */
  public CompileResult<Expr> compile(PatternNode ast) {
    CompileResult<Expr> result =
        compileFragment(ast).map(body -> Exprs.setting(TOP_LEVEL_FLAGS, body));
    if (!result.isSuccess()) {
      logger.finer("Compilation failed: " + result.getError());
    }
    return result;
  }

  /** Compiles {@code ast} without the top-level setting, as needed for macro bodies. */
  CompileResult<Expr> compileFragment(PatternNode ast) {
    return ast.accept(new Walker(ast, MacroScope.createRootScope(builtins.asMap())));
  }

  private final class Walker implements PatternNode.Visitor<CompileResult<Expr>> {
    private final PatternNode root;
    private MacroScope scope;

    Walker(PatternNode root, MacroScope scope) {
      this.root = root;
      this.scope = scope;
    }

    @Override
    public CompileResult<Expr> visitConcat(PatternNode.Concat concat) {
      List<PatternNode.Def> defs = new ArrayList<>();
      List<PatternNode> regexes = new ArrayList<>();
      for (PatternNode item : concat.items()) {
        if (item instanceof PatternNode.Def def) {
          defs.add(def);
        } else {
          regexes.add(item);
        }
      }

      MacroScope outer = scope;
      try {
        if (!defs.isEmpty()) {
          scope = scope.createChildScope();
        }
        for (PatternNode.Def def : defs) {
          if (scope.isDefined(def.name())) {
            return CompileResult.failure(DiagnosticType.MACRO_REDEFINED, def.name());
          }
          CompileResult<Expr> value = def.subregex().accept(this);
          if (!value.isSuccess()) {
            return value;
          }
          scope = scope.define(def.name(), value.getValue());
        }

        List<Expr> compiled = new ArrayList<>();
        for (PatternNode regex : regexes) {
          CompileResult<Expr> item = regex.accept(this);
          if (!item.isSuccess()) {
            return item;
          }
          if (!Exprs.isEmpty(item.getValue())) {
            compiled.add(item.getValue());
          }
        }

        if (compiled.isEmpty()) {
          return CompileResult.success(Exprs.EMPTY);
        }
        if (compiled.size() == 1) {
          return CompileResult.success(compiled.get(0));
        }
        return CompileResult.success(Exprs.concat(compiled));
      } finally {
        scope = outer;
      }
    }

    @Override
    public CompileResult<Expr> visitEither(PatternNode.Either either) {
      ImmutableList.Builder<Expr> compiled = ImmutableList.builder();
      boolean foldable = true;
      for (PatternNode item : either.items()) {
        CompileResult<Expr> branch = item.accept(this);
        if (!branch.isSuccess()) {
          return branch;
        }
        compiled.add(branch.getValue());
        foldable &= isFoldable(branch.getValue());
      }
      ImmutableList<Expr> branches = compiled.build();
      if (!foldable) {
        return CompileResult.success(Exprs.either(branches));
      }

      ImmutableSet.Builder<ClassItem> characters = ImmutableSet.builder();
      for (Expr branch : branches) {
        if (branch instanceof Expr.Literal literal) {
          characters.add(ClassItem.of(literal.string().codePointAt(0)));
        } else {
          characters.addAll(((Expr.CharacterClass) branch).characters());
        }
      }
      return CompileResult.success(new Expr.CharacterClass(characters.build(), false));
    }

    @Override
    public CompileResult<Expr> visitDef(PatternNode.Def def) {
      return CompileResult.failure(DiagnosticType.MISPLACED_DEF, def.name());
    }

    @Override
    public CompileResult<Expr> visitOperator(PatternNode.Operator operator) {
      return operator
          .subregex()
          .accept(this)
          .flatMap(operand -> operators.apply(operator.name(), operand));
    }

    @Override
    public CompileResult<Expr> visitMacro(PatternNode.Macro macro) {
      Expr value = scope.lookup(macro.name());
      if (value != null) {
        return CompileResult.success(value);
      }
      if (DefinedNames.of(root).contains(macro.name())) {
        return CompileResult.failure(DiagnosticType.MACRO_OUT_OF_SCOPE, macro.name());
      }
      return CompileResult.failure(DiagnosticType.UNDEFINED_MACRO, macro.name());
    }

    @Override
    public CompileResult<Expr> visitRange(PatternNode.Range range) {
      char start = range.start();
      char end = range.end();
      CharacterCategory startCategory = CharacterCategory.of(start);
      CharacterCategory endCategory = CharacterCategory.of(end);
      if (startCategory == null) {
        return CompileResult.failure(DiagnosticType.RANGE_UNKNOWN_CATEGORY, start);
      }
      if (endCategory == null) {
        return CompileResult.failure(DiagnosticType.RANGE_UNKNOWN_CATEGORY, end);
      }
      if (startCategory != endCategory) {
        return CompileResult.failure(
            DiagnosticType.RANGE_CATEGORY_MISMATCH, start, startCategory, end, endCategory);
      }
      if (start >= end) {
        return CompileResult.failure(DiagnosticType.RANGE_NOT_ASCENDING, start, end);
      }
      return CompileResult.success(Exprs.characterClass(ClassItem.span(start, end)));
    }

    @Override
    public CompileResult<Expr> visitLiteral(PatternNode.Literal literal) {
      return CompileResult.success(Exprs.literal(literal.string()));
    }

    @Override
    public CompileResult<Expr> visitNothing(PatternNode.Nothing nothing) {
      return CompileResult.success(Exprs.EMPTY);
    }
  }

  /**
   * Whether {@code expr} can be absorbed into a character class. An inverted class is not: the
   * union of its complement with other characters is not the union of its members.
   */
  private static boolean isFoldable(Expr expr) {
    if (expr instanceof Expr.CharacterClass characterClass) {
      return !characterClass.inverted();
    }
    return expr instanceof Expr.Literal && expr.isSingleCharacter();
  }

  /** Collects the names bound by any definition in a tree, for error messages. */
  private static final class DefinedNames implements PatternNode.Visitor<Void> {
    private final ImmutableSet.Builder<String> names = ImmutableSet.builder();

    static ImmutableSet<String> of(PatternNode root) {
      DefinedNames collector = new DefinedNames();
      root.accept(collector);
      return collector.names.build();
    }

    private @Nullable Void visitAll(List<PatternNode> items) {
      for (PatternNode item : items) {
        item.accept(this);
      }
      return null;
    }

    @Override
    public Void visitConcat(PatternNode.Concat concat) {
      return visitAll(concat.items());
    }

    @Override
    public Void visitEither(PatternNode.Either either) {
      return visitAll(either.items());
    }

    @Override
    public Void visitDef(PatternNode.Def def) {
      names.add(def.name());
      return def.subregex().accept(this);
    }

    @Override
    public Void visitOperator(PatternNode.Operator operator) {
      return operator.subregex().accept(this);
    }

    @Override
    public Void visitLiteral(PatternNode.Literal literal) {
      return null;
    }

    @Override
    public Void visitMacro(PatternNode.Macro macro) {
      return null;
    }

    @Override
    public Void visitRange(PatternNode.Range range) {
      return null;
    }

    @Override
    public Void visitNothing(PatternNode.Nothing nothing) {
      return null;
    }
  }
}
