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
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.macroregex.ast.Patterns.anyOf;
import static com.google.macroregex.ast.Patterns.concat;
import static com.google.macroregex.ast.Patterns.def;
import static com.google.macroregex.ast.Patterns.either;
import static com.google.macroregex.ast.Patterns.literal;
import static com.google.macroregex.ast.Patterns.macro;
import static com.google.macroregex.ast.Patterns.oneOrMore;
import static com.google.macroregex.ast.Patterns.optional;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.macroregex.asm.Expr;
import com.google.macroregex.asm.Exprs;
import com.google.macroregex.asm.RegexAssembler;
import com.google.macroregex.asm.RegexFlavor;
import com.google.macroregex.ast.PatternNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The table of macros every pattern can use without defining them, keyed by their
 * {@code #}-prefixed names.
 *
 * <p>The table is built once and never changes afterwards; a single instance is shared by all
 * compilations.
 */
public final class BuiltinMacros {
  private static final Logger logger = Logger.getLogger(BuiltinMacros.class.getName());

  private static final Supplier<BuiltinMacros> STANDARD =
      Suppliers.memoize(BuiltinMacros::createStandard);

  /** Base macros that have a derived {@code #not_} variant. */
  private static final ImmutableSet<String> INVERTIBLE =
      ImmutableSet.of(
          "linefeed",
          "carriage_return",
          "tab",
          "digit",
          "letter",
          "lowercase",
          "uppercase",
          "space",
          "token_character",
          "word_boundary");

  /** Short names of the invertible macros. Each also gets an {@code #n<short>} inverse alias. */
  private static final String INVERTIBLE_ALIASES =
      "linefeed lf\n"
          + "carriage_return cr\n"
          + "tab t\n"
          + "digit d\n"
          + "letter l\n"
          + "lowercase lc\n"
          + "uppercase uc\n"
          + "space s\n"
          + "token_character tc\n"
          + "word_boundary wb";

  private static final String OTHER_ALIASES =
      "any a\n"
          + "windows_newline crlf\n"
          + "start_string ss\n"
          + "end_string es\n"
          + "start_line sl\n"
          + "end_line el\n"
          + "quote q\n"
          + "double_quote dq\n"
          + "left_brace lb\n"
          + "right_brace rb";

  private final ImmutableMap<String, Expr> macros;

  private BuiltinMacros(ImmutableMap<String, Expr> macros) {
    this.macros = checkNotNull(macros);
  }

  /** Returns the standard table. */
  public static BuiltinMacros standard() {
    return STANDARD.get();
  }

  /** Returns the expression bound to {@code name}, or null. */
  public @Nullable Expr get(String name) {
    return macros.get(name);
  }

  public boolean contains(String name) {
    return macros.containsKey(name);
  }

  public ImmutableMap<String, Expr> asMap() {
    return macros;
  }

  private static BuiltinMacros createStandard() {
    Map<String, Expr> table = new LinkedHashMap<>();
    table.put("#any", Exprs.ANY);
    table.put("#linefeed", Exprs.LINEFEED);
    table.put("#carriage_return", Exprs.CARRIAGE_RETURN);
    table.put("#windows_newline", Exprs.literal("\r\n"));
    table.put("#tab", Exprs.TAB);
    table.put("#digit", Exprs.DIGIT);
    table.put("#letter", Exprs.LETTER);
    table.put("#lowercase", Exprs.LOWERCASE);
    table.put("#uppercase", Exprs.UPPERCASE);
    table.put("#space", Exprs.SPACE);
    table.put("#token_character", Exprs.TOKEN_CHARACTER);
    table.put("#start_string", Exprs.START_STRING);
    table.put("#end_string", Exprs.END_STRING);
    table.put("#start_line", Exprs.START_LINE);
    table.put("#end_line", Exprs.END_LINE);
    table.put("#word_boundary", Exprs.WORD_BOUNDARY);

    table.put("#quote", Exprs.literal("'"));
    table.put("#double_quote", Exprs.literal("\""));
    table.put("#left_brace", Exprs.literal("["));
    table.put("#right_brace", Exprs.literal("]"));

    for (String name : INVERTIBLE) {
      Expr macro = table.get("#" + name);
      table.put(
          "#not_" + name,
          macro.invert().orElseThrow(() -> new IllegalStateException("No inverse: " + name)));
    }
    for (List<String> names : aliases(INVERTIBLE_ALIASES)) {
      String longName = names.get(0);
      String shortName = names.get(1);
      table.put("#" + shortName, table.get("#" + longName));
      table.put("#n" + shortName, table.get("#not_" + longName));
    }
    for (List<String> names : aliases(OTHER_ALIASES)) {
      table.put("#" + names.get(1), table.get("#" + names.get(0)));
    }

    // [[0-1 '-'] [1+ #digit]]
    addSelfHosted(
        table, "#integer", "#int", concat(optional(literal("-")), oneOrMore(macro("#digit"))));
    // [1+ #digit]
    addSelfHosted(table, "#unsigned_integer", "#uint", concat(oneOrMore(macro("#digit"))));
    // [#int [0-1 '.' #uint]]
    addSelfHosted(
        table,
        "#real",
        null,
        concat(macro("#int"), optional(concat(literal("."), macro("#uint")))));
    // [[0-1 '-'] [[#uint '.' [0-1 #uint] | '.' #uint] [0-1 #exponent] | #int #exponent]
    //  #exponent=[['e' | 'E'] [0-1 ['+' | '-']] #uint]]
    addSelfHosted(
        table,
        "#float",
        null,
        concat(
            optional(literal("-")),
            either(
                concat(
                    either(
                        concat(macro("#uint"), literal("."), optional(macro("#uint"))),
                        concat(literal("."), macro("#uint"))),
                    optional(macro("#exponent"))),
                concat(macro("#int"), macro("#exponent"))),
            def(
                "#exponent",
                concat(
                    anyOf("eE"),
                    optional(anyOf("+-")),
                    macro("#uint")))));

    BuiltinMacros builtins = new BuiltinMacros(ImmutableMap.copyOf(table));
    logger.fine("Built " + table.size() + " builtin macros");
    return builtins;
  }

  /**
   * Compiles {@code definition} against the table as it stands, then registers the result under
   * {@code longName} and, if given, {@code shortName}.
   */
  private static void addSelfHosted(
      Map<String, Expr> table,
      String longName,
      @Nullable String shortName,
      PatternNode definition) {
    MacroCompiler compiler =
        new MacroCompiler(
            new BuiltinMacros(ImmutableMap.copyOf(table)),
            new BuiltinOperators(new RegexAssembler(RegexFlavor.PYTHON)));
    CompileResult<Expr> result = compiler.compileFragment(definition);
    checkState(result.isSuccess(), "Builtin macro %s does not compile: %s", longName, result);
    table.put(longName, result.getValue());
    if (shortName != null) {
      table.put(shortName, result.getValue());
    }
  }

  private static ImmutableList<List<String>> aliases(String table) {
    return Splitter.on('\n')
        .splitToStream(table)
        .map(line -> Splitter.on(' ').splitToList(line))
        .collect(toImmutableList());
  }
}
