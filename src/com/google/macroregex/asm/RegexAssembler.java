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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;

/**
 * RegexAssembler renders the assembly representation as regex text for one {@link RegexFlavor},
 * adding only the grouping that precedence requires.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class RegexAssembler {

  private final RegexFlavor flavor;

  public RegexAssembler(RegexFlavor flavor) {
    this.flavor = checkNotNull(flavor);
  }

  public RegexFlavor getFlavor() {
    return flavor;
  }

  /** Returns the regex text for {@code expr}. */
  public String assemble(Expr expr) {
    Generator generator = new Generator();
    generator.add(expr, Context.START);
    return generator.sb.toString();
  }

  /**
   * Where an expression is rendered. A {@link Expr.Setting} can only be written as a bare
   * {@code (?flags)} prefix at the very start of the pattern, where it scopes everything that
   * follows; elsewhere it needs a scoped group.
   */
  private enum Context {
    START,
    OTHER
  }

  private final class Generator implements Expr.Visitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private Context context = Context.OTHER;

    void add(Expr expr, Context newContext) {
      Context saved = context;
      context = newContext;
      expr.accept(this);
      context = saved;
    }

    private void addGrouped(Expr expr) {
      sb.append("(?:");
      add(expr, Context.OTHER);
      sb.append(')');
    }

    @Override
    public Void visitLiteral(Expr.Literal literal) {
      literal.string().codePoints().forEach(c -> appendLiteralChar(sb, c));
      return null;
    }

    @Override
    public Void visitConcat(Expr.Concat concat) {
      for (Expr item : concat.items()) {
        if (item instanceof Expr.Either) {
          // Alternation binds looser than concatenation.
          addGrouped(item);
        } else {
          add(item, Context.OTHER);
        }
      }
      return null;
    }

    @Override
    public Void visitEither(Expr.Either either) {
      boolean first = true;
      for (Expr item : either.items()) {
        if (!first) {
          sb.append('|');
        }
        first = false;
        add(item, Context.OTHER);
      }
      return null;
    }

    @Override
    public Void visitMultiple(Expr.Multiple multiple) {
      Expr sub = multiple.subexpr();
      if (context == Context.START && sub instanceof Expr.Setting setting) {
        sb.append("(?").append(setting.flags()).append(')');
        add(
            new Expr.Multiple(
                multiple.min(), multiple.max(), multiple.greedy(), setting.subexpr()),
            Context.START);
        return null;
      }
      if (isAtomic(sub)) {
        add(sub, Context.OTHER);
      } else {
        addGrouped(sub);
      }
      appendQuantifier(multiple);
      return null;
    }

    private void appendQuantifier(Expr.Multiple multiple) {
      int min = multiple.effectiveMin();
      Integer max = multiple.max();
      if (min == 0 && max != null && max == 1) {
        sb.append('?');
      } else if (min == 0 && max == null) {
        sb.append('*');
      } else if (min == 1 && max == null) {
        sb.append('+');
      } else if (max == null) {
        sb.append('{').append(min).append(",}");
      } else if (min == max) {
        sb.append('{').append(min).append('}');
      } else if (min == 0) {
        sb.append(flavor.requiresExplicitMinimum() ? "{0," : "{,").append(max).append('}');
      } else {
        sb.append('{').append(min).append(',').append(max).append('}');
      }
      if (!multiple.greedy()) {
        sb.append('?');
      }
    }

    @Override
    public Void visitCharacterClass(Expr.CharacterClass characterClass) {
      ImmutableList<ClassItem> items = characterClass.characters().asList();
      checkState(!items.isEmpty(), "Empty character class");
      if (!characterClass.inverted() && items.size() == 1) {
        ClassItem item = items.get(0);
        if (item instanceof ClassItem.Single single) {
          appendLiteralChar(sb, single.codePoint());
          return null;
        }
        if (item instanceof ClassItem.Builtin builtin) {
          sb.append(builtin.shorthand().escape());
          return null;
        }
      }
      sb.append(characterClass.inverted() ? "[^" : "[");
      for (ClassItem item : items) {
        if (item instanceof ClassItem.Single single) {
          appendClassChar(sb, single.codePoint());
        } else if (item instanceof ClassItem.Span span) {
          appendClassChar(sb, span.start());
          sb.append('-');
          appendClassChar(sb, span.end());
        } else {
          sb.append(((ClassItem.Builtin) item).shorthand().escape());
        }
      }
      sb.append(']');
      return null;
    }

    @Override
    public Void visitCapture(Expr.Capture capture) {
      if (capture.name() == null) {
        sb.append('(');
      } else {
        sb.append(flavor.namedGroupOpen()).append(capture.name()).append('>');
      }
      add(capture.subexpr(), Context.OTHER);
      sb.append(')');
      return null;
    }

    @Override
    public Void visitSetting(Expr.Setting setting) {
      if (context == Context.START) {
        sb.append("(?").append(setting.flags()).append(')');
        add(setting.subexpr(), Context.START);
      } else {
        sb.append("(?").append(setting.flags()).append(':');
        add(setting.subexpr(), Context.OTHER);
        sb.append(')');
      }
      return null;
    }

    @Override
    public Void visitSpecial(Expr.Special special) {
      switch (special.kind()) {
        case ANY:
          sb.append('.');
          break;
        case START_STRING:
          sb.append("\\A");
          break;
        case END_STRING:
          sb.append(flavor.endOfString());
          break;
        case START_LINE:
          sb.append('^');
          break;
        case END_LINE:
          sb.append('$');
          break;
        case WORD_BOUNDARY:
          sb.append("\\b");
          break;
        case NOT_WORD_BOUNDARY:
          sb.append("\\B");
          break;
      }
      return null;
    }
  }

  /**
   * Whether {@code expr} renders as a single unit that a quantifier can follow without a group.
   * A {@link Expr.Setting} here is never at the start of the pattern, so it renders as a group.
   */
  private static boolean isAtomic(Expr expr) {
    if (expr instanceof Expr.Literal literal) {
      return literal.isSingleCharacter();
    } else if (expr instanceof Expr.Concat concat) {
      return isAtomicSequence(concat.items());
    } else if (expr instanceof Expr.Either either) {
      // An empty branch is still an alternative, so only a lone branch can stand ungrouped.
      return either.items().size() == 1 && isAtomic(either.items().get(0));
    } else if (expr instanceof Expr.Special special) {
      // Most engines refuse to repeat an assertion.
      return !special.kind().isZeroWidth();
    }
    return expr instanceof Expr.CharacterClass
        || expr instanceof Expr.Capture
        || expr instanceof Expr.Setting;
  }

  /** Empty items of a concatenation render as nothing, so they are skipped. */
  private static boolean isAtomicSequence(ImmutableList<Expr> items) {
    Expr only = null;
    for (Expr item : items) {
      if (Exprs.isEmpty(item)) {
        continue;
      }
      if (only != null) {
        return false;
      }
      only = item;
    }
    return only != null && isAtomic(only);
  }

  private static void appendLiteralChar(StringBuilder sb, int c) {
    if (appendControlChar(sb, c)) {
      return;
    }
    if (c < 0x80 && !isWordChar(c)) {
      sb.append('\\');
    }
    sb.appendCodePoint(c);
  }

  private static void appendClassChar(StringBuilder sb, int c) {
    if (appendControlChar(sb, c)) {
      return;
    }
    switch (c) {
      case '\\':
      case ']':
      case '[':
      case '^':
      case '-':
      case '&':
        sb.append('\\');
        break;
      default:
        break;
    }
    sb.appendCodePoint(c);
  }

  private static boolean appendControlChar(StringBuilder sb, int c) {
    switch (c) {
      case '\n':
        sb.append("\\n");
        return true;
      case '\r':
        sb.append("\\r");
        return true;
      case '\t':
        sb.append("\\t");
        return true;
      case '\f':
        sb.append("\\f");
        return true;
      default:
        if (c < 0x20 || c == 0x7f) {
          sb.append(String.format("\\x%02x", c));
          return true;
        }
        return false;
    }
  }

  private static boolean isWordChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
  }
}
