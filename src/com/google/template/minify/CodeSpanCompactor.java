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

package com.google.template.minify;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.template.syntax.Span;
import com.google.template.syntax.Symbol;
import com.google.template.syntax.SymbolType;
import java.util.List;

/**
 * Removes comments and redundant whitespace from the symbols of an embedded code span.
 *
 * <p>Tokens other than whitespace, newlines, unknown characters and comments are kept as they
 * are, in order. Of each run of whitespace-class symbols at most one is kept, and it is shortened
 * to a single character so that adjacent tokens stay separated:
 *
 * <pre>{@code
 * if (x)
 *     // note
 *     return   y;
 * }</pre>
 *
 * Becomes
 *
 * <pre>{@code
 * if (x) return y;
 * }</pre>
 *
 * <p>Whitespace at the beginning of a span is dropped, since the span follows either markup or
 * template syntax that already separates it.
 */
public final class CodeSpanCompactor {
  private static final String SEPARATOR = " ";

  private CodeSpanCompactor() {}

  /** Returns the compacted symbols, leaving {@code symbols} untouched. */
  public static ImmutableList<Symbol> compact(List<Symbol> symbols) {
    ImmutableList.Builder<Symbol> trimmed = ImmutableList.builder();
    boolean previousIsWhitespace = true;
    for (Symbol symbol : symbols) {
      checkNotNull(symbol, "null symbol in %s", symbols);
      SymbolType type = symbol.type();
      if (type == SymbolType.COMMENT) {
        continue;
      }
      if (!type.isWhitespaceClass()) {
        trimmed.add(symbol);
        previousIsWhitespace = false;
        continue;
      }
      if (previousIsWhitespace) {
        continue;
      }
      previousIsWhitespace = true;
      trimmed.add(minifySymbol(symbol));
    }
    return trimmed.build();
  }

  /**
   * Returns a copy of {@code span} with compacted symbols and the same kind, start and edit
   * handler.
   *
   * @throws MinifyException if the span has no symbols
   */
  public static Span compact(Span span) {
    if (!span.hasSymbols()) {
      throw new MinifyException(
          "%s span at %s has no symbols to compact", span.getKind(), span.getStart());
    }
    ImmutableList<Symbol> symbols = span.getSymbols();
    ImmutableList<Symbol> compacted = compact(symbols);
    if (compacted.equals(symbols)) {
      return span;
    }
    return span.toBuilder().clearSymbols().addSymbols(compacted).build();
  }

  private static Symbol minifySymbol(Symbol symbol) {
    switch (symbol.type()) {
      case NEW_LINE:
        return Symbol.of(SymbolType.WHITESPACE, SEPARATOR, symbol.start());
      case WHITESPACE:
        return symbol.withContent(firstCodePoint(symbol.content()));
      default:
        return symbol;
    }
  }

  /** Returns the first character of {@code content}, keeping surrogate pairs whole. */
  private static String firstCodePoint(String content) {
    if (content.isEmpty()) {
      return content;
    }
    return content.substring(0, content.offsetByCodePoints(0, 1));
  }
}
