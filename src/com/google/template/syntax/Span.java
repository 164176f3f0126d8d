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

package com.google.template.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A leaf of the template tree: a run of markup, code or template syntax.
 *
 * <p>A span is normally made of the {@link Symbol}s the tokenizer produced, and its content is
 * their concatenation. A span built from plain text with {@link Builder#setText} has no symbol
 * list; {@link #hasSymbols()} tells the two apart.
 */
public final class Span extends SyntaxNode {
  private static final long serialVersionUID = 1L;

  private final SpanKind kind;
  private final SourceLocation start;
  private final EditHandler editHandler;
  private final String content;
  private final @Nullable ImmutableList<Symbol> symbols;

  private Span(Builder builder) {
    this.kind = builder.kind;
    this.start = builder.start;
    this.editHandler = builder.editHandler;
    if (builder.symbols != null) {
      this.symbols = builder.symbols.build();
      StringBuilder sb = new StringBuilder();
      for (Symbol symbol : symbols) {
        sb.append(symbol.content());
      }
      this.content = sb.toString();
    } else {
      this.symbols = null;
      this.content = builder.text;
    }
  }

  public static Builder builder(SpanKind kind) {
    return new Builder(kind);
  }

  /** Returns a builder holding every attribute of this span, symbols included. */
  public Builder toBuilder() {
    Builder builder = new Builder(kind).setStart(start).setEditHandler(editHandler);
    if (symbols != null) {
      builder.addSymbols(symbols);
    } else {
      builder.setText(content);
    }
    return builder;
  }

  public SpanKind getKind() {
    return kind;
  }

  @Override
  public SourceLocation getStart() {
    return start;
  }

  public EditHandler getEditHandler() {
    return editHandler;
  }

  public String getContent() {
    return content;
  }

  public boolean hasSymbols() {
    return symbols != null;
  }

  /**
   * Returns the symbols of this span.
   *
   * @throws IllegalStateException if the span was built from plain text
   */
  public ImmutableList<Symbol> getSymbols() {
    if (symbols == null) {
      throw new IllegalStateException(kind + " span at " + start + " has no symbols");
    }
    return symbols;
  }

  public boolean isMarkup() {
    return kind == SpanKind.MARKUP;
  }

  public boolean isCode() {
    return kind == SpanKind.CODE;
  }

  public boolean isMetaCode() {
    return kind == SpanKind.META_CODE;
  }

  @Override
  public boolean isSpan() {
    return true;
  }

  @Override
  public boolean isBlock() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Span)) {
      return false;
    }
    Span that = (Span) o;
    return kind == that.kind
        && start.equals(that.start)
        && editHandler.equals(that.editHandler)
        && content.equals(that.content)
        && Objects.equals(symbols, that.symbols);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, start, content);
  }

  @Override
  public String toString() {
    return "SPAN "
        + kind
        + " "
        + start
        + " \""
        + content.replace("\r", "\\r").replace("\n", "\\n")
        + "\"";
  }

  /** Builds {@link Span}s. */
  public static final class Builder {
    private final SpanKind kind;
    private SourceLocation start = SourceLocation.UNDEFINED;
    private EditHandler editHandler = EditHandler.DEFAULT;
    private String text = "";
    private ImmutableList.@Nullable Builder<Symbol> symbols;

    private Builder(SpanKind kind) {
      this.kind = checkNotNull(kind);
    }

    @CanIgnoreReturnValue
    public Builder setStart(SourceLocation start) {
      this.start = checkNotNull(start);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setEditHandler(EditHandler editHandler) {
      this.editHandler = checkNotNull(editHandler);
      return this;
    }

    /** Makes the span plain text, discarding any symbols accepted so far. */
    @CanIgnoreReturnValue
    public Builder setText(String text) {
      this.text = checkNotNull(text);
      this.symbols = null;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder accept(Symbol symbol) {
      checkNotNull(symbol);
      if (symbols == null) {
        symbols = ImmutableList.builder();
      }
      symbols.add(symbol);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addSymbols(Iterable<Symbol> newSymbols) {
      for (Symbol symbol : newSymbols) {
        accept(symbol);
      }
      return this;
    }

    /** Replaces the symbols accepted so far with an empty list. */
    @CanIgnoreReturnValue
    public Builder clearSymbols() {
      symbols = ImmutableList.builder();
      return this;
    }

    public Span build() {
      return new Span(this);
    }
  }
}
