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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * A classified token of a {@link Span}.
 *
 * @param type The classification assigned by the tokenizer.
 * @param content The source text of the token.
 * @param start Where the token starts in the template source.
 */
public record Symbol(SymbolType type, String content, SourceLocation start)
    implements Serializable {

  public Symbol {
    requireNonNull(type, "type");
    requireNonNull(content, "content");
    requireNonNull(start, "start");
  }

  public static Symbol of(SymbolType type, String content, SourceLocation start) {
    return new Symbol(type, content, start);
  }

  /** Creates a symbol holding literal markup text. */
  public static Symbol markup(String content, SourceLocation start) {
    return new Symbol(SymbolType.MARKUP, content, start);
  }

  /** Returns a symbol of the same type and start with different text. */
  public Symbol withContent(String newContent) {
    return newContent.equals(content) ? this : new Symbol(type, newContent, start);
  }

  @Override
  public String toString() {
    return type + "(" + content.replace("\r", "\\r").replace("\n", "\\n") + ")" + start;
  }
}
