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

/** The classification the tokenizer gave a {@link Symbol}. */
public enum SymbolType {
  WHITESPACE,
  NEW_LINE,
  COMMENT,
  /** A character the tokenizer could not classify. Handled like whitespace by minification. */
  UNKNOWN,
  IDENTIFIER,
  KEYWORD,
  OPERATOR,
  STRING_LITERAL,
  CHARACTER_LITERAL,
  INTEGER_LITERAL,
  REAL_LITERAL,
  PUNCTUATION,
  TRANSITION,
  /** Literal markup text. */
  MARKUP;

  /**
   * Whether symbols of this type only separate other tokens, so that a run of them can be reduced
   * to one.
   */
  public boolean isWhitespaceClass() {
    return this == WHITESPACE || this == NEW_LINE || this == UNKNOWN;
  }
}
