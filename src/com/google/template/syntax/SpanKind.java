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

/** What a {@link Span} holds. Assigned by the parser and never changed afterwards. */
public enum SpanKind {
  /** Static markup, written to the output as is. */
  MARKUP,
  /** Embedded code. */
  CODE,
  /** Keywords and delimiters of the template language itself, e.g. {@code section} or braces. */
  META_CODE,
  /** The character switching between markup and code. */
  TRANSITION,
  /** A template comment. */
  COMMENT
}
