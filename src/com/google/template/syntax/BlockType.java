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

/** The role of a {@link Block} in the template. */
public enum BlockType {
  /** The root of a parsed template. */
  DOCUMENT,
  /** A region of markup, possibly nested inside code. */
  MARKUP,
  /** A named section rendered by the layout. */
  SECTION,
  /** A code block or control-flow statement. */
  STATEMENT,
  /** An expression whose value is written to the output. */
  EXPRESSION,
  /** A helper declaration. */
  HELPER,
  DIRECTIVE,
  COMMENT,
  TEMPLATE,
  FUNCTIONS;

  /**
   * Whether the output of blocks of this type is produced by code at render time, but the block
   * can still be walked to minify what it contains.
   */
  public boolean isRecursableCode() {
    return this == SECTION || this == STATEMENT || this == EXPRESSION || this == HELPER;
  }
}
