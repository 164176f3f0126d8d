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

/**
 * What the markup minifier knows about the output written before the markup it is about to
 * process.
 *
 * @param previousIsWhitespace The output so far ends with whitespace, so leading whitespace of the
 *     next markup can be dropped.
 * @param previousEndsWithBlockElement The output so far ends right after a block-level element, so
 *     whitespace next to it is insignificant.
 * @param insideScript The output so far has opened a script region that is not yet closed.
 */
public record MarkupState(
    boolean previousIsWhitespace, boolean previousEndsWithBlockElement, boolean insideScript) {

  private static final MarkupState INITIAL = new MarkupState(true, true, false);

  /** The state at the beginning of a document or of a markup block minified on its own. */
  public static MarkupState initial() {
    return INITIAL;
  }

  /**
   * The state after a node whose output is only known at render time. Nothing can be assumed about
   * the characters it writes, except that it does not leave a script region.
   */
  public MarkupState afterOpaqueNode() {
    return new MarkupState(false, false, insideScript);
  }
}
