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
 * Removes insignificant whitespace and comments from a piece of HTML.
 *
 * <p>Implementations know the HTML semantics (block and inline elements, script and style
 * regions, attributes). {@link MinifyHtmlPass} only decides which pieces of the template are
 * handed over and with which surrounding state. Both methods must be pure functions of their
 * arguments.
 */
public interface HtmlMinifier {

  /**
   * Minifies one run of static markup.
   *
   * @param content the markup, never empty
   * @param previousIsWhitespace whether the output before {@code content} ends with whitespace
   * @param previousEndsWithBlockElement whether the output before {@code content} ends right after
   *     a block-level element
   * @param insideScript whether {@code content} starts inside a script region
   * @return the minified markup, never null
   */
  String minify(
      String content,
      boolean previousIsWhitespace,
      boolean previousEndsWithBlockElement,
      boolean insideScript);

  /**
   * Computes the state that follows already minified markup.
   *
   * @param content the value returned by {@link #minify}
   * @param state the state {@code content} was minified with
   * @return the state for the markup that follows, never null
   */
  MarkupState analyseContent(String content, MarkupState state);
}
