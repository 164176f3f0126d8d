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
 * Thrown when minification is aborted: the tree breaks an invariant the parser guarantees, it is
 * nested deeper than allowed, or the {@link HtmlMinifier} broke its contract.
 *
 * <p>A partly minified template could change the meaning of its code, so there is no fallback.
 */
public class MinifyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  MinifyException(String message, Object... args) {
    super(String.format(message, args));
  }
}
