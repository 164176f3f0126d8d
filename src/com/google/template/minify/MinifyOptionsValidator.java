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

/** Checks for option values the pass cannot run with. */
final class MinifyOptionsValidator {

  static void validate(MinifyOptions options) {
    if (options.maxNestingDepth < 1) {
      throw new InvalidOptionsException(
          "Maximum nesting depth must be at least 1, was %s.", options.maxNestingDepth);
    }

    if (options.compactMetaCode && !options.compactCodeSpans) {
      throw new InvalidOptionsException(
          "Cannot compact template syntax spans when code span compaction is off.");
    }
  }

  /** Exception to indicate invalid values in the MinifyOptions. */
  public static class InvalidOptionsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }

  // Don't instantiate.
  private MinifyOptionsValidator() {}
}
