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
 * What one run of {@link MinifyHtmlPass} changed.
 *
 * @param markupSpansMinified Non-empty markup spans handed to the {@link HtmlMinifier}.
 * @param emptyMarkupSpansRemoved Empty markup spans dropped from their block.
 * @param codeSpansCompacted Code spans passed through the {@link CodeSpanCompactor}.
 * @param codeSymbolsRemoved Symbols the compactor dropped.
 * @param markupCharactersSaved Length of the markup before minification minus after.
 * @param opaqueBlocksVisited Blocks whose output is only known at render time.
 */
public record MinifyReport(
    int markupSpansMinified,
    int emptyMarkupSpansRemoved,
    int codeSpansCompacted,
    int codeSymbolsRemoved,
    long markupCharactersSaved,
    int opaqueBlocksVisited) {

  public static final MinifyReport EMPTY = new MinifyReport(0, 0, 0, 0, 0, 0);

  /** Accumulates counts during a run. Not thread-safe. */
  static final class Builder {
    private int markupSpansMinified;
    private int emptyMarkupSpansRemoved;
    private int codeSpansCompacted;
    private int codeSymbolsRemoved;
    private long markupCharactersSaved;
    private int opaqueBlocksVisited;

    void recordMarkupSpan(int lengthBefore, int lengthAfter) {
      markupSpansMinified++;
      markupCharactersSaved += lengthBefore - lengthAfter;
    }

    void recordEmptyMarkupSpan() {
      emptyMarkupSpansRemoved++;
    }

    void recordCodeSpan(int symbolsBefore, int symbolsAfter) {
      codeSpansCompacted++;
      codeSymbolsRemoved += symbolsBefore - symbolsAfter;
    }

    void recordOpaqueBlock() {
      opaqueBlocksVisited++;
    }

    MinifyReport build() {
      return new MinifyReport(
          markupSpansMinified,
          emptyMarkupSpansRemoved,
          codeSpansCompacted,
          codeSymbolsRemoved,
          markupCharactersSaved,
          opaqueBlocksVisited);
    }
  }
}
