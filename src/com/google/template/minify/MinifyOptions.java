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

import com.google.common.base.MoreObjects;
import java.io.Serializable;

/** Options for {@link MinifyHtmlPass} and {@link MinifyingTemplateParser}. */
public class MinifyOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Default for {@link #setMaxNestingDepth}. */
  public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

  /** Whether {@link MinifyingTemplateParser} runs the pass at all. */
  boolean enabled = true;

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Whether code spans have their whitespace and comments compacted. */
  boolean compactCodeSpans = true;

  public void setCompactCodeSpans(boolean compactCodeSpans) {
    this.compactCodeSpans = compactCodeSpans;
  }

  public boolean shouldCompactCodeSpans() {
    return compactCodeSpans;
  }

  /** Whether spans of template syntax (keywords, braces) are compacted like code spans. */
  boolean compactMetaCode = false;

  public void setCompactMetaCode(boolean compactMetaCode) {
    this.compactMetaCode = compactMetaCode;
  }

  public boolean shouldCompactMetaCode() {
    return compactMetaCode;
  }

  /** How deeply blocks may nest before the pass gives up. */
  int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

  public void setMaxNestingDepth(int maxNestingDepth) {
    this.maxNestingDepth = maxNestingDepth;
  }

  public int getMaxNestingDepth() {
    return maxNestingDepth;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("compactCodeSpans", compactCodeSpans)
        .add("compactMetaCode", compactMetaCode)
        .add("maxNestingDepth", maxNestingDepth)
        .toString();
  }
}
