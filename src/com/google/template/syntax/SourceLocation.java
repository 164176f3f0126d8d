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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * A position in a template source, as recorded by the parser.
 *
 * <p>All three indices are zero-based. {@link #UNDEFINED} marks nodes that were synthesized and
 * have no position of their own.
 *
 * @param absoluteIndex Offset from the beginning of the source.
 * @param lineIndex Line of the position.
 * @param characterIndex Offset from the beginning of the line.
 */
public record SourceLocation(int absoluteIndex, int lineIndex, int characterIndex)
    implements Comparable<SourceLocation>, Serializable {

  public static final SourceLocation UNDEFINED = new SourceLocation(-1, -1, -1);

  public static final SourceLocation ZERO = new SourceLocation(0, 0, 0);

  public SourceLocation {
    boolean undefined = absoluteIndex == -1 && lineIndex == -1 && characterIndex == -1;
    checkArgument(
        undefined || (absoluteIndex >= 0 && lineIndex >= 0 && characterIndex >= 0),
        "Recorded bad position information: %s:%s:%s",
        absoluteIndex,
        lineIndex,
        characterIndex);
  }

  public static SourceLocation of(int absoluteIndex, int lineIndex, int characterIndex) {
    return new SourceLocation(absoluteIndex, lineIndex, characterIndex);
  }

  public boolean isDefined() {
    return absoluteIndex != -1;
  }

  @Override
  public int compareTo(SourceLocation other) {
    return Integer.compare(absoluteIndex, other.absoluteIndex);
  }

  @Override
  public String toString() {
    return isDefined() ? "(" + absoluteIndex + ":" + lineIndex + "," + characterIndex + ")" : "(?)";
  }
}
