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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceLocationTest {

  @Test
  public void testUndefined() {
    assertThat(SourceLocation.UNDEFINED.isDefined()).isFalse();
    assertThat(SourceLocation.ZERO.isDefined()).isTrue();
    assertThat(SourceLocation.UNDEFINED.toString()).isEqualTo("(?)");
  }

  @Test
  public void testBadPositionRejected() {
    assertThrows(IllegalArgumentException.class, () -> SourceLocation.of(-2, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> SourceLocation.of(3, -1, 0));
  }

  @Test
  public void testOrdering() {
    assertThat(SourceLocation.of(3, 0, 3)).isLessThan(SourceLocation.of(10, 1, 2));
  }

  @Test
  public void testWhitespaceClass() {
    assertThat(SymbolType.WHITESPACE.isWhitespaceClass()).isTrue();
    assertThat(SymbolType.NEW_LINE.isWhitespaceClass()).isTrue();
    assertThat(SymbolType.UNKNOWN.isWhitespaceClass()).isTrue();
    assertThat(SymbolType.COMMENT.isWhitespaceClass()).isFalse();
    assertThat(SymbolType.IDENTIFIER.isWhitespaceClass()).isFalse();
  }
}
