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

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Editor metadata the parser attaches to a {@link Span}, describing how the span reacts to
 * incremental edits. Rewrites of the tree carry it over as is; nothing in this package reads it.
 *
 * @param acceptedCharacters Which characters an edit at the end of the span may add.
 * @param autoCompleteString Text an editor may insert to close the span, if any.
 */
public record EditHandler(AcceptedCharacters acceptedCharacters, @Nullable String autoCompleteString)
    implements Serializable {

  public static final EditHandler DEFAULT = new EditHandler(AcceptedCharacters.ANY, null);

  public EditHandler {
    requireNonNull(acceptedCharacters, "acceptedCharacters");
  }

  /** Characters accepted by an edit at the end of a span. */
  public enum AcceptedCharacters {
    NONE,
    NEW_LINE,
    WHITESPACE,
    NON_WHITESPACE,
    ALL_WHITESPACE,
    ANY
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("EditHandler")
        .omitNullValues()
        .add("accepts", acceptedCharacters)
        .add("autoComplete", autoCompleteString)
        .toString();
  }
}
