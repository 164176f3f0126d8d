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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An {@link HtmlMinifier} that collapses whitespace runs to one space and records every call.
 *
 * <p>Its analysis is deliberately simple: the output ends with whitespace if its last character
 * is a space, ends with a block element if it ends with {@code </div>} or {@code </p>}, and is
 * inside a script once it has seen more {@code <script} than {@code </script>}.
 */
class RecordingHtmlMinifier implements HtmlMinifier {

  /** The arguments of one call to {@link #minify}. */
  record Call(
      String content,
      boolean previousIsWhitespace,
      boolean previousEndsWithBlockElement,
      boolean insideScript) {

    MarkupState state() {
      return new MarkupState(previousIsWhitespace, previousEndsWithBlockElement, insideScript);
    }
  }

  private final List<Call> calls = new ArrayList<>();

  @Override
  public String minify(
      String content,
      boolean previousIsWhitespace,
      boolean previousEndsWithBlockElement,
      boolean insideScript) {
    calls.add(new Call(content, previousIsWhitespace, previousEndsWithBlockElement, insideScript));
    return content.replaceAll("\\s+", " ");
  }

  @Override
  public MarkupState analyseContent(String content, MarkupState state) {
    boolean insideScript = state.insideScript();
    int open = content.lastIndexOf("<script");
    int close = content.lastIndexOf("</script>");
    if (open > close) {
      insideScript = true;
    } else if (close >= 0) {
      insideScript = false;
    }
    return new MarkupState(
        content.endsWith(" "),
        content.endsWith("</div>") || content.endsWith("</p>"),
        insideScript);
  }

  ImmutableList<Call> getCalls() {
    return ImmutableList.copyOf(calls);
  }
}
