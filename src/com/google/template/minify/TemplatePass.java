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

import com.google.template.syntax.Block;

/**
 * A transformation of a parsed template, run after parsing and before code generation.
 *
 * <p>The tree is immutable, so a pass returns the root it rewrote instead of editing it in place.
 */
public interface TemplatePass {

  /**
   * Process the template with root node root.
   *
   * @param root Top of the template tree, normally a {@code DOCUMENT} block
   * @return the rewritten tree, or {@code root} itself when nothing changed
   */
  Block process(Block root);
}
