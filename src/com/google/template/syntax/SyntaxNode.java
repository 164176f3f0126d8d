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

import java.io.IOException;
import java.io.Serializable;

/**
 * A node of a parsed template: either a {@link Span}, holding source text, or a {@link Block},
 * holding other nodes.
 *
 * <p>Nodes are immutable. Passes that change the tree build new nodes with {@link
 * Span#toBuilder()} and {@link Block#toBuilder()}, which keep the attributes the code generator
 * relies on.
 */
public abstract class SyntaxNode implements Serializable {
  private static final long serialVersionUID = 1L;

  SyntaxNode() {}

  public abstract boolean isSpan();

  public abstract boolean isBlock();

  /** Where this node starts in the template source. */
  public abstract SourceLocation getStart();

  /** Returns this node as a span. Throws if it is a block. */
  public final Span asSpan() {
    if (!isSpan()) {
      throw new ClassCastException("Not a span: " + this);
    }
    return (Span) this;
  }

  /** Returns this node as a block. Throws if it is a span. */
  public final Block asBlock() {
    if (!isBlock()) {
      throw new ClassCastException("Not a block: " + this);
    }
    return (Block) this;
  }

  /** Prints this node and its descendants, one node per line, indented by depth. */
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(SyntaxNode n, int level, Appendable sb)
      throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    if (n.isBlock()) {
      for (SyntaxNode child : n.asBlock().getChildren()) {
        toStringTreeHelper(child, level + 1, sb);
      }
    }
  }
}
