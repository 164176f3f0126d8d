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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** An inner node of the template tree, holding its children in source order. */
public final class Block extends SyntaxNode {
  private static final long serialVersionUID = 1L;

  private final BlockType type;
  private final @Nullable String name;
  private final ImmutableList<SyntaxNode> children;

  private Block(Builder builder) {
    this.type = builder.type;
    this.name = builder.name;
    this.children = ImmutableList.copyOf(builder.children);
  }

  public static Builder builder(BlockType type) {
    return new Builder(type);
  }

  /** Returns a builder with the type, name and children of this block. */
  public Builder toBuilder() {
    return new Builder(type).setName(name).addChildren(children);
  }

  public BlockType getType() {
    return type;
  }

  public @Nullable String getName() {
    return name;
  }

  public ImmutableList<SyntaxNode> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public SyntaxNode getChildAtIndex(int i) {
    return children.get(i);
  }

  /** The start of the first child, or {@link SourceLocation#UNDEFINED} if there is none. */
  @Override
  public SourceLocation getStart() {
    return children.isEmpty() ? SourceLocation.UNDEFINED : children.get(0).getStart();
  }

  @Override
  public boolean isSpan() {
    return false;
  }

  @Override
  public boolean isBlock() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Block)) {
      return false;
    }
    Block that = (Block) o;
    return type == that.type && Objects.equals(name, that.name) && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, children);
  }

  @Override
  public String toString() {
    return name == null ? "BLOCK " + type : "BLOCK " + type + " " + name;
  }

  /** Builds {@link Block}s. */
  public static final class Builder {
    private final BlockType type;
    private @Nullable String name;
    private final List<SyntaxNode> children = new ArrayList<>();

    private Builder(BlockType type) {
      this.type = checkNotNull(type);
    }

    @CanIgnoreReturnValue
    public Builder setName(@Nullable String name) {
      this.name = name;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChild(SyntaxNode child) {
      children.add(checkNotNull(child, "null child in %s block", type));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChildren(Iterable<? extends SyntaxNode> newChildren) {
      for (SyntaxNode child : newChildren) {
        addChild(child);
      }
      return this;
    }

    /** Replaces the children added so far. */
    @CanIgnoreReturnValue
    public Builder setChildren(Iterable<? extends SyntaxNode> newChildren) {
      children.clear();
      return addChildren(newChildren);
    }

    public Block build() {
      return new Block(this);
    }
  }
}
