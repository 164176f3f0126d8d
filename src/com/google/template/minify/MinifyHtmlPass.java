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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.template.syntax.Block;
import com.google.template.syntax.BlockType;
import com.google.template.syntax.Span;
import com.google.template.syntax.Symbol;
import com.google.template.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Minifies the static markup of a parsed template and compacts its embedded code.
 *
 * <p>Markup spans are handed to an {@link HtmlMinifier} one after the other, together with a
 * {@link MarkupState} describing the output written before them. Whenever the walk passes a block
 * whose output is produced by code at render time (an expression, a statement, a section...), the
 * state is reset to {@link MarkupState#afterOpaqueNode()}: that output may or may not end with
 * whitespace or a block element, so the minifier must not drop whitespace next to it.
 *
 * <p>Code-producing blocks are walked with a narrower policy. Their code spans are compacted,
 * nested statements are walked the same way, and markup blocks found inside them are minified on
 * their own, starting from {@link MarkupState#initial()}. Everything else in them, including the
 * template syntax that ties them to the page, is left alone.
 *
 * <p>Empty markup spans are removed. Every other node keeps its kind, start location and edit
 * handler.
 */
public final class MinifyHtmlPass implements TemplatePass {
  private static final Logger logger = Logger.getLogger(MinifyHtmlPass.class.getName());

  private final HtmlMinifier minifier;
  // Copied from the options, which may change after validation.
  private final boolean compactCodeSpans;
  private final boolean compactMetaCode;
  private final int maxNestingDepth;
  private MinifyReport lastReport = MinifyReport.EMPTY;

  public MinifyHtmlPass(HtmlMinifier minifier) {
    this(minifier, new MinifyOptions());
  }

  public MinifyHtmlPass(HtmlMinifier minifier, MinifyOptions options) {
    this.minifier = checkNotNull(minifier);
    MinifyOptionsValidator.validate(checkNotNull(options));
    this.compactCodeSpans = options.shouldCompactCodeSpans();
    this.compactMetaCode = options.shouldCompactMetaCode();
    this.maxNestingDepth = options.getMaxNestingDepth();
  }

  @Override
  public Block process(Block root) {
    checkNotNull(root);
    logger.fine(
        "Minifying template markup (compactCodeSpans="
            + compactCodeSpans
            + ", compactMetaCode="
            + compactMetaCode
            + ", maxNestingDepth="
            + maxNestingDepth
            + ")");
    MinifyReport.Builder report = new MinifyReport.Builder();
    Block result =
        new Rewriter(report).rewriteMarkupBlock(root, MarkupState.initial(), 1).block();
    lastReport = report.build();
    logger.fine("Finished minifying template markup: " + lastReport);
    return result;
  }

  /** Returns what the last call to {@link #process} changed. */
  public MinifyReport getLastReport() {
    return lastReport;
  }

  /** Minifies the children of {@code block} starting from {@code state}. */
  @VisibleForTesting
  MarkupRewrite rewriteMarkupBlock(Block block, MarkupState state) {
    return new Rewriter(new MinifyReport.Builder()).rewriteMarkupBlock(block, state, 1);
  }

  /** Walks a block whose output is produced by code at render time. */
  @VisibleForTesting
  Block rewriteOpaqueBlock(Block block) {
    return new Rewriter(new MinifyReport.Builder()).rewriteOpaqueBlock(block, 1);
  }

  /**
   * The result of minifying a markup block.
   *
   * @param block The rewritten block.
   * @param state The state after the last child of the block.
   */
  record MarkupRewrite(Block block, MarkupState state) {}

  /** One walk over a tree. Recursion state is passed as arguments, only counts live here. */
  private final class Rewriter {
    private final MinifyReport.Builder report;

    Rewriter(MinifyReport.Builder report) {
      this.report = report;
    }

    MarkupRewrite rewriteMarkupBlock(Block block, MarkupState state, int depth) {
      checkDepth(block, depth);
      List<SyntaxNode> children = new ArrayList<>(block.getChildCount());
      boolean changed = false;
      for (SyntaxNode child : block.getChildren()) {
        SyntaxNode rewritten;
        if (child.isSpan()) {
          Span span = child.asSpan();
          if (span.isMarkup()) {
            if (span.getContent().isEmpty()) {
              logger.finest("Removing empty markup span at " + span.getStart());
              report.recordEmptyMarkupSpan();
              changed = true;
              continue;
            }
            String content =
                minifier.minify(
                    span.getContent(),
                    state.previousIsWhitespace(),
                    state.previousEndsWithBlockElement(),
                    state.insideScript());
            if (content == null) {
              throw new MinifyException(
                  "HtmlMinifier returned null for markup span at %s", span.getStart());
            }
            MarkupState next = minifier.analyseContent(content, state);
            if (next == null) {
              throw new MinifyException(
                  "HtmlMinifier returned no state after markup span at %s", span.getStart());
            }
            state = next;
            report.recordMarkupSpan(span.getContent().length(), content.length());
            rewritten = replaceContent(span, content);
          } else {
            rewritten = maybeCompact(span);
          }
        } else {
          Block nested = child.asBlock();
          report.recordOpaqueBlock();
          if (nested.getType().isRecursableCode()) {
            rewritten = rewriteOpaqueBlock(nested, depth + 1);
          } else {
            logger.finest("Not walking " + nested + " at " + nested.getStart());
            rewritten = nested;
          }
          // Whatever the block writes at render time is unknown here.
          state = state.afterOpaqueNode();
        }
        changed |= rewritten != child;
        children.add(rewritten);
      }
      Block result = changed ? block.toBuilder().setChildren(children).build() : block;
      return new MarkupRewrite(result, state);
    }

    Block rewriteOpaqueBlock(Block block, int depth) {
      checkDepth(block, depth);
      List<SyntaxNode> children = new ArrayList<>(block.getChildCount());
      boolean changed = false;
      for (SyntaxNode child : block.getChildren()) {
        SyntaxNode rewritten = child;
        if (child.isSpan()) {
          rewritten = maybeCompact(child.asSpan());
        } else {
          Block nested = child.asBlock();
          if (nested.getType() == BlockType.STATEMENT) {
            report.recordOpaqueBlock();
            rewritten = rewriteOpaqueBlock(nested, depth + 1);
          } else if (nested.getType() == BlockType.MARKUP) {
            rewritten = rewriteMarkupBlock(nested, MarkupState.initial(), depth + 1).block();
          }
        }
        changed |= rewritten != child;
        children.add(rewritten);
      }
      return changed ? block.toBuilder().setChildren(children).build() : block;
    }

    private Span maybeCompact(Span span) {
      boolean compact =
          (span.isCode() && compactCodeSpans) || (span.isMetaCode() && compactMetaCode);
      if (!compact) {
        return span;
      }
      int before = span.hasSymbols() ? span.getSymbols().size() : 0;
      Span compacted = CodeSpanCompactor.compact(span);
      report.recordCodeSpan(before, compacted.getSymbols().size());
      return compacted;
    }

    private void checkDepth(Block block, int depth) {
      if (depth > maxNestingDepth) {
        throw new MinifyException(
            "%s block at %s is nested deeper than %s levels",
            block.getType(), block.getStart(), maxNestingDepth);
      }
    }
  }

  private static Span replaceContent(Span span, String content) {
    if (content.equals(span.getContent())) {
      return span;
    }
    return span.toBuilder().clearSymbols().accept(Symbol.markup(content, span.getStart())).build();
  }
}
