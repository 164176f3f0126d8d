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

import com.google.template.syntax.Block;
import java.util.logging.Logger;

/**
 * A {@link TemplateParser} that parses with another parser and then minifies the result, so that
 * the code generator only ever sees minified templates.
 */
public final class MinifyingTemplateParser implements TemplateParser {
  private static final Logger logger = Logger.getLogger(MinifyingTemplateParser.class.getName());

  private final TemplateParser parser;
  private final TemplatePass pass;
  private final boolean enabled;

  private MinifyingTemplateParser(TemplateParser parser, TemplatePass pass, boolean enabled) {
    this.parser = parser;
    this.pass = pass;
    this.enabled = enabled;
  }

  public static MinifyingTemplateParser create(
      TemplateParser parser, HtmlMinifier minifier, MinifyOptions options) {
    checkNotNull(parser);
    return new MinifyingTemplateParser(
        parser, new MinifyHtmlPass(minifier, options), options.isEnabled());
  }

  public static MinifyingTemplateParser create(TemplateParser parser, HtmlMinifier minifier) {
    return create(parser, minifier, new MinifyOptions());
  }

  @Override
  public Block parse(String templateName, String source) {
    Block document = parser.parse(templateName, source);
    if (document == null) {
      throw new MinifyException("Parser returned no tree for %s", templateName);
    }
    if (!enabled) {
      return document;
    }
    logger.fine("Minifying " + templateName);
    return pass.process(document);
  }
}
