/*
 * Copyright 2026 The Kythe Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.autofix;

import com.google.devtools.autofix.config.AutofixConfig;
import com.google.devtools.autofix.match.Match;
import com.google.devtools.autofix.source.OffsetUnitMismatchException;
import com.google.devtools.autofix.source.SourceBuffer;
import com.google.devtools.autofix.template.FixTemplate;
import com.google.devtools.autofix.template.FixTemplates;
import com.google.devtools.autofix.template.LanguageParser;

/** Turns each match of a rule that has a fix pattern into a {@link FixOutcome}. */
public class Autofixer {
  private final FixTemplates templates;
  private final FixGenerator generator;

  public Autofixer(AutofixConfig config, Iterable<? extends LanguageParser> parsers) {
    this(
        new FixTemplates(parsers, config.getOffsetUnit()),
        new FixGenerator(config.getVerboseLogging()));
  }

  public Autofixer(FixTemplates templates, FixGenerator generator) {
    this.templates = templates;
    this.generator = generator;
  }

  /**
   * Returns the fix of {@code match}, whose rule has the fix pattern {@code fixText}. A template
   * that fails to parse yields a {@link FixOutcome} without a fix for every match of its rule.
   *
   * @throws OffsetUnitMismatchException if {@code target} does not use the configured offset unit
   */
  public FixOutcome fix(Match match, String fixText, SourceBuffer target) {
    if (target.getUnit() != templates.getOffsetUnit()) {
      throw new OffsetUnitMismatchException(
          String.format(
              "target counts offsets in %s but the scan is configured for %s",
              target.getUnit(), templates.getOffsetUnit()));
    }
    FixTemplate template;
    try {
      template = templates.get(match.ruleId(), match.language(), fixText);
    } catch (TemplateParseException e) {
      return FixOutcome.noFix(match, e);
    }
    return generator.generate(match, template, target);
  }
}
