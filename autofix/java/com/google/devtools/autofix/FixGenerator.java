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

import com.google.common.flogger.FluentLogger;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.match.Match;
import com.google.devtools.autofix.printer.AutofixPrinter;
import com.google.devtools.autofix.printer.RenderedFix;
import com.google.devtools.autofix.source.OffsetUnitMismatchException;
import com.google.devtools.autofix.source.SourceBuffer;
import com.google.devtools.autofix.substitution.MetavariableSubstitution;
import com.google.devtools.autofix.template.FixTemplate;
import java.util.logging.Level;

/**
 * Produces the fix of a single match: substitutes the match's bindings into the rule's template,
 * then prints the result against the target and template buffers.
 *
 * <p>Failures local to the match are returned as a {@link FixOutcome} without a fix. A mismatch of
 * offset units is a broken invariant of the whole scan and is thrown.
 */
public class FixGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Level renderedFixLevel;

  public FixGenerator() {
    this(false);
  }

  /** @param verbose whether every rendered fix is logged at INFO rather than FINE */
  public FixGenerator(boolean verbose) {
    this.renderedFixLevel = verbose ? Level.INFO : Level.FINE;
  }

  /**
   * Returns the fix of {@code match}.
   *
   * @throws OffsetUnitMismatchException if the match range does not address {@code target}
   */
  public FixOutcome generate(Match match, FixTemplate template, SourceBuffer target) {
    // Resolving the match range up front rejects a mismatched unit before any work is done.
    target.toCharOffset(match.range(), match.range().getStart());
    if (template.buffer().getUnit() != target.getUnit()) {
      throw new OffsetUnitMismatchException(
          String.format(
              "template of %s counts offsets in %s but the target uses %s",
              template.ruleId(), template.buffer().getUnit(), target.getUnit()));
    }
    try {
      Node tree = MetavariableSubstitution.replace(match.environment(), template.root());
      RenderedFix rendered = AutofixPrinter.print(tree, target, template.buffer());
      logger.at(renderedFixLevel).log(
          "%s at %s: %s -> %s",
          match.ruleId(), match.range(), target.slice(match.range()), rendered.text());
      return FixOutcome.fixed(match, rendered);
    } catch (AutofixException e) {
      logger.atWarning().log(
          "no fix for %s at %s: %s", match.ruleId(), match.range(), e.getMessage());
      return FixOutcome.noFix(match, e);
    }
  }
}
