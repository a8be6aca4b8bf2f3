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

package com.google.devtools.autofix.apply;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Files;
import com.google.devtools.autofix.FixOutcome;
import com.google.devtools.autofix.config.AutofixConfig;
import com.google.devtools.autofix.source.Range;
import com.google.devtools.autofix.source.SourceBuffer;
import com.google.devtools.autofix.source.TextEdit;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splices the fixes found in one file into its text. Fixes are applied in file order; a fix that
 * overlaps one already applied is skipped, since both were rendered against the original text.
 */
public class FixApplier {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Comparator<FixOutcome> BY_EDIT_POSITION =
      Comparator.comparing((FixOutcome o) -> o.edit().get(), TextEdit.BY_POSITION);

  private final AutofixConfig config;

  public FixApplier(AutofixConfig config) {
    this.config = config;
  }

  /** Applies the fixes among {@code outcomes} to {@code target}, ignoring outcomes without one. */
  public AppliedFixes apply(SourceBuffer target, List<FixOutcome> outcomes) {
    List<FixOutcome> ordered = new ArrayList<>();
    for (FixOutcome outcome : outcomes) {
      if (outcome.hasFix()) {
        ordered.add(outcome);
      }
    }
    // List.sort is stable: fixes at the same position keep the order they were reported in.
    ordered.sort(BY_EDIT_POSITION);

    List<FixOutcome> accepted = new ArrayList<>();
    ImmutableList.Builder<FixOutcome> skipped = ImmutableList.builder();
    TextEdit previous = null;
    for (FixOutcome outcome : ordered) {
      TextEdit edit = outcome.edit().get();
      if (previous != null && edit.overlaps(previous)) {
        logger.atWarning().log(
            "skipping fix of %s at %s: overlaps the fix at %s",
            outcome.match().ruleId(), edit.range(), previous.range());
        skipped.add(outcome);
        continue;
      }
      accepted.add(outcome);
      previous = edit;
    }

    List<TextEdit> edits = new ArrayList<>(accepted.size());
    ImmutableList.Builder<AppliedFix> applied = ImmutableList.builder();
    int delta = 0;
    for (FixOutcome outcome : accepted) {
      TextEdit edit = outcome.edit().get();
      Range range = edit.range();
      int start = target.toCharOffset(range, range.getStart());
      int end = target.toCharOffset(range, range.getEnd());
      int fixedStart = start + delta;
      applied.add(AppliedFix.create(outcome, fixedStart, fixedStart + edit.replacement().length()));
      delta += edit.replacement().length() - (end - start);
      edits.add(edit);
    }
    return AppliedFixes.create(target.apply(edits), applied.build(), skipped.build());
  }

  /**
   * Applies the fixes to the contents of {@code path}, and writes the fixed text back if the
   * configuration asks for it.
   */
  public AppliedFixes applyToFile(Path path, SourceBuffer target, List<FixOutcome> outcomes)
      throws IOException {
    AppliedFixes result = apply(target, outcomes);
    if (result.applied().isEmpty()) {
      return result;
    }
    if (config.shouldWriteFixes()) {
      Files.asCharSink(path.toFile(), UTF_8).write(result.fixedText());
      logger.atInfo().log("applied %d fixes to %s", result.applied().size(), path);
    } else {
      logger.atFine().log(
          "%d fixes for %s not written (autofix=%s, dryrun=%s)",
          result.applied().size(), path, config.getAutofix(), config.getDryRun());
    }
    return result;
  }
}
