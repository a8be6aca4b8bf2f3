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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.source.PositionMappings;
import com.google.devtools.autofix.source.Range;
import com.google.devtools.autofix.source.SourceBuffer;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.List;

/**
 * Renders the fixes of a file as JSON, the way a dry run reports them: for each fix, the lines of
 * the original text it replaces and the complete lines of the fixed text it produced.
 */
public class DryRunReport {
  private static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .disableHtmlEscaping()
          .setPrettyPrinting()
          .create();

  private static final Splitter LINES = Splitter.on('\n');

  private DryRunReport() {}

  /** Returns one entry per applied fix, in file order. */
  public static ImmutableList<Entry> entries(SourceBuffer target, AppliedFixes fixes) {
    PositionMappings mappings = target.getPositionMappings();
    ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    for (AppliedFix fix : fixes.applied()) {
      Range range = fix.edit().range();
      int start = target.toCharOffset(range, range.getStart());
      int end = target.toCharOffset(range, range.getEnd());
      entries.add(
          new Entry(
              fix.outcome().match().ruleId(),
              mappings.charToLine(start),
              mappings.charToLine(end),
              fix.edit().replacement(),
              fixedLines(fixes.fixedText(), fix.fixedStart(), fix.fixedEnd())));
    }
    return entries.build();
  }

  /** Returns the report as a JSON array. */
  public static String toJson(SourceBuffer target, AppliedFixes fixes) {
    return GSON.toJson(entries(target, fixes));
  }

  private static List<String> fixedLines(String text, int start, int end) {
    int lineStart = text.lastIndexOf('\n', start - 1) + 1;
    int lineEnd = text.indexOf('\n', end);
    if (lineEnd < 0) {
      lineEnd = text.length();
    }
    return LINES.splitToList(text.substring(lineStart, lineEnd));
  }

  /** One fix of the report. Field names are serialized in snake case. */
  public static final class Entry {
    private final String ruleId;
    private final int startLine;
    private final int endLine;
    private final String fix;
    private final List<String> fixedLines;

    Entry(String ruleId, int startLine, int endLine, String fix, List<String> fixedLines) {
      this.ruleId = ruleId;
      this.startLine = startLine;
      this.endLine = endLine;
      this.fix = fix;
      this.fixedLines = fixedLines;
    }

    public String getRuleId() {
      return ruleId;
    }

    /** 1-based line of the original text on which the replaced range starts. */
    public int getStartLine() {
      return startLine;
    }

    /** 1-based line of the original text on which the replaced range ends. */
    public int getEndLine() {
      return endLine;
    }

    public String getFix() {
      return fix;
    }

    public List<String> getFixedLines() {
      return fixedLines;
    }
  }
}
