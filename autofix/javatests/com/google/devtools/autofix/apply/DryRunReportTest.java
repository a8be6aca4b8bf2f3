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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.FixGenerator;
import com.google.devtools.autofix.FixOutcome;
import com.google.devtools.autofix.config.AutofixConfig;
import com.google.devtools.autofix.match.Match;
import com.google.devtools.autofix.match.MatchEnvironment;
import com.google.devtools.autofix.source.OffsetUnit;
import com.google.devtools.autofix.source.Range;
import com.google.devtools.autofix.source.SourceBuffer;
import com.google.devtools.autofix.template.FixTemplate;
import com.google.devtools.autofix.testing.ExpressionParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DryRunReportTest {
  // The call on line 2 spans [10, 19).
  private final SourceBuffer target = SourceBuffer.target("x = 1\ny = foo(1, 2)\nz = 3\n");

  private FixOutcome fix(Range range, String fixText) throws Exception {
    FixTemplate template =
        FixTemplate.parse("no-foo", new ExpressionParser(), fixText, OffsetUnit.CHARACTERS);
    Match match =
        Match.create("no-foo", ExpressionParser.LANGUAGE, MatchEnvironment.EMPTY, range);
    return new FixGenerator().generate(match, template, target);
  }

  private AppliedFixes apply(FixOutcome... outcomes) {
    return new FixApplier(new AutofixConfig("autofix"))
        .apply(target, ImmutableList.copyOf(outcomes));
  }

  @Test
  public void testEntry() throws Exception {
    AppliedFixes fixes = apply(fix(target.range(10, 19), "bar()"));

    ImmutableList<DryRunReport.Entry> entries = DryRunReport.entries(target, fixes);

    assertThat(entries).hasSize(1);
    DryRunReport.Entry entry = entries.get(0);
    assertThat(entry.getRuleId()).isEqualTo("no-foo");
    assertThat(entry.getStartLine()).isEqualTo(2);
    assertThat(entry.getEndLine()).isEqualTo(2);
    assertThat(entry.getFix()).isEqualTo("bar()");
    assertThat(entry.getFixedLines()).containsExactly("y = bar()");
  }

  @Test
  public void testMultilineFix() throws Exception {
    AppliedFixes fixes = apply(fix(target.range(10, 19), "bar(1,\n    2)"));

    DryRunReport.Entry entry = DryRunReport.entries(target, fixes).get(0);

    assertThat(entry.getFixedLines()).containsExactly("y = bar(1,", "    2)").inOrder();
  }

  @Test
  public void testFixSpanningLines() throws Exception {
    AppliedFixes fixes = apply(fix(target.range(4, 19), "bar"));

    DryRunReport.Entry entry = DryRunReport.entries(target, fixes).get(0);

    assertThat(entry.getStartLine()).isEqualTo(1);
    assertThat(entry.getEndLine()).isEqualTo(2);
    assertThat(entry.getFixedLines()).containsExactly("x = bar").inOrder();
  }

  @Test
  public void testJsonUsesSnakeCase() throws Exception {
    AppliedFixes fixes = apply(fix(target.range(10, 19), "bar()"));

    String json = DryRunReport.toJson(target, fixes);

    assertThat(json).contains("\"rule_id\": \"no-foo\"");
    assertThat(json).contains("\"start_line\": 2");
    assertThat(json).contains("\"end_line\": 2");
    assertThat(json).contains("\"fix\": \"bar()\"");
    assertThat(json).contains("\"fixed_lines\": [");
    assertThat(json).contains("\"y = bar()\"");
  }

  @Test
  public void testNoFixes() {
    assertThat(DryRunReport.toJson(target, apply())).isEqualTo("[]");
  }
}
