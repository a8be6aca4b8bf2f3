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

import com.google.auto.value.AutoValue;
import com.google.devtools.autofix.match.Match;
import com.google.devtools.autofix.printer.RenderedFix;
import com.google.devtools.autofix.source.TextEdit;
import java.util.Optional;

/**
 * The result of trying to fix one {@link Match}: either an edit replacing the matched range, or
 * the reason no fix is available.
 */
@AutoValue
public abstract class FixOutcome {
  public abstract Match match();

  public abstract Optional<TextEdit> edit();

  public abstract Optional<RenderedFix> rendered();

  public abstract Optional<AutofixException> failure();

  public boolean hasFix() {
    return edit().isPresent();
  }

  static FixOutcome fixed(Match match, RenderedFix rendered) {
    return new AutoValue_FixOutcome(
        match,
        Optional.of(TextEdit.create(match.range(), rendered.text())),
        Optional.of(rendered),
        Optional.empty());
  }

  static FixOutcome noFix(Match match, AutofixException failure) {
    return new AutoValue_FixOutcome(
        match, Optional.empty(), Optional.empty(), Optional.of(failure));
  }
}
