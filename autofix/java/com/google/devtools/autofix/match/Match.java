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

package com.google.devtools.autofix.match;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.devtools.autofix.source.BufferId;
import com.google.devtools.autofix.source.Range;

/** A single finding of a rule, as produced by the structural matcher. */
@AutoValue
public abstract class Match {
  public abstract String ruleId();

  public abstract String language();

  public abstract MatchEnvironment environment();

  /** The span of the target buffer the whole pattern matched. A fix replaces exactly this span. */
  public abstract Range range();

  public static Match create(
      String ruleId, String language, MatchEnvironment environment, Range range) {
    checkArgument(
        range.getBuffer() == BufferId.TARGET, "match range must address the target: %s", range);
    return new AutoValue_Match(ruleId, language, environment, range);
  }
}
