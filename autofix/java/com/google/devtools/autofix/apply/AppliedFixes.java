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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.FixOutcome;

/** The fixes of one file, and the file text once they are applied. */
@AutoValue
public abstract class AppliedFixes {
  public abstract String fixedText();

  /** Fixes whose text is part of {@link #fixedText()}, in file order. */
  public abstract ImmutableList<AppliedFix> applied();

  /** Fixes left out because they overlap an earlier fix. */
  public abstract ImmutableList<FixOutcome> skipped();

  static AppliedFixes create(
      String fixedText, ImmutableList<AppliedFix> applied, ImmutableList<FixOutcome> skipped) {
    return new AutoValue_AppliedFixes(fixedText, applied, skipped);
  }
}
