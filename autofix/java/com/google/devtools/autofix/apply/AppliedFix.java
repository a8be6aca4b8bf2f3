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
import com.google.devtools.autofix.FixOutcome;
import com.google.devtools.autofix.source.TextEdit;

/** A fix that was applied, with the character span its text occupies in the fixed file. */
@AutoValue
public abstract class AppliedFix {
  public abstract FixOutcome outcome();

  /** Character offset in the fixed text at which the fix text begins. */
  public abstract int fixedStart();

  /** Character offset in the fixed text just past the fix text. */
  public abstract int fixedEnd();

  public TextEdit edit() {
    return outcome().edit().get();
  }

  static AppliedFix create(FixOutcome outcome, int fixedStart, int fixedEnd) {
    return new AutoValue_AppliedFix(outcome, fixedStart, fixedEnd);
  }
}
