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

package com.google.devtools.autofix.printer;

import com.google.auto.value.AutoValue;

/**
 * Text rendered for a fix, with a count of where its characters came from. The three counts add up
 * to the length of {@link #text()}.
 */
@AutoValue
public abstract class RenderedFix {
  public abstract String text();

  /** Characters copied verbatim from the target buffer. */
  public abstract int liftedFromTarget();

  /** Characters copied verbatim from the template buffer. */
  public abstract int liftedFromTemplate();

  /** Characters printed from the connective table. */
  public abstract int synthesized();

  static RenderedFix create(
      String text, int liftedFromTarget, int liftedFromTemplate, int synthesized) {
    return new AutoValue_RenderedFix(text, liftedFromTarget, liftedFromTemplate, synthesized);
  }
}
