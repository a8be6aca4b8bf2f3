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

package com.google.devtools.autofix.source;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** Replacement of one {@link Range} of the target buffer with new text. */
@AutoValue
public abstract class TextEdit {
  /** Orders edits by start offset, then by end offset. */
  public static final Comparator<TextEdit> BY_POSITION = Comparator.comparing(TextEdit::range);

  public abstract Range range();

  public abstract String replacement();

  public static TextEdit create(Range range, String replacement) {
    checkArgument(
        range.getBuffer() == BufferId.TARGET, "edits apply to the target buffer, not %s", range);
    return new AutoValue_TextEdit(range, replacement);
  }

  /** Returns true if the two edits touch a common offset other than a shared boundary. */
  public boolean overlaps(TextEdit other) {
    Range a = range();
    Range b = other.range();
    if (a.isEmpty() || b.isEmpty()) {
      // Insertions only collide with an edit that strictly contains their position.
      int point = a.isEmpty() ? a.getStart() : b.getStart();
      Range span = a.isEmpty() ? b : a;
      return span.getStart() < point && point < span.getEnd();
    }
    return a.getStart() < b.getEnd() && b.getStart() < a.getEnd();
  }
}
