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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * Half-open offset span {@code [start, end)} into one {@link SourceBuffer}. Besides the offsets, a
 * range records which buffer it addresses and the unit its offsets are counted in, so a range can
 * never be silently applied to text it was not derived from.
 */
public final class Range implements Comparable<Range> {
  private final BufferId buffer;
  private final OffsetUnit unit;
  private final int start;
  private final int end;

  private Range(BufferId buffer, OffsetUnit unit, int start, int end) {
    this.buffer = buffer;
    this.unit = unit;
    this.start = start;
    this.end = end;
  }

  public static Range of(BufferId buffer, OffsetUnit unit, int startOffset, int endOffset) {
    checkNotNull(buffer, "buffer");
    checkNotNull(unit, "unit");
    checkArgument(startOffset >= 0, "negative start offset: %s", startOffset);
    checkArgument(
        startOffset <= endOffset, "start offset %s after end offset %s", startOffset, endOffset);
    return new Range(buffer, unit, startOffset, endOffset);
  }

  public BufferId getBuffer() {
    return buffer;
  }

  public OffsetUnit getUnit() {
    return unit;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /** Determines if the given offset is contained within {@code this} {@link Range}. */
  public boolean contains(int n) {
    return getStart() <= n && n < getEnd();
  }

  /** Returns true if {@code other} addresses the same buffer and lies within {@code this}. */
  public boolean encloses(Range other) {
    return isCompatibleWith(other) && start <= other.start && other.end <= end;
  }

  /** Returns true if both ranges address the same buffer in the same unit. */
  public boolean isCompatibleWith(Range other) {
    return buffer == other.buffer && unit == other.unit;
  }

  /** Returns the range spanning from the start of {@code this} to the end of {@code other}. */
  public Range extendTo(Range other) {
    checkArgument(isCompatibleWith(other), "cannot join %s and %s", this, other);
    return of(buffer, unit, Math.min(start, other.start), Math.max(end, other.end));
  }

  /** Returns a range of the same buffer and unit with the given offsets. */
  public Range withOffsets(int startOffset, int endOffset) {
    return of(buffer, unit, startOffset, endOffset);
  }

  @Override
  public int compareTo(Range other) {
    if (other.start == this.start) {
      return this.end - other.end;
    }
    return this.start - other.start;
  }

  @Override
  public String toString() {
    return String.format("Range{%s, %d, %d}", buffer, start, end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Range range = (Range) o;
    return buffer == range.buffer && unit == range.unit && start == range.start && end == range.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(buffer, unit, start, end);
  }
}
