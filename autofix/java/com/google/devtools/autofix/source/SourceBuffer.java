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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.nio.CharBuffer;
import java.util.List;

/**
 * Immutable source text taking part in a fix: either the target file or the fix template. Offsets
 * into the buffer are counted in the {@link OffsetUnit} fixed at construction.
 */
public final class SourceBuffer {
  private final BufferId id;
  private final OffsetUnit unit;
  private final String text;
  private final Supplier<PositionMappings> mappings;

  private SourceBuffer(BufferId id, OffsetUnit unit, String text) {
    this.id = checkNotNull(id, "id");
    this.unit = checkNotNull(unit, "unit");
    this.text = checkNotNull(text, "text");
    this.mappings = Suppliers.memoize(() -> new PositionMappings(UTF_8, text));
  }

  public static SourceBuffer create(BufferId id, OffsetUnit unit, String text) {
    SourceBuffer buffer = new SourceBuffer(id, unit, text);
    if (unit == OffsetUnit.UTF8_BYTES) {
      // Byte offsets are resolved on every slice; build the table up front.
      buffer.mappings.get();
    }
    return buffer;
  }

  /** Returns a character-offset target buffer. */
  public static SourceBuffer target(String text) {
    return create(BufferId.TARGET, OffsetUnit.CHARACTERS, text);
  }

  /** Returns a character-offset template buffer. */
  public static SourceBuffer template(String text) {
    return create(BufferId.TEMPLATE, OffsetUnit.CHARACTERS, text);
  }

  public BufferId getId() {
    return id;
  }

  public OffsetUnit getUnit() {
    return unit;
  }

  public String getText() {
    return text;
  }

  /** Returns the length of the buffer in its own offset unit. */
  public int length() {
    return unit == OffsetUnit.CHARACTERS ? text.length() : mappings.get().byteLength();
  }

  /** Returns a {@link Range} of this buffer, in this buffer's unit. */
  public Range range(int start, int end) {
    return Range.of(id, unit, start, end);
  }

  /** Returns the {@link Range} covering the whole buffer. */
  public Range fullRange() {
    return range(0, length());
  }

  public PositionMappings getPositionMappings() {
    return mappings.get();
  }

  /**
   * Returns the text addressed by {@code range}. For character buffers this is a view onto the
   * buffer and does not copy.
   *
   * @throws OffsetUnitMismatchException if {@code range} was not derived from this buffer
   */
  public CharSequence slice(Range range) {
    int start = toCharOffset(range, range.getStart());
    int end = toCharOffset(range, range.getEnd());
    return CharBuffer.wrap(text, start, end);
  }

  /**
   * Converts an offset of {@code range} to a {@link String} index into {@link #getText()}.
   *
   * @throws OffsetUnitMismatchException if {@code range} was not derived from this buffer, or the
   *     offset does not fall on a character boundary inside it
   */
  public int toCharOffset(Range range, int offset) {
    checkAddressable(range);
    if (unit == OffsetUnit.CHARACTERS) {
      return offset;
    }
    int charOffset = mappings.get().byteToCharOffset(offset);
    if (charOffset < 0) {
      throw OffsetUnitMismatchException.format(
          "byte offset %d of %s is not a character boundary of the %s buffer", offset, range, id);
    }
    return charOffset;
  }

  /** Returns the buffer text with {@code edit} applied: {@code prefix + replacement + suffix}. */
  public String splice(TextEdit edit) {
    return apply(ImmutableList.of(edit));
  }

  /**
   * Applies {@code edits} in a single pass. The edits must be sorted by {@link
   * TextEdit#BY_POSITION} and must not overlap.
   *
   * @throws IllegalArgumentException if the edits are unsorted or overlap
   */
  public String apply(List<TextEdit> edits) {
    StringBuilder out = new StringBuilder(text.length());
    int cursor = 0;
    for (TextEdit edit : edits) {
      int start = toCharOffset(edit.range(), edit.range().getStart());
      int end = toCharOffset(edit.range(), edit.range().getEnd());
      if (start < cursor) {
        throw new IllegalArgumentException("edits are unsorted or overlap at " + edit.range());
      }
      out.append(text, cursor, start).append(edit.replacement());
      cursor = end;
    }
    return out.append(text, cursor, text.length()).toString();
  }

  private void checkAddressable(Range range) {
    if (range.getBuffer() != id) {
      throw OffsetUnitMismatchException.format("%s does not address the %s buffer", range, id);
    }
    if (range.getUnit() != unit) {
      throw OffsetUnitMismatchException.format(
          "%s is counted in %s but the %s buffer uses %s", range, range.getUnit(), id, unit);
    }
    if (range.getEnd() > length()) {
      throw OffsetUnitMismatchException.format(
          "%s extends past the end of the %s buffer (length %d)", range, id, length());
    }
  }

  @Override
  public String toString() {
    return String.format("SourceBuffer{%s, %s, length=%d}", id, unit, length());
  }
}
