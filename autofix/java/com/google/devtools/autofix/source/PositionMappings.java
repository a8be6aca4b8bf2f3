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

import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * Provides a mapping of character offsets to byte offsets and line numbers, and of byte offsets
 * back to character offsets.
 */
public class PositionMappings {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int[] byteOffsets;
  private final int[] lineNumbers;

  /**
   * Constructs a new {@link PositionMappings} instance.
   *
   * @param encoding The encoding byte offsets are counted in.
   * @param text The source text to be mapped.
   * @throws IllegalStateException If an error was encountered while encoding the source text.
   */
  public PositionMappings(Charset encoding, CharSequence text) {
    byteOffsets = new int[text.length() + 1];
    lineNumbers = new int[text.length() + 1];

    CountingOutputStream counter = new CountingOutputStream();
    OutputStreamWriter writer = new OutputStreamWriter(counter, encoding);
    for (int i = 0; i < text.length(); i++) {
      byteOffsets[i] = counter.getCount();
      lineNumbers[i] = counter.getLines() + 1;
      try {
        writer.append(text.charAt(i));
        writer.flush();
      } catch (IOException ioe) {
        throw new IllegalStateException(ioe);
      }
    }
    byteOffsets[text.length()] = counter.getCount();
    lineNumbers[text.length()] = counter.getLines() + 1;
  }

  /**
   * Returns the line number corresponding to the specified char offset.
   *
   * @param charOffset The char offset of the requested line.
   * @return The 1-based line number for the specified offset. -1 if the specified offset was out of
   *     bounds.
   */
  public int charToLine(int charOffset) {
    if (charOffset < 0) {
      return -1;
    } else if (charOffset >= lineNumbers.length) {
      logger.atWarning().log(
          "offset past end of source: %d >= %d", charOffset, lineNumbers.length);
      return -1;
    }
    return lineNumbers[charOffset];
  }

  /**
   * Returns the byte offset corresponding to the specified char offset.
   *
   * @param charOffset The char offset of the requested byte offset.
   * @return The byte offset for the specified char offset. -1 if the specified offset was out of
   *     bounds.
   */
  public int charToByteOffset(int charOffset) {
    if (charOffset < 0) {
      return -1;
    } else if (charOffset >= byteOffsets.length) {
      logger.atWarning().log(
          "offset past end of source: %d >= %d", charOffset, byteOffsets.length);
      return -1;
    }
    return byteOffsets[charOffset];
  }

  /**
   * Returns the char offset at which the encoding of a character begins at {@code byteOffset}.
   *
   * @return the char offset, or -1 if the byte offset is out of bounds or falls inside the
   *     encoding of a single character.
   */
  public int byteToCharOffset(int byteOffset) {
    if (byteOffset < 0 || byteOffset > byteOffsets[byteOffsets.length - 1]) {
      return -1;
    }
    int index = Arrays.binarySearch(byteOffsets, byteOffset);
    if (index < 0) {
      return -1;
    }
    // A surrogate pair encodes as a whole, so its high half shares the offset of the low half.
    while (index > 0 && byteOffsets[index - 1] == byteOffset) {
      index--;
    }
    return index;
  }

  /** Returns the total number of encoded bytes. */
  public int byteLength() {
    return byteOffsets[byteOffsets.length - 1];
  }

  /** {@link OutputStream} that only counts each {@code byte} that should be written. */
  private static class CountingOutputStream extends OutputStream {
    private int count;
    private int lines;

    /** Returns the count of bytes that have been requested to be written. */
    public int getCount() {
      return count;
    }

    /** Returns the number of full lines that have been requested to be written. */
    public int getLines() {
      return lines;
    }

    @Override
    public void write(int b) {
      count++;
      if (b == '\n') {
        lines++;
      }
    }
  }
}
