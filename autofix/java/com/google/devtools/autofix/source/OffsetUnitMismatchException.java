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

/**
 * Thrown when a {@link Range} cannot address a {@link SourceBuffer}: it was produced in another
 * offset unit, for another buffer, or lies outside the buffer's text. Any of these means the
 * parser, matcher and printer disagree about offsets, so the output would be corrupt. Never caught
 * by the fix pipeline.
 */
public final class OffsetUnitMismatchException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public OffsetUnitMismatchException(String message) {
    super(message);
  }

  static OffsetUnitMismatchException format(String message, Object... args) {
    return new OffsetUnitMismatchException(String.format(message, args));
  }
}
