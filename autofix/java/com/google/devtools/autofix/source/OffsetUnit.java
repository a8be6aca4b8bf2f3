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
 * The unit in which offsets into a {@link SourceBuffer} are counted. Chosen once, when the buffer
 * is created, and carried by every {@link Range} derived from it.
 */
public enum OffsetUnit {
  /** UTF-16 code units, i.e. {@link String} indices. */
  CHARACTERS,
  /** Bytes of the UTF-8 encoding of the text. */
  UTF8_BYTES
}
