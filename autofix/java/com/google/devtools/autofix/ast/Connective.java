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

package com.google.devtools.autofix.ast;

/**
 * Punctuation the printer may synthesize when no source text exists for it. This is the complete
 * table: no other text is ever invented.
 */
public enum Connective {
  COMMA_SPACE(", "),
  SEMICOLON_SPACE("; "),
  NEWLINE("\n"),
  SPACE(" ");

  private final String text;

  Connective(String text) {
    this.text = text;
  }

  /** Returns the canonical text printed for this connective. */
  public String getText() {
    return text;
  }
}
