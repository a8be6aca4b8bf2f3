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

/** Kinds of {@link NodeKind#LIST} nodes, each with the separator placed between its elements. */
public enum ListKind {
  ARGUMENTS(Connective.COMMA_SPACE),
  PARAMETERS(Connective.COMMA_SPACE),
  ELEMENTS(Connective.COMMA_SPACE),
  FOR_CLAUSES(Connective.SEMICOLON_SPACE),
  STATEMENTS(Connective.NEWLINE),
  WORDS(Connective.SPACE);

  private final Connective separator;

  ListKind(Connective separator) {
    this.separator = separator;
  }

  /** Returns the connective synthesized between consecutive spliced elements. */
  public Connective getSeparator() {
    return separator;
  }
}
