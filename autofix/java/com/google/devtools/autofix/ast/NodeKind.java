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

/** The closed set of node shapes shared by every language's fix-template and target trees. */
public enum NodeKind {
  EXPRESSION,
  STATEMENT,
  /** A sequence of elements, such as an argument list or a block body. */
  LIST,
  /** A leaf token. Without an origin, only valid as a synthesized {@link Connective}. */
  TOKEN,
  /** A reference {@code $X} to a placeholder bound to a single node. */
  METAVARIABLE,
  /** A reference {@code $...X} to a placeholder bound to a sequence of nodes. */
  ELLIPSIS,
  /** The elements of an ellipsis binding spliced into a list, joined by connectives. */
  EXPANDED_SEQUENCE;

  /** Returns true for placeholder references, which substitution must resolve. */
  public boolean isReference() {
    return this == METAVARIABLE || this == ELLIPSIS;
  }

  /** Returns true for kinds that have no children. */
  public boolean isLeaf() {
    return this == TOKEN || isReference();
  }
}
