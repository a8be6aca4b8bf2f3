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

package com.google.devtools.autofix.template;

import com.google.devtools.autofix.TemplateParseException;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.source.SourceBuffer;

/**
 * Parses fix-template text of one language into the generic {@link Node} envelope.
 *
 * <p>Implementations own their language's grammar. They must give every node derived from the
 * template an origin in {@code template}, mark list separators with {@link Node#separator}, and
 * represent placeholders as {@link com.google.devtools.autofix.ast.NodeKind#METAVARIABLE} or
 * {@link com.google.devtools.autofix.ast.NodeKind#ELLIPSIS} leaves.
 */
public interface LanguageParser {
  /** Returns the language identifier used by rules and matches, e.g. {@code "python"}. */
  String language();

  /** Parses the whole of {@code template} as a fix pattern. */
  Node parseTemplate(SourceBuffer template) throws TemplateParseException;
}
