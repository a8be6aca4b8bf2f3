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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.autofix.TemplateParseException;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.ast.Nodes;
import com.google.devtools.autofix.source.BufferId;
import com.google.devtools.autofix.source.OffsetUnit;
import com.google.devtools.autofix.source.SourceBuffer;

/** The parsed fix pattern of a rule. Independent of any match, so it is parsed once per rule. */
@AutoValue
public abstract class FixTemplate {
  public abstract String ruleId();

  public abstract String language();

  public abstract SourceBuffer buffer();

  public abstract Node root();

  /** Returns the placeholders the template refers to, in the order they first appear. */
  public ImmutableSet<String> placeholderNames() {
    return Nodes.referencedNames(root());
  }

  public static FixTemplate create(String ruleId, String language, SourceBuffer buffer, Node root) {
    checkArgument(buffer.getId() == BufferId.TEMPLATE, "not a template buffer: %s", buffer);
    return new AutoValue_FixTemplate(ruleId, language, buffer, root);
  }

  /** Parses {@code text} with {@code parser}, counting offsets in {@code unit}. */
  public static FixTemplate parse(
      String ruleId, LanguageParser parser, String text, OffsetUnit unit)
      throws TemplateParseException {
    SourceBuffer buffer = SourceBuffer.create(BufferId.TEMPLATE, unit, text);
    return create(ruleId, parser.language(), buffer, parser.parseTemplate(buffer));
  }
}
