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

package com.google.devtools.autofix;

import org.checkerframework.checker.nullness.qual.Nullable;

/** The fix template of a rule does not parse in the rule's language. Disables that rule's fix. */
public final class TemplateParseException extends AutofixException {
  private static final long serialVersionUID = 1L;

  private final String language;

  public TemplateParseException(String language, String message) {
    this(language, message, null);
  }

  public TemplateParseException(String language, String message, @Nullable Throwable cause) {
    super(String.format("cannot parse fix template as %s: %s", language, message), cause);
    this.language = language;
  }

  public String getLanguage() {
    return language;
  }
}
