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

/** The fix template references a placeholder the match did not bind. */
public final class UnboundMetavariableException extends AutofixException {
  private static final long serialVersionUID = 1L;

  private final String name;

  public UnboundMetavariableException(String name) {
    super("metavariable $" + name + " is not bound by the match");
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
