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

/**
 * A placeholder is used in a way its binding cannot satisfy: an ellipsis bound to a single node, a
 * single-node placeholder bound to a sequence, or an ellipsis outside of a list.
 */
public final class MetavariableTypeException extends AutofixException {
  private static final long serialVersionUID = 1L;

  private final String name;

  public MetavariableTypeException(String name, String message) {
    super("$" + name + ": " + message);
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
