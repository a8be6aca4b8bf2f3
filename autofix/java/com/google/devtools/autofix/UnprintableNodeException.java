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

import com.google.devtools.autofix.ast.Node;

/** The printer reached a node it can neither lift from source nor synthesize. */
public final class UnprintableNodeException extends AutofixException {
  private static final long serialVersionUID = 1L;

  private final transient Node node;

  public UnprintableNodeException(Node node, String reason) {
    super(String.format("cannot print %s: %s", node, reason));
    this.node = node;
  }

  public Node getNode() {
    return node;
  }
}
