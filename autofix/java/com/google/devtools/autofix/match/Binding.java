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

package com.google.devtools.autofix.match;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.ast.Node;
import java.util.List;
import java.util.Optional;

/**
 * What a placeholder was bound to by the matcher: either a single subtree, or for an ellipsis
 * placeholder an ordered (possibly empty) sequence of subtrees.
 */
@AutoValue
public abstract class Binding {
  /** The bound subtree of a scalar binding. */
  public abstract Optional<Node> node();

  /** The bound subtrees of a sequence binding. Empty for scalar bindings. */
  public abstract ImmutableList<Node> sequence();

  public abstract boolean isSequence();

  public static Binding scalar(Node node) {
    return new AutoValue_Binding(Optional.of(node), ImmutableList.of(), false);
  }

  public static Binding sequence(List<Node> nodes) {
    return new AutoValue_Binding(Optional.empty(), ImmutableList.copyOf(nodes), true);
  }
}
