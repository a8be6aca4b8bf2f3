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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;

/** Utilities for walking {@link Node} trees. */
public final class Nodes {
  private Nodes() {}

  /** Returns every node of the tree rooted at {@code root}, in pre-order, left to right. */
  public static ImmutableList<Node> preOrder(Node root) {
    ImmutableList.Builder<Node> out = ImmutableList.builder();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      out.add(node);
      for (Node child : node.children().reverse()) {
        stack.push(child);
      }
    }
    return out.build();
  }

  /** Returns the names of all placeholders referenced under {@code root}, in first-use order. */
  public static ImmutableSet<String> referencedNames(Node root) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Node node : preOrder(root)) {
      if (node.kind().isReference()) {
        names.add(node.name().get());
      }
    }
    return names.build();
  }

  /** Returns the leaves of the tree in printing order. */
  public static ImmutableList<Node> leaves(Node root) {
    return preOrder(root).stream()
        .filter(n -> n.children().isEmpty() && n.kind() != NodeKind.EXPANDED_SEQUENCE)
        .collect(ImmutableList.toImmutableList());
  }
}
