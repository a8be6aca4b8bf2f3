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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.source.SourceBuffer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NodesTest {
  // f($X, $...REST, $X)
  private final SourceBuffer template = SourceBuffer.template("f($X, $...REST, $X)");
  private final Node callee = Node.token("identifier", template.range(0, 1));
  private final Node x = Node.metavariable("X", template.range(2, 4));
  private final Node firstComma = Node.separator(template.range(4, 5));
  private final Node rest = Node.ellipsis("REST", template.range(6, 14));
  private final Node secondComma = Node.separator(template.range(14, 15));
  private final Node x2 = Node.metavariable("X", template.range(16, 18));
  private final Node args =
      Node.list(
          ListKind.ARGUMENTS,
          template.range(2, 18),
          ImmutableList.of(x, firstComma, rest, secondComma, x2));
  private final Node call =
      Node.expression("call", template.fullRange(), ImmutableList.of(callee, args));

  @Test
  public void testPreOrder() {
    assertThat(Nodes.preOrder(call))
        .containsExactly(call, callee, args, x, firstComma, rest, secondComma, x2)
        .inOrder();
  }

  @Test
  public void testReferencedNamesInFirstUseOrder() {
    assertThat(Nodes.referencedNames(call)).containsExactly("X", "REST").inOrder();
    assertThat(Nodes.referencedNames(callee)).isEmpty();
  }

  @Test
  public void testLeaves() {
    assertThat(Nodes.leaves(call))
        .containsExactly(callee, x, firstComma, rest, secondComma, x2)
        .inOrder();
  }

  @Test
  public void testLeavesSkipEmptyExpansions() {
    Node empty = Node.expandedSequence(ListKind.ARGUMENTS, ImmutableList.of());
    Node rebuilt = args.rebuild(ImmutableList.of(empty), ImmutableList.of());
    assertThat(Nodes.leaves(rebuilt)).isEmpty();
  }
}
