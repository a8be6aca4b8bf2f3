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

package com.google.devtools.autofix.substitution;

import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.AutofixException;
import com.google.devtools.autofix.MetavariableTypeException;
import com.google.devtools.autofix.UnboundMetavariableException;
import com.google.devtools.autofix.ast.ListKind;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.ast.NodeKind;
import com.google.devtools.autofix.match.Binding;
import com.google.devtools.autofix.match.MatchEnvironment;
import com.google.devtools.autofix.source.Range;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces the placeholder references of a parsed fix template with the subtrees a match bound
 * them to.
 *
 * <p>Subtrees of the template that contain no reference are returned as the very same instances,
 * so the printer can lift their template text whole. Composites above a reference are rebuilt and
 * marked {@link Node#altered()}, recording in their {@link Node#layout()} where each child sat in
 * the template. Bound subtrees are shared, never copied: every occurrence of {@code $X} becomes the
 * identical node.
 */
public final class MetavariableSubstitution {
  private final MatchEnvironment env;

  private MetavariableSubstitution(MatchEnvironment env) {
    this.env = env;
  }

  /**
   * Returns {@code template} with every reference resolved against {@code env}. Either the whole
   * tree is substituted or an exception is thrown; no partial result is ever returned.
   *
   * @throws com.google.devtools.autofix.UnboundMetavariableException if a placeholder is not bound
   * @throws com.google.devtools.autofix.MetavariableTypeException if a binding does not fit its use
   */
  public static Node replace(MatchEnvironment env, Node template) throws AutofixException {
    return new MetavariableSubstitution(env).substitute(template);
  }

  private Node substitute(Node node) throws AutofixException {
    switch (node.kind()) {
      case METAVARIABLE:
        return resolveScalar(node);
      case ELLIPSIS:
        throw new MetavariableTypeException(
            node.name().get(), "a sequence placeholder can only be used inside a list");
      case LIST:
        return substituteList(node);
      default:
        if (!node.containsReference()) {
          return node;
        }
        List<Node> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
          children.add(substitute(child));
        }
        return node.rebuild(children, layoutOf(node, node.children()));
    }
  }

  private Node resolveScalar(Node reference) throws AutofixException {
    String name = reference.name().get();
    Binding binding = lookup(name);
    if (binding.isSequence()) {
      throw new MetavariableTypeException(
          name, "bound to a sequence but used where a single node is expected");
    }
    return binding.node().get();
  }

  private Node substituteList(Node list) throws AutofixException {
    if (!list.containsReference()) {
      return list;
    }
    ListKind listKind = list.listKind().get();
    ImmutableList<Node> original = list.children();
    boolean hasLayout = hasLayout(list, original);
    List<Node> children = new ArrayList<>(original.size());
    List<Range> layout = new ArrayList<>(original.size());
    for (int i = 0; i < original.size(); i++) {
      Node child = original.get(i);
      if (child.kind() != NodeKind.ELLIPSIS) {
        children.add(substitute(child));
        if (hasLayout) {
          layout.add(child.origin().get());
        }
        continue;
      }
      ImmutableList<Node> elements = resolveSequence(child);
      Range slot = hasLayout ? child.origin().get() : null;
      if (elements.isEmpty()) {
        // Absorb one neighbouring separator, and the spacing around it, so no dangling comma is
        // printed.
        int last = children.size() - 1;
        if (last >= 0 && isSeparator(children.get(last))) {
          children.remove(last);
          if (hasLayout) {
            Range separator = layout.remove(last);
            int start = last > 0 ? layout.get(last - 1).getEnd() : separator.getStart();
            slot = slot.withOffsets(start, slot.getEnd());
          }
        } else if (i + 1 < original.size() && isSeparator(original.get(i + 1))) {
          i++;
          if (hasLayout) {
            int end =
                i + 1 < original.size()
                    ? original.get(i + 1).origin().get().getStart()
                    : original.get(i).origin().get().getEnd();
            slot = slot.withOffsets(slot.getStart(), end);
          }
        }
      }
      children.add(Node.expandedSequence(listKind, elements));
      if (hasLayout) {
        layout.add(slot);
      }
    }
    return list.rebuild(children, layout);
  }

  private ImmutableList<Node> resolveSequence(Node reference) throws AutofixException {
    String name = reference.name().get();
    Binding binding = lookup(name);
    if (!binding.isSequence()) {
      throw new MetavariableTypeException(
          name, "bound to a single node but used as a sequence placeholder");
    }
    return binding.sequence();
  }

  private Binding lookup(String name) throws UnboundMetavariableException {
    Optional<Binding> binding = env.lookup(name);
    if (!binding.isPresent()) {
      throw new UnboundMetavariableException(name);
    }
    return binding.get();
  }

  private static boolean isSeparator(Node node) {
    return node.kind() == NodeKind.TOKEN && node.separator();
  }

  /**
   * Returns the template spans of {@code children}, or an empty list if the parent or any child
   * has no origin in the parent's buffer, in which case the printer concatenates the children.
   */
  private static ImmutableList<Range> layoutOf(Node parent, List<Node> children) {
    if (!hasLayout(parent, children)) {
      return ImmutableList.of();
    }
    return children.stream().map(c -> c.origin().get()).collect(ImmutableList.toImmutableList());
  }

  private static boolean hasLayout(Node parent, List<Node> children) {
    if (!parent.origin().isPresent()) {
      return false;
    }
    Range span = parent.origin().get();
    int cursor = span.getStart();
    for (Node child : children) {
      if (!child.origin().isPresent() || !span.encloses(child.origin().get())) {
        return false;
      }
      Range origin = child.origin().get();
      if (origin.getStart() < cursor) {
        return false;
      }
      cursor = origin.getEnd();
    }
    return true;
  }
}
