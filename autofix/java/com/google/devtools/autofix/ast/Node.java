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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.devtools.autofix.source.Range;
import java.util.List;
import java.util.Optional;

/**
 * The generic node envelope over every language's syntax trees.
 *
 * <p>Language parsers decide the shape of their trees: {@link #syntax()} carries the
 * language-specific grammar label, while {@link #kind()} is the closed set of shapes substitution
 * and printing understand. A node with an {@link #origin()} derives its text from that range of the
 * target or template buffer; a node without one is synthesized.
 *
 * <p>Nodes are immutable. Substitution never copies a bound subtree, so the same instance may
 * appear several times in one tree.
 */
@AutoValue
public abstract class Node {
  public abstract NodeKind kind();

  /** Language-specific grammar label, e.g. {@code "call"} or {@code "identifier"}. */
  public abstract String syntax();

  public abstract Optional<Range> origin();

  public abstract ImmutableList<Node> children();

  /**
   * For an {@link #altered()} composite, the template span each child occupies, parallel to {@link
   * #children()}. Empty otherwise.
   */
  public abstract ImmutableList<Range> layout();

  /** Placeholder name of a reference node, without sigils. */
  public abstract Optional<String> name();

  public abstract Optional<ListKind> listKind();

  /** Set only on synthesized tokens. */
  public abstract Optional<Connective> connective();

  /** True for a template token that separates the elements of a list, such as a comma. */
  public abstract boolean separator();

  /** True if substitution rebuilt this node, so its origin text no longer describes it. */
  public abstract boolean altered();

  public abstract Builder toBuilder();

  /** Returns true if a reference node remains anywhere in this subtree. */
  @Memoized
  public boolean containsReference() {
    if (kind().isReference()) {
      return true;
    }
    for (Node child : children()) {
      if (child.containsReference()) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if this node has no origin. */
  public boolean isSynthesized() {
    return !origin().isPresent();
  }

  @Memoized
  @Override
  public abstract int hashCode();

  public static Builder builder(NodeKind kind) {
    return new AutoValue_Node.Builder()
        .setKind(kind)
        .setSyntax("")
        .setChildren(ImmutableList.of())
        .setLayout(ImmutableList.of())
        .setSeparator(false)
        .setAltered(false);
  }

  /** Returns a leaf token whose text is {@code origin}. */
  public static Node token(String syntax, Range origin) {
    return builder(NodeKind.TOKEN).setSyntax(syntax).setOrigin(origin).build();
  }

  /** Returns a list separator token, such as the comma between two arguments. */
  public static Node separator(Range origin) {
    return builder(NodeKind.TOKEN)
        .setSyntax("separator")
        .setOrigin(origin)
        .setSeparator(true)
        .build();
  }

  /** Returns a synthesized token printed as {@code connective}. */
  public static Node connective(Connective connective) {
    return builder(NodeKind.TOKEN).setSyntax("connective").setConnective(connective).build();
  }

  public static Node metavariable(String name, Range origin) {
    return builder(NodeKind.METAVARIABLE)
        .setSyntax("metavariable")
        .setName(name)
        .setOrigin(origin)
        .build();
  }

  public static Node ellipsis(String name, Range origin) {
    return builder(NodeKind.ELLIPSIS)
        .setSyntax("ellipsis")
        .setName(name)
        .setOrigin(origin)
        .build();
  }

  public static Node expression(String syntax, Range origin, List<Node> children) {
    return builder(NodeKind.EXPRESSION)
        .setSyntax(syntax)
        .setOrigin(origin)
        .setChildren(ImmutableList.copyOf(children))
        .build();
  }

  public static Node statement(String syntax, Range origin, List<Node> children) {
    return builder(NodeKind.STATEMENT)
        .setSyntax(syntax)
        .setOrigin(origin)
        .setChildren(ImmutableList.copyOf(children))
        .build();
  }

  public static Node list(ListKind listKind, Range origin, List<Node> children) {
    return builder(NodeKind.LIST)
        .setSyntax(Ascii.toLowerCase(listKind.name()))
        .setListKind(listKind)
        .setOrigin(origin)
        .setChildren(ImmutableList.copyOf(children))
        .build();
  }

  /**
   * Returns the synthesized node holding {@code elements} joined by the separator of {@code
   * listKind}. The elements themselves are shared, not copied.
   */
  public static Node expandedSequence(ListKind listKind, List<Node> elements) {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        children.add(connective(listKind.getSeparator()));
      }
      children.add(elements.get(i));
    }
    return builder(NodeKind.EXPANDED_SEQUENCE)
        .setSyntax("expanded_sequence")
        .setListKind(listKind)
        .setChildren(children.build())
        .setAltered(true)
        .build();
  }

  /**
   * Returns a copy of this composite with new children, marked {@link #altered()}.
   *
   * @param layout the template span of each new child, or empty if unknown
   */
  public Node rebuild(List<Node> newChildren, List<Range> layout) {
    checkArgument(!kind().isLeaf(), "cannot rebuild leaf %s", this);
    return toBuilder()
        .setChildren(ImmutableList.copyOf(newChildren))
        .setLayout(ImmutableList.copyOf(layout))
        .setAltered(true)
        .build();
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder(kind().name()).append('(').append(syntax());
    name().ifPresent(n -> sb.append(" $").append(n));
    connective().ifPresent(c -> sb.append(' ').append(c));
    origin().ifPresent(o -> sb.append(' ').append(o));
    if (!children().isEmpty()) {
      sb.append(' ').append(children().size()).append(" children");
    }
    return sb.append(')').toString();
  }

  /** Builder for {@link Node}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setKind(NodeKind kind);

    public abstract Builder setSyntax(String syntax);

    public abstract Builder setOrigin(Range origin);

    public abstract Builder setChildren(ImmutableList<Node> children);

    public abstract Builder setLayout(ImmutableList<Range> layout);

    public abstract Builder setName(String name);

    public abstract Builder setListKind(ListKind listKind);

    public abstract Builder setConnective(Connective connective);

    public abstract Builder setSeparator(boolean separator);

    public abstract Builder setAltered(boolean altered);

    abstract Node autoBuild();

    public Node build() {
      Node node = autoBuild();
      NodeKind kind = node.kind();
      checkState(
          !kind.isLeaf() || node.children().isEmpty(), "%s node cannot have children", kind);
      checkState(
          kind.isReference() == node.name().isPresent(),
          "only reference nodes carry a placeholder name: %s",
          node);
      checkState(
          (kind == NodeKind.LIST || kind == NodeKind.EXPANDED_SEQUENCE)
              == node.listKind().isPresent(),
          "only list nodes carry a list kind: %s",
          node);
      checkState(
          !node.connective().isPresent()
              || (kind == NodeKind.TOKEN && !node.origin().isPresent()),
          "a connective must be a token without origin: %s",
          node);
      checkState(
          node.layout().isEmpty() || node.layout().size() == node.children().size(),
          "layout of %s does not match its %s children",
          node,
          node.children().size());
      return node;
    }
  }
}
