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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.autofix.ast.Node;
import java.util.List;
import java.util.Optional;

/**
 * The placeholder bindings of one match, in the order the matcher bound them. Read-only once
 * built.
 */
public final class MatchEnvironment {
  public static final MatchEnvironment EMPTY = new MatchEnvironment(ImmutableMap.of());

  private final ImmutableMap<String, Binding> bindings;

  private MatchEnvironment(ImmutableMap<String, Binding> bindings) {
    this.bindings = bindings;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the binding of {@code name}, if the matcher bound it. */
  public Optional<Binding> lookup(String name) {
    return Optional.ofNullable(bindings.get(name));
  }

  public ImmutableSet<String> names() {
    return bindings.keySet();
  }

  public ImmutableMap<String, Binding> asMap() {
    return bindings;
  }

  public boolean isEmpty() {
    return bindings.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MatchEnvironment && bindings.equals(((MatchEnvironment) o).bindings);
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public String toString() {
    return "MatchEnvironment" + bindings.keySet();
  }

  /** Builder for {@link MatchEnvironment}. Binding one name twice is an error. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, Binding> bindings = ImmutableMap.builder();

    private Builder() {}

    public Builder bind(String name, Node node) {
      return put(name, Binding.scalar(checkNotNull(node, "node")));
    }

    public Builder bindSequence(String name, List<Node> nodes) {
      return put(name, Binding.sequence(nodes));
    }

    public Builder put(String name, Binding binding) {
      bindings.put(checkNotNull(name, "name"), checkNotNull(binding, "binding"));
      return this;
    }

    /**
     * Returns the built environment.
     *
     * @throws IllegalArgumentException if a name was bound more than once
     */
    public MatchEnvironment build() {
      return new MatchEnvironment(bindings.buildOrThrow());
    }
  }
}
