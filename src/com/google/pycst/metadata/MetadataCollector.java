/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pycst.metadata;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pycst.syntax.Node;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives the metadata of one provider for one tree, and gives the provider access to the
 * metadata of its dependencies.
 *
 * @param <T> the type of the value attached to each annotated node
 */
public final class MetadataCollector<T> {

  /** Reads the metadata resolved so far on a wrapper. */
  interface MetadataSource {
    <D> D getMetadata(BaseMetadataProvider<D> provider, Node node);
  }

  private final BaseMetadataProvider<T> provider;
  private final Node root;
  private final MetadataSource source;
  private final ImmutableSet<BaseMetadataProvider<?>> dependencies;
  private final boolean strictDependencies;
  private final Map<Node, T> values = new LinkedHashMap<>();

  MetadataCollector(
      BaseMetadataProvider<T> provider,
      Node root,
      MetadataSource source,
      boolean strictDependencies) {
    this.provider = provider;
    this.root = root;
    this.source = source;
    this.dependencies = provider.getDependencies();
    this.strictDependencies = strictDependencies;
  }

  /** Returns the root of the tree being analyzed. */
  public Node getRoot() {
    return root;
  }

  /**
   * Attaches {@code value} to {@code node}.
   *
   * @throws IllegalStateException if the node already has a value
   */
  public void setMetadata(Node node, T value) {
    checkNotNull(node);
    checkNotNull(value, "null metadata for %s", node);
    T previous = values.putIfAbsent(node, value);
    if (previous != null) {
      throw new IllegalStateException(
          provider.getName() + " set metadata twice for " + node + ": " + previous + ", " + value);
    }
  }

  /** Returns whether {@link #setMetadata} was already called for {@code node}. */
  public boolean hasMetadata(Node node) {
    return values.containsKey(node);
  }

  /**
   * Returns the value a dependency attached to {@code node}.
   *
   * @throws MetadataLookupException if the dependency was not declared, or did not annotate the
   *     node
   */
  @CanIgnoreReturnValue
  public <D> D getMetadata(BaseMetadataProvider<D> dependency, Node node) {
    if (strictDependencies && !dependencies.contains(dependency)) {
      throw MetadataLookupException.undeclared(provider, dependency);
    }
    return source.getMetadata(dependency, node);
  }

  ImmutableMap<Node, T> build() {
    return ImmutableMap.copyOf(values);
  }
}
