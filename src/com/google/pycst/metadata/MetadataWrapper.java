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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pycst.metadata.NodeTraversal.Callback;
import com.google.pycst.metadata.NodeTraversal.TraversalException;
import com.google.pycst.syntax.Node;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Owns the metadata computed for one immutable syntax tree.
 *
 * <p>Resolving a provider first resolves its dependencies. Providers are run in dependency order,
 * the batchable providers that are ready at the same time sharing a single traversal. Each provider
 * runs at most once per wrapper: its node to value mapping is cached and later requests return the
 * cached mapping. The tree itself is never modified, and wrapping the same tree twice yields two
 * independent caches.
 */
public final class MetadataWrapper {
  private static final Logger logger = Logger.getLogger(MetadataWrapper.class.getName());

  private final Node root;
  private final MetadataOptions options;

  /** The mappings of the resolved providers, in resolution order. */
  private final Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> metadata =
      new LinkedHashMap<>();

  public MetadataWrapper(Node root) {
    this(root, new MetadataOptions());
  }

  public MetadataWrapper(Node root, MetadataOptions options) {
    checkArgument(root.isModule(), "Expected a MODULE root: %s", root);
    this.root = root;
    this.options = checkNotNull(options);
  }

  public Node getRoot() {
    return root;
  }

  /** Returns whether the provider's metadata is cached on this wrapper. */
  public boolean isResolved(BaseMetadataProvider<?> provider) {
    return metadata.containsKey(provider);
  }

  /**
   * Resolves one provider and its dependencies, and returns the provider's mapping.
   *
   * @see #resolveAll(Iterable)
   */
  @CanIgnoreReturnValue
  @SuppressWarnings("unchecked") // The cache maps each provider to its own mapping.
  public <T> ImmutableMap<Node, T> resolve(BaseMetadataProvider<T> provider) {
    resolveAll(ImmutableList.of(provider));
    return (ImmutableMap<Node, T>) metadata.get(provider);
  }

  /** Resolves several providers and returns the mapping of each of them. */
  public ImmutableMap<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolveMany(
      Iterable<? extends BaseMetadataProvider<?>> providers) {
    resolveAll(providers);
    ImmutableMap.Builder<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> result =
        ImmutableMap.builder();
    for (BaseMetadataProvider<?> provider : ImmutableSet.copyOf(providers)) {
      result.put(provider, metadata.get(provider));
    }
    return result.buildOrThrow();
  }

  public void resolveAll(BaseMetadataProvider<?>... providers) {
    resolveAll(Arrays.asList(providers));
  }

  /**
   * Resolves the providers and their transitive dependencies. Providers already resolved on this
   * wrapper are not run again.
   *
   * <p>If a provider fails, the metadata of the providers run by this call is discarded; the
   * metadata resolved by earlier calls stays available.
   *
   * @throws MetadataConfigurationException if the dependencies form a cycle; no provider is run
   * @throws MetadataExecutionException if a provider fails
   */
  public void resolveAll(Iterable<? extends BaseMetadataProvider<?>> providers) {
    ImmutableSet<BaseMetadataProvider<?>> requested = ImmutableSet.copyOf(providers);
    if (metadata.keySet().containsAll(requested)) {
      return;
    }

    MetadataDependencyGraph graph = MetadataDependencyGraph.create(requested);
    ImmutableList<ImmutableList<BaseMetadataProvider<?>>> rounds =
        graph.computeRounds(metadata.keySet());

    Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolved = new LinkedHashMap<>();
    MetadataCollector.MetadataSource source = new Source(resolved);
    for (ImmutableList<BaseMetadataProvider<?>> round : rounds) {
      logger.fine("Resolving " + round);
      List<BatchableMetadataProvider<?>> batch = new ArrayList<>();
      for (BaseMetadataProvider<?> provider : round) {
        if (options.getBatchTraversals() && provider instanceof BatchableMetadataProvider) {
          batch.add((BatchableMetadataProvider<?>) provider);
        } else {
          runProvider(provider, source, resolved);
        }
      }
      if (!batch.isEmpty()) {
        runBatch(batch, source, resolved);
      }
    }
    metadata.putAll(resolved);
  }

  /**
   * Returns the value the provider attached to the node.
   *
   * @throws MetadataLookupException if the provider is not resolved on this wrapper, or did not
   *     annotate the node
   */
  public <T> T get(BaseMetadataProvider<T> provider, Node node) {
    return lookup(metadata, provider, node);
  }

  @SuppressWarnings("unchecked") // The cache maps each provider to its own mapping.
  private static <T> T lookup(
      Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> metadata,
      BaseMetadataProvider<T> provider,
      Node node) {
    ImmutableMap<Node, ?> values = metadata.get(provider);
    if (values == null) {
      throw MetadataLookupException.notResolved(provider);
    }
    Object value = values.get(node);
    if (value == null) {
      throw MetadataLookupException.notAnnotated(provider, node);
    }
    return (T) value;
  }

  private <T> void runProvider(
      BaseMetadataProvider<T> provider,
      MetadataCollector.MetadataSource source,
      Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolved) {
    logger.fine("Running " + provider.getName());
    MetadataCollector<T> collector = newCollector(provider, source);
    try {
      provider.computeMetadata(collector);
    } catch (MetadataExecutionException e) {
      throw e;
    } catch (TraversalException e) {
      throw toExecutionException(provider, e);
    } catch (RuntimeException e) {
      throw new MetadataExecutionException(provider, null, e);
    }
    resolved.put(provider, collector.build());
  }

  private void runBatch(
      List<BatchableMetadataProvider<?>> providers,
      MetadataCollector.MetadataSource source,
      Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolved) {
    logger.fine("Running batched traversal of " + providers);
    Map<BaseMetadataProvider<?>, MetadataCollector<?>> collectors = new LinkedHashMap<>();
    ImmutableMap.Builder<BaseMetadataProvider<?>, Callback> callbacks = ImmutableMap.builder();
    for (BatchableMetadataProvider<?> provider : providers) {
      callbacks.put(provider, createCallback(provider, source, collectors));
    }
    try {
      BatchedTraversal.traverse(root, callbacks.buildOrThrow());
    } catch (TraversalException e) {
      throw toExecutionException(providers.get(0), e);
    }
    for (Map.Entry<BaseMetadataProvider<?>, MetadataCollector<?>> entry : collectors.entrySet()) {
      resolved.put(entry.getKey(), entry.getValue().build());
    }
  }

  private <T> Callback createCallback(
      BatchableMetadataProvider<T> provider,
      MetadataCollector.MetadataSource source,
      Map<BaseMetadataProvider<?>, MetadataCollector<?>> collectors) {
    MetadataCollector<T> collector = newCollector(provider, source);
    collectors.put(provider, collector);
    try {
      return provider.createCallback(collector);
    } catch (RuntimeException e) {
      throw new MetadataExecutionException(provider, null, e);
    }
  }

  private <T> MetadataCollector<T> newCollector(
      BaseMetadataProvider<T> provider, MetadataCollector.MetadataSource source) {
    return new MetadataCollector<>(provider, root, source, options.getStrictDependencyLookups());
  }

  /**
   * Unwraps a traversal failure. A failure inside a batched traversal already names its provider;
   * any other failure is attributed to {@code provider}.
   */
  private static MetadataExecutionException toExecutionException(
      BaseMetadataProvider<?> provider, TraversalException e) {
    if (e.getCause() instanceof MetadataExecutionException) {
      return (MetadataExecutionException) e.getCause();
    }
    return new MetadataExecutionException(provider, e.getNode(), e.getCause());
  }

  /** Serves lookups from the cache and from the providers resolved by the running call. */
  private final class Source implements MetadataCollector.MetadataSource {
    private final Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolved;

    Source(Map<BaseMetadataProvider<?>, ImmutableMap<Node, ?>> resolved) {
      this.resolved = resolved;
    }

    @Override
    public <D> D getMetadata(BaseMetadataProvider<D> provider, Node node) {
      return lookup(resolved.containsKey(provider) ? resolved : metadata, provider, node);
    }
  }
}
