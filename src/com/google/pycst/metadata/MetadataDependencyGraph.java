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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The providers needed to satisfy a resolve request, with an edge from each provider to each of
 * its declared dependencies.
 */
final class MetadataDependencyGraph {

  private final ImmutableGraph<BaseMetadataProvider<?>> graph;

  private MetadataDependencyGraph(ImmutableGraph<BaseMetadataProvider<?>> graph) {
    this.graph = graph;
  }

  /**
   * Collects the requested providers and their transitive dependencies.
   *
   * @throws MetadataConfigurationException if a provider transitively depends on itself
   */
  static MetadataDependencyGraph create(Iterable<? extends BaseMetadataProvider<?>> requested) {
    MutableGraph<BaseMetadataProvider<?>> graph =
        GraphBuilder.directed()
            .allowsSelfLoops(true)
            .nodeOrder(ElementOrder.insertion())
            .incidentEdgeOrder(ElementOrder.stable())
            .build();
    Deque<BaseMetadataProvider<?>> worklist = new ArrayDeque<>();
    for (BaseMetadataProvider<?> provider : requested) {
      if (graph.addNode(provider)) {
        worklist.add(provider);
      }
    }
    while (!worklist.isEmpty()) {
      BaseMetadataProvider<?> provider = worklist.remove();
      for (BaseMetadataProvider<?> dependency : provider.getDependencies()) {
        if (!graph.nodes().contains(dependency)) {
          worklist.add(dependency);
        }
        graph.putEdge(provider, dependency);
      }
    }
    if (Graphs.hasCycle(graph)) {
      throw new MetadataConfigurationException(findCycle(graph));
    }
    return new MetadataDependencyGraph(ImmutableGraph.copyOf(graph));
  }

  /** Returns every provider of the graph, requested ones first. */
  ImmutableSet<BaseMetadataProvider<?>> getProviders() {
    return ImmutableSet.copyOf(graph.nodes());
  }

  ImmutableSet<BaseMetadataProvider<?>> getDependencies(BaseMetadataProvider<?> provider) {
    return ImmutableSet.copyOf(graph.successors(provider));
  }

  /**
   * Orders the providers that are not yet resolved into rounds. Every provider of a round only
   * depends on providers of earlier rounds or on {@code resolved} ones, so the providers of one
   * round can run together.
   */
  ImmutableList<ImmutableList<BaseMetadataProvider<?>>> computeRounds(
      Set<BaseMetadataProvider<?>> resolved) {
    Set<BaseMetadataProvider<?>> completed = new HashSet<>(resolved);
    Set<BaseMetadataProvider<?>> remaining = new LinkedHashSet<>(graph.nodes());
    remaining.removeAll(resolved);

    ImmutableList.Builder<ImmutableList<BaseMetadataProvider<?>>> rounds = ImmutableList.builder();
    while (!remaining.isEmpty()) {
      ImmutableList.Builder<BaseMetadataProvider<?>> round = ImmutableList.builder();
      for (BaseMetadataProvider<?> provider : remaining) {
        if (completed.containsAll(graph.successors(provider))) {
          round.add(provider);
        }
      }
      ImmutableList<BaseMetadataProvider<?>> ready = round.build();
      // Cannot happen for an acyclic graph.
      checkState(!ready.isEmpty(), "No provider of %s can run", remaining);
      completed.addAll(ready);
      ready.forEach(remaining::remove);
      rounds.add(ready);
    }
    return rounds.build();
  }

  /** Returns a path P0 -> P1 -> ... -> P0 of a cyclic graph. */
  private static ImmutableList<BaseMetadataProvider<?>> findCycle(
      MutableGraph<BaseMetadataProvider<?>> graph) {
    Set<BaseMetadataProvider<?>> finished = new HashSet<>();
    for (BaseMetadataProvider<?> start : graph.nodes()) {
      List<BaseMetadataProvider<?>> path = new ArrayList<>();
      ImmutableList<BaseMetadataProvider<?>> cycle = findCycle(graph, start, path, finished);
      if (cycle != null) {
        return cycle;
      }
    }
    throw new IllegalStateException("graph has no cycle");
  }

  private static @Nullable ImmutableList<BaseMetadataProvider<?>> findCycle(
      MutableGraph<BaseMetadataProvider<?>> graph,
      BaseMetadataProvider<?> provider,
      List<BaseMetadataProvider<?>> path,
      Set<BaseMetadataProvider<?>> finished) {
    int index = path.indexOf(provider);
    if (index != -1) {
      return ImmutableList.<BaseMetadataProvider<?>>builder()
          .addAll(path.subList(index, path.size()))
          .add(provider)
          .build();
    }
    if (finished.contains(provider)) {
      return null;
    }
    path.add(provider);
    for (BaseMetadataProvider<?> dependency : graph.successors(provider)) {
      ImmutableList<BaseMetadataProvider<?>> cycle = findCycle(graph, dependency, path, finished);
      if (cycle != null) {
        return cycle;
      }
    }
    path.remove(path.size() - 1);
    finished.add(provider);
    return null;
  }
}
