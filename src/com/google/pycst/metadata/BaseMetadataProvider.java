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

import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * An analysis computing one value per node of a syntax tree.
 *
 * <p>Providers are resolved through a {@link MetadataWrapper}, which runs every provider at most
 * once per tree, after the providers it depends on. A provider's identity is its class: two
 * instances of the same provider class are interchangeable and share one cache entry, so a
 * provider keeps no per-tree state in its fields and writes its results to the {@link
 * MetadataCollector} it is given.
 *
 * @param <T> the type of the value attached to each annotated node
 */
public abstract class BaseMetadataProvider<T> {

  /**
   * Returns the providers whose metadata this provider reads. They are resolved before this
   * provider runs. The default is no dependencies.
   */
  public ImmutableSet<BaseMetadataProvider<?>> getDependencies() {
    return ImmutableSet.of();
  }

  /**
   * Computes the metadata of every node this provider annotates. Dependencies can be queried with
   * {@link MetadataCollector#getMetadata}.
   */
  protected abstract void computeMetadata(MetadataCollector<T> collector);

  /** Returns the simple class name, or the binary name for an anonymous provider. */
  public String getName() {
    String name = getClass().getSimpleName();
    return name.isEmpty() ? getClass().getName() : name;
  }

  @Override
  public final boolean equals(@Nullable Object o) {
    return o != null && o.getClass() == getClass();
  }

  @Override
  public final int hashCode() {
    return getClass().hashCode();
  }

  @Override
  public String toString() {
    return getName();
  }
}
