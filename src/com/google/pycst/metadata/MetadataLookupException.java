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

import com.google.pycst.syntax.Node;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when metadata is queried for a provider that was never resolved, or for a node the
 * provider did not annotate.
 */
public final class MetadataLookupException extends MetadataException {
  private static final long serialVersionUID = 1L;

  private final transient BaseMetadataProvider<?> provider;
  private final transient @Nullable Node node;

  MetadataLookupException(String message, BaseMetadataProvider<?> provider, @Nullable Node node) {
    super(message);
    this.provider = provider;
    this.node = node;
  }

  static MetadataLookupException notResolved(BaseMetadataProvider<?> provider) {
    return new MetadataLookupException(
        provider.getName() + " has not been resolved", provider, null);
  }

  static MetadataLookupException notAnnotated(BaseMetadataProvider<?> provider, Node node) {
    return new MetadataLookupException(
        provider.getName() + " has no metadata for " + node, provider, node);
  }

  static MetadataLookupException undeclared(
      BaseMetadataProvider<?> requester, BaseMetadataProvider<?> provider) {
    return new MetadataLookupException(
        requester.getName() + " did not declare a dependency on " + provider.getName(),
        provider,
        null);
  }

  public BaseMetadataProvider<?> getProvider() {
    return provider;
  }

  public @Nullable Node getNode() {
    return node;
  }
}
