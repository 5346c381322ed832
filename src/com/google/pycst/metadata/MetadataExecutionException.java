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
 * Thrown when a provider fails while computing its metadata. The resolve call that ran it is
 * aborted; metadata cached by earlier calls stays valid.
 */
public final class MetadataExecutionException extends MetadataException {
  private static final long serialVersionUID = 1L;

  private final transient BaseMetadataProvider<?> provider;
  private final transient @Nullable Node node;

  MetadataExecutionException(
      BaseMetadataProvider<?> provider, @Nullable Node node, Throwable cause) {
    super(
        provider.getName()
            + " failed"
            + (node == null ? "" : " at " + node)
            + ": "
            + cause.getMessage(),
        cause);
    this.provider = provider;
    this.node = node;
  }

  public BaseMetadataProvider<?> getProvider() {
    return provider;
  }

  /** Returns the node being visited when the provider failed, or null if it failed elsewhere. */
  public @Nullable Node getNode() {
    return node;
  }
}
