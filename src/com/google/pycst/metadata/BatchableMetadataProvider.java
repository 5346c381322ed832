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

import com.google.pycst.metadata.NodeTraversal.Callback;

/**
 * A provider that computes its metadata during a single traversal of the tree, and can therefore
 * share that traversal with other batchable providers.
 *
 * <p>The callback must not rely on being the only client of the traversal: it sees the nodes in
 * the order documented on {@link NodeTraversal}, and returning false from {@link
 * Callback#shouldTraverse} only hides the subtree from this callback.
 */
public abstract class BatchableMetadataProvider<T> extends BaseMetadataProvider<T> {

  /** Creates the callback that records this provider's metadata for one traversal. */
  protected abstract Callback createCallback(MetadataCollector<T> collector);

  @Override
  protected final void computeMetadata(MetadataCollector<T> collector) {
    NodeTraversal.traverse(collector.getRoot(), createCallback(collector));
  }
}
