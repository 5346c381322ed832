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

import com.google.pycst.metadata.NodeTraversal.AbstractPostOrderCallback;
import com.google.pycst.metadata.NodeTraversal.Callback;
import com.google.pycst.syntax.Node;

/** Maps every node except the root to its parent. */
public final class ParentNodeProvider extends BatchableMetadataProvider<Node> {

  @Override
  protected Callback createCallback(MetadataCollector<Node> collector) {
    return new AbstractPostOrderCallback() {
      @Override
      public void visit(NodeTraversal t, Node n, Node parent) {
        if (parent != null) {
          collector.setMetadata(n, parent);
        }
      }
    };
  }
}
