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

import com.google.common.collect.ImmutableMap;
import com.google.pycst.metadata.NodeTraversal.Callback;
import com.google.pycst.metadata.NodeTraversal.ScopedCallback;
import com.google.pycst.syntax.Node;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A traversal combining the callbacks of several batchable providers, so that their metadata is
 * computed without incurring any additional traversal costs.
 *
 * <p>Each callback behaves as if it were the exclusive client of the traversal: when it returns
 * false from {@link Callback#shouldTraverse}, it stops receiving messages until the traversal
 * leaves that node. A failing callback is reported as a {@link MetadataExecutionException} naming
 * its provider.
 *
 * <p>None of the callbacks may mutate the parse tree.
 */
final class BatchedTraversal implements ScopedCallback {

  /** The callbacks that this traversal combines. */
  private final CallbackWrapper[] callbacks;

  BatchedTraversal(Map<BaseMetadataProvider<?>, Callback> callbacks) {
    this.callbacks = new CallbackWrapper[callbacks.size()];
    int i = 0;
    for (Map.Entry<BaseMetadataProvider<?>, Callback> entry : callbacks.entrySet()) {
      this.callbacks[i++] = new CallbackWrapper(entry.getKey(), entry.getValue());
    }
  }

  static void traverse(Node root, ImmutableMap<BaseMetadataProvider<?>, Callback> callbacks) {
    NodeTraversal.traverse(root, new BatchedTraversal(callbacks));
  }

  /**
   * Maintains information about a callback in order to simulate it being the exclusive client of
   * the shared {@link NodeTraversal}.
   */
  private static class CallbackWrapper {
    private final BaseMetadataProvider<?> provider;

    /** The callback being wrapped. Never null. */
    private final Callback callback;

    /** Non-null iff the callback also wants scope changes. */
    private final @Nullable ScopedCallback scopedCallback;

    /**
     * The node that {@link Callback#shouldTraverse(NodeTraversal, Node, Node)} returned false for.
     * The wrapped callback doesn't receive messages until after this node is revisited in the
     * post-order traversal.
     */
    private @Nullable Node waiting = null;

    private CallbackWrapper(BaseMetadataProvider<?> provider, Callback callback) {
      this.provider = provider;
      this.callback = callback;
      this.scopedCallback = callback instanceof ScopedCallback ? (ScopedCallback) callback : null;
    }

    /**
     * Visits the node unless the wrapped callback is inactive. Activates the callback if
     * appropriate.
     */
    void visitOrMaybeActivate(NodeTraversal t, Node n, @Nullable Node parent) {
      if (isActive()) {
        try {
          callback.visit(t, n, parent);
        } catch (RuntimeException e) {
          throw failure(n, e);
        }
      } else if (waiting == n) {
        waiting = null;
      }
    }

    void shouldTraverseIfActive(NodeTraversal t, Node n, @Nullable Node parent) {
      if (!isActive()) {
        return;
      }
      boolean traverse;
      try {
        traverse = callback.shouldTraverse(t, n, parent);
      } catch (RuntimeException e) {
        throw failure(n, e);
      }
      if (!traverse) {
        waiting = n;
      }
    }

    void enterScopeIfActive(NodeTraversal t) {
      if (isActive() && scopedCallback != null) {
        try {
          scopedCallback.enterScope(t);
        } catch (RuntimeException e) {
          throw failure(t.getScopeRoot(), e);
        }
      }
    }

    void exitScopeIfActive(NodeTraversal t) {
      if (isActive() && scopedCallback != null) {
        try {
          scopedCallback.exitScope(t);
        } catch (RuntimeException e) {
          throw failure(t.getScopeRoot(), e);
        }
      }
    }

    boolean isActive() {
      return waiting == null;
    }

    private MetadataExecutionException failure(Node n, RuntimeException e) {
      if (e instanceof MetadataExecutionException) {
        return (MetadataExecutionException) e;
      }
      return new MetadataExecutionException(provider, n, e);
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    for (CallbackWrapper callback : callbacks) {
      callback.shouldTraverseIfActive(t, n, parent);
    }
    // Returning false when every callback is inactive would save little: the callbacks that
    // prune subtrees are rare.
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    for (CallbackWrapper callback : callbacks) {
      callback.visitOrMaybeActivate(t, n, parent);
    }
  }

  @Override
  public void enterScope(NodeTraversal t) {
    for (CallbackWrapper callback : callbacks) {
      callback.enterScopeIfActive(t);
    }
  }

  @Override
  public void exitScope(NodeTraversal t) {
    for (CallbackWrapper callback : callbacks) {
      callback.exitScopeIfActive(t);
    }
  }
}
