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
import com.google.pycst.syntax.Node;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Labels names, attributes, subscripts and the composite targets containing them with their
 * {@link ExpressionContext}.
 *
 * <p>The context only depends on the position of a node in its parent: a node is a STORE in a
 * binding position (assignment and loop targets, definition names, parameters, with and except
 * targets, import bindings), a DEL in a {@code del} statement and a LOAD anywhere else. Elements
 * of a tuple, list or starred target get the context of the target, so every name unpacked by an
 * assignment is a STORE.
 *
 * <p>The names listed by {@code global} and {@code nonlocal}, and the dotted name of an import
 * with an as-name, are not annotated.
 */
public final class ExpressionContextProvider extends BatchableMetadataProvider<ExpressionContext> {

  @Override
  protected Callback createCallback(MetadataCollector<ExpressionContext> collector) {
    return new ContextCallback(collector);
  }

  private static final class ContextCallback implements Callback {
    private final MetadataCollector<ExpressionContext> collector;

    /** Contexts of the open context-bearing nodes, inherited by the elements of targets. */
    private final Map<Node, ExpressionContext> openContexts = new HashMap<>();

    ContextCallback(MetadataCollector<ExpressionContext> collector) {
      this.collector = collector;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      if (parent != null && isContextBearing(n)) {
        ExpressionContext context = getContext(n, parent, openContexts.get(parent));
        if (context != null) {
          collector.setMetadata(n, context);
          openContexts.put(n, context);
        }
      }
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      openContexts.remove(n);
    }
  }

  static boolean isContextBearing(Node n) {
    switch (n.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
      case STARRED:
      case TUPLE:
      case LIST:
      case DOTTED_NAME:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the context of a context-bearing node, or null if it has none.
   *
   * @param parentContext the context of the parent, if the parent is context-bearing
   */
  static @Nullable ExpressionContext getContext(
      Node n, Node parent, @Nullable ExpressionContext parentContext) {
    switch (parent.getToken()) {
      case ASSIGN:
        return n != parent.getLastChild() ? ExpressionContext.STORE : ExpressionContext.LOAD;
      case AUG_ASSIGN:
      case ANN_ASSIGN:
      case FOR:
      case COMP_FOR:
      case PARAM:
        return n == parent.getFirstChild() ? ExpressionContext.STORE : ExpressionContext.LOAD;
      case WITH_ITEM:
      case EXCEPT_HANDLER:
      case FUNCTION_DEF:
      case CLASS_DEF:
        return n == parent.getSecondChild() ? ExpressionContext.STORE : ExpressionContext.LOAD;
      case DEL:
        return ExpressionContext.DEL;
      case TUPLE:
      case LIST:
      case STARRED:
        return parentContext != null ? parentContext : ExpressionContext.LOAD;
      case IMPORT_ALIAS:
        if (n.isDottedName()) {
          return parent.getSecondChild().isEmpty() ? ExpressionContext.STORE : null;
        }
        return ExpressionContext.STORE;
      case GLOBAL:
      case NONLOCAL:
        return null;
      default:
        return ExpressionContext.LOAD;
    }
  }
}
