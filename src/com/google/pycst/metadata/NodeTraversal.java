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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.pycst.syntax.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * analyses of the parse tree.
 *
 * <p>Children are always visited left to right, so all callbacks sharing a traversal observe the
 * same order. A function scope is entered after the decorators and the function name, a class
 * scope after the decorators, the class name and the bases; lambda and comprehension scopes cover
 * the whole node. Some children inside a scope are still evaluated by Python in the enclosing
 * scope (parameter annotations and defaults, the return annotation, the first iterable of a
 * comprehension); see {@link NodeUtil#isEvaluatedInEnclosingScope}.
 */
public class NodeTraversal {
  private final Callback callback;
  private final @Nullable ScopedCallback scopeCallback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** The roots of the scopes enclosing the current node, outermost first. */
  private final List<Node> scopeRoots = new ArrayList<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} in preorder and by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit(NodeTraversal,
     * Node, Node)} and its children will neither be visited by {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} nor {@link #visit(NodeTraversal, Node, Node)}.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children).
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Callback that also knows about scope changes */
  public interface ScopedCallback extends Callback {

    /**
     * Called immediately after entering a new scope. The new scope root can be accessed through
     * t.getScopeRoot()
     */
    void enterScope(NodeTraversal t);

    /**
     * Called immediately before exiting a scope. The ending scope root can be accessed through
     * t.getScopeRoot()
     */
    void exitScope(NodeTraversal t);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, Node parent) {}
  }

  /**
   * Thrown when a callback fails. Carries the node that was being visited, the original exception
   * being the cause.
   */
  public static final class TraversalException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient @Nullable Node node;

    TraversalException(@Nullable Node node, Throwable cause) {
      super(cause.getMessage() + "\n  Node: " + node, cause);
      this.node = node;
    }

    public @Nullable Node getNode() {
      return node;
    }
  }

  public NodeTraversal(Callback cb) {
    this.callback = checkNotNull(cb);
    this.scopeCallback = cb instanceof ScopedCallback ? (ScopedCallback) cb : null;
  }

  /** Traverses the tree rooted at {@code root}, which opens the outermost scope. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  /** Traverses a parse tree recursively. */
  public void traverse(Node root) {
    checkState(scopeRoots.isEmpty(), "traversal already in progress");
    try {
      currentNode = root;
      pushScope(root);
      // null parent ensures that the callbacks will traverse root
      traverseBranch(root, null);
      popScope();
    } catch (TraversalException e) {
      throw e;
    } catch (RuntimeException unexpectedException) {
      throw new TraversalException(currentNode, unexpectedException);
    } finally {
      scopeRoots.clear();
      currentNode = null;
    }
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        handleFunction(n, parent);
        return;
      case CLASS_DEF:
        handleClass(n, parent);
        return;
      case LAMBDA:
      case LIST_COMP:
      case SET_COMP:
      case GENERATOR_EXP:
      case DICT_COMP:
        handleScopeRoot(n, parent);
        return;
      default:
        break;
    }

    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    traverseChildren(n);

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void traverseChildren(Node n) {
    for (Node child : n.children()) {
      traverseBranch(child, n);
    }
  }

  /**
   * Traverses a function definition. The function scope is entered after the decorators and the
   * function name, before the parameters.
   */
  private void handleFunction(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    ImmutableList<Node> children = n.children();
    traverseBranch(children.get(0), n); // decorators
    traverseBranch(children.get(1), n); // name

    currentNode = n;
    pushScope(n);
    for (int i = 2; i < children.size(); i++) {
      traverseBranch(children.get(i), n);
    }
    popScope();

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /**
   * Traverses a class. The class scope is entered after the decorators, the class name and the
   * bases, before the body.
   */
  private void handleClass(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    Node body = n.getLastChild();
    for (Node child : n.children()) {
      if (child != body) {
        traverseBranch(child, n);
      }
    }

    currentNode = n;
    pushScope(n);
    traverseBranch(body, n);
    popScope();

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Traverses a lambda or a comprehension, whose scope covers all of its children. */
  private void handleScopeRoot(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    pushScope(n);
    traverseChildren(n);
    popScope();

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Creates a new scope (e.g. when entering a function). */
  private void pushScope(Node node) {
    checkNotNull(currentNode);
    checkNotNull(node);
    scopeRoots.add(node);
    if (scopeCallback != null) {
      scopeCallback.enterScope(this);
    }
  }

  /** Pops back to the previous scope (e.g. when leaving a function). */
  private void popScope() {
    if (scopeCallback != null) {
      scopeCallback.exitScope(this);
    }
    scopeRoots.remove(scopeRoots.size() - 1);
  }

  /** Returns the node currently being visited. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the current scope's root. */
  public Node getScopeRoot() {
    checkState(!scopeRoots.isEmpty(), "not traversing");
    return scopeRoots.get(scopeRoots.size() - 1);
  }

  /** Returns the depth of the current scope. The outermost scope has depth 0. */
  public int getScopeDepth() {
    return scopeRoots.size() - 1;
  }

  /** Returns the root of the closest enclosing FUNCTION_DEF or LAMBDA scope, or null. */
  public @Nullable Node getEnclosingFunction() {
    for (int i = scopeRoots.size() - 1; i >= 0; i--) {
      Node root = scopeRoots.get(i);
      if (NodeUtil.isFunctionLike(root)) {
        return root;
      }
    }
    return null;
  }
}
