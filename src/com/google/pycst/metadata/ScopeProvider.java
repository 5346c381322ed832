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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.pycst.metadata.NodeTraversal.ScopedCallback;
import com.google.pycst.syntax.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds the {@link Scope} tree of a module and resolves every name access to the assignments it
 * may refer to. Every traversed node is mapped to the scope it is evaluated in; a scope root is
 * mapped to the scope containing it.
 *
 * <p>Bindings and accesses are collected during one traversal and resolved after it, so whether
 * an assignment is visible to an access in the same scope does not depend on their order in the
 * source. Only functions, lambdas, classes and comprehensions open scopes; conditionals, loops and
 * exception handlers don't.
 *
 * <p>The builtin names are read from {@code python_builtins.txt}. Subclasses may override {@link
 * #getBuiltinNames()}.
 */
public class ScopeProvider extends BaseMetadataProvider<Scope> {
  private static final Logger logger = Logger.getLogger(ScopeProvider.class.getName());

  private static final String BUILTINS_RESOURCE = "python_builtins.txt";

  private static final ImmutableSet<String> DEFAULT_BUILTIN_NAMES = loadBuiltinNames();

  private static final ExpressionContextProvider EXPRESSION_CONTEXT =
      new ExpressionContextProvider();

  @Override
  public ImmutableSet<BaseMetadataProvider<?>> getDependencies() {
    return ImmutableSet.of(EXPRESSION_CONTEXT);
  }

  /** Returns the names that resolve to a {@link BuiltinAssignment} when the module binds none. */
  protected ImmutableSet<String> getBuiltinNames() {
    return DEFAULT_BUILTIN_NAMES;
  }

  @Override
  protected void computeMetadata(MetadataCollector<Scope> collector) {
    ScopeBuilder builder = new ScopeBuilder(collector, getBuiltinNames());
    NodeTraversal.traverse(collector.getRoot(), builder);
    builder.resolve();
  }

  private static ImmutableSet<String> loadBuiltinNames() {
    String text = ResourceLoader.loadTextResource(ScopeProvider.class, BUILTINS_RESOURCE);
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(text)) {
      if (!line.startsWith("#")) {
        names.add(line);
      }
    }
    return names.build();
  }

  /** A name bound in the scope it occurs in, not yet redirected by global or nonlocal. */
  private static final class PendingBinding {
    final String name;
    final Node node;
    final Scope scope;

    PendingBinding(String name, Node node, Scope scope) {
      this.name = name;
      this.node = node;
      this.scope = scope;
    }
  }

  /** A name read or deleted, not yet resolved. */
  private static final class PendingAccess {
    final Node node;
    final Scope scope;
    final ExpressionContext context;

    PendingAccess(Node node, Scope scope, ExpressionContext context) {
      this.node = node;
      this.scope = scope;
      this.context = context;
    }
  }

  /** Collects the scopes, bindings and accesses of one module. */
  private static final class ScopeBuilder implements ScopedCallback {
    private final MetadataCollector<Scope> collector;
    private final ImmutableSet<String> builtinNames;

    /**
     * The scopes nodes are currently evaluated in, innermost first. Besides the scopes opened by
     * the traversal, this holds the enclosing scope while traversing a child that is evaluated
     * outside of its scope, e.g. a parameter default.
     */
    private final Deque<Scope> scopes = new ArrayDeque<>();

    /** The ancestors of the current node, innermost first. */
    private final Deque<Node> ancestors = new ArrayDeque<>();

    /** The nodes for which an enclosing scope was pushed onto {@link #scopes}. */
    private final Deque<Node> evaluatedOutside = new ArrayDeque<>();

    private final List<PendingBinding> bindings = new ArrayList<>();
    private final List<PendingAccess> accesses = new ArrayList<>();
    private @Nullable Scope globalScope;

    ScopeBuilder(MetadataCollector<Scope> collector, ImmutableSet<String> builtinNames) {
      this.collector = collector;
      this.builtinNames = builtinNames;
    }

    @Override
    public void enterScope(NodeTraversal t) {
      Node root = t.getScopeRoot();
      if (scopes.isEmpty()) {
        globalScope = Scope.createGlobalScope(root, builtinNames);
        scopes.push(globalScope);
      } else {
        scopes.push(Scope.createChildScope(scopes.peek(), root));
      }
    }

    @Override
    public void exitScope(NodeTraversal t) {
      Scope scope = scopes.pop();
      checkState(scope.getRootNode() == t.getScopeRoot(), "Unbalanced scopes at %s", scope);
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      // The parent is on top of the ancestors.
      if (NodeUtil.isEvaluatedInEnclosingScope(n, parent, getGrandparent())) {
        scopes.push(scopes.peek().getParent());
        evaluatedOutside.push(n);
      }
      ancestors.push(n);

      Scope scope = scopes.peek();
      collector.setMetadata(n, scope);
      switch (n.getToken()) {
        case GLOBAL:
          for (Node name : n.children()) {
            scope.declareGlobal(name.getString());
          }
          break;
        case NONLOCAL:
          for (Node name : n.children()) {
            scope.declareNonlocal(name.getString());
          }
          break;
        case NAME:
          if (!NodeUtil.isDeclaredName(n, parent)) {
            recordName(n, scope);
          }
          break;
        case DOTTED_NAME:
          if (parent != null && parent.isImportAlias() && parent.getSecondChild().isEmpty()) {
            recordBinding(NodeUtil.getImportedName(parent), n, scope);
          }
          break;
        default:
          break;
      }
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      ancestors.pop();
      if (evaluatedOutside.peek() == n) {
        evaluatedOutside.pop();
        scopes.pop();
      }
    }

    private @Nullable Node getGrandparent() {
      if (ancestors.size() < 2) {
        return null;
      }
      Node parent = ancestors.pop();
      Node grandparent = ancestors.peek();
      ancestors.push(parent);
      return grandparent;
    }

    private void recordName(Node n, Scope scope) {
      ExpressionContext context = collector.getMetadata(EXPRESSION_CONTEXT, n);
      switch (context) {
        case STORE:
          recordBinding(n.getString(), n, scope);
          break;
        case LOAD:
        case DEL:
          accesses.add(new PendingAccess(n, scope, context));
          break;
      }
    }

    private void recordBinding(String name, Node n, Scope scope) {
      bindings.add(new PendingBinding(name, n, scope));
    }

    /**
     * Attaches the bindings to the scopes they belong to, then resolves the accesses. Runs after
     * the traversal, once every global and nonlocal statement is known.
     */
    void resolve() {
      checkState(scopes.isEmpty() && globalScope != null, "Traversal did not complete");
      for (PendingBinding binding : bindings) {
        Scope target = binding.scope.getBindingScope(binding.name);
        target.addAssignment(new Assignment(binding.name, target, binding.node));
      }
      int unresolved = 0;
      for (PendingAccess pending : accesses) {
        Access access =
            new Access(
                pending.node,
                pending.scope,
                pending.context,
                pending.scope.lookup(pending.node.getString()));
        pending.scope.addAccess(access);
        for (Assignment assignment : access.getReferents()) {
          assignment.addReference(access);
        }
        if (!access.isResolved()) {
          unresolved++;
        }
      }
      logger.fine(
          "Resolved "
              + accesses.size()
              + " accesses to "
              + bindings.size()
              + " bindings, "
              + unresolved
              + " unresolved");
    }
  }
}
