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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.pycst.syntax.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Scope contains information about a variable scope in Python. Scopes can be nested, a scope
 * points back to its parent scope. A Scope contains the assignments of the names bound in it and
 * the accesses occurring in it.
 *
 * <p>Two parents are tracked. The syntactic parent is the scope the scope root occurs in. The
 * lookup parent is the scope consulted when a name is not bound locally: it skips class scopes,
 * since the names bound in a class body are not visible to the functions, lambdas, classes and
 * comprehensions nested in it.
 *
 * <p>A scope is built by {@link ScopeProvider} and does not change after the provider finishes.
 *
 * @see ScopeProvider
 */
public final class Scope {

  private final ScopeKind kind;
  private final Node rootNode;
  private final @Nullable Scope parent;
  private final @Nullable Scope lookupParent;
  private final int depth;

  /** Only set on the global scope. */
  private final @Nullable ImmutableSet<String> builtinNames;

  private final Map<String, BuiltinAssignment> builtins = new LinkedHashMap<>();
  private final List<Scope> children = new ArrayList<>();
  private final ListMultimap<String, Assignment> assignments =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final ListMultimap<String, Access> accesses =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final Set<String> globalNames = new LinkedHashSet<>();
  private final Set<String> nonlocalNames = new LinkedHashSet<>();

  static Scope createGlobalScope(Node rootNode, ImmutableSet<String> builtinNames) {
    checkArgument(rootNode.isModule(), rootNode);
    return new Scope(rootNode, checkNotNull(builtinNames));
  }

  static Scope createChildScope(Scope parent, Node rootNode) {
    Scope scope = new Scope(parent, rootNode);
    parent.children.add(scope);
    return scope;
  }

  private Scope(Node rootNode, ImmutableSet<String> builtinNames) {
    this.kind = ScopeKind.GLOBAL;
    this.rootNode = rootNode;
    this.parent = null;
    this.lookupParent = null;
    this.depth = 0;
    this.builtinNames = builtinNames;
  }

  private Scope(Scope parent, Node rootNode) {
    this.kind = ScopeKind.forRoot(rootNode);
    checkArgument(kind != ScopeKind.GLOBAL, "Nested module: %s", rootNode);
    this.rootNode = rootNode;
    this.parent = checkNotNull(parent);
    this.lookupParent = getLookupParentFor(parent);
    this.depth = parent.depth + 1;
    this.builtinNames = null;
  }

  /** Returns the closest scope starting at {@code scope} whose names nested scopes can see. */
  private static Scope getLookupParentFor(Scope scope) {
    Scope s = scope;
    while (true) {
      switch (s.kind) {
        case CLASS:
          s = s.parent;
          break;
        case GLOBAL:
        case FUNCTION:
        case COMPREHENSION:
          return s;
      }
    }
  }

  public ScopeKind getKind() {
    return kind;
  }

  /**
   * Gets the container node of the scope: the MODULE, FUNCTION_DEF, LAMBDA, CLASS_DEF or
   * comprehension node.
   */
  public Node getRootNode() {
    return rootNode;
  }

  /** Returns the scope the root of this scope occurs in, or null for the global scope. */
  public @Nullable Scope getParent() {
    return parent;
  }

  /** Returns the next scope searched for a name not bound here, or null for the global scope. */
  public @Nullable Scope getLookupParent() {
    return lookupParent;
  }

  /** The depth of the scope. The global scope has depth 0. */
  public int getDepth() {
    return depth;
  }

  public boolean isGlobal() {
    return kind == ScopeKind.GLOBAL;
  }

  /** Walks up the tree to find the global scope. */
  public Scope getGlobalScope() {
    Scope result = this;
    while (result.parent != null) {
      result = result.parent;
    }
    return result;
  }

  /** Returns the scopes whose roots occur directly in this scope, in traversal order. */
  public ImmutableList<Scope> getChildScopes() {
    return ImmutableList.copyOf(children);
  }

  /** @return True if this scope contains {@code other}, or is the same scope as {@code other}. */
  public boolean contains(Scope other) {
    for (Scope s = checkNotNull(other); s != null; s = s.parent) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  /** Whether a {@code global} statement in this scope lists the name. */
  public boolean isGlobalName(String name) {
    return globalNames.contains(name);
  }

  /** Whether a {@code nonlocal} statement in this scope lists the name. */
  public boolean isNonlocalName(String name) {
    return nonlocalNames.contains(name);
  }

  /** Returns the assignments of the name in this scope, in traversal order. */
  public ImmutableList<Assignment> getAssignments(String name) {
    return ImmutableList.copyOf(assignments.get(name));
  }

  /** Returns every assignment of this scope, grouped by name. */
  public ImmutableList<Assignment> getAllAssignments() {
    return ImmutableList.copyOf(assignments.values());
  }

  /** Returns the names bound in this scope. */
  public ImmutableSet<String> getAssignedNames() {
    return ImmutableSet.copyOf(assignments.keySet());
  }

  /** Whether the name is bound in this scope, without looking at enclosing scopes. */
  public boolean hasAssignment(String name) {
    return assignments.containsKey(name);
  }

  /** Returns the accesses of the name occurring in this scope, in traversal order. */
  public ImmutableList<Access> getAccesses(String name) {
    return ImmutableList.copyOf(accesses.get(name));
  }

  /** Returns every access occurring in this scope, grouped by name. */
  public ImmutableList<Access> getAllAccesses() {
    return ImmutableList.copyOf(accesses.values());
  }

  /**
   * Returns the assignments an access to {@code name} in this scope may refer to.
   *
   * <p>A {@code global} or {@code nonlocal} statement for the name in this scope starts the search
   * in the declared scope. Otherwise the search starts here and follows the lookup parents. The
   * first scope binding the name provides all of its assignments. A name bound nowhere resolves to
   * its {@link BuiltinAssignment} if it is a builtin, or to nothing.
   */
  public ImmutableSet<Assignment> lookup(String name) {
    for (Scope s = getBindingScope(name); s != null; s = s.lookupParent) {
      List<Assignment> found = s.assignments.get(name);
      if (!found.isEmpty()) {
        return ImmutableSet.copyOf(found);
      }
    }
    BuiltinAssignment builtin = getGlobalScope().getBuiltin(name);
    return builtin == null ? ImmutableSet.of() : ImmutableSet.of(builtin);
  }

  /**
   * Returns the scope a binding of {@code name} in this scope belongs to: the global scope for a
   * {@code global} name, the closest enclosing function scope for a {@code nonlocal} name, this
   * scope otherwise.
   */
  Scope getBindingScope(String name) {
    if (globalNames.contains(name)) {
      return getGlobalScope();
    }
    if (nonlocalNames.contains(name)) {
      Scope target = getEnclosingFunctionScope();
      checkState(target != null, "No binding for nonlocal '%s' in %s", name, this);
      return target.getBindingScope(name);
    }
    return this;
  }

  /** Returns the closest function scope on the lookup chain, or null. */
  private @Nullable Scope getEnclosingFunctionScope() {
    for (Scope s = lookupParent; s != null; s = s.lookupParent) {
      switch (s.kind) {
        case FUNCTION:
          return s;
        case GLOBAL:
          return null;
        case CLASS:
        case COMPREHENSION:
          break;
      }
    }
    return null;
  }

  /** Records a {@code global} statement. It applies to the whole scope. */
  void declareGlobal(String name) {
    checkState(!nonlocalNames.contains(name), "'%s' is nonlocal and global", name);
    switch (kind) {
      case GLOBAL:
        // Module level names are global already.
        return;
      case CLASS:
      case FUNCTION:
        globalNames.add(name);
        return;
      case COMPREHENSION:
        throw new IllegalStateException("global statement in " + this);
    }
  }

  /** Records a {@code nonlocal} statement. It applies to the whole scope. */
  void declareNonlocal(String name) {
    checkState(!globalNames.contains(name), "'%s' is nonlocal and global", name);
    switch (kind) {
      case GLOBAL:
        throw new IllegalStateException(
            "nonlocal declaration not allowed at module level: " + name);
      case CLASS:
      case FUNCTION:
        checkState(
            getEnclosingFunctionScope() != null, "No binding for nonlocal '%s' in %s", name, this);
        nonlocalNames.add(name);
        return;
      case COMPREHENSION:
        throw new IllegalStateException("nonlocal statement in " + this);
    }
  }

  void addAssignment(Assignment assignment) {
    checkArgument(assignment.getScope() == this, assignment);
    assignments.put(assignment.getName(), assignment);
  }

  void addAccess(Access access) {
    checkArgument(access.getScope() == this, access);
    accesses.put(access.getName(), access);
  }

  /** Returns the shared builtin binding of {@code name}, or null if it is not a builtin. */
  private @Nullable BuiltinAssignment getBuiltin(String name) {
    checkState(isGlobal());
    if (!builtinNames.contains(name)) {
      return null;
    }
    return builtins.computeIfAbsent(name, n -> new BuiltinAssignment(n, this));
  }

  @Override
  public String toString() {
    return "Scope(" + kind + " @ " + rootNode + ")";
  }
}
