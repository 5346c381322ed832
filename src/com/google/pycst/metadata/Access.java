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
import com.google.pycst.syntax.Node;

/**
 * A read or a deletion of a name, with the bindings it may refer to.
 *
 * <p>The referents are every binding of the name in the first scope of the lookup chain that binds
 * it, since any of them may be the one in effect at runtime. An access to a builtin name resolves
 * to its {@link BuiltinAssignment}. An access that resolves to nothing has no referents; it is not
 * an error of the analysis, and clients decide how to report it.
 */
public final class Access {

  private final Node node;
  private final Scope scope;
  private final ExpressionContext context;
  private final ImmutableSet<Assignment> referents;

  Access(Node node, Scope scope, ExpressionContext context, ImmutableSet<Assignment> referents) {
    this.node = node;
    this.scope = scope;
    this.context = context;
    this.referents = referents;
  }

  /** Returns the NAME node. */
  public Node getNode() {
    return node;
  }

  public String getName() {
    return node.getString();
  }

  /** Returns the scope in which the access occurs. */
  public Scope getScope() {
    return scope;
  }

  /** Returns {@link ExpressionContext#LOAD} or {@link ExpressionContext#DEL}. */
  public ExpressionContext getContext() {
    return context;
  }

  public ImmutableSet<Assignment> getReferents() {
    return referents;
  }

  /** Whether the name is bound in the module or is a builtin. */
  public boolean isResolved() {
    return !referents.isEmpty();
  }

  @Override
  public String toString() {
    return "Access(" + node + " -> " + referents + ")";
  }
}
