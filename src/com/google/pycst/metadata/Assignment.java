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

import com.google.common.collect.ImmutableList;
import com.google.pycst.syntax.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One place where a name is bound in a scope: an assignment target, a definition, a parameter, an
 * import, a loop or with or except target.
 */
public class Assignment {

  private final String name;
  private final Scope scope;
  private final @Nullable Node node;

  /** The accesses resolving to this assignment, in traversal order. */
  private final List<Access> references = new ArrayList<>();

  Assignment(String name, Scope scope, @Nullable Node node) {
    this.name = name;
    this.scope = scope;
    this.node = node;
  }

  public String getName() {
    return name;
  }

  /** Returns the scope the name is bound in. */
  public Scope getScope() {
    return scope;
  }

  /** Returns the binding node, or null for a {@link BuiltinAssignment}. */
  public @Nullable Node getNode() {
    return node;
  }

  public boolean isBuiltin() {
    return false;
  }

  /** Returns every access that may read or delete this binding. */
  public ImmutableList<Access> getReferences() {
    return ImmutableList.copyOf(references);
  }

  void addReference(Access access) {
    references.add(access);
  }

  @Override
  public String toString() {
    return "Assignment(" + name + " @ " + node + ")";
  }
}
