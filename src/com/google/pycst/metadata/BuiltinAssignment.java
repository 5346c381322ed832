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

/**
 * The binding of a name that is not bound anywhere in the module but is provided by the
 * interpreter, e.g. {@code print} or {@code None}. It has no node and belongs to the global scope.
 * Each builtin name has one instance per analyzed tree.
 */
public final class BuiltinAssignment extends Assignment {

  BuiltinAssignment(String name, Scope globalScope) {
    super(name, globalScope, null);
  }

  @Override
  public boolean isBuiltin() {
    return true;
  }

  @Override
  public String toString() {
    return "BuiltinAssignment(" + getName() + ")";
  }
}
