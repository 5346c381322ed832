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

import com.google.pycst.syntax.Node;

/** The kinds of Python scopes. */
public enum ScopeKind {
  /** The module. */
  GLOBAL,
  /** A class body. Its names are not visible to the scopes nested inside it. */
  CLASS,
  /** A function or lambda. */
  FUNCTION,
  /** A comprehension or generator expression. */
  COMPREHENSION;

  /** Returns the kind of scope opened by a scope root. */
  static ScopeKind forRoot(Node root) {
    switch (root.getToken()) {
      case MODULE:
        return GLOBAL;
      case CLASS_DEF:
        return CLASS;
      case FUNCTION_DEF:
      case LAMBDA:
        return FUNCTION;
      case LIST_COMP:
      case SET_COMP:
      case GENERATOR_EXP:
      case DICT_COMP:
        return COMPREHENSION;
      default:
        throw new IllegalArgumentException("Not a scope root: " + root);
    }
  }
}
