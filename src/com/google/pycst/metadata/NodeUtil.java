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

import com.google.common.base.Splitter;
import com.google.pycst.syntax.Node;
import com.google.pycst.syntax.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether the node opens a new lexical scope. */
  public static boolean createsScope(Node n) {
    switch (n.getToken()) {
      case MODULE:
      case FUNCTION_DEF:
      case LAMBDA:
      case CLASS_DEF:
        return true;
      default:
        return isComprehension(n);
    }
  }

  /** Whether the node is a list, set or dict comprehension or a generator expression. */
  public static boolean isComprehension(Node n) {
    switch (n.getToken()) {
      case LIST_COMP:
      case SET_COMP:
      case GENERATOR_EXP:
      case DICT_COMP:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node is a FUNCTION_DEF or a LAMBDA. */
  public static boolean isFunctionLike(Node n) {
    return n.isFunctionDef() || n.isLambda();
  }

  /** Returns the index of the first COMP_FOR clause of a comprehension. */
  static int getFirstClauseIndex(Node comprehension) {
    checkArgument(isComprehension(comprehension), comprehension);
    return comprehension.getToken() == Token.DICT_COMP ? 2 : 1;
  }

  /**
   * Whether {@code n} is evaluated in the scope enclosing the scope that {@link NodeTraversal}
   * reports for it: the annotation and default of a parameter, the return annotation of a
   * function, and the iterable of the first for clause of a comprehension.
   *
   * @param grandparent the parent of {@code parent}, needed to recognize the first for clause
   */
  public static boolean isEvaluatedInEnclosingScope(
      Node n, @Nullable Node parent, @Nullable Node grandparent) {
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case PARAM:
        return n != parent.getFirstChild();
      case FUNCTION_DEF:
        return n == parent.getChildAtIndex(3);
      case COMP_FOR:
        return n == parent.getSecondChild()
            && grandparent != null
            && isComprehension(grandparent)
            && grandparent.getChildAtIndex(getFirstClauseIndex(grandparent)) == parent;
      default:
        return false;
    }
  }

  /** Whether the node is one of the names listed by a {@code global} or {@code nonlocal}. */
  static boolean isDeclaredName(Node n, @Nullable Node parent) {
    return n.isName() && parent != null && (parent.isGlobal() || parent.isNonlocal());
  }

  /**
   * Returns the name bound by an import: the as-name if present, otherwise the first segment of
   * the dotted name, so that {@code import os.path} binds {@code os}.
   */
  static String getImportedName(Node importAlias) {
    checkArgument(importAlias.isImportAlias(), importAlias);
    Node asName = importAlias.getSecondChild();
    if (asName.isName()) {
      return asName.getString();
    }
    return Splitter.on('.').split(importAlias.getFirstChild().getString()).iterator().next();
  }
}
