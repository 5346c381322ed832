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

package com.google.pycst.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An immutable node of a Python syntax tree.
 *
 * <p>Nodes do not know their parent, so a subtree can be reused while building a larger tree.
 * Identity is object identity: {@code Node} does not override {@link #equals} or
 * {@link #hashCode}, and analyses store the facts they derive in maps keyed by node instead of
 * on the node itself.
 */
public final class Node {

  private final Token token;
  private final @Nullable String string;
  private final ImmutableList<Node> children;

  /** 1-based line of the first character of the node, or -1 when unknown. */
  private final int lineno;

  /** 0-based column of the first character of the node, or -1 when unknown. */
  private final int charno;

  public Node(Token token) {
    this(token, null, ImmutableList.of(), -1, -1);
  }

  public Node(Token token, Node... children) {
    this(token, null, ImmutableList.copyOf(children), -1, -1);
  }

  public Node(Token token, List<Node> children) {
    this(token, null, ImmutableList.copyOf(children), -1, -1);
  }

  private Node(
      Token token, @Nullable String string, ImmutableList<Node> children, int lineno, int charno) {
    this.token = checkNotNull(token);
    this.string = string;
    this.children = children;
    this.lineno = lineno;
    this.charno = charno;
  }

  public static Node newString(Token token, String str) {
    return new Node(token, checkNotNull(str), ImmutableList.of(), -1, -1);
  }

  public static Node newString(Token token, String str, Node... children) {
    return new Node(token, checkNotNull(str), ImmutableList.copyOf(children), -1, -1);
  }

  /** Creates a node whose string payload is optional, e.g. an ARG without a keyword. */
  static Node newOptionalString(Token token, @Nullable String str, Node... children) {
    return new Node(token, str, ImmutableList.copyOf(children), -1, -1);
  }

  /**
   * Returns a copy of this node carrying the given source position. The children are shared with
   * this node.
   */
  @CheckReturnValue
  public Node atPosition(int lineno, int charno) {
    checkArgument(lineno > 0, "line numbers are 1-based: %s", lineno);
    checkArgument(charno >= 0, "columns are 0-based: %s", charno);
    return new Node(token, string, children, lineno, charno);
  }

  public Token getToken() {
    return token;
  }

  /** Returns the string payload: an identifier, attribute name, literal text or operator. */
  public String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public boolean hasString() {
    return string != null;
  }

  public @Nullable String getOptionalString() {
    return string;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /** Returns the position of {@code child} among this node's children, or -1. */
  public int getIndexOfChild(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  public boolean isModule() {
    return token == Token.MODULE;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isFunctionDef() {
    return token == Token.FUNCTION_DEF;
  }

  public boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isParam() {
    return token == Token.PARAM;
  }

  public boolean isClassDef() {
    return token == Token.CLASS_DEF;
  }

  public boolean isDecoratorList() {
    return token == Token.DECORATOR_LIST;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isExceptHandler() {
    return token == Token.EXCEPT_HANDLER;
  }

  public boolean isWithItem() {
    return token == Token.WITH_ITEM;
  }

  public boolean isImportAlias() {
    return token == Token.IMPORT_ALIAS;
  }

  public boolean isImportStar() {
    return token == Token.IMPORT_STAR;
  }

  public boolean isDottedName() {
    return token == Token.DOTTED_NAME;
  }

  public boolean isGlobal() {
    return token == Token.GLOBAL;
  }

  public boolean isNonlocal() {
    return token == Token.NONLOCAL;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isAttribute() {
    return token == Token.ATTRIBUTE;
  }

  public boolean isSubscript() {
    return token == Token.SUBSCRIPT;
  }

  public boolean isStarred() {
    return token == Token.STARRED;
  }

  public boolean isTuple() {
    return token == Token.TUPLE;
  }

  public boolean isList() {
    return token == Token.LIST;
  }

  public boolean isArgList() {
    return token == Token.ARG_LIST;
  }

  public boolean isCompFor() {
    return token == Token.COMP_FOR;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ');
      sb.append(string);
    }
    if (lineno != -1) {
      sb.append(' ');
      sb.append(lineno);
      sb.append(':');
      sb.append(charno);
    }
    return sb.toString();
  }

  @CheckReturnValue
  public String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node child : n.children) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
