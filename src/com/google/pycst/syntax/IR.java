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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>Optional children are represented by {@link Token#EMPTY} nodes so that every node kind has a
 * fixed child layout.
 */
public class IR {

  private static final ImmutableSet<Token> EXPRESSIONS =
      ImmutableSet.of(
          Token.NAME,
          Token.ATTRIBUTE,
          Token.SUBSCRIPT,
          Token.STARRED,
          Token.TUPLE,
          Token.LIST,
          Token.SET,
          Token.DICT,
          Token.CALL,
          Token.BIN_OP,
          Token.BOOL_OP,
          Token.UNARY_OP,
          Token.COMPARE,
          Token.IF_EXP,
          Token.LAMBDA,
          Token.YIELD,
          Token.AWAIT,
          Token.NUMBER,
          Token.STRING,
          Token.ELLIPSIS,
          Token.LIST_COMP,
          Token.SET_COMP,
          Token.GENERATOR_EXP,
          Token.DICT_COMP);

  private static final ImmutableSet<Token> STATEMENTS =
      ImmutableSet.of(
          Token.FUNCTION_DEF,
          Token.CLASS_DEF,
          Token.ASSIGN,
          Token.AUG_ASSIGN,
          Token.ANN_ASSIGN,
          Token.FOR,
          Token.WHILE,
          Token.IF,
          Token.TRY,
          Token.WITH,
          Token.IMPORT,
          Token.IMPORT_FROM,
          Token.DEL,
          Token.GLOBAL,
          Token.NONLOCAL,
          Token.RETURN,
          Token.RAISE,
          Token.EXPR_STMT,
          Token.PASS,
          Token.BREAK,
          Token.CONTINUE);

  private static final ImmutableSet<Token> TARGETS =
      ImmutableSet.of(
          Token.NAME, Token.ATTRIBUTE, Token.SUBSCRIPT, Token.STARRED, Token.TUPLE, Token.LIST);

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  /** MODULE(stmt*) */
  public static Node module(Node... stmts) {
    return module(ImmutableList.copyOf(stmts));
  }

  public static Node module(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Module cannot contain %s", stmt.getToken());
    }
    return new Node(Token.MODULE, stmts);
  }

  /** BLOCK(stmt*) */
  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
    }
    return new Node(Token.BLOCK, stmts);
  }

  // Definitions

  /** FUNCTION_DEF(DECORATOR_LIST, NAME, PARAM_LIST, returns|EMPTY, BLOCK) */
  public static Node function(Node name, Node params, Node body) {
    return function(decorators(), name, params, empty(), body);
  }

  public static Node function(
      Node decorators, Node name, Node params, Node returns, Node body) {
    checkState(decorators.isDecoratorList(), decorators);
    checkState(name.isName(), name);
    checkState(params.isParamList(), params);
    checkState(returns.isEmpty() || mayBeExpression(returns), returns);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION_DEF, decorators, name, params, returns, body);
  }

  /** LAMBDA(PARAM_LIST, expr) */
  public static Node lambda(Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(mayBeExpression(body), body);
    return new Node(Token.LAMBDA, params, body);
  }

  /** PARAM_LIST(PARAM*) */
  public static Node paramList(Node... params) {
    for (Node param : params) {
      checkState(param.isParam(), param);
    }
    return new Node(Token.PARAM_LIST, params);
  }

  /** PARAM(NAME, EMPTY, EMPTY) */
  public static Node param(String name) {
    return param(name(name), empty(), empty());
  }

  /** PARAM(NAME, EMPTY, default) */
  public static Node paramWithDefault(String name, Node defaultValue) {
    return param(name(name), empty(), defaultValue);
  }

  /** PARAM(NAME, annotation|EMPTY, default|EMPTY) */
  public static Node param(Node name, Node annotation, Node defaultValue) {
    return starParam("", name, annotation, defaultValue);
  }

  /** A parameter whose star kind is {@code ""}, {@code "*"} or {@code "**"}. */
  public static Node starParam(String star, Node name, Node annotation, Node defaultValue) {
    checkArgument(star.isEmpty() || star.equals("*") || star.equals("**"), star);
    checkState(name.isName(), name);
    checkState(annotation.isEmpty() || mayBeExpression(annotation), annotation);
    checkState(defaultValue.isEmpty() || mayBeExpression(defaultValue), defaultValue);
    checkState(star.isEmpty() || defaultValue.isEmpty(), "star parameters take no default");
    return Node.newString(Token.PARAM, star, name, annotation, defaultValue);
  }

  /** CLASS_DEF(DECORATOR_LIST, NAME, ARG_LIST, BLOCK) */
  public static Node classDef(Node name, Node body) {
    return classDef(decorators(), name, argList(), body);
  }

  public static Node classDef(Node decorators, Node name, Node bases, Node body) {
    checkState(decorators.isDecoratorList(), decorators);
    checkState(name.isName(), name);
    checkState(bases.isArgList(), bases);
    checkState(body.isBlock(), body);
    return new Node(Token.CLASS_DEF, decorators, name, bases, body);
  }

  /** DECORATOR_LIST(DECORATOR*), each decorator wrapping one expression. */
  public static Node decorators(Node... expressions) {
    ImmutableList.Builder<Node> decorators = ImmutableList.builder();
    for (Node expr : expressions) {
      checkState(mayBeExpression(expr), expr);
      decorators.add(new Node(Token.DECORATOR, expr));
    }
    return new Node(Token.DECORATOR_LIST, decorators.build());
  }

  // Statements

  /** ASSIGN(target+, value) for {@code t1 = t2 = value}. */
  public static Node assign(Node target, Node value) {
    return assign(ImmutableList.of(target), value);
  }

  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty(), "an assignment needs a target");
    for (Node target : targets) {
      checkState(mayBeTarget(target), target);
    }
    checkState(mayBeExpression(value), value);
    return new Node(
        Token.ASSIGN, ImmutableList.<Node>builder().addAll(targets).add(value).build());
  }

  /** AUG_ASSIGN(target, value), the operator as payload, e.g. {@code "+="}. */
  public static Node augAssign(Node target, String operator, Node value) {
    checkState(mayBeTarget(target), target);
    checkState(mayBeExpression(value), value);
    return Node.newString(Token.AUG_ASSIGN, operator, target, value);
  }

  /** ANN_ASSIGN(target, annotation, value|EMPTY) */
  public static Node annAssign(Node target, Node annotation, Node value) {
    checkState(mayBeTarget(target), target);
    checkState(mayBeExpression(annotation), annotation);
    checkState(value.isEmpty() || mayBeExpression(value), value);
    return new Node(Token.ANN_ASSIGN, target, annotation, value);
  }

  /** FOR(target, iter, BLOCK, EMPTY) */
  public static Node forIn(Node target, Node iter, Node body) {
    return forIn(target, iter, body, empty());
  }

  /** FOR(target, iter, BLOCK, BLOCK|EMPTY) */
  public static Node forIn(Node target, Node iter, Node body, Node orElse) {
    checkState(mayBeTarget(target), target);
    checkState(mayBeExpression(iter), iter);
    checkState(body.isBlock(), body);
    checkState(orElse.isEmpty() || orElse.isBlock(), orElse);
    return new Node(Token.FOR, target, iter, body, orElse);
  }

  /** WHILE(test, BLOCK, BLOCK|EMPTY) */
  public static Node whileLoop(Node test, Node body, Node orElse) {
    checkState(mayBeExpression(test), test);
    checkState(body.isBlock(), body);
    checkState(orElse.isEmpty() || orElse.isBlock(), orElse);
    return new Node(Token.WHILE, test, body, orElse);
  }

  public static Node ifStatement(Node test, Node body) {
    return ifStatement(test, body, empty());
  }

  /** IF(test, BLOCK, BLOCK|IF|EMPTY); an IF in the last position is an {@code elif}. */
  public static Node ifStatement(Node test, Node body, Node orElse) {
    checkState(mayBeExpression(test), test);
    checkState(body.isBlock(), body);
    checkState(orElse.isEmpty() || orElse.isBlock() || orElse.isIf(), orElse);
    return new Node(Token.IF, test, body, orElse);
  }

  /** TRY(BLOCK, EXCEPT_HANDLER*, BLOCK|EMPTY, BLOCK|EMPTY) */
  public static Node tryStatement(
      Node body, List<Node> handlers, Node orElse, Node finalBody) {
    checkState(body.isBlock(), body);
    for (Node handler : handlers) {
      checkState(handler.isExceptHandler(), handler);
    }
    checkState(orElse.isEmpty() || orElse.isBlock(), orElse);
    checkState(finalBody.isEmpty() || finalBody.isBlock(), finalBody);
    checkState(
        !handlers.isEmpty() || !finalBody.isEmpty(), "try needs a handler or a finally block");
    return new Node(
        Token.TRY,
        ImmutableList.<Node>builder().add(body).addAll(handlers).add(orElse, finalBody).build());
  }

  /** EXCEPT_HANDLER(type|EMPTY, NAME|EMPTY, BLOCK) */
  public static Node exceptHandler(Node type, Node name, Node body) {
    checkState(type.isEmpty() || mayBeExpression(type), type);
    checkState(name.isEmpty() || name.isName(), name);
    checkState(!name.isName() || !type.isEmpty(), "a bare except cannot bind a name");
    checkState(body.isBlock(), body);
    return new Node(Token.EXCEPT_HANDLER, type, name, body);
  }

  /** WITH(WITH_ITEM+, BLOCK) */
  public static Node with(List<Node> items, Node body) {
    checkArgument(!items.isEmpty(), "with needs an item");
    for (Node item : items) {
      checkState(item.isWithItem(), item);
    }
    checkState(body.isBlock(), body);
    return new Node(Token.WITH, ImmutableList.<Node>builder().addAll(items).add(body).build());
  }

  /** WITH_ITEM(expr, target|EMPTY) */
  public static Node withItem(Node expr, Node target) {
    checkState(mayBeExpression(expr), expr);
    checkState(target.isEmpty() || mayBeTarget(target), target);
    return new Node(Token.WITH_ITEM, expr, target);
  }

  /** IMPORT(IMPORT_ALIAS+) */
  public static Node importNode(Node... aliases) {
    checkArgument(aliases.length > 0, "import needs a name");
    for (Node alias : aliases) {
      checkState(alias.isImportAlias(), alias);
    }
    return new Node(Token.IMPORT, aliases);
  }

  /**
   * IMPORT_FROM(IMPORT_ALIAS+ | IMPORT_STAR), the module as payload including the leading dots of
   * a relative import.
   */
  public static Node importFrom(String module, Node... aliases) {
    checkArgument(aliases.length > 0, "from-import needs a name");
    for (Node alias : aliases) {
      checkState(alias.isImportAlias() || (alias.isImportStar() && aliases.length == 1), alias);
    }
    return Node.newString(Token.IMPORT_FROM, module, aliases);
  }

  public static Node importStar() {
    return new Node(Token.IMPORT_STAR);
  }

  /** IMPORT_ALIAS(DOTTED_NAME, EMPTY) */
  public static Node importAlias(String dottedName) {
    return importAlias(dottedName, empty());
  }

  /** IMPORT_ALIAS(DOTTED_NAME, NAME|EMPTY) */
  public static Node importAlias(String dottedName, Node asName) {
    checkState(asName.isEmpty() || asName.isName(), asName);
    return new Node(Token.IMPORT_ALIAS, dottedName(dottedName), asName);
  }

  public static Node dottedName(String dottedName) {
    for (String segment : Splitter.on('.').split(dottedName)) {
      checkArgument(!segment.isEmpty(), "invalid dotted name: %s", dottedName);
    }
    return Node.newString(Token.DOTTED_NAME, dottedName);
  }

  /** DEL(target+) */
  public static Node del(Node... targets) {
    checkArgument(targets.length > 0, "del needs a target");
    for (Node target : targets) {
      checkState(mayBeTarget(target) && !target.isStarred(), target);
    }
    return new Node(Token.DEL, targets);
  }

  /** GLOBAL(NAME+) */
  public static Node global(String... names) {
    return new Node(Token.GLOBAL, names(names));
  }

  /** NONLOCAL(NAME+) */
  public static Node nonlocal(String... names) {
    return new Node(Token.NONLOCAL, names(names));
  }

  private static ImmutableList<Node> names(String... names) {
    checkArgument(names.length > 0, "declaration needs a name");
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (String name : names) {
      nodes.add(name(name));
    }
    return nodes.build();
  }

  public static Node returnNode() {
    return new Node(Token.RETURN, empty());
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  /** RAISE(exc|EMPTY, cause|EMPTY) */
  public static Node raise(Node exception, Node cause) {
    checkState(exception.isEmpty() || mayBeExpression(exception), exception);
    checkState(cause.isEmpty() || mayBeExpression(cause), cause);
    checkState(cause.isEmpty() || !exception.isEmpty(), "raise from needs an exception");
    return new Node(Token.RAISE, exception, cause);
  }

  public static Node exprStatement(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_STMT, expr);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  // Expressions

  public static Node name(String name) {
    checkArgument(!name.isEmpty() && name.indexOf('.') == -1, "invalid identifier: %s", name);
    return Node.newString(Token.NAME, name);
  }

  /** ATTRIBUTE(value), the attribute name as payload. */
  public static Node attribute(Node value, String attribute) {
    checkState(mayBeExpression(value), value);
    return Node.newString(Token.ATTRIBUTE, attribute, value);
  }

  /** SUBSCRIPT(value, index) */
  public static Node subscript(Node value, Node index) {
    checkState(mayBeExpression(value), value);
    checkState(mayBeExpression(index), index);
    return new Node(Token.SUBSCRIPT, value, index);
  }

  /** STARRED(value) */
  public static Node starred(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.STARRED, value);
  }

  public static Node tuple(Node... elements) {
    return new Node(Token.TUPLE, expressions(elements));
  }

  public static Node list(Node... elements) {
    return new Node(Token.LIST, expressions(elements));
  }

  public static Node set(Node... elements) {
    checkArgument(elements.length > 0, "{} is a dict");
    return new Node(Token.SET, expressions(elements));
  }

  /** DICT(DICT_ENTRY*) */
  public static Node dict(Node... entries) {
    for (Node entry : entries) {
      checkState(entry.getToken() == Token.DICT_ENTRY, entry);
    }
    return new Node(Token.DICT, entries);
  }

  /** DICT_ENTRY(key, value) */
  public static Node dictEntry(Node key, Node value) {
    checkState(mayBeExpression(key), key);
    checkState(mayBeExpression(value), value);
    return new Node(Token.DICT_ENTRY, key, value);
  }

  /**
   * CALL(func, ARG_LIST). Each argument that is not already an ARG is wrapped in a positional
   * ARG.
   */
  public static Node call(Node callee, Node... args) {
    checkState(mayBeExpression(callee), callee);
    return new Node(Token.CALL, callee, argList(args));
  }

  /** ARG_LIST(ARG*), e.g. the bases of a class. */
  public static Node argList(Node... args) {
    ImmutableList.Builder<Node> argNodes = ImmutableList.builder();
    for (Node arg : args) {
      argNodes.add(arg.getToken() == Token.ARG ? arg : arg(null, arg));
    }
    return new Node(Token.ARG_LIST, argNodes.build());
  }

  /** ARG(value), the keyword as payload when there is one. */
  public static Node arg(@Nullable String keyword, Node value) {
    checkState(mayBeExpression(value), value);
    return Node.newOptionalString(Token.ARG, keyword, value);
  }

  public static Node binOp(Node left, String operator, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return Node.newString(Token.BIN_OP, operator, left, right);
  }

  public static Node boolOp(String operator, Node... values) {
    checkArgument(values.length >= 2, "a boolean operation needs two operands");
    return Node.newString(Token.BOOL_OP, operator, expressions(values).toArray(new Node[0]));
  }

  public static Node unaryOp(String operator, Node operand) {
    checkState(mayBeExpression(operand), operand);
    return Node.newString(Token.UNARY_OP, operator, operand);
  }

  /** COMPARE(left, comparator+), the operators space separated as payload. */
  public static Node compare(Node left, String operators, Node... comparators) {
    checkArgument(comparators.length > 0, "a comparison needs a comparator");
    return Node.newString(
        Token.COMPARE,
        operators,
        ImmutableList.<Node>builder()
            .add(left)
            .addAll(expressions(comparators))
            .build()
            .toArray(new Node[0]));
  }

  /** IF_EXP(test, body, orelse) for {@code body if test else orelse}. */
  public static Node ifExp(Node test, Node body, Node orElse) {
    checkState(mayBeExpression(test), test);
    checkState(mayBeExpression(body), body);
    checkState(mayBeExpression(orElse), orElse);
    return new Node(Token.IF_EXP, test, body, orElse);
  }

  public static Node yield(Node value) {
    checkState(value.isEmpty() || mayBeExpression(value), value);
    return new Node(Token.YIELD, value);
  }

  public static Node await(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.AWAIT, value);
  }

  public static Node number(String text) {
    return Node.newString(Token.NUMBER, text);
  }

  public static Node number(int value) {
    return number(String.valueOf(value));
  }

  public static Node string(String text) {
    return Node.newString(Token.STRING, text);
  }

  public static Node ellipsis() {
    return new Node(Token.ELLIPSIS);
  }

  // Comprehensions

  /** LIST_COMP(elt, COMP_FOR+) */
  public static Node listComp(Node element, Node... clauses) {
    return comprehension(Token.LIST_COMP, ImmutableList.of(element), clauses);
  }

  /** SET_COMP(elt, COMP_FOR+) */
  public static Node setComp(Node element, Node... clauses) {
    return comprehension(Token.SET_COMP, ImmutableList.of(element), clauses);
  }

  /** GENERATOR_EXP(elt, COMP_FOR+) */
  public static Node generatorExp(Node element, Node... clauses) {
    return comprehension(Token.GENERATOR_EXP, ImmutableList.of(element), clauses);
  }

  /** DICT_COMP(key, value, COMP_FOR+) */
  public static Node dictComp(Node key, Node value, Node... clauses) {
    return comprehension(Token.DICT_COMP, ImmutableList.of(key, value), clauses);
  }

  private static Node comprehension(Token token, List<Node> elements, Node... clauses) {
    checkArgument(clauses.length > 0, "a comprehension needs a for clause");
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
    }
    for (Node clause : clauses) {
      checkState(clause.isCompFor(), clause);
    }
    return new Node(
        token, ImmutableList.<Node>builder().addAll(elements).add(clauses).build());
  }

  /** COMP_FOR(target, iter, condition*) */
  public static Node compFor(Node target, Node iter, Node... conditions) {
    checkState(mayBeTarget(target), target);
    checkState(mayBeExpression(iter), iter);
    return new Node(
        Token.COMP_FOR,
        ImmutableList.<Node>builder()
            .add(target, iter)
            .addAll(expressions(conditions))
            .build());
  }

  private static ImmutableList<Node> expressions(Node... nodes) {
    for (Node n : nodes) {
      checkState(mayBeExpression(n), n);
    }
    return ImmutableList.copyOf(nodes);
  }

  static boolean mayBeStatement(Node n) {
    return STATEMENTS.contains(n.getToken());
  }

  static boolean mayBeExpression(Node n) {
    return EXPRESSIONS.contains(n.getToken());
  }

  static boolean mayBeTarget(Node n) {
    return TARGETS.contains(n.getToken());
  }
}
