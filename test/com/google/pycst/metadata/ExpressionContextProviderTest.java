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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.pycst.syntax.IR;
import com.google.pycst.syntax.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ExpressionContextProvider}. */
@RunWith(JUnit4.class)
public final class ExpressionContextProviderTest {

  private static ImmutableMap<Node, ExpressionContext> resolve(Node... statements) {
    return new MetadataWrapper(IR.module(statements)).resolve(new ExpressionContextProvider());
  }

  @Test
  public void testAssignment() {
    // a = b = c
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(IR.assign(ImmutableList.of(a, b), c));

    assertThat(contexts).containsEntry(a, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(b, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(c, ExpressionContext.LOAD);
  }

  @Test
  public void testUnpackingPropagatesStore() {
    // (a, [b, *c]) = d
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node starred = IR.starred(c);
    Node list = IR.list(b, starred);
    Node tuple = IR.tuple(a, list);
    ImmutableMap<Node, ExpressionContext> contexts = resolve(IR.assign(tuple, IR.name("d")));

    assertThat(contexts).containsEntry(tuple, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(list, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(starred, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(a, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(b, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(c, ExpressionContext.STORE);
  }

  @Test
  public void testAttributeAndSubscriptTargets() {
    // a.x = b[i] = 0
    Node a = IR.name("a");
    Node attribute = IR.attribute(a, "x");
    Node b = IR.name("b");
    Node i = IR.name("i");
    Node subscript = IR.subscript(b, i);
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(IR.assign(ImmutableList.of(attribute, subscript), IR.number(0)));

    assertThat(contexts).containsEntry(attribute, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(subscript, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(a, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(b, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(i, ExpressionContext.LOAD);
  }

  @Test
  public void testAugmentedAssignmentIsStore() {
    Node a = IR.name("a");
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(IR.augAssign(a, "+=", IR.number(1)));

    assertThat(contexts).containsEntry(a, ExpressionContext.STORE);
  }

  @Test
  public void testDel() {
    // del a, b.c
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node attribute = IR.attribute(b, "c");
    ImmutableMap<Node, ExpressionContext> contexts = resolve(IR.del(a, attribute));

    assertThat(contexts).containsEntry(a, ExpressionContext.DEL);
    assertThat(contexts).containsEntry(attribute, ExpressionContext.DEL);
    assertThat(contexts).containsEntry(b, ExpressionContext.LOAD);
  }

  @Test
  public void testBindingPositions() {
    // for x in xs:
    //   with open() as f:
    //     try: pass
    //     except E as e: pass
    Node x = IR.name("x");
    Node xs = IR.name("xs");
    Node f = IR.name("f");
    Node e = IR.name("e");
    Node type = IR.name("E");
    Node handler = IR.exceptHandler(type, e, IR.block(IR.pass()));
    Node loop =
        IR.forIn(
            x,
            xs,
            IR.block(
                IR.with(
                    ImmutableList.of(IR.withItem(IR.call(IR.name("open")), f)),
                    IR.block(
                        IR.tryStatement(
                            IR.block(IR.pass()),
                            ImmutableList.of(handler),
                            IR.empty(),
                            IR.empty())))));
    ImmutableMap<Node, ExpressionContext> contexts = resolve(loop);

    assertThat(contexts).containsEntry(x, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(xs, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(f, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(e, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(type, ExpressionContext.LOAD);
  }

  @Test
  public void testDefinitions() {
    // @deco
    // def f(p: T = d) -> R: pass
    // class C(B): pass
    Node deco = IR.name("deco");
    Node f = IR.name("f");
    Node p = IR.name("p");
    Node annotation = IR.name("T");
    Node defaultValue = IR.name("d");
    Node returns = IR.name("R");
    Node c = IR.name("C");
    Node base = IR.name("B");
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(
            IR.function(
                IR.decorators(deco),
                f,
                IR.paramList(IR.param(p, annotation, defaultValue)),
                returns,
                IR.block(IR.pass())),
            IR.classDef(IR.decorators(), c, IR.argList(base), IR.block(IR.pass())));

    assertThat(contexts).containsEntry(deco, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(f, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(p, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(annotation, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(defaultValue, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(returns, ExpressionContext.LOAD);
    assertThat(contexts).containsEntry(c, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(base, ExpressionContext.LOAD);
  }

  @Test
  public void testComprehensionTarget() {
    Node target = IR.name("y");
    Node element = IR.name("y");
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(
            IR.exprStatement(IR.listComp(element, IR.compFor(target, IR.name("ys")))));

    assertThat(contexts).containsEntry(target, ExpressionContext.STORE);
    assertThat(contexts).containsEntry(element, ExpressionContext.LOAD);
  }

  @Test
  public void testImports() {
    // import os.path, numpy as np
    Node plain = IR.importAlias("os.path");
    Node asName = IR.name("np");
    Node aliased = IR.importAlias("numpy", asName);
    ImmutableMap<Node, ExpressionContext> contexts = resolve(IR.importNode(plain, aliased));

    assertThat(contexts).containsEntry(plain.getFirstChild(), ExpressionContext.STORE);
    assertThat(contexts).containsEntry(asName, ExpressionContext.STORE);
    assertThat(contexts).doesNotContainKey(aliased.getFirstChild());
  }

  @Test
  public void testDeclaredNamesHaveNoContext() {
    Node global = IR.global("a", "b");
    ImmutableMap<Node, ExpressionContext> contexts = resolve(global);

    assertThat(contexts).doesNotContainKey(global.getFirstChild());
    assertThat(contexts).doesNotContainKey(global.getSecondChild());
  }

  @Test
  public void testOtherNodesHaveNoContext() {
    Node call = IR.call(IR.name("f"));
    Node number = IR.number(1);
    ImmutableMap<Node, ExpressionContext> contexts =
        resolve(IR.exprStatement(call), IR.exprStatement(number));

    assertThat(contexts).doesNotContainKey(call);
    assertThat(contexts).doesNotContainKey(number);
  }
}
