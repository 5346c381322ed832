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

package com.google.pycst.check;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pycst.metadata.MetadataWrapper;
import com.google.pycst.metadata.ScopeProvider;
import com.google.pycst.syntax.IR;
import com.google.pycst.syntax.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link UnresolvedNameCheck}. */
@RunWith(JUnit4.class)
public final class UnresolvedNameCheckTest {

  // import os
  // def f(a):
  //   return a + b + os.sep + len(c)
  // del d
  private Node b;
  private Node c;
  private Node d;

  private Node createModule() {
    b = IR.name("b").atPosition(3, 13);
    c = IR.name("c").atPosition(3, 30);
    d = IR.name("d").atPosition(4, 4);
    Node sum =
        IR.binOp(
            IR.binOp(IR.binOp(IR.name("a"), "+", b), "+", IR.attribute(IR.name("os"), "sep")),
            "+",
            IR.call(IR.name("len"), c));
    return IR.module(
        IR.importNode(IR.importAlias("os")),
        IR.function(IR.name("f"), IR.paramList(IR.param("a")), IR.block(IR.returnNode(sum))),
        IR.del(d));
  }

  @Test
  public void testReportsUndefinedNamesInOrder() {
    ImmutableList<AnalysisError> errors =
        new UnresolvedNameCheck().check(new MetadataWrapper(createModule()));

    assertThat(errors).hasSize(3);
    assertThat(errors.get(0).node()).isSameInstanceAs(b);
    assertThat(errors.get(1).node()).isSameInstanceAs(c);
    assertThat(errors.get(2).node()).isSameInstanceAs(d);
    AnalysisError first = errors.get(0);
    assertThat(first.type()).isEqualTo(UnresolvedNameCheck.UNDEFINED_NAME);
    assertThat(first.level()).isEqualTo(CheckLevel.WARNING);
    assertThat(first.description()).isEqualTo("Name 'b' is not defined");
    assertThat(first.getLineno()).isEqualTo(3);
    assertThat(first.getCharno()).isEqualTo(13);
    assertThat(first.toString())
        .isEqualTo("WARNING PY_UNDEFINED_NAME: Name 'b' is not defined at 3:13");
  }

  @Test
  public void testConfiguredLevel() {
    ImmutableList<AnalysisError> errors =
        new UnresolvedNameCheck(new ScopeProvider(), CheckLevel.ERROR)
            .check(new MetadataWrapper(createModule()));

    assertThat(errors).isNotEmpty();
    for (AnalysisError error : errors) {
      assertThat(error.level()).isEqualTo(CheckLevel.ERROR);
    }
  }

  @Test
  public void testOffReportsNothing() {
    MetadataWrapper wrapper = new MetadataWrapper(createModule());
    ImmutableList<AnalysisError> errors =
        new UnresolvedNameCheck(new ScopeProvider(), CheckLevel.OFF).check(wrapper);

    assertThat(errors).isEmpty();
    assertThat(wrapper.isResolved(new ScopeProvider())).isFalse();
  }

  @Test
  public void testCustomBuiltins() {
    ScopeProvider provider =
        new ScopeProvider() {
          @Override
          protected ImmutableSet<String> getBuiltinNames() {
            return ImmutableSet.of("b", "c", "d");
          }
        };
    ImmutableList<AnalysisError> errors =
        new UnresolvedNameCheck(provider, CheckLevel.WARNING)
            .check(new MetadataWrapper(createModule()));

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).description()).isEqualTo("Name 'len' is not defined");
  }

  @Test
  public void testReusesResolvedScopes() {
    MetadataWrapper wrapper = new MetadataWrapper(createModule());
    wrapper.resolve(new ScopeProvider());

    assertThat(new UnresolvedNameCheck().check(wrapper)).hasSize(3);
  }

  @Test
  public void testCleanModule() {
    Node module =
        IR.module(
            IR.assign(IR.name("x"), IR.number(1)),
            IR.exprStatement(IR.call(IR.name("print"), IR.name("x"))));

    assertThat(new UnresolvedNameCheck().check(new MetadataWrapper(module))).isEmpty();
  }
}
