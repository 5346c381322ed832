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

import com.google.common.collect.ImmutableMap;
import com.google.pycst.syntax.IR;
import com.google.pycst.syntax.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ParentNodeProvider}. */
@RunWith(JUnit4.class)
public final class ParentNodeProviderTest {

  @Test
  public void testParents() {
    Node a = IR.name("a");
    Node value = IR.binOp(a, "+", IR.number(1));
    Node assign = IR.assign(IR.name("b"), value);
    Node root = IR.module(assign);

    ImmutableMap<Node, Node> parents = new MetadataWrapper(root).resolve(new ParentNodeProvider());

    assertThat(parents).containsEntry(a, value);
    assertThat(parents).containsEntry(value, assign);
    assertThat(parents).containsEntry(assign, root);
    assertThat(parents).doesNotContainKey(root);
    assertThat(parents).hasSize(5);
  }

  @Test
  public void testParentsInsideScopes() {
    Node param = IR.param("p");
    Node params = IR.paramList(param);
    Node body = IR.block(IR.pass());
    Node function = IR.function(IR.name("f"), params, body);
    Node root = IR.module(function);

    ImmutableMap<Node, Node> parents = new MetadataWrapper(root).resolve(new ParentNodeProvider());

    assertThat(parents).containsEntry(param, params);
    assertThat(parents).containsEntry(params, function);
    assertThat(parents).containsEntry(body, function);
    assertThat(parents).containsEntry(function, root);
  }
}
