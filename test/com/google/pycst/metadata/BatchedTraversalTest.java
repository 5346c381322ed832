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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.pycst.metadata.NodeTraversal.Callback;
import com.google.pycst.metadata.NodeTraversal.ScopedCallback;
import com.google.pycst.metadata.NodeTraversal.TraversalException;
import com.google.pycst.syntax.IR;
import com.google.pycst.syntax.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BatchedTraversal}. */
@RunWith(JUnit4.class)
public final class BatchedTraversalTest {

  private static final class ProviderA extends BaseMetadataProvider<Object> {
    @Override
    protected void computeMetadata(MetadataCollector<Object> collector) {}
  }

  private static final class ProviderB extends BaseMetadataProvider<Object> {
    @Override
    protected void computeMetadata(MetadataCollector<Object> collector) {}
  }

  /** Records the visited names and scopes; prunes function definitions if asked to. */
  private static final class Recorder implements ScopedCallback {
    final List<String> log = new ArrayList<>();
    final boolean pruneFunctions;

    Recorder(boolean pruneFunctions) {
      this.pruneFunctions = pruneFunctions;
    }

    @Override
    public void enterScope(NodeTraversal t) {
      log.add("enter " + t.getScopeRoot().getToken());
    }

    @Override
    public void exitScope(NodeTraversal t) {
      log.add("exit " + t.getScopeRoot().getToken());
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return !(pruneFunctions && n.isFunctionDef());
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isName()) {
        log.add(n.getString());
      }
    }
  }

  // def f(a): b
  // c
  private static Node createTree() {
    return IR.module(
        IR.function(
            IR.name("f"),
            IR.paramList(IR.param("a")),
            IR.block(IR.exprStatement(IR.name("b")))),
        IR.exprStatement(IR.name("c")));
  }

  @Test
  public void testEachCallbackBehavesAsExclusiveClient() {
    Recorder pruning = new Recorder(true);
    Recorder full = new Recorder(false);
    BatchedTraversal.traverse(
        createTree(),
        ImmutableMap.<BaseMetadataProvider<?>, Callback>of(
            new ProviderA(), pruning, new ProviderB(), full));

    assertThat(pruning.log).containsExactly("enter MODULE", "c", "exit MODULE").inOrder();
    assertThat(full.log)
        .containsExactly(
            "enter MODULE", "f", "enter FUNCTION_DEF", "a", "b", "exit FUNCTION_DEF", "c",
            "exit MODULE")
        .inOrder();
  }

  @Test
  public void testSameResultAsSeparateTraversals() {
    Node root = createTree();
    Recorder alone = new Recorder(true);
    NodeTraversal.traverse(root, alone);

    Recorder batched = new Recorder(true);
    BatchedTraversal.traverse(
        root,
        ImmutableMap.<BaseMetadataProvider<?>, Callback>of(
            new ProviderA(), batched, new ProviderB(), new Recorder(false)));

    assertThat(batched.log).isEqualTo(alone.log);
  }

  @Test
  public void testFailureIsAttributedToItsProvider() {
    Callback failing =
        new NodeTraversal.AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName() && n.getString().equals("c")) {
              throw new IllegalArgumentException("no c");
            }
            return true;
          }
        };
    TraversalException e =
        assertThrows(
            TraversalException.class,
            () ->
                BatchedTraversal.traverse(
                    createTree(),
                    ImmutableMap.<BaseMetadataProvider<?>, Callback>of(
                        new ProviderA(), new Recorder(false), new ProviderB(), failing)));

    assertThat(e).hasCauseThat().isInstanceOf(MetadataExecutionException.class);
    MetadataExecutionException cause = (MetadataExecutionException) e.getCause();
    assertThat(cause.getProvider()).isEqualTo(new ProviderB());
    assertThat(cause.getNode().getString()).isEqualTo("c");
    assertThat(cause).hasCauseThat().hasMessageThat().isEqualTo("no c");
  }
}
