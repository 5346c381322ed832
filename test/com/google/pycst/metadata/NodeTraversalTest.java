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

import com.google.pycst.metadata.NodeTraversal.AbstractPostOrderCallback;
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

/** Tests for {@link NodeTraversal}. */
@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  /** Records scope changes and the names visited, with the scope depth they are visited at. */
  private static class RecordingCallback implements ScopedCallback {
    final List<String> events = new ArrayList<>();

    @Override
    public void enterScope(NodeTraversal t) {
      events.add("enter " + t.getScopeRoot().getToken());
    }

    @Override
    public void exitScope(NodeTraversal t) {
      events.add("exit " + t.getScopeRoot().getToken());
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isName()) {
        events.add(n.getString() + "@" + t.getScopeDepth());
      }
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  @Test
  public void testFunctionScopeStartsAfterName() {
    Node root =
        IR.module(
            IR.function(
                IR.decorators(IR.name("deco")),
                IR.name("f"),
                IR.paramList(IR.paramWithDefault("a", IR.name("d"))),
                IR.empty(),
                IR.block(IR.returnNode(IR.name("a")))));
    RecordingCallback cb = new RecordingCallback();
    NodeTraversal.traverse(root, cb);

    assertThat(cb.events)
        .containsExactly(
            "enter MODULE",
            "deco@0",
            "f@0",
            "enter FUNCTION_DEF",
            "a@1",
            "d@1",
            "a@1",
            "exit FUNCTION_DEF",
            "exit MODULE")
        .inOrder();
  }

  @Test
  public void testClassScopeStartsAfterBases() {
    Node root =
        IR.module(
            IR.classDef(
                IR.decorators(),
                IR.name("C"),
                IR.argList(IR.name("B")),
                IR.block(IR.assign(IR.name("x"), IR.number(1)))));
    RecordingCallback cb = new RecordingCallback();
    NodeTraversal.traverse(root, cb);

    assertThat(cb.events)
        .containsExactly(
            "enter MODULE", "C@0", "B@0", "enter CLASS_DEF", "x@1", "exit CLASS_DEF", "exit MODULE")
        .inOrder();
  }

  @Test
  public void testComprehensionAndLambdaScopesCoverTheWholeNode() {
    Node root =
        IR.module(
            IR.exprStatement(
                IR.listComp(
                    IR.lambda(IR.paramList(IR.param("p")), IR.name("y")),
                    IR.compFor(IR.name("y"), IR.name("ys")))));
    RecordingCallback cb = new RecordingCallback();
    NodeTraversal.traverse(root, cb);

    assertThat(cb.events)
        .containsExactly(
            "enter MODULE",
            "enter LIST_COMP",
            "enter LAMBDA",
            "p@2",
            "y@2",
            "exit LAMBDA",
            "y@1",
            "ys@1",
            "exit LIST_COMP",
            "exit MODULE")
        .inOrder();
  }

  @Test
  public void testPruningSkipsScopes() {
    Node root =
        IR.module(
            IR.function(IR.name("f"), IR.paramList(), IR.block(IR.exprStatement(IR.name("x")))),
            IR.exprStatement(IR.name("y")));
    RecordingCallback cb =
        new RecordingCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            super.shouldTraverse(t, n, parent);
            return !n.isFunctionDef();
          }
        };
    NodeTraversal.traverse(root, cb);

    assertThat(cb.events).containsExactly("enter MODULE", "y@0", "exit MODULE").inOrder();
  }

  @Test
  public void testVisitIsPostOrder() {
    Node root = IR.module(IR.exprStatement(IR.binOp(IR.name("a"), "+", IR.name("b"))));
    List<String> visited = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            visited.add(n.getToken().toString());
          }
        });

    assertThat(visited)
        .containsExactly("NAME", "NAME", "BIN_OP", "EXPR_STMT", "MODULE")
        .inOrder();
  }

  @Test
  public void testEnclosingFunction() {
    Node inner = IR.exprStatement(IR.name("x"));
    Node function = IR.function(IR.name("f"), IR.paramList(), IR.block(inner));
    Node root = IR.module(IR.classDef(IR.name("C"), IR.block(function)));
    List<Node> enclosing = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if (n == inner || n == function) {
              enclosing.add(t.getEnclosingFunction());
            }
          }
        });

    assertThat(enclosing).hasSize(2);
    assertThat(enclosing.get(0)).isSameInstanceAs(function);
    assertThat(enclosing.get(1)).isNull();
  }

  @Test
  public void testCallbackFailureCarriesTheNode() {
    Node x = IR.name("x");
    Node root = IR.module(IR.exprStatement(x));
    TraversalException e =
        assertThrows(
            TraversalException.class,
            () ->
                NodeTraversal.traverse(
                    root,
                    new AbstractPostOrderCallback() {
                      @Override
                      public void visit(NodeTraversal t, Node n, Node parent) {
                        if (n.isName()) {
                          throw new IllegalStateException("boom");
                        }
                      }
                    }));

    assertThat(e.getNode()).isSameInstanceAs(x);
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
    assertThat(e).hasMessageThat().startsWith("boom");
  }
}
