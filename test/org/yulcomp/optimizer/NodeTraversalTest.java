/*
 * Copyright 2026 The Yulcomp Authors.
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
package org.yulcomp.optimizer;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.yulcomp.ir.Node;
import org.yulcomp.optimizer.NodeTraversal.AbstractPostOrderCallback;
import org.yulcomp.parsing.YulParser;

@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  private final Compiler compiler = new Compiler();

  /** Records the order of pre- and post-order visits. */
  private static final class RecordingCallback implements NodeTraversal.Callback {
    final List<String> events = new ArrayList<>();
    private final String skipped;

    RecordingCallback(String skipped) {
      this.skipped = skipped;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      events.add("pre " + describe(n));
      return !describe(n).equals(skipped);
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      events.add("post " + describe(n));
    }

    private static String describe(Node n) {
      return n.getToken().hasString() ? n.getToken() + " " + n.getString() : n.getToken().name();
    }
  }

  @Test
  public void testPreAndPostOrder() {
    Node root = YulParser.parse("{ let a := f(b) }");
    RecordingCallback callback = new RecordingCallback("");

    NodeTraversal.traverse(compiler, root, callback);

    assertThat(callback.events)
        .containsExactly(
            "pre BLOCK",
            "pre VAR_DECL",
            "pre TYPED_NAME a",
            "post TYPED_NAME a",
            "pre CALL f",
            "pre NAME b",
            "post NAME b",
            "post CALL f",
            "post VAR_DECL",
            "post BLOCK")
        .inOrder();
  }

  @Test
  public void testShouldTraverseFalseSkipsSubtree() {
    Node root = YulParser.parse("{ let a := f(b) let c := d }");
    RecordingCallback callback = new RecordingCallback("CALL f");

    NodeTraversal.traverse(compiler, root, callback);

    assertThat(callback.events).contains("pre CALL f");
    assertThat(callback.events).doesNotContain("post CALL f");
    assertThat(callback.events).doesNotContain("pre NAME b");
    assertThat(callback.events).contains("post NAME d");
  }

  @Test
  public void testParentArgument() {
    Node root = YulParser.parse("{ let x := 1 function f() { let y := 2 } }");
    List<String> seen = new ArrayList<>();

    NodeTraversal.traverse(
        compiler,
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (parent == null) {
              seen.add("root " + n.getToken());
            } else {
              assertThat(n.getParent()).isSameInstanceAs(parent);
              if (n.isTypedName()) {
                seen.add(n.getString() + " in " + parent.getToken());
              }
            }
          }
        });

    assertThat(seen).containsExactly("x in VAR_DECL", "y in VAR_DECL", "root BLOCK").inOrder();
  }

  @Test
  public void testChildrenMayBeReplacedDuringVisit() {
    Node root = YulParser.parse("{ let a := b let c := b }");

    NodeTraversal.traverse(
        compiler,
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if (n.isName()) {
              n.replaceWith(Node.newString(n.getToken(), "z"));
            }
          }
        });

    assertThat(CompilerTestCase.toSource(root)).isEqualTo("{ let a := z let c := z }");
  }

  @Test
  public void testUnexpectedExceptionIsReportedAsInternalError() {
    Node root = YulParser.parse("{ let a := b }");

    RuntimeException e =
        assertThrows(
            RuntimeException.class,
            () ->
                NodeTraversal.traverse(
                    compiler,
                    root,
                    new AbstractPostOrderCallback() {
                      @Override
                      public void visit(NodeTraversal t, Node n, Node parent) {
                        if (n.isName()) {
                          throw new IllegalStateException("boom");
                        }
                      }
                    }));

    assertThat(e).hasMessageThat().startsWith("INTERNAL COMPILER ERROR.");
    assertThat(e).hasMessageThat().contains("boom");
    assertThat(e).hasMessageThat().contains("Node(NAME): 1:12");
    assertThat(e).hasMessageThat().contains("Parent(VAR_DECL): 1:3");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }
}
