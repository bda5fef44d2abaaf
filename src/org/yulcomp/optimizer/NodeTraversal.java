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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;
import org.yulcomp.ir.Node;

/**
 * Walks a Yul tree depth first, left to right, and hands every node to a {@link Callback} twice:
 * once before its children and once after them.
 *
 * <p>A failure inside a callback is reported through {@link AbstractCompiler#throwInternalError}
 * together with the node being handled at the time.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;

  // The node being handled, for error context.
  private @Nullable Node currentNode;

  /** Receives the nodes of a traversal. */
  public interface Callback {
    /**
     * Called before the children of {@code n}. Returning false skips {@code n}'s subtree, and
     * {@link #visit} is then not called for {@code n} either.
     *
     * <p>Passes that introduce names do so here, so the name is known to everything below and
     * after the node.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /** Called after the children of {@code n}. The root has a null parent. */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  private NodeTraversal(AbstractCompiler compiler, Callback callback) {
    this.compiler = checkNotNull(compiler);
    this.callback = checkNotNull(callback);
  }

  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    new NodeTraversal(compiler, cb).traverse(root);
  }

  private void traverse(Node root) {
    try {
      currentNode = root;
      traverseBranch(root, null);
    } catch (Error | Exception unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    String message =
        unexpectedException.getMessage()
            + "\n"
            + formatNodeContext("Node", currentNode)
            + (currentNode == null ? "" : formatNodeContext("Parent", currentNode.getParent()));
    compiler.throwInternalError(message, unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL\n";
    }
    return "  " + label + "(" + n.getToken() + "): " + n.getLocation() + "\n";
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      // The callback may replace child.
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }
}
