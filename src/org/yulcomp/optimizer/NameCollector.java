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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.yulcomp.ir.Node;
import org.yulcomp.optimizer.NodeTraversal.AbstractPostOrderCallback;

/**
 * Collects the names declared by function definitions: the function names, and the names of
 * their parameters and return variables.
 *
 * <p>Functions and variables share one namespace in Yul, so these are the names a variable
 * rename must stay away from.
 */
final class NameCollector extends AbstractPostOrderCallback implements CompilerPass {

  private final AbstractCompiler compiler;
  private final Set<String> functionNames = new LinkedHashSet<>();
  private final Set<String> signatureNames = new LinkedHashSet<>();

  NameCollector(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    switch (n.getToken()) {
      case FUNCTION:
        functionNames.add(n.getString());
        break;
      case TYPED_NAME:
        if (parent.isParamList() || parent.isResultList()) {
          signatureNames.add(n.getString());
        }
        break;
      default:
        break;
    }
  }

  /** The names of all defined functions, in the order they were first seen. */
  ImmutableSet<String> getFunctionNames() {
    return ImmutableSet.copyOf(functionNames);
  }

  /** The names of all parameters and return variables, in the order they were first seen. */
  ImmutableSet<String> getSignatureNames() {
    return ImmutableSet.copyOf(signatureNames);
  }
}
