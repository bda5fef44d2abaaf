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

import org.yulcomp.ir.Node;

/**
 * Interface for classes that can optimize a Yul tree.
 *
 * <p>Class has single function "process", which is passed the root node of the tree. The tree
 * is modified in place.
 */
public interface CompilerPass {

  /**
   * Process the tree with root node root. Can modify the contents of each Node tree.
   *
   * @param root Top of the Yul tree, normally the outermost BLOCK
   */
  void process(Node root);
}
