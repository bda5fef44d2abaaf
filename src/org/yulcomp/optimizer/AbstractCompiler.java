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
 * An abstract compiler, to help remove the circular dependency of passes on the concrete
 * {@link Compiler}.
 */
public abstract class AbstractCompiler {

  /** The dialect the tree will be lowered to. */
  public abstract Dialect getDialect();

  /**
   * Passes that make modifications to the tree must call this with the node that changed. Passes
   * that only inspect the tree, or that rewrite a name to itself, must not.
   */
  public abstract void reportChangeToEnclosingScope(Node n);

  /** Whether any change has been reported since the last {@link #resetCodeChange()}. */
  public abstract boolean hasCodeChanged();

  public abstract void resetCodeChange();

  /** Aborts the compilation. Used for failures that indicate a bug rather than bad input. */
  abstract void throwInternalError(String message, Throwable cause);
}
