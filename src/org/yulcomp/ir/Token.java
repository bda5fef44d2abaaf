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
package org.yulcomp.ir;

/**
 * The kinds of {@link Node} in a Yul tree.
 *
 * <p>The set is closed: every pass switches over these values and the traversal relies on the
 * child layout documented on {@link IR}.
 */
public enum Token {
  BLOCK,
  FUNCTION,
  PARAM_LIST,
  RESULT_LIST,
  VAR_DECL,
  TYPED_NAME,
  ASSIGN,
  NAME,
  LITERAL,
  CALL,
  EXPR_RESULT,
  IF,
  SWITCH,
  CASE,
  DEFAULT,
  FOR,
  BREAK,
  CONTINUE,
  LEAVE;

  /** Whether nodes of this kind carry a string payload. */
  public boolean hasString() {
    switch (this) {
      case FUNCTION:
      case TYPED_NAME:
      case NAME:
      case LITERAL:
      case CALL:
        return true;
      default:
        return false;
    }
  }
}
