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

/**
 * The target language a tree will be lowered to. Builtin names of a dialect must never be
 * introduced as variable names.
 */
public interface Dialect {

  /** A short name for the dialect, as used on the command line. */
  String getName();

  /** Whether {@code name} refers to a builtin function of this dialect. */
  boolean isBuiltin(String name);
}
