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
import java.util.Set;

/** Factory methods for the known dialects. */
public final class Dialects {

  private Dialects() {}

  private static final Dialect NONE = withBuiltins("none", ImmutableSet.of());

  public static Dialect evm() {
    return new EvmDialect();
  }

  /** A dialect without any builtin functions. */
  public static Dialect none() {
    return NONE;
  }

  /** A dialect whose builtins are exactly {@code builtins}. */
  public static Dialect withBuiltins(String name, Set<String> builtins) {
    ImmutableSet<String> names = ImmutableSet.copyOf(builtins);
    return new Dialect() {
      @Override
      public String getName() {
        return name;
      }

      @Override
      public boolean isBuiltin(String identifier) {
        return names.contains(identifier);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  /**
   * Looks up a dialect by the name used on the command line.
   *
   * @throws IllegalArgumentException if there is no such dialect
   */
  public static Dialect forName(String name) {
    switch (name) {
      case "evm":
        return evm();
      case "none":
        return none();
      default:
        throw new IllegalArgumentException("Unknown dialect: " + name);
    }
  }
}
