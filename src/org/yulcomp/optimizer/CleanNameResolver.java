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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;

/**
 * Picks the clean name for a declaration: the name without its disambiguation suffix when that
 * is free, otherwise the first free {@code base_N} for N = 1, 2, 3, ...
 *
 * <p>Only the bare stripped name is checked against the dialect's builtins. Numbered names are
 * checked against the registry and the blacklist.
 */
final class CleanNameResolver {

  private static final String SEPARATOR = "_";

  private final Dialect dialect;
  private final ImmutableSortedSet<String> blacklist;
  private final SuffixStripper stripper;
  private final NameRegistry registry;
  private final long maxSuffix;

  CleanNameResolver(
      Dialect dialect, ImmutableSortedSet<String> blacklist, NameRegistry registry) {
    this(dialect, blacklist, registry, Long.MAX_VALUE);
  }

  @VisibleForTesting
  CleanNameResolver(
      Dialect dialect, ImmutableSortedSet<String> blacklist, NameRegistry registry, long maxSuffix) {
    checkArgument(maxSuffix > 0, "maxSuffix must be positive: %s", maxSuffix);
    this.dialect = checkNotNull(dialect);
    this.blacklist = checkNotNull(blacklist);
    this.stripper = new SuffixStripper(blacklist);
    this.registry = checkNotNull(registry);
    this.maxSuffix = maxSuffix;
  }

  /**
   * Returns the clean name for {@code name}, or empty if it has no suffix that may be stripped.
   * The result may equal {@code name} itself when the search for a free numbered name ends there.
   *
   * @throws IllegalStateException if every numbered name up to the counter limit is taken
   */
  Optional<String> findCleanName(String name) {
    Optional<String> stripped = stripper.stripSuffix(name);
    if (!stripped.isPresent()) {
      return Optional.empty();
    }
    String base = stripped.get();
    if (!dialect.isBuiltin(base) && !registry.isTaken(base)) {
      return stripped;
    }

    String prefix = base + SEPARATOR;
    for (long i = 1; i < maxSuffix; ++i) {
      String candidate = prefix + i;
      if (!registry.isTaken(candidate) && !blacklist.contains(candidate)) {
        return Optional.of(candidate);
      }
    }
    throw new IllegalStateException(
        "Exhausted by attempting to find an available suffix for " + base);
  }

  /**
   * Finds the clean name for a declaration of {@code name} and commits it, so no later
   * declaration can pick the same name. A name that cannot be cleaned is committed unchanged.
   *
   * @return the name the declaration must carry from now on
   */
  String makeCleanName(String name) {
    String chosen = findCleanName(name).orElse(name);
    registry.commit(name, chosen);
    return chosen;
  }
}
