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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers, for every name declared so far, the name it ended up with.
 *
 * <p>Chosen names are recorded as mapping to themselves, so a later declaration cannot pick
 * them. Entries are never removed.
 */
final class NameRegistry {

  // Maps original name to new name.
  private final Map<String, String> usedNames = new LinkedHashMap<>();

  /** Records that the declaration named {@code original} is now called {@code chosen}. */
  void commit(String original, String chosen) {
    usedNames.put(chosen, chosen);
    usedNames.put(original, chosen);
  }

  /** Whether {@code name} is either an already declared name or a name already handed out. */
  boolean isTaken(String name) {
    return usedNames.containsKey(name);
  }

  /**
   * Returns the new name for references to {@code name}, or empty if there is no mapping or the
   * name didn't change.
   */
  Optional<String> lookup(String name) {
    String chosen = usedNames.get(name);
    if (chosen == null || chosen.equals(name)) {
      return Optional.empty();
    }
    return Optional.of(chosen);
  }

  int size() {
    return usedNames.size();
  }
}
