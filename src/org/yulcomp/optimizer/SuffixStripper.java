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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;

/**
 * Recognizes the suffixes appended by name disambiguation, such as the {@code _1_2} in {@code
 * a_1_2}.
 *
 * <p>A suffix is a trailing run of one or more groups, each consisting of one or more
 * underscores followed by one or more digits. Digits or underscores that are not part of such a
 * trailing run, like the {@code 1} in {@code a1} or the {@code _2b} in {@code x_2b}, are left
 * alone.
 */
final class SuffixStripper {

  private final ImmutableSortedSet<String> blacklist;

  SuffixStripper(ImmutableSortedSet<String> blacklist) {
    this.blacklist = checkNotNull(blacklist);
  }

  /**
   * Returns {@code name} without its disambiguation suffix, or empty if there is no suffix, the
   * suffix is the whole name, or the stripped name is blacklisted.
   */
  Optional<String> stripSuffix(String name) {
    int end = suffixStart(name);
    if (end == name.length() || end == 0) {
      return Optional.empty();
    }
    String stripped = name.substring(0, end);
    if (blacklist.contains(stripped)) {
      return Optional.empty();
    }
    return Optional.of(stripped);
  }

  /**
   * Scans backwards over complete {@code _+[0-9]+} groups and returns the index where the
   * trailing run of them starts, or {@code name.length()} if the name does not end in one.
   */
  static int suffixStart(String name) {
    int start = name.length();
    while (true) {
      int digits = start;
      while (digits > 0 && isDigit(name.charAt(digits - 1))) {
        digits--;
      }
      if (digits == start) {
        return start;
      }
      int underscores = digits;
      while (underscores > 0 && name.charAt(underscores - 1) == '_') {
        underscores--;
      }
      if (underscores == digits) {
        return start;
      }
      start = underscores;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
