// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.LongBinaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Vote counts per candidate for a single round of a multi-round count.
final class Frequencies {
  private Frequencies() {
  }

  static <C> Map<C, Long> of(Stream<C> votes) {
    return Collections.unmodifiableMap(
        votes.collect(Collectors.groupingBy(c -> c, LinkedHashMap::new, Collectors.counting())));
  }

  static <C> long total(Map<C, Long> frequencies) {
    return frequencies.values().stream().mapToLong(Long::longValue).sum();
  }

  /// Every candidate tied for the most votes. Empty when there are no votes.
  static <C> Set<C> most(Map<C, Long> frequencies) {
    return tiedAt(frequencies, Math::max);
  }

  /// Every candidate tied for the fewest votes. Empty when there are no votes.
  static <C> Set<C> fewest(Map<C, Long> frequencies) {
    return tiedAt(frequencies, Math::min);
  }

  static <C> long highest(Map<C, Long> frequencies) {
    return frequencies.values().stream().mapToLong(Long::longValue).max().orElse(0L);
  }

  private static <C> Set<C> tiedAt(Map<C, Long> frequencies, LongBinaryOperator pick) {
    if (frequencies.isEmpty()) {
      return Set.of();
    }
    final long target = frequencies.values().stream().mapToLong(Long::longValue).reduce(pick).orElseThrow();
    return frequencies.entrySet().stream()
        .filter(e -> e.getValue() == target)
        .map(Map.Entry::getKey)
        .collect(Collectors.toUnmodifiableSet());
  }
}
