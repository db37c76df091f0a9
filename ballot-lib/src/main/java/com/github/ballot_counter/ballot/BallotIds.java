// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/// Source of ids for the `of` factories plus the argument checks shared by the ballot records. Hosts that need
/// readable or durable ids pass their own to the record constructors.
final class BallotIds {
  private BallotIds() {
  }

  static String next() {
    return UUID.randomUUID().toString();
  }

  static void requireId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("ballot id must not be blank");
    }
  }

  static <T extends Collection<?>> T requireNoNulls(T values) {
    Objects.requireNonNull(values, "choices");
    values.forEach(v -> Objects.requireNonNull(v, "a ballot cannot name a null candidate"));
    return values;
  }
}
