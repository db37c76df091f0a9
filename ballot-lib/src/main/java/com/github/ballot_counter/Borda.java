// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

/// Borda count. On a ballot ranking `n` candidates the last choice earns `startingAt` points and each place higher
/// earns one more, so the first choice earns `n - 1 + startingAt`.
///
/// Starting at one rather than zero gives each candidate one extra point per ballot that ranks them. When every ballot
/// ranks the same candidates that is the same shift for all of them and the winners do not change. With partial
/// ballots a candidate ranked more often gains more and the winners can differ.
public final class Borda extends PositionalScoring {
  public static final int DEFAULT_STARTING_AT = 1;

  private final int startingAt;

  public Borda() {
    this(DEFAULT_STARTING_AT);
  }

  /// @param startingAt the points for last place, either 0 or 1
  /// @throws IllegalArgumentException for any other value
  public Borda(int startingAt) {
    if (startingAt != 0 && startingAt != 1) {
      throw new IllegalArgumentException("startingAt must be 0 or 1 but was " + startingAt);
    }
    this.startingAt = startingAt;
  }

  public int startingAt() {
    return startingAt;
  }

  @Override
  protected double pointsFor(int position, int length) {
    return length - position - 1 + startingAt;
  }
}
