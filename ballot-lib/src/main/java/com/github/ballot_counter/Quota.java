// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.PluralityBallot;

import java.util.Collection;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// Plurality with a minimum share of the vote. Every candidate whose share of the ballots reaches the quota wins, so
/// a low quota can produce a tie and a high one can produce no winner.
///
/// A quota greater than one is read as a percentage, otherwise as a fraction: `60` and `0.6` are the same quota.
public final class Quota {
  private final double fraction;

  /// @param quota the share needed to win, in `(0, 100]`
  /// @throws IllegalArgumentException if the quota is out of range
  public Quota(double quota) {
    if (!(quota > 0 && quota <= 100)) {
      throw new IllegalArgumentException("quota must be greater than 0 and at most 100 but was " + quota);
    }
    this.fraction = quota > 1 ? quota / 100 : quota;
  }

  public double fraction() {
    return fraction;
  }

  public <C> Outcome<C> count(Stream<? extends PluralityBallot<C>> ballots) {
    final var tally = new Tally<C>();
    ballots.forEachOrdered(b -> tally.add(b.choice(), 1.0));
    if (tally.isEmpty()) {
      throw new NoSuchElementException("there are no votes to count");
    }
    final double ballotCount = tally.totals().values().stream().mapToDouble(Double::doubleValue).sum();
    final var winners = tally.totals().entrySet().stream()
        .filter(e -> e.getValue() / ballotCount >= fraction)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
    LOGGER.fine(() -> "quota " + fraction + " of " + ballotCount + " ballots met by " + winners);
    return Outcome.of(winners);
  }

  public <C> Outcome<C> count(Collection<? extends PluralityBallot<C>> ballots) {
    return count(ballots.stream());
  }
}
