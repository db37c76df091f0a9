// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.PluralityBallot;

import java.util.Collection;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// First past the post. Every ballot is one vote for its choice and the candidates with the most votes win.
public final class Plurality {

  public <C> Outcome<C> count(Stream<? extends PluralityBallot<C>> ballots) {
    final var tally = Tally.of(ballots.map(b -> Points.one(b.choice())));
    LOGGER.finer(() -> "plurality " + tally);
    return Outcome.of(tally.leaders());
  }

  public <C> Outcome<C> count(Collection<? extends PluralityBallot<C>> ballots) {
    return count(ballots.stream());
  }
}
