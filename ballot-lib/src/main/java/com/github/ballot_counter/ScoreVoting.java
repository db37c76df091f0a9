// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ScoreBallot;

import java.util.Collection;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// Score voting. Every score on every ballot is added to the candidate's total and the highest totals win.
///
/// Totals are compared rather than averages. When every ballot scores every candidate the two give the same order.
/// When ballots leave candidates out a candidate scored on fewer ballots is at a disadvantage; that is the documented
/// behaviour of this count and callers who want means must ensure every ballot is complete.
public final class ScoreVoting {

  public <C> Tally<C> tally(Stream<? extends ScoreBallot<C>> ballots) {
    return Tally.of(ballots.<Points<C>>flatMap(b -> b.scores().entrySet().stream()
        .map(e -> new Points<C>(e.getKey(), e.getValue()))));
  }

  public <C> Outcome<C> count(Stream<? extends ScoreBallot<C>> ballots) {
    final var tally = tally(ballots);
    LOGGER.finer(() -> "score " + tally);
    return Outcome.of(tally.leaders());
  }

  public <C> Outcome<C> count(Collection<? extends ScoreBallot<C>> ballots) {
    return count(ballots.stream());
  }
}
