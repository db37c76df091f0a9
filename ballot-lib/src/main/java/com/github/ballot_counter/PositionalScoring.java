// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.RankedBallot;

import java.util.Collection;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// Ranked counting where each position on a ballot is worth a fixed number of points. Subclasses only decide how
/// many points a position is worth; the points of every ballot are summed in one pass through a [Tally].
public abstract sealed class PositionalScoring permits Borda, Dowdall {

  /// Points earned by the candidate at the zero based `position` of a ranking with `length` candidates.
  protected abstract double pointsFor(int position, int length);

  public <C> Stream<Points<C>> points(RankedBallot<C> ballot) {
    final List<C> choices = ballot.choices();
    final int length = choices.size();
    return IntStream.range(0, length).mapToObj(i -> new Points<>(choices.get(i), pointsFor(i, length)));
  }

  public <C> Tally<C> tally(Stream<? extends RankedBallot<C>> ballots) {
    return Tally.of(ballots.<Points<C>>flatMap(this::points));
  }

  public <C> Outcome<C> count(Stream<? extends RankedBallot<C>> ballots) {
    final var tally = tally(ballots);
    LOGGER.finer(() -> getClass().getSimpleName().toLowerCase() + " " + tally);
    return Outcome.of(tally.leaders());
  }

  public <C> Outcome<C> count(Collection<? extends RankedBallot<C>> ballots) {
    return count(ballots.stream());
  }
}
