// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ScoreBallot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// Score voting by median rather than total. The scores each candidate receives are buffered during the pass, then
/// the candidates with the highest median score win. Equal medians are a tie; there is no further tie break.
public final class MajorityJudgement {

  public <C> Outcome<C> count(Stream<? extends ScoreBallot<C>> ballots) {
    final Map<C, List<Double>> scores = new LinkedHashMap<>();
    ballots.forEachOrdered(b -> b.scores()
        .forEach((candidate, score) -> scores.computeIfAbsent(candidate, c -> new ArrayList<>()).add(score)));
    if (scores.isEmpty()) {
      throw new NoSuchElementException("there are no scores to count");
    }
    final var medians = Tally.of(scores.entrySet().stream().map(e -> new Points<C>(e.getKey(), median(e.getValue()))));
    LOGGER.finer(() -> "majority judgement medians " + medians);
    return Outcome.of(medians.leaders());
  }

  public <C> Outcome<C> count(Collection<? extends ScoreBallot<C>> ballots) {
    return count(ballots.stream());
  }

  /// The middle value of the sorted scores, or the mean of the two middle values when there is an even number.
  ///
  /// @throws NoSuchElementException if there are no scores
  static double median(List<Double> values) {
    if (values.isEmpty()) {
      throw new NoSuchElementException("cannot take the median of no scores");
    }
    final var sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    final int middle = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2;
  }
}
