// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.RankedBallot;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// # Coombs
///
/// Ranked counting that eliminates the least liked candidates rather than the least popular. Each round strikes the
/// eliminated candidates off every ballot and drops ballots left empty, then:
///
/// 1. No ballots left means there is no winner.
/// 2. A candidate who is first choice on more than half of the remaining ballots wins.
/// 3. Otherwise every candidate tied for the most last place votes is eliminated and the ballots are counted again.
///
/// Cyclic preferences such as `[A, B]`, `[B, C]`, `[C, A]` eliminate every candidate and end with no winner.
public final class Coombs {

  /// One round of counting.
  ///
  /// @param number       the one based round number
  /// @param eliminated   the candidates eliminated before this round
  /// @param ballotCount  the ballots that still rank a candidate who is not eliminated
  /// @param firstChoices first remaining choice votes per candidate
  /// @param lastChoices  last remaining choice votes per candidate
  public record Round<C>(int number, Set<C> eliminated, long ballotCount,
                         Map<C, Long> firstChoices, Map<C, Long> lastChoices) {
    public Round {
      eliminated = Set.copyOf(eliminated);
      firstChoices = Map.copyOf(firstChoices);
      lastChoices = Map.copyOf(lastChoices);
    }

    public boolean exhausted() {
      return ballotCount == 0;
    }

    /// The candidate with a strict majority of first choices, if any.
    public Set<C> majority() {
      final var leaders = Frequencies.most(firstChoices);
      return leaders.size() == 1 && Frequencies.highest(firstChoices) / (double) ballotCount > 0.5 ? leaders : Set.of();
    }

    /// Every candidate tied for the most last place votes.
    public Set<C> mostDisliked() {
      return Frequencies.most(lastChoices);
    }
  }

  public <C> Round<C> round(int number, Collection<? extends RankedBallot<C>> ballots, Set<C> eliminated) {
    final List<List<C>> remaining = ballots.stream()
        .map(b -> b.without(eliminated))
        .filter(choices -> !choices.isEmpty())
        .toList();
    return new Round<>(number, eliminated, remaining.size(),
        Frequencies.of(remaining.stream().map(choices -> choices.get(0))),
        Frequencies.of(remaining.stream().map(choices -> choices.get(choices.size() - 1))));
  }

  /// @throws NoSuchElementException if there are no ballots
  public <C> Outcome<C> count(@NotNull Collection<? extends RankedBallot<C>> ballots) {
    if (ballots.isEmpty()) {
      throw new NoSuchElementException("there are no ballots to count");
    }
    Set<C> eliminated = Set.of();
    for (int number = 1; ; number++) {
      final var round = round(number, ballots, eliminated);
      if (round.exhausted()) {
        LOGGER.fine(() -> "coombs round " + round.number() + " every candidate is eliminated so there is no winner");
        return Outcome.none();
      }
      LOGGER.finer(() -> "coombs round " + round.number() + " first choices " + round.firstChoices()
          + " last choices " + round.lastChoices());
      final var majority = round.majority();
      if (!majority.isEmpty()) {
        LOGGER.fine(() -> "coombs round " + round.number() + " won by " + majority);
        return Outcome.of(majority);
      }
      LOGGER.fine(() -> "coombs round " + round.number() + " eliminates " + round.mostDisliked());
      final var next = new HashSet<>(eliminated);
      next.addAll(round.mostDisliked());
      eliminated = Set.copyOf(next);
    }
  }

  /// Materialises the stream once so that it can be read in every round.
  public <C> Outcome<C> count(Stream<? extends RankedBallot<C>> ballots) {
    final List<? extends RankedBallot<C>> replayable = ballots.toList();
    return count(replayable);
  }
}
