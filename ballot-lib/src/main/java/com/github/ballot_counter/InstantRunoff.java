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
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// # Instant Runoff
///
/// Also called the Hare rule, ranked choice or the alternative vote. Each round counts the first choice of every
/// ballot that has not been eliminated:
///
/// 1. If the leading candidate has more than the win percentage of the counted ballots they win.
/// 2. Otherwise every candidate tied for the fewest votes is eliminated and the ballots are counted again.
///
/// Ballots whose ranked candidates have all been eliminated are exhausted and no longer count toward the total. As
/// the win percentage is at least 50 a tie can never win a round. Every round eliminates at least one candidate so
/// the count ends within as many rounds as there are candidates. If every ballot is exhausted there is no winner.
/// That happens whenever all the remaining candidates tie for the fewest votes, as in `[A]`, `[B]`, because the whole
/// field is eliminated in one round.
///
/// The ballots are read once per round so they must be a collection that can be iterated repeatedly.
public final class InstantRunoff {
  public static final double DEFAULT_WIN_PERCENTAGE = 50.0;

  private final double winPercentage;

  public InstantRunoff() {
    this(DEFAULT_WIN_PERCENTAGE);
  }

  /// @param winPercentage the share of counted ballots a candidate must exceed to win, in `[50, 100]`
  /// @throws IllegalArgumentException if the percentage is out of range
  public InstantRunoff(double winPercentage) {
    if (Double.isNaN(winPercentage) || winPercentage > 100.0) {
      throw new IllegalArgumentException("win percentage cannot be higher than 100 but was " + winPercentage);
    }
    if (winPercentage < 50.0) {
      throw new IllegalArgumentException("win percentage must be at least 50 but was " + winPercentage);
    }
    this.winPercentage = winPercentage;
  }

  public double winPercentage() {
    return winPercentage;
  }

  /// One round of counting.
  ///
  /// @param number     the one based round number
  /// @param eliminated the candidates eliminated before this round
  /// @param tallies    the first remaining choice votes of each candidate
  public record Round<C>(int number, Set<C> eliminated, Map<C, Long> tallies) {
    public Round {
      eliminated = Set.copyOf(eliminated);
      tallies = Map.copyOf(tallies);
    }

    /// The number of ballots that are not exhausted.
    public long total() {
      return Frequencies.total(tallies);
    }

    public Set<C> leaders() {
      return Frequencies.most(tallies);
    }

    public Set<C> losers() {
      return Frequencies.fewest(tallies);
    }

    public double leaderPercentage() {
      final long total = total();
      return total == 0 ? 0.0 : (double) Frequencies.highest(tallies) / total * 100;
    }
  }

  /// Counts the first choice of each ballot that is not in `eliminated`.
  public <C> Round<C> round(int number, Collection<? extends RankedBallot<C>> ballots, Set<C> eliminated) {
    final var tallies = Frequencies.of(ballots.stream()
        .map(b -> b.firstChoice(eliminated))
        .flatMap(Optional::stream));
    return new Round<>(number, eliminated, tallies);
  }

  /// @throws NoSuchElementException if there are no ballots
  public <C> Outcome<C> count(@NotNull Collection<? extends RankedBallot<C>> ballots) {
    if (ballots.isEmpty()) {
      throw new NoSuchElementException("there are no ballots to count");
    }
    Set<C> eliminated = Set.of();
    for (int number = 1; ; number++) {
      final var round = round(number, ballots, eliminated);
      LOGGER.finer(() -> "instant runoff round " + round.number() + " tallies " + round.tallies());
      if (round.total() == 0) {
        LOGGER.fine(() -> "instant runoff round " + round.number() + " every ballot is exhausted");
        return Outcome.none();
      }
      if (round.leaderPercentage() > winPercentage) {
        LOGGER.fine(() -> "instant runoff round " + round.number() + " won by " + round.leaders()
            + " with " + round.leaderPercentage() + "%");
        return Outcome.of(round.leaders());
      }
      LOGGER.fine(() -> "instant runoff round " + round.number() + " eliminates " + round.losers());
      final var next = new HashSet<>(eliminated);
      next.addAll(round.losers());
      eliminated = Set.copyOf(next);
    }
  }

  /// Materialises the stream once so that it can be read in every round.
  public <C> Outcome<C> count(Stream<? extends RankedBallot<C>> ballots) {
    final List<? extends RankedBallot<C>> replayable = ballots.toList();
    return count(replayable);
  }
}
