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
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// # Plurality With Runoff
///
/// A two round system on ranked ballots. A candidate with more than half of the first choices wins outright.
/// Otherwise there is a single runoff between everyone tied for first and everyone tied for second. Each ballot then
/// counts for the runoff candidate it ranks highest, ballots ranking none of them are dropped, and the runoff leader
/// wins with more than half of the counted runoff ballots. If nobody reaches that there is no winner.
///
/// The first round share is of every ballot cast, including empty rankings.
public final class PluralityWithRunoff {

  /// Everyone tied for the most first choices together with everyone tied for the next highest count.
  static <C> Set<C> runoffPool(Map<C, Long> firstChoices) {
    final var first = Frequencies.most(firstChoices);
    final var rest = firstChoices.entrySet().stream()
        .filter(e -> !first.contains(e.getKey()))
        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    final var pool = new HashSet<>(first);
    pool.addAll(Frequencies.most(rest));
    return Set.copyOf(pool);
  }

  /// @throws NoSuchElementException if there are no ballots
  public <C> Outcome<C> count(@NotNull Collection<? extends RankedBallot<C>> ballots) {
    if (ballots.isEmpty()) {
      throw new NoSuchElementException("there are no ballots to count");
    }
    final var firstChoices = Frequencies.of(ballots.stream()
        .map(b -> b.firstChoice(Set.of()))
        .flatMap(Optional::stream));
    LOGGER.finer(() -> "plurality with runoff first choices " + firstChoices);
    final var outright = majorityOf(firstChoices, ballots.size());
    if (outright.isPresent()) {
      LOGGER.fine(() -> "plurality with runoff won outright by " + outright.get());
      return new Outcome.Winner<>(outright.get());
    }

    final var pool = runoffPool(firstChoices);
    final var runoff = Frequencies.of(ballots.stream()
        .map(b -> b.firstChoiceAmong(pool))
        .flatMap(Optional::stream));
    LOGGER.fine(() -> "plurality with runoff between " + pool + " counted " + runoff);
    return majorityOf(runoff, Frequencies.total(runoff))
        .<Outcome<C>>map(Outcome.Winner::new)
        .orElseGet(Outcome::none);
  }

  /// Materialises the stream once so that it can be read in both rounds.
  public <C> Outcome<C> count(Stream<? extends RankedBallot<C>> ballots) {
    final List<? extends RankedBallot<C>> replayable = ballots.toList();
    return count(replayable);
  }

  private static <C> Optional<C> majorityOf(Map<C, Long> votes, long ballotCount) {
    final var leaders = Frequencies.most(votes);
    if (ballotCount == 0 || leaders.size() != 1) {
      return Optional.empty();
    }
    return Frequencies.highest(votes) / (double) ballotCount > 0.5 ? leaders.stream().findFirst() : Optional.empty();
  }
}
