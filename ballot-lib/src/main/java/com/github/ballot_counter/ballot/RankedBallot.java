// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/// A vote that puts candidates in strict order from most preferred to least preferred, i.e.
/// `[first choice, second choice, third choice]`. Candidates left off the ballot are ones the voter has no preference
/// between. An empty ranking is an abstention.
public record RankedBallot<C>(String id, List<C> choices) implements Ballot<C> {
  public RankedBallot {
    BallotIds.requireId(id);
    choices = List.copyOf(BallotIds.requireNoNulls(choices));
    if (new HashSet<>(choices).size() != choices.size()) {
      throw new IllegalArgumentException("a ranking cannot list a candidate twice: " + choices);
    }
  }

  @SafeVarargs
  public static <C> RankedBallot<C> of(C... choices) {
    return new RankedBallot<>(BallotIds.next(), Arrays.asList(choices));
  }

  /// The most preferred candidate that is not excluded, or empty if every ranked candidate is excluded.
  public Optional<C> firstChoice(Set<C> excluded) {
    return choices.stream().filter(Predicate.not(excluded::contains)).findFirst();
  }

  /// The most preferred candidate that is included, or empty if none of the ranked candidates is included.
  public Optional<C> firstChoiceAmong(Set<C> included) {
    return choices.stream().filter(included::contains).findFirst();
  }

  /// The ranking with the excluded candidates struck out. Relative order is unchanged.
  public List<C> without(Set<C> excluded) {
    return excluded.isEmpty() ? choices : choices.stream().filter(Predicate.not(excluded::contains)).toList();
  }

  public boolean isEmpty() {
    return choices.isEmpty();
  }

  @Override
  public List<C> candidates() {
    return choices;
  }

  @Override
  public BallotType type() {
    return BallotType.RANKED;
  }
}
