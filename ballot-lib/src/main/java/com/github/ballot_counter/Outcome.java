// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// The result of a count. There is either a single winner, a tie between two or more candidates, or no winner at all.
/// No winner is a normal outcome of quota, Coombs and plurality with runoff counts and is never an error.
public sealed interface Outcome<C> permits Outcome.Winner, Outcome.Tie, Outcome.NoWinner {

  /// The winning candidates. Empty for [NoWinner], a singleton for [Winner].
  Set<C> winners();

  default boolean isDecided() {
    return this instanceof Winner;
  }

  default Optional<C> winner() {
    return this instanceof Winner<C> w ? Optional.of(w.candidate()) : Optional.empty();
  }

  /// Maps a winner set onto an outcome by its size.
  static <C> Outcome<C> of(Collection<C> winners) {
    return switch (winners.size()) {
      case 0 -> none();
      case 1 -> new Winner<>(winners.iterator().next());
      default -> new Tie<>(Set.copyOf(winners));
    };
  }

  static <C> Outcome<C> none() {
    return new NoWinner<>();
  }

  record Winner<C>(C candidate) implements Outcome<C> {
    public Winner {
      Objects.requireNonNull(candidate, "candidate");
    }

    @Override
    public Set<C> winners() {
      return Set.of(candidate);
    }
  }

  record Tie<C>(Set<C> candidates) implements Outcome<C> {
    public Tie {
      candidates = Set.copyOf(candidates);
      if (candidates.size() < 2) {
        throw new IllegalArgumentException("a tie needs at least two candidates but was " + candidates);
      }
    }

    @Override
    public Set<C> winners() {
      return candidates;
    }
  }

  record NoWinner<C>() implements Outcome<C> {
    @Override
    public Set<C> winners() {
      return Set.of();
    }
  }
}
