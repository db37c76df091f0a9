// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.List;
import java.util.Objects;

/// A vote for exactly one candidate.
public record PluralityBallot<C>(String id, C choice) implements Ballot<C> {
  public PluralityBallot {
    BallotIds.requireId(id);
    Objects.requireNonNull(choice, "choice");
  }

  public static <C> PluralityBallot<C> of(C choice) {
    return new PluralityBallot<>(BallotIds.next(), choice);
  }

  @Override
  public List<C> candidates() {
    return List.of(choice);
  }

  @Override
  public BallotType type() {
    return BallotType.PLURALITY;
  }
}
