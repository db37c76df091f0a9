// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.Ballot;

import java.util.Objects;
import java.util.Optional;

/// The result of [Election#cast(Ballot)]. Either the ballot was accepted and there is a new election holding it, or
/// it was rejected with a [CastError] and the election it was cast into is unchanged.
public sealed interface CastResult<C> permits CastResult.Accepted, CastResult.Rejected {

  Optional<Election<C>> accepted();

  Optional<CastError> rejection();

  record Accepted<C>(Election<C> election) implements CastResult<C> {
    public Accepted {
      Objects.requireNonNull(election, "election");
    }

    @Override
    public Optional<Election<C>> accepted() {
      return Optional.of(election);
    }

    @Override
    public Optional<CastError> rejection() {
      return Optional.empty();
    }
  }

  record Rejected<C>(CastError error, Ballot<C> ballot) implements CastResult<C> {
    public Rejected {
      Objects.requireNonNull(error, "error");
      Objects.requireNonNull(ballot, "ballot");
    }

    @Override
    public Optional<Election<C>> accepted() {
      return Optional.empty();
    }

    @Override
    public Optional<CastError> rejection() {
      return Optional.of(error);
    }
  }
}
