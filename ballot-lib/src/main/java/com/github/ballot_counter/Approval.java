// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ApprovalBallot;

import java.util.Collection;
import java.util.stream.Stream;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// Approval voting. Each ballot gives one point to every distinct candidate it approves of and the most approved
/// candidates win.
public final class Approval {

  public <C> Outcome<C> count(Stream<? extends ApprovalBallot<C>> ballots) {
    final var tally = Tally.of(ballots.<Points<C>>flatMap(b -> b.choices().stream().map(Points::one)));
    LOGGER.finer(() -> "approval " + tally);
    return Outcome.of(tally.leaders());
  }

  public <C> Outcome<C> count(Collection<? extends ApprovalBallot<C>> ballots) {
    return count(ballots.stream());
  }
}
