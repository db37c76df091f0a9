// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// A vote approving of any number of candidates. Approving of a candidate twice is the same as approving once so the
/// choices are held as a set in the order each candidate was first given.
public record ApprovalBallot<C>(String id, Set<C> choices) implements Ballot<C> {
  public ApprovalBallot {
    BallotIds.requireId(id);
    choices = Collections.unmodifiableSet(new LinkedHashSet<>(BallotIds.requireNoNulls(choices)));
  }

  /// Duplicates in the list collapse to a single approval.
  public ApprovalBallot(String id, List<C> choices) {
    this(id, new LinkedHashSet<>(BallotIds.requireNoNulls(choices)));
  }

  @SafeVarargs
  public static <C> ApprovalBallot<C> of(C... choices) {
    return new ApprovalBallot<>(BallotIds.next(), Arrays.asList(choices));
  }

  @Override
  public List<C> candidates() {
    return List.copyOf(choices);
  }

  @Override
  public BallotType type() {
    return BallotType.APPROVAL;
  }
}
