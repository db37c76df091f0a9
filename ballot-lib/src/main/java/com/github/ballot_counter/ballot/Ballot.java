// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.List;

/// A single cast ballot. There are exactly four shapes of ballot and an election only ever holds one of them:
///
/// - [PluralityBallot] a single choice.
/// - [ApprovalBallot] an unordered set of approved candidates.
/// - [RankedBallot] candidates in order from most to least preferred.
/// - [ScoreBallot] a numeric score per candidate.
///
/// Candidates may be any type with value semantics for `equals` and `hashCode`. They are never ordered.
///
/// @param <C> the candidate type
public sealed interface Ballot<C> permits PluralityBallot, ApprovalBallot, RankedBallot, ScoreBallot {

  /// The opaque identifier of the ballot. It never changes and is unique within an election.
  String id();

  /// The candidates named by this ballot without duplicates.
  List<C> candidates();

  /// Which of the four shapes of ballot this is.
  BallotType type();
}
