// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

/// Why an election refused a ballot. These are expected outcomes of casting that callers branch on.
public enum CastError {
  /// The ballot is a different shape to the ballots already cast.
  WRONG_VOTE_TYPE,
  /// A ballot with the same id has already been cast.
  DUPLICATE_VOTE,
  /// The ballot names a candidate who is not standing in the election.
  CANDIDATE_NOT_IN_ELECTION
}
