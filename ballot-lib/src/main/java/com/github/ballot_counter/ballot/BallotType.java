// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

/// The tag of each [Ballot] variant. An election accepts only the type of the first ballot cast.
public enum BallotType {
  PLURALITY, APPROVAL, RANKED, SCORE
}
