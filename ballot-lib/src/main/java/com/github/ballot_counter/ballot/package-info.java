// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The four shapes of ballot as records of the sealed [com.github.ballot_counter.ballot.Ballot] interface.
/// Ballots are immutable values. Each one names its candidates and carries an id that is unique within an election.
package com.github.ballot_counter.ballot;
