// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Counting ballots under several electoral rules.
///
/// Ballots are the records in [com.github.ballot_counter.ballot]. They are collected and validated by an
/// [com.github.ballot_counter.Election] and then handed to one of the counters, usually through the static methods
/// of [com.github.ballot_counter.BallotCounter]:
///
/// - Single pass counts built on the [com.github.ballot_counter.Tally] engine:
///   [com.github.ballot_counter.Plurality], [com.github.ballot_counter.Quota], [com.github.ballot_counter.Borda],
///   [com.github.ballot_counter.Dowdall], [com.github.ballot_counter.Approval],
///   [com.github.ballot_counter.ScoreVoting] and [com.github.ballot_counter.MajorityJudgement].
/// - Multi-round counts that eliminate candidates until a majority emerges:
///   [com.github.ballot_counter.InstantRunoff], [com.github.ballot_counter.Coombs] and
///   [com.github.ballot_counter.PluralityWithRunoff].
///
/// Every count returns an [com.github.ballot_counter.Outcome]. Casting a ballot returns a
/// [com.github.ballot_counter.CastResult] rather than throwing, as rejected ballots are an expected part of running an
/// election. Logging is through `java.util.logging` under this package's name.
package com.github.ballot_counter;
