// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ApprovalBallot;
import com.github.ballot_counter.ballot.PluralityBallot;
import com.github.ballot_counter.ballot.RankedBallot;
import com.github.ballot_counter.ballot.ScoreBallot;

import java.util.Collection;
import java.util.stream.Stream;

/// Static entry points for every counting method. Each returns an [Outcome] that is a single winner, a tie or no
/// winner.
///
/// Every method accepts a collection or a `Stream`, which may be lazily produced from a database cursor or a file. The
/// single pass methods read the stream once in order. Instant runoff, Coombs and plurality with runoff read the
/// ballots once per round so they collect a stream into a list before the first round.
///
/// Invalid parameters and empty ballot input throw immediately. No winner is returned as [Outcome.NoWinner].
public final class BallotCounter {
  private BallotCounter() {
  }

  public static <C> Outcome<C> plurality(Stream<? extends PluralityBallot<C>> ballots) {
    return new Plurality().count(ballots);
  }

  public static <C> Outcome<C> plurality(Collection<? extends PluralityBallot<C>> ballots) {
    return new Plurality().count(ballots);
  }

  /// @param quota a percentage when greater than one, otherwise a fraction
  public static <C> Outcome<C> quota(Collection<? extends PluralityBallot<C>> ballots, double quota) {
    return new Quota(quota).count(ballots);
  }

  public static <C> Outcome<C> quota(Stream<? extends PluralityBallot<C>> ballots, double quota) {
    return new Quota(quota).count(ballots);
  }

  public static <C> Outcome<C> pluralityWithRunoff(Collection<? extends RankedBallot<C>> ballots) {
    return new PluralityWithRunoff().count(ballots);
  }

  public static <C> Outcome<C> pluralityWithRunoff(Stream<? extends RankedBallot<C>> ballots) {
    return new PluralityWithRunoff().count(ballots);
  }

  public static <C> Outcome<C> instantRunoff(Collection<? extends RankedBallot<C>> ballots) {
    return new InstantRunoff().count(ballots);
  }

  public static <C> Outcome<C> instantRunoff(Collection<? extends RankedBallot<C>> ballots, double winPercentage) {
    return new InstantRunoff(winPercentage).count(ballots);
  }

  public static <C> Outcome<C> instantRunoff(Stream<? extends RankedBallot<C>> ballots) {
    return new InstantRunoff().count(ballots);
  }

  public static <C> Outcome<C> instantRunoff(Stream<? extends RankedBallot<C>> ballots, double winPercentage) {
    return new InstantRunoff(winPercentage).count(ballots);
  }

  public static <C> Outcome<C> coombs(Collection<? extends RankedBallot<C>> ballots) {
    return new Coombs().count(ballots);
  }

  public static <C> Outcome<C> coombs(Stream<? extends RankedBallot<C>> ballots) {
    return new Coombs().count(ballots);
  }

  public static <C> Outcome<C> borda(Collection<? extends RankedBallot<C>> ballots) {
    return new Borda().count(ballots);
  }

  public static <C> Outcome<C> borda(Stream<? extends RankedBallot<C>> ballots) {
    return new Borda().count(ballots);
  }

  public static <C> Outcome<C> borda(Collection<? extends RankedBallot<C>> ballots, int startingAt) {
    return new Borda(startingAt).count(ballots);
  }

  public static <C> Outcome<C> borda(Stream<? extends RankedBallot<C>> ballots, int startingAt) {
    return new Borda(startingAt).count(ballots);
  }

  public static <C> Outcome<C> dowdall(Collection<? extends RankedBallot<C>> ballots) {
    return new Dowdall().count(ballots);
  }

  public static <C> Outcome<C> dowdall(Stream<? extends RankedBallot<C>> ballots) {
    return new Dowdall().count(ballots);
  }

  public static <C> Outcome<C> approval(Collection<? extends ApprovalBallot<C>> ballots) {
    return new Approval().count(ballots);
  }

  public static <C> Outcome<C> approval(Stream<? extends ApprovalBallot<C>> ballots) {
    return new Approval().count(ballots);
  }

  public static <C> Outcome<C> score(Collection<? extends ScoreBallot<C>> ballots) {
    return new ScoreVoting().count(ballots);
  }

  public static <C> Outcome<C> score(Stream<? extends ScoreBallot<C>> ballots) {
    return new ScoreVoting().count(ballots);
  }

  public static <C> Outcome<C> majorityJudgement(Collection<? extends ScoreBallot<C>> ballots) {
    return new MajorityJudgement().count(ballots);
  }

  public static <C> Outcome<C> majorityJudgement(Stream<? extends ScoreBallot<C>> ballots) {
    return new MajorityJudgement().count(ballots);
  }
}
