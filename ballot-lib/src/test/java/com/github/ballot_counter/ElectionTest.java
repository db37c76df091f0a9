// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ApprovalBallot;
import com.github.ballot_counter.ballot.BallotType;
import com.github.ballot_counter.ballot.PluralityBallot;
import com.github.ballot_counter.ballot.RankedBallot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElectionTest {
  static {
    LoggerConfig.initialize();
  }

  static <C> Election<C> accepted(CastResult<C> result) {
    assertThat(result).isInstanceOf(CastResult.Accepted.class);
    return result.accepted().orElseThrow();
  }

  @Test
  void acceptedBallotsAreCounted() {
    var election = Election.of("A", "B");
    election = accepted(election.cast(PluralityBallot.of("A")));
    election = accepted(election.cast(PluralityBallot.of("A")));
    election = accepted(election.cast(PluralityBallot.of("B")));

    assertThat(election.size()).isEqualTo(3);
    assertThat(election.ballotType()).contains(BallotType.PLURALITY);
    assertThat(BallotCounter.plurality(election.pluralityBallots())).isEqualTo(new Outcome.Winner<>("A"));
  }

  @Test
  void mixingBallotTypesIsRejected() {
    final var election = accepted(Election.of("A").cast(PluralityBallot.of("A")));
    final var approval = ApprovalBallot.of("A");

    final var result = election.cast(approval);

    assertThat(result).isEqualTo(new CastResult.Rejected<>(CastError.WRONG_VOTE_TYPE, approval));
    assertThat(election.size()).isEqualTo(1);
  }

  @Test
  void recastingTheSameIdIsRejected() {
    final var ballot = new PluralityBallot<>("abcd-1234", "A");
    final var election = accepted(Election.of("A", "B").cast(ballot));

    final var again = election.cast(new PluralityBallot<>("abcd-1234", "B"));

    assertThat(again.rejection()).contains(CastError.DUPLICATE_VOTE);
    assertThat(election.ballots()).containsExactly(ballot);
  }

  @Test
  void unknownCandidatesAreRejected() {
    final var result = Election.of("A", "B").cast(RankedBallot.of("A", "Z"));
    assertThat(result.rejection()).contains(CastError.CANDIDATE_NOT_IN_ELECTION);
    assertThat(result.accepted()).isEmpty();
  }

  @Test
  void checksRunInOrder() {
    final var ballot = new PluralityBallot<>("same", "A");
    final var election = accepted(Election.of("A").cast(ballot));

    // wrong type, duplicate id and unknown candidate at once
    final var all = election.cast(new ApprovalBallot<>("same", List.of("Z")));
    assertThat(all.rejection()).contains(CastError.WRONG_VOTE_TYPE);

    // duplicate id and unknown candidate
    final var both = election.cast(new PluralityBallot<>("same", "Z"));
    assertThat(both.rejection()).contains(CastError.DUPLICATE_VOTE);
  }

  @Test
  void castingNeverChangesTheOriginal() {
    final var empty = Election.of(List.of("A", "B", "A"));
    final var one = accepted(empty.cast(RankedBallot.of("A")));
    final var two = accepted(one.cast(RankedBallot.of("B", "A")));

    assertThat(empty.candidates()).containsExactlyInAnyOrder("A", "B");
    assertThat(empty.size()).isZero();
    assertThat(empty.ballotType()).isEmpty();
    assertThat(one.size()).isEqualTo(1);
    assertThat(two.size()).isEqualTo(2);
    assertThat(two.ballots().get(0).candidates()).containsExactly("B", "A");
  }

  @Test
  void typedViewsMatchTheBallotType() {
    final var election = accepted(Election.of("A", "B").cast(RankedBallot.of("A", "B")));
    assertThat(election.rankedBallots()).hasSize(1);
    assertThat(BallotCounter.instantRunoff(election.rankedBallots())).isEqualTo(new Outcome.Winner<>("A"));
    assertThatThrownBy(election::scoreBallots).isInstanceOf(IllegalStateException.class);
    assertThat(Election.of("A").approvalBallots()).isEmpty();
  }
}
