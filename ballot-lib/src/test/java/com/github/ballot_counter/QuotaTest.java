// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.PluralityBallot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.NoSuchElementException;

import static com.github.ballot_counter.Ballots.plurality;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaTest {
  static {
    LoggerConfig.initialize();
  }

  final List<PluralityBallot<String>> ballots = plurality("A", "A", "B");

  @Test
  void percentageQuotaMetByOneCandidate() {
    assertThat(BallotCounter.quota(ballots, 60)).isEqualTo(new Outcome.Winner<>("A"));
  }

  @Test
  void lowQuotaCanBeMetByEveryone() {
    assertThat(BallotCounter.quota(ballots, 30).winners()).containsExactlyInAnyOrder("A", "B");
    assertThat(BallotCounter.quota(ballots, 0.30).winners()).containsExactlyInAnyOrder("A", "B");
  }

  @Test
  void unmetQuotaIsNoWinnerNotAnError() {
    assertThat(BallotCounter.quota(ballots, 70)).isInstanceOf(Outcome.NoWinner.class);
    assertThat(BallotCounter.quota(plurality("A", "A", "B", "B"), 0.60)).isInstanceOf(Outcome.NoWinner.class);
  }

  @Test
  void quotaIsInclusive() {
    assertThat(BallotCounter.quota(plurality("A", "B"), 50).winners()).containsExactlyInAnyOrder("A", "B");
  }

  @Test
  void oneIsAFractionOfTheWhole() {
    assertThat(new Quota(1).fraction()).isEqualTo(1.0);
    assertThat(new Quota(100).fraction()).isEqualTo(1.0);
    assertThat(BallotCounter.quota(plurality("A", "A"), 1)).isEqualTo(new Outcome.Winner<>("A"));
  }

  @ParameterizedTest
  @ValueSource(doubles = {0.0, -1.0, 100.5, Double.NaN})
  void outOfRangeQuotaIsRejected(double quota) {
    assertThatThrownBy(() -> new Quota(quota)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void noBallotsIsAnError() {
    assertThatThrownBy(() -> BallotCounter.quota(List.<PluralityBallot<String>>of(), 50))
        .isInstanceOf(NoSuchElementException.class);
  }
}
