// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.RankedBallot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static com.github.ballot_counter.Ballots.profile;
import static com.github.ballot_counter.Ballots.ranked;
import static com.github.ballot_counter.Ballots.stanfordProfile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstantRunoffTest {
  static {
    LoggerConfig.initialize();
  }

  @Test
  void firstChoiceMajorityWins() {
    final var ballots = ranked(List.of("A"), List.of("A"), List.of("B"));
    assertThat(BallotCounter.instantRunoff(ballots)).isEqualTo(new Outcome.Winner<>("A"));
  }

  @Test
  void tiedLosersAreEliminatedTogether() {
    final var ballots = ranked(List.of("A", "C"), List.of("B", "C"), List.of("C"), List.of("C"));
    final var irv = new InstantRunoff();

    final var first = irv.round(1, ballots, Set.of());
    assertThat(first.tallies()).isEqualTo(Map.of("A", 1L, "B", 1L, "C", 2L));
    assertThat(first.leaderPercentage()).isEqualTo(50.0);
    assertThat(first.losers()).containsExactlyInAnyOrder("A", "B");

    final var second = irv.round(2, ballots, first.losers());
    assertThat(second.tallies()).isEqualTo(Map.of("C", 4L));

    assertThat(irv.count(ballots)).isEqualTo(new Outcome.Winner<>("C"));
  }

  @Test
  void higherWinPercentageNeedsMoreRounds() {
    final var ballots = ranked(
        List.of("A", "F"), List.of("A", "F"), List.of("A", "F"),
        List.of("B", "F"), List.of("C", "F"), List.of("D", "F"), List.of("E", "F"));
    assertThat(BallotCounter.instantRunoff(ballots, 75.0)).isEqualTo(new Outcome.Winner<>("F"));
  }

  @Test
  void exhaustedBallotsLeaveTheDenominator() {
    final var ballots = ranked(List.of("A"), List.of("A"), List.of("B"), List.of("C"));
    final var irv = new InstantRunoff();
    final var first = irv.round(1, ballots, Set.of());
    assertThat(first.leaderPercentage()).isEqualTo(50.0);
    assertThat(first.losers()).containsExactlyInAnyOrder("B", "C");
    final var second = irv.round(2, ballots, first.losers());
    assertThat(second.total()).isEqualTo(2L);
    assertThat(second.leaderPercentage()).isEqualTo(100.0);
    assertThat(irv.count(ballots)).isEqualTo(new Outcome.Winner<>("A"));
  }

  @Test
  void unanimityIsNotEnoughAtOneHundredPercent() {
    final var ballots = ranked(List.of("A"), List.of("A"));
    assertThat(BallotCounter.instantRunoff(ballots, 100.0)).isInstanceOf(Outcome.NoWinner.class);
  }

  @Test
  void fullTieEliminatesEveryoneAndHasNoWinner() {
    final var ballots = ranked(List.of("A"), List.of("B"));
    assertThat(BallotCounter.instantRunoff(ballots)).isEqualTo(Outcome.none());
    final var round = new InstantRunoff().round(1, ballots, Set.of());
    assertThat(round.losers()).containsExactlyInAnyOrder("A", "B");
  }

  @Test
  void stanfordProfileElectsD() {
    assertThat(BallotCounter.instantRunoff(profile(stanfordProfile()))).isEqualTo(new Outcome.Winner<>("D"));
  }

  @Test
  void streamIsMaterialisedOnce() {
    final var ballots = ranked(List.of("A", "C"), List.of("B", "C"), List.of("C"), List.of("C"));
    assertThat(new InstantRunoff().count(ballots.stream())).isEqualTo(new Outcome.Winner<>("C"));
  }

  @Test
  void countingTwiceGivesTheSameResult() {
    final var ballots = profile(stanfordProfile());
    assertThat(BallotCounter.instantRunoff(ballots)).isEqualTo(BallotCounter.instantRunoff(ballots));
  }

  @ParameterizedTest
  @ValueSource(doubles = {49.9, 0.0, 100.1, Double.NaN})
  void winPercentageOutOfRangeIsRejected(double winPercentage) {
    final var ballots = ranked(List.of("A"));
    assertThatThrownBy(() -> BallotCounter.instantRunoff(ballots, winPercentage))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void noBallotsIsAnError() {
    assertThatThrownBy(() -> BallotCounter.instantRunoff(List.<RankedBallot<String>>of()))
        .isInstanceOf(NoSuchElementException.class);
  }
}
