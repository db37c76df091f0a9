// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter.ballot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A vote that gives each named candidate a numeric score. Scores are not normalised and any finite value is allowed.
public record ScoreBallot<C>(String id, Map<C, Double> scores) implements Ballot<C> {
  public ScoreBallot {
    BallotIds.requireId(id);
    Objects.requireNonNull(scores, "scores");
    final var copy = new LinkedHashMap<C, Double>();
    scores.forEach((candidate, score) -> {
      Objects.requireNonNull(candidate, "a ballot cannot name a null candidate");
      Objects.requireNonNull(score, "score");
      if (!Double.isFinite(score)) {
        throw new IllegalArgumentException("score for " + candidate + " must be finite but was " + score);
      }
      copy.put(candidate, score);
    });
    scores = Collections.unmodifiableMap(copy);
  }

  public static <C> ScoreBallot<C> of(Map<C, ? extends Number> scores) {
    final var doubles = new LinkedHashMap<C, Double>();
    scores.forEach((candidate, score) -> doubles.put(candidate, score == null ? null : score.doubleValue()));
    return new ScoreBallot<>(BallotIds.next(), doubles);
  }

  @Override
  public List<C> candidates() {
    return List.copyOf(scores.keySet());
  }

  @Override
  public BallotType type() {
    return BallotType.SCORE;
  }
}
