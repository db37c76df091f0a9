// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import com.github.ballot_counter.ballot.ApprovalBallot;
import com.github.ballot_counter.ballot.Ballot;
import com.github.ballot_counter.ballot.BallotType;
import com.github.ballot_counter.ballot.PluralityBallot;
import com.github.ballot_counter.ballot.RankedBallot;
import com.github.ballot_counter.ballot.ScoreBallot;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.github.ballot_counter.BallotLogger.LOGGER;

/// # Election
///
/// An immutable value holding the candidates standing and the ballots cast so far. The only way to add a ballot is
/// [#cast(Ballot)] which checks, in order, that:
///
/// 1. the ballot is the same [BallotType] as the ballots already cast;
/// 2. no ballot with the same id has been cast;
/// 3. every candidate the ballot names is standing.
///
/// A ballot that passes is added to a new election and the original is left untouched, so an election can be shared
/// freely and every counter sees a consistent snapshot. Elections never count; hand one of the typed ballot views to a
/// counter such as [BallotCounter#instantRunoff(Collection)].
public final class Election<C> {
  private final Set<C> candidates;
  /// Most recently cast first.
  private final List<Ballot<C>> ballots;
  private final Set<String> ballotIds;

  private Election(Set<C> candidates, List<Ballot<C>> ballots, Set<String> ballotIds) {
    this.candidates = candidates;
    this.ballots = ballots;
    this.ballotIds = ballotIds;
  }

  /// An election with no ballots. Duplicate candidates collapse.
  public static <C> Election<C> of(@NotNull Collection<C> candidates) {
    return new Election<>(Set.copyOf(candidates), List.of(), Set.of());
  }

  @SafeVarargs
  public static <C> Election<C> of(C... candidates) {
    return of(Arrays.asList(candidates));
  }

  public CastResult<C> cast(@NotNull Ballot<C> ballot) {
    Objects.requireNonNull(ballot, "ballot");
    final var error = validate(ballot);
    if (error.isPresent()) {
      LOGGER.fine(() -> "election rejected ballot " + ballot.id() + " as " + error.get());
      return new CastResult.Rejected<>(error.get(), ballot);
    }
    final var nextBallots = new ArrayList<Ballot<C>>(ballots.size() + 1);
    nextBallots.add(ballot);
    nextBallots.addAll(ballots);
    final var nextIds = new HashSet<>(ballotIds);
    nextIds.add(ballot.id());
    return new CastResult.Accepted<>(
        new Election<>(candidates, Collections.unmodifiableList(nextBallots), Collections.unmodifiableSet(nextIds)));
  }

  private Optional<CastError> validate(Ballot<C> ballot) {
    if (ballotType().filter(type -> type != ballot.type()).isPresent()) {
      return Optional.of(CastError.WRONG_VOTE_TYPE);
    }
    if (ballotIds.contains(ballot.id())) {
      return Optional.of(CastError.DUPLICATE_VOTE);
    }
    if (!candidates.containsAll(ballot.candidates())) {
      return Optional.of(CastError.CANDIDATE_NOT_IN_ELECTION);
    }
    return Optional.empty();
  }

  public Set<C> candidates() {
    return candidates;
  }

  /// Every ballot cast, most recent first. Counting does not depend on the order.
  public List<Ballot<C>> ballots() {
    return ballots;
  }

  public int size() {
    return ballots.size();
  }

  /// The type of the first ballot cast, which every later ballot must share. Empty until a ballot is cast.
  public Optional<BallotType> ballotType() {
    return ballots.isEmpty() ? Optional.empty() : Optional.of(ballots.get(ballots.size() - 1).type());
  }

  public List<PluralityBallot<C>> pluralityBallots() {
    return view(BallotType.PLURALITY);
  }

  public List<ApprovalBallot<C>> approvalBallots() {
    return view(BallotType.APPROVAL);
  }

  public List<RankedBallot<C>> rankedBallots() {
    return view(BallotType.RANKED);
  }

  public List<ScoreBallot<C>> scoreBallots() {
    return view(BallotType.SCORE);
  }

  /// Every ballot has the election's type so the cast is checked by the type test.
  @SuppressWarnings("unchecked")
  private <B extends Ballot<C>> List<B> view(BallotType type) {
    if (ballotType().filter(t -> t != type).isPresent()) {
      throw new IllegalStateException("election holds " + ballotType().orElseThrow() + " ballots not " + type);
    }
    return (List<B>) (List<?>) ballots;
  }

  @Override
  public String toString() {
    return "Election{candidates=" + candidates + ", ballots=" + ballots.size() + "}";
  }
}
