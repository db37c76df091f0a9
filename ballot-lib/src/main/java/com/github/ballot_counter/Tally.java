// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Stream;

/// # Tally
///
/// Running totals of points per candidate built in a single forward pass. Alongside the totals it tracks the highest
/// total seen and every candidate tied at that total, so the winners are known the moment the pass ends without a
/// second scan of the totals:
///
/// - when a candidate's new total beats the maximum the leaders reset to just that candidate;
/// - when it equals the maximum the candidate joins the leaders;
/// - otherwise the leaders are unchanged.
///
/// The maximum is seeded by the first points seen. This makes the input a one-way sequence that is consumed once which
/// suits lazily produced or streamed ballots. A tally is created and discarded within one count; it is not thread safe.
///
/// @param <C> the candidate type
public final class Tally<C> {
  private final Map<C, Double> totals = new HashMap<>();
  private final Set<C> leaders = new LinkedHashSet<>();
  private double maximum;
  private long additions;

  /// Counts every [Points] in the stream and returns the tally.
  ///
  /// @throws NoSuchElementException if the stream is empty
  public static <C> Tally<C> of(Stream<Points<C>> points) {
    final var tally = new Tally<C>();
    points.forEachOrdered(p -> tally.add(p.candidate(), p.points()));
    if (tally.isEmpty()) {
      throw new NoSuchElementException("there are no votes to count");
    }
    return tally;
  }

  /// All candidates sharing the maximum score. A single candidate is an outright winner, more than one is a tie.
  ///
  /// @throws NoSuchElementException if the stream is empty
  public static <C> Set<C> allMaxScores(Stream<Points<C>> points) {
    return of(points).leaders();
  }

  public void add(C candidate, double points) {
    final double total = totals.merge(candidate, points, Double::sum);
    if (additions++ == 0 || total > maximum) {
      leaders.clear();
      leaders.add(candidate);
      maximum = total;
    } else if (total == maximum) {
      leaders.add(candidate);
    }
  }

  public boolean isEmpty() {
    return additions == 0;
  }

  public Set<C> leaders() {
    return Collections.unmodifiableSet(leaders);
  }

  public double maximum() {
    if (isEmpty()) {
      throw new NoSuchElementException("nothing has been tallied");
    }
    return maximum;
  }

  public double total(C candidate) {
    return totals.getOrDefault(candidate, 0.0);
  }

  public Map<C, Double> totals() {
    return Collections.unmodifiableMap(totals);
  }

  @Override
  public String toString() {
    return "Tally" + totals + " leaders=" + leaders;
  }
}
