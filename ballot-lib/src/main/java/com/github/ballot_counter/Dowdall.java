// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

/// The Nauru or Dowdall count. The candidate in the `n`th place on a ballot earns `1 / n` points: 1, 1/2, 1/3, ...
public final class Dowdall extends PositionalScoring {

  @Override
  protected double pointsFor(int position, int length) {
    return 1.0 / (position + 1);
  }
}
