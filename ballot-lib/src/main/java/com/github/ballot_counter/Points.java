// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import java.util.Objects;

/// Points awarded to one candidate by one ballot. A counting pass is a stream of these fed into a [Tally].
public record Points<C>(C candidate, double points) {
  public Points {
    Objects.requireNonNull(candidate, "candidate");
  }

  public static <C> Points<C> one(C candidate) {
    return new Points<>(candidate, 1.0);
  }
}
