// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ballot_counter;

import java.util.logging.Logger;

/// The single JUL logger of the library. The library never configures handlers or levels, that is left to the host.
final class BallotLogger {
  static final Logger LOGGER = Logger.getLogger(BallotLogger.class.getPackageName());

  private BallotLogger() {
  }
}
