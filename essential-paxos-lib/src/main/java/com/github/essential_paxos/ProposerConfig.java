// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.random.RandomGenerator;

/// The timing knobs of a proposer.
///
/// @param roundDeadlineMillis how long a phase may wait for a quorum before the round is abandoned.
/// @param maxRetries          how many times an abandoned round is retried before giving up with a liveness failure.
/// @param backoffBaseMillis   the backoff before the first retry. It doubles on each further retry.
/// @param backoffMaxMillis    the cap on the backoff before jitter is applied.
public record ProposerConfig(long roundDeadlineMillis, int maxRetries, long backoffBaseMillis, long backoffMaxMillis) {

  public static final ProposerConfig DEFAULT = new ProposerConfig(200, 10, 20, 2_000);

  public ProposerConfig {
    if (roundDeadlineMillis <= 0) {
      throw new IllegalArgumentException("roundDeadlineMillis must be positive but was " + roundDeadlineMillis);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
    }
    if (backoffBaseMillis <= 0 || backoffMaxMillis < backoffBaseMillis) {
      throw new IllegalArgumentException("backoff must satisfy 0 < base <= max but was "
          + backoffBaseMillis + " and " + backoffMaxMillis);
    }
  }

  public ProposerConfig withRoundDeadlineMillis(long roundDeadlineMillis) {
    return new ProposerConfig(roundDeadlineMillis, maxRetries, backoffBaseMillis, backoffMaxMillis);
  }

  public ProposerConfig withMaxRetries(int maxRetries) {
    return new ProposerConfig(roundDeadlineMillis, maxRetries, backoffBaseMillis, backoffMaxMillis);
  }

  public ProposerConfig withBackoff(long backoffBaseMillis, long backoffMaxMillis) {
    return new ProposerConfig(roundDeadlineMillis, maxRetries, backoffBaseMillis, backoffMaxMillis);
  }

  /// Exponential backoff capped at the max and then multiplied by a jitter in `[0.5, 1.0)` so that competing
  /// proposers drift apart.
  ///
  /// @param retry the retry about to be made starting at one.
  public long backoffMillis(int retry, RandomGenerator random) {
    final int shift = Math.min(Math.max(retry - 1, 0), 30);
    final long exponential = Math.min(backoffMaxMillis, backoffBaseMillis << shift);
    final double jitter = 0.5 + random.nextDouble() * 0.5;
    return Math.max(1L, (long) (exponential * jitter));
  }
}
