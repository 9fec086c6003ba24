// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.Outcome;
import com.github.essential_paxos.Value;

import java.util.Objects;

/// What one trial produced. A liveness failure is an ordinary result and does not stop a batch.
public sealed interface TrialResult permits TrialResult.Decided, TrialResult.LivenessFailure {

  int trial();

  long elapsedMillis();

  int retries();

  /// @param elapsedMillis virtual time from the start of the trial until the first learner decided.
  /// @param retries       retries summed over all proposers.
  /// @param rounds        rounds summed over all proposers.
  record Decided(int trial, Value value, long elapsedMillis, int retries, int rounds, long messagesSent,
                 long messagesDropped) implements TrialResult {
    public Decided {
      Objects.requireNonNull(value, "value");
    }
  }

  record LivenessFailure(int trial, Outcome.Reason reason, long elapsedMillis, int retries, long messagesSent,
                         long messagesDropped) implements TrialResult {
    public LivenessFailure {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
