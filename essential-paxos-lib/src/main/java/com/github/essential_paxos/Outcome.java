// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Objects;

/// The terminal result of a proposer attempting to get a value chosen for one slot. Failures of liveness are
/// ordinary values and not exceptions as the caller is expected to retry or give up.
public sealed interface Outcome permits Outcome.Chosen, Outcome.LivenessFailure {

  long slot();

  int rounds();

  int retries();

  long elapsedMillis();

  /// A value was chosen for the slot. It may not be the value that this proposer started with.
  ///
  /// @param adopted true when the chosen value came from another proposer rather than our own candidate.
  record Chosen(long slot, Value value, boolean adopted, int rounds, int retries, long elapsedMillis)
      implements Outcome {
    public Chosen {
      Objects.requireNonNull(value, "value");
    }
  }

  /// The proposer gave up without learning a chosen value. A value may still be chosen by some other proposer.
  record LivenessFailure(long slot, Reason reason, int rounds, int retries, long elapsedMillis) implements Outcome {
    public LivenessFailure {
      Objects.requireNonNull(reason, "reason");
    }
  }

  enum Reason {
    /// Retries were exhausted without a quorum of promises or accepts.
    QUORUM_UNAVAILABLE,
    /// The attempt was abandoned by the host such as when the node was restarted or closed.
    ABANDONED
  }
}
