// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.network;

/// The clock and timers of a node. A simulation supplies a virtual clock so that runs are repeatable.
public interface Scheduler {

  /// @return the current time in milliseconds on this scheduler's clock.
  long now();

  /// Run the task once after the delay. The task runs on a thread owned by the scheduler.
  Cancellable schedule(long delayMillis, Runnable task);
}
