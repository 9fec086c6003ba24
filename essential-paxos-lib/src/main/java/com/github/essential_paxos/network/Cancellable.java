// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.network;

/// A handle on a scheduled task.
@FunctionalInterface
public interface Cancellable {
  /// Prevent the task from running if it has not run yet. Calling this more than once has no further effect.
  void cancel();
}
