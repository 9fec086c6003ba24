// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.metrics;

/// Receives metrics events. Implementations must be safe to call from any thread and must not block.
@FunctionalInterface
public interface EventSink {
  EventSink NONE = event -> {
  };

  void record(MetricsEvent event);
}
