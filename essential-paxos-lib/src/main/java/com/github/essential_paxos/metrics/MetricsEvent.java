// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.metrics;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Role;

import java.util.Objects;

/// One observation made by a role or by the messenger.
///
/// @param slot      the consensus instance.
/// @param node      the node that made the observation.
/// @param role      the role that made the observation.
/// @param type      what happened.
/// @param timestamp milliseconds on the clock of the scheduler that drives the node.
public record MetricsEvent(long slot, NodeId node, Role role, EventType type, long timestamp) {
  public MetricsEvent {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(type, "type");
  }
}
