// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

/// The identity of a cluster member. It is also the unique tie-breaker inside a [ProposalId] so it must be unique
/// across the cluster and across enough time for prior messages to have been forgotten.
public record NodeId(short id) implements Comparable<NodeId> {
  public NodeId {
    if (id < 0) throw new IllegalArgumentException("Node ID must be non-negative");
  }

  public static NodeId of(int id) {
    if (id > Short.MAX_VALUE) throw new IllegalArgumentException("Node ID must fit in a short: " + id);
    return new NodeId((short) id);
  }

  @Override
  public int compareTo(NodeId other) {
    return Short.compare(id, other.id);
  }

  @Override
  public String toString() {
    return "#" + id;
  }
}
