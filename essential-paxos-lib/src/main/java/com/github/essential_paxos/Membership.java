// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/// The static membership of the cluster. Reconfiguration is not supported.
///
/// @param acceptors the nodes that vote. Quorums are counted over this list.
/// @param learners  the nodes that are sent `Accepted` and `Decided` messages.
public record Membership(List<NodeId> acceptors, List<NodeId> learners) {
  public Membership {
    Objects.requireNonNull(acceptors, "acceptors");
    Objects.requireNonNull(learners, "learners");
    acceptors = List.copyOf(acceptors);
    learners = List.copyOf(learners);
    if (acceptors.isEmpty()) {
      throw new IllegalArgumentException("there must be at least one acceptor");
    }
    if (new HashSet<>(acceptors).size() != acceptors.size()) {
      throw new IllegalArgumentException("duplicate acceptor in " + acceptors);
    }
    if (new HashSet<>(learners).size() != learners.size()) {
      throw new IllegalArgumentException("duplicate learner in " + learners);
    }
  }

  public QuorumStrategy quorumStrategy() {
    return new SimpleMajority(acceptors.size());
  }
}
