// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Map;

/// This is the majority strategy from the paper Paxos Made Simple.
public class SimpleMajority implements QuorumStrategy {
  final int clusterSize;
  final int quorum;

  public SimpleMajority(int clusterSize) {
    if (clusterSize < 1) {
      throw new IllegalArgumentException("clusterSize must be at least 1");
    }
    this.clusterSize = clusterSize;
    this.quorum = (int) Math.floor((clusterSize / 2.0) + 1);
  }

  public int quorum() {
    return quorum;
  }

  @Override
  public QuorumOutcome assessPromises(long slot, Map<NodeId, Boolean> promises) {
    return countVotes(quorum, promises.values());
  }

  @Override
  public QuorumOutcome assessAccepts(long slot, Map<NodeId, Boolean> accepts) {
    return countVotes(quorum, accepts.values());
  }
}
