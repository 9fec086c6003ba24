// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// The interface to provide a strategy for determining whether a quorum has been reached.
/// The FPaxos paper [Flexible Paxos: Quorum intersection revisited](https://arxiv.org/pdf/1608.06696v1) shows that
/// we can be more flexible than simple majorities. What we need is that any prepare quorum overlaps with any accept
/// quorum in at least one acceptor.
///
/// The votes are keyed by acceptor so that a duplicated reply is never counted twice.
public interface QuorumStrategy {
  QuorumOutcome assessPromises(long slot, Map<NodeId, Boolean> promises);

  QuorumOutcome assessAccepts(long slot, Map<NodeId, Boolean> accepts);

  enum QuorumOutcome {
    WIN, LOSE, WAIT
  }

  default QuorumOutcome countVotes(int quorum, Collection<Boolean> votes) {
    Map<Boolean, List<Boolean>> voteMap = votes.stream().collect(Collectors.partitioningBy(v -> v));
    if (voteMap.get(true).size() >= quorum)
      return QuorumOutcome.WIN;
    else if (voteMap.get(false).size() >= quorum)
      return QuorumOutcome.LOSE;
    else
      return QuorumOutcome.WAIT;
  }
}
