// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Objects;

/// A proposal id is the ballot number of the Paxos algorithm. Acceptors make promises to not accept any protocol
/// messages with an id less than the one they have promised.
///
/// Each proposer generates its own ids locally. There is no shared counter. Uniqueness across the cluster comes from
/// the proposer [NodeId] which is used as the tie-breaker.
///
/// @param round    The round is incremented each time a proposer abandons an attempt and tries again.
/// @param proposer The node identifier of the proposer which ensures no two proposers generate the same id.
public record ProposalId(long round, NodeId proposer) implements Comparable<ProposalId> {

  public ProposalId {
    if (round < 0) {
      throw new IllegalArgumentException("round must be >= 0 but was " + round);
    }
    Objects.requireNonNull(proposer, "proposer");
  }

  /// The first id a proposer uses when it has seen nothing else in the cluster.
  public static ProposalId first(NodeId proposer) {
    return new ProposalId(1, proposer);
  }

  /// The next id for this proposer that is strictly higher than both this id and the highest id it has observed.
  public ProposalId nextAbove(ProposalId highestSeen) {
    return new ProposalId(Math.max(round, highestSeen.round) + 1, proposer);
  }

  /// Compare the round first then use the proposer node identifier as the tie-breaker.
  @Override
  public int compareTo(ProposalId that) {
    int roundComparison = Long.compare(this.round, that.round);
    if (roundComparison != 0) {
      return roundComparison;
    }
    return this.proposer.compareTo(that.proposer);
  }

  @Override
  public String toString() {
    return String.format("N(r=%d,p=%d)", round, proposer.id());
  }

  public boolean lessThan(ProposalId other) {
    return this.compareTo(other) < 0;
  }

  public boolean greaterThan(ProposalId other) {
    return this.compareTo(other) > 0;
  }

  public boolean lessThanOrEqualTo(ProposalId other) {
    return this.compareTo(other) <= 0;
  }
}
