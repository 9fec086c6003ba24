// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Proposal;
import com.github.essential_paxos.ProposalId;
import com.github.essential_paxos.Value;

import java.util.Objects;

/// The Accept message is the second message in the Paxos protocol named in the paper Paxos Made Simple by Leslie Lamport.
///
/// @param from     The proposer.
/// @param slot     The consensus instance.
/// @param proposal This is the `{N,V}` that the proposer asks acceptors to accept.
public record Accept(NodeId from, long slot, Proposal proposal) implements PaxosMessage {
  public Accept {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(proposal, "proposal");
  }

  @Override
  public MessageType type() {
    return MessageType.ACCEPT;
  }

  public ProposalId id() {
    return proposal.id();
  }

  public Value value() {
    return proposal.value();
  }
}
