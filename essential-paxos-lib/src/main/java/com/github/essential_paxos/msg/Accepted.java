// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Proposal;
import com.github.essential_paxos.ProposalId;
import com.github.essential_paxos.Value;

import java.util.Objects;

/// Accepted is the positive response to an [Accept]. It is sent to the proposer and to every learner.
public record Accepted(NodeId from, long slot, Proposal proposal) implements PaxosMessage, ReplyMessage {
  public Accepted {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(proposal, "proposal");
  }

  @Override
  public MessageType type() {
    return MessageType.ACCEPTED;
  }

  @Override
  public ProposalId id() {
    return proposal.id();
  }

  public Value value() {
    return proposal.value();
  }
}
