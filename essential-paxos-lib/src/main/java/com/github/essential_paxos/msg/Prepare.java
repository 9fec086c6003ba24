// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.ProposalId;

import java.util.Objects;

/// The Prepare message is the first message in the Paxos protocol named in the paper Paxos Made Simple by Leslie Lamport.
///
/// @param from The node identifier of the proposer used to route the reply.
/// @param slot The consensus instance.
/// @param id   The `N` that the proposer asks acceptors to promise.
public record Prepare(NodeId from, long slot, ProposalId id) implements PaxosMessage {
  public Prepare {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(id, "id");
  }

  @Override
  public MessageType type() {
    return MessageType.PREPARE;
  }
}
