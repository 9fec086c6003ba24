// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.metrics;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.ProposalId;
import com.github.essential_paxos.Role;
import com.github.essential_paxos.msg.MessageType;

import java.util.Objects;
import java.util.Optional;

/// A read only view of one role for one slot. Taking a snapshot never changes the role.
///
/// @param nodeId          the node hosting the role.
/// @param role            the role.
/// @param slot            the consensus instance.
/// @param currentRound    the proposal id the role is working with. For an acceptor this is its promise.
/// @param state           a short human readable state name such as `PREPARING` or `DECIDED`.
/// @param lastMessageType the type of the last message the role handled.
public record NodeSnapshot(NodeId nodeId,
                           Role role,
                           long slot,
                           Optional<ProposalId> currentRound,
                           String state,
                           Optional<MessageType> lastMessageType) {
  public NodeSnapshot {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(currentRound, "currentRound");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(lastMessageType, "lastMessageType");
  }
}
