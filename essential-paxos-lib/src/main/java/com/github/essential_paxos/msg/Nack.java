// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.ProposalId;

import java.util.Objects;

/// A Nack is a negative response to either a [Prepare] or an [Accept]. It tells the proposer which higher id the
/// acceptor is bound by so that the next attempt can jump above it.
///
/// @param from     The acceptor that refused.
/// @param slot     The consensus instance.
/// @param id       The id that was refused.
/// @param promised The id the acceptor has promised which is the reason for the refusal.
public record Nack(NodeId from, long slot, ProposalId id, ProposalId promised) implements PaxosMessage, ReplyMessage {
  public Nack {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(promised, "promised");
  }

  @Override
  public MessageType type() {
    return MessageType.NACK;
  }

  public String reason() {
    return "promised " + promised;
  }
}
