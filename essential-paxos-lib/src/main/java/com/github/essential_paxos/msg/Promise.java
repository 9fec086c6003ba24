// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.msg;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Proposal;
import com.github.essential_paxos.ProposalId;

import java.util.Objects;
import java.util.Optional;

/// A Promise is a positive response to a [Prepare]. The acceptor has made a promise to not accept any future Prepare
/// or Accept messages with a lower id. It reports the highest proposal it has already accepted so that the proposer can
/// choose a safe value.
///
/// @param from          The acceptor that made the promise.
/// @param slot          The consensus instance.
/// @param id            The id that was promised.
/// @param priorAccepted The highest proposal accepted by the acceptor before this promise, if any.
public record Promise(NodeId from, long slot, ProposalId id, Optional<Proposal> priorAccepted)
    implements PaxosMessage, ReplyMessage {
  public Promise {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(priorAccepted, "priorAccepted");
    priorAccepted.ifPresent(p -> {
      if (p.id().greaterThan(id)) {
        throw new IllegalArgumentException("prior accepted " + p.id() + " is above the promise " + id);
      }
    });
  }

  @Override
  public MessageType type() {
    return MessageType.PROMISE;
  }
}
