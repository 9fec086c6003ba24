// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Objects;
import java.util.Optional;

/// The durable state of one acceptor for one slot. This is what must be flushed to disk before any reply is sent.
///
/// @param acceptor The node holding this state. Used to check that a journal is not shared by mistake.
/// @param slot     The consensus instance this state belongs to.
/// @param promised The highest proposal id this acceptor has promised, if any.
/// @param accepted The highest proposal this acceptor has accepted, if any.
public record AcceptorState(NodeId acceptor, long slot, Optional<ProposalId> promised, Optional<Proposal> accepted) {

  public AcceptorState {
    Objects.requireNonNull(acceptor, "acceptor");
    Objects.requireNonNull(promised, "promised");
    Objects.requireNonNull(accepted, "accepted");
    if (slot < 0) {
      throw new IllegalArgumentException("slot must be >= 0 but was " + slot);
    }
    if (accepted.isPresent() && promised.isEmpty()) {
      throw new IllegalArgumentException("accepted " + accepted.get() + " without any promise");
    }
  }

  /// The state of an acceptor that has never heard about the slot.
  public static AcceptorState empty(NodeId acceptor, long slot) {
    return new AcceptorState(acceptor, slot, Optional.empty(), Optional.empty());
  }

  public AcceptorState withPromised(ProposalId id) {
    return new AcceptorState(acceptor, slot, Optional.of(id), accepted);
  }

  /// Accepting a proposal also raises the promise to the proposal id.
  public AcceptorState withAccepted(Proposal proposal) {
    return new AcceptorState(acceptor, slot, Optional.of(proposal.id()), Optional.of(proposal));
  }

  /// The accepted id must never be above the promised id.
  public boolean invariantHolds() {
    return accepted.map(p -> promised.map(p.id()::lessThanOrEqualTo).orElse(false)).orElse(true);
  }
}
