// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.metrics.NodeSnapshot;
import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.MessageType;
import com.github.essential_paxos.msg.Nack;
import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// The acceptor of one node for one slot. This is the only role that holds durable state.
///
/// Every state change is written to the [Journal] and synced before the reply is returned. The caller must only send
/// the reply after this method returns. This class is not thread safe and is driven under the mutex of [PaxosNode].
///
/// This class will mark the slot as failed if the journal throws or if a protocol invariant would be violated. A failed
/// acceptor keeps its last durable state and never replies again for this slot. The node must be restarted to reload
/// the journal.
public class Acceptor {
  static final String FAILED = Acceptor.class.getCanonicalName()
      + " SEVERE ERROR FAILED the acceptor is refusing to take part in this slot until the node is restarted: ";

  private final NodeId nodeId;
  private final long slot;
  private final Journal journal;
  private AcceptorState state;
  private boolean failed = false;
  private MessageType lastMessageType;

  /// Create an acceptor by loading any durable state for the slot.
  ///
  /// @param nodeId  the node hosting this acceptor.
  /// @param slot    the consensus instance.
  /// @param journal the durable storage which may already hold a state for this slot.
  public Acceptor(NodeId nodeId, long slot, Journal journal) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.slot = slot;
    this.journal = Objects.requireNonNull(journal, "journal");
    final var loaded = journal.readAcceptorState(nodeId, slot);
    if (loaded.isPresent() && (!loaded.get().acceptor().equals(nodeId) || loaded.get().slot() != slot)) {
      LOGGER.severe("FATAL SEVERE ERROR refusing to run the journal state does not match this acceptor: nodeId="
          + nodeId + ", slot=" + slot + ", journal=" + loaded.get());
      throw new IllegalArgumentException("nodeId=" + nodeId + " slot=" + slot + " journal=" + loaded.get());
    }
    this.state = loaded.orElseGet(() -> AcceptorState.empty(nodeId, slot));
  }

  /// Phase 1b. Promise when the id is higher than any promise made so far. The same id is answered again with the same
  /// promise so that a duplicated or retransmitted prepare still gets a reply. Lower ids are refused with the promise
  /// that binds us.
  public Optional<PaxosMessage> handle(Prepare prepare) {
    if (refuse(prepare)) {
      return Optional.empty();
    }
    final var id = prepare.id();
    final var promised = state.promised();
    if (promised.isEmpty() || id.greaterThan(promised.get())) {
      final var next = state.withPromised(id);
      return persistThenReply(prepare, next, new Promise(nodeId, slot, id, next.accepted()));
    } else if (id.equals(promised.get())) {
      return Optional.of(new Promise(nodeId, slot, id, state.accepted()));
    } else {
      return Optional.of(new Nack(nodeId, slot, id, promised.get()));
    }
  }

  /// Phase 2b. Accept when the id is not lower than our promise. Accepting raises the promise to the accepted id.
  public Optional<PaxosMessage> handle(Accept accept) {
    if (refuse(accept)) {
      return Optional.empty();
    }
    final var proposal = accept.proposal();
    final var promised = state.promised();
    if (promised.isEmpty() || proposal.id().greaterThan(promised.get()) || proposal.id().equals(promised.get())) {
      if (state.accepted().map(proposal::equals).orElse(false)) {
        // a duplicate needs no write
        return Optional.of(new Accepted(nodeId, slot, proposal));
      }
      final var next = state.withAccepted(proposal);
      return persistThenReply(accept, next, new Accepted(nodeId, slot, proposal));
    } else {
      return Optional.of(new Nack(nodeId, slot, proposal.id(), promised.get()));
    }
  }

  private boolean refuse(PaxosMessage message) {
    if (message.slot() != slot) {
      throw new IllegalArgumentException("acceptor for slot " + slot + " was given " + message);
    }
    lastMessageType = message.type();
    if (failed) {
      LOGGER.fine(() -> nodeId + " failed acceptor for slot " + slot + " ignoring " + message);
      return true;
    }
    return false;
  }

  private Optional<PaxosMessage> persistThenReply(PaxosMessage input, AcceptorState next, PaxosMessage reply) {
    final var prior = state;
    if (!validTransition(input, prior, next)) {
      return Optional.empty();
    }
    try {
      journal.writeAcceptorState(next);
      journal.sync();
    } catch (RuntimeException e) {
      failed = true;
      LOGGER.log(Level.SEVERE, FAILED + nodeId + " slot=" + slot + " input=" + input + " " + e, e);
      return Optional.empty();
    }
    state = next;
    return Optional.of(reply);
  }

  /// Here we check that we have not violated the Paxos algorithm invariants. If we would then we mark the slot failed.
  private boolean validTransition(PaxosMessage input, AcceptorState prior, AcceptorState next) {
    if (prior.promised().isPresent()
        && (next.promised().isEmpty() || next.promised().get().lessThan(prior.promised().get()))) {
      failed = true;
      LOGGER.severe(FAILED + "promise went backwards from " + prior + " to " + next + " on " + input);
      return false;
    }
    if (!next.invariantHolds()) {
      failed = true;
      LOGGER.severe(FAILED + "accepted above promise " + next + " on " + input);
      return false;
    }
    return true;
  }

  public NodeId nodeId() {
    return nodeId;
  }

  public long slot() {
    return slot;
  }

  public boolean isFailed() {
    return failed;
  }

  public AcceptorState state() {
    return state;
  }

  public NodeSnapshot snapshot() {
    final String name;
    if (failed) {
      name = "FAILED";
    } else if (state.accepted().isPresent()) {
      name = "ACCEPTED";
    } else if (state.promised().isPresent()) {
      name = "PROMISED";
    } else {
      name = "IDLE";
    }
    return new NodeSnapshot(nodeId, Role.ACCEPTOR, slot, state.promised(), name, Optional.ofNullable(lastMessageType));
  }
}
