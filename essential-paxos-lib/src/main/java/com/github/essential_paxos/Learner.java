// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.metrics.NodeSnapshot;
import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.Decided;
import com.github.essential_paxos.msg.MessageType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// The learner of one node for one slot. It counts `Accepted` messages per proposal and announces a decision exactly
/// once when a quorum of distinct acceptors have accepted the same proposal. A `Decided` message short-circuits the
/// count. Learner state is volatile and is rebuilt from the network after a restart.
public class Learner {
  private final NodeId nodeId;
  private final long slot;
  private final QuorumStrategy quorumStrategy;
  private final Level logAtLevel;
  private final Map<Proposal, Map<NodeId, Boolean>> tally = new HashMap<>();
  private final List<Value> conflicts = new ArrayList<>();
  private Value decided;
  private ProposalId decidedId;
  private ProposalId highestSeen;
  private MessageType lastMessageType;

  public Learner(NodeId nodeId, long slot, QuorumStrategy quorumStrategy, Level logAtLevel) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.slot = slot;
    this.quorumStrategy = Objects.requireNonNull(quorumStrategy, "quorumStrategy");
    this.logAtLevel = Objects.requireNonNull(logAtLevel, "logAtLevel");
  }

  /// Count an accept. Returns the decision only on the call that first reaches a quorum.
  public Optional<Value> observe(Accepted accepted) {
    checkSlot(accepted.slot());
    lastMessageType = accepted.type();
    final var proposal = accepted.proposal();
    if (highestSeen == null || proposal.id().greaterThan(highestSeen)) {
      highestSeen = proposal.id();
    }
    if (decided != null) {
      // an accept below the deciding round may legitimately carry a value that was never chosen
      if (decidedId != null && !proposal.id().lessThan(decidedId)) {
        checkAgrees(proposal.value(), accepted);
      }
      return Optional.empty();
    }
    final var votes = tally.computeIfAbsent(proposal, p -> new HashMap<>());
    votes.put(accepted.from(), true);
    if (quorumStrategy.assessAccepts(slot, votes) == QuorumStrategy.QuorumOutcome.WIN) {
      decidedId = proposal.id();
      return decide(proposal.value(), accepted);
    }
    return Optional.empty();
  }

  /// Learn a decision announced by a proposer. Returns it only if it was not already known.
  public Optional<Value> observe(Decided decision) {
    checkSlot(decision.slot());
    lastMessageType = decision.type();
    if (decided != null) {
      checkAgrees(decision.value(), decision);
      return Optional.empty();
    }
    return decide(decision.value(), decision);
  }

  private Optional<Value> decide(Value value, Object cause) {
    decided = value;
    tally.clear();
    LOGGER.log(logAtLevel, () -> "WIN " + nodeId + " learnt slot=" + slot + " value=" + value + " from " + cause);
    return Optional.of(value);
  }

  private void checkAgrees(Value value, Object cause) {
    if (!decided.equals(value)) {
      conflicts.add(value);
      LOGGER.severe("SEVERE ERROR SAFETY VIOLATION " + nodeId + " slot=" + slot + " decided=" + decided
          + " yet saw " + value + " from " + cause);
    }
  }

  private void checkSlot(long other) {
    if (other != slot) {
      throw new IllegalArgumentException("learner for slot " + slot + " was given slot " + other);
    }
  }

  public Optional<Value> decided() {
    return Optional.ofNullable(decided);
  }

  /// Values that contradicted the decision. This is always empty unless safety has been broken.
  public List<Value> conflicts() {
    return List.copyOf(conflicts);
  }

  public long slot() {
    return slot;
  }

  public NodeSnapshot snapshot() {
    return new NodeSnapshot(nodeId, Role.LEARNER, slot, Optional.ofNullable(highestSeen),
        decided == null ? "LEARNING" : "DECIDED", Optional.ofNullable(lastMessageType));
  }
}
