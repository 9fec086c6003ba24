// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.InMemoryJournal;
import com.github.essential_paxos.Journal;
import com.github.essential_paxos.Membership;
import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.PaxosNode;
import com.github.essential_paxos.ProposerConfig;
import com.github.essential_paxos.Role;
import com.github.essential_paxos.Value;
import com.github.essential_paxos.metrics.EventRecorder;
import com.github.essential_paxos.network.LinkProfile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// A cluster of nodes wired to one [SimulatedNetwork]. Acceptors are numbered from 1, proposers from 101 and
/// dedicated learners from 201. Proposers also play the learner role so that a losing proposer hears the decision.
public class SimulatedCluster {
  static final int PROPOSER_BASE = 100;
  static final int LEARNER_BASE = 200;

  private final SimulatedNetwork network;
  private final EventRecorder events = new EventRecorder();
  private final Membership membership;
  private final List<PaxosNode> acceptors = new ArrayList<>();
  private final List<PaxosNode> proposers = new ArrayList<>();
  private final List<PaxosNode> learners = new ArrayList<>();

  public SimulatedCluster(int acceptors, int proposers, int learners, LinkProfile link, ProposerConfig proposerConfig,
                          long seed) {
    this(acceptors, proposers, learners, link, proposerConfig, seed, id -> new InMemoryJournal());
  }

  /// @param journals supplies the journal of each acceptor so that a test can inject storage faults.
  public SimulatedCluster(int acceptors, int proposers, int learners, LinkProfile link, ProposerConfig proposerConfig,
                          long seed, Function<NodeId, Journal> journals) {
    this.network = new SimulatedNetwork(link, SimulatedNetwork.repeatableRandomGenerator(seed), events);
    final var acceptorIds = ids(1, acceptors);
    final var proposerIds = ids(PROPOSER_BASE + 1, proposers);
    final var learnerIds = ids(LEARNER_BASE + 1, learners);
    this.membership = new Membership(acceptorIds,
        Stream.concat(learnerIds.stream(), proposerIds.stream()).toList());
    for (NodeId id : acceptorIds) {
      this.acceptors.add(node(PaxosNode.Config.of(id, membership).withJournal(journals.apply(id)), seed));
    }
    for (NodeId id : proposerIds) {
      this.proposers.add(node(PaxosNode.Config.of(id, membership, Role.PROPOSER).withProposerConfig(proposerConfig),
          seed));
    }
    for (NodeId id : learnerIds) {
      this.learners.add(node(PaxosNode.Config.of(id, membership), seed));
    }
  }

  private PaxosNode node(PaxosNode.Config config, long seed) {
    final var random = SimulatedNetwork.repeatableRandomGenerator(seed * 1_000 + config.nodeId().id());
    return new PaxosNode(config.withEventSink(events), network, network, random);
  }

  private static List<NodeId> ids(int first, int count) {
    return IntStream.range(first, first + count).mapToObj(NodeId::of).toList();
  }

  public SimulatedNetwork network() {
    return network;
  }

  public EventRecorder events() {
    return events;
  }

  public Membership membership() {
    return membership;
  }

  public List<PaxosNode> acceptors() {
    return List.copyOf(acceptors);
  }

  public List<PaxosNode> proposers() {
    return List.copyOf(proposers);
  }

  public List<PaxosNode> learners() {
    return List.copyOf(learners);
  }

  public PaxosNode acceptor(int index) {
    return acceptors.get(index);
  }

  public PaxosNode proposer(int index) {
    return proposers.get(index);
  }

  /// Every node that plays the learner role.
  public List<PaxosNode> allLearners() {
    return Stream.concat(learners.stream(), proposers.stream()).toList();
  }

  /// What each learner has decided for the slot. Learners that have not decided are left out.
  public Map<NodeId, Value> decisions(long slot) {
    final Map<NodeId, Value> result = new LinkedHashMap<>();
    for (PaxosNode node : allLearners()) {
      node.decided(slot).ifPresent(v -> result.put(node.nodeId(), v));
    }
    return result;
  }

  /// The value decided for the slot by any learner.
  ///
  /// @throws IllegalStateException if two learners decided different values.
  public Optional<Value> agreedValue(long slot) {
    final var decisions = decisions(slot);
    final var distinct = new HashSet<>(decisions.values());
    final boolean conflicts = allLearners().stream().anyMatch(n -> !n.conflicts().isEmpty());
    if (distinct.size() > 1 || conflicts) {
      LOGGER.severe("SAFETY VIOLATION slot=" + slot + " decisions=" + decisions);
      throw new IllegalStateException("learners disagree on slot " + slot + ": " + decisions);
    }
    return distinct.stream().findFirst();
  }
}
