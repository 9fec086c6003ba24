// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.metrics.EventRecorder;
import com.github.essential_paxos.metrics.EventType;
import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.Decided;
import com.github.essential_paxos.msg.Nack;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;

/// Drives a single node by hand to check how messages are routed between its roles and the network.
public class PaxosNodeDispatchTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static final NodeId A1 = NodeId.of(1);
  static final NodeId A2 = NodeId.of(2);
  static final NodeId P = NodeId.of(101);
  static final NodeId L = NodeId.of(201);
  static final Membership MEMBERSHIP = new Membership(List.of(A1, A2, NodeId.of(3)), List.of(L, P));
  static final Value X = Value.of("X");

  final RecordingMessenger messenger = new RecordingMessenger();
  final ManualScheduler scheduler = new ManualScheduler();
  final EventRecorder events = new EventRecorder();

  PaxosNode node(NodeId id, Journal journal, Role... extra) {
    final var config = PaxosNode.Config.of(id, MEMBERSHIP, extra).withJournal(journal).withEventSink(events);
    return new PaxosNode(config, messenger, scheduler, RandomGenerator.of("L64X128MixRandom"));
  }

  /// Fails the test if anything was sent before the journal was synced.
  class SyncBeforeSendJournal extends InMemoryJournal {
    int syncs = 0;

    @Override
    public void sync() {
      assertThat(messenger.sent).as("a reply left before the sync").isEmpty();
      syncs++;
    }
  }

  @Test
  void promisesAreSyncedBeforeTheyAreSent() {
    final var journal = new SyncBeforeSendJournal();
    final var acceptor = node(A1, journal);
    final var id = new ProposalId(3, P);
    acceptor.deliver(new Prepare(P, 0, id));

    assertThat(journal.syncs).isEqualTo(1);
    assertThat(messenger.sent).hasSize(1);
    assertThat(messenger.sent.get(0).to()).isEqualTo(P);
    assertThat(messenger.sent.get(0).message()).isEqualTo(new Promise(A1, 0, id, Optional.empty()));
    assertThat(events.count(0, EventType.PROMISE_SENT)).isEqualTo(1);
  }

  @Test
  void acceptedGoesToTheProposerAndEveryLearnerOnce() {
    final var acceptor = node(A1, new InMemoryJournal());
    final var id = new ProposalId(1, P);
    acceptor.deliver(new Accept(P, 2, new Proposal(id, X)));

    assertThat(messenger.sent).extracting(RecordingMessenger.Sent::to).containsExactly(P, L);
    assertThat(messenger.sentOfType(Accepted.class)).hasSize(2);
    assertThat(acceptor.acceptorForTest(2)).map(a -> a.state().accepted().orElseThrow().value()).contains(X);
  }

  @Test
  void aLowerPrepareIsNacked() {
    final var acceptor = node(A1, new InMemoryJournal());
    acceptor.deliver(new Prepare(P, 0, new ProposalId(5, P)));
    messenger.clear();
    final var other = NodeId.of(102);
    acceptor.deliver(new Prepare(other, 0, new ProposalId(4, other)));

    assertThat(messenger.sent).hasSize(1);
    assertThat(messenger.sent.get(0).to()).isEqualTo(other);
    final var nack = (Nack) messenger.sent.get(0).message();
    assertThat(nack.promised()).isEqualTo(new ProposalId(5, P));
    assertThat(events.count(0, EventType.NACK_SENT)).isEqualTo(1);
  }

  @Test
  void aJournalFailureSilencesTheSlot() {
    final var journal = new InMemoryJournal() {
      @Override
      public void writeAcceptorState(AcceptorState state) {
        throw new JournalException("io error");
      }
    };
    final var acceptor = node(A1, journal);
    acceptor.deliver(new Prepare(P, 0, new ProposalId(1, P)));
    acceptor.deliver(new Prepare(P, 0, new ProposalId(2, P)));

    assertThat(messenger.sent).isEmpty();
    assertThat(acceptor.acceptorForTest(0)).map(Acceptor::isFailed).contains(true);
    assertThat(events.count(0, EventType.PERSISTENCE_FAILURE)).isEqualTo(2);
    assertThat(acceptor.snapshot(0, Role.ACCEPTOR).orElseThrow().state()).isEqualTo("FAILED");

    // a restart drops the failed acceptor so that it reloads from the journal when next needed
    acceptor.restart();
    assertThat(acceptor.acceptorForTest(0)).isEmpty();
  }

  @Test
  void aNodeWithoutTheRoleIgnoresTheMessage() {
    final var learner = node(L, new InMemoryJournal());
    learner.deliver(new Prepare(P, 0, new ProposalId(1, P)));
    learner.deliver(new Accept(P, 0, new Proposal(new ProposalId(1, P), X)));
    assertThat(messenger.sent).isEmpty();
    assertThat(learner.snapshots()).isEmpty();

    learner.deliver(new Decided(P, 0, X));
    assertThat(learner.decided(0)).contains(X);
    assertThat(events.count(0, EventType.DECIDED)).isEqualTo(1);
  }

  @Test
  void aLearnerDecidesOnAQuorumOfAccepts() {
    final var learner = node(L, new InMemoryJournal());
    final var proposal = new Proposal(new ProposalId(1, P), X);
    learner.deliver(new Accepted(A1, 0, proposal));
    assertThat(learner.decided(0)).isEmpty();
    learner.deliver(new Accepted(A2, 0, proposal));
    assertThat(learner.decided(0)).contains(X);
    assertThat(learner.highestDecidedSlot()).isEqualTo(0L);
  }
}
