// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.MessageType;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AcceptorTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static final NodeId ME = NodeId.of(1);
  static final NodeId PROPOSER = NodeId.of(7);

  /// A journal whose writes start failing after a number of successful syncs.
  static class FailingJournal extends InMemoryJournal {
    final AtomicInteger syncsBeforeFailure;

    FailingJournal(int syncsBeforeFailure) {
      this.syncsBeforeFailure = new AtomicInteger(syncsBeforeFailure);
    }

    @Override
    public void sync() {
      if (syncsBeforeFailure.getAndDecrement() <= 0) {
        throw new JournalException("disk full");
      }
    }
  }

  @Test
  void persistenceFailureSuppressesTheReplyAndFailsTheSlot() {
    final var journal = new FailingJournal(1);
    final var acceptor = new Acceptor(ME, 0, journal);
    final var id = ProposalId.first(PROPOSER);

    assertThat(acceptor.handle(new Prepare(PROPOSER, 0, id))).containsInstanceOf(Promise.class);

    final var reply = acceptor.handle(new Accept(PROPOSER, 0, new Proposal(id, Value.of("x"))));
    assertThat(reply).isEmpty();
    assertThat(acceptor.isFailed()).isTrue();
    // in memory state is still the last state that was synced
    assertThat(acceptor.state().accepted()).isEmpty();
    assertThat(acceptor.state().promised()).contains(id);

    // refuses everything for the slot from now on even a message that needs no write
    assertThat(acceptor.handle(new Prepare(PROPOSER, 0, id))).isEmpty();
    assertThat(acceptor.handle(new Prepare(PROPOSER, 0, id.nextAbove(id)))).isEmpty();
    assertThat(acceptor.snapshot().state()).isEqualTo("FAILED");
    assertThat(acceptor.snapshot().lastMessageType()).contains(MessageType.PREPARE);
  }

  @Test
  void restartReloadsTheDurableState() {
    final var journal = new InMemoryJournal();
    final var id = ProposalId.first(PROPOSER);
    final var proposal = new Proposal(id, Value.of("chosen"));
    final var first = new Acceptor(ME, 4, journal);
    first.handle(new Prepare(PROPOSER, 4, id));
    first.handle(new Accept(PROPOSER, 4, proposal));

    final var second = new Acceptor(ME, 4, journal);
    final var reply = second.handle(new Prepare(PROPOSER, 4, id.nextAbove(id)));

    assertThat(reply.orElseThrow()).isInstanceOfSatisfying(Promise.class,
        promise -> assertThat(promise.priorAccepted()).contains(proposal));
  }

  @Test
  void duplicatePrepareIsAnsweredAgainWithoutAnotherWrite() {
    final var writes = new AtomicInteger();
    final var journal = new InMemoryJournal() {
      @Override
      public void writeAcceptorState(AcceptorState state) {
        writes.incrementAndGet();
        super.writeAcceptorState(state);
      }
    };
    final var acceptor = new Acceptor(ME, 0, journal);
    final var prepare = new Prepare(PROPOSER, 0, ProposalId.first(PROPOSER));

    final var firstReply = acceptor.handle(prepare);
    final var secondReply = acceptor.handle(prepare);

    assertThat(secondReply).isEqualTo(firstReply);
    assertThat(writes.get()).isEqualTo(1);
  }

  @Test
  void refusesAJournalOfAnotherNode() {
    final var journal = new InMemoryJournal() {
      @Override
      public Optional<AcceptorState> readAcceptorState(NodeId acceptor, long slot) {
        return Optional.of(AcceptorState.empty(NodeId.of(2), slot));
      }
    };
    assertThatThrownBy(() -> new Acceptor(ME, 0, journal)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsMessagesForAnotherSlot() {
    final var acceptor = new Acceptor(ME, 0, new InMemoryJournal());
    assertThatThrownBy(() -> acceptor.handle(new Prepare(PROPOSER, 1, ProposalId.first(PROPOSER))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void snapshotReportsProgress() {
    final var acceptor = new Acceptor(ME, 0, new InMemoryJournal());
    assertThat(acceptor.snapshot().state()).isEqualTo("IDLE");
    final var id = ProposalId.first(PROPOSER);
    acceptor.handle(new Prepare(PROPOSER, 0, id));
    assertThat(acceptor.snapshot().state()).isEqualTo("PROMISED");
    assertThat(acceptor.snapshot().currentRound()).contains(id);
    acceptor.handle(new Accept(PROPOSER, 0, new Proposal(id, Value.of("v"))));
    assertThat(acceptor.snapshot().state()).isEqualTo("ACCEPTED");
    assertThat(acceptor.snapshot().role()).isEqualTo(Role.ACCEPTOR);
  }
}
