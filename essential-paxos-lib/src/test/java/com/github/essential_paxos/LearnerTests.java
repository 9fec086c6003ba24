// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.Decided;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

public class LearnerTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static final NodeId A1 = NodeId.of(1);
  static final NodeId A2 = NodeId.of(2);
  static final NodeId A3 = NodeId.of(3);
  static final NodeId P = NodeId.of(7);

  final Learner learner = new Learner(NodeId.of(9), 0, new SimpleMajority(3), Level.FINE);

  @Test
  void decidesOnceAQuorumAcceptedTheSameProposal() {
    final var proposal = new Proposal(ProposalId.first(P), Value.of("x"));
    assertThat(learner.observe(new Accepted(A1, 0, proposal))).isEmpty();
    assertThat(learner.observe(new Accepted(A2, 0, proposal))).contains(Value.of("x"));
    // the third accept does not announce again
    assertThat(learner.observe(new Accepted(A3, 0, proposal))).isEmpty();
    assertThat(learner.decided()).contains(Value.of("x"));
    assertThat(learner.snapshot().state()).isEqualTo("DECIDED");
  }

  @Test
  void duplicatesFromOneAcceptorAreCountedOnce() {
    final var proposal = new Proposal(ProposalId.first(P), Value.of("x"));
    learner.observe(new Accepted(A1, 0, proposal));
    learner.observe(new Accepted(A1, 0, proposal));
    learner.observe(new Accepted(A1, 0, proposal));
    assertThat(learner.decided()).isEmpty();
  }

  @Test
  void acceptsOfDifferentRoundsAreNotPooled() {
    final var first = new Proposal(ProposalId.first(P), Value.of("x"));
    final var second = new Proposal(new ProposalId(2, P), Value.of("x"));
    learner.observe(new Accepted(A1, 0, first));
    learner.observe(new Accepted(A2, 0, second));
    assertThat(learner.decided()).isEmpty();
    assertThat(learner.observe(new Accepted(A3, 0, second))).contains(Value.of("x"));
  }

  @Test
  void decidedShortCircuitsTheCount() {
    assertThat(learner.observe(new Decided(P, 0, Value.of("y")))).contains(Value.of("y"));
    assertThat(learner.observe(new Decided(P, 0, Value.of("y")))).isEmpty();
    assertThat(learner.conflicts()).isEmpty();
  }

  @Test
  void lateAcceptsOfAnOlderRoundAreNotConflicts() {
    final var older = new Proposal(ProposalId.first(NodeId.of(3)), Value.of("lost"));
    final var winner = new Proposal(new ProposalId(2, P), Value.of("won"));
    learner.observe(new Accepted(A1, 0, winner));
    learner.observe(new Accepted(A2, 0, winner));
    learner.observe(new Accepted(A3, 0, older));
    assertThat(learner.conflicts()).isEmpty();
    assertThat(learner.decided()).contains(Value.of("won"));
  }

  @Test
  void aContradictingDecisionIsRecorded() {
    learner.observe(new Decided(P, 0, Value.of("y")));
    learner.observe(new Decided(NodeId.of(8), 0, Value.of("z")));
    assertThat(learner.decided()).contains(Value.of("y"));
    assertThat(learner.conflicts()).containsExactly(Value.of("z"));
  }
}
