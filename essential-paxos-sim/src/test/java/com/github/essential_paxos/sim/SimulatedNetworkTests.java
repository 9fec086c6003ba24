// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.ProposalId;
import com.github.essential_paxos.metrics.EventRecorder;
import com.github.essential_paxos.metrics.EventType;
import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.network.LinkProfile;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SimulatedNetworkTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static final NodeId A = NodeId.of(1);
  static final NodeId B = NodeId.of(2);

  final EventRecorder events = new EventRecorder();

  static Prepare prepare(long round) {
    return new Prepare(A, 0, new ProposalId(round, A));
  }

  SimulatedNetwork network(LinkProfile profile, List<PaxosMessage> inbox) {
    final var network = new SimulatedNetwork(profile, 99L, events);
    network.register(B, inbox::add);
    return network;
  }

  @Test
  void deliversAfterTheLinkDelay() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE.withDelay(5, 5), inbox);
    network.send(B, prepare(1));
    network.runFor(4);
    assertThat(inbox).isEmpty();
    network.runFor(1);
    assertThat(inbox).containsExactly(prepare(1));
    assertThat(network.now()).isEqualTo(5);
    assertThat(events.count(EventType.SENT)).isEqualTo(1);
    assertThat(events.count(EventType.DELIVERED)).isEqualTo(1);
  }

  @Test
  void certainLossDropsEverything() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE.withDropProbability(1.0), inbox);
    for (int i = 1; i <= 10; i++) network.send(B, prepare(i));
    network.runFor(100);
    assertThat(inbox).isEmpty();
    assertThat(network.messagesDropped()).isEqualTo(10);
    assertThat(events.count(EventType.DROPPED)).isEqualTo(10);
  }

  @Test
  void certainDuplicationDeliversTwice() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE.withDuplicateProbability(1.0), inbox);
    network.send(B, prepare(1));
    network.runFor(10);
    assertThat(inbox).containsExactly(prepare(1), prepare(1));
    assertThat(network.messagesDuplicated()).isEqualTo(1);
  }

  @Test
  void fifoLinksKeepOrderUnderRandomDelays() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(new LinkProfile(1, 50, 0, 0, true), inbox);
    final List<PaxosMessage> sent = new ArrayList<>();
    for (int i = 1; i <= 50; i++) {
      sent.add(prepare(i));
      network.send(B, prepare(i));
    }
    network.runFor(1_000);
    assertThat(inbox).containsExactlyElementsOf(sent);
  }

  @Test
  void nonFifoLinksReorder() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(new LinkProfile(1, 50, 0, 0, false), inbox);
    final List<PaxosMessage> sent = new ArrayList<>();
    for (int i = 1; i <= 50; i++) {
      sent.add(prepare(i));
      network.send(B, prepare(i));
    }
    network.runFor(1_000);
    assertThat(inbox).containsExactlyInAnyOrderElementsOf(sent).isNotEqualTo(sent);
  }

  @Test
  void partitionDropsInFlightMessages() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE.withDelay(10, 10), inbox);
    network.send(B, prepare(1));
    network.isolate(B);
    network.send(B, prepare(2));
    network.runFor(20);
    assertThat(inbox).isEmpty();
    network.heal(B);
    network.send(B, prepare(3));
    network.runFor(20);
    assertThat(inbox).containsExactly(prepare(3));
  }

  @Test
  void perLinkProfileOverridesTheDefault() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE, inbox);
    network.setLinkProfile(A, B, LinkProfile.RELIABLE.withDelay(100, 100));
    network.send(B, prepare(1));
    network.runFor(99);
    assertThat(inbox).isEmpty();
    network.runFor(1);
    assertThat(inbox).hasSize(1);
  }

  @Test
  void nemesisCanDelayOrDrop() {
    final List<PaxosMessage> inbox = new ArrayList<>();
    final var network = network(LinkProfile.RELIABLE, inbox);
    network.setNemesis((to, message, now) -> ((Prepare) message).id().round() == 1
        ? Nemesis.Verdict.DROP : Nemesis.Verdict.delay(50));
    network.send(B, prepare(1));
    network.send(B, prepare(2));
    network.runFor(50);
    assertThat(inbox).isEmpty();
    network.runFor(1);
    assertThat(inbox).containsExactly(prepare(2));
  }

  @Test
  void cancelledTimersDoNotRun() {
    final var network = new SimulatedNetwork(LinkProfile.RELIABLE, 1L, events);
    final List<String> ran = new ArrayList<>();
    final var cancelled = network.schedule(10, () -> ran.add("cancelled"));
    network.schedule(10, () -> ran.add("kept"));
    cancelled.cancel();
    network.runFor(10);
    assertThat(ran).containsExactly("kept");
  }

  @Test
  void sameSeedSameSchedule() {
    final List<PaxosMessage> first = new ArrayList<>();
    final List<PaxosMessage> second = new ArrayList<>();
    final var profile = new LinkProfile(1, 30, 0.2, 0.2, false);
    for (List<PaxosMessage> inbox : List.of(first, second)) {
      final var network = new SimulatedNetwork(profile, 5L, new EventRecorder());
      network.register(B, inbox::add);
      for (int i = 1; i <= 40; i++) network.send(B, prepare(i));
      network.runFor(1_000);
    }
    assertThat(first).isEqualTo(second);
  }
}
