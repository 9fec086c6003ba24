// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.metrics.EventSink;
import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.Promise;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.IntStream;

/// Whatever prior accepted proposals a quorum of five acceptors reports, the proposer must send the value of the one
/// with the highest id, or its own value when there are none.
public class AdoptionPropertyTests {

  static final List<NodeId> ACCEPTORS = IntStream.rangeClosed(1, 5).mapToObj(NodeId::of).toList();
  static final NodeId ME = NodeId.of(50);
  static final ProposalId ABOVE_ALL_PRIORS = new ProposalId(9, NodeId.of(5));

  @Property(tries = 300)
  void sendsTheValueOfTheHighestPrior(@ForAll("priors") List<Optional<Proposal>> priors) {
    final var messenger = new RecordingMessenger();
    final var proposer = new Proposer(ME, 0, Value.of("own"), new Membership(ACCEPTORS, List.of()),
        ProposerConfig.DEFAULT, messenger, new ManualScheduler(), EventSink.NONE,
        RandomGeneratorFactory.of("L64X128MixRandom").create(1L), outcome -> {
    }, Level.FINE);
    proposer.start(Optional.of(ABOVE_ALL_PRIORS));
    final var id = ProposalId.first(ME).nextAbove(ABOVE_ALL_PRIORS);

    for (int i = 0; i < priors.size(); i++) {
      proposer.onPromise(new Promise(ACCEPTORS.get(i), 0, id, priors.get(i)));
    }

    final var expected = priors.stream()
        .flatMap(Optional::stream)
        .max(Comparator.comparing(Proposal::id))
        .map(Proposal::value)
        .orElse(Value.of("own"));
    final var accepts = messenger.sentOfType(Accept.class);
    assert accepts.size() == ACCEPTORS.size() : accepts;
    for (Accept accept : accepts) {
      assert accept.id().equals(id);
      assert accept.value().equals(expected) : "expected " + expected + " but sent " + accept.value();
    }
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<List<Optional<Proposal>>> priors() {
    final Arbitrary<Optional<Proposal>> prior = Arbitraries.integers().between(1, 9)
        .flatMap(round -> Arbitraries.integers().between(1, 5)
            .map(node -> new Proposal(new ProposalId(round, NodeId.of(node)), Value.of("v" + round + "." + node))))
        .optional();
    // a quorum of three out of five
    return prior.list().ofSize(3);
  }
}
