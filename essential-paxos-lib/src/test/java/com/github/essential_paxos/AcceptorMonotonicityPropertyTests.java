// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;
import java.util.Optional;

/// Any sequence of prepares and accepts, including duplicates and reorderings, must never move a promise backwards or
/// leave an accepted id above the promise.
public class AcceptorMonotonicityPropertyTests {

  record Step(boolean prepare, int round, int proposer) {
    PaxosMessage message(long slot) {
      final var id = new ProposalId(round, NodeId.of(proposer));
      final var from = NodeId.of(proposer);
      return prepare
          ? new Prepare(from, slot, id)
          : new Accept(from, slot, new Proposal(id, Value.of("v" + round + "-" + proposer)));
    }
  }

  @Property(tries = 500)
  void promisesOnlyGoUp(@ForAll("steps") List<Step> steps) {
    final var acceptor = new Acceptor(NodeId.of(9), 0, new InMemoryJournal());
    Optional<ProposalId> lastPromise = Optional.empty();
    for (Step step : steps) {
      final var message = step.message(0);
      final var reply = message instanceof Prepare prepare ? acceptor.handle(prepare) : acceptor.handle((Accept) message);
      final var state = acceptor.state();

      assert state.invariantHolds() : state;
      if (lastPromise.isPresent()) {
        assert !state.promised().orElseThrow().lessThan(lastPromise.get()) : lastPromise + " -> " + state;
      }
      // a positive reply means the message id is now the promise
      reply.ifPresent(r -> {
        if (r instanceof Promise promise) {
          assert promise.id().equals(state.promised().orElseThrow());
        } else if (r instanceof Accepted accepted) {
          assert accepted.proposal().equals(state.accepted().orElseThrow());
        }
      });
      lastPromise = state.promised();
    }
  }

  @Property(tries = 200)
  void reloadedAcceptorAnswersLikeTheOriginal(@ForAll("steps") List<Step> steps, @ForAll("step") Step probe) {
    final var journal = new InMemoryJournal();
    final var original = new Acceptor(NodeId.of(9), 1, journal);
    for (Step step : steps) {
      final var message = step.message(1);
      if (message instanceof Prepare prepare) original.handle(prepare);
      else original.handle((Accept) message);
    }
    final var restarted = new Acceptor(NodeId.of(9), 1, journal);
    assert restarted.state().equals(original.state());

    final var message = probe.message(1);
    final var expected = message instanceof Prepare p ? original.handle(p) : original.handle((Accept) message);
    final var actual = message instanceof Prepare p ? restarted.handle(p) : restarted.handle((Accept) message);
    assert expected.equals(actual) : expected + " vs " + actual;
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<Step> step() {
    return Combinators.combine(
        Arbitraries.of(true, false),
        Arbitraries.integers().between(1, 6),
        Arbitraries.integers().between(1, 3)
    ).as(Step::new);
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<List<Step>> steps() {
    return step().list().ofMinSize(1).ofMaxSize(30);
  }
}
