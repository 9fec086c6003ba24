// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.Outcome;
import com.github.essential_paxos.PaxosNode;
import com.github.essential_paxos.Value;
import com.github.essential_paxos.metrics.EventType;
import com.github.essential_paxos.metrics.MetricsEvent;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// Runs single slot trials where every proposer competes to get its own value chosen on a faulty simulated network.
public class TrialRunner {
  static final long SLOT = 0L;

  public static TrialResult runTrial(TrialConfig config, int trialIndex) {
    final var cluster = new SimulatedCluster(config.acceptors(), config.proposers(), config.learners(), config.link(),
        config.proposer(), config.seed() + trialIndex);
    final List<CompletableFuture<Outcome>> futures = new ArrayList<>();
    for (PaxosNode proposer : cluster.proposers()) {
      futures.add(proposer.propose(SLOT, Value.of("value-" + proposer.nodeId().id())));
    }
    final var network = cluster.network();
    network.runUntil(() -> futures.stream().allMatch(CompletableFuture::isDone), config.maxSimulatedMillis());

    final var outcomes = futures.stream().filter(CompletableFuture::isDone).map(CompletableFuture::join).toList();
    final int retries = outcomes.stream().mapToInt(Outcome::retries).sum();
    final int rounds = outcomes.stream().mapToInt(Outcome::rounds).sum();
    final var agreed = cluster.agreedValue(SLOT);
    final TrialResult result;
    if (agreed.isPresent()) {
      final long decidedAt = cluster.events().forSlot(SLOT).stream()
          .filter(e -> e.type() == EventType.DECIDED)
          .mapToLong(MetricsEvent::timestamp)
          .min()
          .orElse(network.now());
      result = new TrialResult.Decided(trialIndex, agreed.get(), decidedAt, retries, rounds, network.messagesSent(),
          network.messagesDropped());
    } else {
      final var reason = outcomes.stream()
          .filter(o -> o instanceof Outcome.LivenessFailure)
          .map(o -> ((Outcome.LivenessFailure) o).reason())
          .findFirst()
          .orElse(Outcome.Reason.ABANDONED);
      result = new TrialResult.LivenessFailure(trialIndex, reason, network.now(), retries, network.messagesSent(),
          network.messagesDropped());
    }
    cluster.proposers().forEach(PaxosNode::close);
    LOGGER.fine(() -> "trial " + trialIndex + " " + result);
    return result;
  }

  public static List<TrialResult> runAll(TrialConfig config) {
    return IntStream.range(0, config.trials()).mapToObj(i -> runTrial(config, i)).toList();
  }

  /// Run a batch. The single optional argument is a properties file that overrides the classpath defaults.
  public static void main(String[] args) throws IOException {
    final var overrides = new Properties();
    if (args.length > 0) {
      try (InputStream in = new FileInputStream(args[0])) {
        overrides.load(in);
      }
    }
    overrides.putAll(System.getProperties());
    final var config = TrialConfig.fromProperties(overrides);
    LOGGER.info(() -> "running " + config);
    final var results = runAll(config);
    results.forEach(r -> LOGGER.info(r::toString));
    final long decided = results.stream().filter(r -> r instanceof TrialResult.Decided).count();
    LOGGER.info("decided " + decided + " of " + results.size() + " trials");
  }
}
