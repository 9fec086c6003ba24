// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.metrics.EventSink;
import com.github.essential_paxos.metrics.EventType;
import com.github.essential_paxos.metrics.MetricsEvent;
import com.github.essential_paxos.metrics.NodeSnapshot;
import com.github.essential_paxos.msg.Accept;
import com.github.essential_paxos.msg.Accepted;
import com.github.essential_paxos.msg.Decided;
import com.github.essential_paxos.msg.MessageType;
import com.github.essential_paxos.msg.Nack;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;
import com.github.essential_paxos.msg.ReplyMessage;
import com.github.essential_paxos.network.Cancellable;
import com.github.essential_paxos.network.Messenger;
import com.github.essential_paxos.network.Scheduler;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.random.RandomGenerator;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// The proposer of one node for one slot. It drives rounds of the two phase protocol until a value is chosen or it runs
/// out of retries.
///
/// A round is abandoned on any `Nack` for the current id or when the deadline of the current phase passes. The next
/// round uses an id above everything seen so far after a capped exponential backoff with jitter. Replies that do not
/// echo the current id are stale and are discarded.
///
/// This class is not thread safe. The [Scheduler] it is given must run timer tasks under the same mutex that guards
/// message delivery. See [PaxosNode].
public class Proposer {

  public enum Phase {
    IDLE, PREPARING, ACCEPTING, BACKING_OFF, DECIDED, FAILED
  }

  private final NodeId nodeId;
  private final long slot;
  private final Value candidate;
  private final Membership membership;
  private final QuorumStrategy quorumStrategy;
  private final ProposerConfig config;
  private final Messenger messenger;
  private final Scheduler scheduler;
  private final EventSink events;
  private final RandomGenerator random;
  private final Consumer<Outcome> onOutcome;
  private final Level logAtLevel;

  private final Map<NodeId, Boolean> promises = new HashMap<>();
  private final Map<NodeId, Boolean> accepts = new HashMap<>();
  private Phase phase = Phase.IDLE;
  private ProposalId current;
  private ProposalId highestSeen;
  private Optional<Proposal> highestPrior = Optional.empty();
  private Value proposing;
  private Cancellable timer;
  private long startedAt;
  private int rounds = 0;
  private int retries = 0;
  private MessageType lastMessageType;

  public Proposer(NodeId nodeId,
                  long slot,
                  Value candidate,
                  Membership membership,
                  ProposerConfig config,
                  Messenger messenger,
                  Scheduler scheduler,
                  EventSink events,
                  RandomGenerator random,
                  Consumer<Outcome> onOutcome,
                  Level logAtLevel) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.slot = slot;
    this.candidate = Objects.requireNonNull(candidate, "candidate");
    this.membership = Objects.requireNonNull(membership, "membership");
    this.quorumStrategy = membership.quorumStrategy();
    this.config = Objects.requireNonNull(config, "config");
    this.messenger = Objects.requireNonNull(messenger, "messenger");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.events = Objects.requireNonNull(events, "events");
    this.random = Objects.requireNonNull(random, "random");
    this.onOutcome = Objects.requireNonNull(onOutcome, "onOutcome");
    this.logAtLevel = Objects.requireNonNull(logAtLevel, "logAtLevel");
  }

  /// Start the first round.
  ///
  /// @param floor the highest id this node already knows of for the slot. The first round is above it.
  public void start(Optional<ProposalId> floor) {
    if (phase != Phase.IDLE) {
      throw new IllegalStateException("proposer for slot " + slot + " already started: " + phase);
    }
    startedAt = scheduler.now();
    final var first = ProposalId.first(nodeId);
    current = floor.filter(f -> !f.lessThan(first)).map(first::nextAbove).orElse(first);
    highestSeen = current;
    beginRound();
  }

  private void beginRound() {
    rounds++;
    phase = Phase.PREPARING;
    promises.clear();
    accepts.clear();
    highestPrior = Optional.empty();
    LOGGER.fine(() -> nodeId + " slot=" + slot + " PREPARE " + current + " round " + rounds);
    messenger.broadcast(membership.acceptors(), new Prepare(nodeId, slot, current));
    emit(EventType.PREPARE_SENT);
    arm();
  }

  private void arm() {
    cancelTimer();
    final var token = current;
    final var armedPhase = phase;
    timer = scheduler.schedule(config.roundDeadlineMillis(), () -> onDeadline(token, armedPhase));
  }

  private void onDeadline(ProposalId token, Phase armedPhase) {
    if (phase != armedPhase || !token.equals(current)) {
      LOGGER.finest(() -> nodeId + " slot=" + slot + " stale deadline " + token + " " + armedPhase);
      return;
    }
    emit(EventType.TIMEOUT);
    abandonRound("deadline passed in " + phase);
  }

  public void onPromise(Promise promise) {
    lastMessageType = promise.type();
    if (isStale(promise, Phase.PREPARING)) {
      return;
    }
    promises.put(promise.from(), true);
    emit(EventType.PROMISE_RECV);
    promise.priorAccepted().ifPresent(prior -> {
      if (highestPrior.isEmpty() || prior.id().greaterThan(highestPrior.get().id())) {
        highestPrior = Optional.of(prior);
      }
    });
    if (quorumStrategy.assessPromises(slot, promises) == QuorumStrategy.QuorumOutcome.WIN) {
      beginAccept();
    }
  }

  /// Phase 2a. The value of the highest prior accepted proposal reported by the quorum must be used if there is one.
  private void beginAccept() {
    proposing = highestPrior.map(Proposal::value).orElse(candidate);
    phase = Phase.ACCEPTING;
    LOGGER.fine(() -> nodeId + " slot=" + slot + " ACCEPT " + current + " " + proposing
        + (highestPrior.isPresent() ? " adopted from " + highestPrior.get().id() : ""));
    messenger.broadcast(membership.acceptors(), new Accept(nodeId, slot, new Proposal(current, proposing)));
    emit(EventType.ACCEPT_SENT);
    arm();
  }

  public void onNack(Nack nack) {
    lastMessageType = nack.type();
    if (nack.promised().greaterThan(highestSeen)) {
      highestSeen = nack.promised();
    }
    if (isStale(nack, Phase.PREPARING, Phase.ACCEPTING)) {
      return;
    }
    emit(EventType.NACK_RECV);
    abandonRound("nack from " + nack.from() + " " + nack.reason());
  }

  public void onAccepted(Accepted accepted) {
    lastMessageType = accepted.type();
    if (isStale(accepted, Phase.ACCEPTING)) {
      return;
    }
    accepts.put(accepted.from(), true);
    emit(EventType.ACCEPTED_RECV);
    if (quorumStrategy.assessAccepts(slot, accepts) == QuorumStrategy.QuorumOutcome.WIN) {
      cancelTimer();
      messenger.broadcast(membership.learners(), new Decided(nodeId, slot, proposing));
      emit(EventType.DECIDED);
      LOGGER.log(logAtLevel, () -> "WIN " + nodeId + " slot=" + slot + " chose " + proposing + " with " + current);
      complete(Phase.DECIDED, chosen(proposing));
    }
  }

  /// The local learner has seen the slot decided. There is nothing left for this proposer to do.
  public void learned(Value value) {
    if (isTerminal()) {
      return;
    }
    cancelTimer();
    LOGGER.fine(() -> nodeId + " slot=" + slot + " learnt " + value + " while " + phase);
    complete(Phase.DECIDED, chosen(value));
  }

  /// Give up without waiting for the deadline.
  public void abandon() {
    if (isTerminal()) {
      return;
    }
    cancelTimer();
    complete(Phase.FAILED, failure(Outcome.Reason.ABANDONED));
  }

  private boolean isStale(ReplyMessage reply, Phase... expected) {
    boolean phaseMatches = false;
    for (Phase p : expected) {
      phaseMatches |= phase == p;
    }
    if (!phaseMatches || !reply.id().equals(current)) {
      LOGGER.finest(() -> nodeId + " slot=" + slot + " discarding stale " + reply + " while " + phase + " " + current);
      return true;
    }
    return false;
  }

  private void abandonRound(String reason) {
    cancelTimer();
    if (retries >= config.maxRetries()) {
      LOGGER.info(() -> nodeId + " slot=" + slot + " giving up after " + rounds + " rounds: " + reason);
      complete(Phase.FAILED, failure(Outcome.Reason.QUORUM_UNAVAILABLE));
      return;
    }
    retries++;
    emit(EventType.RETRY);
    phase = Phase.BACKING_OFF;
    current = current.nextAbove(highestSeen);
    highestSeen = current;
    final var token = current;
    final long backoff = config.backoffMillis(retries, random);
    LOGGER.fine(() -> nodeId + " slot=" + slot + " abandoned round: " + reason + " retry " + retries + " as " + token
        + " after " + backoff + "ms");
    timer = scheduler.schedule(backoff, () -> {
      if (phase == Phase.BACKING_OFF && token.equals(current)) {
        beginRound();
      }
    });
  }

  private Outcome chosen(Value value) {
    return new Outcome.Chosen(slot, value, !value.equals(candidate), rounds, retries, scheduler.now() - startedAt);
  }

  private Outcome failure(Outcome.Reason reason) {
    return new Outcome.LivenessFailure(slot, reason, rounds, retries, scheduler.now() - startedAt);
  }

  private void complete(Phase terminal, Outcome outcome) {
    phase = terminal;
    onOutcome.accept(outcome);
  }

  private void cancelTimer() {
    if (timer != null) {
      timer.cancel();
      timer = null;
    }
  }

  private void emit(EventType type) {
    events.record(new MetricsEvent(slot, nodeId, Role.PROPOSER, type, scheduler.now()));
  }

  public boolean isTerminal() {
    return phase == Phase.DECIDED || phase == Phase.FAILED;
  }

  public Phase phase() {
    return phase;
  }

  public long slot() {
    return slot;
  }

  public Value candidate() {
    return candidate;
  }

  /// The highest id this proposer has used or seen.
  public Optional<ProposalId> highestSeen() {
    return Optional.ofNullable(highestSeen);
  }

  public int rounds() {
    return rounds;
  }

  public int retries() {
    return retries;
  }

  public NodeSnapshot snapshot() {
    return new NodeSnapshot(nodeId, Role.PROPOSER, slot, Optional.ofNullable(current), phase.name(),
        Optional.ofNullable(lastMessageType));
  }
}
