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
import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.msg.Prepare;
import com.github.essential_paxos.msg.Promise;
import com.github.essential_paxos.network.Cancellable;
import com.github.essential_paxos.network.MessageHandler;
import com.github.essential_paxos.network.Messenger;
import com.github.essential_paxos.network.Scheduler;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.random.RandomGenerator;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// A cluster member hosting any combination of the proposer, acceptor and learner roles. Role objects are created
/// lazily per slot.
///
/// The roles are not thread safe. This class uses a fair [Semaphore] so that message delivery and timer callbacks are
/// handled one at a time. Acceptor replies are only sent after the acceptor has synced its journal. Futures and
/// decision listeners are completed after the mutex is released so that callers may propose again from a callback.
public class PaxosNode implements MessageHandler, AutoCloseable {

  /// The static settings of a node.
  ///
  /// @param nodeId         the identity of this node.
  /// @param roles          the roles this node plays.
  /// @param membership     the acceptors and learners of the cluster.
  /// @param journal        the durable storage of the acceptor role.
  /// @param proposerConfig the timing of the proposer role.
  /// @param eventSink      where metrics events go.
  /// @param logAtLevel     the level to log when values are known to be chosen which is logged as "WIN".
  public record Config(NodeId nodeId,
                       Set<Role> roles,
                       Membership membership,
                       Journal journal,
                       ProposerConfig proposerConfig,
                       EventSink eventSink,
                       Level logAtLevel) {
    public Config {
      Objects.requireNonNull(nodeId, "nodeId");
      Objects.requireNonNull(roles, "roles");
      Objects.requireNonNull(membership, "membership");
      Objects.requireNonNull(journal, "journal");
      Objects.requireNonNull(proposerConfig, "proposerConfig");
      Objects.requireNonNull(eventSink, "eventSink");
      Objects.requireNonNull(logAtLevel, "logAtLevel");
      if (roles.isEmpty() || roles.contains(Role.MESSENGER)) {
        throw new IllegalArgumentException("a node must play some of the protocol roles but was given " + roles);
      }
      roles = Collections.unmodifiableSet(EnumSet.copyOf(roles));
      if (roles.contains(Role.ACCEPTOR) && !membership.acceptors().contains(nodeId)) {
        throw new IllegalArgumentException(nodeId + " is an acceptor but not in " + membership.acceptors());
      }
      if (roles.contains(Role.LEARNER) && !membership.learners().contains(nodeId)) {
        throw new IllegalArgumentException(nodeId + " is a learner but not in " + membership.learners());
      }
    }

    /// A node playing the roles its membership implies with an in-memory journal and default timing.
    public static Config of(NodeId nodeId, Membership membership, Role... extra) {
      final var roles = EnumSet.noneOf(Role.class);
      if (membership.acceptors().contains(nodeId)) roles.add(Role.ACCEPTOR);
      if (membership.learners().contains(nodeId)) roles.add(Role.LEARNER);
      roles.addAll(List.of(extra));
      return new Config(nodeId, roles, membership, new InMemoryJournal(), ProposerConfig.DEFAULT, EventSink.NONE,
          Level.INFO);
    }

    public Config withJournal(Journal journal) {
      return new Config(nodeId, roles, membership, journal, proposerConfig, eventSink, logAtLevel);
    }

    public Config withProposerConfig(ProposerConfig proposerConfig) {
      return new Config(nodeId, roles, membership, journal, proposerConfig, eventSink, logAtLevel);
    }

    public Config withEventSink(EventSink eventSink) {
      return new Config(nodeId, roles, membership, journal, proposerConfig, eventSink, logAtLevel);
    }

    public Config withLogAtLevel(Level logAtLevel) {
      return new Config(nodeId, roles, membership, journal, proposerConfig, eventSink, logAtLevel);
    }
  }

  private final Config config;
  private final Messenger messenger;
  private final Scheduler scheduler;
  private final RandomGenerator random;
  private final Semaphore mutex = new Semaphore(1, true);
  private final List<Runnable> deferred = new ArrayList<>();
  private final List<BiConsumer<Long, Value>> decisionListeners = new CopyOnWriteArrayList<>();

  private final Map<Long, Acceptor> acceptors = new TreeMap<>();
  private final Map<Long, Learner> learners = new TreeMap<>();
  private final Map<Long, Proposer> proposers = new TreeMap<>();
  private final Map<Long, ProposalId> highestSeen = new TreeMap<>();

  private volatile boolean closed = false;

  /// The scheduler handed to proposers. Its tasks run under the mutex.
  private final Scheduler guardedScheduler = new Scheduler() {
    @Override
    public long now() {
      return scheduler.now();
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable task) {
      return scheduler.schedule(delayMillis, () -> withMutex(task));
    }
  };

  /// Create a node and subscribe it to the messenger.
  ///
  /// @param config    the static settings.
  /// @param messenger the transport.
  /// @param scheduler the clock and timers.
  /// @param random    the source of backoff jitter. Pass a seeded generator for repeatable simulations.
  public PaxosNode(Config config, Messenger messenger, Scheduler scheduler, RandomGenerator random) {
    this.config = Objects.requireNonNull(config, "config");
    this.messenger = Objects.requireNonNull(messenger, "messenger");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.random = Objects.requireNonNull(random, "random");
    messenger.register(config.nodeId(), this);
  }

  public NodeId nodeId() {
    return config.nodeId();
  }

  public Set<Role> roles() {
    return config.roles();
  }

  /// Try to get the value chosen for the slot. The future completes with the value actually chosen which may have
  /// been proposed by another node, or with a liveness failure. It never completes exceptionally because of the
  /// network.
  ///
  /// @throws IllegalStateException if this node is not a proposer or is already proposing for the slot.
  public CompletableFuture<Outcome> propose(long slot, Value value) {
    if (!config.roles().contains(Role.PROPOSER)) {
      throw new IllegalStateException(config.nodeId() + " is not a proposer");
    }
    if (slot < 0) {
      throw new IllegalArgumentException("slot must be >= 0 but was " + slot);
    }
    Objects.requireNonNull(value, "value");
    final var future = new CompletableFuture<Outcome>();
    final var rejected = new IllegalStateException[1];
    withMutex(() -> {
      if (closed) {
        deferred.add(() -> future.complete(new Outcome.LivenessFailure(slot, Outcome.Reason.ABANDONED, 0, 0, 0)));
        return;
      }
      final var existing = proposers.get(slot);
      if (existing != null && !existing.isTerminal()) {
        rejected[0] = new IllegalStateException(config.nodeId() + " is already proposing for slot " + slot);
        return;
      }
      final var known = Optional.ofNullable(learners.get(slot)).flatMap(Learner::decided);
      if (known.isPresent()) {
        final var chosen = new Outcome.Chosen(slot, known.get(), !known.get().equals(value), 0, 0, 0);
        deferred.add(() -> future.complete(chosen));
        return;
      }
      final var proposer = new Proposer(config.nodeId(), slot, value, config.membership(), config.proposerConfig(),
          messenger, guardedScheduler, config.eventSink(), random,
          outcome -> {
            proposer(slot).ifPresent(p -> raiseHighestSeen(slot, p.highestSeen()));
            deferred.add(() -> future.complete(outcome));
          },
          config.logAtLevel());
      proposers.put(slot, proposer);
      proposer.start(Optional.ofNullable(highestSeen.get(slot)));
    });
    if (rejected[0] != null) {
      throw rejected[0];
    }
    return future;
  }

  /// Register a callback for every slot this node learns. It runs outside the mutex on the delivering thread.
  public void onDecision(BiConsumer<Long, Value> listener) {
    decisionListeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public void deliver(PaxosMessage message) {
    withMutex(() -> {
      if (closed) {
        LOGGER.finest(() -> config.nodeId() + " closed so ignoring " + message);
        return;
      }
      dispatch(message);
    });
  }

  private void dispatch(PaxosMessage message) {
    final boolean handled = switch (message.type()) {
      case PREPARE -> onPrepare((Prepare) message);
      case ACCEPT -> onAccept((Accept) message);
      case PROMISE -> onPromise((Promise) message);
      case NACK -> onNack((Nack) message);
      case ACCEPTED -> onAccepted((Accepted) message);
      case DECIDED -> onDecided((Decided) message);
    };
    if (!handled) {
      LOGGER.finest(() -> config.nodeId() + " has no role for " + message);
    }
  }

  private boolean onPrepare(Prepare prepare) {
    if (!config.roles().contains(Role.ACCEPTOR)) {
      return false;
    }
    raiseHighestSeen(prepare.slot(), Optional.of(prepare.id()));
    final var acceptor = acceptor(prepare.slot());
    final var reply = acceptor.handle(prepare);
    if (reply.isPresent()) {
      emit(prepare.slot(), Role.ACCEPTOR, reply.get().type() == MessageType.PROMISE
          ? EventType.PROMISE_SENT : EventType.NACK_SENT);
      messenger.send(prepare.id().proposer(), reply.get());
    } else if (acceptor.isFailed()) {
      emit(prepare.slot(), Role.ACCEPTOR, EventType.PERSISTENCE_FAILURE);
    }
    return true;
  }

  private boolean onAccept(Accept accept) {
    if (!config.roles().contains(Role.ACCEPTOR)) {
      return false;
    }
    raiseHighestSeen(accept.slot(), Optional.of(accept.id()));
    final var acceptor = acceptor(accept.slot());
    final var reply = acceptor.handle(accept);
    if (reply.isEmpty()) {
      if (acceptor.isFailed()) {
        emit(accept.slot(), Role.ACCEPTOR, EventType.PERSISTENCE_FAILURE);
      }
      return true;
    }
    if (reply.get() instanceof Accepted accepted) {
      emit(accept.slot(), Role.ACCEPTOR, EventType.ACCEPTED_SENT);
      final var recipients = new LinkedHashSet<NodeId>();
      recipients.add(accept.id().proposer());
      recipients.addAll(config.membership().learners());
      messenger.broadcast(recipients, accepted);
    } else {
      emit(accept.slot(), Role.ACCEPTOR, EventType.NACK_SENT);
      messenger.send(accept.id().proposer(), reply.get());
    }
    return true;
  }

  private boolean onPromise(Promise promise) {
    final var proposer = proposer(promise.slot());
    proposer.ifPresent(p -> p.onPromise(promise));
    return proposer.isPresent();
  }

  private boolean onNack(Nack nack) {
    raiseHighestSeen(nack.slot(), Optional.of(nack.promised()));
    final var proposer = proposer(nack.slot());
    proposer.ifPresent(p -> p.onNack(nack));
    return proposer.isPresent();
  }

  private boolean onAccepted(Accepted accepted) {
    boolean handled = false;
    final var proposer = proposer(accepted.slot());
    if (proposer.isPresent()) {
      proposer.get().onAccepted(accepted);
      handled = true;
    }
    if (config.roles().contains(Role.LEARNER)) {
      learner(accepted.slot()).observe(accepted).ifPresent(value -> learnt(accepted.slot(), value));
      handled = true;
    }
    return handled;
  }

  private boolean onDecided(Decided decided) {
    if (!config.roles().contains(Role.LEARNER)) {
      return false;
    }
    learner(decided.slot()).observe(decided).ifPresent(value -> learnt(decided.slot(), value));
    return true;
  }

  private void learnt(long slot, Value value) {
    emit(slot, Role.LEARNER, EventType.DECIDED);
    proposer(slot).ifPresent(p -> p.learned(value));
    for (var listener : decisionListeners) {
      deferred.add(() -> listener.accept(slot, value));
    }
  }

  private Acceptor acceptor(long slot) {
    return acceptors.computeIfAbsent(slot, s -> new Acceptor(config.nodeId(), s, config.journal()));
  }

  private Learner learner(long slot) {
    return learners.computeIfAbsent(slot,
        s -> new Learner(config.nodeId(), s, config.membership().quorumStrategy(), config.logAtLevel()));
  }

  private Optional<Proposer> proposer(long slot) {
    return Optional.ofNullable(proposers.get(slot));
  }

  private void raiseHighestSeen(long slot, Optional<ProposalId> seen) {
    seen.ifPresent(id -> highestSeen.merge(slot, id, (a, b) -> a.greaterThan(b) ? a : b));
  }

  private void emit(long slot, Role role, EventType type) {
    config.eventSink().record(new MetricsEvent(slot, config.nodeId(), role, type, scheduler.now()));
  }

  /// Run the task holding the mutex then run anything it deferred after releasing the mutex.
  void withMutex(Runnable task) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warning(config.nodeId() + " interrupted while waiting for the mutex so not running " + task);
      return;
    }
    final List<Runnable> after;
    try {
      task.run();
    } finally {
      after = List.copyOf(deferred);
      deferred.clear();
      mutex.release();
    }
    after.forEach(Runnable::run);
  }

  /// The decision this node has learnt for the slot.
  public Optional<Value> decided(long slot) {
    final var result = new AtomicReference<Optional<Value>>(Optional.empty());
    withMutex(() -> result.set(Optional.ofNullable(learners.get(slot)).flatMap(Learner::decided)));
    return result.get();
  }

  /// The highest slot this node has learnt a decision for, or -1.
  public long highestDecidedSlot() {
    final long[] highest = {-1L};
    withMutex(() -> learners.values().stream()
        .filter(l -> l.decided().isPresent())
        .mapToLong(Learner::slot)
        .max()
        .ifPresent(s -> highest[0] = s));
    return highest[0];
  }

  /// Values that contradicted a decision this node learnt. Always empty unless safety has been broken.
  public List<Value> conflicts() {
    final List<Value> result = new ArrayList<>();
    withMutex(() -> learners.values().forEach(l -> result.addAll(l.conflicts())));
    return result;
  }

  /// A read only view of every role object on this node.
  public List<NodeSnapshot> snapshots() {
    final List<NodeSnapshot> result = new ArrayList<>();
    withMutex(() -> {
      proposers.values().forEach(p -> result.add(p.snapshot()));
      acceptors.values().forEach(a -> result.add(a.snapshot()));
      learners.values().forEach(l -> result.add(l.snapshot()));
    });
    return result;
  }

  public Optional<NodeSnapshot> snapshot(long slot, Role role) {
    return snapshots().stream().filter(s -> s.slot() == slot && s.role() == role).findFirst();
  }

  /// Model a crash and restart. All volatile state is lost. Acceptors reload from the journal when next needed.
  /// Proposers are abandoned.
  public void restart() {
    withMutex(() -> {
      LOGGER.info(() -> config.nodeId() + " restarting and discarding volatile state");
      proposers.values().forEach(Proposer::abandon);
      proposers.clear();
      acceptors.clear();
      learners.clear();
      highestSeen.clear();
    });
  }

  @TestOnly
  Optional<Acceptor> acceptorForTest(long slot) {
    return Optional.ofNullable(acceptors.get(slot));
  }

  @Override
  public void close() {
    withMutex(() -> {
      closed = true;
      proposers.values().forEach(Proposer::abandon);
    });
  }
}
