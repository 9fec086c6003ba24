// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.Role;
import com.github.essential_paxos.metrics.EventSink;
import com.github.essential_paxos.metrics.EventType;
import com.github.essential_paxos.metrics.MetricsEvent;
import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.network.LinkProfile;
import com.github.essential_paxos.network.MessageHandler;
import com.github.essential_paxos.network.Messenger;
import com.github.essential_paxos.network.Scheduler;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.random.RandomGenerator;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// The fault injection shared by the simulated and the threaded network. Each send is counted, then may be dropped,
/// duplicated and delayed according to the [LinkProfile] of the link. Partitioned nodes neither send nor receive.
/// Subclasses decide what time means and how a delivery is run.
public abstract class AbstractNetwork implements Messenger, Scheduler {

  record Link(NodeId from, NodeId to) {
  }

  private final Map<NodeId, MessageHandler> handlers = new ConcurrentHashMap<>();
  private final Map<Link, LinkProfile> overrides = new ConcurrentHashMap<>();
  private final Map<Link, Long> lastDeliveryAt = new ConcurrentHashMap<>();
  private final Set<NodeId> isolated = ConcurrentHashMap.newKeySet();
  private final AtomicLong sent = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong duplicated = new AtomicLong();
  private final RandomGenerator random;
  private final EventSink events;
  private volatile LinkProfile defaultProfile;
  private volatile Nemesis nemesis = Nemesis.NONE;

  protected AbstractNetwork(LinkProfile defaultProfile, RandomGenerator random, EventSink events) {
    this.defaultProfile = Objects.requireNonNull(defaultProfile, "defaultProfile");
    this.random = Objects.requireNonNull(random, "random");
    this.events = Objects.requireNonNull(events, "events");
  }

  /// Run the task at the absolute time on this network's clock.
  protected abstract void scheduleAt(long when, Runnable task);

  @Override
  public void register(NodeId node, MessageHandler handler) {
    handlers.put(Objects.requireNonNull(node, "node"), Objects.requireNonNull(handler, "handler"));
  }

  @Override
  public void send(NodeId to, PaxosMessage message) {
    final var link = new Link(message.from(), to);
    sent.incrementAndGet();
    emit(message.slot(), message.from(), EventType.SENT);
    if (isolated.contains(link.from()) || isolated.contains(link.to())) {
      drop(link, message, "partitioned");
      return;
    }
    final var verdict = nemesis.interfere(to, message, now());
    if (verdict.drop()) {
      drop(link, message, "nemesis");
      return;
    }
    final var profile = profile(link.from(), link.to());
    final int copies;
    final long[] delays;
    synchronized (random) {
      if (profile.sampleDrop(random)) {
        copies = 0;
      } else {
        copies = profile.sampleDuplicate(random) ? 2 : 1;
      }
      delays = new long[copies];
      for (int i = 0; i < copies; i++) {
        delays[i] = profile.sampleDelay(random) + verdict.extraDelayMillis();
      }
    }
    if (copies == 0) {
      drop(link, message, "lossy link");
      return;
    }
    if (copies > 1) {
      duplicated.incrementAndGet();
      emit(message.slot(), link.from(), EventType.DUPLICATED);
    }
    final long now = now();
    for (long delay : delays) {
      long when = now + delay;
      if (profile.fifo()) {
        when = lastDeliveryAt.merge(link, when, Math::max);
      }
      final long at = when;
      LOGGER.finest(() -> "schedule " + message + " to " + to + " at " + at);
      scheduleAt(when, () -> deliver(link, message));
    }
  }

  private void deliver(Link link, PaxosMessage message) {
    if (isolated.contains(link.from()) || isolated.contains(link.to())) {
      drop(link, message, "partitioned in flight");
      return;
    }
    final var handler = handlers.get(link.to());
    if (handler == null) {
      drop(link, message, "no such node");
      return;
    }
    delivered.incrementAndGet();
    emit(message.slot(), link.to(), EventType.DELIVERED);
    handler.deliver(message);
  }

  private void drop(Link link, PaxosMessage message, String why) {
    dropped.incrementAndGet();
    emit(message.slot(), link.from(), EventType.DROPPED);
    LOGGER.finer(() -> "dropped " + message + " to " + link.to() + " " + why);
  }

  private void emit(long slot, NodeId node, EventType type) {
    events.record(new MetricsEvent(slot, node, Role.MESSENGER, type, now()));
  }

  public LinkProfile profile(NodeId from, NodeId to) {
    return overrides.getOrDefault(new Link(from, to), defaultProfile);
  }

  public void setDefaultProfile(LinkProfile profile) {
    this.defaultProfile = Objects.requireNonNull(profile, "profile");
  }

  /// Override the profile of the one way link from one node to another.
  public void setLinkProfile(NodeId from, NodeId to, LinkProfile profile) {
    overrides.put(new Link(from, to), Objects.requireNonNull(profile, "profile"));
  }

  public void setNemesis(Nemesis nemesis) {
    this.nemesis = Objects.requireNonNull(nemesis, "nemesis");
  }

  /// Cut the node off. Messages already in flight to or from it are dropped on arrival.
  public void isolate(NodeId node) {
    LOGGER.info(() -> "isolating " + node);
    isolated.add(node);
  }

  public void heal(NodeId node) {
    LOGGER.info(() -> "healing " + node);
    isolated.remove(node);
  }

  public void healAll() {
    isolated.clear();
  }

  public long messagesSent() {
    return sent.get();
  }

  public long messagesDelivered() {
    return delivered.get();
  }

  public long messagesDropped() {
    return dropped.get();
  }

  public long messagesDuplicated() {
    return duplicated.get();
  }
}
