// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// Runs independent consensus instances for a stream of values on one proposer node. Slots are assigned in increasing
/// order and at most `maxInFlight` proposals run at once. Further values wait in a queue.
///
/// When a slot is won by another node's value the local value is moved to a fresh slot. The future of a value
/// completes with the [Outcome.Chosen] of the slot that holds it, or with the [Outcome.LivenessFailure] of the attempt
/// that gave up.
public class InstanceCoordinator {

  record Pending(Value value, CompletableFuture<Outcome> future) {
  }

  private final PaxosNode node;
  private final int maxInFlight;
  private final Queue<Pending> queue = new ArrayDeque<>();
  private final NavigableMap<Long, Value> decisions = new TreeMap<>();
  private long nextSlot;
  private int inFlight = 0;

  public InstanceCoordinator(PaxosNode node, int maxInFlight) {
    this(node, maxInFlight, 0L);
  }

  /// @param node        a node with the proposer role.
  /// @param maxInFlight the pipelining depth.
  /// @param firstSlot   the first slot to use.
  public InstanceCoordinator(PaxosNode node, int maxInFlight, long firstSlot) {
    this.node = Objects.requireNonNull(node, "node");
    if (!node.roles().contains(Role.PROPOSER)) {
      throw new IllegalArgumentException(node.nodeId() + " is not a proposer");
    }
    if (maxInFlight < 1) {
      throw new IllegalArgumentException("maxInFlight must be at least 1 but was " + maxInFlight);
    }
    if (firstSlot < 0) {
      throw new IllegalArgumentException("firstSlot must be >= 0 but was " + firstSlot);
    }
    this.maxInFlight = maxInFlight;
    this.nextSlot = firstSlot;
  }

  public CompletableFuture<Outcome> submit(Value value) {
    Objects.requireNonNull(value, "value");
    final var pending = new Pending(value, new CompletableFuture<>());
    final boolean launch;
    synchronized (this) {
      launch = inFlight < maxInFlight;
      if (launch) {
        inFlight++;
      } else {
        queue.add(pending);
      }
    }
    if (launch) {
      launch(pending);
    }
    return pending.future();
  }

  private void launch(Pending pending) {
    final long slot;
    final long firstUndecided = node.highestDecidedSlot() + 1;
    synchronized (this) {
      // skip slots we already know to be taken
      nextSlot = Math.max(nextSlot, firstUndecided);
      slot = nextSlot++;
    }
    LOGGER.fine(() -> node.nodeId() + " coordinator proposing " + pending.value() + " in slot " + slot);
    node.propose(slot, pending.value()).thenAccept(outcome -> completed(pending, outcome));
  }

  private void completed(Pending pending, Outcome outcome) {
    if (outcome instanceof Outcome.Chosen chosen) {
      synchronized (this) {
        decisions.put(chosen.slot(), chosen.value());
      }
      if (chosen.adopted()) {
        LOGGER.fine(() -> node.nodeId() + " slot " + chosen.slot() + " went to " + chosen.value() + " retrying "
            + pending.value());
        launch(pending);
        return;
      }
    }
    pending.future().complete(outcome);
    final Pending next;
    synchronized (this) {
      next = queue.poll();
      if (next == null) {
        inFlight--;
      }
    }
    if (next != null) {
      launch(next);
    }
  }

  public synchronized int inFlight() {
    return inFlight;
  }

  public synchronized int queued() {
    return queue.size();
  }

  /// The slots this coordinator has seen decided, including those won by other nodes.
  public synchronized NavigableMap<Long, Value> decisions() {
    return Collections.unmodifiableNavigableMap(new TreeMap<>(decisions));
  }
}
