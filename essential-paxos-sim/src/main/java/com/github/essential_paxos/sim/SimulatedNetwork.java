// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.metrics.EventSink;
import com.github.essential_paxos.network.Cancellable;
import com.github.essential_paxos.network.LinkProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// A discrete event simulation of the network and of the timers. Time is virtual and only moves when the next event
/// is run, so a run with the same seed always makes the same choices. Events at the same time run in the order they
/// were scheduled. Everything runs on the calling thread.
public class SimulatedNetwork extends AbstractNetwork {

  private final NavigableMap<Long, List<Runnable>> eventQueue = new TreeMap<>();
  private long now = 0;

  public SimulatedNetwork(LinkProfile defaultProfile, RandomGenerator random, EventSink events) {
    super(defaultProfile, random, events);
  }

  public SimulatedNetwork(LinkProfile defaultProfile, long seed, EventSink events) {
    this(defaultProfile, repeatableRandomGenerator(seed), events);
  }

  public static RandomGenerator repeatableRandomGenerator(long seed) {
    RandomGeneratorFactory<RandomGenerator> factory = RandomGeneratorFactory.of("L64X128MixRandom");
    final RandomGenerator rng = factory.create(seed);
    LOGGER.fine("Simulation Using Seed: " + seed);
    return rng;
  }

  @Override
  public long now() {
    return now;
  }

  @Override
  protected void scheduleAt(long when, Runnable task) {
    eventQueue.computeIfAbsent(Math.max(when, now), t -> new ArrayList<>()).add(task);
  }

  @Override
  public Cancellable schedule(long delayMillis, Runnable task) {
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must be >= 0 but was " + delayMillis);
    }
    final boolean[] cancelled = {false};
    scheduleAt(now + delayMillis, () -> {
      if (!cancelled[0]) {
        task.run();
      }
    });
    return () -> cancelled[0] = true;
  }

  /// Run every event due at the earliest time in the queue.
  ///
  /// @return false if there was nothing left to run.
  public boolean step() {
    final var entry = eventQueue.pollFirstEntry();
    if (entry == null) {
      return false;
    }
    now = entry.getKey();
    // tasks scheduled for this same time while running land in a new list and are run by the next step
    for (Runnable task : entry.getValue()) {
      task.run();
    }
    return true;
  }

  /// Run events until the condition holds, the queue is empty or the clock would pass the max time.
  ///
  /// @return whether the condition holds.
  public boolean runUntil(BooleanSupplier done, long maxTime) {
    while (!done.getAsBoolean()) {
      final var next = eventQueue.firstEntry();
      if (next == null || next.getKey() > maxTime) {
        LOGGER.fine(() -> "simulation stopped at " + now + " with " + eventQueue.size() + " pending times");
        return done.getAsBoolean();
      }
      step();
    }
    return true;
  }

  /// Run everything due up to and including the time and then move the clock to it.
  public void runFor(long millis) {
    final long until = now + millis;
    runUntil(() -> false, until);
    now = Math.max(now, until);
  }

  public boolean isQuiet() {
    return eventQueue.isEmpty();
  }
}
