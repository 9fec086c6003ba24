// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.metrics.EventSink;
import com.github.essential_paxos.network.Cancellable;
import com.github.essential_paxos.network.LinkProfile;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.random.RandomGenerator;

import static com.github.essential_paxos.PaxosLogger.LOGGER;

/// The same faults as [SimulatedNetwork] but in real time. Deliveries and timers run on one daemon thread so that
/// messages on a FIFO link arrive in order. Client threads may call into the nodes concurrently.
public class ThreadedNetwork extends AbstractNetwork implements AutoCloseable {

  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
    final var thread = new Thread(runnable, "essential-paxos-network");
    thread.setDaemon(true);
    return thread;
  });
  private final long startNanos = System.nanoTime();

  public ThreadedNetwork(LinkProfile defaultProfile, RandomGenerator random, EventSink events) {
    super(defaultProfile, random, events);
  }

  @Override
  public long now() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  @Override
  protected void scheduleAt(long when, Runnable task) {
    submit(Math.max(0, when - now()), task);
  }

  @Override
  public Cancellable schedule(long delayMillis, Runnable task) {
    final var future = submit(delayMillis, task);
    return () -> {
      if (future != null) {
        future.cancel(false);
      }
    };
  }

  private ScheduledFuture<?> submit(long delayMillis, Runnable task) {
    try {
      return executor.schedule(() -> {
        try {
          task.run();
        } catch (RuntimeException | Error e) {
          LOGGER.log(Level.SEVERE, "task failed on the network thread: " + e, e);
          throw e;
        }
      }, delayMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.finer(() -> "network closed so not scheduling " + task);
      return null;
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
