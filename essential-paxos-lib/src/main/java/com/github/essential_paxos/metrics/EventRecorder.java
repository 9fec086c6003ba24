// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.metrics;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentLinkedQueue;

/// An [EventSink] that keeps every event in arrival order so that tests and trial runs can query them.
public class EventRecorder implements EventSink {
  private final ConcurrentLinkedQueue<MetricsEvent> events = new ConcurrentLinkedQueue<>();

  @Override
  public void record(MetricsEvent event) {
    events.add(event);
  }

  public List<MetricsEvent> events() {
    return List.copyOf(events);
  }

  public long count(EventType type) {
    return events.stream().filter(e -> e.type() == type).count();
  }

  public long count(long slot, EventType type) {
    return events.stream().filter(e -> e.slot() == slot && e.type() == type).count();
  }

  public List<MetricsEvent> forSlot(long slot) {
    return events.stream().filter(e -> e.slot() == slot).toList();
  }

  /// The time from the first prepare sent for the slot until the first decision observed for it.
  public OptionalLong consensusLatency(long slot) {
    final var start = events.stream()
        .filter(e -> e.slot() == slot && e.type() == EventType.PREPARE_SENT)
        .mapToLong(MetricsEvent::timestamp)
        .min();
    final var end = events.stream()
        .filter(e -> e.slot() == slot && e.type() == EventType.DECIDED)
        .mapToLong(MetricsEvent::timestamp)
        .min();
    if (start.isEmpty() || end.isEmpty()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(end.getAsLong() - start.getAsLong());
  }

  public void clear() {
    events.clear();
  }
}
