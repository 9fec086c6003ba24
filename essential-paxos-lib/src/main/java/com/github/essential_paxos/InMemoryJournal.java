// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// A journal that survives the loss of the volatile role objects of a node but not the loss of the JVM. It is what the
/// simulations use to model a crash and restart of an acceptor.
public class InMemoryJournal implements Journal {

  record Key(NodeId acceptor, long slot) {
  }

  private final Map<Key, AcceptorState> states = new ConcurrentHashMap<>();

  @Override
  public void writeAcceptorState(AcceptorState state) {
    states.put(new Key(state.acceptor(), state.slot()), state);
  }

  @Override
  public Optional<AcceptorState> readAcceptorState(NodeId acceptor, long slot) {
    return Optional.ofNullable(states.get(new Key(acceptor, slot)));
  }

  @Override
  public void sync() {
    // the map is the durable store
  }
}
