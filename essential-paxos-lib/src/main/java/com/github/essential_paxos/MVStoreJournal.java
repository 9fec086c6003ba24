// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// A journal backed by the H2 MVStore. Each acceptor gets its own map keyed by slot. The values are pickled so that
/// the store does not depend on Java serialization.
public class MVStoreJournal implements Journal {
  static final String MAP_PREFIX = "com.github.essential_paxos#acceptor-";

  private final MVStore store;
  private final Map<NodeId, MVMap<Long, byte[]>> maps = new ConcurrentHashMap<>();

  public MVStoreJournal(MVStore store) {
    this.store = store;
  }

  private MVMap<Long, byte[]> map(NodeId acceptor) {
    return maps.computeIfAbsent(acceptor, id -> store.openMap(MAP_PREFIX + id.id()));
  }

  @Override
  public void writeAcceptorState(AcceptorState state) {
    final byte[] pickled;
    try {
      pickled = Pickle.writeAcceptorState(state);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    try {
      map(state.acceptor()).put(state.slot(), pickled);
    } catch (IllegalStateException e) {
      throw new JournalException("unable to write " + state, e);
    }
  }

  @Override
  public Optional<AcceptorState> readAcceptorState(NodeId acceptor, long slot) {
    final byte[] pickled = map(acceptor).get(slot);
    if (pickled == null) {
      return Optional.empty();
    }
    try {
      final var state = Pickle.readAcceptorState(pickled);
      if (!state.acceptor().equals(acceptor)) {
        throw new JournalException("journal for " + acceptor + " holds state of " + state.acceptor());
      }
      return Optional.of(state);
    } catch (IOException e) {
      throw new JournalException("unable to read slot " + slot + " of " + acceptor, e);
    }
  }

  @Override
  public void sync() {
    try {
      store.commit();
    } catch (IllegalStateException e) {
      throw new JournalException("commit failed", e);
    }
  }
}
