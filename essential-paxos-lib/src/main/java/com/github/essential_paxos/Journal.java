// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.Optional;

/// The journal is the storage layer of the Paxos Algorithm. Journal writes must be crash-proof (disk flush or equivalent).
///
/// An acceptor writes its [AcceptorState] and then calls [#sync()] before it replies to a proposer. If it replied first
/// and then crashed it could forget a promise and break safety.
///
/// The journal is node specific. We must not accidentally mix the identity of nodes when moving state between
/// physical hosts so every state carries the acceptor [NodeId] and readers check it.
///
/// VERY IMPORTANT: If you get errors where you don't know what the state of the underlying journal has become you
/// should throw a [JournalException]. The acceptor will then refuse to take any further part in the slot.
public interface Journal {

  /// Save the promise and the accepted proposal of one acceptor for one slot.
  void writeAcceptorState(AcceptorState state);

  /// Load the last saved state of an acceptor for a slot. Empty when the acceptor has never written anything for it.
  Optional<AcceptorState> readAcceptorState(NodeId acceptor, long slot);

  /// Make everything written so far crash durable. Only after this returns may the acceptor send its reply.
  void sync();
}
