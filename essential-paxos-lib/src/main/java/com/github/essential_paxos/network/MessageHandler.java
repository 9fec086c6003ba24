// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.network;

import com.github.essential_paxos.msg.PaxosMessage;

/// The receiving side of a node as seen by a [Messenger].
@FunctionalInterface
public interface MessageHandler {
  void deliver(PaxosMessage message);
}
