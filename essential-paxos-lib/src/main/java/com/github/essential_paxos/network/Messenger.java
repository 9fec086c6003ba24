// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.network;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.msg.PaxosMessage;

import java.util.Collection;

/// The transport between nodes. A messenger may delay, drop, duplicate and reorder messages. It must never corrupt a
/// message or invent one. Sending never blocks and never delivers on the calling thread.
public interface Messenger {

  /// Subscribe a node to the messages addressed to it. A second registration replaces the first.
  void register(NodeId node, MessageHandler handler);

  void send(NodeId to, PaxosMessage message);

  default void broadcast(Collection<NodeId> to, PaxosMessage message) {
    for (NodeId node : to) {
      send(node, message);
    }
  }
}
